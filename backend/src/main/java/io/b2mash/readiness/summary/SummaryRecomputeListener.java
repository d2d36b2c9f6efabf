package io.b2mash.readiness.summary;

import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.config.AsyncConfig;
import io.b2mash.readiness.event.AbsenceReviewedEvent;
import io.b2mash.readiness.event.CheckinSubmittedEvent;
import io.b2mash.readiness.event.ExemptionDecidedEvent;
import io.b2mash.readiness.event.HolidayChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Rebuilds cached daily summaries after the data they derive from changes. Runs after commit on
 * the recompute executor; failures are logged and never reach the triggering request.
 */
@Component
public class SummaryRecomputeListener {

  private static final Logger log = LoggerFactory.getLogger(SummaryRecomputeListener.class);

  private final DailySummaryService dailySummaryService;

  public SummaryRecomputeListener(DailySummaryService dailySummaryService) {
    this.dailySummaryService = dailySummaryService;
  }

  @Async(AsyncConfig.RECOMPUTE_EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onCheckinSubmitted(CheckinSubmittedEvent event) {
    try {
      dailySummaryService.recalculate(event.teamId(), event.checkinDate());
    } catch (Exception e) {
      log.warn(
          "Failed to rebuild summary after checkin={} team={} date={}",
          event.entityId(),
          event.teamId(),
          event.checkinDate(),
          e);
    }
  }

  @Async(AsyncConfig.RECOMPUTE_EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onHolidayChanged(HolidayChangedEvent event) {
    try {
      dailySummaryService.recomputeCompanyDate(event.companyId(), event.holidayDate());
    } catch (Exception e) {
      log.warn(
          "Failed to rebuild summaries after {} company={} date={}",
          event.eventType(),
          event.companyId(),
          event.holidayDate(),
          e);
    }
  }

  @Async(AsyncConfig.RECOMPUTE_EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onExemptionDecided(ExemptionDecidedEvent event) {
    if (!event.affectsSummaries() || event.endDate().isBefore(event.startDate())) {
      return;
    }
    try {
      dailySummaryService.recomputeRange(
          event.teamId(), new DateRange(event.startDate(), event.endDate()));
    } catch (Exception e) {
      log.warn(
          "Failed to rebuild summaries after {} exemption={} team={}",
          event.eventType(),
          event.entityId(),
          event.teamId(),
          e);
    }
  }

  @Async(AsyncConfig.RECOMPUTE_EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onAbsenceReviewed(AbsenceReviewedEvent event) {
    try {
      dailySummaryService.recalculate(event.teamId(), event.absenceDate());
    } catch (Exception e) {
      log.warn(
          "Failed to rebuild summary after absence review={} team={} date={}",
          event.entityId(),
          event.teamId(),
          event.absenceDate(),
          e);
    }
  }
}
