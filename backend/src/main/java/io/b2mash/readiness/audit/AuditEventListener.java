package io.b2mash.readiness.audit;

import io.b2mash.readiness.event.AbsenceJustifiedEvent;
import io.b2mash.readiness.event.AbsenceReviewedEvent;
import io.b2mash.readiness.event.CheckinSubmittedEvent;
import io.b2mash.readiness.event.DomainEvent;
import io.b2mash.readiness.event.ExemptionDecidedEvent;
import io.b2mash.readiness.event.ExemptionRequestedEvent;
import io.b2mash.readiness.event.HolidayChangedEvent;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Writes one audit entry per committed domain event. Audit failures are logged and dropped. */
@Component
public class AuditEventListener {

  private static final Logger log = LoggerFactory.getLogger(AuditEventListener.class);

  private final AuditService auditService;

  public AuditEventListener(AuditService auditService) {
    this.auditService = auditService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onDomainEvent(DomainEvent event) {
    try {
      auditService.log(
          AuditEventBuilder.builder()
              .companyId(event.companyId())
              .actorId(event.actorMemberId())
              .actionTag(event.eventType())
              .entityType(event.entityType())
              .entityId(event.entityId())
              .description(describe(event))
              .metadata(event.details())
              .build());
    } catch (Exception e) {
      log.warn(
          "Failed to record audit event for {} entity={}", event.eventType(), event.entityId(), e);
    }
  }

  static String describe(DomainEvent event) {
    if (event instanceof CheckinSubmittedEvent checkin) {
      return "Check-in submitted for " + checkin.checkinDate();
    }
    if (event instanceof HolidayChangedEvent holiday) {
      return (event.eventType().endsWith("deleted") ? "Holiday removed on " : "Holiday added on ")
          + holiday.holidayDate();
    }
    if (event instanceof ExemptionRequestedEvent requested) {
      return "Leave requested for " + requested.startDate() + " to " + requested.endDate();
    }
    if (event instanceof ExemptionDecidedEvent decided) {
      return "Leave " + decided.status().toLowerCase(Locale.ROOT) + " (" + event.eventType() + ")";
    }
    if (event instanceof AbsenceJustifiedEvent justified) {
      return "Absence on " + justified.absenceDate() + " justified";
    }
    if (event instanceof AbsenceReviewedEvent reviewed) {
      return "Absence on " + reviewed.absenceDate() + " reviewed as " + reviewed.verdict();
    }
    return event.eventType();
  }
}
