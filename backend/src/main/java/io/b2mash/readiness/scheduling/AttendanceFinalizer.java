package io.b2mash.readiness.scheduling;

import io.b2mash.readiness.absence.AbsenceService;
import io.b2mash.readiness.company.CompanyRepository;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.config.ReadinessProperties;
import io.b2mash.readiness.summary.DailySummaryService;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Hourly job that closes out yesterday for every company whose local clock has reached the
 * configured hour: records absences for missed check-ins, then rebuilds yesterday's team summaries.
 * Each company is processed independently; one failing company does not stop the others.
 */
@Component
public class AttendanceFinalizer {

  private static final Logger log = LoggerFactory.getLogger(AttendanceFinalizer.class);

  private final CompanyRepository companyRepository;
  private final CompanyZoneResolver zoneResolver;
  private final AbsenceService absenceService;
  private final DailySummaryService dailySummaryService;
  private final ReadinessProperties properties;

  public AttendanceFinalizer(
      CompanyRepository companyRepository,
      CompanyZoneResolver zoneResolver,
      AbsenceService absenceService,
      DailySummaryService dailySummaryService,
      ReadinessProperties properties) {
    this.companyRepository = companyRepository;
    this.zoneResolver = zoneResolver;
    this.absenceService = absenceService;
    this.dailySummaryService = dailySummaryService;
    this.properties = properties;
  }

  @Scheduled(cron = "0 0 * * * *")
  public void finalizeAttendance() {
    if (!properties.finalizer().enabled()) {
      return;
    }
    finalizeDueCompanies(Instant.now());
  }

  /** Finalizes every active company whose local hour at {@code now} is the configured hour. */
  public int finalizeDueCompanies(Instant now) {
    var companies = companyRepository.findByActiveTrue();
    int processed = 0;
    for (var company : companies) {
      var local = ZonedDateTime.ofInstant(now, zoneResolver.zoneOf(company.getId()));
      if (local.getHour() != properties.finalizer().hour()) {
        continue;
      }
      var yesterday = local.toLocalDate().minusDays(1);
      try {
        int absences = absenceService.detectForCompany(company.getId(), local.toLocalDate());
        int teams = dailySummaryService.recomputeCompanyDate(company.getId(), yesterday);
        processed++;
        log.info(
            "Finalized {} for company={}: {} new absences, {} team summaries",
            yesterday,
            company.getId(),
            absences,
            teams);
      } catch (Exception e) {
        log.error(
            "Attendance finalizer failed for company={} date={}", company.getId(), yesterday, e);
      }
    }
    return processed;
  }
}
