package io.b2mash.readiness.company;

import io.b2mash.readiness.event.HolidayChangedEvent;
import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.scope.AccessScope;
import io.b2mash.readiness.scope.CompanyScope;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manages company holidays. Adding or removing a holiday changes whether attendance is expected
 * on that date, so both publish a {@link HolidayChangedEvent} that rebuilds every team's summary
 * for the date once the change commits.
 */
@Service
public class HolidayService {

  private static final Logger log = LoggerFactory.getLogger(HolidayService.class);

  private final HolidayRepository holidayRepository;
  private final CompanyRepository companyRepository;
  private final ApplicationEventPublisher eventPublisher;

  public HolidayService(
      HolidayRepository holidayRepository,
      CompanyRepository companyRepository,
      ApplicationEventPublisher eventPublisher) {
    this.holidayRepository = holidayRepository;
    this.companyRepository = companyRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public List<Holiday> listHolidays(AccessScope scope, UUID companyId, int year) {
    requireCompany(scope, companyId);
    return holidayRepository.findByCompanyIdAndDateRange(
        companyId, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
  }

  @Transactional
  public Holiday createHoliday(AccessScope scope, UUID companyId, LocalDate date, String name) {
    requireCompany(scope, companyId);
    requireManager(scope);
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Invalid holiday", "Holiday name is required");
    }
    if (holidayRepository.existsByCompanyIdAndHolidayDate(companyId, date)) {
      throw new ResourceConflictException(
          "Holiday already exists", "A holiday is already defined on " + date);
    }
    var holiday =
        holidayRepository.save(new Holiday(companyId, date, name.trim(), scope.callerId()));
    log.info("Created holiday {} on {} for company {}", holiday.getId(), date, companyId);
    publish("holiday.created", holiday, scope.callerId());
    return holiday;
  }

  @Transactional
  public void deleteHoliday(AccessScope scope, UUID holidayId) {
    var holiday =
        holidayRepository
            .findById(holidayId)
            .filter(h -> h.getCompanyId().equals(scope.companyId()))
            .orElseThrow(() -> new ResourceNotFoundException("Holiday", holidayId));
    requireManager(scope);
    holidayRepository.delete(holiday);
    log.info(
        "Deleted holiday {} on {} for company {}",
        holiday.getId(),
        holiday.getHolidayDate(),
        holiday.getCompanyId());
    publish("holiday.deleted", holiday, scope.callerId());
  }

  private void publish(String eventType, Holiday holiday, UUID actorId) {
    eventPublisher.publishEvent(
        new HolidayChangedEvent(
            eventType,
            "holiday",
            holiday.getId(),
            holiday.getCompanyId(),
            actorId,
            Instant.now(),
            Map.of("date", holiday.getHolidayDate().toString(), "name", holiday.getName()),
            holiday.getHolidayDate()));
  }

  private void requireCompany(AccessScope scope, UUID companyId) {
    if (!scope.companyId().equals(companyId) || !companyRepository.existsById(companyId)) {
      throw new ResourceNotFoundException("Company", companyId);
    }
  }

  private void requireManager(AccessScope scope) {
    if (!(scope instanceof CompanyScope)) {
      throw new ForbiddenException(
          "Insufficient role", "Only supervisors, executives and admins can manage holidays");
    }
  }
}
