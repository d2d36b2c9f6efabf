package io.b2mash.readiness.checkin;

import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.company.HolidayRepository;
import io.b2mash.readiness.event.CheckinSubmittedEvent;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.exemption.ExemptionRepository;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.member.MemberRole;
import io.b2mash.readiness.scope.AccessScope;
import io.b2mash.readiness.team.TeamRepository;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Accepts a worker's daily check-in for the current local date of their company. */
@Service
public class CheckinService {

  private static final Logger log = LoggerFactory.getLogger(CheckinService.class);

  private final CheckinRepository checkinRepository;
  private final MemberRepository memberRepository;
  private final TeamRepository teamRepository;
  private final HolidayRepository holidayRepository;
  private final ExemptionRepository exemptionRepository;
  private final CompanyZoneResolver zoneResolver;
  private final ApplicationEventPublisher eventPublisher;

  public CheckinService(
      CheckinRepository checkinRepository,
      MemberRepository memberRepository,
      TeamRepository teamRepository,
      HolidayRepository holidayRepository,
      ExemptionRepository exemptionRepository,
      CompanyZoneResolver zoneResolver,
      ApplicationEventPublisher eventPublisher) {
    this.checkinRepository = checkinRepository;
    this.memberRepository = memberRepository;
    this.teamRepository = teamRepository;
    this.holidayRepository = holidayRepository;
    this.exemptionRepository = exemptionRepository;
    this.zoneResolver = zoneResolver;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Checkin submit(
      AccessScope scope, int mood, int stress, int sleep, int physicalHealth, String notes) {
    return submit(scope, mood, stress, sleep, physicalHealth, notes, Instant.now());
  }

  @Transactional
  Checkin submit(
      AccessScope scope,
      int mood,
      int stress,
      int sleep,
      int physicalHealth,
      String notes,
      Instant now) {
    requireInput("mood", mood);
    requireInput("stress", stress);
    requireInput("sleep", sleep);
    requireInput("physicalHealth", physicalHealth);

    var member =
        memberRepository
            .findById(scope.callerId())
            .orElseThrow(() -> new ResourceNotFoundException("Member", scope.callerId()));
    if (member.getRole() != MemberRole.WORKER) {
      throw new InvalidStateException(
          "Not a team member", "Only team members submit daily check-ins");
    }
    if (member.getTeamId() == null) {
      throw new InvalidStateException(
          "No team", "You must be assigned to a team before checking in");
    }
    var team =
        teamRepository
            .findById(member.getTeamId())
            .orElseThrow(() -> new ResourceNotFoundException("Team", member.getTeamId()));

    var zone = zoneResolver.zoneOf(member.getCompanyId());
    var today = WorkCalendar.localDate(now, zone);
    if (!exemptionRepository
        .findApprovedOverlapping(List.of(member.getId()), today, today)
        .isEmpty()) {
      throw new InvalidStateException("On leave", "You are on approved leave today");
    }
    if (!WorkCalendar.isWorkDay(today, team.getWorkDays())) {
      throw new InvalidStateException(
          "Not a work day", today.getDayOfWeek() + " is not a work day for " + team.getName());
    }
    if (holidayRepository.existsByCompanyIdAndHolidayDate(member.getCompanyId(), today)) {
      throw new InvalidStateException("Holiday", today + " is a company holiday");
    }
    if (checkinRepository.existsByMemberIdAndCheckinDate(member.getId(), today)) {
      throw ResourceConflictException.withCurrentState(
          "Already checked in",
          "A check-in for " + today + " was already submitted",
          Map.of("checkinDate", today.toString()));
    }

    var checkin =
        checkinRepository.save(
            new Checkin(
                member.getId(),
                member.getCompanyId(),
                team.getId(),
                today,
                now,
                mood,
                stress,
                sleep,
                physicalHealth,
                notes));
    member.recordCheckin(checkin.getReadinessScore(), checkin.getReadinessStatus(), now);
    log.info(
        "Check-in {} by member={} date={} score={} status={}",
        checkin.getId(),
        member.getId(),
        today,
        checkin.getReadinessScore(),
        checkin.getReadinessStatus());

    var details = new HashMap<String, Object>();
    details.put("checkin_date", today.toString());
    details.put("readiness_score", checkin.getReadinessScore());
    details.put("readiness_status", checkin.getReadinessStatus().name());
    eventPublisher.publishEvent(
        new CheckinSubmittedEvent(
            "checkin.submitted",
            "checkin",
            checkin.getId(),
            member.getCompanyId(),
            member.getId(),
            now,
            details,
            team.getId(),
            today));
    return checkin;
  }

  private static void requireInput(String field, int value) {
    if (value < 1 || value > 10) {
      throw new InvalidStateException("Invalid " + field, field + " must be between 1 and 10");
    }
  }
}
