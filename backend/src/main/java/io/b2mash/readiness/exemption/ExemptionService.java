package io.b2mash.readiness.exemption;

import io.b2mash.readiness.absence.AbsenceRepository;
import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.event.ExemptionDecidedEvent;
import io.b2mash.readiness.event.ExemptionRequestedEvent;
import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.member.MemberRole;
import io.b2mash.readiness.scope.AccessScope;
import io.b2mash.readiness.team.TeamAccessService;
import io.b2mash.readiness.team.TeamRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ExemptionService {

  private static final Logger log = LoggerFactory.getLogger(ExemptionService.class);

  private final ExemptionRepository exemptionRepository;
  private final AbsenceRepository absenceRepository;
  private final MemberRepository memberRepository;
  private final TeamRepository teamRepository;
  private final TeamAccessService teamAccessService;
  private final CompanyZoneResolver zoneResolver;
  private final ApplicationEventPublisher eventPublisher;

  public ExemptionService(
      ExemptionRepository exemptionRepository,
      AbsenceRepository absenceRepository,
      MemberRepository memberRepository,
      TeamRepository teamRepository,
      TeamAccessService teamAccessService,
      CompanyZoneResolver zoneResolver,
      ApplicationEventPublisher eventPublisher) {
    this.exemptionRepository = exemptionRepository;
    this.absenceRepository = absenceRepository;
    this.memberRepository = memberRepository;
    this.teamRepository = teamRepository;
    this.teamAccessService = teamAccessService;
    this.zoneResolver = zoneResolver;
    this.eventPublisher = eventPublisher;
  }

  /** A worker requests leave for themselves. The request waits for their team lead. */
  @Transactional
  public Exemption requestExemption(
      AccessScope scope,
      ExemptionType type,
      String reason,
      LocalDate startDate,
      LocalDate endDate) {
    var member =
        memberRepository
            .findById(scope.callerId())
            .orElseThrow(() -> new ResourceNotFoundException("Member", scope.callerId()));
    if (member.getRole() != MemberRole.WORKER) {
      throw new InvalidStateException(
          "Not a team member", "Leave requests are only submitted by team members");
    }
    if (member.getTeamId() == null) {
      throw new InvalidStateException(
          "No team", "You must be assigned to a team before requesting leave");
    }
    var team =
        teamRepository
            .findById(member.getTeamId())
            .orElseThrow(() -> new ResourceNotFoundException("Team", member.getTeamId()));
    if (team.getLeaderId() == null) {
      throw new InvalidStateException(
          "No team lead", "Your team has no team lead to review the request");
    }
    if (exemptionRepository.existsOpenOverlapping(member.getId(), startDate, endDate)) {
      throw new ResourceConflictException(
          "Overlapping leave", "A pending or approved leave already covers part of this range");
    }

    var exemption =
        exemptionRepository.save(
            new Exemption(
                member.getId(),
                team.getId(),
                member.getCompanyId(),
                type,
                reason,
                startDate,
                endDate,
                member.getId()));
    log.info(
        "Leave {} requested by member {} for {}..{}",
        exemption.getId(),
        member.getId(),
        startDate,
        endDate);

    var details = baseDetails(exemption);
    details.put("team_lead_id", team.getLeaderId().toString());
    eventPublisher.publishEvent(
        new ExemptionRequestedEvent(
            "exemption.requested",
            "exemption",
            exemption.getId(),
            exemption.getCompanyId(),
            member.getId(),
            Instant.now(),
            details,
            team.getId(),
            member.getId(),
            startDate,
            endDate));
    return exemption;
  }

  /**
   * Approves a pending exemption. Absences already recorded inside the leave range that still
   * await justification or review are excused in the same transaction.
   */
  @Transactional
  public Exemption approve(AccessScope scope, UUID exemptionId, String notes) {
    var exemption = requireReviewable(scope, exemptionId);
    exemption.approve(scope.callerId(), notes);
    int excused =
        absenceRepository.excuseCoveredByLeave(
            exemption.getMemberId(),
            exemption.getStartDate(),
            exemption.getEndDate(),
            scope.callerId(),
            "Covered by approved leave (" + exemption.getType().name() + ")",
            Instant.now());
    log.info(
        "Leave {} approved by {}, {} absence(s) excused", exemptionId, scope.callerId(), excused);
    publishDecision(
        "exemption.approved",
        exemption,
        scope.callerId(),
        exemption.getStartDate(),
        exemption.getEndDate(),
        true);
    return exemption;
  }

  @Transactional
  public Exemption reject(AccessScope scope, UUID exemptionId, String notes) {
    var exemption = requireReviewable(scope, exemptionId);
    exemption.reject(scope.callerId(), notes);
    log.info("Leave {} rejected by {}", exemptionId, scope.callerId());
    publishDecision(
        "exemption.rejected",
        exemption,
        scope.callerId(),
        exemption.getStartDate(),
        exemption.getEndDate(),
        false);
    return exemption;
  }

  /**
   * Cancels a pending or approved exemption. The requester may cancel only while it is pending;
   * reviewers may cancel either.
   */
  @Transactional
  public Exemption cancel(AccessScope scope, UUID exemptionId) {
    var exemption = requireViewable(scope, exemptionId);
    boolean isOwner = exemption.getMemberId().equals(scope.callerId());
    boolean isReviewer = scope.canReviewTeam(exemption.getCompanyId(), exemption.getTeamId());
    if (!isReviewer) {
      if (!isOwner) {
        throw new ForbiddenException(
            "Insufficient authority", "You cannot cancel this leave request");
      }
      if (exemption.getStatus() != ExemptionStatus.PENDING) {
        throw new ForbiddenException(
            "Already reviewed", "A reviewed leave request can only be cancelled by a reviewer");
      }
    }
    boolean wasApproved = exemption.getStatus() == ExemptionStatus.APPROVED;
    exemption.cancel();
    log.info("Leave {} cancelled by {}", exemptionId, scope.callerId());
    publishDecision(
        "exemption.cancelled",
        exemption,
        scope.callerId(),
        exemption.getStartDate(),
        exemption.getEndDate(),
        wasApproved);
    return exemption;
  }

  /**
   * Ends an approved exemption early. Without an explicit date the leave ends yesterday, or today
   * when it started today.
   */
  @Transactional
  public Exemption endEarly(
      AccessScope scope, UUID exemptionId, LocalDate requestedEndDate, String notes) {
    var exemption = requireReviewable(scope, exemptionId);
    var today = WorkCalendar.today(zoneResolver.zoneOf(exemption.getCompanyId()));
    LocalDate newEndDate = requestedEndDate;
    if (newEndDate == null) {
      newEndDate = exemption.getStartDate().equals(today) ? today : today.minusDays(1);
    }
    var previousEndDate = exemption.getEndDate();
    exemption.endEarly(newEndDate, scope.callerId(), notes);
    log.info(
        "Leave {} ended early by {}: {} -> {}",
        exemptionId,
        scope.callerId(),
        previousEndDate,
        newEndDate);
    publishDecision(
        "exemption.ended_early",
        exemption,
        scope.callerId(),
        newEndDate.plusDays(1),
        previousEndDate,
        true);
    return exemption;
  }

  @Transactional(readOnly = true)
  public List<Exemption> listForTeam(AccessScope scope, UUID teamId) {
    teamAccessService.requireReviewableTeam(scope, teamId);
    return exemptionRepository.findByTeamId(teamId);
  }

  @Transactional(readOnly = true)
  public List<Exemption> listMine(AccessScope scope) {
    return exemptionRepository.findByMemberIdOrderByStartDateDesc(scope.callerId());
  }

  private Exemption requireViewable(AccessScope scope, UUID exemptionId) {
    return exemptionRepository
        .findById(exemptionId)
        .filter(
            e ->
                e.getMemberId().equals(scope.callerId())
                    || scope.canReviewTeam(e.getCompanyId(), e.getTeamId()))
        .orElseThrow(() -> new ResourceNotFoundException("Exemption", exemptionId));
  }

  private Exemption requireReviewable(AccessScope scope, UUID exemptionId) {
    var exemption = requireViewable(scope, exemptionId);
    if (!scope.canReviewTeam(exemption.getCompanyId(), exemption.getTeamId())) {
      throw new ForbiddenException(
          "Insufficient authority", "Only the team lead or a supervisor can decide leave");
    }
    return exemption;
  }

  private void publishDecision(
      String eventType,
      Exemption exemption,
      UUID actorId,
      LocalDate affectedFrom,
      LocalDate affectedTo,
      boolean affectsSummaries) {
    eventPublisher.publishEvent(
        new ExemptionDecidedEvent(
            eventType,
            "exemption",
            exemption.getId(),
            exemption.getCompanyId(),
            actorId,
            Instant.now(),
            baseDetails(exemption),
            exemption.getTeamId(),
            exemption.getMemberId(),
            exemption.getStatus().name(),
            affectedFrom,
            affectedTo,
            affectsSummaries));
  }

  private HashMap<String, Object> baseDetails(Exemption exemption) {
    var details = new HashMap<String, Object>();
    details.put("member_id", exemption.getMemberId().toString());
    details.put("type", exemption.getType().name());
    details.put("status", exemption.getStatus().name());
    details.put("start_date", exemption.getStartDate().toString());
    details.put("end_date", exemption.getEndDate().toString());
    return details;
  }
}
