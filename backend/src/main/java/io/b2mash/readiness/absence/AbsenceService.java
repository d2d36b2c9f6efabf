package io.b2mash.readiness.absence;

import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.config.ReadinessProperties;
import io.b2mash.readiness.event.AbsenceJustifiedEvent;
import io.b2mash.readiness.event.AbsenceReviewedEvent;
import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.member.MemberRole;
import io.b2mash.readiness.scope.AccessScope;
import io.b2mash.readiness.summary.AttendanceSnapshotLoader;
import io.b2mash.readiness.team.Team;
import io.b2mash.readiness.team.TeamAccessService;
import io.b2mash.readiness.team.TeamRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AbsenceService {

  private static final Logger log = LoggerFactory.getLogger(AbsenceService.class);

  static final int MAX_HISTORY_LIMIT = 100;

  private final AbsenceRepository absenceRepository;
  private final AbsenceDetectionRepository detectionRepository;
  private final MemberRepository memberRepository;
  private final TeamRepository teamRepository;
  private final TeamAccessService teamAccessService;
  private final AttendanceSnapshotLoader snapshotLoader;
  private final CompanyZoneResolver zoneResolver;
  private final ReadinessProperties properties;
  private final ApplicationEventPublisher eventPublisher;

  public AbsenceService(
      AbsenceRepository absenceRepository,
      AbsenceDetectionRepository detectionRepository,
      MemberRepository memberRepository,
      TeamRepository teamRepository,
      TeamAccessService teamAccessService,
      AttendanceSnapshotLoader snapshotLoader,
      CompanyZoneResolver zoneResolver,
      ReadinessProperties properties,
      ApplicationEventPublisher eventPublisher) {
    this.absenceRepository = absenceRepository;
    this.detectionRepository = detectionRepository;
    this.memberRepository = memberRepository;
    this.teamRepository = teamRepository;
    this.teamAccessService = teamAccessService;
    this.snapshotLoader = snapshotLoader;
    this.zoneResolver = zoneResolver;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
  }

  /** Unjustified absences of the caller and whether any of them blocks further activity. */
  public record PendingAbsences(List<Absence> absences, boolean hasBlocking) {}

  // --- Detection ---

  /**
   * Records an absence for every missed check-in day of one worker within the lookback window.
   * Returns how many new absences were created; repeated runs create none.
   */
  @Transactional
  public int detectForMember(UUID memberId) {
    var member =
        memberRepository
            .findById(memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Member", memberId));
    var today = WorkCalendar.today(zoneResolver.zoneOf(member.getCompanyId()));
    return detectForMember(memberId, today);
  }

  @Transactional
  int detectForMember(UUID memberId, LocalDate today) {
    var member =
        memberRepository
            .findById(memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Member", memberId));
    if (member.getRole() != MemberRole.WORKER || !member.isActive() || member.getTeamId() == null) {
      return 0;
    }
    var window =
        AbsenceDetector.detectionWindow(today, properties.absence().detectionLookbackDays());
    if (window.isEmpty()) {
      return 0;
    }
    var team =
        teamRepository
            .findById(member.getTeamId())
            .orElseThrow(() -> new ResourceNotFoundException("Team", member.getTeamId()));
    var snapshot = snapshotLoader.load(team, window.get());
    int created = 0;
    for (var fact : snapshot.members()) {
      if (fact.memberId().equals(memberId)) {
        for (var date : AbsenceDetector.missedDates(snapshot, fact, today)) {
          if (detectionRepository.insertIfAbsent(
              memberId, team.getId(), team.getCompanyId(), date)) {
            created++;
          }
        }
      }
    }
    if (created > 0) {
      log.info("Detected {} new absences for member={}", created, memberId);
    }
    return created;
  }

  /** Runs detection for every active worker of every active team of a company. */
  @Transactional
  public int detectForCompany(UUID companyId, LocalDate today) {
    var window =
        AbsenceDetector.detectionWindow(today, properties.absence().detectionLookbackDays());
    if (window.isEmpty()) {
      return 0;
    }
    var teams = teamRepository.findByCompanyIdAndActiveTrueOrderByName(companyId);
    var snapshots = snapshotLoader.loadAll(companyId, teams, window.get());
    int created = 0;
    for (var snapshot : snapshots.values()) {
      for (var fact : snapshot.members()) {
        for (var date : AbsenceDetector.missedDates(snapshot, fact, today)) {
          if (detectionRepository.insertIfAbsent(
              fact.memberId(), snapshot.teamId(), snapshot.companyId(), date)) {
            created++;
          }
        }
      }
    }
    log.info("Absence detection for company={} created {} absences", companyId, created);
    return created;
  }

  // --- Worker side ---

  /** Runs detection for the caller first, so the list is never stale. */
  @Transactional
  public PendingAbsences getMyPending(AccessScope scope) {
    detectForMember(scope.callerId());
    var absences = absenceRepository.findAwaitingJustification(scope.callerId());
    return new PendingAbsences(absences, !absences.isEmpty());
  }

  /**
   * Justifies a batch of the caller's absences. Every item is checked before any is written; one
   * bad item rejects the whole batch.
   */
  @Transactional
  public List<Absence> submitJustification(
      AccessScope scope, List<AbsenceJustification> justifications) {
    if (justifications == null || justifications.isEmpty()) {
      throw new InvalidStateException(
          "Empty justification", "At least one absence must be justified");
    }
    var ids = justifications.stream().map(AbsenceJustification::absenceId).toList();
    if (new HashSet<>(ids).size() != ids.size()) {
      throw new InvalidStateException(
          "Duplicate absence", "Each absence may appear only once in a justification batch");
    }

    Map<UUID, Absence> absences =
        absenceRepository.findAllById(ids).stream()
            .collect(Collectors.toMap(Absence::getId, Function.identity()));
    for (var item : justifications) {
      var absence = absences.get(item.absenceId());
      if (absence == null || !absence.getMemberId().equals(scope.callerId())) {
        throw new ResourceNotFoundException("Absence", item.absenceId());
      }
      if (absence.getStatus() != AbsenceStatus.PENDING_JUSTIFICATION || absence.isJustified()) {
        throw stateConflict(absence, "justify");
      }
    }

    var now = Instant.now();
    for (var item : justifications) {
      int updated =
          absenceRepository.justify(
              item.absenceId(),
              scope.callerId(),
              item.reasonCategory(),
              item.explanation(),
              now);
      if (updated == 0) {
        throw stateConflict(reload(item.absenceId()), "justify");
      }
    }

    var justified = new LinkedHashMap<UUID, Absence>();
    absenceRepository.findAllById(ids).forEach(a -> justified.put(a.getId(), a));
    log.info("Member {} justified {} absences", scope.callerId(), justified.size());

    for (var absence : justified.values()) {
      var details = new HashMap<String, Object>();
      details.put("absence_date", absence.getAbsenceDate().toString());
      details.put("reason_category", absence.getReasonCategory().name());
      eventPublisher.publishEvent(
          new AbsenceJustifiedEvent(
              "absence.justified",
              "absence",
              absence.getId(),
              absence.getCompanyId(),
              scope.callerId(),
              now,
              details,
              absence.getTeamId(),
              absence.getMemberId(),
              absence.getAbsenceDate()));
    }
    return List.copyOf(justified.values());
  }

  @Transactional(readOnly = true)
  public List<Absence> getHistory(AccessScope scope, Integer limit) {
    int size = limit != null ? limit : properties.absence().historyLimit();
    if (size < 1 || size > MAX_HISTORY_LIMIT) {
      throw new InvalidStateException(
          "Invalid limit", "limit must be between 1 and " + MAX_HISTORY_LIMIT);
    }
    return absenceRepository.findHistory(scope.callerId(), PageRequest.of(0, size));
  }

  @Transactional(readOnly = true)
  public AbsenceCounts getCounts(AccessScope scope) {
    long pending = 0;
    long excused = 0;
    long unexcused = 0;
    for (var row : absenceRepository.countByStatus(scope.callerId())) {
      switch (row.getStatus()) {
        case PENDING_JUSTIFICATION -> pending = row.getTotal();
        case EXCUSED -> excused = row.getTotal();
        case UNEXCUSED -> unexcused = row.getTotal();
      }
    }
    return new AbsenceCounts(pending, excused, unexcused, pending + excused + unexcused);
  }

  // --- Reviewer side ---

  /**
   * Records the reviewer's verdict on a justified absence. Only the lead of the absence's team or
   * a company-wide role may review.
   */
  @Transactional
  public Absence reviewAbsence(
      AccessScope scope, UUID absenceId, AbsenceStatus verdict, String notes) {
    if (verdict == null || !verdict.isTerminal()) {
      throw new InvalidStateException("Invalid verdict", "Verdict must be EXCUSED or UNEXCUSED");
    }
    var absence =
        absenceRepository
            .findById(absenceId)
            .filter(
                a ->
                    a.getMemberId().equals(scope.callerId())
                        || scope.canViewTeam(a.getCompanyId(), a.getTeamId()))
            .orElseThrow(() -> new ResourceNotFoundException("Absence", absenceId));
    if (!scope.canReviewTeam(absence.getCompanyId(), absence.getTeamId())) {
      throw new ForbiddenException(
          "Insufficient authority", "Only the team lead or a supervisor can review absences");
    }
    if (!absence.isJustified() || absence.getStatus().isTerminal()) {
      throw stateConflict(absence, "review");
    }

    var now = Instant.now();
    int updated = absenceRepository.review(absenceId, verdict, scope.callerId(), notes, now);
    if (updated == 0) {
      throw stateConflict(reload(absenceId), "review");
    }
    var reviewed = reload(absenceId);
    log.info("Absence {} reviewed as {} by {}", absenceId, verdict, scope.callerId());

    var details = new HashMap<String, Object>();
    details.put("absence_date", reviewed.getAbsenceDate().toString());
    details.put("verdict", verdict.name());
    eventPublisher.publishEvent(
        new AbsenceReviewedEvent(
            "absence.reviewed",
            "absence",
            reviewed.getId(),
            reviewed.getCompanyId(),
            scope.callerId(),
            now,
            details,
            reviewed.getTeamId(),
            reviewed.getMemberId(),
            reviewed.getAbsenceDate(),
            verdict.name()));
    return reviewed;
  }

  /** Justified absences awaiting a verdict across every team the caller can review. */
  @Transactional(readOnly = true)
  public List<Absence> getPendingReviews(AccessScope scope) {
    var teamIds =
        teamAccessService.listViewableTeams(scope).stream()
            .filter(team -> scope.canReviewTeam(team.getCompanyId(), team.getId()))
            .map(Team::getId)
            .toList();
    if (teamIds.isEmpty()) {
      return List.of();
    }
    return absenceRepository.findAwaitingReview(teamIds);
  }

  @Transactional(readOnly = true)
  public List<Absence> getPendingReviewsForTeam(AccessScope scope, UUID teamId) {
    var team = teamAccessService.requireReviewableTeam(scope, teamId);
    return absenceRepository.findAwaitingReview(List.of(team.getId()));
  }

  private Absence reload(UUID absenceId) {
    return absenceRepository
        .findById(absenceId)
        .orElseThrow(() -> new ResourceNotFoundException("Absence", absenceId));
  }

  private ResourceConflictException stateConflict(Absence absence, String action) {
    return ResourceConflictException.withCurrentState(
        "Invalid absence state",
        "Cannot "
            + action
            + " absence on "
            + absence.getAbsenceDate()
            + " in status "
            + absence.getStatus()
            + (absence.isJustified() ? " (justified)" : " (not justified)"),
        Map.of("currentStatus", absence.getStatus().name(), "justified", absence.isJustified()));
  }
}
