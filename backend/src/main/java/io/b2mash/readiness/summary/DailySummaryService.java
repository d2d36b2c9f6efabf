package io.b2mash.readiness.summary;

import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.config.ReadinessProperties;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.scope.AccessScope;
import io.b2mash.readiness.team.Team;
import io.b2mash.readiness.team.TeamAccessService;
import io.b2mash.readiness.team.TeamRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the {@link DailyTeamSummary} cache. Every write is a full recomputation from an {@link
 * AttendanceSnapshot}, so rebuilding any date any number of times converges on the same row.
 */
@Service
public class DailySummaryService {

  private static final Logger log = LoggerFactory.getLogger(DailySummaryService.class);

  private final TeamRepository teamRepository;
  private final TeamAccessService teamAccessService;
  private final AttendanceSnapshotLoader snapshotLoader;
  private final DailyTeamSummaryRepository summaryRepository;
  private final DailyTeamSummaryUpsertRepository upsertRepository;
  private final ReadinessProperties properties;

  public DailySummaryService(
      TeamRepository teamRepository,
      TeamAccessService teamAccessService,
      AttendanceSnapshotLoader snapshotLoader,
      DailyTeamSummaryRepository summaryRepository,
      DailyTeamSummaryUpsertRepository upsertRepository,
      ReadinessProperties properties) {
    this.teamRepository = teamRepository;
    this.teamAccessService = teamAccessService;
    this.snapshotLoader = snapshotLoader;
    this.summaryRepository = summaryRepository;
    this.upsertRepository = upsertRepository;
    this.properties = properties;
  }

  // --- Recompute (system-initiated) ---

  @Transactional
  public DailyAttendanceFigures recalculate(UUID teamId, LocalDate date) {
    var team =
        teamRepository
            .findById(teamId)
            .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
    return recalculate(team, date);
  }

  /**
   * Rebuilds every date of {@code range} for one team. Stops early, keeping what was written, when
   * the range is longer than the configured maximum or the time budget runs out.
   */
  @Transactional
  public List<DailyAttendanceFigures> recomputeRange(UUID teamId, DateRange range) {
    var team =
        teamRepository
            .findById(teamId)
            .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
    return recomputeRange(team, range);
  }

  /** Rebuilds {@code date} for every active team of the company. */
  @Transactional
  public int recomputeCompanyDate(UUID companyId, LocalDate date) {
    var teams = teamRepository.findByCompanyIdAndActiveTrueOrderByName(companyId);
    var range = DateRange.single(date);
    var snapshots = snapshotLoader.loadAll(companyId, teams, range);
    for (var snapshot : snapshots.values()) {
      upsertRepository.upsert(DailySummaryCalculator.calculate(snapshot, date));
    }
    log.debug("Rebuilt {} team summaries for company={} date={}", teams.size(), companyId, date);
    return teams.size();
  }

  // --- Queries (caller-initiated) ---

  /** The cached summary of a team for {@code date}, built on first access. */
  @Transactional
  public DailyAttendanceFigures getDailySummary(AccessScope scope, UUID teamId, LocalDate date) {
    var team = teamAccessService.requireViewableTeam(scope, teamId);
    return summaryRepository
        .findByTeamIdAndSummaryDate(team.getId(), date)
        .map(DailyTeamSummary::toFigures)
        .orElseGet(() -> recalculate(team, date));
  }

  /** Cached summaries in {@code from..to}; dates never computed are absent from the result. */
  @Transactional(readOnly = true)
  public List<DailyAttendanceFigures> listSummaries(
      AccessScope scope, UUID teamId, LocalDate from, LocalDate to) {
    var team = teamAccessService.requireViewableTeam(scope, teamId);
    var range = requireRange(from, to);
    return summaryRepository
        .findByTeamIdAndSummaryDateBetweenOrderBySummaryDate(
            team.getId(), range.start(), range.end())
        .stream()
        .map(DailyTeamSummary::toFigures)
        .toList();
  }

  @Transactional
  public List<DailyAttendanceFigures> rebuildRange(
      AccessScope scope, UUID teamId, LocalDate from, LocalDate to) {
    var team = teamAccessService.requireViewableTeam(scope, teamId);
    var range = requireRange(from, to);
    log.info(
        "Manual summary rebuild of team={} {}..{} by member={}",
        teamId,
        range.start(),
        range.end(),
        scope.callerId());
    return recomputeRange(team, range);
  }

  private DailyAttendanceFigures recalculate(Team team, LocalDate date) {
    var snapshot = snapshotLoader.load(team, DateRange.single(date));
    var figures = DailySummaryCalculator.calculate(snapshot, date);
    upsertRepository.upsert(figures);
    log.debug(
        "Rebuilt summary team={} date={} expected={} checkedIn={} compliance={}",
        team.getId(),
        date,
        figures.expectedToCheckIn(),
        figures.checkedInCount(),
        figures.complianceRate());
    return figures;
  }

  private List<DailyAttendanceFigures> recomputeRange(Team team, DateRange range) {
    int maxDays = properties.recompute().maxDays();
    var effective = range;
    if (range.days() > maxDays) {
      effective = new DateRange(range.start(), range.start().plusDays(maxDays - 1L));
      log.warn(
          "Summary rebuild of team={} truncated to {} days: requested {}..{}",
          team.getId(),
          maxDays,
          range.start(),
          range.end());
    }
    var deadline = Instant.now().plus(properties.recompute().budget());
    var snapshot = snapshotLoader.load(team, effective);
    var results = new ArrayList<DailyAttendanceFigures>(effective.days());
    for (var date : effective.dates()) {
      if (Instant.now().isAfter(deadline)) {
        log.warn(
            "Summary rebuild of team={} ran out of time budget at {} ({} of {} days written)",
            team.getId(),
            date,
            results.size(),
            effective.days());
        break;
      }
      var figures = DailySummaryCalculator.calculate(snapshot, date);
      upsertRepository.upsert(figures);
      results.add(figures);
    }
    log.debug(
        "Rebuilt {} summaries for team={} {}..{}",
        results.size(),
        team.getId(),
        effective.start(),
        effective.end());
    return results;
  }

  private DateRange requireRange(LocalDate from, LocalDate to) {
    if (to.isBefore(from)) {
      throw new InvalidStateException(
          "Invalid date range", "'from' " + from + " must not be after 'to' " + to);
    }
    return new DateRange(from, to);
  }
}
