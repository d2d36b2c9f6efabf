package io.b2mash.readiness.grading;

import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.config.ReadinessProperties;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.scope.AccessScope;
import io.b2mash.readiness.summary.AttendanceSnapshotLoader;
import io.b2mash.readiness.team.TeamAccessService;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TeamGradeService {

  private static final Logger log = LoggerFactory.getLogger(TeamGradeService.class);

  static final int MAX_PERIOD_DAYS = 365;

  /** Worst simple grade first, then lowest score, then name. */
  static final Comparator<TeamGrade> WORST_FIRST =
      Comparator.comparing(TeamGrade::simpleGrade)
          .reversed()
          .thenComparingInt(TeamGrade::score)
          .thenComparing(TeamGrade::teamName);

  private final TeamAccessService teamAccessService;
  private final AttendanceSnapshotLoader snapshotLoader;
  private final CompanyZoneResolver zoneResolver;
  private final ReadinessProperties properties;

  public TeamGradeService(
      TeamAccessService teamAccessService,
      AttendanceSnapshotLoader snapshotLoader,
      CompanyZoneResolver zoneResolver,
      ReadinessProperties properties) {
    this.teamAccessService = teamAccessService;
    this.snapshotLoader = snapshotLoader;
    this.zoneResolver = zoneResolver;
    this.properties = properties;
  }

  /** Grades one team over the last {@code periodDays} local days ending today. */
  @Transactional(readOnly = true)
  public TeamGrade getTeamGrade(AccessScope scope, UUID teamId, Integer periodDays) {
    var team = teamAccessService.requireViewableTeam(scope, teamId);
    var today = WorkCalendar.today(zoneResolver.zoneOf(team.getCompanyId()));
    return getTeamGrade(scope, teamId, periodDays, today);
  }

  @Transactional(readOnly = true)
  TeamGrade getTeamGrade(AccessScope scope, UUID teamId, Integer periodDays, LocalDate today) {
    int days = resolvePeriodDays(periodDays);
    var team = teamAccessService.requireViewableTeam(scope, teamId);
    var period = DateRange.endingOn(today, days);
    var snapshot = snapshotLoader.load(team, period.previous().span(period));
    var grade = TeamGradeCalculator.calculate(team.getId(), team.getName(), snapshot, period);
    log.debug(
        "Graded team={} over {}..{}: score={} grade={} trend={}",
        teamId,
        period.start(),
        period.end(),
        grade.score(),
        grade.grade(),
        grade.trend());
    return grade;
  }

  /** Grades every active team of the company that the caller can see. */
  @Transactional(readOnly = true)
  public TeamsOverview teamsOverview(AccessScope scope, UUID companyId, Integer periodDays) {
    if (!scope.companyId().equals(companyId)) {
      throw new ResourceNotFoundException("Company", companyId);
    }
    return teamsOverview(
        scope, companyId, periodDays, WorkCalendar.today(zoneResolver.zoneOf(companyId)));
  }

  @Transactional(readOnly = true)
  TeamsOverview teamsOverview(
      AccessScope scope, UUID companyId, Integer periodDays, LocalDate today) {
    int days = resolvePeriodDays(periodDays);
    var period = DateRange.endingOn(today, days);
    var teams = teamAccessService.listViewableTeams(scope);
    var snapshots = snapshotLoader.loadAll(companyId, teams, period.previous().span(period));

    var grades = new ArrayList<TeamGrade>(teams.size());
    for (var team : teams) {
      grades.add(
          TeamGradeCalculator.calculate(
              team.getId(), team.getName(), snapshots.get(team.getId()), period));
    }
    grades.sort(WORST_FIRST);
    return new TeamsOverview(days, List.copyOf(grades), summarize(grades));
  }

  static TeamsOverview.Summary summarize(List<TeamGrade> grades) {
    if (grades.isEmpty()) {
      return new TeamsOverview.Summary(0, 0, 0, "N/A", 0, 0, 0, 0);
    }
    int totalMembers = grades.stream().mapToInt(TeamGrade::memberCount).sum();
    int avgScore =
        (int) Math.round(grades.stream().mapToInt(TeamGrade::score).average().orElse(0));
    return new TeamsOverview.Summary(
        grades.size(),
        totalMembers,
        avgScore,
        GradeScale.simpleGrade(avgScore),
        (int)
            grades.stream()
                .filter(g -> g.simpleGrade().equals("C") || g.simpleGrade().equals("D"))
                .count(),
        (int) grades.stream().filter(g -> g.simpleGrade().equals("D")).count(),
        (int) grades.stream().filter(g -> g.trend() == Trend.UP).count(),
        (int) grades.stream().filter(g -> g.trend() == Trend.DOWN).count());
  }

  private int resolvePeriodDays(Integer periodDays) {
    int days = periodDays != null ? periodDays : properties.grading().defaultPeriodDays();
    if (days < 1 || days > MAX_PERIOD_DAYS) {
      throw new InvalidStateException(
          "Invalid period", "days must be between 1 and " + MAX_PERIOD_DAYS);
    }
    return days;
  }
}
