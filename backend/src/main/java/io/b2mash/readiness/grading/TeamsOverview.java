package io.b2mash.readiness.grading;

import java.util.List;

/** Every visible team of a company graded over the same period, worst first. */
public record TeamsOverview(int periodDays, List<TeamGrade> teams, Summary summary) {

  /**
   * @param avgGrade simple grade of {@code avgScore}, {@code N/A} when there are no teams
   * @param teamsAtRisk teams with a simple grade of C or D
   * @param teamsCritical teams with a simple grade of D
   */
  public record Summary(
      int totalTeams,
      int totalMembers,
      int avgScore,
      String avgGrade,
      int teamsAtRisk,
      int teamsCritical,
      int teamsImproving,
      int teamsDeclining) {}
}
