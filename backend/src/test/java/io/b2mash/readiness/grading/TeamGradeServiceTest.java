package io.b2mash.readiness.grading;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TeamGradeServiceTest {

  @Test
  void worstFirst_ordersBySimpleGradeThenScoreThenName() {
    var grades =
        new ArrayList<>(
            List.of(
                grade("Alpha", 95, 0),
                grade("Bravo", 55, 0),
                grade("Charlie", 72, 0),
                grade("Delta", 55, 0),
                grade("Echo", 65, 0)));

    grades.sort(TeamGradeService.WORST_FIRST);

    assertThat(grades)
        .extracting(TeamGrade::teamName)
        .containsExactly("Bravo", "Delta", "Echo", "Charlie", "Alpha");
  }

  @Test
  void summarize_countsRiskAndTrends() {
    var summary =
        TeamGradeService.summarize(
            List.of(grade("Alpha", 92, 5), grade("Bravo", 74, -4), grade("Charlie", 50, 1)));

    assertThat(summary.totalTeams()).isEqualTo(3);
    assertThat(summary.totalMembers()).isEqualTo(12);
    assertThat(summary.avgScore()).isEqualTo(72);
    assertThat(summary.avgGrade()).isEqualTo("C");
    assertThat(summary.teamsAtRisk()).isEqualTo(2);
    assertThat(summary.teamsCritical()).isEqualTo(1);
    assertThat(summary.teamsImproving()).isEqualTo(1);
    assertThat(summary.teamsDeclining()).isEqualTo(1);
  }

  @Test
  void summarize_noTeams() {
    var summary = TeamGradeService.summarize(List.of());

    assertThat(summary.totalTeams()).isZero();
    assertThat(summary.avgGrade()).isEqualTo("N/A");
  }

  private static TeamGrade grade(String name, int score, int delta) {
    var letter = GradeScale.letterFor(score);
    return new TeamGrade(
        UUID.randomUUID(),
        name,
        LocalDate.of(2025, 1, 1),
        LocalDate.of(2025, 1, 30),
        30,
        4,
        4,
        0,
        score,
        score,
        score,
        letter.grade(),
        letter.label(),
        letter.color(),
        GradeScale.simpleGrade(score),
        score - delta,
        delta,
        Trend.of(delta),
        100,
        0,
        0,
        new TeamGrade.Totals(0, 0, 0, 0, 0, 0),
        List.of());
  }
}
