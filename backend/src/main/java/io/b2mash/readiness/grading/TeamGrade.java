package io.b2mash.readiness.grading;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A team's grade over one period, with the previous period's score for trend.
 *
 * @param score {@code round(avgReadiness * 0.60 + periodCompliance * 0.40)}
 * @param memberCount every active worker, including onboarding ones
 * @param totals member-day tallies over the work days of the period
 */
public record TeamGrade(
    UUID teamId,
    String teamName,
    LocalDate periodStart,
    LocalDate periodEnd,
    int periodDays,
    int memberCount,
    int includedMemberCount,
    int onboardingCount,
    int avgReadiness,
    int periodCompliance,
    int score,
    String grade,
    String gradeLabel,
    String gradeColor,
    String simpleGrade,
    int previousScore,
    int scoreDelta,
    Trend trend,
    int onTimeRate,
    int atRiskCount,
    int needsAttentionCount,
    Totals totals,
    List<MemberGradeBreakdown> members) {

  public record Totals(
      int greenCount,
      int yellowCount,
      int redCount,
      int onLeaveDays,
      int excusedDays,
      int absentDays) {}
}
