package io.b2mash.readiness.grading;

import io.b2mash.readiness.absence.AbsenceStatus;
import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.checkin.ReadinessStatus;
import io.b2mash.readiness.summary.AttendanceSnapshot;
import io.b2mash.readiness.summary.AttendanceSnapshot.CheckinFact;
import io.b2mash.readiness.summary.AttendanceSnapshot.MemberFact;
import io.b2mash.readiness.summary.DailyAttendanceFigures;
import io.b2mash.readiness.summary.DailySummaryCalculator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.ToIntFunction;

/**
 * Grades a team over a period from an {@link AttendanceSnapshot} covering that period and the one
 * before it.
 *
 * <p>Daily compliance comes from {@link DailySummaryCalculator} over the same snapshot, so a grade
 * always agrees with a freshly rebuilt summary for each of its dates. Period compliance is the mean
 * of the daily rates on work days that have one; readiness is the mean of per-member averages over
 * members with at least {@link #MIN_CHECKIN_DAYS_THRESHOLD} check-ins.
 */
public final class TeamGradeCalculator {

  static final int MIN_CHECKIN_DAYS_THRESHOLD = 3;
  static final double READINESS_WEIGHT = 0.60;
  static final double COMPLIANCE_WEIGHT = 0.40;
  static final int AT_RISK_BELOW = 60;
  static final int NEEDS_ATTENTION_BELOW = 70;

  private TeamGradeCalculator() {}

  /** Score components of one period. */
  record PeriodScore(
      int avgReadiness, int compliance, int score, List<DailyAttendanceFigures> days) {}

  public static TeamGrade calculate(
      UUID teamId, String teamName, AttendanceSnapshot snapshot, DateRange period) {
    var current = periodScore(snapshot, period);
    var previous = periodScore(snapshot, period.previous());
    int delta = current.score() - previous.score();
    var letter = GradeScale.letterFor(current.score());

    var members =
        snapshot.members().stream()
            .map(member -> breakdown(snapshot, member, period))
            .sorted(Comparator.comparing(MemberGradeBreakdown::name))
            .toList();
    int onboarding = countTier(members, RiskTier.ONBOARDING);
    int atRisk = countTier(members, RiskTier.AT_RISK);
    int needsAttention = atRisk + countTier(members, RiskTier.NEEDS_ATTENTION);

    var workDays =
        current.days().stream().filter(d -> d.workDay() && !d.holiday()).toList();
    var totals =
        new TeamGrade.Totals(
            sum(current.days(), DailyAttendanceFigures::greenCount),
            sum(current.days(), DailyAttendanceFigures::yellowCount),
            sum(current.days(), DailyAttendanceFigures::redCount),
            sum(workDays, DailyAttendanceFigures::onLeaveCount),
            sum(workDays, DailyAttendanceFigures::excusedCount),
            sum(workDays, DailyAttendanceFigures::absentCount));
    int totalCheckins = totals.greenCount() + totals.yellowCount() + totals.redCount();
    int onTimeRate =
        totalCheckins > 0 ? (int) Math.round(totals.greenCount() * 100.0 / totalCheckins) : 0;

    return new TeamGrade(
        teamId,
        teamName,
        period.start(),
        period.end(),
        period.days(),
        members.size(),
        members.size() - onboarding,
        onboarding,
        current.avgReadiness(),
        current.compliance(),
        current.score(),
        letter.grade(),
        letter.label(),
        letter.color(),
        GradeScale.simpleGrade(current.score()),
        previous.score(),
        delta,
        Trend.of(delta),
        onTimeRate,
        atRisk,
        needsAttention,
        totals,
        members);
  }

  static PeriodScore periodScore(AttendanceSnapshot snapshot, DateRange period) {
    var days = new ArrayList<DailyAttendanceFigures>(period.days());
    for (var date : period.dates()) {
      days.add(DailySummaryCalculator.calculate(snapshot, date));
    }
    int compliance =
        roundedMean(
            days.stream()
                .filter(d -> d.workDay() && !d.holiday())
                .map(DailyAttendanceFigures::complianceRate)
                .filter(Objects::nonNull)
                .mapToDouble(Integer::doubleValue)
                .toArray());

    var memberAverages = new ArrayList<Double>();
    for (var member : snapshot.members()) {
      var checkins = snapshot.checkinsOf(member.memberId(), period);
      if (checkins.size() >= MIN_CHECKIN_DAYS_THRESHOLD) {
        memberAverages.add(mean(checkins, CheckinFact::readinessScore));
      }
    }
    int avgReadiness =
        roundedMean(memberAverages.stream().mapToDouble(Double::doubleValue).toArray());
    return new PeriodScore(avgReadiness, compliance, score(avgReadiness, compliance), days);
  }

  /** {@code round(avgReadiness * 0.60 + compliance * 0.40)}. */
  static int score(int avgReadiness, int compliance) {
    return (int) Math.round(avgReadiness * READINESS_WEIGHT + compliance * COMPLIANCE_WEIGHT);
  }

  static RiskTier riskTier(int checkinCount, double averageScore) {
    if (checkinCount < MIN_CHECKIN_DAYS_THRESHOLD) {
      return RiskTier.ONBOARDING;
    }
    if (averageScore < AT_RISK_BELOW) {
      return RiskTier.AT_RISK;
    }
    if (averageScore < NEEDS_ATTENTION_BELOW) {
      return RiskTier.NEEDS_ATTENTION;
    }
    return RiskTier.ON_TRACK;
  }

  private static MemberGradeBreakdown breakdown(
      AttendanceSnapshot snapshot, MemberFact member, DateRange period) {
    var checkins = snapshot.checkinsOf(member.memberId(), period);
    boolean any = !checkins.isEmpty();
    double average = any ? mean(checkins, CheckinFact::readinessScore) : 0;
    return new MemberGradeBreakdown(
        member.memberId(),
        member.name(),
        any ? round2(average) : null,
        checkins.size(),
        riskTier(checkins.size(), average),
        countStatus(checkins, ReadinessStatus.GREEN),
        countStatus(checkins, ReadinessStatus.YELLOW),
        countStatus(checkins, ReadinessStatus.RED),
        any ? round2(mean(checkins, CheckinFact::mood)) : null,
        any ? round2(mean(checkins, CheckinFact::stress)) : null,
        any ? round2(mean(checkins, CheckinFact::sleep)) : null,
        any ? round2(mean(checkins, CheckinFact::physicalHealth)) : null,
        snapshot.countAbsences(member.memberId(), period, AbsenceStatus.EXCUSED),
        snapshot.countAbsences(member.memberId(), period, AbsenceStatus.UNEXCUSED));
  }

  private static double mean(List<CheckinFact> checkins, ToIntFunction<CheckinFact> field) {
    return checkins.stream().mapToInt(field).average().orElse(0);
  }

  private static int roundedMean(double[] values) {
    if (values.length == 0) {
      return 0;
    }
    double total = 0;
    for (double value : values) {
      total += value;
    }
    return (int) Math.round(total / values.length);
  }

  private static int countStatus(List<CheckinFact> checkins, ReadinessStatus status) {
    return (int) checkins.stream().filter(c -> c.status() == status).count();
  }

  private static int countTier(List<MemberGradeBreakdown> members, RiskTier tier) {
    return (int) members.stream().filter(m -> m.riskTier() == tier).count();
  }

  private static int sum(
      List<DailyAttendanceFigures> days, ToIntFunction<DailyAttendanceFigures> field) {
    return days.stream().mapToInt(field).sum();
  }

  private static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
