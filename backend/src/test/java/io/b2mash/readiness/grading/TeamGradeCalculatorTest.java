package io.b2mash.readiness.grading;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.readiness.absence.AbsenceStatus;
import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.checkin.ReadinessStatus;
import io.b2mash.readiness.summary.AttendanceSnapshot;
import io.b2mash.readiness.summary.AttendanceSnapshot.AbsenceFact;
import io.b2mash.readiness.summary.AttendanceSnapshot.CheckinFact;
import io.b2mash.readiness.summary.AttendanceSnapshot.MemberFact;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TeamGradeCalculatorTest {

  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID ALICE = UUID.randomUUID();
  private static final UUID BOB = UUID.randomUUID();

  private static final LocalDate JOINED = LocalDate.of(2025, 1, 1);
  private static final LocalDate MON_13 = LocalDate.of(2025, 1, 13);
  private static final LocalDate TUE_14 = LocalDate.of(2025, 1, 14);
  private static final LocalDate WED_15 = LocalDate.of(2025, 1, 15);
  private static final LocalDate THU_16 = LocalDate.of(2025, 1, 16);
  private static final LocalDate FRI_17 = LocalDate.of(2025, 1, 17);

  /** Monday 13th to Friday 17th; the previous period is Wednesday 8th to Sunday 12th. */
  private static final DateRange PERIOD = new DateRange(MON_13, FRI_17);

  @Test
  void score_weightsReadinessSixtyAndComplianceForty() {
    assertThat(TeamGradeCalculator.score(100, 0)).isEqualTo(60);
    assertThat(TeamGradeCalculator.score(0, 100)).isEqualTo(40);
    assertThat(TeamGradeCalculator.score(100, 100)).isEqualTo(100);
    assertThat(TeamGradeCalculator.score(85, 72)).isEqualTo(80);
  }

  @Test
  void grade_combinesMemberAveragesAndMeanDailyCompliance() {
    var snapshot =
        snapshot(
            List.of(new MemberFact(ALICE, "Alice", JOINED)),
            List.of(
                checkin(ALICE, TUE_14, 80, ReadinessStatus.GREEN),
                checkin(ALICE, WED_15, 80, ReadinessStatus.GREEN),
                checkin(ALICE, THU_16, 80, ReadinessStatus.GREEN),
                checkin(ALICE, FRI_17, 80, ReadinessStatus.GREEN)),
            List.of());

    var grade = TeamGradeCalculator.calculate(TEAM_ID, "Alpha", snapshot, PERIOD);

    // Monday 0%, Tuesday to Friday 100%
    assertThat(grade.periodCompliance()).isEqualTo(80);
    assertThat(grade.avgReadiness()).isEqualTo(80);
    assertThat(grade.score()).isEqualTo(80);
    assertThat(grade.grade()).isEqualTo("B-");
    assertThat(grade.simpleGrade()).isEqualTo("B");
    assertThat(grade.previousScore()).isZero();
    assertThat(grade.trend()).isEqualTo(Trend.UP);
    assertThat(grade.onTimeRate()).isEqualTo(100);
    assertThat(grade.totals().absentDays()).isEqualTo(1);
    assertThat(grade.totals().greenCount()).isEqualTo(4);
    assertThat(grade.members())
        .singleElement()
        .satisfies(
            member -> {
              assertThat(member.checkinCount()).isEqualTo(4);
              assertThat(member.averageScore()).isEqualTo(80.0);
              assertThat(member.riskTier()).isEqualTo(RiskTier.ON_TRACK);
              assertThat(member.avgMood()).isEqualTo(7.0);
            });
  }

  @Test
  void membersBelowCheckinThreshold_areOnboardingAndExcludedFromReadiness() {
    var snapshot =
        snapshot(
            List.of(new MemberFact(ALICE, "Alice", JOINED), new MemberFact(BOB, "Bob", JOINED)),
            List.of(
                checkin(ALICE, TUE_14, 90, ReadinessStatus.GREEN),
                checkin(ALICE, WED_15, 90, ReadinessStatus.GREEN),
                checkin(ALICE, THU_16, 90, ReadinessStatus.GREEN),
                checkin(BOB, TUE_14, 30, ReadinessStatus.RED),
                checkin(BOB, WED_15, 30, ReadinessStatus.RED)),
            List.of());

    var grade = TeamGradeCalculator.calculate(TEAM_ID, "Alpha", snapshot, PERIOD);

    assertThat(grade.avgReadiness()).isEqualTo(90);
    assertThat(grade.memberCount()).isEqualTo(2);
    assertThat(grade.includedMemberCount()).isEqualTo(1);
    assertThat(grade.onboardingCount()).isEqualTo(1);
    assertThat(grade.atRiskCount()).isZero();
    assertThat(grade.members())
        .filteredOn(m -> m.memberId().equals(BOB))
        .singleElement()
        .satisfies(m -> assertThat(m.riskTier()).isEqualTo(RiskTier.ONBOARDING));
  }

  @Test
  void excusedAbsence_isLeftOutOfCompliance() {
    var snapshot =
        snapshot(
            List.of(new MemberFact(ALICE, "Alice", JOINED)),
            List.of(
                checkin(ALICE, TUE_14, 75, ReadinessStatus.GREEN),
                checkin(ALICE, WED_15, 75, ReadinessStatus.GREEN),
                checkin(ALICE, THU_16, 75, ReadinessStatus.GREEN),
                checkin(ALICE, FRI_17, 75, ReadinessStatus.GREEN)),
            List.of(new AbsenceFact(ALICE, MON_13, AbsenceStatus.EXCUSED)));

    var grade = TeamGradeCalculator.calculate(TEAM_ID, "Alpha", snapshot, PERIOD);

    assertThat(grade.periodCompliance()).isEqualTo(100);
    assertThat(grade.totals().excusedDays()).isEqualTo(1);
    assertThat(grade.totals().absentDays()).isZero();
    assertThat(grade.members().get(0).excusedAbsences()).isEqualTo(1);
  }

  @Test
  void emptyTeam_gradesZero() {
    var snapshot = snapshot(List.of(), List.of(), List.of());

    var grade = TeamGradeCalculator.calculate(TEAM_ID, "Empty", snapshot, PERIOD);

    assertThat(grade.score()).isZero();
    assertThat(grade.grade()).isEqualTo("F");
    assertThat(grade.trend()).isEqualTo(Trend.STABLE);
    assertThat(grade.members()).isEmpty();
  }

  @Test
  void riskTier_bands() {
    assertThat(TeamGradeCalculator.riskTier(2, 10)).isEqualTo(RiskTier.ONBOARDING);
    assertThat(TeamGradeCalculator.riskTier(3, 59.9)).isEqualTo(RiskTier.AT_RISK);
    assertThat(TeamGradeCalculator.riskTier(3, 65)).isEqualTo(RiskTier.NEEDS_ATTENTION);
    assertThat(TeamGradeCalculator.riskTier(3, 70)).isEqualTo(RiskTier.ON_TRACK);
  }

  private static AttendanceSnapshot snapshot(
      List<MemberFact> members, List<CheckinFact> checkins, List<AbsenceFact> absences) {
    return new AttendanceSnapshot(
        TEAM_ID,
        COMPANY_ID,
        WorkCalendar.parseWorkDays(WorkCalendar.DEFAULT_WORK_DAYS),
        PERIOD.previous().span(PERIOD),
        members,
        checkins,
        Set.of(),
        List.of(),
        absences);
  }

  private static CheckinFact checkin(
      UUID memberId, LocalDate date, int score, ReadinessStatus status) {
    return new CheckinFact(memberId, date, score, status, 7, 3, 7, 7);
  }
}
