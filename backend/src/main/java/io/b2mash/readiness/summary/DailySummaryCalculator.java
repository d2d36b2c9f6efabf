package io.b2mash.readiness.summary;

import io.b2mash.readiness.absence.AbsenceStatus;
import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.checkin.ReadinessStatus;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.UUID;

/**
 * Computes one team's attendance figures for one date from an {@link AttendanceSnapshot}.
 *
 * <p>Classification of an active worker on a work day that is not a holiday:
 *
 * <ol>
 *   <li>Not yet effective (date before the day after they joined): ignored.
 *   <li>On approved leave: counted in {@code onLeaveCount}, excluded from expected and checked in.
 *   <li>Absence reviewed as EXCUSED: counted in {@code excusedCount}, excluded likewise.
 *   <li>Otherwise expected; checked in if a check-in exists for the date, absent if not.
 * </ol>
 *
 * <p>On non-work days and holidays nobody is expected and compliance is null; check-ins that exist
 * anyway are still tallied. Pure and deterministic: the same snapshot yields the same figures.
 */
public final class DailySummaryCalculator {

  private DailySummaryCalculator() {}

  public static DailyAttendanceFigures calculate(AttendanceSnapshot snapshot, LocalDate date) {
    boolean workDay = WorkCalendar.isWorkDay(date, snapshot.workDays());
    boolean holiday = snapshot.isHoliday(date);
    var checkins = snapshot.checkinsOn(date);

    var checkedInMembers = new HashSet<UUID>();
    int green = 0;
    int yellow = 0;
    int red = 0;
    long readinessTotal = 0;
    for (var checkin : checkins) {
      checkedInMembers.add(checkin.memberId());
      readinessTotal += checkin.readinessScore();
      if (checkin.status() == ReadinessStatus.GREEN) {
        green++;
      } else if (checkin.status() == ReadinessStatus.YELLOW) {
        yellow++;
      } else {
        red++;
      }
    }
    Double avgReadiness =
        checkins.isEmpty() ? null : round2((double) readinessTotal / checkins.size());

    int onLeave = 0;
    int excused = 0;
    int expected = 0;
    int checkedIn = 0;
    for (var member : snapshot.members()) {
      if (date.isBefore(member.effectiveStart())) {
        continue;
      }
      if (snapshot.isOnLeave(member.memberId(), date)) {
        onLeave++;
        continue;
      }
      if (!workDay || holiday) {
        continue;
      }
      if (snapshot.absenceStatus(member.memberId(), date) == AbsenceStatus.EXCUSED) {
        excused++;
        continue;
      }
      expected++;
      if (checkedInMembers.contains(member.memberId())) {
        checkedIn++;
      }
    }

    if (!workDay || holiday) {
      return new DailyAttendanceFigures(
          snapshot.teamId(),
          snapshot.companyId(),
          date,
          workDay,
          holiday,
          snapshot.members().size(),
          onLeave,
          0,
          0,
          0,
          checkins.size(),
          green,
          yellow,
          red,
          avgReadiness,
          null);
    }

    return new DailyAttendanceFigures(
        snapshot.teamId(),
        snapshot.companyId(),
        date,
        true,
        false,
        snapshot.members().size(),
        onLeave,
        excused,
        expected - checkedIn,
        expected,
        checkedIn,
        green,
        yellow,
        red,
        avgReadiness,
        complianceRate(checkedIn, expected));
  }

  /** {@code min(100, round(checkedIn / expected * 100))}, or null when nobody was expected. */
  static Integer complianceRate(int checkedIn, int expected) {
    if (expected <= 0) {
      return null;
    }
    return (int) Math.min(100, Math.round(checkedIn * 100.0 / expected));
  }

  private static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
