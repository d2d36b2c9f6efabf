package io.b2mash.readiness.absence;

import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.summary.AttendanceSnapshot;
import io.b2mash.readiness.summary.AttendanceSnapshot.MemberFact;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the dates on which a worker owed a check-in and left no trace: a work day that is not a
 * holiday, on or after their effective start, strictly before today, not on approved leave, with
 * neither a check-in nor an absence already recorded.
 */
public final class AbsenceDetector {

  private AbsenceDetector() {}

  /** Window scanned by a detection run on {@code today}; empty when there is nothing to scan. */
  public static Optional<DateRange> detectionWindow(LocalDate today, int lookbackDays) {
    if (lookbackDays < 1) {
      return Optional.empty();
    }
    return Optional.of(DateRange.endingOn(today.minusDays(1), lookbackDays));
  }

  public static List<LocalDate> missedDates(
      AttendanceSnapshot snapshot, MemberFact member, LocalDate today) {
    var missed = new ArrayList<LocalDate>();
    for (var date : snapshot.range().dates()) {
      if (!date.isBefore(today) || date.isBefore(member.effectiveStart())) {
        continue;
      }
      if (!WorkCalendar.isWorkDay(date, snapshot.workDays()) || snapshot.isHoliday(date)) {
        continue;
      }
      if (snapshot.isOnLeave(member.memberId(), date)
          || snapshot.hasCheckin(member.memberId(), date)
          || snapshot.absenceStatus(member.memberId(), date) != null) {
        continue;
      }
      missed.add(date);
    }
    return missed;
  }
}
