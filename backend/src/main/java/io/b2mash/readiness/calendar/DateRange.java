package io.b2mash.readiness.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of local calendar dates.
 *
 * @param start first date of the range
 * @param end last date of the range, never before {@code start}
 */
public record DateRange(LocalDate start, LocalDate end) {

  public DateRange {
    if (start == null || end == null) {
      throw new IllegalArgumentException("start and end are required");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("end " + end + " is before start " + start);
    }
  }

  /** The {@code days}-long range ending on {@code end} inclusive. */
  public static DateRange endingOn(LocalDate end, int days) {
    if (days < 1) {
      throw new IllegalArgumentException("days must be positive, was " + days);
    }
    return new DateRange(end.minusDays(days - 1L), end);
  }

  public static DateRange single(LocalDate date) {
    return new DateRange(date, date);
  }

  public int days() {
    return (int) ChronoUnit.DAYS.between(start, end) + 1;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  /** The range of identical length ending the day before this one starts. */
  public DateRange previous() {
    return endingOn(start.minusDays(1), days());
  }

  /** Smallest range covering both this range and {@code other}. */
  public DateRange span(DateRange other) {
    var s = start.isBefore(other.start) ? start : other.start;
    var e = end.isAfter(other.end) ? end : other.end;
    return new DateRange(s, e);
  }

  public List<LocalDate> dates() {
    var dates = new ArrayList<LocalDate>(days());
    for (var d = start; !d.isAfter(end); d = d.plusDays(1)) {
      dates.add(d);
    }
    return dates;
  }
}
