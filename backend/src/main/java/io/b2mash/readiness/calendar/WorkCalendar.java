package io.b2mash.readiness.calendar;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Timezone-correct calendar primitives shared by aggregation, absence detection and grading.
 *
 * <p>Every "which day is it" question is answered in the company timezone, never the server's.
 * Work days are configured per team as comma-separated three-letter tokens ({@code
 * "MON,TUE,WED,THU,FRI"}); parsing is case-insensitive, tolerates whitespace and ignores unknown
 * tokens. Local dates are keyed as {@code YYYY-MM-DD} strings where they cross a storage boundary.
 * Pure utility class with no Spring dependencies.
 */
public final class WorkCalendar {

  public static final String DEFAULT_WORK_DAYS = "MON,TUE,WED,THU,FRI";

  private static final Map<String, DayOfWeek> DAY_TOKENS =
      Map.of(
          "SUN", DayOfWeek.SUNDAY,
          "MON", DayOfWeek.MONDAY,
          "TUE", DayOfWeek.TUESDAY,
          "WED", DayOfWeek.WEDNESDAY,
          "THU", DayOfWeek.THURSDAY,
          "FRI", DayOfWeek.FRIDAY,
          "SAT", DayOfWeek.SATURDAY);

  private WorkCalendar() {}

  /** Normalises a token list such as {@code "mon, Tue"} into a set of days. */
  public static Set<DayOfWeek> parseWorkDays(String workDayTokens) {
    if (workDayTokens == null || workDayTokens.isBlank()) {
      return Collections.emptySet();
    }
    var days = EnumSet.noneOf(DayOfWeek.class);
    for (String token : workDayTokens.split(",")) {
      var day = DAY_TOKENS.get(token.trim().toUpperCase(Locale.ROOT));
      if (day != null) {
        days.add(day);
      }
    }
    return days;
  }

  public static boolean isWorkDay(LocalDate date, Set<DayOfWeek> workDays) {
    return workDays.contains(date.getDayOfWeek());
  }

  public static boolean isWorkDay(LocalDate date, String workDayTokens) {
    return isWorkDay(date, parseWorkDays(workDayTokens));
  }

  /** Whether {@code instant}, as observed in {@code zone}, falls on a configured work day. */
  public static boolean isWorkDay(Instant instant, String workDayTokens, ZoneId zone) {
    return isWorkDay(localDate(instant, zone), workDayTokens);
  }

  public static LocalDate localDate(Instant instant, ZoneId zone) {
    return LocalDate.ofInstant(instant, zone);
  }

  public static LocalDate today(ZoneId zone) {
    return LocalDate.now(zone);
  }

  /** Canonical {@code YYYY-MM-DD} key of the local date of {@code instant} in {@code zone}. */
  public static String formatLocalDate(Instant instant, ZoneId zone) {
    return localDate(instant, zone).format(DateTimeFormatter.ISO_LOCAL_DATE);
  }

  /**
   * Local midnight of the calendar day after the instant's local date. A member who joins at 23:59
   * is first expected on the next calendar day, not 24 hours later.
   */
  public static ZonedDateTime effectiveStartDate(Instant joinedAt, ZoneId zone) {
    return effectiveStartLocalDate(joinedAt, zone).atStartOfDay(zone);
  }

  public static LocalDate effectiveStartLocalDate(Instant joinedAt, ZoneId zone) {
    return localDate(joinedAt, zone).plusDays(1);
  }

  /**
   * Counts work days between the local dates of {@code start} and {@code end}, both inclusive,
   * skipping dates whose {@code YYYY-MM-DD} key is in {@code holidayDates}.
   */
  public static int countWorkDaysInRange(
      Instant start,
      Instant end,
      String workDayTokens,
      ZoneId zone,
      Collection<String> holidayDates) {
    return countWorkDaysInRange(
        localDate(start, zone), localDate(end, zone), workDayTokens, holidayDates);
  }

  public static int countWorkDaysInRange(
      LocalDate start, LocalDate end, String workDayTokens, Collection<String> holidayDates) {
    var workDays = parseWorkDays(workDayTokens);
    if (end.isBefore(start) || workDays.isEmpty()) {
      return 0;
    }
    Set<String> holidays = holidayDates == null ? Set.of() : new HashSet<>(holidayDates);
    int count = 0;
    for (var date = start; !date.isAfter(end); date = date.plusDays(1)) {
      if (isWorkDay(date, workDays) && !holidays.contains(date.toString())) {
        count++;
      }
    }
    return count;
  }

  /** Inclusive list of dates from {@code start} to {@code end}; empty when end precedes start. */
  public static List<LocalDate> datesBetween(LocalDate start, LocalDate end) {
    if (end.isBefore(start)) {
      return List.of();
    }
    return new DateRange(start, end).dates();
  }
}
