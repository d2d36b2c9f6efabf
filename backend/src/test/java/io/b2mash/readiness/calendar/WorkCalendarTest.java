package io.b2mash.readiness.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class WorkCalendarTest {

  private static final ZoneId MANILA = ZoneId.of("Asia/Manila");

  @Test
  void parseWorkDays_isCaseInsensitiveAndIgnoresUnknownTokens() {
    assertThat(WorkCalendar.parseWorkDays(" mon,Tue , xyz,FRI"))
        .containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.FRIDAY);
    assertThat(WorkCalendar.parseWorkDays("")).isEmpty();
    assertThat(WorkCalendar.parseWorkDays(null)).isEmpty();
  }

  @Test
  void parseWorkDays_ignoresDefaultLocale() {
    var original = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      assertThat(WorkCalendar.parseWorkDays("mon,fri,sat"))
          .containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  void isWorkDay_usesCompanyLocalDate() {
    // 2025-01-17T20:00Z is Friday in UTC but already Saturday in Manila (UTC+8)
    var instant = Instant.parse("2025-01-17T20:00:00Z");

    assertThat(WorkCalendar.isWorkDay(instant, WorkCalendar.DEFAULT_WORK_DAYS, ZoneOffset.UTC))
        .isTrue();
    assertThat(WorkCalendar.isWorkDay(instant, WorkCalendar.DEFAULT_WORK_DAYS, MANILA)).isFalse();
    assertThat(WorkCalendar.formatLocalDate(instant, MANILA)).isEqualTo("2025-01-18");
  }

  @Test
  void effectiveStart_isLocalMidnightOfNextDay() {
    var joinedLateEvening = Instant.parse("2025-01-13T15:59:00Z"); // 23:59 in Manila

    var start = WorkCalendar.effectiveStartDate(joinedLateEvening, MANILA);

    assertThat(start.toLocalDate()).isEqualTo(LocalDate.of(2025, 1, 14));
    assertThat(start.getHour()).isZero();
    assertThat(start.getZone()).isEqualTo(MANILA);
  }

  @Test
  void countWorkDaysInRange_skipsWeekendsAndHolidays() {
    int count =
        WorkCalendar.countWorkDaysInRange(
            LocalDate.of(2025, 1, 14),
            LocalDate.of(2025, 1, 17),
            "MON,TUE,WED,THU,FRI",
            List.of("2025-01-16"));

    assertThat(count).isEqualTo(3);
  }

  @Test
  void countWorkDaysInRange_overInstantsUsesLocalDates() {
    int count =
        WorkCalendar.countWorkDaysInRange(
            Instant.parse("2025-01-13T00:00:00Z"),
            Instant.parse("2025-01-19T23:00:00Z"),
            "MON,TUE,WED,THU,FRI",
            ZoneOffset.UTC,
            List.of());

    assertThat(count).isEqualTo(5);
  }

  @Test
  void countWorkDaysInRange_isZeroForInvertedRangeOrNoWorkDays() {
    var start = LocalDate.of(2025, 1, 17);
    var end = LocalDate.of(2025, 1, 14);

    assertThat(WorkCalendar.countWorkDaysInRange(start, end, "MON,TUE", List.of())).isZero();
    assertThat(WorkCalendar.countWorkDaysInRange(end, start, "", List.of())).isZero();
  }

  @Test
  void datesBetween_isInclusiveAndEmptyWhenInverted() {
    var jan14 = LocalDate.of(2025, 1, 14);
    var jan16 = LocalDate.of(2025, 1, 16);

    assertThat(WorkCalendar.datesBetween(jan14, jan16))
        .containsExactly(jan14, LocalDate.of(2025, 1, 15), jan16);
    assertThat(WorkCalendar.datesBetween(jan16, jan14)).isEmpty();
  }

  @Test
  void dateRange_previousHasSameLengthAndEndsTheDayBefore() {
    var range = DateRange.endingOn(LocalDate.of(2025, 1, 31), 30);

    var previous = range.previous();

    assertThat(range.start()).isEqualTo(LocalDate.of(2025, 1, 2));
    assertThat(previous.end()).isEqualTo(LocalDate.of(2025, 1, 1));
    assertThat(previous.days()).isEqualTo(30);
    assertThat(previous.span(range).days()).isEqualTo(60);
  }
}
