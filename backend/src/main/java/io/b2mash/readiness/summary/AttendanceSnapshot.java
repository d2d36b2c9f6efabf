package io.b2mash.readiness.summary;

import io.b2mash.readiness.absence.AbsenceStatus;
import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.checkin.ReadinessStatus;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Consistent, in-memory view of everything that decides one team's attendance over a date range:
 * its active workers, their check-ins, the company's holidays, approved leave and absence verdicts.
 * Loaded in one batch so a member can never appear both on leave and expected.
 */
public final class AttendanceSnapshot {

  /** An active worker and the first date their check-in obligation applies. */
  public record MemberFact(UUID memberId, String name, LocalDate effectiveStart) {}

  public record CheckinFact(
      UUID memberId,
      LocalDate date,
      int readinessScore,
      ReadinessStatus status,
      int mood,
      int stress,
      int sleep,
      int physicalHealth) {}

  /** Approved leave covering {@code start..end} inclusive. */
  public record LeaveFact(UUID memberId, LocalDate start, LocalDate end) {

    boolean covers(LocalDate date) {
      return !date.isBefore(start) && !date.isAfter(end);
    }
  }

  public record AbsenceFact(UUID memberId, LocalDate date, AbsenceStatus status) {}

  private final UUID teamId;
  private final UUID companyId;
  private final Set<DayOfWeek> workDays;
  private final DateRange range;
  private final List<MemberFact> members;
  private final Set<LocalDate> holidays;
  private final Map<LocalDate, List<CheckinFact>> checkinsByDate = new HashMap<>();
  private final Map<UUID, List<CheckinFact>> checkinsByMember = new HashMap<>();
  private final Map<UUID, List<LeaveFact>> leavesByMember = new HashMap<>();
  private final Map<UUID, Map<LocalDate, AbsenceStatus>> absencesByMember = new HashMap<>();

  public AttendanceSnapshot(
      UUID teamId,
      UUID companyId,
      Set<DayOfWeek> workDays,
      DateRange range,
      List<MemberFact> members,
      Collection<CheckinFact> checkins,
      Set<LocalDate> holidays,
      Collection<LeaveFact> leaves,
      Collection<AbsenceFact> absences) {
    this.teamId = teamId;
    this.companyId = companyId;
    this.workDays = Set.copyOf(workDays);
    this.range = range;
    this.members = List.copyOf(members);
    this.holidays = Set.copyOf(holidays);
    for (var checkin : checkins) {
      checkinsByDate.computeIfAbsent(checkin.date(), d -> new ArrayList<>()).add(checkin);
      checkinsByMember.computeIfAbsent(checkin.memberId(), m -> new ArrayList<>()).add(checkin);
    }
    for (var leave : leaves) {
      leavesByMember.computeIfAbsent(leave.memberId(), m -> new ArrayList<>()).add(leave);
    }
    for (var absence : absences) {
      absencesByMember
          .computeIfAbsent(absence.memberId(), m -> new HashMap<>())
          .put(absence.date(), absence.status());
    }
  }

  public UUID teamId() {
    return teamId;
  }

  public UUID companyId() {
    return companyId;
  }

  public Set<DayOfWeek> workDays() {
    return workDays;
  }

  public DateRange range() {
    return range;
  }

  public List<MemberFact> members() {
    return members;
  }

  public boolean isHoliday(LocalDate date) {
    return holidays.contains(date);
  }

  /** Check-ins of this team's members on {@code date}; at most one per member. */
  public List<CheckinFact> checkinsOn(LocalDate date) {
    return checkinsByDate.getOrDefault(date, List.of());
  }

  public List<CheckinFact> checkinsOf(UUID memberId, DateRange period) {
    return checkinsByMember.getOrDefault(memberId, List.of()).stream()
        .filter(c -> period.contains(c.date()))
        .toList();
  }

  public boolean hasCheckin(UUID memberId, LocalDate date) {
    return checkinsByMember.getOrDefault(memberId, List.of()).stream()
        .anyMatch(c -> c.date().equals(date));
  }

  /** Overlapping approved leave never double-counts: the answer is a plain yes or no. */
  public boolean isOnLeave(UUID memberId, LocalDate date) {
    return leavesByMember.getOrDefault(memberId, List.of()).stream()
        .anyMatch(leave -> leave.covers(date));
  }

  /** Verdict state of the member's absence on {@code date}, or null if none was recorded. */
  public AbsenceStatus absenceStatus(UUID memberId, LocalDate date) {
    return absencesByMember.getOrDefault(memberId, Map.of()).get(date);
  }

  public long countAbsences(UUID memberId, DateRange period, AbsenceStatus status) {
    return absencesByMember.getOrDefault(memberId, Map.of()).entrySet().stream()
        .filter(e -> period.contains(e.getKey()) && e.getValue() == status)
        .count();
  }
}
