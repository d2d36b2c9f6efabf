package io.b2mash.readiness.summary;

import io.b2mash.readiness.absence.AbsenceRepository;
import io.b2mash.readiness.calendar.DateRange;
import io.b2mash.readiness.calendar.WorkCalendar;
import io.b2mash.readiness.checkin.CheckinRepository;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.company.HolidayRepository;
import io.b2mash.readiness.exemption.ExemptionRepository;
import io.b2mash.readiness.member.Member;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.summary.AttendanceSnapshot.AbsenceFact;
import io.b2mash.readiness.summary.AttendanceSnapshot.CheckinFact;
import io.b2mash.readiness.summary.AttendanceSnapshot.LeaveFact;
import io.b2mash.readiness.summary.AttendanceSnapshot.MemberFact;
import io.b2mash.readiness.team.Team;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Batch-loads {@link AttendanceSnapshot}s. One query per table for any number of teams of a
 * company, then in-memory fan-out per team.
 */
@Component
public class AttendanceSnapshotLoader {

  private final MemberRepository memberRepository;
  private final CheckinRepository checkinRepository;
  private final HolidayRepository holidayRepository;
  private final ExemptionRepository exemptionRepository;
  private final AbsenceRepository absenceRepository;
  private final CompanyZoneResolver zoneResolver;

  public AttendanceSnapshotLoader(
      MemberRepository memberRepository,
      CheckinRepository checkinRepository,
      HolidayRepository holidayRepository,
      ExemptionRepository exemptionRepository,
      AbsenceRepository absenceRepository,
      CompanyZoneResolver zoneResolver) {
    this.memberRepository = memberRepository;
    this.checkinRepository = checkinRepository;
    this.holidayRepository = holidayRepository;
    this.exemptionRepository = exemptionRepository;
    this.absenceRepository = absenceRepository;
    this.zoneResolver = zoneResolver;
  }

  @Transactional(readOnly = true)
  public AttendanceSnapshot load(Team team, DateRange range) {
    return loadAll(team.getCompanyId(), List.of(team), range).get(team.getId());
  }

  /**
   * Loads snapshots for teams that all belong to {@code companyId}, keyed by team id in input
   * order.
   */
  @Transactional(readOnly = true)
  public Map<UUID, AttendanceSnapshot> loadAll(UUID companyId, List<Team> teams, DateRange range) {
    var result = new LinkedHashMap<UUID, AttendanceSnapshot>();
    if (teams.isEmpty()) {
      return result;
    }
    var zone = zoneResolver.zoneOf(companyId);
    var teamIds = teams.stream().map(Team::getId).toList();
    var members = memberRepository.findActiveWorkersByTeamIdIn(teamIds);
    var memberIds = members.stream().map(Member::getId).toList();
    Map<UUID, UUID> teamOfMember = new HashMap<>();
    members.forEach(m -> teamOfMember.put(m.getId(), m.getTeamId()));

    Set<LocalDate> holidays =
        holidayRepository
            .findByCompanyIdAndDateRange(companyId, range.start(), range.end())
            .stream()
            .map(h -> h.getHolidayDate())
            .collect(Collectors.toSet());

    Map<UUID, List<CheckinFact>> checkinsByTeam = new HashMap<>();
    Map<UUID, List<LeaveFact>> leavesByTeam = new HashMap<>();
    Map<UUID, List<AbsenceFact>> absencesByTeam = new HashMap<>();
    if (!memberIds.isEmpty()) {
      var checkins =
          checkinRepository.findByMemberIdsAndDateRange(memberIds, range.start(), range.end());
      for (var c : checkins) {
        checkinsByTeam
            .computeIfAbsent(teamOfMember.get(c.getMemberId()), t -> new ArrayList<>())
            .add(
                new CheckinFact(
                    c.getMemberId(),
                    c.getCheckinDate(),
                    c.getReadinessScore(),
                    c.getReadinessStatus(),
                    c.getMood(),
                    c.getStress(),
                    c.getSleep(),
                    c.getPhysicalHealth()));
      }
      var leaves =
          exemptionRepository.findApprovedOverlapping(memberIds, range.start(), range.end());
      for (var e : leaves) {
        leavesByTeam
            .computeIfAbsent(teamOfMember.get(e.getMemberId()), t -> new ArrayList<>())
            .add(new LeaveFact(e.getMemberId(), e.getStartDate(), e.getEndDate()));
      }
      var absences =
          absenceRepository.findByMemberIdsAndDateRange(memberIds, range.start(), range.end());
      for (var a : absences) {
        absencesByTeam
            .computeIfAbsent(teamOfMember.get(a.getMemberId()), t -> new ArrayList<>())
            .add(new AbsenceFact(a.getMemberId(), a.getAbsenceDate(), a.getStatus()));
      }
    }

    Map<UUID, List<MemberFact>> membersByTeam = new HashMap<>();
    for (var m : members) {
      membersByTeam
          .computeIfAbsent(m.getTeamId(), t -> new ArrayList<>())
          .add(
              new MemberFact(
                  m.getId(),
                  m.getName(),
                  WorkCalendar.effectiveStartLocalDate(m.attendanceAnchor(), zone)));
    }

    for (var team : teams) {
      result.put(
          team.getId(),
          new AttendanceSnapshot(
              team.getId(),
              team.getCompanyId(),
              WorkCalendar.parseWorkDays(team.getWorkDays()),
              range,
              membersByTeam.getOrDefault(team.getId(), List.of()),
              checkinsByTeam.getOrDefault(team.getId(), List.of()),
              holidays,
              leavesByTeam.getOrDefault(team.getId(), List.of()),
              absencesByTeam.getOrDefault(team.getId(), List.of())));
    }
    return result;
  }
}
