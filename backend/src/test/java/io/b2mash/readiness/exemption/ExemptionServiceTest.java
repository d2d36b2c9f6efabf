package io.b2mash.readiness.exemption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.readiness.absence.AbsenceRepository;
import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.event.ExemptionDecidedEvent;
import io.b2mash.readiness.event.ExemptionRequestedEvent;
import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.member.Member;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.member.MemberRole;
import io.b2mash.readiness.scope.SelfScope;
import io.b2mash.readiness.scope.TeamScope;
import io.b2mash.readiness.team.Team;
import io.b2mash.readiness.team.TeamAccessService;
import io.b2mash.readiness.team.TeamRepository;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class ExemptionServiceTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final UUID WORKER_ID = UUID.randomUUID();
  private static final UUID LEAD_ID = UUID.randomUUID();
  private static final LocalDate START = LocalDate.of(2025, 1, 13);
  private static final LocalDate END = LocalDate.of(2025, 1, 17);

  private static final SelfScope WORKER = new SelfScope(WORKER_ID, COMPANY_ID, TEAM_ID);
  private static final TeamScope LEAD = new TeamScope(LEAD_ID, COMPANY_ID, Set.of(TEAM_ID), null);

  @Mock private ExemptionRepository exemptionRepository;
  @Mock private AbsenceRepository absenceRepository;
  @Mock private MemberRepository memberRepository;
  @Mock private TeamRepository teamRepository;
  @Mock private TeamAccessService teamAccessService;
  @Mock private CompanyZoneResolver zoneResolver;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ExemptionService service;

  @BeforeEach
  void setUp() {
    service =
        new ExemptionService(
            exemptionRepository,
            absenceRepository,
            memberRepository,
            teamRepository,
            teamAccessService,
            zoneResolver,
            eventPublisher);
  }

  @Test
  void requestExemption_onlyForWorkers() {
    var lead =
        withId(new Member(COMPANY_ID, TEAM_ID, "Lee", "lee@example.com", MemberRole.TEAM_LEAD));
    when(memberRepository.findById(LEAD_ID)).thenReturn(Optional.of(lead));

    assertThatThrownBy(
            () -> service.requestExemption(LEAD, ExemptionType.SICK_LEAVE, "Flu", START, END))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void requestExemption_requiresTeamLead() {
    stubWorker();
    when(teamRepository.findById(TEAM_ID))
        .thenReturn(Optional.of(new Team(COMPANY_ID, "Alpha", null, null)));

    assertThatThrownBy(
            () -> service.requestExemption(WORKER, ExemptionType.SICK_LEAVE, "Flu", START, END))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("team lead");
  }

  @Test
  void requestExemption_rejectsOverlap() {
    stubWorker();
    stubTeam();
    when(exemptionRepository.existsOpenOverlapping(WORKER_ID, START, END)).thenReturn(true);

    assertThatThrownBy(
            () -> service.requestExemption(WORKER, ExemptionType.SICK_LEAVE, "Flu", START, END))
        .isInstanceOf(ResourceConflictException.class);
    verify(exemptionRepository, never()).save(any());
  }

  @Test
  void requestExemption_savesPendingAndPublishes() {
    stubWorker();
    stubTeam();
    when(exemptionRepository.existsOpenOverlapping(WORKER_ID, START, END)).thenReturn(false);
    when(exemptionRepository.save(any(Exemption.class)))
        .thenAnswer(inv -> withId((Exemption) inv.getArgument(0)));

    var exemption =
        service.requestExemption(WORKER, ExemptionType.PERSONAL_LEAVE, "Wedding", START, END);

    assertThat(exemption.getStatus()).isEqualTo(ExemptionStatus.PENDING);
    assertThat(exemption.getTeamId()).isEqualTo(TEAM_ID);
    verify(eventPublisher).publishEvent(any(ExemptionRequestedEvent.class));
  }

  @Test
  void approve_forbiddenForRequester() {
    var exemption = pendingExemption();
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));

    assertThatThrownBy(() -> service.approve(WORKER, exemption.getId(), null))
        .isInstanceOf(ForbiddenException.class);
    assertThat(exemption.getStatus()).isEqualTo(ExemptionStatus.PENDING);
  }

  @Test
  void approve_hiddenFromOtherTeamsLead() {
    var exemption = pendingExemption();
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));
    var otherLead = new TeamScope(UUID.randomUUID(), COMPANY_ID, Set.of(UUID.randomUUID()), null);

    assertThatThrownBy(() -> service.approve(otherLead, exemption.getId(), null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void approve_byLeadRebuildsCoveredDates() {
    var exemption = pendingExemption();
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));

    service.approve(LEAD, exemption.getId(), "Get well");

    assertThat(exemption.getStatus()).isEqualTo(ExemptionStatus.APPROVED);
    var captor = ArgumentCaptor.forClass(ExemptionDecidedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().affectsSummaries()).isTrue();
    assertThat(captor.getValue().startDate()).isEqualTo(START);
    assertThat(captor.getValue().endDate()).isEqualTo(END);
  }

  @Test
  void approve_excusesPendingAbsencesInsideLeave() {
    var exemption = pendingExemption();
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));
    when(absenceRepository.excuseCoveredByLeave(
            eq(WORKER_ID), eq(START), eq(END), eq(LEAD_ID), anyString(), any()))
        .thenReturn(2);

    service.approve(LEAD, exemption.getId(), null);

    verify(absenceRepository)
        .excuseCoveredByLeave(
            eq(WORKER_ID),
            eq(START),
            eq(END),
            eq(LEAD_ID),
            eq("Covered by approved leave (SICK_LEAVE)"),
            any());
  }

  @Test
  void reject_doesNotAffectSummaries() {
    var exemption = pendingExemption();
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));

    service.reject(LEAD, exemption.getId(), "Busy week");

    var captor = ArgumentCaptor.forClass(ExemptionDecidedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().affectsSummaries()).isFalse();
    verify(absenceRepository, never())
        .excuseCoveredByLeave(any(), any(), any(), any(), any(), any());
  }

  @Test
  void cancel_requesterCanWithdrawPending() {
    var exemption = pendingExemption();
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));

    service.cancel(WORKER, exemption.getId());

    assertThat(exemption.getStatus()).isEqualTo(ExemptionStatus.CANCELLED);
  }

  @Test
  void cancel_requesterCannotWithdrawApproved() {
    var exemption = pendingExemption();
    exemption.approve(LEAD_ID, null);
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));

    assertThatThrownBy(() -> service.cancel(WORKER, exemption.getId()))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void endEarly_rebuildsReleasedDates() {
    var exemption = pendingExemption();
    exemption.approve(LEAD_ID, null);
    when(exemptionRepository.findById(exemption.getId())).thenReturn(Optional.of(exemption));
    when(zoneResolver.zoneOf(COMPANY_ID)).thenReturn(ZoneOffset.UTC);

    service.endEarly(LEAD, exemption.getId(), LocalDate.of(2025, 1, 14), null);

    assertThat(exemption.getEndDate()).isEqualTo(LocalDate.of(2025, 1, 14));
    var captor = ArgumentCaptor.forClass(ExemptionDecidedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().startDate()).isEqualTo(LocalDate.of(2025, 1, 15));
    assertThat(captor.getValue().endDate()).isEqualTo(END);
  }

  private void stubWorker() {
    var worker = new Member(COMPANY_ID, TEAM_ID, "Wren", "wren@example.com", MemberRole.WORKER);
    setField(Member.class, worker, "id", WORKER_ID);
    when(memberRepository.findById(WORKER_ID)).thenReturn(Optional.of(worker));
  }

  private void stubTeam() {
    var team = new Team(COMPANY_ID, "Alpha", null, LEAD_ID);
    setField(Team.class, team, "id", TEAM_ID);
    when(teamRepository.findById(TEAM_ID)).thenReturn(Optional.of(team));
  }

  private static Exemption pendingExemption() {
    return withId(
        new Exemption(
            WORKER_ID,
            TEAM_ID,
            COMPANY_ID,
            ExemptionType.SICK_LEAVE,
            "Flu",
            START,
            END,
            WORKER_ID));
  }

  private static Exemption withId(Exemption exemption) {
    setField(Exemption.class, exemption, "id", UUID.randomUUID());
    return exemption;
  }

  private static Member withId(Member member) {
    setField(Member.class, member, "id", UUID.randomUUID());
    return member;
  }

  private static void setField(Class<?> type, Object target, String name, Object value) {
    try {
      var field = type.getDeclaredField(name);
      field.setAccessible(true);
      field.set(target, value);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }
  }
}
