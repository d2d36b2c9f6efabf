package io.b2mash.readiness.absence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.readiness.company.CompanyZoneResolver;
import io.b2mash.readiness.config.ReadinessProperties;
import io.b2mash.readiness.event.AbsenceJustifiedEvent;
import io.b2mash.readiness.event.AbsenceReviewedEvent;
import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.scope.SelfScope;
import io.b2mash.readiness.scope.TeamScope;
import io.b2mash.readiness.summary.AttendanceSnapshotLoader;
import io.b2mash.readiness.team.TeamAccessService;
import io.b2mash.readiness.team.TeamRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class AbsenceServiceTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final UUID WORKER_ID = UUID.randomUUID();
  private static final UUID OTHER_WORKER_ID = UUID.randomUUID();
  private static final UUID LEAD_ID = UUID.randomUUID();
  private static final LocalDate ABSENCE_DATE = LocalDate.of(2025, 1, 14);

  private static final SelfScope WORKER = new SelfScope(WORKER_ID, COMPANY_ID, TEAM_ID);
  private static final TeamScope LEAD = new TeamScope(LEAD_ID, COMPANY_ID, Set.of(TEAM_ID), null);

  @Mock private AbsenceRepository absenceRepository;
  @Mock private AbsenceDetectionRepository detectionRepository;
  @Mock private MemberRepository memberRepository;
  @Mock private TeamRepository teamRepository;
  @Mock private TeamAccessService teamAccessService;
  @Mock private AttendanceSnapshotLoader snapshotLoader;
  @Mock private CompanyZoneResolver zoneResolver;
  @Mock private ApplicationEventPublisher eventPublisher;

  private AbsenceService service;

  @BeforeEach
  void setUp() {
    var properties =
        new ReadinessProperties(
            "UTC",
            new ReadinessProperties.Recompute(
                31, Duration.ofSeconds(30), new ReadinessProperties.Executor(1, 1, 10)),
            new ReadinessProperties.Absence(14, 30),
            new ReadinessProperties.Grading(30),
            new ReadinessProperties.Finalizer(false, 1));
    service =
        new AbsenceService(
            absenceRepository,
            detectionRepository,
            memberRepository,
            teamRepository,
            teamAccessService,
            snapshotLoader,
            zoneResolver,
            properties,
            eventPublisher);
  }

  @Test
  void submitJustification_rejectsEmptyBatch() {
    assertThatThrownBy(() -> service.submitJustification(WORKER, List.of()))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void submitJustification_rejectsDuplicateIds() {
    var id = UUID.randomUUID();
    var item = new AbsenceJustification(id, AbsenceReasonCategory.SICK, "Fever");

    assertThatThrownBy(() -> service.submitJustification(WORKER, List.of(item, item)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void submitJustification_hidesAbsencesOfOtherMembers() {
    var absence = absence(OTHER_WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, null);
    when(absenceRepository.findAllById(List.of(absence.getId()))).thenReturn(List.of(absence));

    assertThatThrownBy(
            () ->
                service.submitJustification(
                    WORKER,
                    List.of(
                        new AbsenceJustification(
                            absence.getId(), AbsenceReasonCategory.SICK, "Fever"))))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(absenceRepository, never())
        .justify(any(), any(), any(), anyString(), any(Instant.class));
  }

  @Test
  void submitJustification_conflictsWhenAlreadyJustified() {
    var absence =
        absence(WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, AbsenceReasonCategory.PERSONAL);
    when(absenceRepository.findAllById(List.of(absence.getId()))).thenReturn(List.of(absence));

    assertThatThrownBy(
            () ->
                service.submitJustification(
                    WORKER,
                    List.of(
                        new AbsenceJustification(
                            absence.getId(), AbsenceReasonCategory.SICK, "Fever"))))
        .isInstanceOf(ResourceConflictException.class);
    verify(absenceRepository, never())
        .justify(any(), any(), any(), anyString(), any(Instant.class));
  }

  @Test
  void submitJustification_justifiesAndPublishes() {
    var pending = absence(WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, null);
    var justified =
        absence(
            pending.getId(),
            WORKER_ID,
            AbsenceStatus.PENDING_JUSTIFICATION,
            AbsenceReasonCategory.SICK);
    when(absenceRepository.findAllById(List.of(pending.getId())))
        .thenReturn(List.of(pending), List.of(justified));
    when(absenceRepository.justify(
            eq(pending.getId()),
            eq(WORKER_ID),
            eq(AbsenceReasonCategory.SICK),
            eq("Fever"),
            any(Instant.class)))
        .thenReturn(1);

    var result =
        service.submitJustification(
            WORKER,
            List.of(
                new AbsenceJustification(pending.getId(), AbsenceReasonCategory.SICK, "Fever")));

    assertThat(result).containsExactly(justified);
    verify(eventPublisher).publishEvent(any(AbsenceJustifiedEvent.class));
  }

  @Test
  void submitJustification_conflictsWhenConcurrentlyChanged() {
    var pending = absence(WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, null);
    var reviewed =
        absence(pending.getId(), WORKER_ID, AbsenceStatus.EXCUSED, AbsenceReasonCategory.SICK);
    when(absenceRepository.findAllById(List.of(pending.getId()))).thenReturn(List.of(pending));
    when(absenceRepository.justify(any(), any(), any(), anyString(), any(Instant.class)))
        .thenReturn(0);
    when(absenceRepository.findById(pending.getId())).thenReturn(Optional.of(reviewed));

    assertThatThrownBy(
            () ->
                service.submitJustification(
                    WORKER,
                    List.of(
                        new AbsenceJustification(
                            pending.getId(), AbsenceReasonCategory.SICK, "Fever"))))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("EXCUSED");
    verify(eventPublisher, never()).publishEvent(any(Object.class));
  }

  @Test
  void reviewAbsence_rejectsNonTerminalVerdict() {
    assertThatThrownBy(
            () ->
                service.reviewAbsence(
                    LEAD, UUID.randomUUID(), AbsenceStatus.PENDING_JUSTIFICATION, null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void reviewAbsence_forbiddenForTeammates() {
    var absence =
        absence(OTHER_WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, AbsenceReasonCategory.SICK);
    when(absenceRepository.findById(absence.getId())).thenReturn(Optional.of(absence));

    assertThatThrownBy(
            () -> service.reviewAbsence(WORKER, absence.getId(), AbsenceStatus.EXCUSED, null))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void reviewAbsence_conflictsWhenNotJustified() {
    var absence = absence(WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, null);
    when(absenceRepository.findById(absence.getId())).thenReturn(Optional.of(absence));

    assertThatThrownBy(
            () -> service.reviewAbsence(LEAD, absence.getId(), AbsenceStatus.EXCUSED, "ok"))
        .isInstanceOf(ResourceConflictException.class);
    verify(absenceRepository, never()).review(any(), any(), any(), any(), any());
  }

  @Test
  void reviewAbsence_conflictsWhenAlreadyReviewed() {
    var absence = absence(WORKER_ID, AbsenceStatus.UNEXCUSED, AbsenceReasonCategory.SICK);
    when(absenceRepository.findById(absence.getId())).thenReturn(Optional.of(absence));

    assertThatThrownBy(
            () -> service.reviewAbsence(LEAD, absence.getId(), AbsenceStatus.EXCUSED, "ok"))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("UNEXCUSED");
    verify(absenceRepository, never()).review(any(), any(), any(), any(), any());
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void reviewAbsence_recordsVerdictAndPublishes() {
    var justified =
        absence(WORKER_ID, AbsenceStatus.PENDING_JUSTIFICATION, AbsenceReasonCategory.SICK);
    var excused =
        absence(justified.getId(), WORKER_ID, AbsenceStatus.EXCUSED, AbsenceReasonCategory.SICK);
    when(absenceRepository.findById(justified.getId()))
        .thenReturn(Optional.of(justified), Optional.of(excused));
    when(absenceRepository.review(
            eq(justified.getId()),
            eq(AbsenceStatus.EXCUSED),
            eq(LEAD_ID),
            eq("ok"),
            any(Instant.class)))
        .thenReturn(1);

    var result = service.reviewAbsence(LEAD, justified.getId(), AbsenceStatus.EXCUSED, "ok");

    assertThat(result.getStatus()).isEqualTo(AbsenceStatus.EXCUSED);
    verify(eventPublisher).publishEvent(any(AbsenceReviewedEvent.class));
  }

  @Test
  void getHistory_usesConfiguredDefaultLimit() {
    when(absenceRepository.findHistory(WORKER_ID, PageRequest.of(0, 30))).thenReturn(List.of());

    assertThat(service.getHistory(WORKER, null)).isEmpty();
  }

  @Test
  void getHistory_rejectsOutOfRangeLimit() {
    assertThatThrownBy(() -> service.getHistory(WORKER, 0))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.getHistory(WORKER, 101))
        .isInstanceOf(InvalidStateException.class);
  }

  private static Absence absence(
      UUID memberId, AbsenceStatus status, AbsenceReasonCategory justifiedWith) {
    return absence(UUID.randomUUID(), memberId, status, justifiedWith);
  }

  /** An absence in the given state; a non-null reason marks it as justified. */
  private static Absence absence(
      UUID id, UUID memberId, AbsenceStatus status, AbsenceReasonCategory justifiedWith) {
    var absence = new Absence(memberId, TEAM_ID, COMPANY_ID, ABSENCE_DATE);
    setField(absence, "id", id);
    setField(absence, "status", status);
    if (justifiedWith != null) {
      setField(absence, "reasonCategory", justifiedWith);
      setField(absence, "explanation", "Fever");
      setField(absence, "justifiedAt", Instant.parse("2025-01-15T09:00:00Z"));
    }
    return absence;
  }

  private static void setField(Absence absence, String name, Object value) {
    try {
      var field = Absence.class.getDeclaredField(name);
      field.setAccessible(true);
      field.set(absence, value);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }
  }
}
