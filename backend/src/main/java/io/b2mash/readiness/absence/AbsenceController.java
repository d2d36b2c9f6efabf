package io.b2mash.readiness.absence;

import io.b2mash.readiness.scope.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AbsenceController {

  private final AbsenceService absenceService;

  public AbsenceController(AbsenceService absenceService) {
    this.absenceService = absenceService;
  }

  @GetMapping("/api/absences/my-pending")
  public ResponseEntity<PendingAbsencesResponse> getMyPending() {
    var pending = absenceService.getMyPending(RequestScopes.requireScope());
    return ResponseEntity.ok(
        new PendingAbsencesResponse(
            pending.absences().stream().map(AbsenceResponse::from).toList(),
            pending.hasBlocking()));
  }

  @PostMapping("/api/absences/justify")
  public ResponseEntity<List<AbsenceResponse>> justify(
      @Valid @RequestBody JustifyAbsencesRequest request) {
    var items =
        request.justifications().stream()
            .map(
                j -> new AbsenceJustification(j.absenceId(), j.reasonCategory(), j.explanation()))
            .toList();
    var justified = absenceService.submitJustification(RequestScopes.requireScope(), items);
    return ResponseEntity.ok(justified.stream().map(AbsenceResponse::from).toList());
  }

  @GetMapping("/api/absences/my-history")
  public ResponseEntity<List<AbsenceResponse>> getMyHistory(
      @RequestParam(required = false) Integer limit) {
    var history = absenceService.getHistory(RequestScopes.requireScope(), limit);
    return ResponseEntity.ok(history.stream().map(AbsenceResponse::from).toList());
  }

  @GetMapping("/api/absences/my-counts")
  public ResponseEntity<AbsenceCounts> getMyCounts() {
    return ResponseEntity.ok(absenceService.getCounts(RequestScopes.requireScope()));
  }

  @GetMapping("/api/absences/pending-reviews")
  public ResponseEntity<List<AbsenceResponse>> getPendingReviews() {
    var pending = absenceService.getPendingReviews(RequestScopes.requireScope());
    return ResponseEntity.ok(pending.stream().map(AbsenceResponse::from).toList());
  }

  @GetMapping("/api/teams/{teamId}/absences/pending-reviews")
  public ResponseEntity<List<AbsenceResponse>> getPendingReviewsForTeam(
      @PathVariable UUID teamId) {
    var pending = absenceService.getPendingReviewsForTeam(RequestScopes.requireScope(), teamId);
    return ResponseEntity.ok(pending.stream().map(AbsenceResponse::from).toList());
  }

  @PostMapping("/api/absences/{id}/review")
  public ResponseEntity<AbsenceResponse> review(
      @PathVariable UUID id, @Valid @RequestBody ReviewAbsenceRequest request) {
    var absence =
        absenceService.reviewAbsence(
            RequestScopes.requireScope(), id, request.action(), request.notes());
    return ResponseEntity.ok(AbsenceResponse.from(absence));
  }

  // --- DTOs ---

  public record JustificationItem(
      @NotNull UUID absenceId,
      @NotNull AbsenceReasonCategory reasonCategory,
      @NotBlank @Size(max = 1000) String explanation) {}

  public record JustifyAbsencesRequest(@NotEmpty List<@Valid JustificationItem> justifications) {}

  public record ReviewAbsenceRequest(
      @NotNull AbsenceStatus action, @Size(max = 500) String notes) {}

  public record PendingAbsencesResponse(List<AbsenceResponse> absences, boolean hasBlocking) {}

  public record AbsenceResponse(
      UUID id,
      UUID memberId,
      UUID teamId,
      LocalDate absenceDate,
      AbsenceStatus status,
      boolean justified,
      AbsenceReasonCategory reasonCategory,
      String explanation,
      Instant justifiedAt,
      UUID reviewedBy,
      String reviewNotes,
      Instant reviewedAt) {

    public static AbsenceResponse from(Absence absence) {
      return new AbsenceResponse(
          absence.getId(),
          absence.getMemberId(),
          absence.getTeamId(),
          absence.getAbsenceDate(),
          absence.getStatus(),
          absence.isJustified(),
          absence.getReasonCategory(),
          absence.getExplanation(),
          absence.getJustifiedAt(),
          absence.getReviewedBy(),
          absence.getReviewNotes(),
          absence.getReviewedAt());
    }
  }
}
