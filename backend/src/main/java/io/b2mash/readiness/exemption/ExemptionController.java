package io.b2mash.readiness.exemption;

import io.b2mash.readiness.scope.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ExemptionController {

  private final ExemptionService exemptionService;

  public ExemptionController(ExemptionService exemptionService) {
    this.exemptionService = exemptionService;
  }

  @PostMapping("/api/exemptions")
  public ResponseEntity<ExemptionResponse> requestExemption(
      @Valid @RequestBody CreateExemptionRequest request) {
    var exemption =
        exemptionService.requestExemption(
            RequestScopes.requireScope(),
            request.type(),
            request.reason(),
            request.startDate(),
            request.endDate());
    return ResponseEntity.created(URI.create("/api/exemptions/" + exemption.getId()))
        .body(ExemptionResponse.from(exemption));
  }

  @GetMapping("/api/exemptions/mine")
  public ResponseEntity<List<ExemptionResponse>> listMine() {
    var exemptions = exemptionService.listMine(RequestScopes.requireScope());
    return ResponseEntity.ok(exemptions.stream().map(ExemptionResponse::from).toList());
  }

  @GetMapping("/api/teams/{teamId}/exemptions")
  public ResponseEntity<List<ExemptionResponse>> listForTeam(@PathVariable UUID teamId) {
    var exemptions = exemptionService.listForTeam(RequestScopes.requireScope(), teamId);
    return ResponseEntity.ok(exemptions.stream().map(ExemptionResponse::from).toList());
  }

  @PostMapping("/api/exemptions/{id}/approve")
  public ResponseEntity<ExemptionResponse> approve(
      @PathVariable UUID id, @Valid @RequestBody(required = false) ReviewNotesRequest request) {
    var exemption =
        exemptionService.approve(RequestScopes.requireScope(), id, notesOf(request));
    return ResponseEntity.ok(ExemptionResponse.from(exemption));
  }

  @PostMapping("/api/exemptions/{id}/reject")
  public ResponseEntity<ExemptionResponse> reject(
      @PathVariable UUID id, @Valid @RequestBody(required = false) ReviewNotesRequest request) {
    var exemption = exemptionService.reject(RequestScopes.requireScope(), id, notesOf(request));
    return ResponseEntity.ok(ExemptionResponse.from(exemption));
  }

  @PostMapping("/api/exemptions/{id}/cancel")
  public ResponseEntity<ExemptionResponse> cancel(@PathVariable UUID id) {
    var exemption = exemptionService.cancel(RequestScopes.requireScope(), id);
    return ResponseEntity.ok(ExemptionResponse.from(exemption));
  }

  @PostMapping("/api/exemptions/{id}/end-early")
  public ResponseEntity<ExemptionResponse> endEarly(
      @PathVariable UUID id, @Valid @RequestBody(required = false) EndEarlyRequest request) {
    var exemption =
        exemptionService.endEarly(
            RequestScopes.requireScope(),
            id,
            request != null ? request.endDate() : null,
            request != null ? request.notes() : null);
    return ResponseEntity.ok(ExemptionResponse.from(exemption));
  }

  private static String notesOf(ReviewNotesRequest request) {
    return request != null ? request.notes() : null;
  }

  // --- DTOs ---

  public record CreateExemptionRequest(
      @NotNull ExemptionType type,
      @NotBlank @Size(max = 1000) String reason,
      @NotNull LocalDate startDate,
      @NotNull LocalDate endDate) {}

  public record ReviewNotesRequest(@Size(max = 500) String notes) {}

  public record EndEarlyRequest(LocalDate endDate, @Size(max = 500) String notes) {}

  public record ExemptionResponse(
      UUID id,
      UUID memberId,
      UUID teamId,
      ExemptionType type,
      String reason,
      LocalDate startDate,
      LocalDate endDate,
      ExemptionStatus status,
      UUID reviewedBy,
      String reviewNotes,
      Instant reviewedAt,
      Instant createdAt) {

    public static ExemptionResponse from(Exemption exemption) {
      return new ExemptionResponse(
          exemption.getId(),
          exemption.getMemberId(),
          exemption.getTeamId(),
          exemption.getType(),
          exemption.getReason(),
          exemption.getStartDate(),
          exemption.getEndDate(),
          exemption.getStatus(),
          exemption.getReviewedBy(),
          exemption.getReviewNotes(),
          exemption.getReviewedAt(),
          exemption.getCreatedAt());
    }
  }
}
