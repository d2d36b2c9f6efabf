package io.b2mash.readiness.checkin;

import io.b2mash.readiness.scope.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CheckinController {

  private final CheckinService checkinService;

  public CheckinController(CheckinService checkinService) {
    this.checkinService = checkinService;
  }

  @PostMapping("/api/checkins")
  public ResponseEntity<CheckinResponse> submit(@Valid @RequestBody SubmitCheckinRequest request) {
    var checkin =
        checkinService.submit(
            RequestScopes.requireScope(),
            request.mood(),
            request.stress(),
            request.sleep(),
            request.physicalHealth(),
            request.notes());
    return ResponseEntity.created(URI.create("/api/checkins/" + checkin.getId()))
        .body(CheckinResponse.from(checkin));
  }

  // --- DTOs ---

  public record SubmitCheckinRequest(
      @NotNull @Min(1) @Max(10) Integer mood,
      @NotNull @Min(1) @Max(10) Integer stress,
      @NotNull @Min(1) @Max(10) Integer sleep,
      @NotNull @Min(1) @Max(10) Integer physicalHealth,
      @Size(max = 1000) String notes) {}

  public record CheckinResponse(
      UUID id,
      UUID memberId,
      UUID teamId,
      LocalDate checkinDate,
      Instant submittedAt,
      int readinessScore,
      ReadinessStatus readinessStatus) {

    public static CheckinResponse from(Checkin checkin) {
      return new CheckinResponse(
          checkin.getId(),
          checkin.getMemberId(),
          checkin.getTeamId(),
          checkin.getCheckinDate(),
          checkin.getSubmittedAt(),
          checkin.getReadinessScore(),
          checkin.getReadinessStatus());
    }
  }
}
