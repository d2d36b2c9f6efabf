package io.b2mash.readiness.summary;

import io.b2mash.readiness.scope.RequestScopes;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/teams/{teamId}/daily-summaries")
public class DailySummaryController {

  private final DailySummaryService dailySummaryService;

  public DailySummaryController(DailySummaryService dailySummaryService) {
    this.dailySummaryService = dailySummaryService;
  }

  @GetMapping("/{date}")
  public ResponseEntity<DailyAttendanceFigures> getDailySummary(
      @PathVariable UUID teamId,
      @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return ResponseEntity.ok(
        dailySummaryService.getDailySummary(RequestScopes.requireScope(), teamId, date));
  }

  @GetMapping
  public ResponseEntity<List<DailyAttendanceFigures>> listSummaries(
      @PathVariable UUID teamId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    return ResponseEntity.ok(
        dailySummaryService.listSummaries(RequestScopes.requireScope(), teamId, from, to));
  }

  @PostMapping("/recalculate")
  public ResponseEntity<List<DailyAttendanceFigures>> rebuildRange(
      @PathVariable UUID teamId,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    return ResponseEntity.ok(
        dailySummaryService.rebuildRange(RequestScopes.requireScope(), teamId, from, to));
  }
}
