package io.b2mash.readiness.grading;

import io.b2mash.readiness.scope.RequestScopes;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class GradingController {

  private final TeamGradeService teamGradeService;

  public GradingController(TeamGradeService teamGradeService) {
    this.teamGradeService = teamGradeService;
  }

  @GetMapping("/api/teams/{teamId}/grade")
  public ResponseEntity<TeamGrade> getTeamGrade(
      @PathVariable UUID teamId, @RequestParam(required = false) Integer days) {
    return ResponseEntity.ok(
        teamGradeService.getTeamGrade(RequestScopes.requireScope(), teamId, days));
  }

  @GetMapping("/api/companies/{companyId}/teams-overview")
  public ResponseEntity<TeamsOverview> getTeamsOverview(
      @PathVariable UUID companyId, @RequestParam(required = false) Integer days) {
    return ResponseEntity.ok(
        teamGradeService.teamsOverview(RequestScopes.requireScope(), companyId, days));
  }
}
