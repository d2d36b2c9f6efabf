package io.b2mash.readiness.team;

import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.exception.ResourceNotFoundException;
import io.b2mash.readiness.scope.AccessScope;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads teams on behalf of a caller. Teams outside the caller's scope are reported as not found;
 * teams the caller can see but not manage are forbidden.
 */
@Service
public class TeamAccessService {

  private final TeamRepository teamRepository;

  public TeamAccessService(TeamRepository teamRepository) {
    this.teamRepository = teamRepository;
  }

  @Transactional(readOnly = true)
  public Team requireViewableTeam(AccessScope scope, UUID teamId) {
    return teamRepository
        .findById(teamId)
        .filter(team -> scope.canViewTeam(team.getCompanyId(), team.getId()))
        .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
  }

  @Transactional(readOnly = true)
  public Team requireReviewableTeam(AccessScope scope, UUID teamId) {
    var team = requireViewableTeam(scope, teamId);
    if (!scope.canReviewTeam(team.getCompanyId(), team.getId())) {
      throw new ForbiddenException(
          "Insufficient authority", "You cannot review members of team " + team.getName());
    }
    return team;
  }

  /** Active teams of the caller's company that the caller can see. */
  @Transactional(readOnly = true)
  public List<Team> listViewableTeams(AccessScope scope) {
    return teamRepository.findByCompanyIdAndActiveTrueOrderByName(scope.companyId()).stream()
        .filter(team -> scope.canViewTeam(team.getCompanyId(), team.getId()))
        .toList();
  }
}
