package io.b2mash.readiness.scope;

import io.b2mash.readiness.member.MemberRole;
import java.util.Set;
import java.util.UUID;

/**
 * @param ledTeamIds teams the caller leads
 * @param ownTeamId team the caller belongs to as a member, may be null
 */
public record TeamScope(UUID callerId, UUID companyId, Set<UUID> ledTeamIds, UUID ownTeamId)
    implements AccessScope {

  public TeamScope {
    ledTeamIds = Set.copyOf(ledTeamIds);
  }

  @Override
  public MemberRole role() {
    return MemberRole.TEAM_LEAD;
  }

  @Override
  public boolean canViewTeam(UUID teamCompanyId, UUID teamId) {
    return companyId.equals(teamCompanyId)
        && (ledTeamIds.contains(teamId) || teamId.equals(ownTeamId));
  }

  @Override
  public boolean canReviewTeam(UUID teamCompanyId, UUID teamId) {
    return companyId.equals(teamCompanyId) && ledTeamIds.contains(teamId);
  }
}
