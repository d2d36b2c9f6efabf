package io.b2mash.readiness.scope;

import io.b2mash.readiness.member.MemberRole;
import java.util.UUID;

public record SelfScope(UUID callerId, UUID companyId, UUID teamId) implements AccessScope {

  @Override
  public MemberRole role() {
    return MemberRole.WORKER;
  }

  @Override
  public boolean canViewTeam(UUID teamCompanyId, UUID teamId) {
    return companyId.equals(teamCompanyId) && teamId.equals(this.teamId);
  }

  @Override
  public boolean canReviewTeam(UUID teamCompanyId, UUID teamId) {
    return false;
  }
}
