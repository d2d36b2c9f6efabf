package io.b2mash.readiness.scope;

import io.b2mash.readiness.member.MemberRole;
import java.util.UUID;

public record CompanyScope(UUID callerId, UUID companyId, MemberRole role) implements AccessScope {

  @Override
  public boolean canViewTeam(UUID teamCompanyId, UUID teamId) {
    return companyId.equals(teamCompanyId);
  }

  @Override
  public boolean canReviewTeam(UUID teamCompanyId, UUID teamId) {
    return companyId.equals(teamCompanyId);
  }
}
