package io.b2mash.readiness.scope;

import io.b2mash.readiness.member.MemberRole;
import java.util.UUID;

/**
 * What a caller may see, resolved once per request from their member record and passed explicitly
 * to every service call that reads attendance data.
 *
 * <ul>
 *   <li>{@link CompanyScope}: supervisors, executives and admins see every team of their company.
 *   <li>{@link TeamScope}: team leads see the teams they lead.
 *   <li>{@link SelfScope}: workers see only their own records and their own team.
 * </ul>
 */
public sealed interface AccessScope permits CompanyScope, TeamScope, SelfScope {

  UUID callerId();

  UUID companyId();

  MemberRole role();

  /** Whether the caller may read data of {@code teamId} in {@code teamCompanyId}. */
  boolean canViewTeam(UUID teamCompanyId, UUID teamId);

  /** Whether the caller may review absences and decide exemptions for members of the team. */
  boolean canReviewTeam(UUID teamCompanyId, UUID teamId);
}
