package io.b2mash.readiness.member;

public enum MemberRole {
  WORKER,
  TEAM_LEAD,
  SUPERVISOR,
  EXECUTIVE,
  ADMIN;

  /** Roles that see and act on every team of their company. */
  public boolean isCompanyWide() {
    return this == SUPERVISOR || this == EXECUTIVE || this == ADMIN;
  }
}
