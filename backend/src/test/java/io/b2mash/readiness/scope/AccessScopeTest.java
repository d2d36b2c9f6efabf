package io.b2mash.readiness.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.readiness.exception.MissingCallerException;
import io.b2mash.readiness.member.MemberRole;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

class AccessScopeTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID OTHER_COMPANY_ID = UUID.randomUUID();
  private static final UUID TEAM_ID = UUID.randomUUID();
  private static final UUID OTHER_TEAM_ID = UUID.randomUUID();

  @AfterEach
  void clearRequest() {
    RequestContextHolder.resetRequestAttributes();
  }

  @Test
  void companyScope_seesAndReviewsEveryTeamOfItsCompany() {
    var scope = new CompanyScope(UUID.randomUUID(), COMPANY_ID, MemberRole.SUPERVISOR);

    assertThat(scope.canViewTeam(COMPANY_ID, OTHER_TEAM_ID)).isTrue();
    assertThat(scope.canReviewTeam(COMPANY_ID, OTHER_TEAM_ID)).isTrue();
    assertThat(scope.canViewTeam(OTHER_COMPANY_ID, TEAM_ID)).isFalse();
  }

  @Test
  void teamScope_reviewsOnlyLedTeams() {
    var scope = new TeamScope(UUID.randomUUID(), COMPANY_ID, Set.of(TEAM_ID), OTHER_TEAM_ID);

    assertThat(scope.canReviewTeam(COMPANY_ID, TEAM_ID)).isTrue();
    assertThat(scope.canViewTeam(COMPANY_ID, OTHER_TEAM_ID)).isTrue();
    assertThat(scope.canReviewTeam(COMPANY_ID, OTHER_TEAM_ID)).isFalse();
    assertThat(scope.canViewTeam(OTHER_COMPANY_ID, TEAM_ID)).isFalse();
  }

  @Test
  void selfScope_seesOwnTeamButReviewsNothing() {
    var scope = new SelfScope(UUID.randomUUID(), COMPANY_ID, TEAM_ID);

    assertThat(scope.canViewTeam(COMPANY_ID, TEAM_ID)).isTrue();
    assertThat(scope.canViewTeam(COMPANY_ID, OTHER_TEAM_ID)).isFalse();
    assertThat(scope.canReviewTeam(COMPANY_ID, TEAM_ID)).isFalse();
  }

  @Test
  void requestScopes_readsBoundScope() {
    var scope = new SelfScope(UUID.randomUUID(), COMPANY_ID, TEAM_ID);
    var request = new MockHttpServletRequest();
    request.setAttribute(RequestScopes.SCOPE_ATTRIBUTE, scope);
    RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));

    assertThat(RequestScopes.requireScope()).isEqualTo(scope);
  }

  @Test
  void requestScopes_emptyOutsideRequest() {
    assertThat(RequestScopes.currentScope()).isEmpty();
    assertThatThrownBy(RequestScopes::requireScope).isInstanceOf(MissingCallerException.class);
  }
}
