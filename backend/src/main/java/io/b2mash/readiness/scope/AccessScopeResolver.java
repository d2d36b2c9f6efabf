package io.b2mash.readiness.scope;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.readiness.member.Member;
import io.b2mash.readiness.member.MemberRepository;
import io.b2mash.readiness.member.MemberRole;
import io.b2mash.readiness.team.Team;
import io.b2mash.readiness.team.TeamRepository;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Resolves and caches the {@link AccessScope} of a member id. */
@Component
public class AccessScopeResolver {

  private final MemberRepository memberRepository;
  private final TeamRepository teamRepository;
  private final Cache<UUID, Optional<AccessScope>> scopeCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofMinutes(1)).build();

  public AccessScopeResolver(MemberRepository memberRepository, TeamRepository teamRepository) {
    this.memberRepository = memberRepository;
    this.teamRepository = teamRepository;
  }

  /** Empty when the member does not exist or is inactive. */
  public Optional<AccessScope> resolve(UUID memberId) {
    return scopeCache.get(memberId, this::load);
  }

  private Optional<AccessScope> load(UUID memberId) {
    return memberRepository.findById(memberId).filter(Member::isActive).map(this::scopeOf);
  }

  AccessScope scopeOf(Member member) {
    var role = member.getRole();
    if (role.isCompanyWide()) {
      return new CompanyScope(member.getId(), member.getCompanyId(), role);
    }
    if (role == MemberRole.TEAM_LEAD) {
      var ledTeams =
          teamRepository.findByLeaderIdAndActiveTrue(member.getId()).stream()
              .map(Team::getId)
              .collect(Collectors.toSet());
      return new TeamScope(member.getId(), member.getCompanyId(), ledTeams, member.getTeamId());
    }
    return new SelfScope(member.getId(), member.getCompanyId(), member.getTeamId());
  }
}
