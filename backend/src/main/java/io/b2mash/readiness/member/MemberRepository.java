package io.b2mash.readiness.member;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  /** Active workers of the given teams: the population that attendance is measured against. */
  @Query(
      """
      SELECT m FROM Member m
      WHERE m.teamId IN :teamIds
        AND m.active = true
        AND m.role = io.b2mash.readiness.member.MemberRole.WORKER
      ORDER BY m.name
      """)
  List<Member> findActiveWorkersByTeamIdIn(@Param("teamIds") Collection<UUID> teamIds);
}
