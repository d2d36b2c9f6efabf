package io.b2mash.readiness.team;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, UUID> {

  List<Team> findByCompanyIdAndActiveTrueOrderByName(UUID companyId);

  List<Team> findByLeaderIdAndActiveTrue(UUID leaderId);
}
