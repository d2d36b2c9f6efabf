package io.b2mash.readiness.exemption;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ExemptionRepository extends JpaRepository<Exemption, UUID> {

  /** Approved exemptions of the given members that overlap {@code from..to}. */
  @Query(
      """
      SELECT e FROM Exemption e
      WHERE e.memberId IN :memberIds
        AND e.status = io.b2mash.readiness.exemption.ExemptionStatus.APPROVED
        AND e.startDate <= :to
        AND e.endDate >= :from
      """)
  List<Exemption> findApprovedOverlapping(
      @Param("memberIds") Collection<UUID> memberIds,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query(
      """
      SELECT e FROM Exemption e
      WHERE e.teamId = :teamId
      ORDER BY e.startDate DESC
      """)
  List<Exemption> findByTeamId(@Param("teamId") UUID teamId);

  List<Exemption> findByMemberIdOrderByStartDateDesc(UUID memberId);

  @Query(
      """
      SELECT COUNT(e) > 0 FROM Exemption e
      WHERE e.memberId = :memberId
        AND e.status IN (io.b2mash.readiness.exemption.ExemptionStatus.PENDING,
                         io.b2mash.readiness.exemption.ExemptionStatus.APPROVED)
        AND e.startDate <= :to
        AND e.endDate >= :from
      """)
  boolean existsOpenOverlapping(
      @Param("memberId") UUID memberId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);
}
