package io.b2mash.readiness.checkin;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CheckinRepository extends JpaRepository<Checkin, UUID> {

  boolean existsByMemberIdAndCheckinDate(UUID memberId, LocalDate checkinDate);

  /**
   * Check-ins of the given members in a date range, regardless of the team recorded on the row. A
   * member's check-ins follow them when they move teams.
   */
  @Query(
      """
      SELECT c FROM Checkin c
      WHERE c.memberId IN :memberIds
        AND c.checkinDate BETWEEN :from AND :to
      ORDER BY c.checkinDate
      """)
  List<Checkin> findByMemberIdsAndDateRange(
      @Param("memberIds") Collection<UUID> memberIds,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);
}
