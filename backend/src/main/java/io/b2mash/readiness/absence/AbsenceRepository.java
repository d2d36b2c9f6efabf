package io.b2mash.readiness.absence;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AbsenceRepository extends JpaRepository<Absence, UUID> {

  /**
   * Records the worker's justification. Matches only an unjustified pending absence owned by the
   * member; returns 0 otherwise.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Absence a
      SET a.reasonCategory = :category,
          a.explanation = :explanation,
          a.justifiedAt = :now,
          a.updatedAt = :now
      WHERE a.id = :id
        AND a.memberId = :memberId
        AND a.status = io.b2mash.readiness.absence.AbsenceStatus.PENDING_JUSTIFICATION
        AND a.justifiedAt IS NULL
      """)
  int justify(
      @Param("id") UUID id,
      @Param("memberId") UUID memberId,
      @Param("category") AbsenceReasonCategory category,
      @Param("explanation") String explanation,
      @Param("now") Instant now);

  /**
   * Records the reviewer's verdict. Matches only a justified, still pending absence; returns 0
   * otherwise.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Absence a
      SET a.status = :verdict,
          a.reviewedBy = :reviewerId,
          a.reviewNotes = :notes,
          a.reviewedAt = :now,
          a.updatedAt = :now
      WHERE a.id = :id
        AND a.status = io.b2mash.readiness.absence.AbsenceStatus.PENDING_JUSTIFICATION
        AND a.justifiedAt IS NOT NULL
      """)
  int review(
      @Param("id") UUID id,
      @Param("verdict") AbsenceStatus verdict,
      @Param("reviewerId") UUID reviewerId,
      @Param("notes") String notes,
      @Param("now") Instant now);

  /** Excuses the member's pending absences that fall inside approved leave. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Absence a
      SET a.status = io.b2mash.readiness.absence.AbsenceStatus.EXCUSED,
          a.reviewedBy = :reviewerId,
          a.reviewNotes = :notes,
          a.reviewedAt = :now,
          a.updatedAt = :now
      WHERE a.memberId = :memberId
        AND a.absenceDate BETWEEN :from AND :to
        AND a.status = io.b2mash.readiness.absence.AbsenceStatus.PENDING_JUSTIFICATION
      """)
  int excuseCoveredByLeave(
      @Param("memberId") UUID memberId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to,
      @Param("reviewerId") UUID reviewerId,
      @Param("notes") String notes,
      @Param("now") Instant now);

  @Query(
      """
      SELECT a FROM Absence a
      WHERE a.memberId = :memberId
        AND a.status = io.b2mash.readiness.absence.AbsenceStatus.PENDING_JUSTIFICATION
        AND a.justifiedAt IS NULL
      ORDER BY a.absenceDate
      """)
  List<Absence> findAwaitingJustification(@Param("memberId") UUID memberId);

  /** Justified absences still waiting for a verdict, oldest justification first. */
  @Query(
      """
      SELECT a FROM Absence a
      WHERE a.teamId IN :teamIds
        AND a.status = io.b2mash.readiness.absence.AbsenceStatus.PENDING_JUSTIFICATION
        AND a.justifiedAt IS NOT NULL
      ORDER BY a.justifiedAt
      """)
  List<Absence> findAwaitingReview(@Param("teamIds") Collection<UUID> teamIds);

  @Query(
      """
      SELECT a FROM Absence a
      WHERE a.memberId = :memberId
      ORDER BY a.absenceDate DESC
      """)
  List<Absence> findHistory(@Param("memberId") UUID memberId, Pageable pageable);

  @Query(
      """
      SELECT a.status AS status, COUNT(a) AS total FROM Absence a
      WHERE a.memberId = :memberId
      GROUP BY a.status
      """)
  List<StatusCount> countByStatus(@Param("memberId") UUID memberId);

  @Query(
      """
      SELECT a FROM Absence a
      WHERE a.memberId IN :memberIds
        AND a.absenceDate BETWEEN :from AND :to
      """)
  List<Absence> findByMemberIdsAndDateRange(
      @Param("memberIds") Collection<UUID> memberIds,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  interface StatusCount {
    AbsenceStatus getStatus();

    long getTotal();
  }
}
