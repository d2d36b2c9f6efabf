package io.b2mash.readiness.absence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A missed required check-in day. Created by detection, justified once by the worker, reviewed once
 * by a lead or supervisor, never deleted. Both transitions are conditional updates in {@link
 * AbsenceRepository}; this entity has no mutators.
 */
@Entity
@Table(name = "absences")
public class Absence {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "member_id", nullable = false, updatable = false)
  private UUID memberId;

  @Column(name = "team_id", nullable = false, updatable = false)
  private UUID teamId;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "absence_date", nullable = false, updatable = false)
  private LocalDate absenceDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private AbsenceStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "reason_category", length = 30)
  private AbsenceReasonCategory reasonCategory;

  @Column(name = "explanation", columnDefinition = "TEXT")
  private String explanation;

  @Column(name = "justified_at")
  private Instant justifiedAt;

  @Column(name = "reviewed_by")
  private UUID reviewedBy;

  @Column(name = "review_notes", columnDefinition = "TEXT")
  private String reviewNotes;

  @Column(name = "reviewed_at")
  private Instant reviewedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Absence() {}

  public Absence(UUID memberId, UUID teamId, UUID companyId, LocalDate absenceDate) {
    this.memberId = memberId;
    this.teamId = teamId;
    this.companyId = companyId;
    this.absenceDate = absenceDate;
    this.status = AbsenceStatus.PENDING_JUSTIFICATION;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isJustified() {
    return justifiedAt != null;
  }

  public UUID getId() {
    return id;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public LocalDate getAbsenceDate() {
    return absenceDate;
  }

  public AbsenceStatus getStatus() {
    return status;
  }

  public AbsenceReasonCategory getReasonCategory() {
    return reasonCategory;
  }

  public String getExplanation() {
    return explanation;
  }

  public Instant getJustifiedAt() {
    return justifiedAt;
  }

  public UUID getReviewedBy() {
    return reviewedBy;
  }

  public String getReviewNotes() {
    return reviewNotes;
  }

  public Instant getReviewedAt() {
    return reviewedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
