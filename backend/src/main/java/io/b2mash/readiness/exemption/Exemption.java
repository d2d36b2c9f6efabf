package io.b2mash.readiness.exemption;

import io.b2mash.readiness.exception.InvalidStateException;
import io.b2mash.readiness.exception.ResourceConflictException;
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
import java.util.Map;
import java.util.UUID;

/**
 * Leave request covering an inclusive range of local dates. Only {@link ExemptionStatus#APPROVED}
 * exemptions take a member out of the attendance requirement.
 */
@Entity
@Table(name = "exemptions")
public class Exemption {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "member_id", nullable = false, updatable = false)
  private UUID memberId;

  @Column(name = "team_id", nullable = false, updatable = false)
  private UUID teamId;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 30)
  private ExemptionType type;

  @Column(name = "reason", nullable = false, columnDefinition = "TEXT")
  private String reason;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date", nullable = false)
  private LocalDate endDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ExemptionStatus status;

  @Column(name = "requested_by", nullable = false, updatable = false)
  private UUID requestedBy;

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

  protected Exemption() {}

  public Exemption(
      UUID memberId,
      UUID teamId,
      UUID companyId,
      ExemptionType type,
      String reason,
      LocalDate startDate,
      LocalDate endDate,
      UUID requestedBy) {
    if (endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid date range", "Start date " + startDate + " is after end date " + endDate);
    }
    this.memberId = memberId;
    this.teamId = teamId;
    this.companyId = companyId;
    this.type = type;
    this.reason = reason;
    this.startDate = startDate;
    this.endDate = endDate;
    this.requestedBy = requestedBy;
    this.status = ExemptionStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** PENDING -> APPROVED. */
  public void approve(UUID reviewerId, String notes) {
    requireStatus(ExemptionStatus.PENDING, "approve");
    decide(ExemptionStatus.APPROVED, reviewerId, notes);
  }

  /** PENDING -> REJECTED. */
  public void reject(UUID reviewerId, String notes) {
    requireStatus(ExemptionStatus.PENDING, "reject");
    decide(ExemptionStatus.REJECTED, reviewerId, notes);
  }

  /** PENDING or APPROVED -> CANCELLED. */
  public void cancel() {
    if (status != ExemptionStatus.PENDING && status != ExemptionStatus.APPROVED) {
      throw conflict("cancel");
    }
    this.status = ExemptionStatus.CANCELLED;
    this.updatedAt = Instant.now();
  }

  /**
   * Shortens an approved exemption. The new end must stay on or after the start and strictly
   * before the current end.
   */
  public void endEarly(LocalDate newEndDate, UUID reviewerId, String notes) {
    requireStatus(ExemptionStatus.APPROVED, "end early");
    if (newEndDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid end date", "New end date cannot be before the start date " + startDate);
    }
    if (!newEndDate.isBefore(endDate)) {
      throw new InvalidStateException(
          "Invalid end date", "New end date must be before the current end date " + endDate);
    }
    this.endDate = newEndDate;
    this.reviewedBy = reviewerId;
    if (notes != null) {
      this.reviewNotes = notes;
    }
    this.reviewedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean covers(LocalDate date) {
    return !date.isBefore(startDate) && !date.isAfter(endDate);
  }

  private void decide(ExemptionStatus newStatus, UUID reviewerId, String notes) {
    this.status = newStatus;
    this.reviewedBy = reviewerId;
    this.reviewNotes = notes;
    this.reviewedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  private void requireStatus(ExemptionStatus expected, String action) {
    if (status != expected) {
      throw conflict(action);
    }
  }

  private ResourceConflictException conflict(String action) {
    return ResourceConflictException.withCurrentState(
        "Invalid exemption state",
        "Cannot " + action + " an exemption in status " + status,
        Map.of("currentStatus", status.name()));
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

  public ExemptionType getType() {
    return type;
  }

  public String getReason() {
    return reason;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public ExemptionStatus getStatus() {
    return status;
  }

  public UUID getRequestedBy() {
    return requestedBy;
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
