package io.b2mash.readiness.checkin;

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
 * Immutable daily check-in. {@code checkinDate} is the local date in the company timezone at
 * submission time; the database enforces one row per member per such date.
 */
@Entity
@Table(name = "checkins")
public class Checkin {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "member_id", nullable = false, updatable = false)
  private UUID memberId;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "team_id", updatable = false)
  private UUID teamId;

  @Column(name = "checkin_date", nullable = false, updatable = false)
  private LocalDate checkinDate;

  @Column(name = "submitted_at", nullable = false, updatable = false)
  private Instant submittedAt;

  @Column(name = "mood", nullable = false, updatable = false)
  private int mood;

  @Column(name = "stress", nullable = false, updatable = false)
  private int stress;

  @Column(name = "sleep", nullable = false, updatable = false)
  private int sleep;

  @Column(name = "physical_health", nullable = false, updatable = false)
  private int physicalHealth;

  @Column(name = "readiness_score", nullable = false, updatable = false)
  private int readinessScore;

  @Enumerated(EnumType.STRING)
  @Column(name = "readiness_status", nullable = false, updatable = false, length = 10)
  private ReadinessStatus readinessStatus;

  @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
  private String notes;

  protected Checkin() {}

  public Checkin(
      UUID memberId,
      UUID companyId,
      UUID teamId,
      LocalDate checkinDate,
      Instant submittedAt,
      int mood,
      int stress,
      int sleep,
      int physicalHealth,
      String notes) {
    var readiness = ReadinessCalculator.calculate(mood, stress, sleep, physicalHealth);
    this.memberId = memberId;
    this.companyId = companyId;
    this.teamId = teamId;
    this.checkinDate = checkinDate;
    this.submittedAt = submittedAt;
    this.mood = mood;
    this.stress = stress;
    this.sleep = sleep;
    this.physicalHealth = physicalHealth;
    this.readinessScore = readiness.score();
    this.readinessStatus = readiness.status();
    this.notes = notes;
  }

  public UUID getId() {
    return id;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public LocalDate getCheckinDate() {
    return checkinDate;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public int getMood() {
    return mood;
  }

  public int getStress() {
    return stress;
  }

  public int getSleep() {
    return sleep;
  }

  public int getPhysicalHealth() {
    return physicalHealth;
  }

  public int getReadinessScore() {
    return readinessScore;
  }

  public ReadinessStatus getReadinessStatus() {
    return readinessStatus;
  }

  public String getNotes() {
    return notes;
  }
}
