package io.b2mash.readiness.member;

import io.b2mash.readiness.checkin.ReadinessStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "team_id")
  private UUID teamId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private MemberRole role;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "team_joined_at")
  private Instant teamJoinedAt;

  @Column(name = "total_checkins", nullable = false)
  private int totalCheckins;

  @Column(name = "avg_readiness_score")
  private Double avgReadinessScore;

  @Enumerated(EnumType.STRING)
  @Column(name = "last_readiness_status", length = 10)
  private ReadinessStatus lastReadinessStatus;

  @Column(name = "last_checkin_at")
  private Instant lastCheckinAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Member() {}

  public Member(UUID companyId, UUID teamId, String name, String email, MemberRole role) {
    this.companyId = companyId;
    this.teamId = teamId;
    this.name = name;
    this.email = email;
    this.role = role;
    this.active = true;
    this.createdAt = Instant.now();
    this.teamJoinedAt = teamId != null ? this.createdAt : null;
  }

  /** Moves the member to a team, restarting the attendance requirement from the join instant. */
  public void joinTeam(UUID teamId, Instant joinedAt) {
    this.teamId = teamId;
    this.teamJoinedAt = joinedAt;
  }

  /** Folds one new check-in into the running counters. */
  public void recordCheckin(int readinessScore, ReadinessStatus status, Instant at) {
    double previousTotal = avgReadinessScore != null ? avgReadinessScore * totalCheckins : 0;
    this.totalCheckins++;
    this.avgReadinessScore = (previousTotal + readinessScore) / totalCheckins;
    this.lastReadinessStatus = status;
    this.lastCheckinAt = at;
  }

  /** Instant from which the attendance requirement is measured: team join, else creation. */
  public Instant attendanceAnchor() {
    return teamJoinedAt != null ? teamJoinedAt : createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public MemberRole getRole() {
    return role;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getTeamJoinedAt() {
    return teamJoinedAt;
  }

  public int getTotalCheckins() {
    return totalCheckins;
  }

  public Double getAvgReadinessScore() {
    return avgReadinessScore;
  }

  public ReadinessStatus getLastReadinessStatus() {
    return lastReadinessStatus;
  }

  public Instant getLastCheckinAt() {
    return lastCheckinAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
