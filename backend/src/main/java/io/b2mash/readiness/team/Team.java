package io.b2mash.readiness.team;

import io.b2mash.readiness.calendar.WorkCalendar;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "teams")
public class Team {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  /** Comma-separated day tokens, e.g. {@code MON,TUE,WED,THU,FRI}. */
  @Column(name = "work_days", nullable = false, length = 64)
  private String workDays;

  @Column(name = "shift_start", nullable = false, length = 5)
  private String shiftStart;

  @Column(name = "shift_end", nullable = false, length = 5)
  private String shiftEnd;

  @Column(name = "leader_id")
  private UUID leaderId;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Team() {}

  public Team(UUID companyId, String name, String workDays, UUID leaderId) {
    this.companyId = companyId;
    this.name = name;
    this.workDays = workDays != null ? workDays : WorkCalendar.DEFAULT_WORK_DAYS;
    this.shiftStart = "08:00";
    this.shiftEnd = "17:00";
    this.leaderId = leaderId;
    this.active = true;
    this.createdAt = Instant.now();
  }

  public void assignLeader(UUID leaderId) {
    this.leaderId = leaderId;
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getName() {
    return name;
  }

  public String getWorkDays() {
    return workDays;
  }

  public String getShiftStart() {
    return shiftStart;
  }

  public String getShiftEnd() {
    return shiftEnd;
  }

  public UUID getLeaderId() {
    return leaderId;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
