package io.b2mash.readiness.summary;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Cached attendance aggregate of one team on one date. A derived projection: rows are written only
 * by {@link DailyTeamSummaryUpsertRepository}, always replacing every field, and can be rebuilt at
 * any time from check-ins, holidays, leave and absences.
 */
@Entity
@Table(name = "daily_team_summaries")
public class DailyTeamSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "team_id", nullable = false, updatable = false)
  private UUID teamId;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "summary_date", nullable = false, updatable = false)
  private LocalDate summaryDate;

  @Column(name = "is_work_day", nullable = false)
  private boolean workDay;

  @Column(name = "is_holiday", nullable = false)
  private boolean holiday;

  @Column(name = "total_members", nullable = false)
  private int totalMembers;

  @Column(name = "on_leave_count", nullable = false)
  private int onLeaveCount;

  @Column(name = "excused_count", nullable = false)
  private int excusedCount;

  @Column(name = "absent_count", nullable = false)
  private int absentCount;

  @Column(name = "expected_to_check_in", nullable = false)
  private int expectedToCheckIn;

  @Column(name = "checked_in_count", nullable = false)
  private int checkedInCount;

  @Column(name = "green_count", nullable = false)
  private int greenCount;

  @Column(name = "yellow_count", nullable = false)
  private int yellowCount;

  @Column(name = "red_count", nullable = false)
  private int redCount;

  @Column(name = "avg_readiness_score")
  private Double avgReadinessScore;

  @Column(name = "compliance_rate")
  private Integer complianceRate;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected DailyTeamSummary() {}

  public DailyAttendanceFigures toFigures() {
    return new DailyAttendanceFigures(
        teamId,
        companyId,
        summaryDate,
        workDay,
        holiday,
        totalMembers,
        onLeaveCount,
        excusedCount,
        absentCount,
        expectedToCheckIn,
        checkedInCount,
        greenCount,
        yellowCount,
        redCount,
        avgReadinessScore,
        complianceRate);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTeamId() {
    return teamId;
  }

  public LocalDate getSummaryDate() {
    return summaryDate;
  }

  public Integer getComplianceRate() {
    return complianceRate;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
