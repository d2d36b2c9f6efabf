package io.b2mash.readiness.summary;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Computed attendance of one team on one date. Persisted wholesale as a {@link DailyTeamSummary}.
 *
 * @param avgReadinessScore mean readiness of the check-ins found, null when there were none
 * @param complianceRate 0-100, null when nobody was expected
 */
public record DailyAttendanceFigures(
    UUID teamId,
    UUID companyId,
    LocalDate date,
    boolean workDay,
    boolean holiday,
    int totalMembers,
    int onLeaveCount,
    int excusedCount,
    int absentCount,
    int expectedToCheckIn,
    int checkedInCount,
    int greenCount,
    int yellowCount,
    int redCount,
    Double avgReadinessScore,
    Integer complianceRate) {}
