package io.b2mash.readiness.grading;

import java.util.UUID;

/**
 * One worker's contribution to a team grade. Averages are null when the member has no check-ins in
 * the period.
 */
public record MemberGradeBreakdown(
    UUID memberId,
    String name,
    Double averageScore,
    int checkinCount,
    RiskTier riskTier,
    int greenCount,
    int yellowCount,
    int redCount,
    Double avgMood,
    Double avgStress,
    Double avgSleep,
    Double avgPhysicalHealth,
    long excusedAbsences,
    long unexcusedAbsences) {}
