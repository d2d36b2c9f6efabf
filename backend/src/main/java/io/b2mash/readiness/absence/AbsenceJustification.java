package io.b2mash.readiness.absence;

import java.util.UUID;

/** One item of a justification batch. */
public record AbsenceJustification(
    UUID absenceId, AbsenceReasonCategory reasonCategory, String explanation) {}
