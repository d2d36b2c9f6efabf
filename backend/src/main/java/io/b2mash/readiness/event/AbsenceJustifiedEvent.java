package io.b2mash.readiness.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record AbsenceJustifiedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID companyId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID teamId,
    UUID memberId,
    LocalDate absenceDate)
    implements DomainEvent {}
