package io.b2mash.readiness.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/**
 * An exemption was approved, rejected, cancelled or ended early.
 *
 * @param affectsSummaries whether leave coverage changed on any date in {@code startDate..endDate}
 */
public record ExemptionDecidedEvent(
    String eventType,
    String entityType,
    UUID entityId,
    UUID companyId,
    UUID actorMemberId,
    Instant occurredAt,
    Map<String, Object> details,
    UUID teamId,
    UUID memberId,
    String status,
    LocalDate startDate,
    LocalDate endDate,
    boolean affectsSummaries)
    implements DomainEvent {}
