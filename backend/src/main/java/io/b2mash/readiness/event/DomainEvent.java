package io.b2mash.readiness.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for attendance domain events published via Spring ApplicationEventPublisher. All
 * implementations are records with value fields only, no JPA entity references, so they remain
 * valid after the publishing transaction commits.
 *
 * <p>Consumers (audit, notifications, summary rebuilds) run after commit and must not fail the
 * publishing operation.
 */
public sealed interface DomainEvent
    permits CheckinSubmittedEvent,
        HolidayChangedEvent,
        ExemptionRequestedEvent,
        ExemptionDecidedEvent,
        AbsenceJustifiedEvent,
        AbsenceReviewedEvent {

  String eventType();

  String entityType();

  UUID entityId();

  UUID companyId();

  /** Member who caused the event; null for system-initiated events. */
  UUID actorMemberId();

  Instant occurredAt();

  Map<String, Object> details();
}
