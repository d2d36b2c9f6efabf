package io.b2mash.readiness.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which fills in the actor from the current request when one is bound.
 *
 * @param actionTag free-form tag following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g. "absence", "exemption")
 * @param entityId ID of the affected entity (not a FK, the entity may be deleted later)
 * @param actorId member ID of the acting user; null for system-initiated events
 * @param description one human-readable sentence
 * @param metadata key fields of the change as JSONB; nullable
 */
public record AuditEventRecord(
    UUID companyId,
    UUID actorId,
    String actionTag,
    String entityType,
    UUID entityId,
    String description,
    Map<String, Object> metadata) {}
