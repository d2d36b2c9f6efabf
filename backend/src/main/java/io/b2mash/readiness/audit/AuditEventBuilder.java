package io.b2mash.readiness.audit;

import io.b2mash.readiness.scope.RequestScopes;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Builder for {@link AuditEventRecord}. When no actor is set explicitly, the caller bound to the
 * current request is used; outside a request the actor stays null (system). A {@code source} key
 * ({@code API} or {@code INTERNAL}) is always added to the metadata.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .companyId(absence.getCompanyId())
 *     .actionTag("absence.reviewed")
 *     .entityType("absence")
 *     .entityId(absence.getId())
 *     .description("Absence on 2025-01-14 reviewed as EXCUSED")
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private UUID companyId;
  private UUID actorId;
  private String actionTag;
  private String entityType;
  private UUID entityId;
  private String description;
  private Map<String, Object> metadata;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder companyId(UUID companyId) {
    this.companyId = companyId;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actionTag(String actionTag) {
    this.actionTag = actionTag;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder description(String description) {
    this.description = description;
    return this;
  }

  public AuditEventBuilder metadata(Map<String, Object> metadata) {
    this.metadata = metadata;
    return this;
  }

  public AuditEventRecord build() {
    if (companyId == null || actionTag == null || entityType == null || entityId == null) {
      throw new IllegalStateException(
          "companyId, actionTag, entityType and entityId are required for an audit event");
    }
    UUID resolvedActorId = actorId;
    if (!actorIdExplicitlySet) {
      resolvedActorId = RequestScopes.currentScope().map(scope -> scope.callerId()).orElse(null);
    }
    var resolvedMetadata = new HashMap<String, Object>(metadata != null ? metadata : Map.of());
    resolvedMetadata.putIfAbsent(
        "source", RequestContextHolder.getRequestAttributes() != null ? "API" : "INTERNAL");
    return new AuditEventRecord(
        companyId,
        resolvedActorId,
        actionTag,
        entityType,
        entityId,
        description,
        resolvedMetadata);
  }
}
