package io.b2mash.readiness.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable audit entry persisted to the {@code audit_events} table. No setters and no {@code
 * updatedAt}.
 *
 * @see AuditEventRecord
 */
@Entity
@Table(name = "audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "actor_id", updatable = false)
  private UUID actorId;

  @Column(name = "action_tag", nullable = false, updatable = false, length = 100)
  private String actionTag;

  @Column(name = "entity_type", nullable = false, updatable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  @Column(name = "description", columnDefinition = "TEXT", updatable = false)
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> metadata;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected AuditEvent() {}

  public AuditEvent(AuditEventRecord record) {
    this.companyId = record.companyId();
    this.actorId = record.actorId();
    this.actionTag = record.actionTag();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.description = record.description();
    this.metadata = record.metadata();
    this.occurredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getActorId() {
    return actorId;
  }

  public String getActionTag() {
    return actionTag;
  }

  public String getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public String getDescription() {
    return description;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
