package io.b2mash.readiness.notification;

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

@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recipient_member_id", nullable = false)
  private UUID recipientMemberId;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "type", nullable = false, length = 50)
  private String type;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "message", columnDefinition = "TEXT")
  private String message;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "payload", columnDefinition = "jsonb")
  private Map<String, Object> payload;

  @Column(name = "is_read", nullable = false)
  private boolean isRead;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Notification() {}

  public Notification(
      UUID recipientMemberId,
      UUID companyId,
      String type,
      String title,
      String message,
      Map<String, Object> payload) {
    this.recipientMemberId = recipientMemberId;
    this.companyId = companyId;
    this.type = type;
    this.title = title;
    this.message = message;
    this.payload = payload;
    this.isRead = false;
    this.createdAt = Instant.now();
  }

  public void markAsRead() {
    this.isRead = true;
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecipientMemberId() {
    return recipientMemberId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getType() {
    return type;
  }

  public String getTitle() {
    return title;
  }

  public String getMessage() {
    return message;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public boolean isRead() {
    return isRead;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
