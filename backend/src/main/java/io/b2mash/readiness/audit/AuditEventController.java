package io.b2mash.readiness.audit;

import io.b2mash.readiness.exception.ForbiddenException;
import io.b2mash.readiness.scope.CompanyScope;
import io.b2mash.readiness.scope.RequestScopes;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  /** Audit trail of one entity. Company-wide roles only. */
  @GetMapping("/api/audit-events")
  public ResponseEntity<List<AuditEventResponse>> listForEntity(
      @RequestParam String entityType, @RequestParam UUID entityId) {
    var scope = RequestScopes.requireScope();
    if (!(scope instanceof CompanyScope)) {
      throw new ForbiddenException(
          "Insufficient authority", "Only supervisors and administrators can read the audit trail");
    }
    var events = auditService.findByEntity(scope.companyId(), entityType, entityId);
    return ResponseEntity.ok(events.stream().map(AuditEventResponse::from).toList());
  }

  // --- DTOs ---

  public record AuditEventResponse(
      UUID id,
      String actionTag,
      String entityType,
      UUID entityId,
      UUID actorId,
      String description,
      Map<String, Object> metadata,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getActionTag(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorId(),
          event.getDescription(),
          event.getMetadata(),
          event.getOccurredAt());
    }
  }
}
