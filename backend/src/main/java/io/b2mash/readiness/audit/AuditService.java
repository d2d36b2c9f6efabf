package io.b2mash.readiness.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads the attendance audit trail. */
public interface AuditService {

  /**
   * Records a single audit event in its own transaction. Callers run after the audited change has
   * committed, so the entry is never rolled back with it.
   */
  void log(AuditEventRecord record);

  /** Events of one entity, newest first. */
  List<AuditEvent> findByEntity(UUID companyId, String entityType, UUID entityId);
}
