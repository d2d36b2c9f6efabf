package io.b2mash.readiness.audit;

import io.b2mash.readiness.member.MemberRepository;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Database-backed implementation of {@link AuditService}. */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final MemberRepository memberRepository;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, MemberRepository memberRepository) {
    this.auditEventRepository = auditEventRepository;
    this.memberRepository = memberRepository;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void log(AuditEventRecord record) {
    var event = new AuditEvent(enrichActorName(record));
    auditEventRepository.save(event);
    log.debug(
        "Recorded audit event: action={}, entity={}/{}, actor={}",
        record.actionTag(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findByEntity(UUID companyId, String entityType, UUID entityId) {
    return auditEventRepository.findByEntity(companyId, entityType, entityId);
  }

  /**
   * Ensures the {@code actor_name} key is present in the metadata: the member's name for a known
   * actor, "System" otherwise. A caller-supplied value is kept.
   */
  private AuditEventRecord enrichActorName(AuditEventRecord record) {
    var metadata =
        new HashMap<String, Object>(record.metadata() != null ? record.metadata() : Map.of());
    if (!metadata.containsKey("actor_name")) {
      if (record.actorId() != null) {
        memberRepository
            .findById(record.actorId())
            .ifPresent(member -> metadata.put("actor_name", member.getName()));
      }
      metadata.putIfAbsent("actor_name", "System");
    }
    return new AuditEventRecord(
        record.companyId(),
        record.actorId(),
        record.actionTag(),
        record.entityType(),
        record.entityId(),
        record.description(),
        metadata);
  }
}
