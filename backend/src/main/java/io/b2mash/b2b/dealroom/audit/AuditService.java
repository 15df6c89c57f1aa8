package io.b2mash.b2b.dealroom.audit;

import java.util.List;
import java.util.UUID;

/** Records and reads audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Returns the audit trail of one entity, oldest first. */
  List<AuditEvent> findForEntity(String entityType, UUID entityId);
}
