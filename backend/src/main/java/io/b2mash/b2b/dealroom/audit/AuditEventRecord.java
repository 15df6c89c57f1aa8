package io.b2mash.b2b.dealroom.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "negotiation", "contract")
 * @param entityId ID of the affected entity
 * @param actorId id of the acting user; null for system-initiated events
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param ipAddress client IP; null for non-HTTP sources
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID actorId,
    String actorType,
    String source,
    String ipAddress,
    Map<String, Object> details) {}
