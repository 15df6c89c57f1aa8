package io.b2mash.b2b.dealroom.audit;

import io.b2mash.b2b.dealroom.actor.ActorContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. The actor is taken from the {@link
 * ActorContext} handed to the operation; source and IP address are read from the current HTTP
 * request when there is one.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("negotiation.created")
 *     .entityType("negotiation")
 *     .entityId(negotiation.getId())
 *     .actor(actor)
 *     .details(Map.of("contract_id", contractId.toString()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
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

  public AuditEventBuilder actor(ActorContext actor) {
    this.actorId = actor != null ? actor.actorId() : null;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    HttpServletRequest request = resolveHttpRequest();
    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        actorId,
        actorId != null ? "USER" : "SYSTEM",
        request != null ? "API" : "INTERNAL",
        request != null ? request.getRemoteAddr() : null,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
