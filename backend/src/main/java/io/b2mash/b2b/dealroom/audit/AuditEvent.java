package io.b2mash.b2b.dealroom.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One row of the audit trail of a negotiation or contract. Written once inside the transaction of
 * the action it describes and never updated.
 */
@Entity
@Immutable
@Table(name = "audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_type", nullable = false, length = 100, updatable = false)
  private String eventType;

  @Column(name = "entity_type", nullable = false, length = 50, updatable = false)
  private String entityType;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  // --- Origin: who triggered the event and through which channel ---

  @Column(name = "actor_id", updatable = false)
  private UUID actorId;

  @Column(name = "actor_type", nullable = false, length = 20, updatable = false)
  private String actorType;

  @Column(name = "source", nullable = false, length = 30, updatable = false)
  private String source;

  @Column(name = "ip_address", length = 45, updatable = false)
  private String ipAddress;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> details;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected AuditEvent() {}

  private AuditEvent(AuditEventRecord record, Instant occurredAt) {
    this.eventType = Objects.requireNonNull(record.eventType(), "eventType must not be null");
    this.entityType = Objects.requireNonNull(record.entityType(), "entityType must not be null");
    this.entityId = Objects.requireNonNull(record.entityId(), "entityId must not be null");
    this.actorId = record.actorId();
    this.actorType = record.actorType();
    this.source = record.source();
    this.ipAddress = record.ipAddress();
    this.details = record.details() != null ? new LinkedHashMap<>(record.details()) : null;
    this.occurredAt = occurredAt;
  }

  /** Stamps {@code record} with the current time. */
  static AuditEvent of(AuditEventRecord record) {
    return new AuditEvent(Objects.requireNonNull(record, "record must not be null"), Instant.now());
  }

  /** A single entry of the recorded details, e.g. {@code final_price}. */
  public Optional<Object> detail(String key) {
    return details == null ? Optional.empty() : Optional.ofNullable(details.get(key));
  }

  public String getEventType() {
    return eventType;
  }

  /** Null for events raised by the system rather than a participant. */
  public UUID getActorId() {
    return actorId;
  }
}
