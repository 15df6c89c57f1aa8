package io.b2mash.b2b.dealroom.negotiation;

import io.b2mash.b2b.dealroom.negotiation.EntryPayload.MessagePayload;
import io.b2mash.b2b.dealroom.negotiation.EntryPayload.TermsPayload;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/** One immutable entry of a negotiation's history. No setters, never updated or deleted. */
@Entity
@Immutable
@Table(name = "negotiation_entries")
public class NegotiationEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "negotiation_id", nullable = false, updatable = false)
  private UUID negotiationId;

  @Column(name = "sequence_number", nullable = false, updatable = false)
  private int sequenceNumber;

  @Column(name = "actor_id", nullable = false, updatable = false)
  private UUID actorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "entry_type", nullable = false, updatable = false, length = 20)
  private EntryType entryType;

  @Column(name = "price", precision = 12, scale = 2, updatable = false)
  private BigDecimal price;

  @Column(name = "deadline", updatable = false)
  private Instant deadline;

  @Column(name = "notes", nullable = false, updatable = false, columnDefinition = "TEXT")
  private String notes;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  /** Protected no-arg constructor required by JPA. */
  protected NegotiationEntry() {}

  NegotiationEntry(
      UUID negotiationId,
      int sequenceNumber,
      UUID actorId,
      EntryType entryType,
      EntryPayload payload,
      Instant occurredAt) {
    this.negotiationId = Objects.requireNonNull(negotiationId, "negotiationId must not be null");
    this.sequenceNumber = sequenceNumber;
    this.actorId = Objects.requireNonNull(actorId, "actorId must not be null");
    this.entryType = Objects.requireNonNull(entryType, "entryType must not be null");
    this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    this.notes = payload.notes();
    if (payload instanceof TermsPayload terms) {
      this.price = terms.price();
      this.deadline = terms.deadline();
    }
  }

  /** Rebuilds the typed payload matching this entry's type. */
  public EntryPayload getPayload() {
    if (entryType == EntryType.MESSAGE) {
      return new MessagePayload(notes);
    }
    return new TermsPayload(price, deadline, notes);
  }

  public boolean carriesTerms() {
    return entryType.carriesTerms() && getPayload().hasTerms();
  }

  public UUID getId() {
    return id;
  }

  public UUID getNegotiationId() {
    return negotiationId;
  }

  public int getSequenceNumber() {
    return sequenceNumber;
  }

  public UUID getActorId() {
    return actorId;
  }

  public EntryType getEntryType() {
    return entryType;
  }

  public BigDecimal getPrice() {
    return price;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
