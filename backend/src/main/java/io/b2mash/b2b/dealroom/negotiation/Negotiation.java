package io.b2mash.b2b.dealroom.negotiation;

import io.b2mash.b2b.dealroom.exception.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A two-party negotiation over the terms of one contract. Owns the negotiation status; every
 * status change goes through {@link NegotiationStatus#next(NegotiationAction)}.
 *
 * <p>History entries live in {@code negotiation_entries} and are appended through {@link
 * NegotiationHistoryLog}; this entity only hands out their sequence numbers.
 */
@Entity
@Table(name = "negotiations")
public class Negotiation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "contract_id", nullable = false, updatable = false)
  private UUID contractId;

  @Column(name = "requester_id", nullable = false, updatable = false)
  private UUID requesterId;

  @Column(name = "provider_id", nullable = false, updatable = false)
  private UUID providerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private NegotiationStatus status;

  @Column(name = "final_price", precision = 12, scale = 2)
  private BigDecimal finalPrice;

  @Column(name = "final_deadline")
  private Instant finalDeadline;

  @Column(name = "entry_count", nullable = false)
  private int entryCount;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "closed_at")
  private Instant closedAt;

  /** JPA-required no-arg constructor. */
  protected Negotiation() {}

  public Negotiation(UUID contractId, UUID requesterId, UUID providerId) {
    this.contractId = Objects.requireNonNull(contractId, "contractId must not be null");
    this.requesterId = Objects.requireNonNull(requesterId, "requesterId must not be null");
    this.providerId = Objects.requireNonNull(providerId, "providerId must not be null");
    this.status = NegotiationStatus.AWAITING_PROVIDER;
    this.entryCount = 0;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  // --- State machine ---

  /**
   * Returns the status {@code action} would lead to, without applying it.
   *
   * @throws InvalidTransitionException if the action is not allowed from the current status
   */
  public NegotiationStatus requireTransition(NegotiationAction action) {
    return status
        .next(action)
        .orElseThrow(
            () ->
                new InvalidTransitionException(
                    status.name(), action.name().toLowerCase(Locale.ROOT)));
  }

  /** Applies the status change caused by appending an entry of the given type. */
  public void applyEntry(EntryType type) {
    this.status = requireTransition(type.action());
    this.updatedAt = Instant.now();
  }

  /** Closes the negotiation as ACCEPTED with the given terms (possibly empty). */
  public void accept(NegotiatedTerms terms) {
    Objects.requireNonNull(terms, "terms must not be null");
    close(NegotiationAction.ACCEPT);
    this.finalPrice = terms.price();
    this.finalDeadline = terms.deadline();
  }

  public void reject() {
    close(NegotiationAction.REJECT);
  }

  public void cancel() {
    close(NegotiationAction.CANCEL);
  }

  private void close(NegotiationAction action) {
    this.status = requireTransition(action);
    var now = Instant.now();
    this.updatedAt = now;
    this.closedAt = now;
  }

  /** Reserves the next dense sequence number for a history entry. Starts at 1. */
  int nextSequenceNumber() {
    this.entryCount++;
    this.updatedAt = Instant.now();
    return this.entryCount;
  }

  // --- Participants ---

  /** Returns which side {@code actorId} is on, or empty for a non-participant. */
  public Optional<ParticipantRole> participantRoleOf(UUID actorId) {
    if (requesterId.equals(actorId)) {
      return Optional.of(ParticipantRole.REQUESTER);
    }
    if (providerId.equals(actorId)) {
      return Optional.of(ParticipantRole.PROVIDER);
    }
    return Optional.empty();
  }

  public UUID participantId(ParticipantRole role) {
    return role == ParticipantRole.REQUESTER ? requesterId : providerId;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getContractId() {
    return contractId;
  }

  public UUID getRequesterId() {
    return requesterId;
  }

  public UUID getProviderId() {
    return providerId;
  }

  public NegotiationStatus getStatus() {
    return status;
  }

  /** Agreed terms; present only once the negotiation is ACCEPTED. */
  public Optional<NegotiatedTerms> getFinalTerms() {
    if (status != NegotiationStatus.ACCEPTED) {
      return Optional.empty();
    }
    return Optional.of(new NegotiatedTerms(finalPrice, finalDeadline));
  }

  public int getEntryCount() {
    return entryCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getClosedAt() {
    return closedAt;
  }
}
