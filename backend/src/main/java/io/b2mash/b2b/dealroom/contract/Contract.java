package io.b2mash.b2b.dealroom.contract;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A service contract between a requester and a provider. Only the fields negotiation touches are
 * mapped here.
 *
 * <p>Price ({@code totalValue}) and the service window end can only change through {@link
 * ContractTermsApplier}; the mutator is package-private.
 */
@Entity
@Table(name = "contracts")
public class Contract {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "requester_id", nullable = false, updatable = false)
  private UUID requesterId;

  @Column(name = "provider_id", nullable = false, updatable = false)
  private UUID providerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 30)
  private ContractStatus status;

  @Column(name = "total_value", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalValue;

  @Column(name = "service_start")
  private Instant serviceStart;

  @Column(name = "service_end")
  private Instant serviceEnd;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Contract() {}

  public Contract(
      UUID requesterId,
      UUID providerId,
      ContractStatus status,
      BigDecimal totalValue,
      Instant serviceStart,
      Instant serviceEnd) {
    this.requesterId = Objects.requireNonNull(requesterId, "requesterId must not be null");
    this.providerId = Objects.requireNonNull(providerId, "providerId must not be null");
    this.status = Objects.requireNonNull(status, "status must not be null");
    this.totalValue = Objects.requireNonNull(totalValue, "totalValue must not be null");
    this.serviceStart = serviceStart;
    this.serviceEnd = serviceEnd;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Writes negotiated terms. Null arguments leave the corresponding field unchanged. */
  void applyNegotiatedTerms(BigDecimal price, Instant deadline) {
    if (price != null) {
      this.totalValue = price;
    }
    if (deadline != null) {
      this.serviceEnd = deadline;
    }
    this.updatedAt = Instant.now();
  }

  public boolean isParticipant(UUID actorId) {
    return requesterId.equals(actorId) || providerId.equals(actorId);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getRequesterId() {
    return requesterId;
  }

  public UUID getProviderId() {
    return providerId;
  }

  public ContractStatus getStatus() {
    return status;
  }

  public BigDecimal getTotalValue() {
    return totalValue;
  }

  public Instant getServiceStart() {
    return serviceStart;
  }

  public Instant getServiceEnd() {
    return serviceEnd;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
