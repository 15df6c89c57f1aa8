package io.b2mash.b2b.dealroom.contract;

import java.util.Set;

/** Lifecycle status of a service contract, as far as negotiation is concerned. */
public enum ContractStatus {
  /** Requested, awaiting the provider's confirmation. */
  PENDING,

  /** Provider confirmed; service not yet started. */
  ACCEPTED,

  IN_PROGRESS,
  COMPLETED,
  CANCELLED_BY_REQUESTER,
  CANCELLED_BY_PROVIDER,
  DISPUTED;

  private static final Set<ContractStatus> NEGOTIABLE = Set.of(PENDING, ACCEPTED);

  /** Returns true if terms may still be negotiated and settled onto the contract. */
  public boolean allowsNegotiation() {
    return NEGOTIABLE.contains(this);
  }
}
