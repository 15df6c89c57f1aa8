package io.b2mash.b2b.dealroom.negotiation;

/** Outcome requested by the turn holder when closing a negotiation. */
public enum FinalizeDecision {
  ACCEPT(NegotiationAction.ACCEPT),
  REJECT(NegotiationAction.REJECT);

  private final NegotiationAction action;

  FinalizeDecision(NegotiationAction action) {
    this.action = action;
  }

  public NegotiationAction action() {
    return action;
  }
}
