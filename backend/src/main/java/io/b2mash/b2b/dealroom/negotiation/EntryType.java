package io.b2mash.b2b.dealroom.negotiation;

/** Kind of a history entry. PROPOSAL and RESPONSE carry terms; MESSAGE carries notes only. */
public enum EntryType {
  PROPOSAL(NegotiationAction.PROPOSAL),
  RESPONSE(NegotiationAction.RESPONSE),
  MESSAGE(NegotiationAction.MESSAGE);

  private final NegotiationAction action;

  EntryType(NegotiationAction action) {
    this.action = action;
  }

  /** The state machine action that appending an entry of this type performs. */
  public NegotiationAction action() {
    return action;
  }

  public boolean carriesTerms() {
    return this != MESSAGE;
  }
}
