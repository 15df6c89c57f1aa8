package io.b2mash.b2b.dealroom.negotiation;

/** Every action a participant can take on a negotiation. */
public enum NegotiationAction {
  PROPOSAL,
  RESPONSE,
  MESSAGE,
  ACCEPT,
  REJECT,
  CANCEL
}
