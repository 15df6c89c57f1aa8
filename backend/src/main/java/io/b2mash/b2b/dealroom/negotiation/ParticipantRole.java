package io.b2mash.b2b.dealroom.negotiation;

/** Side of the negotiation an actor is on. */
public enum ParticipantRole {
  REQUESTER("requester"),
  PROVIDER("provider");

  private final String label;

  ParticipantRole(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public ParticipantRole counterpart() {
    return this == REQUESTER ? PROVIDER : REQUESTER;
  }
}
