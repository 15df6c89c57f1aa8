package io.b2mash.b2b.dealroom.negotiation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Negotiation lifecycle status. Transitions are driven by {@link NegotiationAction}s through an
 * explicit table; a missing cell means the action is not allowed from that status.
 *
 * <pre>
 * AWAITING_PROVIDER  --RESPONSE--&gt; AWAITING_REQUESTER
 * AWAITING_REQUESTER --PROPOSAL--&gt; AWAITING_PROVIDER
 * either open status --MESSAGE--&gt;  (unchanged)
 * either open status --ACCEPT / REJECT / CANCEL--&gt; ACCEPTED / REJECTED / CANCELLED
 * </pre>
 */
public enum NegotiationStatus {
  AWAITING_PROVIDER,
  AWAITING_REQUESTER,
  ACCEPTED,
  REJECTED,
  CANCELLED;

  private static final Map<NegotiationStatus, Map<NegotiationAction, NegotiationStatus>>
      TRANSITIONS = new EnumMap<>(NegotiationStatus.class);

  static {
    var awaitingProvider =
        new EnumMap<NegotiationAction, NegotiationStatus>(NegotiationAction.class);
    awaitingProvider.put(NegotiationAction.RESPONSE, AWAITING_REQUESTER);
    awaitingProvider.put(NegotiationAction.MESSAGE, AWAITING_PROVIDER);
    awaitingProvider.put(NegotiationAction.ACCEPT, ACCEPTED);
    awaitingProvider.put(NegotiationAction.REJECT, REJECTED);
    awaitingProvider.put(NegotiationAction.CANCEL, CANCELLED);

    var awaitingRequester =
        new EnumMap<NegotiationAction, NegotiationStatus>(NegotiationAction.class);
    awaitingRequester.put(NegotiationAction.PROPOSAL, AWAITING_PROVIDER);
    awaitingRequester.put(NegotiationAction.MESSAGE, AWAITING_REQUESTER);
    awaitingRequester.put(NegotiationAction.ACCEPT, ACCEPTED);
    awaitingRequester.put(NegotiationAction.REJECT, REJECTED);
    awaitingRequester.put(NegotiationAction.CANCEL, CANCELLED);

    TRANSITIONS.put(AWAITING_PROVIDER, Collections.unmodifiableMap(awaitingProvider));
    TRANSITIONS.put(AWAITING_REQUESTER, Collections.unmodifiableMap(awaitingRequester));
  }

  /** Returns the status reached by applying {@code action}, or empty if the action is invalid. */
  public Optional<NegotiationStatus> next(NegotiationAction action) {
    return Optional.ofNullable(TRANSITIONS.getOrDefault(this, Map.of()).get(action));
  }

  public boolean allows(NegotiationAction action) {
    return next(action).isPresent();
  }

  /** Returns true for ACCEPTED, REJECTED and CANCELLED. */
  public boolean isTerminal() {
    return !TRANSITIONS.containsKey(this);
  }

  /** The participant expected to act next, or empty once the negotiation is closed. */
  public Optional<ParticipantRole> turnHolder() {
    return switch (this) {
      case AWAITING_PROVIDER -> Optional.of(ParticipantRole.PROVIDER);
      case AWAITING_REQUESTER -> Optional.of(ParticipantRole.REQUESTER);
      default -> Optional.empty();
    };
  }
}
