package io.b2mash.b2b.dealroom.negotiation;

import io.b2mash.b2b.dealroom.actor.ActorContext;
import io.b2mash.b2b.dealroom.exception.ForbiddenException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether an actor may perform an action, from their side of the negotiation and whose
 * turn it is. Status preconditions are left to {@link NegotiationStatus}: on a closed negotiation
 * participants pass the guard and the transition table rejects the action.
 */
@Component
public class NegotiationAuthorizationGuard {

  private static final Logger log = LoggerFactory.getLogger(NegotiationAuthorizationGuard.class);

  private final NegotiationProperties properties;

  public NegotiationAuthorizationGuard(NegotiationProperties properties) {
    this.properties = properties;
  }

  /**
   * Outcome of an authorization check.
   *
   * @param allowed whether the action may proceed
   * @param participantRole the actor's side, or null for a non-participant
   * @param reason why the action was denied, or null when allowed
   */
  public record Decision(boolean allowed, ParticipantRole participantRole, String reason) {

    static Decision allow(ParticipantRole role) {
      return new Decision(true, role, null);
    }

    static Decision deny(ParticipantRole role, String reason) {
      return new Decision(false, role, reason);
    }
  }

  public Decision canAct(Negotiation negotiation, ActorContext actor, NegotiationAction action) {
    var maybeRole = negotiation.participantRoleOf(actor.actorId());
    if (maybeRole.isEmpty()) {
      return Decision.deny(null, "Actor is not a participant of this negotiation");
    }
    var role = maybeRole.get();
    var status = negotiation.getStatus();
    if (status.isTerminal()) {
      return Decision.allow(role);
    }

    boolean holdsTurn = status.turnHolder().map(holder -> holder == role).orElse(false);
    return switch (action) {
      case PROPOSAL ->
          role == ParticipantRole.REQUESTER
              ? Decision.allow(role)
              : Decision.deny(role, "Only the requester can send a proposal");
      case RESPONSE ->
          role == ParticipantRole.PROVIDER
              ? Decision.allow(role)
              : Decision.deny(role, "Only the provider can send a response");
      case MESSAGE -> Decision.allow(role);
      case ACCEPT ->
          holdsTurn
              ? Decision.allow(role)
              : Decision.deny(role, "Only the participant whose turn it is can accept");
      case REJECT ->
          holdsTurn || properties.policy().offTurnRejectAllowed()
              ? Decision.allow(role)
              : Decision.deny(role, "Only the participant whose turn it is can reject");
      case CANCEL ->
          role == ParticipantRole.REQUESTER
              ? Decision.allow(role)
              : Decision.deny(role, "Only the requester can cancel a negotiation");
    };
  }

  /**
   * Returns the actor's side if the action is allowed.
   *
   * @throws ForbiddenException otherwise
   */
  public ParticipantRole requireCanAct(
      Negotiation negotiation, ActorContext actor, NegotiationAction action) {
    var decision = canAct(negotiation, actor, action);
    if (!decision.allowed()) {
      log.warn(
          "Denied {} on negotiation {} for actor {}: {}",
          action,
          negotiation.getId(),
          actor.actorId(),
          decision.reason());
      throw new ForbiddenException(
          "Cannot " + action.name().toLowerCase(Locale.ROOT) + " negotiation", decision.reason());
    }
    return decision.participantRole();
  }

  /** Read access: participants only. */
  public ParticipantRole requireParticipant(Negotiation negotiation, ActorContext actor) {
    return negotiation
        .participantRoleOf(actor.actorId())
        .orElseThrow(
            () ->
                new ForbiddenException(
                    "Cannot view negotiation", "Actor is not a participant of this negotiation"));
  }
}
