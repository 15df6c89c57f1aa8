package io.b2mash.b2b.dealroom.actor;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the caller for a single negotiation action. Passed explicitly into every core
 * operation; the core never reads identity from request-bound state.
 *
 * @param actorId the authenticated user's id
 * @param role the user's platform role
 */
public record ActorContext(UUID actorId, ActorRole role) {

  public ActorContext {
    Objects.requireNonNull(actorId, "actorId must not be null");
    Objects.requireNonNull(role, "role must not be null");
  }

  public static ActorContext of(UUID actorId, ActorRole role) {
    return new ActorContext(actorId, role);
  }

  public boolean hasRole(ActorRole expected) {
    return this.role == expected;
  }
}
