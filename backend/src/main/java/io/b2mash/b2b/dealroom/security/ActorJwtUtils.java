package io.b2mash.b2b.dealroom.security;

import io.b2mash.b2b.dealroom.actor.ActorContext;
import io.b2mash.b2b.dealroom.actor.ActorRole;
import io.b2mash.b2b.dealroom.exception.MissingActorContextException;
import java.util.Optional;
import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Builds the {@link ActorContext} from a validated access token.
 *
 * <p>Token format: {@code { "sub": "<actor uuid>", "rol": "requester" }}
 */
public final class ActorJwtUtils {

  /** Extracts the platform role ({@code rol}) claim, if present and known. */
  public static Optional<ActorRole> extractRole(Jwt jwt) {
    return ActorRole.fromClaim(jwt.getClaimAsString(Roles.ROLE_CLAIM));
  }

  /** Resolves the caller's identity. Throws 401 when the subject or role cannot be read. */
  public static ActorContext toActorContext(Jwt jwt) {
    if (jwt == null || jwt.getSubject() == null) {
      throw new MissingActorContextException("Access token has no subject");
    }
    UUID actorId;
    try {
      actorId = UUID.fromString(jwt.getSubject());
    } catch (IllegalArgumentException e) {
      throw new MissingActorContextException("Access token subject is not a valid actor id");
    }
    var role =
        extractRole(jwt)
            .orElseThrow(
                () -> new MissingActorContextException("Access token has no known role claim"));
    return ActorContext.of(actorId, role);
  }

  private ActorJwtUtils() {}
}
