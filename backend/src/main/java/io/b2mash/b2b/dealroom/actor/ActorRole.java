package io.b2mash.b2b.dealroom.actor;

import java.util.Arrays;
import java.util.Optional;

/** Platform role of an authenticated user, carried in the {@code rol} claim of the access token. */
public enum ActorRole {
  REQUESTER("requester"),
  PROVIDER("provider"),
  ADVERTISER("advertiser"),
  ADMIN("admin");

  private final String claimValue;

  ActorRole(String claimValue) {
    this.claimValue = claimValue;
  }

  public String claimValue() {
    return claimValue;
  }

  /** Resolves a role from its claim value, case-insensitively. */
  public static Optional<ActorRole> fromClaim(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(r -> r.claimValue.equalsIgnoreCase(value)).findFirst();
  }
}
