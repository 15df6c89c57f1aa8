package io.b2mash.b2b.dealroom.security;

/**
 * Centralized role constants used across authentication and authorization.
 *
 * <p>Platform roles come from the access token's {@code rol} claim. Spring authorities are the
 * {@code ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  public static final String ROLE_CLAIM = "rol";

  public static final String AUTHORITY_REQUESTER = "ROLE_REQUESTER";
  public static final String AUTHORITY_PROVIDER = "ROLE_PROVIDER";
  public static final String AUTHORITY_ADVERTISER = "ROLE_ADVERTISER";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

  private Roles() {}
}
