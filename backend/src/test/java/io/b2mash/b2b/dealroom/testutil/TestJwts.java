package io.b2mash.b2b.dealroom.testutil;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;

import java.util.List;
import java.util.UUID;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;

/** MockMvc JWT post-processors carrying the {@code sub} and {@code rol} claims. */
public final class TestJwts {

  public static JwtRequestPostProcessor requesterJwt(UUID actorId) {
    return actorJwt(actorId, "requester", "ROLE_REQUESTER");
  }

  public static JwtRequestPostProcessor providerJwt(UUID actorId) {
    return actorJwt(actorId, "provider", "ROLE_PROVIDER");
  }

  public static JwtRequestPostProcessor advertiserJwt(UUID actorId) {
    return actorJwt(actorId, "advertiser", "ROLE_ADVERTISER");
  }

  private static JwtRequestPostProcessor actorJwt(UUID actorId, String role, String authority) {
    return jwt()
        .jwt(j -> j.subject(actorId.toString()).claim("rol", role))
        .authorities(List.of(new SimpleGrantedAuthority(authority)));
  }

  private TestJwts() {}
}
