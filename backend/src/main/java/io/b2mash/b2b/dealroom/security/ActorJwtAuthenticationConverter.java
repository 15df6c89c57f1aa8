package io.b2mash.b2b.dealroom.security;

import io.b2mash.b2b.dealroom.actor.ActorRole;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class ActorJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<ActorRole, String> ROLE_MAPPING =
      Map.of(
          ActorRole.REQUESTER, Roles.AUTHORITY_REQUESTER,
          ActorRole.PROVIDER, Roles.AUTHORITY_PROVIDER,
          ActorRole.ADVERTISER, Roles.AUTHORITY_ADVERTISER,
          ActorRole.ADMIN, Roles.AUTHORITY_ADMIN);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    return ActorJwtUtils.extractRole(jwt)
        .map(ROLE_MAPPING::get)
        .<Collection<GrantedAuthority>>map(a -> List.of(new SimpleGrantedAuthority(a)))
        .orElse(List.of());
  }
}
