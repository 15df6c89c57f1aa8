package io.b2mash.b2b.dealroom.security;

import io.b2mash.b2b.dealroom.audit.AuditAuthenticationEntryPoint;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  private final ActorJwtAuthenticationConverter jwtAuthConverter;
  private final AuditAuthenticationEntryPoint auditAuthEntryPoint;

  public SecurityConfig(
      ActorJwtAuthenticationConverter jwtAuthConverter,
      AuditAuthenticationEntryPoint auditAuthEntryPoint) {
    this.jwtAuthConverter = jwtAuthConverter;
    this.auditAuthEntryPoint = auditAuthEntryPoint;
  }

  /** Stateless bearer-token chain for the negotiation API and actuator health. */
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/info")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthConverter))
                    .authenticationEntryPoint(auditAuthEntryPoint));

    return http.build();
  }
}
