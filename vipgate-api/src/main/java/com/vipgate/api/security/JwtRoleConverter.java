package com.vipgate.api.security;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps the "role" claim and the "roles" list claim to ROLE_* authorities. A token with
 * neither gets no authorities and cannot reach admin endpoints.
 */
public final class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Set<SimpleGrantedAuthority> authorities = new LinkedHashSet<>();
    add(authorities, jwt.getClaimAsString("role"));
    if (jwt.hasClaim("roles")) {
      List<String> roles = jwt.getClaimAsStringList("roles");
      if (roles != null) roles.forEach(r -> add(authorities, r));
    }
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private static void add(Collection<SimpleGrantedAuthority> authorities, String role) {
    if (role == null || role.isBlank()) return;
    String normalized = role.trim().toUpperCase(Locale.ROOT);
    if (normalized.startsWith("ROLE_")) normalized = normalized.substring("ROLE_".length());
    authorities.add(new SimpleGrantedAuthority("ROLE_" + normalized));
  }
}
