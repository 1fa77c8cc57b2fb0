package com.vipgate.api.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JwtRoleConverterTest {

  private final JwtRoleConverter converter = new JwtRoleConverter();

  private static Jwt.Builder token() {
    return Jwt.withTokenValue("t")
        .header("alg", "HS256")
        .subject("ops-carol")
        .issuedAt(Instant.parse("2026-01-01T00:00:00Z"));
  }

  @Test
  void singleRoleClaim() {
    AbstractAuthenticationToken auth = converter.convert(token().claim("role", " admin ").build());

    assertThat(auth.getAuthorities()).extracting(GrantedAuthority::getAuthority).containsExactly("ROLE_ADMIN");
    assertThat(auth.getName()).isEqualTo("ops-carol");
  }

  @Test
  void rolesListIsMergedWithoutDuplicates() {
    AbstractAuthenticationToken auth = converter.convert(token()
        .claim("role", "ADMIN")
        .claim("roles", List.of("ROLE_ADMIN", "support"))
        .build());

    assertThat(auth.getAuthorities()).extracting(GrantedAuthority::getAuthority)
        .containsExactly("ROLE_ADMIN", "ROLE_SUPPORT");
  }

  @Test
  void noRoleMeansNoAuthorities() {
    assertThat(converter.convert(token().claim("scope", "read").build()).getAuthorities()).isEmpty();
  }
}
