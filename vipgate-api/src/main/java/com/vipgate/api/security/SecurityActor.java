package com.vipgate.api.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Who is acting, for audit rows.
 *
 * - JWT request: the token subject (falls back to "admin" when the token has none)
 * - anything else (scheduler, startup): "system"
 */
public final class SecurityActor {

  public static final String SYSTEM = "system";

  private SecurityActor() {}

  public static String current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (!(auth instanceof JwtAuthenticationToken jat)) {
      return SYSTEM;
    }
    Jwt jwt = jat.getToken();
    String subject = jwt.getSubject();
    return subject == null || subject.isBlank() ? "admin" : subject.trim();
  }
}
