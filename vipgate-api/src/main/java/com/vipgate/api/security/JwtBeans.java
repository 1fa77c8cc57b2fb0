package com.vipgate.api.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Admin tokens are HS256, signed with a shared secret by whoever operates the deployment.
 * The API only verifies them.
 */
@Configuration
public class JwtBeans {

  private final Environment env;

  public JwtBeans(Environment env) {
    this.env = env;
  }

  @Bean
  @ConditionalOnMissingBean(name = "jwtDecoder")
  public JwtDecoder jwtDecoder(@Value("${vipgate.auth.jwt-secret:}") String secret) {
    var key = new SecretKeySpec(normalizeSecret(secret), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }

  /**
   * Any configured secret string is reduced to a fixed 32-byte key (SHA-256), so token issuers must
   * sign with the same derived key. See {@link #deriveKey(String)}.
   */
  private byte[] normalizeSecret(String secret) {
    String s = (secret == null) ? "" : secret.trim();
    if (s.isEmpty()) {
      if (env.acceptsProfiles(Profiles.of("dev"))) {
        s = "dev-secret-change-me";
      } else {
        throw new IllegalStateException("vipgate.auth.jwt-secret is empty. Set VIPGATE_JWT_SECRET.");
      }
    }
    return deriveKey(s);
  }

  public static byte[] deriveKey(String secret) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return md.digest(secret.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
