package com.vipgate.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Two chains for /api/**: a short public list (health, Stripe webhook) and a stateless
 * JWT chain where admin routes need role ADMIN. 401/403 come back as JSON envelopes.
 */
@Configuration
public class SecurityConfig {

    public static final String STRIPE_WEBHOOK = "/api/v1/billing/stripe/webhook";
    public static final String ADMIN_API = "/api/v1/admin/**";

    private final SecurityErrorWriter errors;

    public SecurityConfig(SecurityErrorWriter errors) {
        this.errors = errors;
    }

    /**
     * Public endpoints (NO JWT, NO resource server):
     * - Health & error
     * - Stripe webhook (authenticated by its own signature)
     */
    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(
                "/api/v1/health",
                "/error",
                STRIPE_WEBHOOK
            )
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/api/v1/health", "/error").permitAll()
                .requestMatchers(HttpMethod.POST, STRIPE_WEBHOOK).permitAll()
                .anyRequest().denyAll() // fail-closed
            )
            .build();
    }

    /**
     * Secured API (JWT required):
     * - /api/v1/admin/** needs role ADMIN
     * - anything else under /api/** just needs a valid token
     */
    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher("/api/**")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(ADMIN_API).hasRole("ADMIN")
                .anyRequest().authenticated()
            )
            .exceptionHandling(eh -> eh
                .authenticationEntryPoint(errors.entryPoint())
                .accessDeniedHandler(errors.accessDenied())
            )
            .oauth2ResourceServer(oauth -> oauth
                .jwt(jwt -> jwt.jwtAuthenticationConverter(new JwtRoleConverter()))
                .authenticationEntryPoint(errors.entryPoint())
                .accessDeniedHandler(errors.accessDenied())
            )
            .build();
    }
}
