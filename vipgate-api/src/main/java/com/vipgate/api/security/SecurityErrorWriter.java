package com.vipgate.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.oauth2.server.resource.web.access.BearerTokenAccessDeniedHandler;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 401/403 bodies in the same {status, reason, message, ts} shape as ApiExceptionHandler.
 * The bearer handlers still set WWW-Authenticate before the body is written.
 */
@Component
public class SecurityErrorWriter {

    private static final Logger log = LoggerFactory.getLogger(SecurityErrorWriter.class);

    private final ObjectMapper om;
    private final Clock clock;
    private final BearerTokenAuthenticationEntryPoint bearerEntryPoint = new BearerTokenAuthenticationEntryPoint();
    private final BearerTokenAccessDeniedHandler bearerDenied = new BearerTokenAccessDeniedHandler();

    public SecurityErrorWriter(ObjectMapper om, Clock clock) {
        this.om = om;
        this.clock = clock;
    }

    public AuthenticationEntryPoint entryPoint() {
        return (request, response, ex) -> {
            bearerEntryPoint.commence(request, response, ex);
            write(response, HttpStatus.UNAUTHORIZED, "unauthorized", message(ex));
        };
    }

    public AccessDeniedHandler accessDenied() {
        return (request, response, ex) -> {
            log.warn("Denied {} {} for {}", request.getMethod(), request.getRequestURI(), SecurityActor.current());
            bearerDenied.handle(request, response, ex);
            write(response, HttpStatus.FORBIDDEN, "forbidden", "admin role required");
        };
    }

    private void write(HttpServletResponse response, HttpStatus status, String reason, String message)
        throws IOException {
        if (response.isCommitted()) return;
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("reason", reason);
        body.put("message", message);
        body.put("ts", clock.instant().toString());
        om.writeValue(response.getOutputStream(), body);
    }

    private static String message(AuthenticationException ex) {
        return ex instanceof InvalidBearerTokenException
            ? "invalid or expired token"
            : "bearer token required";
    }
}
