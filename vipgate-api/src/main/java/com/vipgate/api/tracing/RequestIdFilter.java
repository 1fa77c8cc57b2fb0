package com.vipgate.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for every HTTP request.
 *
 * The caller's X-Request-Id (or X-Correlation-Id) is kept when it is a short token of safe
 * characters, otherwise a UUID is generated. The id goes to the MDC, to {@link RequestContext}
 * for audit rows and back to the caller in X-Request-Id.
 *
 * Admin and webhook calls get one access line each. Runs ahead of the security chain so
 * 401/403 responses carry the id too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String HDR_CORRELATION_ID = "X-Correlation-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  // ids end up in log lines and audit rows
  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {

    String requestId = acceptOrGenerate(request.getHeader(HDR_REQUEST_ID), request.getHeader(HDR_CORRELATION_ID));
    MDC.put(MDC_REQUEST_ID, requestId);
    RequestContext.set(requestId);
    response.setHeader(HDR_REQUEST_ID, requestId);

    long started = System.nanoTime();
    try {
      chain.doFilter(request, response);
    } finally {
      if (isAudited(request.getRequestURI())) {
        log.info("{} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(), response.getStatus(),
            (System.nanoTime() - started) / 1_000_000);
      }
      RequestContext.clear();
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  static String acceptOrGenerate(String requestId, String correlationId) {
    for (String candidate : new String[] {requestId, correlationId}) {
      if (candidate != null && SAFE_ID.matcher(candidate.trim()).matches()) {
        return candidate.trim();
      }
    }
    return UUID.randomUUID().toString();
  }

  private static boolean isAudited(String uri) {
    return uri != null && (uri.startsWith("/api/v1/admin/") || uri.startsWith("/api/v1/billing/"));
  }
}
