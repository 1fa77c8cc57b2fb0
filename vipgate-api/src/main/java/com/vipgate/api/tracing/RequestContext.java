package com.vipgate.api.tracing;

/**
 * Per-request correlation id stored in a ThreadLocal.
 *
 * Audit rows carry it so an admin action can be matched with the access log line.
 */
public final class RequestContext {

  private static final ThreadLocal<String> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    TL.set(requestId);
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    return TL.get();
  }
}
