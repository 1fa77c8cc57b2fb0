package com.vipgate.application.ports;

/**
 * A directory call failed (transport error, timeout or platform rejection).
 */
public class MembershipException extends Exception {

  private final boolean transientFailure;

  public MembershipException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public MembershipException(String message, Throwable cause) {
    super(message, cause);
    this.transientFailure = true;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
