package com.vipgate.domain.sweep;

/**
 * Outcome recorded for one candidate in one sweep.
 */
public enum RemovalLogStatus {
  PROCESSING,
  SUCCESS,
  FAILED,
  WHITELISTED,
  NO_MEMBER_ID,
  INVALID_MEMBER_ID,
  ERROR
}
