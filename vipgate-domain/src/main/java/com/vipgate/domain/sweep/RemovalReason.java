package com.vipgate.domain.sweep;

public enum RemovalReason {
  EXPIRED,
  CANCELLED
}
