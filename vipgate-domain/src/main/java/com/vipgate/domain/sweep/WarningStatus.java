package com.vipgate.domain.sweep;

public enum WarningStatus {
  SENT,
  FAILED
}
