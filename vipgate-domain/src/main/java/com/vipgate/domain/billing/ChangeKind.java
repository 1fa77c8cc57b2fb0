package com.vipgate.domain.billing;

/**
 * Classification of what one event did to a subscription record.
 */
public enum ChangeKind {
  CREATED,
  /** Expiry moved forward on an already active record. */
  EXTENDED,
  ACTIVATED,
  DEACTIVATED,
  /** Only descriptive fields (name, member id, billing ids, invoice marker) changed. */
  UPDATED,
  UNCHANGED,
  /** Event could not be applied (no target, missing required data). Nothing was written. */
  IGNORED;

  public boolean mutates() {
    return this != UNCHANGED && this != IGNORED;
  }
}
