package com.vipgate.application.billing;

import com.vipgate.domain.billing.ChangeKind;

/**
 * What happened to one inbound billing event.
 *
 * @param change null unless the event reached the reducer
 * @param reason short code for DUPLICATE / IGNORED outcomes
 */
public record IngestResult(String eventId, Outcome outcome, ChangeKind change, String reason) {

  public enum Outcome {
    APPLIED,
    DUPLICATE,
    IGNORED
  }

  public static IngestResult applied(String eventId, ChangeKind change) {
    return new IngestResult(eventId, Outcome.APPLIED, change, null);
  }

  public static IngestResult duplicate(String eventId) {
    return new IngestResult(eventId, Outcome.DUPLICATE, null, "already_processed");
  }

  public static IngestResult ignored(String eventId, String reason) {
    return new IngestResult(eventId, Outcome.IGNORED, null, reason);
  }

  public static IngestResult ignored(String eventId, ChangeKind change, String reason) {
    return new IngestResult(eventId, Outcome.IGNORED, change, reason);
  }
}
