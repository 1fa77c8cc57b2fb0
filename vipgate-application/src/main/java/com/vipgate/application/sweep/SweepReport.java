package com.vipgate.application.sweep;

import java.time.Instant;

/**
 * Counters for one completed sweep run.
 *
 * @param skipped candidates left alone for missing or invalid member ids, or because they changed after selection
 */
public record SweepReport(
    String sweepId,
    Instant startedAt,
    Instant finishedAt,
    int candidates,
    int removed,
    int failed,
    int whitelisted,
    int skipped,
    int errors
) {}
