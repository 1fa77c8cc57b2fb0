package com.vipgate.application.warning;

/**
 * @param alreadySent milestones skipped because a SENT entry exists
 */
public record WarningReport(int sent, int failed, int alreadySent) {}
