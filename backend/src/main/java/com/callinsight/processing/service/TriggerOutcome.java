package com.callinsight.processing.service;

public enum TriggerOutcome {
    PROCESSED,
    SKIPPED_ALREADY_PROCESSED,
    SKIPPED_IN_FLIGHT,
    FAILED
}
