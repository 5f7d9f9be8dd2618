package com.callinsight.processing.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QueueItemStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    RETRYING;

    public boolean isActive() {
        return this == PENDING || this == PROCESSING || this == RETRYING;
    }

    public boolean isWaiting() {
        return this == PENDING || this == RETRYING;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
