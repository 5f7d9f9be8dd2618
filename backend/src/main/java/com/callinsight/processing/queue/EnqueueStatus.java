package com.callinsight.processing.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnqueueStatus {
    QUEUED,
    ALREADY_QUEUED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
