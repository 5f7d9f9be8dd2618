package com.callinsight.processing.queue;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProcessingStage {
    DOWNLOADING,
    TRANSCRIBING,
    ANALYZING,
    SAVING;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
