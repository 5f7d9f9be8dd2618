package com.callinsight.calls.model;

import java.util.Locale;

public enum CallDirection {
    INBOUND,
    OUTBOUND,
    INTERNAL;

    public static CallDirection fromPbx(String value) {
        if (value == null) {
            return INTERNAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "inbound" -> INBOUND;
            case "outbound" -> OUTBOUND;
            default -> INTERNAL;
        };
    }
}
