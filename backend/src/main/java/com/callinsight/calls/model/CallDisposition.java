package com.callinsight.calls.model;

import java.util.Locale;

public enum CallDisposition {
    ANSWERED,
    NO_ANSWER,
    BUSY,
    FAILED,
    VOICEMAIL,
    MISSED;

    public static CallDisposition fromPbx(String value) {
        if (value == null) {
            return MISSED;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "ANSWERED" -> ANSWERED;
            case "NO ANSWER", "NO_ANSWER" -> NO_ANSWER;
            case "BUSY" -> BUSY;
            case "VOICEMAIL" -> VOICEMAIL;
            case "FAILED", "CONGESTION" -> FAILED;
            default -> MISSED;
        };
    }
}
