package com.callinsight.calls.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record CdrRecord(
        String callId,
        String callerNumber,
        String callerName,
        String calleeNumber,
        String calleeName,
        CallDirection direction,
        CallDisposition disposition,
        LocalDateTime startTime,
        int durationSeconds,
        String recordingFile
) {

    private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("dd/MM/yyyy hh:mm:ss a", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss")
    );

    public static CdrRecord fromPbx(Map<String, ?> raw) {
        String callId = first(raw, "uid", "callid", "uniqueid");
        return new CdrRecord(
                callId,
                first(raw, "call_from_number", "src", "callerid"),
                first(raw, "call_from_name", "callername", "src_name"),
                first(raw, "call_to_number", "dst", "destination"),
                first(raw, "call_to_name", "dst_name"),
                direction(raw),
                CallDisposition.fromPbx(first(raw, "disposition", "status")),
                parseTime(first(raw, "time", "start", "calldate")),
                parseInt(first(raw, "duration", "billsec")),
                first(raw, "recording", "record_file", "recordingfile", "recordfile")
        );
    }

    public boolean hasRecording() {
        return recordingFile != null && !recordingFile.isBlank();
    }

    public boolean isProcessable(boolean includeInternal) {
        return disposition == CallDisposition.ANSWERED
                && hasRecording()
                && (direction != CallDirection.INTERNAL || includeInternal);
    }

    static LocalDateTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (DateTimeFormatter format : TIME_FORMATS) {
            try {
                return LocalDateTime.parse(value.trim(), format);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return null;
    }

    private static CallDirection direction(Map<String, ?> raw) {
        String type = first(raw, "call_type", "calltype", "type");
        if (type != null) {
            return CallDirection.fromPbx(type);
        }
        if ("yes".equalsIgnoreCase(first(raw, "outbound"))) {
            return CallDirection.OUTBOUND;
        }
        if ("yes".equalsIgnoreCase(first(raw, "internal"))) {
            return CallDirection.INTERNAL;
        }
        return CallDirection.INBOUND;
    }

    private static int parseInt(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static String first(Map<String, ?> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }
}
