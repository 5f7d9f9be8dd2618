package com.callinsight.processing.service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record RecordingContext(String extension, String direction) {

    private static final Pattern EXTENSION = Pattern.compile("-(\\d{3})-");

    public static RecordingContext fromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return new RecordingContext(null, null);
        }
        Matcher matcher = EXTENSION.matcher(fileName);
        String extension = matcher.find() ? matcher.group(1) : null;

        String lower = fileName.toLowerCase(Locale.ROOT);
        String direction = null;
        if (lower.contains("outbound")) {
            direction = "outbound";
        } else if (lower.contains("inbound")) {
            direction = "inbound";
        } else if (lower.contains("internal")) {
            direction = "internal";
        }
        return new RecordingContext(extension, direction);
    }

    public String describe() {
        StringBuilder builder = new StringBuilder();
        if (extension != null) {
            builder.append("Extension: ").append(extension).append('\n');
        }
        if (direction != null) {
            builder.append("Call Direction: ").append(switch (direction) {
                case "outbound" -> "Outbound (Staff initiated the call)";
                case "inbound" -> "Inbound (Customer called in)";
                default -> "Internal (Call between staff members)";
            }).append('\n');
        }
        return builder.toString().strip();
    }
}
