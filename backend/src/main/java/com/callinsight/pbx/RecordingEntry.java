package com.callinsight.pbx;

public record RecordingEntry(
        String uid,
        String file
) {
}
