package com.callinsight.processing.queue;

public record QueueRequest(
        String callId,
        String recordingFile,
        boolean force
) {

    public static QueueRequest of(String callId) {
        return new QueueRequest(callId, null, false);
    }
}
