package com.callinsight.processing.dto;

import com.callinsight.processing.queue.QueueRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddToQueueRequest(
        @NotBlank @Size(max = 128) String callId,
        @Size(max = 512) String recordingFile,
        Boolean force
) {

    public QueueRequest toQueueRequest() {
        return new QueueRequest(callId, recordingFile, Boolean.TRUE.equals(force));
    }
}
