package com.callinsight.processing.queue;

import java.time.Instant;

public record QueueItemView(
        String callId,
        String recordingFile,
        boolean force,
        QueueItemStatus status,
        int attempt,
        int maxRetries,
        String errorMessage,
        Instant addedAt,
        Instant startedAt,
        Instant completedAt,
        Instant nextRetryAt,
        ProcessingStage stage
) {
}
