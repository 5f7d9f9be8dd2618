package com.callinsight.processing.dto;

import com.callinsight.processing.queue.QueueStatus;

public record QueueStatusResponse(
        QueueStatus queue,
        int activeCount,
        int inferenceSlotsAvailable
) {
}
