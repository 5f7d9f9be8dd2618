package com.callinsight.processing.queue;

import java.util.List;

public record QueueStatus(
        int pending,
        List<QueueItemView> pendingItems,
        QueueItemView processingItem,
        int completedCount,
        int failedCount,
        List<QueueItemView> recentCompleted,
        List<QueueItemView> recentFailed,
        boolean running
) {
}
