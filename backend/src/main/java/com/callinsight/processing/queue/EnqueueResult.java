package com.callinsight.processing.queue;

public record EnqueueResult(
        EnqueueStatus status,
        int position,
        QueueItemView item
) {

    public boolean queued() {
        return status == EnqueueStatus.QUEUED;
    }
}
