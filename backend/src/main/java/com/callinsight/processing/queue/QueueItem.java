package com.callinsight.processing.queue;

import java.time.Instant;

/**
 * Mutable queue entry. Every mutation happens under the owning {@link ProcessingQueue}'s lock;
 * outside the queue only {@link QueueItemView} snapshots are visible.
 */
public class QueueItem {

    public static final int MAX_RETRIES = 3;

    private final String callId;
    private final String recordingFile;
    private final boolean force;
    private final Instant addedAt;

    private QueueItemStatus status = QueueItemStatus.PENDING;
    private int attempt;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
    private Instant nextRetryAt;
    private ProcessingStage stage;

    QueueItem(String callId, String recordingFile, boolean force, Instant addedAt) {
        this.callId = callId;
        this.recordingFile = recordingFile;
        this.force = force;
        this.addedAt = addedAt;
    }

    public String getCallId() {
        return callId;
    }

    public String getRecordingFile() {
        return recordingFile;
    }

    public boolean isForce() {
        return force;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public QueueItemStatus getStatus() {
        return status;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getNextRetryAt() {
        return nextRetryAt;
    }

    void markProcessing(Instant now) {
        status = QueueItemStatus.PROCESSING;
        attempt++;
        startedAt = now;
        nextRetryAt = null;
        stage = null;
    }

    void updateStage(ProcessingStage stage) {
        this.stage = stage;
    }

    void markCompleted(Instant now) {
        status = QueueItemStatus.COMPLETED;
        completedAt = now;
        errorMessage = null;
    }

    void markRetrying(String errorMessage, Instant nextRetryAt) {
        status = QueueItemStatus.RETRYING;
        this.errorMessage = errorMessage;
        this.nextRetryAt = nextRetryAt;
    }

    void markFailed(String errorMessage, Instant now) {
        status = QueueItemStatus.FAILED;
        this.errorMessage = errorMessage;
        completedAt = now;
    }

    QueueItemView view() {
        return new QueueItemView(
                callId,
                recordingFile,
                force,
                status,
                attempt,
                MAX_RETRIES,
                errorMessage,
                addedAt,
                startedAt,
                completedAt,
                nextRetryAt,
                stage
        );
    }
}
