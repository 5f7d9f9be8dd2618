package com.callinsight.processing.service;

import com.callinsight.processing.queue.StageListener;
import com.callinsight.processing.tracker.ProcessingTracker;
import com.callinsight.summary.service.CallSummaryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point through which every trigger runs the recording processor.
 *
 * <p>All triggers share one {@link ProcessingTracker}, so a call is never processed twice at the
 * same time no matter which thread or scheduler asked for it.
 */
public class ProcessingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ProcessingCoordinator.class);

    private final ProcessingTracker tracker;
    private final CallSummaryService callSummaryService;
    private final RecordingProcessor recordingProcessor;

    public ProcessingCoordinator(ProcessingTracker tracker,
                                 CallSummaryService callSummaryService,
                                 RecordingProcessor recordingProcessor) {
        this.tracker = tracker;
        this.callSummaryService = callSummaryService;
        this.recordingProcessor = recordingProcessor;
    }

    public boolean shouldProcess(String callId, boolean force) {
        return force || !callSummaryService.hasCompletedSummary(callId);
    }

    public boolean isInFlight(String callId) {
        return tracker.isProcessing(callId);
    }

    /**
     * Runs the processor on the calling thread. Never throws; failures are logged and reported.
     */
    public TriggerOutcome processNow(String callId, String recordingFile, boolean force, TriggerSource source) {
        if (!shouldProcess(callId, force)) {
            log.debug("[{}] Call {} already has a summary", source, callId);
            return TriggerOutcome.SKIPPED_ALREADY_PROCESSED;
        }
        if (!tracker.tryAcquire(callId)) {
            log.info("[{}] Call {} is already being processed", source, callId);
            return TriggerOutcome.SKIPPED_IN_FLIGHT;
        }
        try {
            recordingProcessor.process(callId, recordingFile, force, StageListener.NONE);
            log.info("[{}] Processed call {}", source, callId);
            return TriggerOutcome.PROCESSED;
        } catch (Exception ex) {
            log.error("[{}] Processing failed for call {}", source, callId, ex);
            return TriggerOutcome.FAILED;
        } finally {
            tracker.release(callId);
        }
    }

    /**
     * Queue worker entry point. Skips return normally; processor failures propagate so the queue
     * can schedule a retry.
     */
    public void processQueued(String callId, String recordingFile, boolean force, StageListener stageListener) {
        if (!shouldProcess(callId, force)) {
            log.info("Queued call {} already has a summary, skipping", callId);
            return;
        }
        if (!tracker.tryAcquire(callId)) {
            log.info("Queued call {} is being processed by another trigger, skipping", callId);
            return;
        }
        try {
            recordingProcessor.process(callId, recordingFile, force, stageListener);
        } finally {
            tracker.release(callId);
        }
    }
}
