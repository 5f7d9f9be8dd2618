package com.callinsight.processing.controller;

import com.callinsight.common.security.SecurityUtils;
import com.callinsight.processing.adapter.SseStatusBroadcaster;
import com.callinsight.processing.dto.AddToQueueRequest;
import com.callinsight.processing.dto.BatchQueueRequest;
import com.callinsight.processing.dto.QueueStatusResponse;
import com.callinsight.processing.queue.BatchResult;
import com.callinsight.processing.queue.ClearResult;
import com.callinsight.processing.queue.EnqueueResult;
import com.callinsight.processing.queue.ProcessingQueue;
import com.callinsight.processing.service.InferenceGate;
import com.callinsight.processing.tracker.ProcessingTracker;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/v1/queue")
public class QueueController {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final ProcessingQueue processingQueue;
    private final ProcessingTracker processingTracker;
    private final InferenceGate inferenceGate;
    private final SseStatusBroadcaster statusBroadcaster;

    public QueueController(ProcessingQueue processingQueue,
                           ProcessingTracker processingTracker,
                           InferenceGate inferenceGate,
                           SseStatusBroadcaster statusBroadcaster) {
        this.processingQueue = processingQueue;
        this.processingTracker = processingTracker;
        this.inferenceGate = inferenceGate;
        this.statusBroadcaster = statusBroadcaster;
    }

    @PostMapping
    public EnqueueResult add(@RequestBody @Valid AddToQueueRequest request) {
        return processingQueue.add(request.callId(), request.recordingFile(), Boolean.TRUE.equals(request.force()));
    }

    @PostMapping("/batch")
    public BatchResult addBatch(@RequestBody @Valid BatchQueueRequest request) {
        return processingQueue.addBatch(request.items().stream().map(AddToQueueRequest::toQueueRequest).toList());
    }

    @GetMapping("/status")
    public QueueStatusResponse status() {
        return new QueueStatusResponse(
                processingQueue.getStatus(),
                processingTracker.activeCount(),
                inferenceGate.availablePermits()
        );
    }

    @PostMapping("/clear")
    public ClearResult clear() {
        log.info("Queue clear requested by {}", SecurityUtils.currentSubject());
        return processingQueue.clear();
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return statusBroadcaster.subscribe();
    }
}
