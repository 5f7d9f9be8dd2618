package com.callinsight.processing.controller;

import com.callinsight.common.exception.NotFoundException;
import com.callinsight.common.security.SecurityUtils;
import com.callinsight.processing.dto.ProcessCallResponse;
import com.callinsight.processing.queue.EnqueueResult;
import com.callinsight.processing.queue.ProcessingQueue;
import com.callinsight.processing.service.BackfillResult;
import com.callinsight.processing.service.BackfillService;
import com.callinsight.processing.service.ProcessingCoordinator;
import com.callinsight.summary.dto.CallSummaryResponse;
import com.callinsight.summary.service.CallSummaryMapper;
import com.callinsight.summary.service.CallSummaryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/transcription")
@Validated
public class TranscriptionController {

    private static final Logger log = LoggerFactory.getLogger(TranscriptionController.class);

    private final ProcessingCoordinator processingCoordinator;
    private final ProcessingQueue processingQueue;
    private final CallSummaryService callSummaryService;
    private final BackfillService backfillService;

    public TranscriptionController(ProcessingCoordinator processingCoordinator,
                                   ProcessingQueue processingQueue,
                                   CallSummaryService callSummaryService,
                                   BackfillService backfillService) {
        this.processingCoordinator = processingCoordinator;
        this.processingQueue = processingQueue;
        this.callSummaryService = callSummaryService;
        this.backfillService = backfillService;
    }

    @PostMapping("/process/{callId}")
    public ProcessCallResponse process(@PathVariable String callId,
                                       @RequestParam(value = "recordingFile", required = false) String recordingFile,
                                       @RequestParam(value = "force", defaultValue = "false") boolean force) {
        if (!processingCoordinator.shouldProcess(callId, force)) {
            CallSummaryResponse summary = callSummaryService.find(callId)
                    .map(CallSummaryMapper::toResponse)
                    .orElse(null);
            return ProcessCallResponse.alreadyProcessed(callId, summary);
        }
        if (processingCoordinator.isInFlight(callId)) {
            return ProcessCallResponse.processing(callId);
        }
        EnqueueResult result = processingQueue.add(callId, recordingFile, force);
        log.info("Call {} submitted by {}: {}", callId, SecurityUtils.currentSubject(), result.status().label());
        return new ProcessCallResponse(result.status().label(), callId, result.position(), null);
    }

    @GetMapping("/summary/{callId}")
    public CallSummaryResponse summary(@PathVariable String callId) {
        return callSummaryService.find(callId)
                .map(CallSummaryMapper::toResponse)
                .orElseThrow(() -> new NotFoundException("No summary for call " + callId));
    }

    @PostMapping("/backfill")
    public BackfillResult backfill(@RequestParam(value = "hours", defaultValue = "24") @Min(1) @Max(720) int hours,
                                   @RequestParam(value = "force", defaultValue = "false") boolean force) {
        log.info("Backfill of {} h requested by {} (force={})", hours, SecurityUtils.currentSubject(), force);
        return backfillService.backfill(hours, force);
    }
}
