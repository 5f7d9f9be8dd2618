package com.callinsight.processing.service;

import com.callinsight.calls.model.CdrRecord;
import com.callinsight.calls.service.CallLogService;
import com.callinsight.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;

@Service
public class CallEventHandler {

    private static final Logger log = LoggerFactory.getLogger(CallEventHandler.class);

    public static final String NEW_CDR = "NewCdr";

    private final CallLogService callLogService;
    private final ProcessingCoordinator processingCoordinator;
    private final TaskScheduler taskScheduler;
    private final AppProperties appProperties;
    private final Clock clock;

    public CallEventHandler(CallLogService callLogService,
                            ProcessingCoordinator processingCoordinator,
                            TaskScheduler taskScheduler,
                            AppProperties appProperties,
                            Clock clock) {
        this.callLogService = callLogService;
        this.processingCoordinator = processingCoordinator;
        this.taskScheduler = taskScheduler;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public String handle(Map<String, Object> event) {
        Object type = event.get("event") != null ? event.get("event") : event.get("action");
        if (type == null) {
            log.warn("Ignoring PBX event without a type: {}", event.keySet());
            return null;
        }
        String eventType = type.toString();
        if (NEW_CDR.equals(eventType)) {
            handleNewCdr(event);
        } else {
            log.debug("Ignoring PBX event {}", eventType);
        }
        return eventType;
    }

    private void handleNewCdr(Map<String, Object> event) {
        CdrRecord record = CdrRecord.fromPbx(event);
        if (record.callId() == null) {
            log.warn("NewCdr event without a call id");
            return;
        }
        if (!callLogService.recordIfNew(record)) {
            log.debug("Call {} already logged", record.callId());
            return;
        }
        log.info("Logged call {} ({}, {})", record.callId(), record.direction(), record.disposition());

        AppProperties.AutoProcess autoProcess = appProperties.autoProcess();
        if (!autoProcess.enabled()) {
            return;
        }
        if (!record.isProcessable(autoProcess.internalCalls())) {
            log.info("Not auto-processing call {}", record.callId());
            return;
        }
        taskScheduler.schedule(
                () -> processingCoordinator.processNow(record.callId(), record.recordingFile(), false, TriggerSource.WEBHOOK),
                clock.instant().plus(autoProcess.webhookDelay())
        );
        log.info("Scheduled processing for call {} in {} s", record.callId(), autoProcess.webhookDelay().toSeconds());
    }
}
