package com.callinsight.processing.service;

import com.callinsight.calls.model.CdrRecord;
import com.callinsight.config.AppProperties;
import com.callinsight.pbx.PbxClient;
import com.callinsight.summary.service.CallSummaryService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(value = "app.poller.enabled", havingValue = "true", matchIfMissing = true)
public class CdrPoller {

    private static final Logger log = LoggerFactory.getLogger(CdrPoller.class);

    private final PbxClient pbxClient;
    private final ProcessingCoordinator processingCoordinator;
    private final CallSummaryService callSummaryService;
    private final AppProperties.Poller settings;
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "cdr-poller");
        thread.setDaemon(true);
        return thread;
    });

    private volatile boolean stopped;

    public CdrPoller(PbxClient pbxClient,
                     ProcessingCoordinator processingCoordinator,
                     CallSummaryService callSummaryService,
                     AppProperties appProperties) {
        this.pbxClient = pbxClient;
        this.processingCoordinator = processingCoordinator;
        this.callSummaryService = callSummaryService;
        this.settings = appProperties.poller();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("CDR poller starting in {} s, interval {} s", settings.initialDelay().toSeconds(), settings.interval().toSeconds());
        scheduleNext(settings.initialDelay());
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        executor.shutdownNow();
        log.info("CDR poller stopped");
    }

    public int pollOnce() {
        List<CdrRecord> records = pbxClient.listCdrs(1, settings.pageSize());
        log.debug("CDR poller fetched {} records", records.size());

        int processed = 0;
        for (CdrRecord record : records) {
            // inbound and outbound only, regardless of the internal-calls setting
            if (record.callId() == null || !record.isProcessable(false)) {
                continue;
            }
            if (callSummaryService.hasSummary(record.callId())) {
                continue;
            }
            if (processingCoordinator.isInFlight(record.callId())) {
                log.info("CDR poller: skipping {}, already being processed", record.callId());
                continue;
            }
            processed++;
            log.info("Auto-processing new call {} ({})", record.callId(), record.direction());
            processingCoordinator.processNow(record.callId(), record.recordingFile(), false, TriggerSource.POLLER);
        }
        if (processed == 0) {
            log.debug("CDR poller: no new calls to process");
        }
        return processed;
    }

    private void runCycle() {
        Duration next = settings.interval();
        try {
            pollOnce();
        } catch (Exception ex) {
            log.error("CDR poller cycle failed", ex);
            next = settings.errorBackoff();
        }
        scheduleNext(next);
    }

    private void scheduleNext(Duration delay) {
        if (stopped || executor.isShutdown()) {
            return;
        }
        executor.schedule(this::runCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
