package com.callinsight.processing.service;

import com.callinsight.calls.model.CdrRecord;
import com.callinsight.calls.service.CallLogService;
import com.callinsight.config.AppProperties;
import com.callinsight.pbx.PbxClient;
import com.callinsight.pbx.PbxClientException;
import com.callinsight.processing.queue.BatchResult;
import com.callinsight.processing.queue.ProcessingQueue;
import com.callinsight.processing.queue.QueueRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Service
public class CdrSyncService {

    private static final Logger log = LoggerFactory.getLogger(CdrSyncService.class);

    private final PbxClient pbxClient;
    private final CallLogService callLogService;
    private final ProcessingCoordinator processingCoordinator;
    private final ProcessingQueue processingQueue;
    private final TaskScheduler taskScheduler;
    private final AppProperties appProperties;
    private final Clock clock;

    public CdrSyncService(PbxClient pbxClient,
                          CallLogService callLogService,
                          ProcessingCoordinator processingCoordinator,
                          ProcessingQueue processingQueue,
                          TaskScheduler taskScheduler,
                          AppProperties appProperties,
                          Clock clock) {
        this.pbxClient = pbxClient;
        this.callLogService = callLogService;
        this.processingCoordinator = processingCoordinator;
        this.processingQueue = processingQueue;
        this.taskScheduler = taskScheduler;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void syncOnStartup() {
        AppProperties.CdrSync settings = appProperties.cdrSync();
        if (!settings.enabled() || !settings.onStartup()) {
            return;
        }
        taskScheduler.schedule(() -> sync(settings.startupPages()), clock.instant());
    }

    @Scheduled(fixedDelayString = "${app.cdr-sync.interval:PT5M}", initialDelayString = "${app.cdr-sync.interval:PT5M}")
    public void periodicSync() {
        if (!appProperties.cdrSync().enabled()) {
            return;
        }
        sync(appProperties.cdrSync().periodicPages());
    }

    public SyncResult sync(int maxPages) {
        int pageSize = appProperties.cdrSync().pageSize();
        boolean includeInternal = appProperties.autoProcess().internalCalls();

        int pages = 0;
        int seen = 0;
        int created = 0;
        List<QueueRequest> toQueue = new ArrayList<>();
        try {
            for (int page = 1; page <= maxPages; page++) {
                List<CdrRecord> records = pbxClient.listCdrs(page, pageSize);
                pages++;
                seen += records.size();
                for (CdrRecord record : records) {
                    if (!callLogService.recordIfNew(record)) {
                        continue;
                    }
                    created++;
                    if (record.isProcessable(includeInternal)
                            && processingCoordinator.shouldProcess(record.callId(), false)) {
                        toQueue.add(new QueueRequest(record.callId(), record.recordingFile(), false));
                    }
                }
                if (records.size() < pageSize) {
                    break;
                }
            }
        } catch (PbxClientException ex) {
            log.error("CDR sync stopped after {} pages", pages, ex);
        }
        log.info("Synced {} new CDR records from {} pages", created, pages);

        BatchResult queued = null;
        if (appProperties.autoProcess().enabled() && !toQueue.isEmpty()) {
            queued = processingQueue.addBatch(toQueue);
            log.info("Queued {} synced calls for processing ({} skipped)", queued.addedCount(), queued.skippedCount());
        }
        return new SyncResult(pages, seen, created, queued);
    }
}
