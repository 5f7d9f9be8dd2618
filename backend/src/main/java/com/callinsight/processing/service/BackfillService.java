package com.callinsight.processing.service;

import com.callinsight.calls.model.CallDirection;
import com.callinsight.calls.model.CallDisposition;
import com.callinsight.calls.model.CdrRecord;
import com.callinsight.pbx.PbxClient;
import com.callinsight.pbx.PbxClientException;
import com.callinsight.processing.queue.BatchResult;
import com.callinsight.processing.queue.ProcessingQueue;
import com.callinsight.processing.queue.QueueRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class BackfillService {

    private static final Logger log = LoggerFactory.getLogger(BackfillService.class);

    static final int PAGE_SIZE = 100;
    static final int MAX_PAGES = 600;

    private final PbxClient pbxClient;
    private final ProcessingCoordinator processingCoordinator;
    private final ProcessingQueue processingQueue;
    private final Clock clock;

    public BackfillService(PbxClient pbxClient,
                           ProcessingCoordinator processingCoordinator,
                           ProcessingQueue processingQueue,
                           Clock clock) {
        this.pbxClient = pbxClient;
        this.processingCoordinator = processingCoordinator;
        this.processingQueue = processingQueue;
        this.clock = clock;
    }

    public BackfillResult backfill(int hours, boolean force) {
        LocalDateTime end = LocalDateTime.now(clock);
        LocalDateTime start = end.minusHours(hours);
        List<CdrRecord> fetched = fetchWindow(start);

        Set<String> seen = new HashSet<>();
        List<QueueRequest> requests = new ArrayList<>();
        int internal = 0;
        int notAnswered = 0;
        int noRecording = 0;
        int alreadyProcessed = 0;
        for (CdrRecord record : fetched) {
            if (record.callId() == null || !seen.add(record.callId())) {
                continue;
            }
            if (record.direction() == CallDirection.INTERNAL) {
                internal++;
                continue;
            }
            if (record.disposition() != CallDisposition.ANSWERED) {
                notAnswered++;
                continue;
            }
            if (!record.hasRecording()) {
                noRecording++;
                continue;
            }
            if (!processingCoordinator.shouldProcess(record.callId(), force)) {
                alreadyProcessed++;
                continue;
            }
            LocalDateTime time = record.startTime();
            if (time != null && (time.isBefore(start) || time.isAfter(end))) {
                continue;
            }
            requests.add(new QueueRequest(record.callId(), record.recordingFile(), force));
        }

        BatchResult batch = processingQueue.addBatch(requests);
        log.info("Backfill of {} h: {} fetched, {} queued, skipped {} internal, {} not answered, {} without recording, {} processed",
                hours, fetched.size(), batch.addedCount(), internal, notAnswered, noRecording, alreadyProcessed);
        return new BackfillResult(
                "queued",
                start,
                end,
                fetched.size(),
                batch.addedCount(),
                internal,
                notAnswered,
                noRecording,
                alreadyProcessed,
                batch.skippedCount(),
                batch.added()
        );
    }

    private List<CdrRecord> fetchWindow(LocalDateTime start) {
        List<CdrRecord> all = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            List<CdrRecord> records;
            try {
                records = pbxClient.listCdrs(page, PAGE_SIZE);
            } catch (PbxClientException ex) {
                if (page == 1) {
                    throw ex;
                }
                log.warn("Backfill stopped at page {}: {}", page, ex.getMessage());
                break;
            }
            if (records.isEmpty()) {
                break;
            }
            all.addAll(records);
            LocalDateTime oldest = records.get(records.size() - 1).startTime();
            if (oldest != null && oldest.isBefore(start)) {
                break;
            }
            if (records.size() < PAGE_SIZE) {
                break;
            }
        }
        return all;
    }
}
