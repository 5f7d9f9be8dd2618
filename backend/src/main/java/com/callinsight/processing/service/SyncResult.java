package com.callinsight.processing.service;

import com.callinsight.processing.queue.BatchResult;

public record SyncResult(
        int pagesFetched,
        int recordsSeen,
        int newRecords,
        BatchResult queued
) {
}
