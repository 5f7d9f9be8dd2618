package com.callinsight.processing.service;

import java.time.LocalDateTime;
import java.util.List;

public record BackfillResult(
        String status,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        int totalCdrsFetched,
        int callsToProcess,
        int skippedInternal,
        int skippedNotAnswered,
        int skippedNoRecording,
        int skippedAlreadyProcessed,
        int skippedAlreadyQueued,
        List<String> callIds
) {
}
