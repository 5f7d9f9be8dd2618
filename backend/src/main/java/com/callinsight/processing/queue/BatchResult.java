package com.callinsight.processing.queue;

import java.util.List;

public record BatchResult(
        String status,
        int addedCount,
        int skippedCount,
        List<String> added,
        List<String> skipped
) {

    public static BatchResult of(List<String> added, List<String> skipped) {
        return new BatchResult("batch_queued", added.size(), skipped.size(), List.copyOf(added), List.copyOf(skipped));
    }
}
