package com.callinsight.processing.queue;

import java.util.List;

public record ClearResult(
        int clearedCount,
        List<String> callIds
) {
}
