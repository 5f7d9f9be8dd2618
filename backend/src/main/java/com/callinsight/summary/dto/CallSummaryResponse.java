package com.callinsight.summary.dto;

import java.time.Instant;
import java.util.List;

public record CallSummaryResponse(
        String callId,
        String recordingFile,
        String detectedLanguage,
        String transcriptPreview,
        String callType,
        String serviceCategory,
        String summary,
        String staffName,
        String customerName,
        String companyName,
        List<String> topics,
        List<String> actionItems,
        String resolutionStatus,
        String sentiment,
        String analysisSkipReason,
        Double processingSeconds,
        String modelUsed,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {
}
