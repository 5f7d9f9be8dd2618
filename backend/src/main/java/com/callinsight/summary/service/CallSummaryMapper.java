package com.callinsight.summary.service;

import com.callinsight.summary.dto.CallSummaryResponse;
import com.callinsight.summary.model.CallSummaryEntity;

import java.util.List;

public final class CallSummaryMapper {

    private CallSummaryMapper() {
    }

    public static CallSummaryResponse toResponse(CallSummaryEntity entity) {
        return new CallSummaryResponse(
                entity.getCallId(),
                entity.getRecordingFile(),
                entity.getDetectedLanguage(),
                entity.getTranscriptPreview(),
                entity.getCallType(),
                entity.getServiceCategory(),
                entity.getSummary(),
                entity.getStaffName(),
                entity.getCustomerName(),
                entity.getCompanyName(),
                entity.getTopics() == null ? List.of() : List.copyOf(entity.getTopics()),
                entity.getActionItems() == null ? List.of() : List.copyOf(entity.getActionItems()),
                entity.getResolutionStatus(),
                entity.getSentiment(),
                entity.getAnalysisSkipReason(),
                entity.getProcessingSeconds(),
                entity.getModelUsed(),
                entity.getErrorMessage(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
