package com.callinsight.processing.service;

import java.util.List;

public record CallAnalysis(
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
        String modelUsed
) {

    public CallAnalysis {
        topics = topics == null ? List.of() : List.copyOf(topics);
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    public CallAnalysis withStaffName(String staffName) {
        return new CallAnalysis(callType, serviceCategory, summary, staffName, customerName, companyName,
                topics, actionItems, resolutionStatus, sentiment, modelUsed);
    }
}
