package com.callinsight.processing.dto;

import com.callinsight.summary.dto.CallSummaryResponse;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessCallResponse(
        String status,
        String callId,
        Integer position,
        CallSummaryResponse summary
) {

    public static ProcessCallResponse alreadyProcessed(String callId, CallSummaryResponse summary) {
        return new ProcessCallResponse("already_processed", callId, null, summary);
    }

    public static ProcessCallResponse processing(String callId) {
        return new ProcessCallResponse("processing", callId, null, null);
    }
}
