package com.callinsight.processing.dto;

public record WebhookResponse(
        String status,
        String event
) {
}
