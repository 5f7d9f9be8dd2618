package com.callinsight.processing.service;

public record TranscriptionResult(
        String detectedLanguage,
        String text,
        String providerModel,
        long latencyMs
) {
}
