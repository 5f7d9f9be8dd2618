package com.callinsight.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Jwt jwt,
        Pbx pbx,
        Transcription transcription,
        Analysis analysis,
        Queue queue,
        Inference inference,
        AutoProcess autoProcess,
        Poller poller,
        CdrSync cdrSync
) {

    public record Jwt(
            String issuer,
            String secret
    ) {}

    public record Pbx(
            String baseUrl,
            String accessToken,
            String webhookToken,
            Duration timeout
    ) {}

    public record Transcription(
            String baseUrl,
            String apiKey,
            String model,
            Duration timeout
    ) {}

    public record Analysis(
            String baseUrl,
            String model,
            int contextLength,
            Duration timeout
    ) {}

    public record Queue(
            Duration backoffBase,
            int historySize,
            Duration maxResidency,
            Duration stopTimeout
    ) {}

    public record Inference(
            int maxConcurrent,
            Duration acquireTimeout,
            Duration callTimeout,
            int poolSize
    ) {}

    public record AutoProcess(
            boolean enabled,
            boolean internalCalls,
            Duration webhookDelay
    ) {}

    public record Poller(
            boolean enabled,
            Duration initialDelay,
            Duration interval,
            Duration errorBackoff,
            int pageSize
    ) {}

    public record CdrSync(
            boolean enabled,
            boolean onStartup,
            int startupPages,
            int periodicPages,
            int pageSize,
            Duration interval
    ) {}
}
