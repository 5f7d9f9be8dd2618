package com.callinsight.processing.adapter;

import com.callinsight.config.AppProperties;
import com.callinsight.processing.service.RecordingProcessingException;
import com.callinsight.processing.service.TranscriptionAdapter;
import com.callinsight.processing.service.TranscriptionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

@Component
public class OpenAiTranscriptionAdapter implements TranscriptionAdapter {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public OpenAiTranscriptionAdapter(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setReadTimeout(appProperties.transcription().timeout());
        this.restClient = builder.requestFactory(requestFactory).build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public TranscriptionResult transcribe(Path filePath) {
        AppProperties.Transcription settings = appProperties.transcription();
        if (settings.baseUrl() == null || settings.baseUrl().isBlank()) {
            throw new RecordingProcessingException("Transcription service is not configured");
        }
        Instant start = Instant.now();

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("model", settings.model());
        // verbose_json is rejected by some model variants; json works everywhere
        body.add("response_format", "json");
        body.add("file", new FileSystemResource(filePath));

        RestClient.RequestBodySpec request = restClient.post()
                .uri(settings.baseUrl() + "/v1/audio/transcriptions")
                .contentType(MediaType.MULTIPART_FORM_DATA);
        if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
            request = request.header("Authorization", "Bearer " + settings.apiKey());
        }

        try {
            String rawResponse = request.body(body).retrieve().body(String.class);

            String text;
            String language = "unknown";
            String trimmed = rawResponse == null ? "" : rawResponse.trim();
            if (trimmed.startsWith("{")) {
                JsonNode root = objectMapper.readTree(trimmed);
                text = root.path("text").asText();
                language = root.path("language").asText("unknown");
            } else {
                text = trimmed;
            }

            long latencyMs = Duration.between(start, Instant.now()).toMillis();
            return new TranscriptionResult(language, text == null ? "" : text.trim(), settings.model(), latencyMs);
        } catch (Exception exception) {
            throw new RecordingProcessingException("Transcription request failed", exception);
        }
    }
}
