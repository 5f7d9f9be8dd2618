package com.callinsight.processing.adapter;

import com.callinsight.config.AppProperties;
import com.callinsight.processing.service.AnalysisAdapter;
import com.callinsight.processing.service.CallAnalysis;
import com.callinsight.processing.service.RecordingProcessingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class OllamaAnalysisAdapter implements AnalysisAdapter {

    private static final String PROMPT_TEMPLATE = """
            Analyze this phone call transcript between a STAFF member and a CUSTOMER.

            Recording context:
            %s

            Transcript:
            %s

            Respond with a single JSON object and nothing else, using these keys:
            {
              "call_type": "inquiry|complaint|follow_up|booking|support|sales|other",
              "service_category": "short category name",
              "summary": "two or three sentences describing the call",
              "staff_name": "name or null",
              "customer_name": "name or null",
              "company_name": "name or null",
              "topics": ["topic"],
              "action_items": ["action"],
              "resolution_status": "resolved|pending|escalated|unclear",
              "sentiment": "positive|neutral|negative"
            }
            Only use facts stated in the transcript.
            """;

    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([]}])");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public OllamaAnalysisAdapter(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setReadTimeout(appProperties.analysis().timeout());
        this.restClient = builder.requestFactory(requestFactory).build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public CallAnalysis analyze(String transcript, String recordingContext) {
        if (transcript == null || transcript.isBlank()) {
            throw new IllegalArgumentException("Transcript cannot be empty");
        }
        AppProperties.Analysis settings = appProperties.analysis();
        if (settings.baseUrl() == null || settings.baseUrl().isBlank()) {
            throw new RecordingProcessingException("Analysis model is not configured");
        }

        String context = recordingContext == null || recordingContext.isBlank()
                ? "No additional context available."
                : recordingContext;
        Map<String, Object> payload = Map.of(
                "model", settings.model(),
                "stream", false,
                "prompt", PROMPT_TEMPLATE.formatted(context, transcript),
                "options", Map.of(
                        "temperature", 0.3,
                        "num_predict", 2000,
                        "num_ctx", settings.contextLength()
                )
        );

        String json;
        try {
            json = restClient.post()
                    .uri(settings.baseUrl() + "/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException exception) {
            throw new RecordingProcessingException("Analysis request failed", exception);
        }

        try {
            JsonNode root = objectMapper.readTree(json == null ? "{}" : json);
            String response = root.path("response").asText();
            if (response == null || response.isBlank()) {
                throw new RecordingProcessingException("Analysis model returned an empty response");
            }
            return toAnalysis(extractObject(response), settings.model());
        } catch (JsonProcessingException exception) {
            throw new RecordingProcessingException("Analysis model returned unparseable output", exception);
        }
    }

    JsonNode extractObject(String modelText) throws JsonProcessingException {
        int start = modelText.indexOf('{');
        int end = modelText.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new RecordingProcessingException("Analysis model output contains no JSON object");
        }
        String candidate = modelText.substring(start, end + 1);
        candidate = TRAILING_COMMA.matcher(candidate).replaceAll("$1");
        candidate = CONTROL_CHARS.matcher(candidate).replaceAll("");
        return objectMapper.readTree(candidate);
    }

    private static CallAnalysis toAnalysis(JsonNode data, String model) {
        String sentiment = text(data, "sentiment");
        if (sentiment == null) {
            sentiment = text(data.path("mood_sentiment_analysis"), "overall_sentiment");
        }
        return new CallAnalysis(
                text(data, "call_type"),
                text(data, "service_category"),
                text(data, "summary"),
                text(data, "staff_name"),
                text(data, "customer_name"),
                text(data, "company_name"),
                list(data.path("topics")),
                list(data.path("action_items")),
                text(data, "resolution_status"),
                sentiment,
                model
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
    }

    private static List<String> list(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                String value = item.isTextual() ? item.asText() : item.toString();
                if (!value.isBlank()) {
                    values.add(value);
                }
            });
        }
        return values;
    }
}
