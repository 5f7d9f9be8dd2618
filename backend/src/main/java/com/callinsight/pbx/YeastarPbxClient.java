package com.callinsight.pbx;

import com.callinsight.calls.model.CdrRecord;
import com.callinsight.config.AppProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class YeastarPbxClient implements PbxClient {

    private static final Logger log = LoggerFactory.getLogger(YeastarPbxClient.class);

    private static final TypeReference<Map<String, Object>> RAW_CDR = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public YeastarPbxClient(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(appProperties.pbx().timeout());
        requestFactory.setReadTimeout(appProperties.pbx().timeout());
        this.restClient = builder.requestFactory(requestFactory).build();
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    @Override
    public List<CdrRecord> listCdrs(int page, int pageSize) {
        JsonNode root = getJson(pageUri("/openapi/v1.0/cdr/list", page, pageSize, "time"));
        List<CdrRecord> records = new ArrayList<>();
        for (JsonNode node : root.path("data")) {
            records.add(CdrRecord.fromPbx(objectMapper.convertValue(node, RAW_CDR)));
        }
        return records;
    }

    @Override
    public List<RecordingEntry> listRecordings(int page, int pageSize) {
        JsonNode root = getJson(pageUri("/openapi/v1.0/recording/list", page, pageSize, "id"));
        List<RecordingEntry> entries = new ArrayList<>();
        for (JsonNode node : root.path("data")) {
            entries.add(new RecordingEntry(node.path("uid").asText(null), node.path("file").asText(null)));
        }
        return entries;
    }

    @Override
    public String resolveDownloadUrl(String recordingFile) {
        URI uri = UriComponentsBuilder.fromHttpUrl(appProperties.pbx().baseUrl())
                .path("/openapi/v1.0/recording/download")
                .queryParam("file", "{file}")
                .queryParam("access_token", "{token}")
                .encode()
                .buildAndExpand(recordingFile, appProperties.pbx().accessToken())
                .toUri();
        JsonNode root = getJson(uri);
        String resource = root.path("download_resource_url").asText("");
        if (resource.isBlank()) {
            throw new PbxClientException("Recording file not available: " + recordingFile);
        }
        return UriComponentsBuilder.fromHttpUrl(appProperties.pbx().baseUrl() + resource)
                .queryParam("access_token", "{token}")
                .encode()
                .buildAndExpand(appProperties.pbx().accessToken())
                .toUriString();
    }

    @Override
    public void download(String downloadUrl, Path target) {
        try {
            restClient.get()
                    .uri(URI.create(downloadUrl))
                    .exchange((request, response) -> {
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new PbxClientException("Recording download failed with HTTP " + response.getStatusCode().value());
                        }
                        try (InputStream body = response.getBody()) {
                            Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return null;
                    });
        } catch (RestClientException ex) {
            throw new PbxClientException("Recording download failed", ex);
        }
        try {
            if (Files.size(target) == 0) {
                throw new PbxClientException("Downloaded recording is empty");
            }
        } catch (IOException ex) {
            throw new PbxClientException("Downloaded recording is unreadable", ex);
        }
    }

    private URI pageUri(String path, int page, int pageSize, String sortBy) {
        return UriComponentsBuilder.fromHttpUrl(appProperties.pbx().baseUrl())
                .path(path)
                .queryParam("page", page)
                .queryParam("page_size", pageSize)
                .queryParam("sort_by", sortBy)
                .queryParam("order_by", "desc")
                .queryParam("access_token", "{token}")
                .encode()
                .buildAndExpand(appProperties.pbx().accessToken())
                .toUri();
    }

    private JsonNode getJson(URI uri) {
        String json;
        try {
            json = restClient.get()
                    .uri(uri)
                    .header("User-Agent", "OpenAPI")
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException ex) {
            throw new PbxClientException("PBX request to " + uri.getPath() + " failed", ex);
        }
        try {
            JsonNode root = objectMapper.readTree(json == null ? "{}" : json);
            int errcode = root.path("errcode").asInt(-1);
            if (errcode != 0) {
                log.warn("PBX returned errcode {} for {}: {}", errcode, uri.getPath(), root.path("errmsg").asText(""));
                throw new PbxClientException("PBX error " + errcode + " for " + uri.getPath());
            }
            return root;
        } catch (IOException ex) {
            throw new PbxClientException("Unreadable PBX response from " + uri.getPath(), ex);
        }
    }
}
