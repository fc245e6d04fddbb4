package com.sweepwatch.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sweepwatch.dispatch.client.ClientProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Blocking JSON client for the sweep REST API, used by the CLI commands.
 */
@Component
public class SweepApiClient {

    static final String SWEEP_PATH = "/api/v1/sweep";

    /** Status code and parsed JSON body of one call. */
    public record ApiResponse(int status, JsonNode body) {
        public boolean ok() {
            return status >= 200 && status < 300;
        }

        public String text(String field) {
            JsonNode node = body.path(field);
            return node.isMissingNode() || node.isNull() ? "-" : node.asText();
        }
    }

    private final ClientProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public SweepApiClient(ClientProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .build();
    }

    public ApiResponse get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    public ApiResponse post(String path, Object body) throws IOException, InterruptedException {
        String json = body == null ? "{}" : objectMapper.writeValueAsString(body);
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(request);
    }

    public URI dataStreamUri(String types) {
        String query = types == null || types.isBlank() ? "" : "?types=" + types;
        return uri(SWEEP_PATH + "/data-stream" + query);
    }

    public String baseUrl() {
        return properties.getBaseUrl();
    }

    private URI uri(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }

    private ApiResponse send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String raw = response.body();
        JsonNode body = raw == null || raw.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(raw);
        return new ApiResponse(response.statusCode(), body);
    }
}
