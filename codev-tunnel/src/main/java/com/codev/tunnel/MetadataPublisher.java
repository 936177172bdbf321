package com.codev.tunnel;

import com.codev.common.infra.ErrorUtils;
import com.codev.common.logging.LogRedact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort push of the metadata snapshot to the relay API
 * ({@code POST <serverUrl>/api/tower/metadata}) each time the tunnel connects.
 * Failures are logged and otherwise ignored; the relay can still poll the snapshot
 * through the tunnel.
 */
@Slf4j
class MetadataPublisher {

    static final String METADATA_API_PATH = "/api/tower/metadata";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final URI endpoint;
    private final String apiKey;

    MetadataPublisher(String serverUrl, String apiKey, ObjectMapper mapper) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(TIMEOUT)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), serverUrl, apiKey, mapper);
    }

    MetadataPublisher(HttpClient client, String serverUrl, String apiKey, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
        this.endpoint = URI.create(serverUrl).resolve(METADATA_API_PATH);
        this.apiKey = apiKey;
    }

    URI getEndpoint() {
        return endpoint;
    }

    /**
     * Post the snapshot. The returned future completes with the HTTP status, or -1 when
     * the request could not be sent; it never completes exceptionally.
     */
    CompletableFuture<Integer> publish(TowerMetadata metadata) {
        String body;
        try {
            body = mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tower metadata: {}", e.getMessage());
            return CompletableFuture.completedFuture(-1);
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    if (response.statusCode() >= 300) {
                        log.debug("Metadata push to {} answered {}", endpoint, response.statusCode());
                    }
                    return response.statusCode();
                })
                .exceptionally(err -> {
                    log.debug("Metadata push to {} failed: {}", endpoint,
                            LogRedact.redactSensitiveText(ErrorUtils.formatRootCause(err)));
                    return -1;
                });
    }
}
