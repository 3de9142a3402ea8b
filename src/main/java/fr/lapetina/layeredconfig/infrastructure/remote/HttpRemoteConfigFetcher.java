package fr.lapetina.layeredconfig.infrastructure.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.layeredconfig.domain.model.RemoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Fetches configuration over HTTP.
 *
 * Uses java.net.http.HttpClient. Three dialects are supported:
 * - PLAIN: GET {@code <endpoint><path>}, body is the JSON payload
 * - CONSUL: GET {@code <endpoint>/v1/kv/<path>?raw}
 * - ETCD3: POST {@code <endpoint>/v3/kv/range} on the gRPC gateway, value is base64 in the response
 */
public final class HttpRemoteConfigFetcher implements RemoteConfigFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteConfigFetcher.class);

    public enum Dialect {
        PLAIN,
        CONSUL,
        ETCD3
    }

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Dialect dialect;
    private final String defaultScheme;
    private final Duration requestTimeout;

    public HttpRemoteConfigFetcher(Dialect dialect, String defaultScheme, Duration connectTimeout, Duration requestTimeout) {
        this.dialect = dialect;
        this.defaultScheme = defaultScheme;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public HttpRemoteConfigFetcher(Dialect dialect) {
        this(dialect, "http", Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    @Override
    public byte[] fetch(RemoteProvider provider) throws IOException {
        HttpRequest request = buildRequest(provider);
        log.debug("Fetching remote configuration: dialect={}, uri={}", dialect, request.uri());

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + request.uri());
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new IOException("No configuration found at " + request.uri());
        }
        if (status < 200 || status >= 300) {
            throw new IOException("Unexpected HTTP status " + status + " from " + request.uri());
        }

        if (dialect == Dialect.ETCD3) {
            return extractEtcdValue(response.body(), provider);
        }
        return response.body();
    }

    HttpRequest buildRequest(RemoteProvider provider) throws IOException {
        String base = baseUri(provider.endpoint());
        String key = stripLeadingSlash(provider.path());

        return switch (dialect) {
            case PLAIN -> HttpRequest.newBuilder(URI.create(base + "/" + key))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            case CONSUL -> HttpRequest.newBuilder(URI.create(base + "/v1/kv/" + key + "?raw"))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            case ETCD3 -> {
                String encodedKey = Base64.getEncoder()
                        .encodeToString(provider.path().getBytes(StandardCharsets.UTF_8));
                String body = objectMapper.writeValueAsString(Map.of("key", encodedKey));
                yield HttpRequest.newBuilder(URI.create(base + "/v3/kv/range"))
                        .timeout(requestTimeout)
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build();
            }
        };
    }

    private byte[] extractEtcdValue(byte[] body, RemoteProvider provider) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode kvs = root.path("kvs");
        if (!kvs.isArray() || kvs.isEmpty()) {
            throw new IOException("Key not found in etcd: " + provider.path());
        }
        String value = kvs.get(0).path("value").asText("");
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed etcd value for key: " + provider.path(), e);
        }
    }

    private String baseUri(String endpoint) {
        String base = endpoint.contains("://") ? endpoint : defaultScheme + "://" + endpoint;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private static String stripLeadingSlash(String path) {
        String result = path;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        return result;
    }
}
