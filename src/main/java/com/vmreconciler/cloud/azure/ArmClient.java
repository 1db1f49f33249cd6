package com.vmreconciler.cloud.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vmreconciler.cloud.CloudApiException;
import com.vmreconciler.cloud.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * HTTP client for the Azure Resource Manager REST API.
 *
 * <p>Authenticates with an OAuth2 client-credentials grant against the
 * configured authority and caches the token until shortly before it expires.
 * A 404 is reported as {@link ResourceNotFoundException}, any other error
 * status as {@link CloudApiException} carrying the response body.
 */
public class ArmClient {

    private static final Logger log = LoggerFactory.getLogger(ArmClient.class);

    static final String ASYNC_OPERATION_HEADER = "Azure-AsyncOperation";

    /**
     * Body and long-running operation URL (if any) of a mutating call.
     */
    public record ArmResponse(JsonNode body, String asyncOperationUrl) {}

    private final AzureProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private String accessToken;
    private Instant tokenExpiry = Instant.MIN;

    public ArmClient(AzureProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public Optional<JsonNode> get(String path, String apiVersion) {
        try {
            return Optional.of(getAbsolute(url(path, apiVersion)));
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    public JsonNode getAbsolute(String url) {
        var response = send(authorized(url).GET().build());
        return parse(response.body());
    }

    public ArmResponse put(String path, String apiVersion, JsonNode body) {
        var request = authorized(url(path, apiVersion))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        var response = send(request);
        return new ArmResponse(parse(response.body()), asyncUrl(response));
    }

    public ArmResponse post(String path, String apiVersion) {
        var request = authorized(url(path, apiVersion))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString("{}"))
                .build();
        var response = send(request);
        return new ArmResponse(parse(response.body()), asyncUrl(response));
    }

    public ArmResponse delete(String path, String apiVersion) {
        var response = send(authorized(url(path, apiVersion)).DELETE().build());
        if (response.statusCode() == 204) {
            throw new ResourceNotFoundException(path);
        }
        return new ArmResponse(parse(response.body()), asyncUrl(response));
    }

    private HttpResponse<String> send(HttpRequest request) {
        log.debug("ARM {} {}", request.method(), request.uri());
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                throw new ResourceNotFoundException(request.uri().getPath());
            }
            if (response.statusCode() >= 400) {
                throw new CloudApiException("ARM %s %s failed (HTTP %d)"
                        .formatted(request.method(), request.uri().getPath(), response.statusCode()),
                        response.statusCode(), response.body());
            }
            return response;
        } catch (IOException e) {
            throw new CloudApiException("ARM request failed: %s %s".formatted(request.method(), request.uri()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloudApiException("ARM request interrupted: %s %s".formatted(request.method(), request.uri()), e);
        }
    }

    private HttpRequest.Builder authorized(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("Authorization", "Bearer " + getToken())
                .header("Accept", "application/json");
    }

    private synchronized String getToken() {
        if (accessToken != null && Instant.now().isBefore(tokenExpiry)) {
            return accessToken;
        }
        if (properties.getClientId().isBlank() || properties.getClientSecret().isBlank()) {
            throw new CloudApiException("Azure credentials not configured; set vmreconciler.azure.client-id "
                    + "and vmreconciler.azure.client-secret", 401, null);
        }

        var body = "grant_type=client_credentials&client_id=%s&client_secret=%s&scope=%s".formatted(
                encode(properties.getClientId()), encode(properties.getClientSecret()),
                encode(properties.getManagementUrl() + "/.default"));
        var tokenUrl = "%s/%s/oauth2/v2.0/token".formatted(properties.getAuthorityUrl(), properties.getTenantId());

        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(tokenUrl))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new CloudApiException("Azure token request failed (HTTP %d)".formatted(response.statusCode()),
                        response.statusCode(), response.body());
            }

            var json = objectMapper.readTree(response.body());
            accessToken = json.get("access_token").asText();
            int expiresIn = json.get("expires_in").asInt();
            tokenExpiry = Instant.now().plusSeconds(Math.max(expiresIn - 60, 10));

            log.info("Obtained Azure access token (expires in {}s)", expiresIn);
            return accessToken;
        } catch (IOException e) {
            throw new CloudApiException("Failed to obtain Azure access token", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloudApiException("Interrupted while obtaining Azure access token", e);
        }
    }

    private String url(String path, String apiVersion) {
        return properties.getManagementUrl() + path + "?api-version=" + apiVersion;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CloudApiException("Malformed ARM response: " + body, e);
        }
    }

    private static String asyncUrl(HttpResponse<String> response) {
        return response.headers().firstValue(ASYNC_OPERATION_HEADER).orElse(null);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
