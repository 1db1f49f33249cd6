package com.vmreconciler.cloud.azure;

import com.vmreconciler.cloud.BlobApi;
import com.vmreconciler.cloud.BlobProperties;
import com.vmreconciler.cloud.BlobRef;
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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BlobApi} over the Blob service REST API, authorized with a SAS token
 * per storage account.
 */
public class AzureBlobApi implements BlobApi {

    private static final Logger log = LoggerFactory.getLogger(AzureBlobApi.class);

    private static final String META_PREFIX = "x-ms-meta-";

    private final AzureProperties azure;
    private final HttpClient httpClient;

    public AzureBlobApi(AzureProperties azure) {
        this.azure = azure;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public Optional<BlobProperties> getProperties(BlobRef blob) {
        var request = request(blob, null)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            var response = send(request);
            var metadata = new LinkedHashMap<String, String>();
            response.headers().map().forEach((name, values) -> {
                if (name.toLowerCase().startsWith(META_PREFIX) && !values.isEmpty()) {
                    metadata.put(name.substring(META_PREFIX.length()), values.get(0));
                }
            });
            long length = response.headers().firstValueAsLong("Content-Length").orElse(0);
            return Optional.of(new BlobProperties(length, response.headers().firstValue("ETag").orElse(null), metadata));
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public void deleteBlob(BlobRef blob) {
        send(request(blob, null).DELETE().build());
    }

    @Override
    public String snapshotBlob(BlobRef blob, Map<String, String> metadata) {
        var builder = request(blob, "comp=snapshot");
        metadata.forEach((key, value) -> builder.header(META_PREFIX + key, value));
        var response = send(builder.PUT(HttpRequest.BodyPublishers.noBody()).build());
        return response.headers().firstValue("x-ms-snapshot")
                .orElseThrow(() -> new CloudApiException("snapshot response for %s carries no snapshot id"
                        .formatted(blob.name()), response.statusCode(), response.body()));
    }

    @Override
    public void copyBlob(BlobRef target, String sourceUrl) {
        var source = sourceUrl + (sourceUrl.contains("?") ? "&" : "?") + sas(target.account());
        var request = request(target, null)
                .header("x-ms-copy-source", source)
                .PUT(HttpRequest.BodyPublishers.noBody())
                .build();
        send(request);
    }

    private HttpRequest.Builder request(BlobRef blob, String extraQuery) {
        var query = new StringBuilder(sas(blob.account()));
        if (blob.isSnapshot()) {
            query.append("&snapshot=").append(URLEncoder.encode(blob.snapshotId(), StandardCharsets.UTF_8));
        }
        if (extraQuery != null) {
            query.append('&').append(extraQuery);
        }
        var url = "https://%s.%s/%s/%s?%s".formatted(blob.account(), azure.getBlobEndpointSuffix(),
                blob.container(), blob.name(), query);
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("x-ms-version", azure.getStorageApiVersion());
    }

    private HttpResponse<String> send(HttpRequest request) {
        log.debug("Blob {} {}", request.method(), request.uri().getPath());
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                throw new ResourceNotFoundException(request.uri().getPath());
            }
            if (response.statusCode() >= 400) {
                throw new CloudApiException("Blob %s %s failed (HTTP %d)"
                        .formatted(request.method(), request.uri().getPath(), response.statusCode()),
                        response.statusCode(), response.body());
            }
            return response;
        } catch (IOException e) {
            throw new CloudApiException("Blob request failed: %s %s".formatted(request.method(), request.uri().getPath()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CloudApiException("Blob request interrupted: " + request.uri().getPath(), e);
        }
    }

    private String sas(String account) {
        var token = azure.getSasTokens().get(account);
        if (token == null || token.isBlank()) {
            throw new CloudApiException("no SAS token configured for storage account " + account, 403, null);
        }
        return token.startsWith("?") ? token.substring(1) : token;
    }
}
