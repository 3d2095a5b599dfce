package app.threejs.catalog.client.sketchfab;

import app.threejs.catalog.auth.TokenLifecycle;
import app.threejs.catalog.support.FailureKind;
import app.threejs.catalog.support.SketchfabException;
import app.threejs.catalog.support.ZipArchives;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

@Component
public class SketchfabClient {

    private static final Logger log = LoggerFactory.getLogger(SketchfabClient.class);

    static final int DEFAULT_SEARCH_LIMIT = 10;
    static final int MAX_SEARCH_LIMIT = 24;

    private final RestClient restClient;
    private final RestClient downloadRestClient;
    private final TokenLifecycle tokenLifecycle;

    public SketchfabClient(@Qualifier("sketchfabRestClient") RestClient restClient,
                           @Qualifier("sketchfabDownloadRestClient") RestClient downloadRestClient,
                           TokenLifecycle tokenLifecycle) {
        this.restClient = restClient;
        this.downloadRestClient = downloadRestClient;
        this.tokenLifecycle = tokenLifecycle;
    }

    /**
     * Searches the catalog and returns only downloadable models. Failures are logged and
     * reported as an empty result.
     */
    public List<ModelSummary> search(String query, Integer limit) {
        int count = effectiveLimit(limit);
        String q = query == null ? "" : query;
        try {
            log.info("Search request params: q={}, count={}", q, count);
            JsonNode response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/search")
                            .queryParam("q", "{q}")
                            .queryParam("count", "{count}")
                            .build(Map.of("q", q, "count", count)))
                    .retrieve()
                    .body(JsonNode.class);
            return SketchfabResponseParser.downloadableModels(response);
        } catch (RestClientException | IllegalArgumentException ex) {
            log.error("Failed to search Sketchfab: {}", ex.getMessage());
            return List.of();
        }
    }

    public ModelDetail getModel(String modelId) {
        log.info("Get model request for ID: {}", modelId);
        try {
            JsonNode response = authorized(restClient.get().uri("/models/{id}", modelId))
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null || !response.isObject()) {
                throw new IllegalStateException("Model response is empty");
            }
            return SketchfabResponseParser.toDetail(modelId, response);
        } catch (RestClientException | IllegalStateException ex) {
            log.error("Failed to get model details: {}", ex.getMessage());
            throw new SketchfabException(FailureKind.REMOTE_REQUEST_FAILED,
                    "Failed to get model details: " + ex.getMessage(), ex);
        }
    }

    public Map<String, DownloadLink> resolveDownloadLinks(String modelId) {
        if (!tokenLifecycle.current().hasAccessToken()) {
            log.error("Failed to get download link: no access token configured");
            throw new SketchfabException(FailureKind.AUTH_REQUIRED,
                    "OAuth2 access token is required for downloading models");
        }
        log.info("Get download link request for ID: {}", modelId);
        try {
            JsonNode response = authorized(restClient.get().uri("/models/{id}/download", modelId))
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null || !response.isObject()) {
                throw new IllegalStateException("Download response is empty");
            }
            return SketchfabResponseParser.downloadLinks(response);
        } catch (RestClientException | IllegalStateException ex) {
            log.error("Failed to get download link: {}", ex.getMessage());
            throw new SketchfabException(FailureKind.REMOTE_REQUEST_FAILED,
                    "Failed to get download link: " + ex.getMessage(), ex);
        }
    }

    /**
     * Downloads {@code url} to {@code destination}, or to a fresh temp file when no destination
     * is given. Zip payloads are recognised by their local file header and unpacked next to the
     * download in {@code <destination>_extracted}.
     */
    public DownloadResult download(String url, Path destination) {
        log.info("Downloading model from URL: {}", url);
        Path staging = null;
        try {
            staging = Files.createTempFile("sketchfab-download-", ".part");
            Path target = staging;
            int status = downloadRestClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> {
                        int code = response.getStatusCode().value();
                        log.info("Download response status: {}", code);
                        log.info("Download content type: {}", response.getHeaders().getContentType());
                        log.info("Download content length: {}", response.getHeaders().getFirst(HttpHeaders.CONTENT_LENGTH));
                        if (response.getStatusCode().is2xxSuccessful()) {
                            try (InputStream body = response.getBody()) {
                                Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                            }
                        }
                        return code;
                    });
            if (status < 200 || status >= 300) {
                throw new IOException("Download returned HTTP " + status);
            }

            boolean isArchive = ZipArchives.hasZipSignature(staging);
            Path localPath = destination != null
                    ? destination
                    : Files.createTempFile("sketchfab-model-", isArchive ? ".zip" : "");
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.move(staging, localPath, StandardCopyOption.REPLACE_EXISTING);
            staging = null;

            if (!isArchive) {
                return new DownloadResult(localPath, false, null, List.of());
            }
            Path extractedDir = Path.of(localPath + "_extracted");
            List<String> entries = ZipArchives.extract(localPath, extractedDir);
            log.info("Extracted {} entries to {}", entries.size(), extractedDir);
            return new DownloadResult(localPath, true, extractedDir, List.copyOf(entries));
        } catch (IOException | RestClientException | IllegalArgumentException ex) {
            log.error("Failed to download model: {}", ex.getMessage());
            throw new SketchfabException(FailureKind.DOWNLOAD_FAILED,
                    "Failed to download model: " + ex.getMessage(), ex);
        } finally {
            deleteStaging(staging);
        }
    }

    static int effectiveLimit(Integer limit) {
        if (limit == null || limit == 0) {
            return DEFAULT_SEARCH_LIMIT;
        }
        return Math.max(1, Math.min(limit, MAX_SEARCH_LIMIT));
    }

    private RestClient.RequestHeadersSpec<?> authorized(RestClient.RequestHeadersSpec<?> request) {
        tokenLifecycle.ensureValid();
        String token = tokenLifecycle.current().accessToken();
        if (token.isEmpty()) {
            log.info("No access token available, making unauthenticated request");
            return request;
        }
        log.debug("Using OAuth2 authentication header");
        return request.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    private void deleteStaging(Path staging) {
        if (staging == null) {
            return;
        }
        try {
            Files.deleteIfExists(staging);
        } catch (IOException ex) {
            log.warn("Failed to delete staging file {}: {}", staging, ex.getMessage());
        }
    }
}
