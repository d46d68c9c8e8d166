package me.internalizable.modmanager.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.internalizable.modmanager.config.ModManagerConfig;
import me.internalizable.modmanager.environment.ModLoader;
import me.internalizable.modmanager.registry.model.Project;
import me.internalizable.modmanager.registry.model.SearchHit;
import me.internalizable.modmanager.registry.model.SearchResponse;
import me.internalizable.modmanager.registry.model.Version;
import me.internalizable.modmanager.registry.model.VersionFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * {@link ModRegistry} backed by the Modrinth v2 REST API.
 *
 * <p>Metadata requests go through a {@link ResponseCache}. Every exchange,
 * including reading the body, is bounded by a timeout; downloads use a
 * separate, longer one.</p>
 */
public class ModrinthClient implements ModRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModrinthClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<List<Version>> VERSION_LIST = new TypeReference<>() {};

    private final String baseUrl;
    private final String expectedHost;
    private final String userAgent;
    private final Duration requestTimeout;
    private final Duration downloadTimeout;
    private final HttpClient http;
    private final ResponseCache cache;

    /**
     * Create a client.
     *
     * @param config registry settings
     * @param clock clock for cache expiry
     */
    public ModrinthClient(@Nonnull ModManagerConfig.RegistryConfig config, @Nonnull Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        this.baseUrl = stripTrailingSlash(config.getBaseUrl());
        this.expectedHost = config.getExpectedHost().toLowerCase(Locale.ROOT);
        this.userAgent = config.getUserAgent();
        this.requestTimeout = Duration.ofSeconds(Math.max(1, config.getRequestTimeoutSeconds()));
        this.downloadTimeout = Duration.ofSeconds(Math.max(1, config.getDownloadTimeoutSeconds()));
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(1, config.getConnectTimeoutSeconds())))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.cache = new ResponseCache(Duration.ofSeconds(Math.max(0, config.getCacheTtlSeconds())), clock);
    }

    // ==================== Reference normalization ====================

    /**
     * Turn a project page URL into a slug; anything else is returned trimmed.
     *
     * @param slugOrUrl slug, id or URL
     * @return the slug
     * @throws RegistryException if the URL does not point at a project on the registry host
     */
    @Nonnull
    public String normalizeReference(@Nonnull String slugOrUrl) throws RegistryException {
        String value = slugOrUrl.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return value;
        }

        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new RegistryException(RegistryException.Kind.INVALID_REFERENCE, "Malformed URL: " + value, e);
        }

        String host = uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : "";
        if (!host.equals(expectedHost) && !host.endsWith("." + expectedHost)) {
            throw new RegistryException(RegistryException.Kind.INVALID_REFERENCE, "Unsupported URL: " + value);
        }

        String path = uri.getPath() != null ? uri.getPath() : "";
        String[] parts = path.replaceAll("^/+|/+$", "").split("/");
        if (parts.length >= 2 && (parts[0].equals("mod") || parts[0].equals("project")) && !parts[1].isBlank()) {
            return parts[1];
        }
        throw new RegistryException(RegistryException.Kind.INVALID_REFERENCE, "Could not extract slug from URL: " + value);
    }

    // ==================== Metadata ====================

    @Override
    @Nonnull
    public Project getProject(@Nonnull String slugOrUrl) throws RegistryException {
        String slug = normalizeReference(slugOrUrl);
        return fetch("project/" + encode(slug), Map.of(), body -> MAPPER.readValue(body, Project.class));
    }

    @Override
    @Nonnull
    public List<Version> getVersions(@Nonnull String slug, @Nullable String gameVersion, @Nullable ModLoader loader)
            throws RegistryException {
        String normalized = normalizeReference(slug);
        Map<String, String> params = new LinkedHashMap<>();
        if (gameVersion != null) {
            params.put("game_versions", jsonArray(gameVersion));
        }
        if (loader != null) {
            params.put("loaders", jsonArray(loader.getId()));
        }
        return fetch("project/" + encode(normalized) + "/version", params, body -> MAPPER.readValue(body, VERSION_LIST));
    }

    @Override
    @Nonnull
    public Version getVersion(@Nonnull String versionId) throws RegistryException {
        return fetch("version/" + encode(versionId), Map.of(), body -> MAPPER.readValue(body, Version.class));
    }

    @Override
    @Nonnull
    public List<SearchHit> searchProjects(@Nonnull String query, @Nullable String gameVersion, int limit)
            throws RegistryException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("limit", String.valueOf(Math.max(1, limit)));
        if (gameVersion != null) {
            params.put("facets", "[[\"versions:" + gameVersion + "\"]]");
        }
        return fetch("search", params, body -> MAPPER.readValue(body, SearchResponse.class).hits());
    }

    /**
     * Drop all cached responses.
     */
    public void clearCache() {
        cache.clear();
    }

    private <T> T fetch(String endpoint, Map<String, String> params, BodyDecoder<T> decoder) throws RegistryException {
        String key = ResponseCache.key(endpoint, params);
        String cached = cache.get(key);
        if (cached != null) {
            return decode(endpoint, cached, decoder);
        }

        String body = send(endpoint, params);
        T value = decode(endpoint, body, decoder);
        cache.put(key, body);
        return value;
    }

    private <T> T decode(String endpoint, String body, BodyDecoder<T> decoder) throws RegistryException {
        try {
            return decoder.decode(body);
        } catch (JsonProcessingException e) {
            throw new RegistryException(RegistryException.Kind.MALFORMED_RESPONSE,
                    "Malformed response from " + endpoint + ": " + e.getOriginalMessage(), e);
        }
    }

    private String send(String endpoint, Map<String, String> params) throws RegistryException {
        URI uri = URI.create(baseUrl + "/" + endpoint + query(params));
        HttpRequest request = baseGet(uri, requestTimeout)
                .header("Accept", "application/json")
                .build();

        LOGGER.debug("HTTP GET {}", uri);
        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = exchange(request, HttpResponse.BodyHandlers.ofString(), requestTimeout);
        } catch (HttpTimeoutException | TimeoutException e) {
            throw new RegistryException(RegistryException.Kind.TIMEOUT, "Request timed out: " + endpoint, e);
        } catch (IOException e) {
            throw new RegistryException(RegistryException.Kind.NETWORK, "Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException(RegistryException.Kind.NETWORK, "Interrupted while requesting " + endpoint, e);
        }

        long tookMs = (System.nanoTime() - start) / 1_000_000L;
        int code = response.statusCode();
        LOGGER.debug("HTTP {} {} in {} ms", code, endpoint, tookMs);

        if (code == 404) {
            throw new RegistryException(RegistryException.Kind.NOT_FOUND, "Not found: " + endpoint);
        }
        if (code == 429) {
            throw new RegistryException(RegistryException.Kind.RATE_LIMITED, "Registry rate limit exceeded");
        }
        if (code < 200 || code >= 300) {
            throw new RegistryException(RegistryException.Kind.HTTP_ERROR,
                    "Registry error (" + code + "): " + response.body());
        }
        return response.body();
    }

    // ==================== Downloads ====================

    @Override
    public boolean download(@Nonnull VersionFile file, @Nonnull Path destination) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(destination, "destination");

        Path temp = destination.resolveSibling(destination.getFileName() + ".part");
        long start = System.nanoTime();
        try {
            URI uri = URI.create(file.url());
            HttpRequest request = baseGet(uri, downloadTimeout)
                    .header("Accept", "application/octet-stream")
                    .build();

            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // Only a 200 body is written to disk
            HttpResponse.BodyHandler<Path> handler = info -> info.statusCode() == 200
                    ? HttpResponse.BodySubscribers.ofFile(temp,
                            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)
                    : HttpResponse.BodySubscribers.<Path>replacing(null);

            LOGGER.info("Downloading {}", file.filename());
            HttpResponse<Path> response = exchange(request, handler, downloadTimeout);
            int code = response.statusCode();
            if (code != 200) {
                LOGGER.error("Download of {} failed: HTTP {}", file.filename(), code);
                return false;
            }

            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            long tookMs = (System.nanoTime() - start) / 1_000_000L;
            LOGGER.info("Downloaded {} ({} bytes) in {} ms", file.filename(), Files.size(destination), tookMs);
            return true;

        } catch (HttpTimeoutException | TimeoutException e) {
            LOGGER.error("Download of {} timed out after {} s", file.filename(), downloadTimeout.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Download of {} interrupted", file.filename());
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.error("Download of {} failed: {}", file.filename(), e.toString());
        }

        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOGGER.warn("Failed to remove partial download {}: {}", temp, e.getMessage());
        }
        return false;
    }

    @Override
    public boolean isReachable() {
        HttpRequest request = baseGet(URI.create(baseUrl), requestTimeout).build();
        try {
            HttpResponse<Void> response = exchange(request, HttpResponse.BodyHandlers.discarding(), requestTimeout);
            return response.statusCode() < 500;
        } catch (IOException | TimeoutException e) {
            LOGGER.warn("Registry not reachable: {}", e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Helpers ====================

    /**
     * Send a request and wait for the whole response, body included.
     * {@link HttpRequest#timeout} only bounds the wait for headers, so the
     * exchange as a whole is bounded here and cancelled when the deadline passes.
     */
    private <T> HttpResponse<T> exchange(HttpRequest request, HttpResponse.BodyHandler<T> handler, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        CompletableFuture<HttpResponse<T>> future = http.sendAsync(request, handler);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException(cause);
        }
    }

    private HttpRequest.Builder baseGet(URI uri, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET();
    }

    private static String query(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        return "?" + params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String jsonArray(String value) throws RegistryException {
        try {
            return MAPPER.writeValueAsString(List.of(value));
        } catch (JsonProcessingException e) {
            throw new RegistryException(RegistryException.Kind.MALFORMED_RESPONSE, "Cannot encode filter " + value, e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        String result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @FunctionalInterface
    private interface BodyDecoder<T> {
        T decode(String body) throws JsonProcessingException;
    }
}
