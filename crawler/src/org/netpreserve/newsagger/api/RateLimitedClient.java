package org.netpreserve.newsagger.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.newsagger.NewsaggerException;
import org.netpreserve.newsagger.config.ApiConfig;
import org.netpreserve.newsagger.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.BooleanSupplier;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The only path by which requests reach the archive. Every request waits out any CAPTCHA cooling-off, then keeps
 * at least {@link #requestDelay()} since the previous request, then retries 429s and network failures with their own
 * backoff policies. CAPTCHA challenges are never retried here.
 */
public class RateLimitedClient {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedClient.class);
    public static final Duration MIN_REQUEST_DELAY = Duration.ofSeconds(3);
    private static final Duration DOWNLOAD_RETRY_DELAY = Duration.ofSeconds(2);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final HttpClient httpClient;
    private final GlobalCaptchaManager captchaManager;
    private final Clock clock;
    private final Sleeper sleeper;
    private final URI baseUrl;
    private final Duration requestDelay;
    private final Duration timeout;
    private final Duration downloadTimeout;
    private final String userAgent;
    private final Duration captchaPollInterval;
    private final RetryPolicy networkRetry;
    private final RetryPolicy downloadRetry;
    private final RetryPolicy rateLimitRetry;
    private @Nullable Instant lastRequestAt;

    public RateLimitedClient(ApiConfig config, GlobalCaptchaManager captchaManager) {
        this(config, captchaManager, HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build(),
                Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimitedClient(ApiConfig config, GlobalCaptchaManager captchaManager, HttpClient httpClient,
                             Clock clock, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.captchaManager = captchaManager;
        this.clock = clock;
        this.sleeper = sleeper;
        this.baseUrl = config.baseUrl();
        this.timeout = config.timeout();
        this.downloadTimeout = config.downloadTimeout();
        this.userAgent = config.userAgent();
        this.captchaPollInterval = config.captchaPollInterval();
        this.networkRetry = RetryPolicy.network(config.maxRetries(), config.networkRetryDelay());
        this.downloadRetry = RetryPolicy.network(config.maxRetries(), DOWNLOAD_RETRY_DELAY);
        this.rateLimitRetry = RetryPolicy.rateLimit(config.maxRetries(), config.rateLimitBackoff(),
                config.rateLimitMaxBackoff());
        if (config.requestDelay() == null || config.requestDelay().compareTo(MIN_REQUEST_DELAY) < 0) {
            log.warn("Request delay {} is below the {}s minimum, using the minimum", config.requestDelay(),
                    MIN_REQUEST_DELAY.toSeconds());
            this.requestDelay = MIN_REQUEST_DELAY;
        } else {
            this.requestDelay = config.requestDelay();
        }
    }

    public Duration requestDelay() {
        return requestDelay;
    }

    public URI baseUrl() {
        return baseUrl;
    }

    public GlobalCaptchaManager captchaManager() {
        return captchaManager;
    }

    /**
     * Fetches a JSON endpoint.
     *
     * @param endpoint path relative to the base URL, or an absolute URL
     * @param params   query parameters in the order they should appear, null values are omitted
     */
    public JsonNode request(String endpoint, Map<String, String> params) throws NewsaggerException, InterruptedException {
        URI uri = resolve(endpoint, params);
        String description = "GET " + endpoint;
        try {
            return networkRetry.execute(description, sleeper,
                    n -> rateLimitRetry.execute(description, sleeper, m -> fetchJson(uri, endpoint)));
        } catch (IOException e) {
            throw new TransientNetworkException(endpoint, e);
        }
    }

    /**
     * Streams a binary resource to {@code target}, writing through a {@code .part} file so a failed download never
     * leaves a truncated file under the final name.
     *
     * @return number of bytes written
     */
    public long download(URI uri, Path target, @Nullable ProgressListener listener)
            throws NewsaggerException, InterruptedException {
        String endpoint = uri.toString();
        String description = "download " + endpoint;
        try {
            return downloadRetry.execute(description, sleeper,
                    n -> rateLimitRetry.execute(description, sleeper, m -> downloadOnce(uri, target, listener)));
        } catch (IOException e) {
            throw new TransientNetworkException(endpoint, e);
        }
    }

    private JsonNode fetchJson(URI uri, String endpoint) throws NewsaggerException, IOException, InterruptedException {
        awaitClearance(endpoint);
        throttle();
        var request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("GET {}", uri);
        HttpResponse<String> response = httpClient.send(request, BodyHandlers.ofString());
        int status = response.statusCode();
        String body = response.body();
        if (status == 429) throw new RateLimitedException(endpoint);
        if (looksLikeCaptcha(body)) {
            captchaManager.recordCaptcha(endpoint);
            throw new CaptchaDetectedException(endpoint, "challenge page served with HTTP " + status);
        }
        if (status >= 500) throw new IOException("HTTP " + status + " from " + uri);
        if (status >= 400) throw new FatalRequestException("HTTP " + status + " from " + uri, status);
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FatalRequestException("Malformed JSON from " + uri + ": " + e.getOriginalMessage(), status, e);
        }
    }

    private long downloadOnce(URI uri, Path target, @Nullable ProgressListener listener)
            throws NewsaggerException, IOException, InterruptedException {
        String endpoint = uri.toString();
        awaitClearance(endpoint);
        throttle();
        var request = HttpRequest.newBuilder(uri)
                .timeout(downloadTimeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();
        log.debug("Downloading {} to {}", uri, target);
        HttpResponse<InputStream> response = httpClient.send(request, BodyHandlers.ofInputStream());
        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status == 429) throw new RateLimitedException(endpoint);
            String contentType = response.headers().firstValue("Content-Type").orElse("");
            if (contentType.toLowerCase(Locale.ROOT).startsWith("text/html")) {
                String html = new String(body.readAllBytes(), UTF_8);
                if (looksLikeCaptcha(html)) {
                    captchaManager.recordCaptcha(endpoint);
                    throw new CaptchaDetectedException(endpoint, "challenge page served instead of content");
                }
                if (status < 400) {
                    throw new FatalRequestException("Expected binary content but got HTML from " + uri, status);
                }
            }
            if (status >= 500) throw new IOException("HTTP " + status + " from " + uri);
            if (status >= 400) throw new FatalRequestException("HTTP " + status + " from " + uri, status);

            long expected = response.headers().firstValueAsLong("Content-Length").orElse(-1);
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            long written = 0;
            try (OutputStream out = Files.newOutputStream(partial)) {
                byte[] buffer = new byte[8192];
                int n;
                while ((n = body.read(buffer)) != -1) {
                    if (Thread.interrupted()) throw new InterruptedException("Download of " + uri + " cancelled");
                    out.write(buffer, 0, n);
                    written += n;
                    if (listener != null) listener.progress(written, expected);
                }
            } catch (IOException | InterruptedException e) {
                Files.deleteIfExists(partial);
                throw e;
            }
            if (expected > 0 && written != expected) {
                Files.deleteIfExists(partial);
                throw new IOException("Download incomplete: " + written + "/" + expected + " bytes from " + uri);
            }
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
            return written;
        }
    }

    /**
     * Blocks while a CAPTCHA cooling-off window is active, re-checking at least every poll interval.
     */
    public void awaitClearance(String endpoint) throws InterruptedException {
        awaitClearance(endpoint, () -> false);
    }

    /**
     * Like {@link #awaitClearance(String)} but gives up within {@link Sleeper#STOP_CHECK_INTERVAL} once
     * {@code stopRequested} turns true.
     *
     * @return true if requests may be made, false if stopped while still blocked
     */
    public boolean awaitClearance(String endpoint, BooleanSupplier stopRequested) throws InterruptedException {
        while (true) {
            var gate = captchaManager.canMakeRequests();
            if (gate.allowed()) return true;
            Duration wait = gate.remaining().compareTo(captchaPollInterval) < 0 ? gate.remaining() : captchaPollInterval;
            log.info("Holding request to {}: {}", endpoint, gate.reason());
            if (!sleeper.sleepUnless(stopRequested, wait)) {
                log.info("Stopped while holding request to {}", endpoint);
                return false;
            }
        }
    }

    private synchronized void throttle() throws InterruptedException {
        if (lastRequestAt != null) {
            Duration wait = Duration.between(clock.instant(), lastRequestAt.plus(requestDelay));
            if (!wait.isNegative() && !wait.isZero()) sleeper.sleep(wait);
        }
        lastRequestAt = clock.instant();
    }

    URI resolve(String endpoint, Map<String, String> params) {
        URI target = endpoint.startsWith("http://") || endpoint.startsWith("https://")
                ? URI.create(endpoint) : baseUrl.resolve(endpoint);
        var query = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value != null) query.add(URLEncoder.encode(key, UTF_8) + "=" + URLEncoder.encode(value, UTF_8));
        });
        if (query.length() == 0) return target;
        return URI.create(target + (target.getRawQuery() == null ? "?" : "&") + query);
    }

    /**
     * CAPTCHA pages come back as HTML with HTTP 200, so they can only be recognised by content. JSON bodies are
     * never treated as challenges even if OCR text happens to mention the word.
     */
    static boolean looksLikeCaptcha(@Nullable String body) {
        if (body == null) return false;
        String trimmed = body.stripLeading();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) return false;
        return trimmed.toLowerCase(Locale.ROOT).contains("captcha");
    }

    @FunctionalInterface
    public interface ProgressListener {
        void progress(long bytesRead, long totalBytes);
    }
}
