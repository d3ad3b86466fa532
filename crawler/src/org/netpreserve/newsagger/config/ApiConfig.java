package org.netpreserve.newsagger.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.newsagger.util.DurationDeserializer;

import java.net.URI;
import java.time.Duration;

/**
 * How to talk to the archive API.
 *
 * @param baseUrl             API root, every relative endpoint is resolved against it
 * @param requestDelay        minimum gap between consecutive requests (never less than 3 seconds)
 * @param maxRetries          attempts per request for network failures and for 429 responses
 * @param timeout             per-request timeout for JSON endpoints
 * @param downloadTimeout     per-request timeout for binary downloads
 * @param userAgent           User-Agent header sent with every request
 * @param networkRetryDelay   first backoff after a connection-level failure
 * @param rateLimitBackoff    first backoff after an HTTP 429
 * @param rateLimitMaxBackoff cap on any single 429 backoff
 * @param captchaCoolingOff   how long all requests pause after a CAPTCHA challenge
 * @param captchaPollInterval how often a blocked request re-checks the cooling-off state
 */
public record ApiConfig(
        URI baseUrl,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration requestDelay,
        int maxRetries,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration downloadTimeout,
        String userAgent,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration networkRetryDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration rateLimitBackoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration rateLimitMaxBackoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration captchaCoolingOff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration captchaPollInterval
) {
    public static final URI DEFAULT_BASE_URL = URI.create("https://chroniclingamerica.loc.gov/");
    public static final String DEFAULT_USER_AGENT = "Newsagger/0.1.0 (Educational Archive Tool - Rate Limited)";

    public static ApiConfig defaults() {
        return new ApiConfig(DEFAULT_BASE_URL, Duration.ofSeconds(3), 3, Duration.ofSeconds(60),
                Duration.ofSeconds(120), DEFAULT_USER_AGENT, Duration.ofSeconds(30), Duration.ofHours(1),
                Duration.ofHours(4), Duration.ofMinutes(60), Duration.ofMinutes(5));
    }

    public ApiConfig withBaseUrl(URI baseUrl) {
        return new ApiConfig(baseUrl, requestDelay, maxRetries, timeout, downloadTimeout, userAgent,
                networkRetryDelay, rateLimitBackoff, rateLimitMaxBackoff, captchaCoolingOff, captchaPollInterval);
    }

    public ApiConfig withRequestDelay(Duration requestDelay) {
        return new ApiConfig(baseUrl, requestDelay, maxRetries, timeout, downloadTimeout, userAgent,
                networkRetryDelay, rateLimitBackoff, rateLimitMaxBackoff, captchaCoolingOff, captchaPollInterval);
    }
}
