package org.netpreserve.newsagger.api;

import org.netpreserve.newsagger.NewsaggerException;

/**
 * HTTP 429 from the server. Thrown per attempt and again once the rate limit retry policy gives up.
 */
public class RateLimitedException extends NewsaggerException {
    private final String endpoint;

    public RateLimitedException(String endpoint) {
        super("Rate limited (HTTP 429) by " + endpoint);
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
