package org.netpreserve.newsagger.api;

import org.netpreserve.newsagger.NewsaggerException;

/**
 * The server answered with a CAPTCHA challenge instead of data. The client never retries these itself; the caller
 * decides how to wait out the cooling-off period.
 */
public class CaptchaDetectedException extends NewsaggerException {
    public static final String GLOBAL_COOLING_OFF = "global_cooling_off";
    private final String endpoint;
    private final String reason;

    public CaptchaDetectedException(String endpoint, String reason) {
        super("CAPTCHA challenge from " + endpoint + ": " + reason);
        this.endpoint = endpoint;
        this.reason = reason;
    }

    public String endpoint() {
        return endpoint;
    }

    public String reason() {
        return reason;
    }

    public String retryStrategy() {
        return GLOBAL_COOLING_OFF;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
