package org.netpreserve.newsagger.api;

import org.netpreserve.newsagger.NewsaggerException;

/**
 * A request that will never succeed as issued: a 4xx status other than 429, or a body that isn't valid JSON.
 */
public class FatalRequestException extends NewsaggerException {
    private final int status;

    public FatalRequestException(String message, int status) {
        super(message);
        this.status = status;
    }

    public FatalRequestException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP status of the failed response.
     */
    public int status() {
        return status;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
