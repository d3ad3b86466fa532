package org.netpreserve.newsagger;

/**
 * Base class for failures talking to the archive API.
 */
public abstract class NewsaggerException extends Exception {
    public NewsaggerException(String message) {
        super(message);
    }

    public NewsaggerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same request later can succeed.
     */
    public abstract boolean retryable();
}
