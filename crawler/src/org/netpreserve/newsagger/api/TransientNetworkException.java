package org.netpreserve.newsagger.api;

import org.netpreserve.newsagger.NewsaggerException;

import java.io.IOException;

/**
 * Connection-level failure (timeout, reset, truncated body, 5xx) that persisted through every network retry.
 */
public class TransientNetworkException extends NewsaggerException {
    public TransientNetworkException(String endpoint, IOException cause) {
        super("Network failure requesting " + endpoint + ": " + cause.getMessage(), cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
