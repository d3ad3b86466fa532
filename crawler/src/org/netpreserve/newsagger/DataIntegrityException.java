package org.netpreserve.newsagger;

/**
 * A record that can't be tied to what it should identify: an API entry without an identifier, or a stored facet or
 * queue item that doesn't resolve to stored pages.
 */
public class DataIntegrityException extends RuntimeException {
    public DataIntegrityException(String message) {
        super(message);
    }
}
