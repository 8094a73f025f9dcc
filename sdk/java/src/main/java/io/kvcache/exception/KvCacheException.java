package io.kvcache.exception;

/**
 * Base exception for all kvcache errors.
 */
public class KvCacheException extends RuntimeException {

    public KvCacheException(String message) {
        super(message);
    }

    public KvCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
