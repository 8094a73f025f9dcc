package io.kvcache.exception;

/**
 * Thrown when the key-value store cannot be reached or rejects a command.
 */
public class BackendException extends KvCacheException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
