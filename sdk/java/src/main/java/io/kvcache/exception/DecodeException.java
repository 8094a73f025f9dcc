package io.kvcache.exception;

/**
 * Thrown when a stored value cannot be decoded to the requested type.
 */
public class DecodeException extends KvCacheException {

    private final String key;

    public DecodeException(String key, Throwable cause) {
        super("Failed to decode value for key: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
