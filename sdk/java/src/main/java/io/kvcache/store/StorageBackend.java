package io.kvcache.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Interface for key-value stores offering atomic counters, lists and TTL-based expiration.
 * Every primitive is expected to execute atomically with respect to concurrent callers.
 */
public interface StorageBackend extends AutoCloseable {

    /**
     * Stores a value without expiry, replacing any previous value.
     *
     * @param key the key
     * @param value the value
     */
    void set(String key, byte[] value);

    /**
     * Stores a value with the specified TTL.
     *
     * @param key the key
     * @param value the value
     * @param ttl the time-to-live
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * Gets a value by key.
     *
     * @param key the key
     * @return the value, or empty if not found or expired
     */
    Optional<byte[]> get(String key);

    /**
     * Increments the integer stored at a key, starting from zero when the key is missing.
     *
     * @param key the key
     * @return the value after the increment
     */
    long increment(String key);

    /**
     * Appends a value to the tail of the list stored at a key.
     *
     * @param key the list key
     * @param value the value to append
     * @return the length of the list after the append
     */
    long append(String key, String value);

    /**
     * Appends one value to each of two lists as a single atomic step, so that
     * concurrent pair appends keep the two lists positionally aligned.
     *
     * @param firstKey the first list key
     * @param firstValue the value appended to the first list
     * @param secondKey the second list key
     * @param secondValue the value appended to the second list
     */
    void appendPair(String firstKey, String firstValue, String secondKey, String secondValue);

    /**
     * Reads an inclusive range of a list. Negative indices count from the tail,
     * so {@code range(key, 0, -1)} returns the whole list.
     *
     * @param key the list key
     * @param start the first index
     * @param end the last index
     * @return the elements in order, empty if the list does not exist
     */
    List<String> range(String key, long start, long end);

    /**
     * Deletes a key.
     *
     * @param key the key
     * @return true if the key existed and was deleted
     */
    boolean delete(String key);

    /**
     * Checks if a key exists and is not expired.
     *
     * @param key the key
     * @return true if the key exists
     */
    boolean exists(String key);

    /**
     * Gets the remaining TTL for a key.
     *
     * @param key the key
     * @return the remaining TTL, or empty if the key doesn't exist or never expires
     */
    Optional<Duration> ttl(String key);

    /**
     * Removes every key from the store.
     */
    void flush();

    /**
     * Gets the name of this backend type.
     *
     * @return the backend name
     */
    String getBackendName();

    /**
     * Closes the backend and releases resources.
     */
    @Override
    void close();
}
