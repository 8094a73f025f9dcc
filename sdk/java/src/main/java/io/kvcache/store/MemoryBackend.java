package io.kvcache.store;

import io.kvcache.exception.BackendException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory storage backend with lazy expiration.
 * Suitable for testing and single-process deployments.
 */
public final class MemoryBackend implements StorageBackend {

    private final Map<String, Entry> data;
    private final Clock clock;
    private final Object listLock = new Object();

    public MemoryBackend() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a memory backend that evaluates expiry against the given clock.
     *
     * @param clock the clock
     */
    public MemoryBackend(Clock clock) {
        this.data = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    @Override
    public void set(String key, byte[] value) {
        data.put(key, Entry.scalar(value.clone(), null));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        data.put(key, Entry.scalar(value.clone(), expiresAt));
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry entry = live(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.list() != null) {
            throw wrongType(key);
        }
        return Optional.of(entry.value().clone());
    }

    @Override
    public long increment(String key) {
        long[] result = new long[1];
        data.compute(key, (k, entry) -> {
            if (entry == null || isExpired(entry)) {
                result[0] = 1;
                return Entry.scalar(encode(1), null);
            }
            if (entry.list() != null) {
                throw wrongType(k);
            }
            long current;
            try {
                current = Long.parseLong(new String(entry.value(), StandardCharsets.US_ASCII));
            } catch (NumberFormatException e) {
                throw new BackendException("Value is not an integer for key: " + k, e);
            }
            try {
                result[0] = Math.addExact(current, 1);
            } catch (ArithmeticException e) {
                throw new BackendException("Increment would overflow for key: " + k, e);
            }
            return Entry.scalar(encode(result[0]), entry.expiresAt());
        });
        return result[0];
    }

    @Override
    public long append(String key, String value) {
        synchronized (listLock) {
            return push(key, value);
        }
    }

    // List writes share one lock, so a pair append never interleaves with another list write
    @Override
    public void appendPair(String firstKey, String firstValue, String secondKey, String secondValue) {
        synchronized (listLock) {
            checkList(firstKey);
            checkList(secondKey);
            push(firstKey, firstValue);
            push(secondKey, secondValue);
        }
    }

    private void checkList(String key) {
        Entry entry = live(key);
        if (entry != null && entry.list() == null) {
            throw wrongType(key);
        }
    }

    private long push(String key, String value) {
        long[] result = new long[1];
        data.compute(key, (k, entry) -> {
            if (entry == null || isExpired(entry)) {
                entry = Entry.list(Collections.synchronizedList(new ArrayList<>()));
            } else if (entry.list() == null) {
                throw wrongType(k);
            }
            entry.list().add(value);
            result[0] = entry.list().size();
            return entry;
        });
        return result[0];
    }

    @Override
    public List<String> range(String key, long start, long end) {
        Entry entry = live(key);
        if (entry == null) {
            return List.of();
        }
        if (entry.list() == null) {
            throw wrongType(key);
        }
        List<String> snapshot;
        synchronized (entry.list()) {
            snapshot = List.copyOf(entry.list());
        }
        int size = snapshot.size();
        long from = start < 0 ? Math.max(size + start, 0) : start;
        long to = end < 0 ? size + end : Math.min(end, size - 1);
        if (from > to || from >= size) {
            return List.of();
        }
        return snapshot.subList((int) from, (int) to + 1);
    }

    @Override
    public boolean delete(String key) {
        Entry entry = data.remove(key);
        return entry != null && !isExpired(entry);
    }

    @Override
    public boolean exists(String key) {
        return live(key) != null;
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Entry entry = live(key);
        if (entry == null || entry.expiresAt() == null) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    @Override
    public void flush() {
        data.clear();
    }

    @Override
    public String getBackendName() {
        return "memory";
    }

    @Override
    public void close() {
        data.clear();
    }

    /**
     * Gets the number of entries (including potentially expired ones).
     *
     * @return the entry count
     */
    public int size() {
        return data.size();
    }

    /**
     * Removes all expired entries.
     *
     * @return the number of entries removed
     */
    public int cleanup() {
        int removed = 0;
        var iterator = data.entrySet().iterator();
        while (iterator.hasNext()) {
            var entry = iterator.next();
            if (isExpired(entry.getValue())) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private Entry live(String key) {
        Entry entry = data.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            data.remove(key, entry);
            return null;
        }
        return entry;
    }

    private boolean isExpired(Entry entry) {
        return entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt());
    }

    private static byte[] encode(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    private static BackendException wrongType(String key) {
        return new BackendException("Operation against a key holding the wrong kind of value: " + key);
    }

    private record Entry(byte[] value, List<String> list, Instant expiresAt) {

        static Entry scalar(byte[] value, Instant expiresAt) {
            return new Entry(value, null, expiresAt);
        }

        static Entry list(List<String> list) {
            return new Entry(null, list, null);
        }
    }
}
