package io.kvcache.store;

import io.kvcache.exception.BackendException;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Test backend over a {@link MemoryBackend} that fails the chosen commands with {@link BackendException}.
 */
public final class FailingBackend implements StorageBackend {

    public enum Command {
        SET,
        GET,
        INCREMENT,
        APPEND_PAIR
    }

    private final MemoryBackend delegate = new MemoryBackend();
    private final Set<Command> failing = EnumSet.noneOf(Command.class);

    public FailingBackend fail(Command command) {
        failing.add(command);
        return this;
    }

    public MemoryBackend delegate() {
        return delegate;
    }

    private void check(Command command) {
        if (failing.contains(command)) {
            throw new BackendException("Store unavailable during " + command);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        check(Command.SET);
        delegate.set(key, value);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        check(Command.SET);
        delegate.set(key, value, ttl);
    }

    @Override
    public Optional<byte[]> get(String key) {
        check(Command.GET);
        return delegate.get(key);
    }

    @Override
    public long increment(String key) {
        check(Command.INCREMENT);
        return delegate.increment(key);
    }

    @Override
    public long append(String key, String value) {
        return delegate.append(key, value);
    }

    @Override
    public void appendPair(String firstKey, String firstValue, String secondKey, String secondValue) {
        check(Command.APPEND_PAIR);
        delegate.appendPair(firstKey, firstValue, secondKey, secondValue);
    }

    @Override
    public List<String> range(String key, long start, long end) {
        return delegate.range(key, start, end);
    }

    @Override
    public boolean delete(String key) {
        return delegate.delete(key);
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public Optional<Duration> ttl(String key) {
        return delegate.ttl(key);
    }

    @Override
    public void flush() {
        delegate.flush();
    }

    @Override
    public String getBackendName() {
        return "failing";
    }

    @Override
    public void close() {
        delegate.close();
    }
}
