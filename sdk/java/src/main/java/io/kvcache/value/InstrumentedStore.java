package io.kvcache.value;

import io.kvcache.exception.DecodeException;
import io.kvcache.exception.KvCacheException;
import io.kvcache.instrument.ArgumentFormatter;
import io.kvcache.instrument.Instrumentation;
import io.kvcache.instrument.Operation;
import io.kvcache.store.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Stores scalars under generated identifiers and retrieves them with typed decoding.
 * Every {@link #store} call is counted and recorded under the configured operation name.
 *
 * <pre>
 * InstrumentedStore store = InstrumentedStore.builder()
 *     .backend(new MemoryBackend())
 *     .operationName("Cache.store")
 *     .build();
 *
 * String id = store.store("foo");
 * Optional&lt;String&gt; text = store.retrieveText(id);
 * </pre>
 */
public final class InstrumentedStore {

    public static final String DEFAULT_OPERATION_NAME = "Cache.store";

    private static final Logger log = LoggerFactory.getLogger(InstrumentedStore.class);

    private final StorageBackend backend;
    private final String operationName;
    private final Operation<StoredValue, String> storeOperation;

    private InstrumentedStore(Builder builder) {
        this.backend = Objects.requireNonNull(builder.backend, "backend must be set");
        this.operationName = builder.operationName;
        this.storeOperation = Instrumentation.counted(backend, operationName,
            Instrumentation.recorded(backend, operationName, builder.formatter, this::persist));

        if (builder.flushOnStart) {
            backend.flush();
        }
    }

    /**
     * Creates a new builder for InstrumentedStore.
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Stores a value under a freshly generated identifier.
     *
     * @param value the value
     * @return the identifier
     */
    public String store(StoredValue value) {
        return storeOperation.apply(value);
    }

    public String store(String value) {
        return store(StoredValue.text(value));
    }

    public String store(byte[] value) {
        return store(StoredValue.bytes(value));
    }

    public String store(long value) {
        return store(StoredValue.integer(value));
    }

    public String store(double value) {
        return store(StoredValue.floating(value));
    }

    /**
     * Retrieves the raw bytes stored under an identifier.
     *
     * @param id the identifier
     * @return the bytes, or empty if nothing is stored under the identifier
     */
    public Optional<byte[]> retrieve(String id) {
        return backend.get(id);
    }

    /**
     * Retrieves a value and converts it with the given decoder.
     *
     * @param id the identifier
     * @param decoder converts the stored bytes
     * @param <T> the decoded type
     * @return the decoded value, or empty if nothing is stored under the identifier
     * @throws DecodeException if the decoder fails
     * @throws NullPointerException if the decoder is null
     */
    public <T> Optional<T> retrieve(String id, Function<byte[], T> decoder) {
        Objects.requireNonNull(decoder, "decoder");
        Optional<byte[]> raw = backend.get(id);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(decoder.apply(raw.get()));
        } catch (KvCacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodeException(id, e);
        }
    }

    public Optional<String> retrieveText(String id) {
        return retrieve(id, bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public Optional<Integer> retrieveInt(String id) {
        return retrieve(id, bytes -> Integer.parseInt(ascii(bytes)));
    }

    public Optional<Long> retrieveLong(String id) {
        return retrieve(id, bytes -> Long.parseLong(ascii(bytes)));
    }

    public Optional<Double> retrieveDouble(String id) {
        return retrieve(id, bytes -> StoredValue.parseFloating(ascii(bytes)));
    }

    /**
     * Gets how many times {@link #store} has been called.
     *
     * @return the call count
     */
    public long callCount() {
        return retrieveLong(operationName).orElse(0L);
    }

    public String getOperationName() {
        return operationName;
    }

    private String persist(StoredValue value) {
        String id = UUID.randomUUID().toString();
        backend.set(id, value.encode());
        log.debug("Stored {} value under {}", value.getKind(), id);
        return id;
    }

    private static String ascii(byte[] bytes) {
        return new String(bytes, StandardCharsets.US_ASCII).trim();
    }

    /**
     * Builder for InstrumentedStore.
     */
    public static class Builder {
        private StorageBackend backend;
        private String operationName = DEFAULT_OPERATION_NAME;
        private ArgumentFormatter formatter = ArgumentFormatter.tuple();
        private boolean flushOnStart;

        public Builder backend(StorageBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder operationName(String operationName) {
            if (operationName == null || operationName.isBlank()) {
                throw new IllegalArgumentException("Operation name cannot be null or empty");
            }
            this.operationName = operationName;
            return this;
        }

        public Builder formatter(ArgumentFormatter formatter) {
            this.formatter = Objects.requireNonNull(formatter, "formatter");
            return this;
        }

        /**
         * Drops every key in the backend when the store is built.
         */
        public Builder flushOnStart(boolean flushOnStart) {
            this.flushOnStart = flushOnStart;
            return this;
        }

        public InstrumentedStore build() {
            return new InstrumentedStore(this);
        }
    }
}
