package io.kvcache;

import io.kvcache.config.TTLParser;
import io.kvcache.fetch.ExpiringFetchCache;
import io.kvcache.fetch.HttpPageFetcher;
import io.kvcache.fetch.PageFetcher;
import io.kvcache.instrument.CallHistoryReporter;
import io.kvcache.store.MemoryBackend;
import io.kvcache.store.RedisBackend;
import io.kvcache.store.StorageBackend;
import io.kvcache.value.InstrumentedStore;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Map;

/**
 * The main entry point for kvcache.
 * Owns one backend connection and the components sharing it.
 *
 * <pre>
 * try (KvCache cache = KvCache.builder()
 *     .backend("redis://localhost:6379")
 *     .fetchTtl("10s")
 *     .build()) {
 *
 *     String id = cache.values().store("foo");
 *     cache.reporter().report(cache.values().getOperationName());
 *     String html = cache.pages().fetch("http://example.com");
 * }
 * </pre>
 */
public final class KvCache implements AutoCloseable {

    private final StorageBackend backend;
    private final InstrumentedStore values;
    private final CallHistoryReporter reporter;
    private final ExpiringFetchCache pages;

    private KvCache(Builder builder) {
        this.backend = builder.backend != null ? builder.backend : new MemoryBackend();
        this.values = InstrumentedStore.builder()
            .backend(backend)
            .operationName(builder.operationName)
            .flushOnStart(builder.flushOnStart)
            .build();
        this.reporter = new CallHistoryReporter(backend, builder.out);
        this.pages = ExpiringFetchCache.builder()
            .backend(backend)
            .fetcher(builder.fetcher != null ? builder.fetcher : new HttpPageFetcher(builder.fetchTimeout))
            .ttl(builder.fetchTtl)
            .build();
    }

    /**
     * Creates a new builder for KvCache.
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public InstrumentedStore values() {
        return values;
    }

    public CallHistoryReporter reporter() {
        return reporter;
    }

    public ExpiringFetchCache pages() {
        return pages;
    }

    public StorageBackend backend() {
        return backend;
    }

    /**
     * Gets statistics about this cache.
     *
     * @return a map of statistics
     */
    public Map<String, Object> stats() {
        return Map.of(
            "backend", backend.getBackendName(),
            "operation", values.getOperationName(),
            "calls", values.callCount(),
            "fetch_ttl", TTLParser.format(pages.getTtl())
        );
    }

    @Override
    public void close() {
        backend.close();
    }

    /**
     * Builder for KvCache.
     */
    public static class Builder {
        private StorageBackend backend;
        private String operationName = InstrumentedStore.DEFAULT_OPERATION_NAME;
        private PageFetcher fetcher;
        private Duration fetchTtl = ExpiringFetchCache.DEFAULT_TTL;
        private Duration fetchTimeout = HttpPageFetcher.DEFAULT_TIMEOUT;
        private PrintStream out = System.out;
        private boolean flushOnStart;

        public Builder backend(StorageBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder backend(String uri) {
            if (uri.startsWith("redis://") || uri.startsWith("rediss://")) {
                this.backend = new RedisBackend(uri);
            } else if (uri.equals("memory") || uri.equals("memory://")) {
                this.backend = new MemoryBackend();
            } else {
                throw new IllegalArgumentException("Unsupported backend URI: " + uri);
            }
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder fetcher(PageFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder fetchTtl(Duration fetchTtl) {
            this.fetchTtl = fetchTtl;
            return this;
        }

        public Builder fetchTtl(String fetchTtl) {
            this.fetchTtl = TTLParser.parse(fetchTtl);
            return this;
        }

        /**
         * Sets the timeout of the default HTTP fetcher. Ignored when a fetcher is supplied.
         */
        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder reportTo(PrintStream out) {
            this.out = out;
            return this;
        }

        public Builder flushOnStart(boolean flushOnStart) {
            this.flushOnStart = flushOnStart;
            return this;
        }

        public KvCache build() {
            return new KvCache(this);
        }
    }
}
