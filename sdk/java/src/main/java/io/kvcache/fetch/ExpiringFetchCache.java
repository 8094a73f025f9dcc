package io.kvcache.fetch;

import io.kvcache.config.TTLParser;
import io.kvcache.exception.FetchException;
import io.kvcache.store.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caches fetched page content in the backend for a fixed TTL and counts every access per URL.
 * Expiry is left to the backend; an expired entry simply reads as absent.
 *
 * <pre>
 * PageFetcher pages = ExpiringFetchCache.builder()
 *     .backend(backend)
 *     .fetcher(new HttpPageFetcher())
 *     .ttl("10s")
 *     .build();
 *
 * String html = pages.fetch("http://example.com");
 * </pre>
 *
 * <p>A failed fetch propagates its {@link FetchException} and leaves the cache untouched.
 */
public final class ExpiringFetchCache implements PageFetcher {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(10);
    public static final String CACHE_PREFIX = "cache:";
    public static final String COUNT_PREFIX = "count:";

    private static final Logger log = LoggerFactory.getLogger(ExpiringFetchCache.class);

    private final StorageBackend backend;
    private final PageFetcher fetcher;
    private final Duration ttl;

    private ExpiringFetchCache(Builder builder) {
        this.backend = Objects.requireNonNull(builder.backend, "backend must be set");
        this.fetcher = Objects.requireNonNull(builder.fetcher, "fetcher must be set");
        this.ttl = builder.ttl;
    }

    /**
     * Creates a new builder for ExpiringFetchCache.
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String fetch(String url) {
        backend.increment(COUNT_PREFIX + url);

        String cacheKey = CACHE_PREFIX + url;
        Optional<byte[]> cached = backend.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", url);
            return new String(cached.get(), StandardCharsets.UTF_8);
        }

        log.debug("Cache miss for {}", url);
        String content;
        try {
            content = fetcher.fetch(url);
        } catch (FetchException e) {
            log.warn("Fetch failed for {}: {}", url, e.getMessage());
            throw e;
        }
        backend.set(cacheKey, content.getBytes(StandardCharsets.UTF_8), ttl);
        return content;
    }

    /**
     * Gets how many times a URL has been fetched through this cache, hits and misses alike.
     *
     * @param url the URL
     * @return the access count, 0 if never fetched
     */
    public long accessCount(String url) {
        return backend.get(COUNT_PREFIX + url)
            .map(bytes -> Long.parseLong(new String(bytes, StandardCharsets.US_ASCII)))
            .orElse(0L);
    }

    /**
     * Checks whether an unexpired entry is cached for a URL.
     *
     * @param url the URL
     * @return true if the next fetch would be a hit
     */
    public boolean isCached(String url) {
        return backend.exists(CACHE_PREFIX + url);
    }

    /**
     * Removes the cached entry for a URL, leaving its access count intact.
     *
     * @param url the URL
     * @return true if an entry was removed
     */
    public boolean evict(String url) {
        return backend.delete(CACHE_PREFIX + url);
    }

    public Duration getTtl() {
        return ttl;
    }

    /**
     * Builder for ExpiringFetchCache.
     */
    public static class Builder {
        private StorageBackend backend;
        private PageFetcher fetcher;
        private Duration ttl = DEFAULT_TTL;

        public Builder backend(StorageBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder fetcher(PageFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder ttl(Duration ttl) {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                throw new IllegalArgumentException("TTL must be positive");
            }
            this.ttl = ttl;
            return this;
        }

        public Builder ttl(String ttl) {
            return ttl(TTLParser.parse(ttl));
        }

        public ExpiringFetchCache build() {
            return new ExpiringFetchCache(this);
        }
    }
}
