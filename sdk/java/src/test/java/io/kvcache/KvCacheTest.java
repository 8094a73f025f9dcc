package io.kvcache;

import io.kvcache.store.MemoryBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KvCache Tests")
class KvCacheTest {

    private MemoryBackend backend;
    private ByteArrayOutputStream printed;
    private AtomicInteger fetches;
    private KvCache cache;

    @BeforeEach
    void setUp() {
        backend = new MemoryBackend();
        printed = new ByteArrayOutputStream();
        fetches = new AtomicInteger();
        cache = KvCache.builder()
            .backend(backend)
            .operationName("store")
            .fetcher(url -> "page " + fetches.incrementAndGet())
            .reportTo(new PrintStream(printed, true, StandardCharsets.UTF_8))
            .build();
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("Store, retrieve and replay share one backend")
    void testStoreAndReplay() {
        String id = cache.values().store("foo");

        assertArrayEquals("foo".getBytes(StandardCharsets.UTF_8), cache.values().retrieve(id).orElseThrow());
        assertEquals("foo", cache.values().retrieveText(id).orElseThrow());
        assertEquals(1, cache.values().callCount());

        cache.reporter().report("store");
        assertEquals("store was called 1 times:\nstore(*('foo',)) -> " + id + "\n",
            printed.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n"));
    }

    @Test
    @DisplayName("Pages are fetched through the expiring cache")
    void testPages() {
        assertEquals("page 1", cache.pages().fetch("http://example.test/a"));
        assertEquals("page 1", cache.pages().fetch("http://example.test/a"));

        assertEquals(1, fetches.get());
        assertEquals(2, cache.pages().accessCount("http://example.test/a"));
        assertSame(backend, cache.backend());
    }

    @Test
    @DisplayName("Stats describe the configuration and call count")
    void testStats() {
        cache.values().store(1);
        cache.values().store(2);

        var stats = cache.stats();

        assertEquals("memory", stats.get("backend"));
        assertEquals("store", stats.get("operation"));
        assertEquals(2L, stats.get("calls"));
        assertEquals("10s", stats.get("fetch_ttl"));
    }

    @Test
    @DisplayName("Builder configures backend from URI")
    void testBuilderWithUri() {
        try (KvCache fromUri = KvCache.builder().backend("memory://").fetchTtl("30s").build()) {
            String id = fromUri.values().store("x");
            assertTrue(fromUri.values().retrieve(id).isPresent());
            assertEquals("memory", fromUri.stats().get("backend"));
            assertEquals("30s", fromUri.stats().get("fetch_ttl"));
            assertEquals("Cache.store", fromUri.values().getOperationName());
        }
    }

    @Test
    @DisplayName("Builder rejects unsupported URIs")
    void testUnsupportedUri() {
        assertThrows(IllegalArgumentException.class, () -> KvCache.builder().backend("memcached://localhost"));
    }

    @Test
    @DisplayName("Flush on start clears the backend")
    void testFlushOnStart() {
        String id = cache.values().store("foo");

        KvCache fresh = KvCache.builder()
            .backend(backend)
            .operationName("store")
            .flushOnStart(true)
            .build();

        assertTrue(fresh.values().retrieve(id).isEmpty());
        assertEquals(0, fresh.values().callCount());
    }

    @Test
    @DisplayName("Close releases the backend")
    void testClose() {
        cache.values().store("foo");
        cache.close();

        assertEquals(0, backend.size());
    }
}
