package com.lunaindex.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.lunaindex.store.SearchMode;

class LruCacheTest {

    @Test
    void shouldEvictLeastRecentlyUsedEntry() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        cache.set("A", 1);
        cache.set("B", 2);
        cache.set("C", 3);

        assertFalse(cache.has("A"));
        assertTrue(cache.has("B"));
        assertTrue(cache.has("C"));

        assertEquals(Optional.of(2), cache.get("B"));
        cache.set("D", 4);

        assertTrue(cache.has("B"));
        assertTrue(cache.has("D"));
        assertFalse(cache.has("C"));
        assertEquals(2, cache.size());
    }

    @Test
    void shouldNotRefreshRecencyOnHas() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        cache.set("A", 1);
        cache.set("B", 2);

        assertTrue(cache.has("A"));
        cache.set("C", 3);

        assertFalse(cache.has("A"));
        assertTrue(cache.has("B"));
    }

    @Test
    void shouldReplaceValueAndRefreshOnSetOfExistingKey() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        cache.set("A", 1);
        cache.set("B", 2);
        cache.set("A", 10);
        cache.set("C", 3);

        assertEquals(Optional.of(10), cache.get("A"));
        assertFalse(cache.has("B"));
    }

    @Test
    void shouldClearAllEntries() {
        LruCache<String, Integer> cache = new LruCache<>();
        cache.set("A", 1);
        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(Optional.empty(), cache.get("A"));
        assertEquals(LruCache.DEFAULT_CAPACITY, cache.capacity());
    }

    @Test
    void shouldRejectInvalidCapacityAndNullValues() {
        assertThrows(IllegalArgumentException.class, () -> new LruCache<String, Integer>(0));
        LruCache<String, Integer> cache = new LruCache<>(1);
        assertThrows(IllegalArgumentException.class, () -> cache.set("A", null));
    }

    @Test
    void shouldBuildDistinctKeysPerOperation() {
        Path root = Path.of("/work");

        assertEquals("file-summary:" + root + ":src/a.ts", CacheKeys.fileSummary(root, "src/a.ts"));
        assertEquals("search:" + root + ":auth:exports", CacheKeys.search(root, "auth", SearchMode.EXPORTS));
        assertEquals("graph:" + root, CacheKeys.fullGraph(root));
        assertEquals("graph:" + root + ":src/a.ts", CacheKeys.graphQuery(root, "src/a.ts"));
    }
}
