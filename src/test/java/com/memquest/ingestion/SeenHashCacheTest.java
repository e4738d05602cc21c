package com.memquest.ingestion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeenHashCacheTest {

    @Test
    void addIfAbsentReportsFirstSighting() {
        var cache = new SeenHashCache(10);
        assertTrue(cache.addIfAbsent("h1"));
        assertFalse(cache.addIfAbsent("h1"));
        assertTrue(cache.contains("h1"));
        assertEquals(1, cache.size());
    }

    @Test
    void resetsWhenFull() {
        var cache = new SeenHashCache(2);
        cache.addIfAbsent("a");
        cache.addIfAbsent("b");
        assertTrue(cache.addIfAbsent("c"));
        assertEquals(1, cache.size());
        assertFalse(cache.contains("a"));
        assertTrue(cache.addIfAbsent("a"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SeenHashCache(0));
    }
}
