package com.memquest.ingestion;

import com.memquest.observability.MemoryMetrics;
import com.memquest.providers.EmbeddingProvider;
import com.memquest.providers.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EmbedderTest {

    private static final RetryPolicy FAST = RetryPolicy.exponential(3, 1);

    /** Vector [length, 1, 1] per text, counting provider calls. */
    private static class CountingProvider implements EmbeddingProvider {
        final AtomicInteger calls = new AtomicInteger();
        final List<List<String>> batches = new ArrayList<>();

        @Override
        public List<float[]> embed(List<String> texts) {
            calls.incrementAndGet();
            batches.add(List.copyOf(texts));
            return texts.stream().map(t -> new float[]{t.length(), 1f, 1f}).toList();
        }
    }

    @Test
    void returnsOneVectorPerTextInOrder() {
        var provider = new CountingProvider();
        var embedder = new Embedder(provider, 3, 100, FAST, new MemoryMetrics());
        var vectors = embedder.generateEmbeddings(List.of("a", "bbb", "cc"));
        assertEquals(3, vectors.size());
        assertEquals(1f, vectors.get(0)[0]);
        assertEquals(3f, vectors.get(1)[0]);
        assertEquals(2f, vectors.get(2)[0]);
    }

    @Test
    void cachedTextsAreNotReEmbedded() {
        var provider = new CountingProvider();
        var embedder = new Embedder(provider, 3, 100, FAST, new MemoryMetrics());
        embedder.generateEmbeddings(List.of("alpha", "beta"));
        embedder.generateEmbeddings(List.of("beta", "gamma"));
        assertEquals(2, provider.calls.get());
        assertEquals(List.of("gamma"), provider.batches.get(1));
        assertEquals(3, embedder.cacheSize());
    }

    @Test
    void cacheStopsGrowingAtCapacity() {
        var provider = new CountingProvider();
        var embedder = new Embedder(provider, 3, 2, FAST, new MemoryMetrics());
        embedder.generateEmbeddings(List.of("one", "two", "three"));
        assertEquals(2, embedder.cacheSize());
        var again = embedder.generateEmbeddings(List.of("three"));
        assertEquals(5f, again.get(0)[0]);
        assertEquals(2, provider.calls.get());
    }

    @Test
    void unconfiguredProviderYieldsZeroVectors() {
        var embedder = new Embedder(null, 4, 100, FAST, new MemoryMetrics());
        var vectors = embedder.generateEmbeddings(List.of("x", "y"));
        assertEquals(2, vectors.size());
        assertEquals(4, vectors.get(0).length);
        assertTrue(Embedder.isZero(vectors.get(0)));
        assertFalse(embedder.configured());
    }

    @Test
    void retriesThenRecovers() {
        var attempts = new AtomicInteger();
        EmbeddingProvider flaky = texts -> {
            if (attempts.incrementAndGet() < 3) throw new RuntimeException("Embedding API error 503");
            return List.of(new float[]{1f, 2f});
        };
        var embedder = new Embedder(flaky, 2, 100, FAST, new MemoryMetrics());
        var vectors = embedder.generateEmbeddings(List.of("hello world"));
        assertEquals(3, attempts.get());
        assertFalse(Embedder.isZero(vectors.get(0)));
    }

    @Test
    void exhaustedRetriesYieldZeroVectorsAndAreNotCached() {
        var attempts = new AtomicInteger();
        EmbeddingProvider broken = texts -> {
            attempts.incrementAndGet();
            throw new RuntimeException("Embedding API error 500");
        };
        var embedder = new Embedder(broken, 2, 100, FAST, new MemoryMetrics());
        var vectors = embedder.generateEmbeddings(List.of("a", "b"));
        assertEquals(3, attempts.get());
        assertTrue(vectors.stream().allMatch(Embedder::isZero));
        assertEquals(0, embedder.cacheSize());
    }

    @Test
    void recordsEmbedLatency() {
        var metrics = new MemoryMetrics();
        new Embedder(new CountingProvider(), 3, 10, FAST, metrics).generateEmbeddings(List.of("timed"));
        assertEquals(1, metrics.embedLatency().count());
    }
}
