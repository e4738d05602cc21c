package com.memquest.ingestion;

import com.memquest.observability.MemoryMetrics;
import com.memquest.providers.EmbeddingProvider;
import com.memquest.providers.ResilientCall;
import com.memquest.providers.RetryPolicy;
import com.memquest.shared.model.MemoryEvent;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns texts into vectors through an {@link EmbeddingProvider}, with a
 * content-hash cache and retries. Never throws for provider trouble: texts that
 * could not be embedded come back as all-zero vectors.
 */
public class Embedder {

    private static final Logger log = LoggerFactory.getLogger(Embedder.class);

    private final EmbeddingProvider provider;
    private final int dimensions;
    private final int cacheCapacity;
    private final RetryPolicy retryPolicy;
    private final MemoryMetrics metrics;
    private final Map<String, float[]> cache = new ConcurrentHashMap<>();
    private final Object cacheLock = new Object();

    /**
     * @param provider {@code null} when no embedding endpoint is configured
     */
    public Embedder(EmbeddingProvider provider, int dimensions, int cacheCapacity,
                    RetryPolicy retryPolicy, MemoryMetrics metrics) {
        this.provider = provider;
        this.dimensions = dimensions;
        this.cacheCapacity = cacheCapacity;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    public int dimensions() { return dimensions; }

    public boolean configured() { return provider != null; }

    /** One vector per text, same order as the input. */
    public List<float[]> generateEmbeddings(List<String> texts) {
        var results = new ArrayList<float[]>(texts.size());
        var missIndexes = new ArrayList<Integer>();
        var missTexts = new ArrayList<String>();

        for (int i = 0; i < texts.size(); i++) {
            var cached = cache.get(MemoryEvent.contentHash(texts.get(i)));
            results.add(cached);
            if (cached == null) {
                missIndexes.add(i);
                missTexts.add(texts.get(i));
            }
        }
        if (missTexts.isEmpty()) return results;

        var vectors = embedWithRetry(missTexts);
        for (int j = 0; j < missIndexes.size(); j++) {
            var vec = j < vectors.size() && vectors.get(j) != null ? vectors.get(j) : zeroVector();
            results.set(missIndexes.get(j), vec);
            if (!isZero(vec)) remember(MemoryEvent.contentHash(missTexts.get(j)), vec);
        }
        return results;
    }

    public float[] zeroVector() {
        return new float[dimensions];
    }

    public static boolean isZero(float[] vector) {
        if (vector == null) return true;
        for (float v : vector) {
            if (v != 0f) return false;
        }
        return true;
    }

    public int cacheSize() {
        return cache.size();
    }

    private List<float[]> embedWithRetry(List<String> texts) {
        if (provider == null) {
            log.warn("Embedding provider not configured; returning {} zero vectors", texts.size());
            return zeroVectors(texts.size());
        }
        var sample = Timer.start(metrics.registry());
        try {
            return ResilientCall.execute("embedding", () -> provider.embed(texts), retryPolicy);
        } catch (ResilientCall.RetriesExhaustedException e) {
            log.error("Embedding generation failed after {} attempts; using zero vectors",
                    retryPolicy.maxAttempts(), e);
            return zeroVectors(texts.size());
        } finally {
            sample.stop(metrics.embedLatency());
        }
    }

    private void remember(String hash, float[] vector) {
        if (cache.size() >= cacheCapacity) return;
        synchronized (cacheLock) {
            if (cache.size() < cacheCapacity) cache.putIfAbsent(hash, vector);
        }
    }

    private List<float[]> zeroVectors(int count) {
        var out = new ArrayList<float[]>(count);
        for (int i = 0; i < count; i++) out.add(zeroVector());
        return out;
    }
}
