package com.memquest.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class MemoryMetrics {

    private final MeterRegistry registry;

    public MemoryMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MemoryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    // hot path

    public Counter hotRetrievals() {
        return Counter.builder("memquest.hot.retrieval.count").register(registry);
    }

    public Timer hotRetrievalLatency() {
        return Timer.builder("memquest.hot.retrieval.latency").register(registry);
    }

    public Counter hotRetrievalTimeouts() {
        return Counter.builder("memquest.hot.retrieval.timeouts").register(registry);
    }

    public Counter hotRetrievalFallbacks() {
        return Counter.builder("memquest.hot.retrieval.fallbacks").register(registry);
    }

    // cold path

    public Counter coldIngests() {
        return Counter.builder("memquest.cold.ingest.count").register(registry);
    }

    public Counter coldStored() {
        return Counter.builder("memquest.cold.ingest.stored").register(registry);
    }

    public Counter coldSkipped(String reason) {
        return Counter.builder("memquest.cold.ingest.skipped").tag("reason", reason).register(registry);
    }

    public Counter coldFailed(String reason) {
        return Counter.builder("memquest.cold.ingest.failed").tag("reason", reason).register(registry);
    }

    public Timer embedLatency() {
        return Timer.builder("memquest.cold.embed.latency").register(registry);
    }

    public Timer upsertLatency() {
        return Timer.builder("memquest.cold.upsert.latency").register(registry);
    }

    public Counter deadLettered() {
        return Counter.builder("memquest.cold.dlq.count").register(registry);
    }

    public Counter enqueueDropped() {
        return Counter.builder("memquest.cold.enqueue.dropped").register(registry);
    }

    /** Flat view of every memquest meter: counters by count, timers by count and total ms. */
    public Map<String, Double> snapshot() {
        var out = new LinkedHashMap<String, Double>();
        for (var meter : registry.getMeters()) {
            var id = meter.getId();
            if (!id.getName().startsWith("memquest.")) continue;
            var key = id.getName() + id.getTags().stream()
                    .map(t -> "," + t.getKey() + "=" + t.getValue())
                    .reduce("", String::concat);
            if (meter instanceof Counter c) {
                out.merge(key, c.count(), Double::sum);
            } else if (meter instanceof Timer t) {
                out.put(key + ".count", (double) t.count());
                out.put(key + ".total_ms", t.totalTime(TimeUnit.MILLISECONDS));
            }
        }
        return out;
    }
}
