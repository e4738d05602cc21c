package com.memquest.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new MemoryMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.hotRetrievals());
        assertNotNull(metrics.hotRetrievalLatency());
        assertNotNull(metrics.coldStored());
        assertNotNull(metrics.deadLettered());
        assertNotNull(metrics.enqueueDropped());
    }

    @Test
    void countersIncrementCorrectly() {
        var metrics = new MemoryMetrics();
        metrics.hotRetrievals().increment();
        metrics.hotRetrievals().increment();
        assertEquals(2.0, metrics.hotRetrievals().count());
    }

    @Test
    void snapshotKeysTaggedCountersSeparately() {
        var metrics = new MemoryMetrics();
        metrics.coldSkipped("duplicate").increment();
        metrics.coldSkipped("duplicate").increment();
        metrics.coldSkipped("too_short").increment();
        metrics.upsertLatency().record(java.time.Duration.ofMillis(12));

        var snapshot = metrics.snapshot();

        assertEquals(2.0, snapshot.get("memquest.cold.ingest.skipped,reason=duplicate"));
        assertEquals(1.0, snapshot.get("memquest.cold.ingest.skipped,reason=too_short"));
        assertEquals(1.0, snapshot.get("memquest.cold.upsert.latency.count"));
        assertTrue(snapshot.get("memquest.cold.upsert.latency.total_ms") >= 12.0);
    }

    @Test
    void deadLettersAreCounted() {
        var metrics = new MemoryMetrics();
        metrics.deadLettered().increment();
        metrics.deadLettered().increment();

        assertEquals("memquest.cold.dlq.count", metrics.deadLettered().getId().getName());
        assertEquals(2.0, metrics.snapshot().get("memquest.cold.dlq.count"));
    }
}
