package com.memquest.ingestion;

import com.memquest.deadletter.DeadLetterHandler;
import com.memquest.memory.DocumentStore;
import com.memquest.memory.MemoryFields;
import com.memquest.observability.MemoryMetrics;
import com.memquest.providers.ResilientCall;
import com.memquest.providers.RetryPolicy;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes memory documents to the {@link DocumentStore} with merge-or-upload
 * semantics. Whole-batch failures are retried; documents that still fail, or
 * that the store rejects individually, go to the {@link DeadLetterHandler}.
 */
public class Upserter {

    private static final Logger log = LoggerFactory.getLogger(Upserter.class);

    private final DocumentStore store;
    private final DeadLetterHandler deadLetters;
    private final RetryPolicy retryPolicy;
    private final MemoryMetrics metrics;

    /**
     * @param store {@code null} when no store is configured; every document is then dead-lettered
     */
    public Upserter(DocumentStore store, DeadLetterHandler deadLetters, RetryPolicy retryPolicy,
                    MemoryMetrics metrics) {
        this.store = store;
        this.deadLetters = deadLetters;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    public UpsertResult upsert(List<Map<String, Object>> documents) {
        if (documents == null || documents.isEmpty()) return UpsertResult.EMPTY;

        var prepared = new ArrayList<Map<String, Object>>(documents.size());
        for (var doc : documents) prepared.add(normalize(doc));

        if (store == null) {
            log.warn("No document store configured; dead-lettering {} documents", prepared.size());
            prepared.forEach(d -> deadLetter(d, "store_not_configured"));
            return new UpsertResult(0, prepared.size());
        }

        var sample = Timer.start(metrics.registry());
        try {
            var results = ResilientCall.execute("upsert", () -> store.mergeOrUpload(prepared), retryPolicy);
            int ok = 0;
            int failed = 0;
            for (int i = 0; i < prepared.size(); i++) {
                var result = i < results.size() ? results.get(i) : null;
                if (result != null && result.succeeded()) {
                    ok++;
                } else {
                    failed++;
                    var error = result != null && result.error() != null ? result.error() : "no result";
                    log.error("Store rejected document {}: {}", prepared.get(i).get(MemoryFields.ID), error);
                    deadLetter(prepared.get(i), error);
                }
            }
            log.info("Upserted {} documents ({} failed)", ok, failed);
            return new UpsertResult(ok, failed);
        } catch (ResilientCall.RetriesExhaustedException e) {
            log.error("Upsert of {} documents failed after retries", prepared.size(), e);
            var reason = e.getCause() != null ? String.valueOf(e.getCause().getMessage()) : e.getMessage();
            prepared.forEach(d -> deadLetter(d, reason));
            return new UpsertResult(0, prepared.size());
        } finally {
            sample.stop(metrics.upsertLatency());
        }
    }

    private void deadLetter(Map<String, Object> document, String reason) {
        metrics.deadLettered().increment();
        try {
            deadLetters.deadLetter(document, reason);
        } catch (RuntimeException e) {
            log.error("Dead-letter handler failed for {}", document.get(MemoryFields.ID), e);
        }
    }

    /** Copy with {@code ts} and {@code expires_at} as ISO-8601 UTC strings. */
    static Map<String, Object> normalize(Map<String, Object> document) {
        var copy = new LinkedHashMap<>(document);
        isoTimestamp(copy, MemoryFields.TS);
        isoTimestamp(copy, MemoryFields.EXPIRES_AT);
        return copy;
    }

    private static void isoTimestamp(Map<String, Object> doc, String field) {
        var value = doc.get(field);
        if (value instanceof Number n) {
            long micros = Math.round(n.doubleValue() * 1_000_000d);
            doc.put(field, Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L),
                    Math.floorMod(micros, 1_000_000L) * 1_000L).toString());
        } else if (value instanceof Instant instant) {
            doc.put(field, instant.toString());
        }
    }
}
