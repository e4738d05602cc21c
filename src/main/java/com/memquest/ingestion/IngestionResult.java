package com.memquest.ingestion;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal outcome of one event passing through the {@link IngestionPipeline}.
 *
 * @param docId     {@code null} unless the event got as far as the store
 * @param expiresAt {@code null} for durable facts and for events that were not stored
 */
public record IngestionResult(Status status, String reason, String docId, Instant expiresAt, UpsertResult upsert) {

    public enum Status {
        STORED, SKIPPED, ERROR;

        public String code() {
            return name().toLowerCase();
        }
    }

    static IngestionResult stored(String docId, Instant expiresAt, UpsertResult upsert) {
        return new IngestionResult(Status.STORED, null, docId, expiresAt, upsert);
    }

    static IngestionResult skipped(String reason) {
        return new IngestionResult(Status.SKIPPED, reason, null, null, null);
    }

    static IngestionResult error(String reason, String docId, UpsertResult upsert) {
        return new IngestionResult(Status.ERROR, reason, docId, null, upsert);
    }

    public boolean isStored() {
        return status == Status.STORED;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", status.code());
        if (reason != null) map.put("reason", reason);
        if (docId != null) map.put("id", docId);
        map.put("expires_at", expiresAt != null ? expiresAt.toString() : null);
        if (upsert != null) {
            map.put("success", upsert.success());
            map.put("failed", upsert.failed());
        }
        return map;
    }
}
