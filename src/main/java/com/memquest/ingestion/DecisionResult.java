package com.memquest.ingestion;

import java.time.Instant;

/**
 * @param expiresAt {@code null} means durable (no TTL)
 */
public record DecisionResult(boolean shouldStore, DecisionReason reason, Instant expiresAt, String contentHash) {

    static DecisionResult reject(DecisionReason reason, String contentHash) {
        return new DecisionResult(false, reason, null, contentHash);
    }
}
