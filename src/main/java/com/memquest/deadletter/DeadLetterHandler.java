package com.memquest.deadletter;

import java.util.Map;

/**
 * Destination for documents that permanently failed to reach the store.
 */
@FunctionalInterface
public interface DeadLetterHandler {
    void deadLetter(Map<String, Object> document, String reason);
}
