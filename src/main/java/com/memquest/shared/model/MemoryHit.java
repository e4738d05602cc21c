package com.memquest.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One retrieval result. {@code score} is only comparable within a single retrieval call.
 */
public record MemoryHit(String id, String textSnippet, double score, String source, Map<String, Object> metadata) {

    public MemoryHit {
        var meta = new LinkedHashMap<String, Object>();
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) meta.put(k, v);
            });
        }
        metadata = Collections.unmodifiableMap(meta);
    }
}
