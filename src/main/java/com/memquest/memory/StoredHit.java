package com.memquest.memory;

import java.util.Map;

/** A document returned by a store search, with the store's own relevance score. */
public record StoredHit(String id, String text, double score, Map<String, Object> metadata) {}
