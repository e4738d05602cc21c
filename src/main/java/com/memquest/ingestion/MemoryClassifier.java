package com.memquest.ingestion;

import java.util.List;
import java.util.Optional;

/**
 * Second opinion on text the heuristics already accepted. An empty result
 * keeps the heuristic outcome.
 */
public interface MemoryClassifier {

    Optional<Classification> classify(String text, List<String> tags) throws Exception;

    record Classification(boolean store, boolean durable) {}
}
