package com.memquest.retrieval;

import java.util.Map;

/**
 * A fused retrieval candidate on its way to the reranker.
 *
 * @param semanticScore set only once the reranker has scored the candidate
 */
public record RerankCandidate(String id, String text, double fusedScore, Double semanticScore,
                              Map<String, Object> metadata) {

    public RerankCandidate withSemanticScore(double score) {
        return new RerankCandidate(id, text, fusedScore, score, metadata);
    }
}
