package com.memquest.providers;

import java.util.List;

/**
 * Query-scoped relevance scoring over an explicit candidate set.
 */
public interface RerankProvider {

    /** Scores for (a subset of) {@code documents}, best first. */
    List<RerankScore> rerank(String query, List<String> documents, String configName) throws Exception;

    /** {@code index} points into the submitted document list. */
    record RerankScore(int index, double relevanceScore) {}
}
