package com.memquest.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion over any number of ranked id lists. Only positions
 * matter: an id at 1-based rank {@code r} in a list gains {@code 1 / (k + r)}.
 */
public final class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private ReciprocalRankFusion() {}

    public static List<RankedId> fuse(List<List<String>> rankedLists) {
        return fuse(rankedLists, DEFAULT_K, null);
    }

    /**
     * @param topK maximum number of results, {@code null} for all of them
     * @return fused ids, best first; equal scores keep first-seen order
     */
    public static List<RankedId> fuse(List<List<String>> rankedLists, int k, Integer topK) {
        if (k < 0) throw new IllegalArgumentException("k must be >= 0");
        Map<String, Double> scores = new LinkedHashMap<>();
        if (rankedLists != null) {
            for (var list : rankedLists) {
                if (list == null) continue;
                int rank = 1;
                for (var id : list) {
                    if (id != null) scores.merge(id, 1.0 / (k + rank), Double::sum);
                    rank++;
                }
            }
        }

        var fused = new ArrayList<RankedId>(scores.size());
        scores.forEach((id, score) -> fused.add(new RankedId(id, score)));
        fused.sort(Comparator.comparingDouble(RankedId::score).reversed());

        if (topK != null && topK >= 0 && topK < fused.size()) {
            return List.copyOf(fused.subList(0, topK));
        }
        return List.copyOf(fused);
    }
}
