package com.memquest.retrieval;

import com.memquest.providers.RerankProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional second-stage ordering. Disabled, unconfigured or failing reranks all
 * leave the fused order untouched, and no candidate is ever dropped.
 */
public class SemanticReranker {

    private static final Logger log = LoggerFactory.getLogger(SemanticReranker.class);

    private final RerankProvider provider;
    private final boolean enabled;
    private final String configName;

    public SemanticReranker(RerankProvider provider, boolean enabled, String configName) {
        this.provider = provider;
        this.enabled = enabled;
        this.configName = configName;
    }

    public boolean active() {
        return enabled && provider != null;
    }

    public List<RerankCandidate> rerank(List<RerankCandidate> candidates, String query) {
        if (!active() || candidates == null || candidates.isEmpty()) return candidates;
        try {
            var texts = candidates.stream().map(RerankCandidate::text).toList();
            var scores = provider.rerank(query, texts, configName);

            var out = new ArrayList<RerankCandidate>(candidates.size());
            var placed = new boolean[candidates.size()];
            for (var s : scores) {
                int i = s.index();
                if (i < 0 || i >= candidates.size() || placed[i]) continue;
                placed[i] = true;
                out.add(candidates.get(i).withSemanticScore(s.relevanceScore()));
            }
            for (int i = 0; i < candidates.size(); i++) {
                if (!placed[i]) out.add(candidates.get(i));
            }
            log.debug("Reranked {} candidates ({} scored)", candidates.size(), scores.size());
            return out;
        } catch (Exception e) {
            log.warn("Semantic rerank failed, keeping fused order: {}", e.getMessage());
            return candidates;
        }
    }
}
