package com.memquest.agent;

import com.memquest.memory.MemoryAdapter;
import com.memquest.shared.model.MemoryEvent;
import com.memquest.shared.model.MemoryHit;
import com.memquest.shared.model.QueryContext;

import java.util.List;

/**
 * Chat-agent side of memory: recalls context for an incoming user message and
 * records the message itself for later ingestion.
 */
public class MemoryAugmenter {

    private final MemoryAdapter memory;
    private final int k;

    public MemoryAugmenter(MemoryAdapter memory, int k) {
        this.memory = memory;
        this.k = k;
    }

    public record Augmented(String prompt, List<MemoryHit> memories) {}

    public Augmented augment(String agentId, String userId, String tenantId, String userMessage, List<String> tags) {
        var query = QueryContext.of(userMessage, userId, tenantId, agentId);
        var memories = memory.retrieve(query, k, null);

        var prompt = userMessage;
        if (!memories.isEmpty()) {
            var sb = new StringBuilder();
            for (var m : memories) sb.append("- ").append(m.textSnippet()).append("\n");
            prompt = "[Recalled memories]\n" + sb + "\n[User message]\n" + userMessage;
        }

        memory.enqueueWrite(MemoryEvent.of(agentId, userId, tenantId, userMessage, tags));
        return new Augmented(prompt, memories);
    }
}
