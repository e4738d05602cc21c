package com.memquest.memory;

import com.memquest.shared.config.MemQuestConfig;

import java.time.Duration;

public record AdapterSettings(
    boolean memoryEnabled,
    boolean hotRetrievalEnabled,
    boolean coldIngestEnabled,
    int defaultK,
    int rrfK,
    Duration retrievalTimeout,
    int enqueueCapacity,
    OverflowPolicy overflowPolicy
) {

    public static AdapterSettings from(MemQuestConfig config) {
        var memory = config.memory();
        return new AdapterSettings(
            memory.enabled(),
            memory.hotRetrievalEnabled(),
            memory.coldIngestEnabled(),
            memory.k(),
            memory.rrfK(),
            Duration.ofMillis(memory.retrievalTimeoutMs()),
            Math.max(1, config.stream().enqueueCapacity()),
            OverflowPolicy.parse(config.stream().overflowPolicy())
        );
    }

    public static AdapterSettings defaults() {
        return from(MemQuestConfig.defaults());
    }
}
