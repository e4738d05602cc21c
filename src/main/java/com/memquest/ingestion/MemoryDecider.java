package com.memquest.ingestion;

import com.memquest.shared.model.MemoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a piece of text is worth persisting and for how long.
 * Checks run in order: duplicate, too short, chit-chat, then acceptance with a
 * TTL unless a durable tag is present.
 */
public class MemoryDecider {

    private static final Logger log = LoggerFactory.getLogger(MemoryDecider.class);

    public static final int DEFAULT_MIN_TEXT_LENGTH = 15;
    public static final int DEFAULT_TTL_DAYS = 30;

    static final Set<String> DURABLE_TAGS = Set.of(
        "preference", "constraint", "decision", "tool_outcome", "task_state", "fact", "final_answer"
    );

    static final Set<String> CHIT_CHAT = Set.of(
        "hi", "hello", "hey", "ok", "okay", "thanks", "thank you", "bye", "yes", "no", "sure", "cool"
    );

    private final SeenHashCache seen;
    private final int minTextLength;
    private final Duration ttl;
    private final Clock clock;
    private final MemoryClassifier classifier;

    public MemoryDecider(SeenHashCache seen) {
        this(seen, DEFAULT_MIN_TEXT_LENGTH, DEFAULT_TTL_DAYS, Clock.systemUTC(), null);
    }

    /**
     * @param classifier optional LLM-assisted override, {@code null} for heuristics only
     */
    public MemoryDecider(SeenHashCache seen, int minTextLength, int ttlDays, Clock clock,
                         MemoryClassifier classifier) {
        this.seen = seen;
        this.minTextLength = minTextLength;
        this.ttl = Duration.ofDays(ttlDays);
        this.clock = clock;
        this.classifier = classifier;
    }

    public DecisionResult decide(String text, Collection<String> tags) {
        var contentHash = MemoryEvent.contentHash(text);
        if (!seen.addIfAbsent(contentHash)) {
            return DecisionResult.reject(DecisionReason.DUPLICATE, contentHash);
        }

        var normalized = text.strip().toLowerCase(Locale.ROOT);
        if (normalized.length() < minTextLength) {
            return DecisionResult.reject(DecisionReason.TOO_SHORT, contentHash);
        }
        if (CHIT_CHAT.contains(normalized)) {
            return DecisionResult.reject(DecisionReason.CHIT_CHAT, contentHash);
        }

        var tagList = tags != null ? List.copyOf(tags) : List.<String>of();
        boolean durable = tagList.stream().anyMatch(DURABLE_TAGS::contains);
        var heuristic = accept(DecisionReason.HEURISTIC_PASS, durable, contentHash);

        if (classifier == null) return heuristic;
        try {
            var verdict = classifier.classify(text, tagList);
            if (verdict.isEmpty()) return heuristic;
            if (!verdict.get().store()) {
                return DecisionResult.reject(DecisionReason.LLM_SKIP, contentHash);
            }
            return accept(DecisionReason.LLM_STORE, durable || verdict.get().durable(), contentHash);
        } catch (Exception e) {
            log.warn("Memory classifier failed, keeping heuristic decision: {}", e.getMessage());
            return heuristic;
        }
    }

    private DecisionResult accept(DecisionReason reason, boolean durable, String contentHash) {
        var expiresAt = durable ? null : clock.instant().plus(ttl);
        return new DecisionResult(true, reason, expiresAt, contentHash);
    }
}
