package com.memquest.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memquest.memory.MemoryFields;
import com.memquest.observability.LogContext;
import com.memquest.observability.MemoryMetrics;
import com.memquest.shared.model.MemoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cold-path orchestration for a single event: parse, redact, decide, embed,
 * build the document, upsert. Steps run strictly in that order and every
 * event ends in exactly one of stored, skipped or error.
 */
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String PARSE_FAILURE = "parse_failure";
    static final String UPSERT_FAILED = "upsert_failed";

    private final PiiRedactor redactor;
    private final MemoryDecider decider;
    private final Embedder embedder;
    private final Upserter upserter;
    private final MemoryMetrics metrics;

    public IngestionPipeline(PiiRedactor redactor, MemoryDecider decider, Embedder embedder,
                             Upserter upserter, MemoryMetrics metrics) {
        this.redactor = redactor;
        this.decider = decider;
        this.embedder = embedder;
        this.upserter = upserter;
        this.metrics = metrics;
    }

    /** Entry point for raw stream payloads. */
    public IngestionResult processEvent(String payload) {
        metrics.coldIngests().increment();
        MemoryEvent event;
        try {
            event = MemoryEvent.fromJson(payload);
        } catch (IOException e) {
            log.warn("Dropping unparseable event: {}", e.getMessage());
            metrics.coldFailed(PARSE_FAILURE).increment();
            return IngestionResult.error(PARSE_FAILURE, null, null);
        }
        return run(event);
    }

    public IngestionResult process(MemoryEvent event) {
        metrics.coldIngests().increment();
        return run(event);
    }

    private IngestionResult run(MemoryEvent event) {
        try (var ctx = LogContext.open(event.tenantId(), event.agentId(), event.id())) {
            var redaction = redactor.redact(event.text());
            var redacted = event.withRedaction(redaction.text(), redaction.piiDetected());
            if (redaction.piiDetected()) {
                log.info("Redacted PII from event: {}", redaction.piiTypes());
            }

            var decision = decider.decide(redacted.text(), redacted.tags());
            if (!decision.shouldStore()) {
                log.debug("Skipping event: {}", decision.reason().code());
                metrics.coldSkipped(decision.reason().code()).increment();
                return IngestionResult.skipped(decision.reason().code());
            }

            var vector = embedder.generateEmbeddings(List.of(redacted.text())).get(0);

            var docId = redacted.id().isBlank()
                    ? MemoryEvent.generateId(redacted.tenantId(), redacted.userId(), redacted.agentId(),
                            redacted.ts(), decision.contentHash())
                    : redacted.id();
            ctx.eventId(docId);

            var document = toDocument(redacted.withId(docId), vector, decision);
            var upsert = upserter.upsert(List.of(document));
            if (upsert.success() == 0) {
                log.warn("Event {} was not written; see dead letters", docId);
                metrics.coldFailed(UPSERT_FAILED).increment();
                return IngestionResult.error(UPSERT_FAILED, docId, upsert);
            }
            metrics.coldStored().increment();
            log.info("Stored memory {} (expires {})", docId,
                    decision.expiresAt() != null ? decision.expiresAt() : "never");
            return IngestionResult.stored(docId, decision.expiresAt(), upsert);
        }
    }

    static Map<String, Object> toDocument(MemoryEvent event, float[] vector, DecisionResult decision) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put(MemoryFields.ID, event.id());
        doc.put(MemoryFields.AGENT_ID, event.agentId());
        doc.put(MemoryFields.TENANT_ID, event.tenantId());
        doc.put(MemoryFields.USER_ID, event.userId());
        doc.put(MemoryFields.TS, event.ts());
        doc.put(MemoryFields.TEXT, event.text());
        doc.put(MemoryFields.TAGS, event.tags());
        doc.put(MemoryFields.VECTOR, vector);
        doc.put(MemoryFields.METADATA_JSON, metadataJson(event, decision.contentHash()));
        if (decision.expiresAt() != null) {
            doc.put(MemoryFields.EXPIRES_AT, decision.expiresAt());
        }
        return doc;
    }

    private static String metadataJson(MemoryEvent event, String contentHash) {
        var meta = new LinkedHashMap<String, Object>();
        meta.put("tool_outputs", event.toolOutputs());
        meta.put("pii_suspected", event.piiSuspected());
        meta.put("content_hash", contentHash);
        try {
            return MAPPER.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metadata for " + event.id(), e);
        }
    }
}
