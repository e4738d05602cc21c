package com.memquest.shared.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unit of conversational signal emitted by an agent for cold-path ingestion.
 *
 * @param id           document id; blank until derived by the ingestion pipeline
 * @param ts           seconds since epoch
 * @param toolOutputs  opaque tool output payload, may be {@code null}
 */
public record MemoryEvent(
    String id,
    String agentId,
    String userId,
    String tenantId,
    double ts,
    String text,
    String toolOutputs,
    List<String> tags,
    boolean piiSuspected
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public MemoryEvent {
        id = id != null ? id : "";
        agentId = agentId != null ? agentId : "";
        userId = userId != null ? userId : "";
        tenantId = tenantId != null ? tenantId : "";
        text = text != null ? text : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static MemoryEvent of(String agentId, String userId, String tenantId, String text, List<String> tags) {
        return new MemoryEvent("", agentId, userId, tenantId, nowSeconds(), text, null, tags, false);
    }

    /** Copy carrying the redacted text and the detector's verdict. */
    public MemoryEvent withRedaction(String redactedText, boolean piiDetected) {
        return new MemoryEvent(id, agentId, userId, tenantId, ts, redactedText, toolOutputs, tags, piiDetected);
    }

    public MemoryEvent withId(String newId) {
        return new MemoryEvent(newId, agentId, userId, tenantId, ts, text, toolOutputs, tags, piiSuspected);
    }

    /** sha256(tenant|user|agent|ts|contentHash), hex encoded, with ts as rendered by {@link #formatTs}. */
    public static String generateId(String tenantId, String userId, String agentId,
                                    double ts, String contentHash) {
        return sha256(tenantId + "|" + userId + "|" + agentId + "|" + formatTs(ts) + "|" + contentHash);
    }

    /** Plain decimal with at least one fractional digit: {@code 1760000000.5}, {@code 1760000000.0}. */
    static String formatTs(double ts) {
        if (Double.isNaN(ts)) return "nan";
        if (Double.isInfinite(ts)) return ts > 0 ? "inf" : "-inf";
        var plain = BigDecimal.valueOf(ts).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    public static String contentHash(String text) {
        return sha256(text);
    }

    /**
     * Parses the event-stream wire format. Missing optional fields take their
     * defaults; a missing {@code ts} means "now".
     *
     * @throws IOException when the payload is not a JSON object
     */
    public static MemoryEvent fromJson(String payload) throws IOException {
        var root = MAPPER.readTree(payload);
        if (root == null || !root.isObject()) {
            throw new IOException("Event payload is not a JSON object");
        }
        var tags = new ArrayList<String>();
        var tagNode = root.path("tags");
        if (tagNode.isArray()) {
            tagNode.forEach(t -> tags.add(t.asText()));
        }
        var ts = root.path("ts");
        return new MemoryEvent(
            root.path("id").asText(""),
            root.path("agent_id").asText(""),
            root.path("user_id").asText(""),
            root.path("tenant_id").asText(""),
            ts.isNumber() ? ts.asDouble() : nowSeconds(),
            root.path("text").asText(""),
            textOrNull(root.path("tool_outputs")),
            tags,
            root.path("pii_suspected").asBoolean(false)
        );
    }

    public Map<String, Object> toWire() {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("id", id);
        wire.put("agent_id", agentId);
        wire.put("user_id", userId);
        wire.put("tenant_id", tenantId);
        wire.put("ts", ts);
        wire.put("text", text);
        wire.put("tool_outputs", toolOutputs);
        wire.put("tags", tags);
        wire.put("pii_suspected", piiSuspected);
        return wire;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toWire());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize event " + id, e);
        }
    }

    static double nowSeconds() {
        return System.currentTimeMillis() / 1000.0;
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) return null;
        return node.isTextual() ? node.asText() : node.toString();
    }

    private static String sha256(String raw) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
