package com.memquest.gateway.http;

import com.memquest.ingestion.IngestionPipeline;
import com.memquest.ingestion.IngestionResult;
import com.memquest.memory.MemoryAdapter;
import com.memquest.observability.MemoryDoctor;
import com.memquest.observability.MemoryMetrics;
import com.memquest.shared.model.MemoryEvent;
import com.memquest.shared.model.MemoryHit;
import com.memquest.shared.model.QueryContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/memory")
public class MemoryController {

    private final MemoryAdapter memory;
    private final IngestionPipeline pipeline;
    private final MemoryMetrics metrics;
    private final MemoryDoctor doctor;

    public MemoryController(MemoryAdapter memory, IngestionPipeline pipeline, MemoryMetrics metrics,
                            MemoryDoctor doctor) {
        this.memory = memory;
        this.pipeline = pipeline;
        this.metrics = metrics;
        this.doctor = doctor;
    }

    @PostMapping("/retrieve")
    public Map<String, Object> retrieve(@RequestBody Map<String, Object> body) {
        var query = QueryContext.of(
                string(body, "text"), string(body, "user_id"), string(body, "tenant_id"), string(body, "agent_id"));
        int k = body.get("k") instanceof Number n ? n.intValue() : 0;
        var hits = memory.retrieve(query, k, filters(body.get("filters")));
        return Map.of("hits", hits.stream().map(MemoryController::toWire).toList());
    }

    @PostMapping(value = "/events", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> enqueue(@RequestBody String payload) {
        try {
            memory.enqueueWrite(MemoryEvent.fromJson(payload));
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "accepted"));
        } catch (IOException e) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "reason", "parse_failure"));
        }
    }

    @PostMapping(value = "/ingest", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody String payload) {
        var result = pipeline.processEvent(payload);
        if (result.status() == IngestionResult.Status.ERROR && "parse_failure".equals(result.reason())) {
            return ResponseEntity.badRequest().body(result.toMap());
        }
        return ResponseEntity.ok(result.toMap());
    }

    @GetMapping("/metrics")
    public Map<String, Double> metrics() {
        return metrics.snapshot();
    }

    @GetMapping(value = "/doctor", produces = MediaType.TEXT_PLAIN_VALUE)
    public String doctor() {
        return doctor.run();
    }

    static Map<String, Object> toWire(MemoryHit hit) {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("id", hit.id());
        wire.put("text_snippet", hit.textSnippet());
        wire.put("score", hit.score());
        wire.put("source", hit.source());
        wire.put("metadata", hit.metadata());
        return wire;
    }

    static String string(Map<String, Object> body, String key) {
        var value = body.get(key);
        return value != null ? value.toString() : "";
    }

    private static Map<String, String> filters(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) return null;
        var out = new LinkedHashMap<String, String>();
        map.forEach((k, v) -> {
            if (k != null && v != null) out.put(k.toString(), v.toString());
        });
        return out;
    }

    static List<String> tags(Object raw) {
        if (!(raw instanceof List<?> list)) return List.of();
        return list.stream().filter(t -> t != null).map(Object::toString).toList();
    }
}
