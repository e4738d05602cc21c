package com.memquest.observability;

import com.memquest.deadletter.JdbcDeadLetterStore;
import com.memquest.memory.DocumentStore;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;

/**
 * Health report over the memory collaborators, one {@code [OK]/[WARN]/[FAIL]} line each.
 */
public class MemoryDoctor {

    private final DocumentStore store;
    private final String embeddingBaseUrl;
    private final JdbcDeadLetterStore deadLetters;

    /**
     * @param embeddingBaseUrl blank when no embedding endpoint is configured
     * @param deadLetters      {@code null} when dead letters are only logged
     */
    public MemoryDoctor(DocumentStore store, String embeddingBaseUrl, JdbcDeadLetterStore deadLetters) {
        this.store = store;
        this.embeddingBaseUrl = embeddingBaseUrl;
        this.deadLetters = deadLetters;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkIndex());
        results.add(checkEmbeddingEndpoint());
        results.add(checkDeadLetters());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkIndex() {
        try {
            return "[OK] Memory index (" + store.name() + "): " + store.count() + " documents";
        } catch (Exception e) {
            return "[FAIL] Memory index: " + e.getMessage();
        }
    }

    private String checkEmbeddingEndpoint() {
        if (embeddingBaseUrl == null || embeddingBaseUrl.isBlank()) {
            return "[WARN] Embedding endpoint not configured (keyword search only)";
        }
        try {
            var client = HttpClient.newHttpClient();
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(embeddingBaseUrl))
                    .timeout(Duration.ofSeconds(5))
                    .GET().build();
            var resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            return resp.statusCode() < 500
                    ? "[OK] Embedding endpoint reachable"
                    : "[FAIL] Embedding endpoint: HTTP " + resp.statusCode();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "[FAIL] Embedding endpoint: interrupted";
        } catch (Exception e) {
            return "[FAIL] Embedding endpoint: " + e.getMessage();
        }
    }

    private String checkDeadLetters() {
        if (deadLetters == null) return "[WARN] Dead letters are logged only (no database configured)";
        try (var conn = deadLetters.dataSource().getConnection();
             var ps = conn.prepareStatement("SELECT 1");
             var rs = ps.executeQuery()) {
            long pending = deadLetters.pending();
            return pending > 0
                    ? "[WARN] Dead-letter store: " + pending + " documents awaiting replay"
                    : "[OK] Dead-letter store";
        } catch (Exception e) {
            return "[FAIL] Dead-letter store: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
