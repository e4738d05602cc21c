package com.memquest.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("absent.yaml"), Map.of());
        assertEquals(18790, cfg.serverPort());
        assertTrue(cfg.memory().enabled());
        assertTrue(cfg.memory().hotRetrievalEnabled());
        assertTrue(cfg.memory().coldIngestEnabled());
        assertEquals(8, cfg.memory().k());
        assertEquals(60, cfg.memory().rrfK());
        assertEquals(10_000, cfg.memory().retrievalTimeoutMs());
        assertEquals("mask", cfg.pii().mode());
        assertEquals(15, cfg.decider().minTextLength());
        assertEquals(30, cfg.decider().defaultTtlDays());
        assertFalse(cfg.embedding().configured());
        assertEquals(1024, cfg.embedding().dimensions());
        assertFalse(cfg.rerank().enabled());
        assertEquals("drop-oldest", cfg.stream().overflowPolicy());
        assertEquals(10_000, cfg.stream().maxRetainedEvents());
        assertFalse(cfg.deadLetter().configured());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            server:
              port: 9000
            memory:
              enabled: true
              hot-retrieval-enabled: false
              k: 5
              rrf-k: 30
              retrieval-timeout-ms: 2500
              index-path: /tmp/idx
            pii:
              enabled: false
              mode: tag
            decider:
              min-text-length: 20
              default-ttl-days: 7
              llm-enabled: true
            embedding:
              base-url: http://localhost:11434/v1
              model: nomic-embed-text
              dimensions: 768
            rerank:
              enabled: true
              config-name: bge-reranker
              base-url: http://localhost:8081
            stream:
              partitions: 8
              enqueue-capacity: 16
              overflow-policy: drop-newest
              max-retained-events: 500
            dead-letter:
              jdbc-url: jdbc:postgresql://localhost/memquest
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals(9000, cfg.serverPort());
        assertFalse(cfg.memory().hotRetrievalEnabled());
        assertEquals(5, cfg.memory().k());
        assertEquals(30, cfg.memory().rrfK());
        assertEquals(2500, cfg.memory().retrievalTimeoutMs());
        assertEquals("/tmp/idx", cfg.memory().indexPath());
        assertFalse(cfg.pii().enabled());
        assertEquals("tag", cfg.pii().mode());
        assertEquals(20, cfg.decider().minTextLength());
        assertEquals(7, cfg.decider().defaultTtlDays());
        assertTrue(cfg.decider().llmEnabled());
        assertTrue(cfg.embedding().configured());
        assertEquals(768, cfg.embedding().dimensions());
        assertTrue(cfg.rerank().enabled());
        assertEquals("bge-reranker", cfg.rerank().configName());
        assertEquals(8, cfg.stream().partitions());
        assertEquals(16, cfg.stream().enqueueCapacity());
        assertEquals("drop-newest", cfg.stream().overflowPolicy());
        assertEquals(500, cfg.stream().maxRetainedEvents());
        assertTrue(cfg.deadLetter().configured());
    }

    @Test
    void environmentOverridesFile() throws IOException {
        var yaml = """
            memory:
              enabled: true
              k: 5
            pii:
              mode: tag
            """;
        var env = Map.of(
                "MEMORY_ENABLED", "false",
                "MEMORY_K", "12",
                "RRF_K", "10",
                "PII_REDACTION_MODE", "drop",
                "VECTOR_DIM", "256",
                "SEMANTIC_RERANK_ENABLED", "1");
        var cfg = writeAndLoad(yaml, env);
        assertFalse(cfg.memory().enabled());
        assertEquals(12, cfg.memory().k());
        assertEquals(10, cfg.memory().rrfK());
        assertEquals("drop", cfg.pii().mode());
        assertEquals(256, cfg.embedding().dimensions());
        assertTrue(cfg.rerank().enabled());
    }

    @Test
    void malformedNumericOverrideKeepsFileValue() throws IOException {
        var cfg = writeAndLoad("memory:\n  k: 4\n", Map.of("MEMORY_K", "many"));
        assertEquals(4, cfg.memory().k());
    }

    private MemQuestConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env);
    }
}
