package com.memquest.shared.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads {@code ~/.memquest/config.yaml}. Environment variables win over the file,
 * the file wins over the built-in defaults.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".memquest", "config.yaml"
    );

    public static MemQuestConfig load() {
        return load(DEFAULT_PATH);
    }

    public static MemQuestConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static MemQuestConfig load(Path path, Map<String, String> vars) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = section(raw, "server");
        var env = new Env(vars);
        return new MemQuestConfig(
            env.integer("MEMQUEST_PORT", server.getOrDefault("port", 18790)),
            parseMemory(section(raw, "memory"), env),
            parsePii(section(raw, "pii"), env),
            parseDecider(section(raw, "decider"), env),
            parseEmbedding(section(raw, "embedding"), env),
            parseRerank(section(raw, "rerank"), env),
            parseUpsert(section(raw, "upsert")),
            parseStream(section(raw, "stream"), env),
            parseDeadLetter(section(raw, "dead-letter"), env),
            parseLlm(section(raw, "llm"), env)
        );
    }

    private static MemQuestConfig.MemoryConfig parseMemory(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.MemoryConfig.defaults();
        return new MemQuestConfig.MemoryConfig(
            env.bool("MEMORY_ENABLED", m.getOrDefault("enabled", d.enabled())),
            env.bool("HOT_RETRIEVAL_ENABLED", m.getOrDefault("hot-retrieval-enabled", d.hotRetrievalEnabled())),
            env.bool("COLD_INGEST_ENABLED", m.getOrDefault("cold-ingest-enabled", d.coldIngestEnabled())),
            env.integer("MEMORY_K", m.getOrDefault("k", d.k())),
            env.integer("RRF_K", m.getOrDefault("rrf-k", d.rrfK())),
            env.longValue("MEMORY_RETRIEVAL_TIMEOUT_MS", m.getOrDefault("retrieval-timeout-ms", d.retrievalTimeoutMs())),
            env.string("MEMORY_INDEX_PATH", m.getOrDefault("index-path", d.indexPath()))
        );
    }

    private static MemQuestConfig.PiiConfig parsePii(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.PiiConfig.defaults();
        return new MemQuestConfig.PiiConfig(
            env.bool("PII_REDACTION_ENABLED", m.getOrDefault("enabled", d.enabled())),
            env.string("PII_REDACTION_MODE", m.getOrDefault("mode", d.mode()))
        );
    }

    private static MemQuestConfig.DeciderConfig parseDecider(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.DeciderConfig.defaults();
        return new MemQuestConfig.DeciderConfig(
            Integer.parseInt(String.valueOf(m.getOrDefault("min-text-length", d.minTextLength()))),
            Integer.parseInt(String.valueOf(m.getOrDefault("default-ttl-days", d.defaultTtlDays()))),
            Integer.parseInt(String.valueOf(m.getOrDefault("seen-capacity", d.seenCapacity()))),
            env.bool("MEMORY_DECIDER_LLM_ENABLED", m.getOrDefault("llm-enabled", d.llmEnabled()))
        );
    }

    private static MemQuestConfig.EmbeddingConfig parseEmbedding(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.EmbeddingConfig.defaults();
        return new MemQuestConfig.EmbeddingConfig(
            env.string("EMBEDDING_BASE_URL", m.getOrDefault("base-url", d.baseUrl())),
            env.string("EMBEDDING_API_KEY", m.getOrDefault("api-key", d.apiKey())),
            env.string("EMBEDDING_MODEL", m.getOrDefault("model", d.model())),
            env.integer("VECTOR_DIM", m.getOrDefault("dimensions", d.dimensions())),
            Integer.parseInt(String.valueOf(m.getOrDefault("cache-size", d.cacheSize()))),
            Integer.parseInt(String.valueOf(m.getOrDefault("max-retries", d.maxRetries()))),
            Long.parseLong(String.valueOf(m.getOrDefault("backoff-ms", d.backoffMs())))
        );
    }

    private static MemQuestConfig.RerankConfig parseRerank(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.RerankConfig.defaults();
        return new MemQuestConfig.RerankConfig(
            env.bool("SEMANTIC_RERANK_ENABLED", m.getOrDefault("enabled", d.enabled())),
            env.string("SEMANTIC_RERANK_CONFIG_NAME", m.getOrDefault("config-name", d.configName())),
            env.string("RERANK_BASE_URL", m.getOrDefault("base-url", d.baseUrl())),
            env.string("RERANK_API_KEY", m.getOrDefault("api-key", d.apiKey()))
        );
    }

    private static MemQuestConfig.UpsertConfig parseUpsert(Map<String, Object> m) {
        var d = MemQuestConfig.UpsertConfig.defaults();
        return new MemQuestConfig.UpsertConfig(
            Integer.parseInt(String.valueOf(m.getOrDefault("max-retries", d.maxRetries()))),
            Long.parseLong(String.valueOf(m.getOrDefault("backoff-ms", d.backoffMs())))
        );
    }

    private static MemQuestConfig.StreamConfig parseStream(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.StreamConfig.defaults();
        return new MemQuestConfig.StreamConfig(
            env.string("EVENT_STREAM_NAME", m.getOrDefault("name", d.name())),
            Integer.parseInt(String.valueOf(m.getOrDefault("partitions", d.partitions()))),
            env.string("EVENT_STREAM_CONSUMER_GROUP", m.getOrDefault("consumer-group", d.consumerGroup())),
            Integer.parseInt(String.valueOf(m.getOrDefault("enqueue-capacity", d.enqueueCapacity()))),
            String.valueOf(m.getOrDefault("overflow-policy", d.overflowPolicy())),
            Integer.parseInt(String.valueOf(m.getOrDefault("max-retained-events", d.maxRetainedEvents())))
        );
    }

    private static MemQuestConfig.DeadLetterConfig parseDeadLetter(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.DeadLetterConfig.defaults();
        return new MemQuestConfig.DeadLetterConfig(
            env.string("DEAD_LETTER_JDBC_URL", m.getOrDefault("jdbc-url", d.jdbcUrl())),
            env.string("DEAD_LETTER_DB_USER", m.getOrDefault("username", d.username())),
            env.string("DEAD_LETTER_DB_PASS", m.getOrDefault("password", d.password()))
        );
    }

    private static MemQuestConfig.LlmConfig parseLlm(Map<String, Object> m, Env env) {
        var d = MemQuestConfig.LlmConfig.defaults();
        return new MemQuestConfig.LlmConfig(
            env.string("LLM_BASE_URL", m.getOrDefault("base-url", d.baseUrl())),
            env.string("LLM_API_KEY", m.getOrDefault("api-key", d.apiKey())),
            env.string("LLM_MODEL", m.getOrDefault("model", d.model()))
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String name) {
        var value = raw.get(name);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private record Env(Map<String, String> vars) {

        String string(String name, Object fallback) {
            var val = vars.get(name);
            return val != null ? val : String.valueOf(fallback);
        }

        int integer(String name, Object fallback) {
            var val = vars.get(name);
            if (val != null) {
                try {
                    return Integer.parseInt(val.trim());
                } catch (NumberFormatException e) {
                    log.warn("Ignoring malformed {}={}", name, val);
                }
            }
            return Integer.parseInt(String.valueOf(fallback));
        }

        long longValue(String name, Object fallback) {
            var val = vars.get(name);
            if (val != null) {
                try {
                    return Long.parseLong(val.trim());
                } catch (NumberFormatException e) {
                    log.warn("Ignoring malformed {}={}", name, val);
                }
            }
            return Long.parseLong(String.valueOf(fallback));
        }

        boolean bool(String name, Object fallback) {
            var val = vars.get(name);
            var text = val != null ? val : String.valueOf(fallback);
            var normalized = text.trim().toLowerCase();
            return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
        }
    }
}
