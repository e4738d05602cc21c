package com.memquest.shared.config;

public record MemQuestConfig(
    int serverPort,
    MemoryConfig memory,
    PiiConfig pii,
    DeciderConfig decider,
    EmbeddingConfig embedding,
    RerankConfig rerank,
    UpsertConfig upsert,
    StreamConfig stream,
    DeadLetterConfig deadLetter,
    LlmConfig llm
) {

    public record MemoryConfig(boolean enabled, boolean hotRetrievalEnabled, boolean coldIngestEnabled,
                               int k, int rrfK, long retrievalTimeoutMs, String indexPath) {
        public static MemoryConfig defaults() {
            return new MemoryConfig(true, true, true, 8, 60, 10_000,
                    System.getProperty("user.home") + "/.memquest/index");
        }
    }

    public record PiiConfig(boolean enabled, String mode) {
        public static PiiConfig defaults() {
            return new PiiConfig(true, "mask");
        }
    }

    public record DeciderConfig(int minTextLength, int defaultTtlDays, int seenCapacity, boolean llmEnabled) {
        public static DeciderConfig defaults() {
            return new DeciderConfig(15, 30, 50_000, false);
        }
    }

    public record EmbeddingConfig(String baseUrl, String apiKey, String model, int dimensions,
                                  int cacheSize, int maxRetries, long backoffMs) {
        public static EmbeddingConfig defaults() {
            return new EmbeddingConfig("", "", "text-embedding-3-large", 1024, 10_000, 3, 1000);
        }

        public boolean configured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    public record RerankConfig(boolean enabled, String configName, String baseUrl, String apiKey) {
        public static RerankConfig defaults() {
            return new RerankConfig(false, "default", "", "");
        }

        public boolean configured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    public record UpsertConfig(int maxRetries, long backoffMs) {
        public static UpsertConfig defaults() {
            return new UpsertConfig(3, 1000);
        }
    }

    public record StreamConfig(String name, int partitions, String consumerGroup,
                               int enqueueCapacity, String overflowPolicy, int maxRetainedEvents) {
        public static StreamConfig defaults() {
            return new StreamConfig("memory-events", 4, "$Default", 1024, "drop-oldest", 10_000);
        }
    }

    public record DeadLetterConfig(String jdbcUrl, String username, String password) {
        public static DeadLetterConfig defaults() {
            return new DeadLetterConfig("", "memquest", "memquest");
        }

        public boolean configured() {
            return jdbcUrl != null && !jdbcUrl.isBlank();
        }
    }

    public record LlmConfig(String baseUrl, String apiKey, String model) {
        public static LlmConfig defaults() {
            return new LlmConfig("", "", "gpt-4o-mini");
        }

        public boolean configured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    public static MemQuestConfig defaults() {
        return new MemQuestConfig(
            18790,
            MemoryConfig.defaults(),
            PiiConfig.defaults(),
            DeciderConfig.defaults(),
            EmbeddingConfig.defaults(),
            RerankConfig.defaults(),
            UpsertConfig.defaults(),
            StreamConfig.defaults(),
            DeadLetterConfig.defaults(),
            LlmConfig.defaults()
        );
    }
}
