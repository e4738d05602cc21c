package com.memquest.gateway;

import com.memquest.agent.MemoryAugmenter;
import com.memquest.deadletter.DeadLetterHandler;
import com.memquest.deadletter.JdbcDeadLetterStore;
import com.memquest.deadletter.LoggingDeadLetterHandler;
import com.memquest.ingestion.Embedder;
import com.memquest.ingestion.IngestionConsumer;
import com.memquest.ingestion.IngestionPipeline;
import com.memquest.ingestion.LlmMemoryClassifier;
import com.memquest.ingestion.MemoryDecider;
import com.memquest.ingestion.PiiRedactor;
import com.memquest.ingestion.RedactionMode;
import com.memquest.ingestion.SeenHashCache;
import com.memquest.ingestion.Upserter;
import com.memquest.memory.AdapterSettings;
import com.memquest.memory.LuceneDocumentStore;
import com.memquest.memory.SearchMemoryAdapter;
import com.memquest.observability.MemoryDoctor;
import com.memquest.observability.MemoryMetrics;
import com.memquest.providers.ChatCompletionClient;
import com.memquest.providers.HttpRerankProvider;
import com.memquest.providers.OpenAiEmbeddingProvider;
import com.memquest.providers.RetryPolicy;
import com.memquest.retrieval.SemanticReranker;
import com.memquest.shared.config.ConfigLoader;
import com.memquest.shared.config.MemQuestConfig;
import com.memquest.stream.InMemoryEventHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public MemQuestConfig memQuestConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public MemoryMetrics memoryMetrics() {
        return new MemoryMetrics();
    }

    @Bean(destroyMethod = "close")
    public LuceneDocumentStore documentStore(MemQuestConfig config) {
        var path = Path.of(config.memory().indexPath());
        log.info("Memory index at {}", path);
        return new LuceneDocumentStore(path);
    }

    @Bean
    public Embedder embedder(MemQuestConfig config, MemoryMetrics metrics) {
        var emb = config.embedding();
        OpenAiEmbeddingProvider provider = null;
        if (emb.configured()) {
            provider = new OpenAiEmbeddingProvider(emb.baseUrl(), emb.apiKey(), emb.model(), emb.dimensions());
        } else {
            log.warn("Embedding endpoint not configured; vector search disabled. Set embedding.base-url "
                    + "in ~/.memquest/config.yaml or EMBEDDING_BASE_URL");
        }
        return new Embedder(provider, emb.dimensions(), emb.cacheSize(),
                RetryPolicy.exponential(emb.maxRetries(), emb.backoffMs()), metrics);
    }

    @Bean
    public DeadLetterHandler deadLetterHandler(MemQuestConfig config) {
        var dl = config.deadLetter();
        if (!dl.configured()) {
            log.info("Dead letters will be logged only");
            return new LoggingDeadLetterHandler();
        }
        var dataSource = DataSourceBuilder.create()
                .url(dl.jdbcUrl())
                .username(dl.username())
                .password(dl.password())
                .build();
        log.info("Dead letters will be stored in {}", dl.jdbcUrl());
        return new JdbcDeadLetterStore(dataSource);
    }

    @Bean
    public IngestionPipeline ingestionPipeline(MemQuestConfig config, LuceneDocumentStore store, Embedder embedder,
                                               DeadLetterHandler deadLetters, MemoryMetrics metrics) {
        var pii = config.pii();
        var redactor = new PiiRedactor(pii.enabled(), RedactionMode.parse(pii.mode()));

        var dc = config.decider();
        LlmMemoryClassifier classifier = null;
        if (dc.llmEnabled()) {
            if (config.llm().configured()) {
                var llm = config.llm();
                classifier = new LlmMemoryClassifier(new ChatCompletionClient(llm.baseUrl(), llm.apiKey(), llm.model()));
            } else {
                log.warn("LLM-assisted memory decisions requested but llm.base-url is not set; using heuristics");
            }
        }
        var decider = new MemoryDecider(new SeenHashCache(dc.seenCapacity()), dc.minTextLength(),
                dc.defaultTtlDays(), Clock.systemUTC(), classifier);

        var up = config.upsert();
        var upserter = new Upserter(store, deadLetters, RetryPolicy.exponential(up.maxRetries(), up.backoffMs()), metrics);
        return new IngestionPipeline(redactor, decider, embedder, upserter, metrics);
    }

    @Bean
    public InMemoryEventHub eventHub(MemQuestConfig config) {
        var stream = config.stream();
        return new InMemoryEventHub(stream.name(), stream.partitions(), stream.maxRetainedEvents());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public IngestionConsumer ingestionConsumer(MemQuestConfig config, InMemoryEventHub hub,
                                               IngestionPipeline pipeline) {
        var memory = config.memory();
        return new IngestionConsumer(hub, pipeline, config.stream().consumerGroup(),
                memory.enabled() && memory.coldIngestEnabled());
    }

    @Bean
    public SemanticReranker semanticReranker(MemQuestConfig config) {
        var rr = config.rerank();
        var provider = rr.configured() ? new HttpRerankProvider(rr.baseUrl(), rr.apiKey()) : null;
        if (rr.enabled() && provider == null) {
            log.warn("Semantic rerank enabled but rerank.base-url is not set; keeping fused order");
        }
        return new SemanticReranker(provider, rr.enabled(), rr.configName());
    }

    @Bean(destroyMethod = "close")
    public SearchMemoryAdapter memoryAdapter(MemQuestConfig config, LuceneDocumentStore store, Embedder embedder,
                                             SemanticReranker reranker, InMemoryEventHub hub, MemoryMetrics metrics) {
        return new SearchMemoryAdapter(AdapterSettings.from(config), store, embedder, reranker, hub, metrics);
    }

    @Bean
    public MemoryAugmenter memoryAugmenter(MemQuestConfig config, SearchMemoryAdapter adapter) {
        return new MemoryAugmenter(adapter, config.memory().k());
    }

    @Bean
    public MemoryDoctor memoryDoctor(MemQuestConfig config, LuceneDocumentStore store, DeadLetterHandler deadLetters) {
        var jdbc = deadLetters instanceof JdbcDeadLetterStore j ? j : null;
        return new MemoryDoctor(store, config.embedding().baseUrl(), jdbc);
    }
}
