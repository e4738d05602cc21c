package com.memquest.memory;

import com.memquest.ingestion.Embedder;
import com.memquest.observability.LogContext;
import com.memquest.observability.MemoryMetrics;
import com.memquest.retrieval.ReciprocalRankFusion;
import com.memquest.retrieval.RerankCandidate;
import com.memquest.retrieval.SemanticReranker;
import com.memquest.shared.model.MemoryEvent;
import com.memquest.shared.model.MemoryHit;
import com.memquest.shared.model.QueryContext;
import com.memquest.stream.EventProducer;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MemoryAdapter} over a {@link DocumentStore}: hybrid keyword + vector
 * retrieval fused with RRF, optional semantic rerank, and fire-and-forget
 * enqueueing of new events onto the ingestion stream.
 */
public class SearchMemoryAdapter implements MemoryAdapter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchMemoryAdapter.class);

    static final String RRF_SCORE = "rrf_score";

    private final AdapterSettings settings;
    private final DocumentStore store;
    private final Embedder embedder;
    private final SemanticReranker reranker;
    private final EventProducer producer;
    private final MemoryMetrics metrics;
    private final ExecutorService searchExecutor;
    private final ThreadPoolExecutor writeExecutor;

    /**
     * @param producer {@code null} when no event stream is available; enqueued events are then discarded
     */
    public SearchMemoryAdapter(AdapterSettings settings, DocumentStore store, Embedder embedder,
                               SemanticReranker reranker, EventProducer producer, MemoryMetrics metrics) {
        this.settings = settings;
        this.store = store;
        this.embedder = embedder;
        this.reranker = reranker;
        this.producer = producer;
        this.metrics = metrics;

        int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        this.searchExecutor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(256), daemonThreads("memory-search-"),
                new ThreadPoolExecutor.AbortPolicy());
        this.writeExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(settings.enqueueCapacity()), daemonThreads("memory-enqueue-"),
                overflowHandler(settings.overflowPolicy()));
    }

    @Override
    public List<MemoryHit> retrieve(QueryContext query, int k, Map<String, String> filters) {
        return retrieve(query, k, filters, settings.retrievalTimeout());
    }

    /** Same as {@link #retrieve(QueryContext, int, Map)} with an explicit deadline. */
    public List<MemoryHit> retrieve(QueryContext query, int k, Map<String, String> filters, Duration timeout) {
        if (!settings.memoryEnabled() || !settings.hotRetrievalEnabled()) return List.of();
        if (query == null || query.text().isBlank()) return List.of();

        int limit = k > 0 ? k : settings.defaultK();
        metrics.hotRetrievals().increment();
        var sample = Timer.start(metrics.registry());
        long deadline = System.nanoTime() + timeout.toNanos();
        try (var ctx = LogContext.open(query.tenantId(), query.agentId(), null)) {
            try {
                var hits = search(query, limit, filters, deadline);
                log.debug("Retrieved {} memories", hits.size());
                return hits;
            } catch (TimeoutException e) {
                metrics.hotRetrievalTimeouts().increment();
                log.warn("Memory retrieval timed out after {}ms", timeout.toMillis());
                return List.of();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                metrics.hotRetrievalFallbacks().increment();
                log.warn("Memory retrieval interrupted");
                return List.of();
            } catch (Exception e) {
                metrics.hotRetrievalFallbacks().increment();
                log.warn("Memory retrieval failed, continuing without memories: {}", e.toString());
                return List.of();
            }
        } finally {
            sample.stop(metrics.hotRetrievalLatency());
        }
    }

    private List<MemoryHit> search(QueryContext query, int limit, Map<String, String> filters, long deadline)
            throws Exception {
        var filter = SearchFilter.forQuery(query, filters);
        int candidates = limit * 2;
        log.debug("Hybrid search k={} filter=[{}]", limit, filter.toExpression());

        var sparseFuture = CompletableFuture.supplyAsync(
                () -> keywordLeg(query.text(), filter, candidates), searchExecutor);
        var denseFuture = CompletableFuture.supplyAsync(() -> embed(query.text()), searchExecutor)
                .thenApplyAsync(vector -> vectorLeg(vector, filter, candidates), searchExecutor);

        List<StoredHit> sparse;
        List<StoredHit> dense;
        try {
            sparse = await(sparseFuture, deadline);
            dense = await(denseFuture, deadline);
        } catch (TimeoutException | InterruptedException e) {
            sparseFuture.cancel(true);
            denseFuture.cancel(true);
            throw e;
        }

        var byId = new LinkedHashMap<String, StoredHit>();
        sparse.forEach(h -> byId.putIfAbsent(h.id(), h));
        dense.forEach(h -> byId.putIfAbsent(h.id(), h));

        var fused = ReciprocalRankFusion.fuse(
                List.of(ids(sparse), ids(dense)), settings.rrfK(), limit);

        var ranked = new ArrayList<RerankCandidate>(fused.size());
        for (var f : fused) {
            var hit = byId.get(f.id());
            ranked.add(new RerankCandidate(f.id(), hit.text(), f.score(), null, hit.metadata()));
        }

        List<RerankCandidate> ordered = ranked;
        if (reranker != null && reranker.active() && !ranked.isEmpty()) {
            var rerankFuture = CompletableFuture.supplyAsync(
                    () -> reranker.rerank(ranked, query.text()), searchExecutor);
            ordered = await(rerankFuture, deadline);
        }

        var hits = new ArrayList<MemoryHit>(ordered.size());
        for (var c : ordered) {
            var meta = new LinkedHashMap<String, Object>(c.metadata());
            meta.put(RRF_SCORE, c.fusedScore());
            double score = c.semanticScore() != null ? c.semanticScore() : c.fusedScore();
            hits.add(new MemoryHit(c.id(), c.text(), score, store.name(), meta));
        }
        return hits;
    }

    private List<StoredHit> keywordLeg(String text, SearchFilter filter, int top) {
        try {
            return store.keywordSearch(text, filter, top);
        } catch (Exception e) {
            log.warn("Keyword search failed: {}", e.toString());
            return List.of();
        }
    }

    private List<StoredHit> vectorLeg(float[] vector, SearchFilter filter, int top) {
        if (vector.length == 0 || Embedder.isZero(vector)) return List.of();
        try {
            return store.vectorSearch(vector, filter, top);
        } catch (Exception e) {
            log.warn("Vector search failed: {}", e.toString());
            return List.of();
        }
    }

    private float[] embed(String text) {
        try {
            var vectors = embedder.generateEmbeddings(List.of(text));
            return vectors.isEmpty() || vectors.get(0) == null ? new float[0] : vectors.get(0);
        } catch (Exception e) {
            log.warn("Query embedding failed, keyword search only: {}", e.toString());
            return new float[0];
        }
    }

    private static <T> T await(CompletableFuture<T> future, long deadline)
            throws TimeoutException, InterruptedException, ExecutionException {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) throw new TimeoutException();
        return future.get(remaining, TimeUnit.NANOSECONDS);
    }

    private static List<String> ids(List<StoredHit> hits) {
        return hits.stream().map(StoredHit::id).toList();
    }

    @Override
    public void enqueueWrite(MemoryEvent event) {
        if (!settings.memoryEnabled() || !settings.coldIngestEnabled() || event == null) return;
        if (producer == null) {
            log.debug("No event producer configured; discarding memory event");
            return;
        }
        try {
            writeExecutor.execute(() -> send(event));
        } catch (RuntimeException e) {
            log.warn("Could not schedule memory event: {}", e.getMessage());
        }
    }

    private void send(MemoryEvent event) {
        var key = !event.tenantId().isBlank() ? event.tenantId() : event.userId();
        try {
            producer.sendBatch(key, List.of(event.toJson()));
        } catch (Exception e) {
            log.warn("Failed to enqueue memory event for {}: {}", key, e.toString());
        }
    }

    /** Events accepted but not yet handed to the producer. */
    public int pendingWrites() {
        return writeExecutor.getQueue().size();
    }

    @Override
    public void close() {
        writeExecutor.shutdown();
        searchExecutor.shutdownNow();
        try {
            if (!writeExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Dropping {} pending memory events on shutdown", writeExecutor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writeExecutor.shutdownNow();
        }
    }

    private RejectedExecutionHandler overflowHandler(OverflowPolicy policy) {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                log.debug("Adapter closed; discarding memory event");
                return;
            }
            metrics.enqueueDropped().increment();
            if (policy == OverflowPolicy.DROP_OLDEST) {
                executor.getQueue().poll();
                log.warn("Enqueue buffer full; dropped oldest pending memory event");
                executor.execute(task);
            } else {
                log.warn("Enqueue buffer full; dropped new memory event");
            }
        };
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
