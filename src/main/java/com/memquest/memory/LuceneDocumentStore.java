package com.memquest.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link DocumentStore} on a Lucene index. The whole document is kept as JSON in
 * a stored {@code _source} field, which is what merges read back. The text is
 * BM25-searchable, the vector goes to an HNSW field (cosine), every other scalar
 * or list-of-scalars field is indexed as an exact-match keyword for filtering.
 * The writer is opened lazily on first use.
 */
public class LuceneDocumentStore implements DocumentStore, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LuceneDocumentStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final String SOURCE = "_source";
    private static final Set<String> NON_KEYWORD = Set.of(
            MemoryFields.TEXT, MemoryFields.VECTOR, MemoryFields.METADATA_JSON);

    private final Path indexPath;
    private final Object initLock = new Object();
    private final Object writeLock = new Object();
    private final StandardAnalyzer analyzer = new StandardAnalyzer();
    private volatile Directory directory;
    private volatile IndexWriter writer;
    private volatile SearcherManager searcherManager;

    public LuceneDocumentStore(Path indexPath) {
        this.indexPath = indexPath;
    }

    /** For an already opened directory, e.g. {@code ByteBuffersDirectory} in tests. */
    public LuceneDocumentStore(Directory directory) {
        this.indexPath = null;
        this.directory = directory;
    }

    @Override
    public String name() { return "lucene"; }

    public Path indexPath() { return indexPath; }

    /**
     * Batches are applied one at a time: each merge reads the state left by the
     * previous batch, so fields missing from a write are never lost to a race.
     */
    @Override
    public List<WriteResult> mergeOrUpload(List<Map<String, Object>> documents) throws IOException {
        ensureOpen();
        synchronized (writeLock) {
            var results = new ArrayList<WriteResult>(documents.size());
            var batch = new HashMap<String, Map<String, Object>>();
            for (var incoming : documents) {
                var id = incoming.get(MemoryFields.ID) instanceof String s ? s : "";
                if (id.isBlank()) {
                    results.add(WriteResult.failed(id, "missing id"));
                    continue;
                }
                try {
                    var merged = new LinkedHashMap<String, Object>();
                    var existing = batch.containsKey(id) ? Optional.of(batch.get(id)) : get(id);
                    existing.ifPresent(merged::putAll);
                    merged.putAll(incoming);
                    writer.updateDocument(new Term(MemoryFields.ID, id), toLucene(id, merged));
                    batch.put(id, merged);
                    results.add(WriteResult.ok(id));
                } catch (IllegalArgumentException | JsonProcessingException e) {
                    log.warn("Rejected document {}: {}", id, e.getMessage());
                    results.add(WriteResult.failed(id, e.getMessage()));
                }
            }
            writer.commit();
            searcherManager.maybeRefreshBlocking();
            return results;
        }
    }

    @Override
    public List<StoredHit> keywordSearch(String text, SearchFilter filter, int top) throws IOException {
        if (text == null || text.isBlank() || top <= 0) return List.of();
        // lower-cased so AND/OR/NOT in user text are plain terms
        Query parsed;
        try {
            parsed = new QueryParser(MemoryFields.TEXT, analyzer)
                    .parse(QueryParser.escape(text.toLowerCase(Locale.ROOT)));
        } catch (ParseException e) {
            throw new IOException("Unparseable query: " + text, e);
        }
        if (parsed == null) return List.of();
        var builder = new BooleanQuery.Builder().add(parsed, BooleanClause.Occur.MUST);
        addFilters(builder, filter);
        return search(builder.build(), top);
    }

    @Override
    public List<StoredHit> vectorSearch(float[] vector, SearchFilter filter, int top) throws IOException {
        if (vector == null || vector.length == 0 || isZero(vector) || top <= 0) return List.of();
        Query filterQuery = null;
        if (filter != null && !filter.isEmpty()) {
            var builder = new BooleanQuery.Builder();
            addFilters(builder, filter);
            filterQuery = builder.build();
        }
        return search(new KnnFloatVectorQuery(MemoryFields.VECTOR, vector, top, filterQuery), top);
    }

    @Override
    public Optional<Map<String, Object>> get(String id) throws IOException {
        ensureOpen();
        var searcher = searcherManager.acquire();
        try {
            var hits = searcher.search(new TermQuery(new Term(MemoryFields.ID, id)), 1);
            if (hits.scoreDocs.length == 0) return Optional.empty();
            return Optional.of(source(searcher, hits.scoreDocs[0].doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public long count() throws IOException {
        ensureOpen();
        var searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void close() {
        try {
            synchronized (initLock) {
                if (searcherManager != null) searcherManager.close();
                if (writer != null) writer.close();
                if (directory != null) directory.close();
                searcherManager = null;
                writer = null;
                directory = null;
            }
            analyzer.close();
        } catch (IOException e) {
            log.error("Failed to close memory index", e);
        }
    }

    private void ensureOpen() throws IOException {
        if (searcherManager != null) return;
        synchronized (initLock) {
            if (searcherManager != null) return;
            if (directory == null) {
                if (indexPath == null) throw new IOException("Memory index is closed");
                Files.createDirectories(indexPath);
                directory = FSDirectory.open(indexPath);
            }
            var config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            writer = new IndexWriter(directory, config);
            searcherManager = new SearcherManager(writer, null);
            log.info("Memory index opened at {}", indexPath != null ? indexPath : directory);
        }
    }

    private List<StoredHit> search(Query query, int top) throws IOException {
        ensureOpen();
        var searcher = searcherManager.acquire();
        try {
            TopDocs docs = searcher.search(query, top);
            var hits = new ArrayList<StoredHit>(docs.scoreDocs.length);
            for (var scoreDoc : docs.scoreDocs) {
                var src = source(searcher, scoreDoc.doc);
                hits.add(new StoredHit(
                        String.valueOf(src.get(MemoryFields.ID)),
                        String.valueOf(src.getOrDefault(MemoryFields.TEXT, "")),
                        scoreDoc.score,
                        metadataOf(src)));
            }
            return hits;
        } finally {
            searcherManager.release(searcher);
        }
    }

    private static void addFilters(BooleanQuery.Builder builder, SearchFilter filter) {
        if (filter == null) return;
        filter.equalities().forEach((field, value) ->
                builder.add(new TermQuery(new Term(field, value)), BooleanClause.Occur.FILTER));
    }

    private Document toLucene(String id, Map<String, Object> src) throws JsonProcessingException {
        var doc = new Document();
        doc.add(new StringField(MemoryFields.ID, id, Field.Store.NO));
        doc.add(new StoredField(SOURCE, MAPPER.writeValueAsString(src)));

        var text = src.get(MemoryFields.TEXT);
        if (text != null) doc.add(new TextField(MemoryFields.TEXT, text.toString(), Field.Store.NO));

        var vector = toVector(src.get(MemoryFields.VECTOR));
        if (vector != null && !isZero(vector)) {
            doc.add(new KnnFloatVectorField(MemoryFields.VECTOR, vector, VectorSimilarityFunction.COSINE));
        }

        for (var entry : src.entrySet()) {
            var name = entry.getKey();
            if (name.equals(MemoryFields.ID) || NON_KEYWORD.contains(name)) continue;
            if (entry.getValue() instanceof Collection<?> values) {
                for (var v : values) {
                    if (v != null) doc.add(new StringField(name, String.valueOf(v), Field.Store.NO));
                }
            } else if (entry.getValue() instanceof String || entry.getValue() instanceof Number
                    || entry.getValue() instanceof Boolean) {
                doc.add(new StringField(name, String.valueOf(entry.getValue()), Field.Store.NO));
            }
        }
        return doc;
    }

    private static Map<String, Object> source(IndexSearcher searcher, int docId) throws IOException {
        var json = searcher.storedFields().document(docId).get(SOURCE);
        return MAPPER.readValue(json, MAP_TYPE);
    }

    private static Map<String, Object> metadataOf(Map<String, Object> src) {
        var meta = new LinkedHashMap<String, Object>();
        for (var entry : src.entrySet()) {
            var name = entry.getKey();
            if (name.equals(MemoryFields.ID) || NON_KEYWORD.contains(name) || entry.getValue() == null) continue;
            meta.put(name, entry.getValue());
        }
        if (src.get(MemoryFields.METADATA_JSON) instanceof String json && !json.isBlank()) {
            try {
                MAPPER.readValue(json, MAP_TYPE).forEach((k, v) -> {
                    if (v != null) meta.putIfAbsent(k, v);
                });
            } catch (JsonProcessingException e) {
                log.debug("Ignoring unreadable metadata_json on {}", src.get(MemoryFields.ID));
            }
        }
        return meta;
    }

    static float[] toVector(Object value) {
        if (value instanceof float[] floats) return floats;
        if (value instanceof Collection<?> values) {
            var vec = new float[values.size()];
            int i = 0;
            for (var v : values) {
                vec[i++] = v instanceof Number n ? n.floatValue() : 0f;
            }
            return vec;
        }
        return null;
    }

    private static boolean isZero(float[] vector) {
        for (float v : vector) {
            if (v != 0f) return false;
        }
        return true;
    }
}
