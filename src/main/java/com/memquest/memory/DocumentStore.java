package com.memquest.memory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable memory document store.
 */
public interface DocumentStore {

    /** Short backend name, reported as the source of retrieval hits. */
    String name();

    /**
     * Creates each document or, when its {@code id} already exists, merges the
     * given fields over the stored ones.
     *
     * @return one result per input document, in input order
     * @throws IOException when the batch as a whole could not be written
     */
    List<WriteResult> mergeOrUpload(List<Map<String, Object>> documents) throws IOException;

    /** Keyword (BM25) search over the text field, best first. */
    List<StoredHit> keywordSearch(String text, SearchFilter filter, int top) throws IOException;

    /** Vector similarity search, best first. */
    List<StoredHit> vectorSearch(float[] vector, SearchFilter filter, int top) throws IOException;

    Optional<Map<String, Object>> get(String id) throws IOException;

    long count() throws IOException;
}
