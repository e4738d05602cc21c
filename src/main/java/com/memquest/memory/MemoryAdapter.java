package com.memquest.memory;

import com.memquest.shared.model.MemoryEvent;
import com.memquest.shared.model.MemoryHit;
import com.memquest.shared.model.QueryContext;

import java.util.List;
import java.util.Map;

/**
 * What the chat agent sees of the memory subsystem. Neither call ever throws
 * because memory is unavailable.
 */
public interface MemoryAdapter {

    /**
     * Hot path. Returns at most {@code k} hits scoped to the query's tenant and
     * user, or an empty list when memory is disabled, slow or failing.
     *
     * @param filters extra equality constraints, may be {@code null}
     */
    List<MemoryHit> retrieve(QueryContext query, int k, Map<String, String> filters);

    /** Cold path. Schedules the event for ingestion and returns immediately. */
    void enqueueWrite(MemoryEvent event);
}
