package com.memquest.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of one retrieval request. Tenant and user ids scope the search.
 */
public record QueryContext(
    String text,
    String userId,
    String tenantId,
    String agentId,
    double time,
    List<String> tags,
    Map<String, String> filters
) {

    public QueryContext {
        text = text != null ? text : "";
        tags = tags != null ? tags.stream().filter(t -> t != null).toList() : null;
        filters = filters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(filters)) : null;
    }

    public static QueryContext of(String text, String userId, String tenantId, String agentId) {
        return new QueryContext(text, userId, tenantId, agentId, MemoryEvent.nowSeconds(), null, null);
    }
}
