package com.memquest.memory;

import com.memquest.shared.model.QueryContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conjunction of field equality constraints applied to every search.
 */
public record SearchFilter(Map<String, String> equalities) {

    public SearchFilter {
        equalities = Collections.unmodifiableMap(new LinkedHashMap<>(equalities));
    }

    public static SearchFilter none() {
        return new SearchFilter(Map.of());
    }

    /**
     * Caller filters first, then the query's tenant and user, so the isolation
     * constraints cannot be replaced by a caller-supplied value.
     */
    public static SearchFilter forQuery(QueryContext query, Map<String, String> extra) {
        var eq = new LinkedHashMap<String, String>();
        if (query.filters() != null) putAll(eq, query.filters());
        if (extra != null) putAll(eq, extra);
        scope(eq, MemoryFields.TENANT_ID, query.tenantId());
        scope(eq, MemoryFields.USER_ID, query.userId());
        return new SearchFilter(eq);
    }

    public boolean isEmpty() {
        return equalities.isEmpty();
    }

    /** OData-style rendering, for logs. */
    public String toExpression() {
        return equalities.entrySet().stream()
                .map(e -> e.getKey() + " eq '" + e.getValue().replace("'", "''") + "'")
                .collect(Collectors.joining(" and "));
    }

    private static void scope(Map<String, String> eq, String field, String value) {
        if (value == null || value.isEmpty()) return;
        eq.remove(field);
        eq.put(field, value);
    }

    private static void putAll(Map<String, String> target, Map<String, String> source) {
        source.forEach((k, v) -> {
            if (k != null && v != null) target.put(k, v);
        });
    }
}
