package com.memquest.memory;

import com.memquest.shared.model.QueryContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchFilterTest {

    @Test
    void scopesToTenantAndUser() {
        var filter = SearchFilter.forQuery(QueryContext.of("q", "u1", "t1", "a"), null);
        assertEquals(Map.of("tenant_id", "t1", "user_id", "u1"), filter.equalities());
    }

    @Test
    void callerFiltersCannotOverrideIsolation() {
        var filter = SearchFilter.forQuery(QueryContext.of("q", "u1", "t1", "a"),
                Map.of("tenant_id", "other", "user_id", "someone", "agent_id", "a7"));
        assertEquals("t1", filter.equalities().get("tenant_id"));
        assertEquals("u1", filter.equalities().get("user_id"));
        assertEquals("a7", filter.equalities().get("agent_id"));
    }

    @Test
    void blankScopeIsOmitted() {
        var filter = SearchFilter.forQuery(QueryContext.of("q", "", null, "a"), Map.of("tags", "fact"));
        assertEquals(Map.of("tags", "fact"), filter.equalities());
    }

    @Test
    void rendersEscapedExpression() {
        var filter = SearchFilter.forQuery(QueryContext.of("q", "o'neil", "t1", "a"), null);
        assertEquals("tenant_id eq 't1' and user_id eq 'o''neil'", filter.toExpression());
        assertTrue(SearchFilter.none().isEmpty());
    }
}
