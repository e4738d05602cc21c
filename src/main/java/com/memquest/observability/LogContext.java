package com.memquest.observability;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Scoped MDC correlation ids. Closing restores whatever the thread carried before.
 */
public final class LogContext implements AutoCloseable {

    public static final String TRACE_ID = "trace_id";
    public static final String TENANT_ID = "tenant_id";
    public static final String AGENT_ID = "agent_id";
    public static final String EVENT_ID = "event_id";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext(Map<String, String> fields) {
        fields.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            if (value == null || value.isEmpty()) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static LogContext open(String tenantId, String agentId, String eventId) {
        var fields = new LinkedHashMap<String, String>();
        fields.put(TRACE_ID, newTraceId());
        fields.put(TENANT_ID, tenantId);
        fields.put(AGENT_ID, agentId);
        fields.put(EVENT_ID, eventId);
        return new LogContext(fields);
    }

    /** Adds or replaces the event id inside an already open context. */
    public void eventId(String eventId) {
        if (!previous.containsKey(EVENT_ID)) previous.put(EVENT_ID, MDC.get(EVENT_ID));
        MDC.put(EVENT_ID, eventId);
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }
}
