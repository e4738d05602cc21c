package com.memquest.memory;

/**
 * Field names of a persisted memory document.
 */
public final class MemoryFields {

    public static final String ID = "id";
    public static final String AGENT_ID = "agent_id";
    public static final String TENANT_ID = "tenant_id";
    public static final String USER_ID = "user_id";
    public static final String TS = "ts";
    public static final String TEXT = "text";
    public static final String TAGS = "tags";
    public static final String VECTOR = "vector";
    public static final String METADATA_JSON = "metadata_json";
    public static final String EXPIRES_AT = "expires_at";

    private MemoryFields() {}
}
