package com.memquest.ingestion;

public record UpsertResult(int success, int failed) {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0);
}
