package com.memquest.memory;

public record WriteResult(String key, boolean succeeded, String error) {

    public static WriteResult ok(String key) {
        return new WriteResult(key, true, null);
    }

    public static WriteResult failed(String key, String error) {
        return new WriteResult(key, false, error);
    }
}
