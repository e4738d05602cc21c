package com.memquest.ingestion;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded set of recently seen content hashes. When full it is cleared
 * entirely before the next insert, so a duplicate arriving right after a reset
 * is accepted again.
 */
public class SeenHashCache {

    private final int capacity;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();
    private final Object writeLock = new Object();

    public SeenHashCache(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    public boolean contains(String hash) {
        return seen.contains(hash);
    }

    /** @return {@code false} if the hash was already present */
    public boolean addIfAbsent(String hash) {
        if (seen.contains(hash)) return false;
        synchronized (writeLock) {
            if (seen.contains(hash)) return false;
            if (seen.size() >= capacity) seen.clear();
            seen.add(hash);
            return true;
        }
    }

    public int size() {
        return seen.size();
    }

    public void clear() {
        synchronized (writeLock) {
            seen.clear();
        }
    }
}
