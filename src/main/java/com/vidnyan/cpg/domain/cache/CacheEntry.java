package com.vidnyan.cpg.domain.cache;

import java.lang.ref.SoftReference;
import java.time.Instant;

/**
 * One cached value with its access bookkeeping. A compressed entry only keeps a soft reference
 * to its value, so the collector may reclaim it under pressure; a reclaimed entry reads as absent.
 */
public final class CacheEntry {

    private final String key;
    private final Instant insertedAt;
    private Object value;
    private SoftReference<Object> softValue;
    private volatile Instant lastAccess;
    private volatile int accessCount;

    public CacheEntry(String key, Object value, Instant now) {
        this.key = key;
        this.value = value;
        this.insertedAt = now;
        this.lastAccess = now;
    }

    public String key() {
        return key;
    }

    public Instant insertedAt() {
        return insertedAt;
    }

    public Instant lastAccess() {
        return lastAccess;
    }

    public int accessCount() {
        return accessCount;
    }

    public synchronized Object value() {
        if (value != null) {
            return value;
        }
        return softValue != null ? softValue.get() : null;
    }

    public synchronized void touch(Instant now) {
        lastAccess = now;
        accessCount++;
    }

    public synchronized boolean isCompressed() {
        return value == null && softValue != null;
    }

    /** Demote the value to a soft reference. Returns false if already compressed. */
    public synchronized boolean compress() {
        if (value == null) {
            return false;
        }
        softValue = new SoftReference<>(value);
        value = null;
        return true;
    }

    public boolean isExpired(Instant now, long ttlMs) {
        return insertedAt.plusMillis(ttlMs).isBefore(now);
    }
}
