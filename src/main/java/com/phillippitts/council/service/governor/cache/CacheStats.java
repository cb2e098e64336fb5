package com.phillippitts.council.service.governor.cache;

/**
 * Point-in-time cache statistics.
 */
public record CacheStats(int size, int capacity, long hits, long misses, long evictions) {

    public double utilisation() {
        return capacity == 0 ? 0.0 : (double) size / capacity;
    }

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
