package me.golemcore.logai.domain.model;

/**
 * Point-in-time view of the result cache.
 */
public record CacheStats(int entryCount, long totalBytes, long capacityBytes, long hits, long misses) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
