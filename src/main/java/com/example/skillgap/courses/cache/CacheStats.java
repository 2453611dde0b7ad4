package com.example.skillgap.courses.cache;

/**
 * Snapshot of course cache counters.
 *
 * @param hitRate           hits / totalRequests, 0 when nothing was requested yet
 * @param memoryEstimateMb  sampled estimate, see {@link DynamicCourseCache#getStats()}
 */
public record CacheStats(
        long totalRequests,
        long hits,
        long misses,
        double hitRate,
        double avgRetrievalTimeMs,
        int activeItems,
        double memoryEstimateMb,
        long expiredCleaned,
        long evictions
) {
}
