package com.example.skillgap.courses.cache;

import java.time.Instant;

public record CacheEntrySummary(
        String cacheKey,
        long accessCount,
        double ageMinutes,
        Instant lastAccess,
        long dataSizeBytes
) {
}
