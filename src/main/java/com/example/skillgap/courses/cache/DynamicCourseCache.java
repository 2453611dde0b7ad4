package com.example.skillgap.courses.cache;

import com.example.skillgap.courses.model.CourseAvailability;
import com.example.skillgap.courses.telemetry.TelemetrySink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory cache of course availability results with LRU eviction and TTL expiry.
 * <p>
 * All state is guarded by a single lock. Recency is tracked in an explicit deque of keys: the most
 * recently used key sits at the tail, eviction takes the head. Expired entries are dropped lazily on
 * read and in bulk by {@link #cleanupExpired()}. Values are copied on the way in and on the way out.
 */
@Slf4j
public class DynamicCourseCache {

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    static final String TELEMETRY_EVENT = "DynamicCacheOperation";
    private static final int MEMORY_SAMPLE_SIZE = 10;
    private static final int ITEM_OVERHEAD_BYTES = 200;
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final int maxSize;
    private final Duration ttl;
    private final Clock clock;
    private final TelemetrySink telemetry;
    private final ObjectMapper objectMapper;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, CacheItem> items = new LinkedHashMap<>();
    private final Deque<String> accessOrder = new ArrayDeque<>();

    private long totalRequests;
    private long hits;
    private long misses;
    private long expiredCleaned;
    private long evictions;
    private double avgRetrievalTimeMs;

    public DynamicCourseCache(int maxSize, Duration ttl, Clock clock, TelemetrySink telemetry, ObjectMapper objectMapper) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive but was " + maxSize);
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive but was " + ttl);
        }
        this.maxSize = maxSize;
        this.ttl = ttl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.telemetry = telemetry == null ? TelemetrySink.noop() : telemetry;
        this.objectMapper = objectMapper == null ? new ObjectMapper() : objectMapper;
        log.info("DynamicCourseCache initialised with maxSize={}, ttl={}min", maxSize, ttl.toMinutes());
    }

    public Optional<CourseAvailability> get(String key) {
        long startNanos = System.nanoTime();
        String operation;
        CourseAvailability result = null;
        int size;
        double hitRate;

        lock.lock();
        try {
            totalRequests++;
            CacheItem item = key == null ? null : items.get(key);
            Instant now = clock.instant();
            if (item == null) {
                misses++;
                operation = "cache_miss";
            } else if (isExpired(item, now)) {
                log.debug("Course cache key expired: {}", key);
                removeItem(key);
                misses++;
                operation = "cache_miss_expired";
            } else {
                item.accessCount++;
                item.lastAccess = now;
                accessOrder.remove(key);
                accessOrder.addLast(key);
                hits++;
                operation = "cache_hit";
                result = item.data.copy();
            }
            recordRetrievalTime(elapsedMs(startNanos));
            size = items.size();
            hitRate = hitRate();
        } finally {
            lock.unlock();
        }

        track(operation, startNanos, size, hitRate);
        return Optional.ofNullable(result);
    }

    public void set(String key, CourseAvailability value) {
        if (key == null || value == null) {
            return;
        }
        long startNanos = System.nanoTime();
        int size;
        double hitRate;

        lock.lock();
        try {
            Instant now = clock.instant();
            boolean existing = items.containsKey(key);
            if (!existing && items.size() >= maxSize) {
                evictLeastRecentlyUsed();
            }
            items.put(key, new CacheItem(value.copy(), now));
            if (existing) {
                accessOrder.remove(key);
            }
            accessOrder.addLast(key);
            size = items.size();
            hitRate = hitRate();
        } finally {
            lock.unlock();
        }

        log.debug("Course cache set: {}", key);
        track("cache_set", startNanos, size, hitRate);
    }

    /**
     * Drops every entry and resets all counters.
     */
    public void clear() {
        int cleared;
        lock.lock();
        try {
            cleared = items.size();
            items.clear();
            accessOrder.clear();
            totalRequests = 0;
            hits = 0;
            misses = 0;
            expiredCleaned = 0;
            evictions = 0;
            avgRetrievalTimeMs = 0.0;
        } finally {
            lock.unlock();
        }
        log.info("Course cache cleared {} items", cleared);
    }

    /**
     * Removes every entry older than the TTL.
     *
     * @return number of removed entries
     */
    public int cleanupExpired() {
        int removed;
        lock.lock();
        try {
            Instant now = clock.instant();
            Set<String> expiredKeys = new HashSet<>();
            Iterator<Map.Entry<String, CacheItem>> it = items.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheItem> entry = it.next();
                if (isExpired(entry.getValue(), now)) {
                    expiredKeys.add(entry.getKey());
                    it.remove();
                }
            }
            if (!expiredKeys.isEmpty()) {
                accessOrder.removeIf(expiredKeys::contains);
            }
            removed = expiredKeys.size();
            expiredCleaned += removed;
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Course cache cleaned {} expired items", removed);
        }
        return removed;
    }

    /**
     * Counters plus derived values. The memory estimate serialises at most
     * {@value #MEMORY_SAMPLE_SIZE} entries and extrapolates to the full size.
     */
    public CacheStats getStats() {
        lock.lock();
        try {
            return new CacheStats(
                    totalRequests,
                    hits,
                    misses,
                    hitRate(),
                    avgRetrievalTimeMs,
                    items.size(),
                    estimateMemoryMb(),
                    expiredCleaned,
                    evictions
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most frequently hit entries, highest access count first.
     */
    public List<CacheEntrySummary> getTopItems(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            List<Map.Entry<String, CacheItem>> entries = new ArrayList<>(items.entrySet());
            entries.sort(Comparator.comparingLong(
                    (Map.Entry<String, CacheItem> e) -> e.getValue().accessCount).reversed());
            return entries.stream()
                    .limit(limit)
                    .map(e -> new CacheEntrySummary(
                            e.getKey(),
                            e.getValue().accessCount,
                            Duration.between(e.getValue().timestamp, now).toMillis() / 60_000.0,
                            e.getValue().lastAccess,
                            sizeOf(e.getValue().data)))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isExpired(CacheItem item, Instant now) {
        return Duration.between(item.timestamp, now).compareTo(ttl) > 0;
    }

    private void evictLeastRecentlyUsed() {
        String lruKey = accessOrder.pollFirst();
        if (lruKey != null && items.remove(lruKey) != null) {
            evictions++;
            log.debug("Course cache evicted LRU item: {}", lruKey);
        }
    }

    private void removeItem(String key) {
        items.remove(key);
        accessOrder.remove(key);
    }

    private double hitRate() {
        return totalRequests == 0 ? 0.0 : (double) hits / totalRequests;
    }

    private void recordRetrievalTime(double durationMs) {
        long lookups = hits + misses;
        if (lookups <= 1) {
            avgRetrievalTimeMs = durationMs;
        } else {
            avgRetrievalTimeMs = (avgRetrievalTimeMs * (lookups - 1) + durationMs) / lookups;
        }
    }

    private double estimateMemoryMb() {
        if (items.isEmpty()) {
            return 0.0;
        }
        int sampled = 0;
        long sampledBytes = 0;
        for (Map.Entry<String, CacheItem> entry : items.entrySet()) {
            if (sampled >= MEMORY_SAMPLE_SIZE) {
                break;
            }
            sampledBytes += entry.getKey().length() + sizeOf(entry.getValue().data) + ITEM_OVERHEAD_BYTES;
            sampled++;
        }
        double averageBytes = (double) sampledBytes / sampled;
        double totalMb = averageBytes * items.size() / BYTES_PER_MB;
        return Math.round(totalMb * 100.0) / 100.0;
    }

    private long sizeOf(CourseAvailability data) {
        try {
            return objectMapper.writeValueAsBytes(data).length;
        } catch (JsonProcessingException ex) {
            log.debug("Falling back to toString() size for cache entry: {}", ex.getMessage());
            return String.valueOf(data).length();
        }
    }

    private void track(String operation, long startNanos, int size, double hitRate) {
        try {
            telemetry.record(TELEMETRY_EVENT, Map.of(
                    "operation", operation,
                    "duration_ms", Math.round(elapsedMs(startNanos) * 100.0) / 100.0,
                    "cache_size", size,
                    "hit_rate", hitRate
            ));
        } catch (RuntimeException ex) {
            log.warn("Course cache telemetry failed for operation {}: {}", operation, ex.getMessage());
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static final class CacheItem {
        private final CourseAvailability data;
        private final Instant timestamp;
        private long accessCount;
        private Instant lastAccess;

        private CacheItem(CourseAvailability data, Instant timestamp) {
            this.data = data;
            this.timestamp = timestamp;
            this.lastAccess = timestamp;
        }
    }
}
