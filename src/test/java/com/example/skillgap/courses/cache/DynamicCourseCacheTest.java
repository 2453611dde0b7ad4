package com.example.skillgap.courses.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.skillgap.courses.model.CourseAvailability;
import com.example.skillgap.courses.telemetry.TelemetrySink;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DynamicCourseCacheTest {

  private MutableClock clock;
  private List<String> operations;
  private DynamicCourseCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    operations = new ArrayList<>();
    TelemetrySink sink = (event, attributes) -> operations.add(String.valueOf(attributes.get("operation")));
    cache = new DynamicCourseCache(3, Duration.ofMinutes(30), clock, sink, new ObjectMapper());
  }

  @Test
  void hitReturnsStoredValue() {
    cache.set("k1", available("c1", "c2"));

    Optional<CourseAvailability> hit = cache.get("k1");

    assertThat(hit).isPresent();
    assertThat(hit.get().availableCourseIds()).containsExactly("c1", "c2");
    assertThat(operations).containsExactly("cache_set", "cache_hit");
  }

  @Test
  void unknownKeyIsMiss() {
    assertThat(cache.get("nope")).isEmpty();
    assertThat(cache.getStats().misses()).isEqualTo(1);
    assertThat(operations).containsExactly("cache_miss");
  }

  @Test
  void entryExpiresOnlyAfterTtl() {
    cache.set("k1", available("c1"));

    clock.advance(Duration.ofMinutes(30));
    assertThat(cache.get("k1")).isPresent();

    clock.advance(Duration.ofSeconds(1));
    assertThat(cache.get("k1")).isEmpty();
    assertThat(cache.size()).isZero();
    assertThat(operations).endsWith("cache_miss_expired");
  }

  @Test
  void evictsLeastRecentlyUsedAtCapacity() {
    cache.set("a", available("c1"));
    cache.set("b", available("c2"));
    cache.set("c", available("c3"));
    cache.get("a");

    cache.set("d", available("c4"));

    assertThat(cache.size()).isEqualTo(3);
    assertThat(cache.get("b")).isEmpty();
    assertThat(cache.get("a")).isPresent();
    assertThat(cache.get("c")).isPresent();
    assertThat(cache.get("d")).isPresent();
    assertThat(cache.getStats().evictions()).isEqualTo(1);
  }

  @Test
  void overwritingKeyDoesNotEvict() {
    cache.set("a", available("c1"));
    cache.set("b", available("c2"));
    cache.set("c", available("c3"));

    cache.set("a", available("c9"));

    assertThat(cache.size()).isEqualTo(3);
    assertThat(cache.get("a")).get().extracting(CourseAvailability::availableCourseIds)
        .isEqualTo(List.of("c9"));
    assertThat(cache.getStats().evictions()).isZero();
  }

  @Test
  void overwriteRefreshesRecency() {
    cache.set("a", available("c1"));
    cache.set("b", available("c2"));
    cache.set("c", available("c3"));
    cache.set("a", available("c1"));

    cache.set("d", available("c4"));

    assertThat(cache.get("b")).isEmpty();
    assertThat(cache.get("a")).isPresent();
  }

  @Test
  void callersCannotMutateCachedValue() {
    List<String> ids = new ArrayList<>(List.of("c1"));
    cache.set("k1", new CourseAvailability(true, 1, ids, 1, List.of("course"), List.of()));
    ids.add("c2");

    CourseAvailability first = cache.get("k1").orElseThrow();

    assertThat(first.availableCourseIds()).containsExactly("c1");
    assertThatThrownBy(() -> first.availableCourseIds().add("c3"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void statsTrackHitsAndMisses() {
    cache.set("k1", available("c1"));
    cache.get("k1");
    cache.get("k1");
    cache.get("k2");

    CacheStats stats = cache.getStats();

    assertThat(stats.totalRequests()).isEqualTo(3);
    assertThat(stats.hits()).isEqualTo(2);
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.hitRate()).isEqualTo(2.0 / 3.0);
    assertThat(stats.activeItems()).isEqualTo(1);
    assertThat(stats.memoryEstimateMb()).isGreaterThanOrEqualTo(0.0);
  }

  @Test
  void clearDropsEntriesAndResetsStats() {
    cache.set("k1", available("c1"));
    cache.get("k1");

    cache.clear();

    CacheStats stats = cache.getStats();
    assertThat(cache.size()).isZero();
    assertThat(stats.totalRequests()).isZero();
    assertThat(stats.hits()).isZero();
    assertThat(stats.memoryEstimateMb()).isZero();
  }

  @Test
  void cleanupRemovesOnlyExpiredEntries() {
    cache.set("old", available("c1"));
    clock.advance(Duration.ofMinutes(20));
    cache.set("fresh", available("c2"));
    clock.advance(Duration.ofMinutes(15));

    int removed = cache.cleanupExpired();

    assertThat(removed).isEqualTo(1);
    assertThat(cache.size()).isEqualTo(1);
    assertThat(cache.getStats().expiredCleaned()).isEqualTo(1);
    assertThat(cache.get("fresh")).isPresent();
  }

  @Test
  void topItemsOrderedByAccessCount() {
    cache.set("a", available("c1"));
    cache.set("b", available("c2"));
    cache.get("b");
    cache.get("b");
    cache.get("a");

    List<CacheEntrySummary> top = cache.getTopItems(2);

    assertThat(top).extracting(CacheEntrySummary::cacheKey).containsExactly("b", "a");
    assertThat(top.get(0).accessCount()).isEqualTo(2);
    assertThat(top.get(0).dataSizeBytes()).isPositive();
    assertThat(cache.getTopItems(0)).isEmpty();
  }

  @Test
  void failingTelemetryDoesNotBreakOperations() {
    TelemetrySink failing = (event, attributes) -> {
      throw new IllegalStateException("sink down");
    };
    DynamicCourseCache guarded = new DynamicCourseCache(2, Duration.ofMinutes(5), clock, failing, new ObjectMapper());

    guarded.set("k1", available("c1"));

    assertThat(guarded.get("k1")).isPresent();
  }

  @Test
  void concurrentMixedOperationsStayConsistent() throws Exception {
    int maxSize = 8;
    int threads = 8;
    int rounds = 500;
    DynamicCourseCache shared =
        new DynamicCourseCache(maxSize, Duration.ofMinutes(30), clock, TelemetrySink.noop(), new ObjectMapper());
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();

    for (int t = 0; t < threads; t++) {
      int seed = t;
      futures.add(pool.submit(() -> {
        start.await();
        for (int i = 0; i < rounds; i++) {
          String key = "k" + ((seed * 31 + i) % 20);
          int op = i % 4;
          if (op < 2) {
            shared.get(key);
          } else if (op == 2) {
            shared.set(key, available("c" + i));
          } else {
            shared.cleanupExpired();
            shared.getStats();
          }
        }
        return null;
      }));
    }
    start.countDown();
    try {
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    CacheStats stats = shared.getStats();
    assertThat(shared.size()).isLessThanOrEqualTo(maxSize);
    assertThat(stats.hits() + stats.misses()).isEqualTo(stats.totalRequests());
    assertThat(stats.totalRequests()).isEqualTo(threads * rounds / 2);
    assertThat(shared.getTopItems(maxSize * 2)).hasSizeLessThanOrEqualTo(maxSize);
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThatThrownBy(() -> new DynamicCourseCache(0, Duration.ofMinutes(1), clock, null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DynamicCourseCache(10, Duration.ZERO, clock, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static CourseAvailability available(String... ids) {
    return new CourseAvailability(true, ids.length, List.of(ids), 1, List.of("course"), List.of());
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
