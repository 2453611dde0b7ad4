package com.example.skillgap.courses.controller;

import com.example.skillgap.courses.cache.CacheEntrySummary;
import com.example.skillgap.courses.cache.CacheStats;
import com.example.skillgap.courses.cache.DynamicCourseCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/course-cache")
@RequiredArgsConstructor
@Tag(name = "Course Cache", description = "Inspection and maintenance of the course availability cache")
public class CourseCacheController {

    static final int MAX_TOP_LIMIT = 100;

    private final DynamicCourseCache cache;

    @Operation(summary = "Cache counters, hit rate and memory estimate")
    @GetMapping("/stats")
    public Mono<CacheStats> stats() {
        return Mono.fromSupplier(cache::getStats);
    }

    @Operation(summary = "Most frequently hit cache entries")
    @GetMapping("/top")
    public Mono<List<CacheEntrySummary>> top(
            @RequestParam(defaultValue = "10") @Min(0) @Max(MAX_TOP_LIMIT) int limit) {
        return Mono.fromSupplier(() -> cache.getTopItems(limit));
    }

    @Operation(summary = "Drop every cache entry and reset the counters")
    @DeleteMapping
    public Mono<ResponseEntity<Void>> clear() {
        return Mono.fromRunnable(() -> {
                    log.info("Course cache clear requested via admin API");
                    cache.clear();
                })
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @Operation(summary = "Remove expired entries now")
    @PostMapping("/cleanup")
    public Mono<ResponseEntity<Map<String, Integer>>> cleanup() {
        return Mono.fromSupplier(cache::cleanupExpired)
                .map(removed -> ResponseEntity.ok(Map.of("removed", removed, "remaining", cache.size())));
    }
}
