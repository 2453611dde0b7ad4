package com.example.skillgap.courses.service;

import com.example.skillgap.courses.cache.DynamicCourseCache;
import com.example.skillgap.courses.config.CourseAvailabilityProperties;
import com.example.skillgap.courses.config.CourseCacheProperties;
import com.example.skillgap.courses.model.AvailabilityReport;
import com.example.skillgap.courses.model.CourseAvailability;
import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.CourseDetail;
import com.example.skillgap.courses.model.SkillCategory;
import com.example.skillgap.courses.model.SkillQuery;
import com.example.skillgap.courses.policy.QuotaPolicy;
import com.example.skillgap.courses.selection.CourseSelection;
import com.example.skillgap.courses.selection.CourseSelectionStrategy;
import com.example.skillgap.courses.telemetry.TelemetrySink;
import com.example.skillgap.courses.util.CacheKeyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Checks which skill gaps have matching learning resources.
 * <p>
 * Per batch: cached skills are answered from {@link DynamicCourseCache}; all remaining skills are
 * embedded in one request, then searched concurrently with an individual timeout each. A failing
 * skill degrades to "no courses" on its own and is not cached. Losing the embedding provider
 * degrades every uncached skill of the batch, and any other unexpected error degrades every skill not
 * resolved so far. The returned list is the input list, enriched in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseAvailabilityService {

    static final String EVENT_BATCH = "CourseAvailabilityCheck";
    static final String EVENT_SKILL_FAILED = "CourseAvailabilityCheckFailed";
    static final String EVENT_SYSTEM_ERROR = "CourseAvailabilitySystemError";

    private final DynamicCourseCache cache;
    private final QuotaPolicy quotaPolicy;
    private final CourseSelectionStrategy selectionStrategy;
    private final SkillEmbeddingClient embeddingClient;
    private final CourseVectorStore vectorStore;
    private final EnhancementDataBuilder enhancementDataBuilder;
    private final TelemetrySink telemetry;
    private final CourseCacheProperties cacheProperties;
    private final CourseAvailabilityProperties availabilityProperties;

    private final Scheduler blockingScheduler = Schedulers.boundedElastic();

    public Mono<List<SkillQuery>> checkAvailability(List<SkillQuery> skills) {
        if (skills == null || skills.isEmpty()) {
            return Mono.just(new ArrayList<>());
        }
        Set<SkillQuery> resolved = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
        return Mono.defer(() -> runBatch(skills, resolved))
                .onErrorResume(ex -> Mono.fromSupplier(() -> degradeUnresolved(skills, resolved, ex)));
    }

    /**
     * Availability check followed by enhancement extraction over the whole batch.
     */
    public Mono<AvailabilityReport> checkWithEnhancements(List<SkillQuery> skills) {
        return checkAvailability(skills)
                .map(checked -> new AvailabilityReport(checked, enhancementDataBuilder.build(checked)));
    }

    private Mono<List<SkillQuery>> runBatch(List<SkillQuery> skills, Set<SkillQuery> resolved) {
        long startNanos = System.nanoTime();
        boolean cacheEnabled = cacheProperties.isEnabled();
        String platform = availabilityProperties.getAvailability().getPlatform();

        // 1) cache lookups
        List<PendingSkill> uncached = new ArrayList<>();
        int cacheHits = 0;
        for (SkillQuery skill : skills) {
            if (skill == null) {
                continue;
            }
            SkillCategory category = skill.resolvedCategory();
            double threshold = quotaPolicy.thresholdFor(category);
            String cacheKey = null;

            if (cacheEnabled) {
                cacheKey = CacheKeyUtils.buildKey(skill, category, threshold, platform);
                Optional<CourseAvailability> cached = cache.get(cacheKey);
                if (cached.isPresent()) {
                    cached.get().applyTo(skill, includeDetails());
                    resolved.add(skill);
                    cacheHits++;
                    log.debug("Course cache hit for '{}'", skill.getSkillName());
                    continue;
                }
            }
            uncached.add(new PendingSkill(skill, category, threshold, cacheKey,
                    CacheKeyUtils.embeddingText(skill, category)));
        }

        int hits = cacheHits;
        return resolveUncached(uncached, resolved)
                .then(Mono.fromSupplier(() -> {
                    recordBatch(skills.size(), hits, uncached.size(), cacheEnabled, startNanos);
                    return skills;
                }));
    }

    private Mono<Void> resolveUncached(List<PendingSkill> uncached, Set<SkillQuery> resolved) {
        if (uncached.isEmpty()) {
            return Mono.empty();
        }

        List<PendingSkill> embeddable = new ArrayList<>(uncached.size());
        for (PendingSkill pending : uncached) {
            if (pending.embeddingText().isBlank()) {
                log.debug("Skill without name or description, no lookup possible");
                degrade(pending.skill());
                resolved.add(pending.skill());
            } else {
                embeddable.add(pending);
            }
        }
        if (embeddable.isEmpty()) {
            return Mono.empty();
        }

        // 2) one embedding request for the whole batch
        List<String> texts = embeddable.stream().map(PendingSkill::embeddingText).toList();
        log.debug("Generating embeddings for {} skills", texts.size());

        return Mono.fromCallable(() -> embeddingClient.embedAll(texts))
                .subscribeOn(blockingScheduler)
                .flatMap(vectors -> {
                    if (vectors == null || vectors.size() != embeddable.size()) {
                        return Mono.error(new IllegalStateException("Expected %d embeddings but got %d"
                                .formatted(embeddable.size(), vectors == null ? 0 : vectors.size())));
                    }
                    // 3) fan out, one search per skill
                    return Flux.range(0, embeddable.size())
                            .flatMap(i -> resolveSkill(embeddable.get(i), vectors.get(i), resolved),
                                    Math.max(1, availabilityProperties.getAvailability().getMaxConcurrency()))
                            .then();
                })
                .onErrorResume(ex -> {
                    log.error("Course availability batch failed for {} skills: {}", embeddable.size(), ex.toString());
                    emit(EVENT_SYSTEM_ERROR, attributes(
                            "error", String.valueOf(ex.getMessage()),
                            "uncached_count", embeddable.size(),
                            "severity", "HIGH"));
                    embeddable.forEach(pending -> {
                        degrade(pending.skill());
                        resolved.add(pending.skill());
                    });
                    return Mono.empty();
                });
    }

    private Mono<Void> resolveSkill(PendingSkill pending, float[] vector, Set<SkillQuery> resolved) {
        return Mono.fromCallable(() -> vectorStore.search(
                        vector, pending.category(), quotaPolicy.minThreshold(), pending.threshold()))
                .subscribeOn(blockingScheduler)
                .timeout(availabilityProperties.getAvailability().getQueryTimeout())
                .defaultIfEmpty(List.of())
                .map(candidates -> toAvailability(
                        selectionStrategy.select(filterCandidates(candidates, pending.threshold()), pending.category())))
                .doOnNext(result -> {
                    // 4) + 5) write back, cache only what actually resolved
                    result.applyTo(pending.skill(), includeDetails());
                    resolved.add(pending.skill());
                    if (pending.cacheKey() != null) {
                        cache.set(pending.cacheKey(), result);
                    }
                })
                .onErrorResume(ex -> {
                    handleSkillFailure(pending, ex);
                    resolved.add(pending.skill());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Last line of defence before selection: nulls and anything under the category threshold go.
     */
    private static List<CourseCandidate> filterCandidates(List<CourseCandidate> candidates, double threshold) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .filter(Objects::nonNull)
                .filter(candidate -> candidate.similarity() >= threshold)
                .toList();
    }

    private CourseAvailability toAvailability(CourseSelection selection) {
        List<CourseDetail> details = includeDetails()
                ? selection.selected().stream().map(CourseDetail::from).toList()
                : List.of();
        return new CourseAvailability(
                !selection.isEmpty(),
                selection.size(),
                selection.ids(),
                selection.typeDiversity(),
                selection.courseTypes(),
                details
        );
    }

    private void handleSkillFailure(PendingSkill pending, Throwable ex) {
        String skillName = safe(pending.skill().getSkillName());
        if (ex instanceof TimeoutException) {
            log.warn("Timeout checking course availability for '{}'", skillName);
        } else {
            log.warn("Course availability failed for '{}': {}", skillName, ex.toString());
        }
        emit(EVENT_SKILL_FAILED, attributes(
                "skill", skillName,
                "error", String.valueOf(ex.getMessage()),
                "severity", "MEDIUM"));
        degrade(pending.skill());
    }

    /**
     * Batch boundary: anything not answered before the error is reported as unavailable.
     */
    private List<SkillQuery> degradeUnresolved(List<SkillQuery> skills, Set<SkillQuery> resolved, Throwable ex) {
        int degraded = 0;
        for (SkillQuery skill : skills) {
            if (skill != null && !resolved.contains(skill)) {
                degrade(skill);
                degraded++;
            }
        }
        log.error("Course availability check failed, degraded {} of {} skills: {}", degraded, skills.size(), ex.toString());
        emit(EVENT_SYSTEM_ERROR, attributes(
                "error", String.valueOf(ex.getMessage()),
                "uncached_count", degraded,
                "severity", "HIGH"));
        return skills;
    }

    private void degrade(SkillQuery skill) {
        CourseAvailability.none().applyTo(skill, includeDetails());
    }

    private void recordBatch(int skillCount, int cacheHits, int uncachedCount, boolean cacheEnabled, long startNanos) {
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        double hitRate = skillCount == 0 ? 0.0 : (double) cacheHits / skillCount;

        emit(EVENT_BATCH, attributes(
                "skill_count", skillCount,
                "duration_ms", durationMs,
                "cache_hit_rate", hitRate,
                "cached_count", cacheHits,
                "uncached_count", uncachedCount,
                "cache_enabled", cacheEnabled));

        if (cacheEnabled) {
            log.info("Checked {} skills in {}ms (cache hit rate: {}%, hits: {})",
                    skillCount, durationMs, Math.round(hitRate * 1000) / 10.0, cacheHits);
        } else {
            log.info("Checked {} skills in {}ms (cache disabled)", skillCount, durationMs);
        }
    }

    private void emit(String event, Map<String, Object> attributes) {
        try {
            telemetry.record(event, attributes);
        } catch (RuntimeException ex) {
            log.warn("Telemetry event {} could not be recorded: {}", event, ex.getMessage());
        }
    }

    private boolean includeDetails() {
        return availabilityProperties.getAvailability().isIncludeDetails();
    }

    private static Map<String, Object> attributes(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    private record PendingSkill(
            SkillQuery skill,
            SkillCategory category,
            double threshold,
            String cacheKey,
            String embeddingText
    ) {
    }
}
