package com.example.skillgap.courses.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep of expired course cache entries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "course-match.cache.enabled", havingValue = "true", matchIfMissing = true)
public class CourseCacheMaintenance {

    private final DynamicCourseCache cache;

    @Scheduled(
            initialDelayString = "${course-match.cache.cleanup-interval:PT1H}",
            fixedDelayString = "${course-match.cache.cleanup-interval:PT1H}"
    )
    public void sweepExpired() {
        try {
            int removed = cache.cleanupExpired();
            log.debug("Course cache sweep removed {} items, {} remaining", removed, cache.size());
        } catch (RuntimeException ex) {
            log.error("Course cache background cleanup failed", ex);
        }
    }
}
