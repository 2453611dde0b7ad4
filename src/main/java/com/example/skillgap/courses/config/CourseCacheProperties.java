package com.example.skillgap.courses.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties:
 *
 * course-match.cache.enabled=true
 * course-match.cache.max-size=1000
 * course-match.cache.ttl=30m
 * course-match.cache.cleanup-interval=1h
 */
@Data
@ConfigurationProperties(prefix = "course-match.cache")
public class CourseCacheProperties {

    /**
     * When false every skill goes to the vector store.
     */
    private boolean enabled = true;

    private int maxSize = 1000;

    private Duration ttl = Duration.ofMinutes(30);

    /**
     * Delay between two expired-entry sweeps.
     */
    private Duration cleanupInterval = Duration.ofHours(1);
}
