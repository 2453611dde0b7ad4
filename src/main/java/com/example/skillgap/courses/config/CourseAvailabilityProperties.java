package com.example.skillgap.courses.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Binds properties under {@code course-match.availability} and {@code course-match.selection}.
 */
@Data
@ConfigurationProperties(prefix = "course-match")
public class CourseAvailabilityProperties {

    private final Availability availability = new Availability();
    private final Selection selection = new Selection();

    @Data
    public static class Availability {

        /**
         * Value of {@code courses.platform} searched; also part of every cache key.
         */
        private String platform = "coursera";

        /**
         * Per-skill vector search timeout.
         */
        private Duration queryTimeout = Duration.ofSeconds(3);

        /**
         * Upper bound of raw candidates fetched per skill before quota selection.
         */
        private int maxCandidates = 80;

        /**
         * Parallel vector searches within one batch.
         */
        private int maxConcurrency = 20;

        /**
         * Attach course_details to every skill (required for enhancement extraction).
         */
        private boolean includeDetails = true;
    }

    @Data
    public static class Selection {

        /**
         * Deficit filling on: quota allocator. Off: plain top-N by similarity.
         */
        private boolean deficitFilling = true;
    }
}
