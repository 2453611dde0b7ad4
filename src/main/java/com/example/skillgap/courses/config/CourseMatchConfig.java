package com.example.skillgap.courses.config;

import com.example.skillgap.courses.cache.DynamicCourseCache;
import com.example.skillgap.courses.policy.QuotaPolicy;
import com.example.skillgap.courses.selection.CourseSelectionStrategy;
import com.example.skillgap.courses.selection.DeficitFillingSelectionStrategy;
import com.example.skillgap.courses.selection.SimilarityRankSelectionStrategy;
import com.example.skillgap.courses.telemetry.TelemetrySink;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the matching core: quota policy, selection strategy and the shared course cache.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        CoursePolicyProperties.class,
        CourseCacheProperties.class,
        CourseAvailabilityProperties.class
})
public class CourseMatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fails startup on thresholds outside [0, 1] or negative quotas.
     */
    @Bean
    public QuotaPolicy quotaPolicy(CoursePolicyProperties properties) {
        QuotaPolicy policy = new QuotaPolicy(properties);
        log.info("Course quota policy loaded: minThreshold={}, thresholds={}",
                policy.minThreshold(), properties.getThresholds());
        return policy;
    }

    @Bean
    public CourseSelectionStrategy courseSelectionStrategy(QuotaPolicy quotaPolicy,
                                                           CourseAvailabilityProperties properties) {
        CourseSelectionStrategy strategy = properties.getSelection().isDeficitFilling()
                ? new DeficitFillingSelectionStrategy(quotaPolicy)
                : new SimilarityRankSelectionStrategy();
        log.info("Course selection strategy: {}", strategy.name());
        return strategy;
    }

    @Bean
    public DynamicCourseCache dynamicCourseCache(CourseCacheProperties properties,
                                                 Clock clock,
                                                 TelemetrySink telemetrySink,
                                                 ObjectMapper objectMapper) {
        return new DynamicCourseCache(properties.getMaxSize(), properties.getTtl(), clock, telemetrySink, objectMapper);
    }
}
