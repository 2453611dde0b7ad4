package com.example.skillgap.courses.model;

import java.util.List;

/**
 * Enriched skills of one batch together with the enhancement entries extracted from them.
 */
public record AvailabilityReport(List<SkillQuery> skills, EnhancementData enhancements) {
}
