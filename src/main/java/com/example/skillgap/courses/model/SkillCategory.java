package com.example.skillgap.courses.model;

import java.util.Locale;

/**
 * Kind of gap a skill query describes. Drives thresholds, quotas and the embedding text.
 */
public enum SkillCategory {
    /** Narrow tool or technology gap. */
    SKILL,
    /** Broad domain gap. */
    FIELD,
    DEFAULT;

    /**
     * Lenient parse used at the request boundary: null, blank or unknown values map to {@link #DEFAULT}.
     */
    public static SkillCategory from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (SkillCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return DEFAULT;
    }
}
