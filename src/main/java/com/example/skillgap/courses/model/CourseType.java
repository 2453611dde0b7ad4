package com.example.skillgap.courses.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Standardised resource type as stored in {@code courses.course_type_standard}.
 */
public enum CourseType {
    COURSE("course"),
    PROJECT("project"),
    CERTIFICATION("certification"),
    SPECIALIZATION("specialization"),
    DEGREE("degree");

    private final String wireName;

    CourseType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<CourseType> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (CourseType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
