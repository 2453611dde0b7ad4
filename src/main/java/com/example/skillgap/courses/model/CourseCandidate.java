package com.example.skillgap.courses.model;

import java.util.Objects;

/**
 * One row returned by the vector store for a single skill lookup.
 * Required fields are enforced here; rows that cannot satisfy them are dropped by the store.
 */
public record CourseCandidate(
        String id,
        CourseType type,
        double similarity,
        String name,
        String provider,
        String description
) {

    public CourseCandidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (Double.isNaN(similarity)) {
            throw new IllegalArgumentException("similarity must be a number");
        }
    }

    public static CourseCandidate of(String id, CourseType type, double similarity) {
        return new CourseCandidate(id, type, similarity, null, null, null);
    }
}
