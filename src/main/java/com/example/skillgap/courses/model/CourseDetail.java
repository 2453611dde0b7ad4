package com.example.skillgap.courses.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Detail record attached to a skill in detailed mode, one per selected candidate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CourseDetail(
        String id,
        String name,
        CourseType type,
        String provider,
        String description,
        double similarity
) {

    public static CourseDetail from(CourseCandidate candidate) {
        return new CourseDetail(
                candidate.id(),
                candidate.name(),
                candidate.type(),
                candidate.provider(),
                candidate.description(),
                candidate.similarity()
        );
    }
}
