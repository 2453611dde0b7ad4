package com.example.skillgap.courses.selection;

import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.SkillCategory;

import java.util.Comparator;
import java.util.List;

/**
 * Turns the raw, threshold-filtered candidates of one skill into the final ranked selection.
 * Implementations must be deterministic and must only return candidates taken from the input.
 */
public interface CourseSelectionStrategy {

    int MAX_RESULTS = 25;

    /**
     * Similarity descending, ties broken by id so equal scores never depend on input order.
     */
    Comparator<CourseCandidate> BY_SIMILARITY = Comparator
            .comparingDouble(CourseCandidate::similarity).reversed()
            .thenComparing(CourseCandidate::id);

    String name();

    CourseSelection select(List<CourseCandidate> candidates, SkillCategory category);
}
