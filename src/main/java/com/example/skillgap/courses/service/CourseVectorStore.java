package com.example.skillgap.courses.service;

import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.SkillCategory;

import java.util.List;

/**
 * Similarity search over the course catalogue.
 */
public interface CourseVectorStore {

    /**
     * Candidates at or above {@code minThreshold}, capped at the configured volume, then narrowed to
     * {@code categoryThreshold}. Only valid candidates are returned, similarity descending.
     * May throw on datastore errors; callers isolate failures per skill.
     */
    List<CourseCandidate> search(float[] queryVector,
                                 SkillCategory category,
                                 double minThreshold,
                                 double categoryThreshold);
}
