package com.example.skillgap.courses.selection;

import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.SkillCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Plain top-N by similarity, ignoring resource types. Used when deficit filling is switched off.
 */
public class SimilarityRankSelectionStrategy implements CourseSelectionStrategy {

    @Override
    public String name() {
        return "similarity-rank";
    }

    @Override
    public CourseSelection select(List<CourseCandidate> candidates, SkillCategory category) {
        if (candidates == null || candidates.isEmpty()) {
            return CourseSelection.empty();
        }
        Map<String, CourseCandidate> unique = new LinkedHashMap<>();
        candidates.stream()
                .filter(Objects::nonNull)
                .sorted(BY_SIMILARITY)
                .forEach(c -> unique.putIfAbsent(c.id(), c));
        List<CourseCandidate> top = unique.values().stream()
                .limit(MAX_RESULTS)
                .toList();
        return new CourseSelection(top, 0);
    }
}
