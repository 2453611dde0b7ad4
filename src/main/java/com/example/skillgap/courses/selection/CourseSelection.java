package com.example.skillgap.courses.selection;

import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.CourseType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered result of a selection strategy.
 *
 * @param selected          similarity-descending, at most {@link CourseSelectionStrategy#MAX_RESULTS}
 * @param promotedReserve   reserve courses pulled in to cover other types' deficits
 */
public record CourseSelection(List<CourseCandidate> selected, int promotedReserve) {

    public CourseSelection {
        selected = selected == null ? List.of() : List.copyOf(selected);
    }

    public static CourseSelection empty() {
        return new CourseSelection(List.of(), 0);
    }

    public List<String> ids() {
        return selected.stream().map(CourseCandidate::id).toList();
    }

    public boolean isEmpty() {
        return selected.isEmpty();
    }

    public int size() {
        return selected.size();
    }

    public int typeDiversity() {
        return types().size();
    }

    /**
     * Distinct types present, in {@link CourseType} declaration order.
     */
    public List<String> courseTypes() {
        return types().stream().map(CourseType::wireName).toList();
    }

    private Set<CourseType> types() {
        Set<CourseType> types = EnumSet.noneOf(CourseType.class);
        for (CourseCandidate candidate : selected) {
            types.add(candidate.type());
        }
        return types;
    }
}
