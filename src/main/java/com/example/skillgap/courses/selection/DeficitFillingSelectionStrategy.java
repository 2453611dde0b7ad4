package com.example.skillgap.courses.selection;

import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.SkillCategory;
import com.example.skillgap.courses.policy.QuotaPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Quota allocator that keeps results type-diverse and lets surplus courses cover shortages.
 * <p>
 * Every non-course type gets up to its basic quota. Courses get their basic slice unconditionally
 * plus a reserve slice (up to the extended quota) that is only used to fill the summed deficit of
 * the other types. The union is re-ranked by similarity and capped at {@link #MAX_RESULTS}.
 */
@Slf4j
public class DeficitFillingSelectionStrategy implements CourseSelectionStrategy {

    private final QuotaPolicy policy;

    public DeficitFillingSelectionStrategy(QuotaPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public String name() {
        return "deficit-filling";
    }

    @Override
    public CourseSelection select(List<CourseCandidate> candidates, SkillCategory category) {
        if (candidates == null || candidates.isEmpty()) {
            return CourseSelection.empty();
        }

        Map<CourseType, List<CourseCandidate>> byType = groupByType(candidates);
        List<CourseCandidate> selected = new ArrayList<>();

        // 1) non-course types: basic quota, remember what is missing
        int deficit = 0;
        for (CourseType type : CourseType.values()) {
            if (type == CourseType.COURSE) {
                continue;
            }
            int quota = policy.basicQuotaFor(category, type);
            List<CourseCandidate> pool = byType.getOrDefault(type, List.of());
            int taken = Math.min(quota, pool.size());
            selected.addAll(pool.subList(0, taken));
            if (taken < quota) {
                deficit += quota - taken;
            }
        }

        // 2) courses: basic slice always, reserve slice only against the deficit
        List<CourseCandidate> courses = byType.getOrDefault(CourseType.COURSE, List.of());
        int basicCourses = Math.min(policy.basicQuotaFor(category, CourseType.COURSE), courses.size());
        int extendedCourses = Math.min(
                Math.max(policy.quotaFor(category, CourseType.COURSE), basicCourses),
                courses.size());
        selected.addAll(courses.subList(0, basicCourses));

        List<CourseCandidate> reserve = courses.subList(basicCourses, extendedCourses);
        int promoted = 0;
        if (deficit > 0 && !reserve.isEmpty()) {
            promoted = Math.min(deficit, reserve.size());
            selected.addAll(reserve.subList(0, promoted));
        }

        // 3) promoted reserve courses may outrank low-similarity quota fillers
        selected.sort(BY_SIMILARITY);
        List<CourseCandidate> capped = selected.size() > MAX_RESULTS
                ? selected.subList(0, MAX_RESULTS)
                : selected;

        log.debug("Deficit selection category={} candidates={} deficit={} reserve={} promoted={} selected={}",
                category, candidates.size(), deficit, reserve.size(), promoted, capped.size());
        return new CourseSelection(capped, promoted);
    }

    /**
     * Groups by type with each group similarity-descending. Null entries and repeated ids are dropped,
     * keeping the best-scored occurrence.
     */
    private static Map<CourseType, List<CourseCandidate>> groupByType(List<CourseCandidate> candidates) {
        List<CourseCandidate> ordered = new ArrayList<>(candidates.size());
        for (CourseCandidate candidate : candidates) {
            if (candidate != null) {
                ordered.add(candidate);
            }
        }
        ordered.sort(BY_SIMILARITY);

        Set<String> seen = new LinkedHashSet<>();
        Map<CourseType, List<CourseCandidate>> byType = new EnumMap<>(CourseType.class);
        for (CourseCandidate candidate : ordered) {
            if (seen.add(candidate.id())) {
                byType.computeIfAbsent(candidate.type(), t -> new ArrayList<>()).add(candidate);
            }
        }
        return byType;
    }
}
