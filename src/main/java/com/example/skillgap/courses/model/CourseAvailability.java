package com.example.skillgap.courses.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolved availability for one skill. This is the value stored in the course cache.
 */
public record CourseAvailability(
        boolean hasAvailableCourses,
        int courseCount,
        List<String> availableCourseIds,
        int typeDiversity,
        List<String> courseTypes,
        List<CourseDetail> courseDetails
) {

    private static final CourseAvailability NONE =
            new CourseAvailability(false, 0, List.of(), 0, List.of(), List.of());

    public CourseAvailability {
        availableCourseIds = availableCourseIds == null ? List.of() : List.copyOf(availableCourseIds);
        courseTypes = courseTypes == null ? List.of() : List.copyOf(courseTypes);
        courseDetails = courseDetails == null ? List.of() : List.copyOf(courseDetails);
    }

    /**
     * "No courses" result. Timeouts, datastore errors and genuine zero supply all map here.
     */
    public static CourseAvailability none() {
        return NONE;
    }

    public CourseAvailability copy() {
        return new CourseAvailability(
                hasAvailableCourses, courseCount, availableCourseIds, typeDiversity, courseTypes, courseDetails);
    }

    /**
     * Writes the result fields onto the skill. Details are only attached when {@code includeDetails} is set.
     */
    public SkillQuery applyTo(SkillQuery skill, boolean includeDetails) {
        skill.setHasAvailableCourses(hasAvailableCourses)
                .setCourseCount(courseCount)
                .setAvailableCourseIds(new ArrayList<>(availableCourseIds))
                .setTypeDiversity(typeDiversity)
                .setCourseTypes(new ArrayList<>(courseTypes));
        if (includeDetails) {
            skill.setCourseDetails(new ArrayList<>(courseDetails));
        }
        return skill;
    }
}
