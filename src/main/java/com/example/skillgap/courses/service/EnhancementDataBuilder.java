package com.example.skillgap.courses.service;

import com.example.skillgap.courses.model.CourseDetail;
import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.EnhancementData;
import com.example.skillgap.courses.model.EnhancementEntry;
import com.example.skillgap.courses.model.SkillQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects projects and certifications/specializations from every skill's course details for
 * resume enhancement. Per skill at most {@value #MAX_PROJECTS_PER_SKILL} projects and
 * {@value #MAX_CERTIFICATIONS_PER_SKILL} certifications are taken, in detail order. Entries are keyed
 * by course id across the batch; a later skill overwrites an earlier one for the same id.
 */
@Slf4j
@Component
public class EnhancementDataBuilder {

    static final int MAX_PROJECTS_PER_SKILL = 2;
    static final int MAX_CERTIFICATIONS_PER_SKILL = 4;
    static final int MAX_DESCRIPTION_CHARS = 200;

    public EnhancementData build(List<SkillQuery> skills) {
        if (skills == null || skills.isEmpty()) {
            return EnhancementData.empty();
        }

        Map<String, EnhancementEntry> projects = new LinkedHashMap<>();
        Map<String, EnhancementEntry> certifications = new LinkedHashMap<>();

        for (SkillQuery skill : skills) {
            if (skill == null || skill.getCourseDetails() == null) {
                continue;
            }
            int projectCount = 0;
            int certificationCount = 0;

            for (CourseDetail detail : skill.getCourseDetails()) {
                if (detail == null || detail.type() == null || isBlank(detail.id())) {
                    continue;
                }
                if (detail.type() == CourseType.PROJECT && projectCount < MAX_PROJECTS_PER_SKILL) {
                    projects.put(detail.id(), toEntry(detail, skill.getSkillName()));
                    projectCount++;
                } else if ((detail.type() == CourseType.CERTIFICATION || detail.type() == CourseType.SPECIALIZATION)
                        && certificationCount < MAX_CERTIFICATIONS_PER_SKILL) {
                    certifications.put(detail.id(), toEntry(detail, skill.getSkillName()));
                    certificationCount++;
                }
            }
        }

        log.debug("Enhancement data built: {} projects, {} certifications from {} skills",
                projects.size(), certifications.size(), skills.size());
        return new EnhancementData(projects, certifications);
    }

    private static EnhancementEntry toEntry(CourseDetail detail, String relatedSkill) {
        return new EnhancementEntry(
                detail.id(),
                safe(detail.name()),
                safe(detail.provider()),
                clip(safe(detail.description()), MAX_DESCRIPTION_CHARS),
                safe(relatedSkill)
        );
    }

    private static String clip(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
        return text.substring(0, end);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
