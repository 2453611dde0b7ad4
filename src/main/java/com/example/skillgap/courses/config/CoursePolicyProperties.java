package com.example.skillgap.courses.config;

import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.SkillCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binds properties:
 *
 * course-match.policy.min-threshold=0.25
 * course-match.policy.thresholds.skill=0.30
 * course-match.policy.quotas.skill.course.basic=15
 * course-match.policy.quotas.skill.course.reserve=10
 */
@ConfigurationProperties(prefix = "course-match.policy")
@Validated
public class CoursePolicyProperties {

    private double minThreshold = 0.25;
    private final Map<SkillCategory, Double> thresholds = new EnumMap<>(SkillCategory.class);
    private final Map<SkillCategory, Map<CourseType, TypeQuota>> quotas = new EnumMap<>(SkillCategory.class);

    public CoursePolicyProperties() {
        thresholds.put(SkillCategory.SKILL, 0.30);
        thresholds.put(SkillCategory.FIELD, 0.25);
        thresholds.put(SkillCategory.DEFAULT, 0.30);

        quotas.put(SkillCategory.SKILL, table(
                quota(CourseType.COURSE, 15, 10),
                quota(CourseType.PROJECT, 5, 0),
                quota(CourseType.CERTIFICATION, 2, 0)));
        quotas.put(SkillCategory.FIELD, table(
                quota(CourseType.COURSE, 5, 10),
                quota(CourseType.SPECIALIZATION, 12, 0),
                quota(CourseType.DEGREE, 5, 0),
                quota(CourseType.CERTIFICATION, 3, 0)));
        quotas.put(SkillCategory.DEFAULT, table(
                quota(CourseType.COURSE, 15, 10),
                quota(CourseType.PROJECT, 3, 0),
                quota(CourseType.CERTIFICATION, 3, 0),
                quota(CourseType.SPECIALIZATION, 3, 0),
                quota(CourseType.DEGREE, 1, 0)));
    }

    public double getMinThreshold() {
        return minThreshold;
    }

    public void setMinThreshold(double minThreshold) {
        this.minThreshold = minThreshold;
    }

    public Map<SkillCategory, Double> getThresholds() {
        return thresholds;
    }

    public void setThresholds(Map<SkillCategory, Double> thresholds) {
        if (thresholds != null) {
            this.thresholds.putAll(thresholds);
        }
    }

    public Map<SkillCategory, Map<CourseType, TypeQuota>> getQuotas() {
        return quotas;
    }

    public void setQuotas(Map<SkillCategory, Map<CourseType, TypeQuota>> quotas) {
        if (quotas == null) {
            return;
        }
        quotas.forEach((category, table) -> {
            Map<CourseType, TypeQuota> merged = this.quotas.computeIfAbsent(category, c -> new EnumMap<>(CourseType.class));
            if (table != null) {
                merged.putAll(table);
            }
        });
    }

    @SafeVarargs
    private static Map<CourseType, TypeQuota> table(Map.Entry<CourseType, TypeQuota>... entries) {
        Map<CourseType, TypeQuota> table = new EnumMap<>(CourseType.class);
        for (Map.Entry<CourseType, TypeQuota> entry : entries) {
            table.put(entry.getKey(), entry.getValue());
        }
        return table;
    }

    private static Map.Entry<CourseType, TypeQuota> quota(CourseType type, int basic, int reserve) {
        return Map.entry(type, new TypeQuota(basic, reserve));
    }

    /**
     * Basic slots are always filled first; reserve slots only back-fill deficits of other types.
     */
    public static final class TypeQuota {
        private int basic;
        private int reserve;

        public TypeQuota() {
        }

        public TypeQuota(int basic, int reserve) {
            this.basic = basic;
            this.reserve = reserve;
        }

        public int getBasic() {
            return basic;
        }

        public void setBasic(int basic) {
            this.basic = basic;
        }

        public int getReserve() {
            return reserve;
        }

        public void setReserve(int reserve) {
            this.reserve = reserve;
        }

        public int extended() {
            return basic + reserve;
        }
    }
}
