package com.example.skillgap.courses.policy;

import com.example.skillgap.courses.config.CoursePolicyProperties;
import com.example.skillgap.courses.config.CoursePolicyProperties.TypeQuota;
import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.SkillCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category similarity thresholds and per-type quotas.
 * <p>
 * Built once from {@link CoursePolicyProperties} and immutable afterwards. Lookups never fail:
 * a null category resolves to {@link SkillCategory#DEFAULT} and a type missing from a category's
 * table has a quota of zero.
 */
public final class QuotaPolicy {

    private final double minThreshold;
    private final Map<SkillCategory, Double> thresholds;
    private final Map<SkillCategory, Map<CourseType, Integer>> basicQuotas;
    private final Map<SkillCategory, Map<CourseType, Integer>> extendedQuotas;

    public QuotaPolicy(CoursePolicyProperties properties) {
        this.minThreshold = requireUnitInterval("min-threshold", properties.getMinThreshold());

        Map<SkillCategory, Double> resolvedThresholds = new EnumMap<>(SkillCategory.class);
        Map<SkillCategory, Map<CourseType, Integer>> basic = new EnumMap<>(SkillCategory.class);
        Map<SkillCategory, Map<CourseType, Integer>> extended = new EnumMap<>(SkillCategory.class);

        for (SkillCategory category : SkillCategory.values()) {
            Double threshold = properties.getThresholds().get(category);
            if (threshold != null) {
                resolvedThresholds.put(category, requireUnitInterval("thresholds." + category, threshold));
            }

            Map<CourseType, TypeQuota> table = properties.getQuotas().get(category);
            if (table == null) {
                continue;
            }
            Map<CourseType, Integer> basicTable = new EnumMap<>(CourseType.class);
            Map<CourseType, Integer> extendedTable = new EnumMap<>(CourseType.class);
            table.forEach((type, quota) -> {
                if (quota == null) {
                    return;
                }
                if (quota.getBasic() < 0 || quota.getReserve() < 0) {
                    throw new IllegalArgumentException(
                            "Quota for %s/%s must not be negative".formatted(category, type.wireName()));
                }
                basicTable.put(type, quota.getBasic());
                extendedTable.put(type, quota.extended());
            });
            basic.put(category, Collections.unmodifiableMap(basicTable));
            extended.put(category, Collections.unmodifiableMap(extendedTable));
        }

        if (!resolvedThresholds.containsKey(SkillCategory.DEFAULT)) {
            throw new IllegalArgumentException("A DEFAULT threshold is required");
        }
        this.thresholds = Collections.unmodifiableMap(resolvedThresholds);
        this.basicQuotas = Collections.unmodifiableMap(basic);
        this.extendedQuotas = Collections.unmodifiableMap(extended);
    }

    public static QuotaPolicy defaults() {
        return new QuotaPolicy(new CoursePolicyProperties());
    }

    /**
     * Lower bound applied by the vector store before the category threshold.
     */
    public double minThreshold() {
        return minThreshold;
    }

    public double thresholdFor(SkillCategory category) {
        Double threshold = thresholds.get(resolve(category));
        return threshold != null ? threshold : thresholds.get(SkillCategory.DEFAULT);
    }

    /**
     * Extended quota per type: basic plus reserve slots.
     */
    public Map<CourseType, Integer> quotaFor(SkillCategory category) {
        return lookup(extendedQuotas, category);
    }

    public Map<CourseType, Integer> basicQuotaFor(SkillCategory category) {
        return lookup(basicQuotas, category);
    }

    public int quotaFor(SkillCategory category, CourseType type) {
        return quotaFor(category).getOrDefault(type, 0);
    }

    public int basicQuotaFor(SkillCategory category, CourseType type) {
        return basicQuotaFor(category).getOrDefault(type, 0);
    }

    private static Map<CourseType, Integer> lookup(Map<SkillCategory, Map<CourseType, Integer>> source,
                                                   SkillCategory category) {
        Map<CourseType, Integer> table = source.get(resolve(category));
        if (table == null) {
            table = source.get(SkillCategory.DEFAULT);
        }
        return table == null ? Map.of() : table;
    }

    private static SkillCategory resolve(SkillCategory category) {
        return category == null ? SkillCategory.DEFAULT : category;
    }

    private static double requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
        }
        return value;
    }
}
