package com.example.skillgap.courses.policy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.skillgap.courses.config.CoursePolicyProperties;
import com.example.skillgap.courses.config.CoursePolicyProperties.TypeQuota;
import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.SkillCategory;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QuotaPolicyTest {

  @Test
  void defaultThresholdsPerCategory() {
    QuotaPolicy policy = QuotaPolicy.defaults();

    assertThat(policy.minThreshold()).isEqualTo(0.25);
    assertThat(policy.thresholdFor(SkillCategory.SKILL)).isEqualTo(0.30);
    assertThat(policy.thresholdFor(SkillCategory.FIELD)).isEqualTo(0.25);
    assertThat(policy.thresholdFor(SkillCategory.DEFAULT)).isEqualTo(0.30);
    assertThat(policy.thresholdFor(null)).isEqualTo(0.30);
  }

  @Test
  void courseQuotaIsBasicPlusReserve() {
    QuotaPolicy policy = QuotaPolicy.defaults();

    assertThat(policy.basicQuotaFor(SkillCategory.SKILL, CourseType.COURSE)).isEqualTo(15);
    assertThat(policy.quotaFor(SkillCategory.SKILL, CourseType.COURSE)).isEqualTo(25);
    assertThat(policy.quotaFor(SkillCategory.SKILL, CourseType.PROJECT)).isEqualTo(5);
    assertThat(policy.quotaFor(SkillCategory.FIELD, CourseType.SPECIALIZATION)).isEqualTo(12);
  }

  @Test
  void missingTypeHasZeroQuota() {
    QuotaPolicy policy = QuotaPolicy.defaults();

    assertThat(policy.quotaFor(SkillCategory.SKILL, CourseType.DEGREE)).isZero();
    assertThat(policy.basicQuotaFor(SkillCategory.SKILL, CourseType.SPECIALIZATION)).isZero();
  }

  @Test
  void overridesMergeIntoDefaults() {
    CoursePolicyProperties properties = new CoursePolicyProperties();
    Map<SkillCategory, Double> thresholds = new EnumMap<>(SkillCategory.class);
    thresholds.put(SkillCategory.SKILL, 0.40);
    properties.setThresholds(thresholds);

    Map<CourseType, TypeQuota> skillTable = new EnumMap<>(CourseType.class);
    skillTable.put(CourseType.PROJECT, new TypeQuota(7, 0));
    Map<SkillCategory, Map<CourseType, TypeQuota>> quotas = new EnumMap<>(SkillCategory.class);
    quotas.put(SkillCategory.SKILL, skillTable);
    properties.setQuotas(quotas);

    QuotaPolicy policy = new QuotaPolicy(properties);

    assertThat(policy.thresholdFor(SkillCategory.SKILL)).isEqualTo(0.40);
    assertThat(policy.thresholdFor(SkillCategory.FIELD)).isEqualTo(0.25);
    assertThat(policy.quotaFor(SkillCategory.SKILL, CourseType.PROJECT)).isEqualTo(7);
    assertThat(policy.quotaFor(SkillCategory.SKILL, CourseType.COURSE)).isEqualTo(25);
  }

  @Test
  void rejectsThresholdOutsideUnitInterval() {
    CoursePolicyProperties properties = new CoursePolicyProperties();
    properties.setThresholds(Map.of(SkillCategory.FIELD, 1.5));

    assertThatThrownBy(() -> new QuotaPolicy(properties))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("FIELD");
  }

  @Test
  void rejectsNegativeMinThreshold() {
    CoursePolicyProperties properties = new CoursePolicyProperties();
    properties.setMinThreshold(-0.1);

    assertThatThrownBy(() -> new QuotaPolicy(properties))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("min-threshold");
  }

  @Test
  void rejectsNegativeQuota() {
    CoursePolicyProperties properties = new CoursePolicyProperties();
    properties.setQuotas(Map.of(SkillCategory.DEFAULT, Map.of(CourseType.DEGREE, new TypeQuota(-1, 0))));

    assertThatThrownBy(() -> new QuotaPolicy(properties))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("degree");
  }

  @Test
  void returnedTablesAreImmutable() {
    QuotaPolicy policy = QuotaPolicy.defaults();

    assertThatThrownBy(() -> policy.quotaFor(SkillCategory.SKILL).put(CourseType.DEGREE, 3))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
