package com.example.skillgap.courses.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SkillCategoryTest {

  @Test
  void parsesKnownCategoriesLeniently() {
    assertThat(SkillCategory.from("skill")).isEqualTo(SkillCategory.SKILL);
    assertThat(SkillCategory.from(" FIELD ")).isEqualTo(SkillCategory.FIELD);
  }

  @Test
  void unknownOrMissingFallsBackToDefault() {
    assertThat(SkillCategory.from("TOOLING")).isEqualTo(SkillCategory.DEFAULT);
    assertThat(SkillCategory.from("")).isEqualTo(SkillCategory.DEFAULT);
    assertThat(SkillCategory.from(null)).isEqualTo(SkillCategory.DEFAULT);
  }

  @Test
  void courseTypeParsesWireNames() {
    assertThat(CourseType.fromWire("Specialization")).contains(CourseType.SPECIALIZATION);
    assertThat(CourseType.fromWire("bootcamp")).isEmpty();
    assertThat(CourseType.fromWire(null)).isEmpty();
  }
}
