package com.example.skillgap.courses.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

/**
 * A skill gap produced by gap analysis. The availability check writes its result fields in place.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SkillQuery {
  // input
  private String skillName;
  private String description;
  private String skillCategory;

  // availability result
  private boolean hasAvailableCourses;
  private int courseCount;
  private List<String> availableCourseIds = new ArrayList<>();
  private int typeDiversity;
  private List<String> courseTypes = new ArrayList<>();

  // detailed mode only
  private List<CourseDetail> courseDetails;

  public static SkillQuery of(String skillName, String description, String skillCategory) {
    return new SkillQuery()
        .setSkillName(skillName)
        .setDescription(description)
        .setSkillCategory(skillCategory);
  }

  public SkillCategory resolvedCategory() {
    return SkillCategory.from(skillCategory);
  }
}
