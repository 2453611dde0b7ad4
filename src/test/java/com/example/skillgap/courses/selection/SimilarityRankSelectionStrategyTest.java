package com.example.skillgap.courses.selection;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.skillgap.courses.model.CourseCandidate;
import com.example.skillgap.courses.model.CourseType;
import com.example.skillgap.courses.model.SkillCategory;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SimilarityRankSelectionStrategyTest {

  private final SimilarityRankSelectionStrategy strategy = new SimilarityRankSelectionStrategy();

  @Test
  void returnsTopResultsRegardlessOfType() {
    List<CourseCandidate> candidates = new ArrayList<>();
    for (int i = 0; i < 30; i++) {
      candidates.add(CourseCandidate.of("d-" + i, CourseType.DEGREE, 0.99 - i * 0.001));
    }
    candidates.add(CourseCandidate.of("c-1", CourseType.COURSE, 0.50));

    CourseSelection selection = strategy.select(candidates, SkillCategory.SKILL);

    assertThat(selection.size()).isEqualTo(CourseSelectionStrategy.MAX_RESULTS);
    assertThat(selection.courseTypes()).containsExactly("degree");
    assertThat(selection.ids()).first().isEqualTo("d-0");
    assertThat(selection.promotedReserve()).isZero();
  }

  @Test
  void tiesBrokenById() {
    List<CourseCandidate> candidates = List.of(
        CourseCandidate.of("b", CourseType.COURSE, 0.7),
        CourseCandidate.of("a", CourseType.PROJECT, 0.7),
        CourseCandidate.of("a", CourseType.PROJECT, 0.4));

    CourseSelection selection = strategy.select(candidates, SkillCategory.DEFAULT);

    assertThat(selection.ids()).containsExactly("a", "b");
    assertThat(selection.typeDiversity()).isEqualTo(2);
  }

  @Test
  void emptyInputGivesEmptySelection() {
    assertThat(strategy.select(List.of(), SkillCategory.DEFAULT).isEmpty()).isTrue();
  }
}
