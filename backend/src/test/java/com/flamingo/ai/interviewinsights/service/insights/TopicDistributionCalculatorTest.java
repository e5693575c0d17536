package com.flamingo.ai.interviewinsights.service.insights;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.interviewinsights.domain.enums.PriorityLevel;
import com.flamingo.ai.interviewinsights.domain.enums.TopicCategory;
import com.flamingo.ai.interviewinsights.domain.model.Topic;
import com.flamingo.ai.interviewinsights.domain.model.TopicDistribution;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TopicDistributionCalculator Tests")
class TopicDistributionCalculatorTest {

  private final TopicDistributionCalculator calculator = new TopicDistributionCalculator();

  private static Topic topic(String term, TopicCategory category, PriorityLevel priority) {
    return Topic.builder()
        .id(term)
        .representativeTerm(term)
        .category(category)
        .priorityLevel(priority)
        .build();
  }

  @Test
  @DisplayName("Should count topics per category and per priority")
  void shouldCountTopicsPerCategoryAndPriority() {
    TopicDistribution distribution =
        calculator.calculate(
            List.of(
                topic("caching", TopicCategory.SYSTEM_DESIGN, PriorityLevel.HIGH),
                topic("database", TopicCategory.SYSTEM_DESIGN, PriorityLevel.LOW),
                topic("leadership", TopicCategory.BEHAVIORAL, PriorityLevel.LOW)));

    assertThat(distribution.totalTopics()).isEqualTo(3);
    assertThat(distribution.byCategory().keySet())
        .containsExactly(TopicCategory.SYSTEM_DESIGN, TopicCategory.BEHAVIORAL);
    assertThat(distribution.byCategory().get(TopicCategory.SYSTEM_DESIGN))
        .isEqualTo(new TopicDistribution.Share(2, 66.7));
    assertThat(distribution.byCategory().get(TopicCategory.BEHAVIORAL))
        .isEqualTo(new TopicDistribution.Share(1, 33.3));
    assertThat(distribution.byPriority().keySet())
        .containsExactly(PriorityLevel.HIGH, PriorityLevel.LOW);
    assertThat(distribution.byPriority().get(PriorityLevel.LOW))
        .isEqualTo(new TopicDistribution.Share(2, 66.7));
  }

  @Test
  @DisplayName("Should return an empty distribution without topics")
  void shouldHandleNoTopics() {
    TopicDistribution distribution = calculator.calculate(List.of());

    assertThat(distribution.totalTopics()).isZero();
    assertThat(distribution.byCategory()).isEmpty();
    assertThat(distribution.byPriority()).isEmpty();
  }
}
