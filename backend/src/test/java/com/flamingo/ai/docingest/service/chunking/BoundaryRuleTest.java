package com.flamingo.ai.docingest.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Rule-by-rule tests for {@link BoundaryRule}. */
class BoundaryRuleTest {

  private static final int BUDGET = 100;

  @Test
  @DisplayName("should evaluate rules as fence, paragraph, sentence, line, space")
  void shouldKeepPriorityOrder() {
    assertThat(BoundaryRule.CASCADE)
        .containsExactly(
            BoundaryRule.FENCE,
            BoundaryRule.PARAGRAPH,
            BoundaryRule.SENTENCE,
            BoundaryRule.LINE,
            BoundaryRule.SPACE);
    assertThat(BoundaryRule.SPACE.minFraction()).isEqualTo(0.1);
    assertThat(BoundaryRule.LINE.minFraction()).isEqualTo(0.3);
  }

  @Test
  @DisplayName("should cut after the period for a sentence boundary")
  void shouldIncludePeriod_whenSentenceBoundary() {
    String window = "a".repeat(50) + ". " + "b".repeat(48);

    assertThat(BoundaryRule.SENTENCE.findCut(window, BUDGET, List.of())).isEqualTo(51);
  }

  @Test
  @DisplayName("should cut before the delimiter for a paragraph boundary")
  void shouldCutBeforeParagraphBreak() {
    String window = "a".repeat(60) + "\n\n" + "b".repeat(38);

    assertThat(BoundaryRule.PARAGRAPH.findCut(window, BUDGET, List.of())).isEqualTo(60);
  }

  @Test
  @DisplayName("should use the last occurrence in the window")
  void shouldUseLastOccurrence() {
    String window = "a".repeat(40) + "\n" + "b".repeat(30) + "\n" + "c".repeat(28);

    assertThat(BoundaryRule.LINE.findCut(window, BUDGET, List.of())).isEqualTo(71);
  }

  @Test
  @DisplayName("should reject a match exactly at the threshold")
  void shouldRejectMatch_exactlyAtThreshold() {
    String paragraphAt30 = "a".repeat(30) + "\n\n" + "b".repeat(68);
    String spaceAt10 = "a".repeat(10) + " " + "b".repeat(89);
    String spaceAt11 = "a".repeat(11) + " " + "b".repeat(88);

    assertThat(BoundaryRule.PARAGRAPH.findCut(paragraphAt30, BUDGET, List.of())).isEqualTo(-1);
    assertThat(BoundaryRule.SPACE.findCut(spaceAt10, BUDGET, List.of())).isEqualTo(-1);
    assertThat(BoundaryRule.SPACE.findCut(spaceAt11, BUDGET, List.of())).isEqualTo(11);
  }

  @Test
  @DisplayName("should not apply when the delimiter is absent")
  void shouldNotApply_whenDelimiterAbsent() {
    assertThat(BoundaryRule.SPACE.findCut("x".repeat(100), BUDGET, List.of())).isEqualTo(-1);
  }

  @Test
  @DisplayName("should only cut before opening fence delimiters")
  void shouldCutBeforeOpeningFenceOnly() {
    String window = "a".repeat(40) + "```" + "b".repeat(20) + "```" + "c".repeat(34);

    assertThat(BoundaryRule.FENCE.findCut(window, BUDGET, List.of(40))).isEqualTo(40);
    assertThat(BoundaryRule.FENCE.findCut(window, BUDGET, List.of())).isEqualTo(-1);
  }

  @Test
  @DisplayName("should ignore an opening fence that does not fit in the window")
  void shouldIgnoreFence_whenTruncatedByWindow() {
    String window = "a".repeat(98) + "``";

    assertThat(BoundaryRule.FENCE.findCut(window, BUDGET, List.of(98))).isEqualTo(-1);
  }
}
