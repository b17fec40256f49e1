package com.mk.fx.qa.llm.load.prompts;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PaddingPromptProviderTest {

  private final PaddingPromptProvider provider = new PaddingPromptProvider();

  @Test
  void smallTarget_returnsRenderedTemplate() {
    var prompt = provider.createPrompt(PromptTemplate.CODE_REVIEW, 10);

    assertThat(prompt).isEqualTo(PromptTemplate.CODE_REVIEW.render());
  }

  @Test
  void largeTarget_padsUpToEstimate() {
    var target = 20_000;

    var prompt = provider.createPrompt(PromptTemplate.FILE_SEARCH, target);

    assertThat(prompt).startsWith(PromptTemplate.FILE_SEARCH.render());
    assertThat(prompt).contains("\n\nAdditional context: detail detail ");
    assertThat(TokenEstimator.estimate(prompt)).isBetween(target, target + 10);
  }

  @Test
  void tokenEstimate_isFourCharsPerToken() {
    assertThat(TokenEstimator.estimate("abcdefgh")).isEqualTo(2);
    assertThat(TokenEstimator.estimate("abc")).isZero();
    assertThat(TokenEstimator.estimate(null)).isZero();
  }
}
