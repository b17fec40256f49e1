package com.mk.fx.qa.llm.load.prompts;

import org.springframework.stereotype.Component;

/**
 * Renders the template and appends a filler section until the estimated size reaches the target.
 */
@Component
public class PaddingPromptProvider implements PromptProvider {

  private static final String PADDING_HEADER = "Additional context: ";
  private static final String PADDING_WORD = "detail ";

  @Override
  public String createPrompt(PromptTemplate template, int targetTokens) {
    var prompt = template.render();
    var currentTokens = TokenEstimator.estimate(prompt);
    if (currentTokens >= targetTokens) {
      return prompt;
    }
    var paddingChars = (targetTokens - currentTokens) * TokenEstimator.CHARS_PER_TOKEN;
    return prompt
        + "\n\n"
        + PADDING_HEADER
        + PADDING_WORD.repeat(paddingChars / PADDING_WORD.length());
  }
}
