package com.mk.fx.qa.llm.load.prompts;

/** Produces prompt text of approximately a requested size for a template. */
public interface PromptProvider {

  /**
   * Renders {@code template} and grows it to about {@code targetTokens} estimated tokens.
   *
   * @param template template to render
   * @param targetTokens token budget; text already larger than this is returned as is
   * @return prompt text
   */
  String createPrompt(PromptTemplate template, int targetTokens);
}
