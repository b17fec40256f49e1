package com.mk.fx.qa.llm.load.prompts;

import java.util.List;
import java.util.Random;

/**
 * Picks the next workload for a user: a family with equal probability, then a template uniformly
 * within that family.
 */
public final class WorkloadSelector {

  static final double MIN_VARIATION = 0.7;
  static final double MAX_VARIATION = 1.0;

  private WorkloadSelector() {
    // Utility class, no instantiation
  }

  public static PromptTemplate pick(Random random) {
    var family = random.nextDouble() < 0.5 ? WorkloadFamily.MCP : WorkloadFamily.AGENTIC;
    List<PromptTemplate> templates = PromptTemplate.byFamily(family);
    return templates.get(random.nextInt(templates.size()));
  }

  /** Draws the size variation factor, uniform in [0.7, 1.0). */
  public static double nextVariation(Random random) {
    return MIN_VARIATION + (MAX_VARIATION - MIN_VARIATION) * random.nextDouble();
  }

  /** {@code floor(contextFraction * maxContextTokens * variation)}. */
  public static int targetTokens(PromptTemplate template, int maxContextTokens, double variation) {
    return (int) Math.floor(template.contextFraction() * maxContextTokens * variation);
  }
}
