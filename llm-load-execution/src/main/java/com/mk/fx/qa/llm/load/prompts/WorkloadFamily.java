package com.mk.fx.qa.llm.load.prompts;

/** The two workload families a simulated user alternates between. */
public enum WorkloadFamily {
  /** Tool-use prompts in the style of Model Context Protocol servers. */
  MCP("MCP"),
  /** Multi-step reasoning prompts for autonomous agents. */
  AGENTIC("Agentic");

  private final String tagPrefix;

  WorkloadFamily(String tagPrefix) {
    this.tagPrefix = tagPrefix;
  }

  public String tagPrefix() {
    return tagPrefix;
  }
}
