package com.mk.fx.qa.llm.load.prompts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.llm.load.client.JsonUtil;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Fixed catalog of prompt templates. Each template renders to the same text every time; prompt
 * size is adjusted afterwards by a {@link PromptProvider}.
 */
public enum PromptTemplate {
  FILE_SEARCH(
      WorkloadFamily.MCP,
      "file_search",
      0.3,
      "You are an AI assistant with access to a file system.\n"
          + "The user has asked you to search for files matching a pattern.\n"
          + "Available tools:\n"
          + "- search_files(pattern: str, path: str) -> List[str]\n"
          + "- read_file(path: str) -> str\n"
          + "- list_directory(path: str) -> List[str]\n"
          + "\n"
          + "Context: You have access to a large codebase with the following structure:\n"
          + "%s\n"
          + "\n"
          + "User request: Find all Python files that contain database connection logic and"
          + " summarize their contents.\n") {
    @Override
    String filler() {
      return IntStream.range(0, 10)
          .boxed()
          .flatMap(i -> IntStream.range(0, 5).mapToObj(j -> "src/module_" + i + "/file_" + j + ".py"))
          .collect(Collectors.joining("\n"));
    }
  },

  DATA_ANALYSIS(
      WorkloadFamily.MCP,
      "data_analysis",
      0.5,
      "You are a data analysis AI with access to query tools.\n"
          + "Available tools:\n"
          + "- execute_query(sql: str) -> DataFrame\n"
          + "- calculate_statistics(data: List) -> Dict\n"
          + "- create_visualization(data: List, chart_type: str) -> Image\n"
          + "\n"
          + "Context: Database schema and sample data:\n"
          + "%s\n"
          + "\n"
          + "User request: Analyze the sales trends over the last quarter and identify the top"
          + " performing products.\n") {
    @Override
    String filler() {
      Map<String, Object> tables = new LinkedHashMap<>();
      tables.put("sales", columns("id", "product_id", "amount", "date", "customer_id"));
      tables.put("products", columns("id", "name", "category", "price"));
      tables.put("customers", columns("id", "name", "email", "region"));
      List<Map<String, Object>> sampleData = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("record", i);
        row.put("data", "sample".repeat(10));
        sampleData.add(row);
      }
      Map<String, Object> schema = new LinkedHashMap<>();
      schema.put("tables", tables);
      schema.put("sample_data", sampleData);
      return prettyJson(schema);
    }
  },

  CODE_REVIEW(
      WorkloadFamily.MCP,
      "code_review",
      0.4,
      "You are a code review AI assistant.\n"
          + "Available tools:\n"
          + "- analyze_code(file_path: str) -> CodeAnalysis\n"
          + "- check_security(code: str) -> SecurityReport\n"
          + "- suggest_improvements(code: str) -> List[Suggestion]\n"
          + "\n"
          + "Context: Review the following code files:\n"
          + "%s\n"
          + "\n"
          + "User request: Review these files for security vulnerabilities and performance"
          + " issues.\n") {
    @Override
    String filler() {
      return IntStream.range(0, 5)
          .mapToObj(i -> "# File: module_" + i + ".py\n" + "def function():\n    pass\n".repeat(20))
          .collect(Collectors.joining("\n\n"));
    }
  },

  RESEARCH_TASK(
      WorkloadFamily.AGENTIC,
      "research_task",
      0.6,
      "You are an autonomous research agent. Your task involves:\n"
          + "1. Gathering information from multiple sources\n"
          + "2. Synthesizing the information\n"
          + "3. Drawing conclusions\n"
          + "4. Providing recommendations\n"
          + "\n"
          + "Previous research context:\n"
          + "%s\n"
          + "\n"
          + "Current task: Research the impact of AI on software development practices and"
          + " provide a comprehensive analysis.\n"
          + "Please break this down into subtasks and execute them systematically.\n") {
    @Override
    String filler() {
      return IntStream.range(0, 10)
          .mapToObj(i -> "Study " + i + ": " + "Finding ".repeat(30))
          .collect(Collectors.joining("\n"));
    }
  },

  PLANNING_TASK(
      WorkloadFamily.AGENTIC,
      "planning_task",
      0.7,
      "You are a planning agent responsible for breaking down complex tasks.\n"
          + "You have access to previous planning sessions and outcomes.\n"
          + "\n"
          + "Historical planning data:\n"
          + "%s\n"
          + "\n"
          + "Current objective: Design and implement a scalable microservices architecture for"
          + " an e-commerce platform.\n"
          + "Create a detailed implementation plan with:\n"
          + "- Architecture decisions\n"
          + "- Technology choices\n"
          + "- Implementation steps\n"
          + "- Risk assessment\n"
          + "- Timeline estimates\n") {
    @Override
    String filler() {
      List<Map<String, Object>> sessions = new ArrayList<>();
      for (int i = 0; i < 5; i++) {
        Map<String, Object> session = new LinkedHashMap<>();
        session.put("session", i);
        session.put("tasks", Collections.nCopies(5, "task".repeat(10)));
        session.put("outcomes", "success".repeat(20));
        sessions.add(session);
      }
      return prettyJson(sessions);
    }
  },

  PROBLEM_SOLVING(
      WorkloadFamily.AGENTIC,
      "problem_solving",
      0.8,
      "You are a problem-solving agent with reasoning capabilities.\n"
          + "You need to analyze complex scenarios and provide solutions.\n"
          + "\n"
          + "Problem context and constraints:\n"
          + "%s\n"
          + "\n"
          + "Problem: A distributed system is experiencing intermittent failures. Analyze the"
          + " logs, identify root causes, and propose solutions.\n"
          + "Use chain-of-thought reasoning to work through this systematically.\n") {
    @Override
    String filler() {
      List<String> entries = new ArrayList<>();
      for (int i = 0; i < 15; i++) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", i);
        entry.put("level", "ERROR");
        entry.put("message", "error".repeat(10));
        entry.put("stack", "trace".repeat(10));
        entries.add("Log entry " + i + ": " + compactJson(entry));
      }
      return String.join("\n", entries);
    }
  };

  private final WorkloadFamily family;
  private final String templateName;
  private final double contextFraction;
  private final String format;

  PromptTemplate(
      WorkloadFamily family, String templateName, double contextFraction, String format) {
    this.family = family;
    this.templateName = templateName;
    this.contextFraction = contextFraction;
    this.format = format;
  }

  /** Static context data substituted into the template. */
  abstract String filler();

  public WorkloadFamily family() {
    return family;
  }

  public String templateName() {
    return templateName;
  }

  /** Share of the maximum context this template aims for, in (0, 1]. */
  public double contextFraction() {
    return contextFraction;
  }

  /** Tag recorded on outcomes, e.g. {@code MCP_file_search}. */
  public String workloadType() {
    return family.tagPrefix() + "_" + templateName;
  }

  /** Fills the template with its context data. Deterministic. */
  public String render() {
    return format.replace("%s", filler());
  }

  public static List<PromptTemplate> byFamily(WorkloadFamily family) {
    return Arrays.stream(values()).filter(t -> t.family == family).collect(Collectors.toList());
  }

  private static Map<String, Object> columns(String... names) {
    List<String> repeated = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      repeated.addAll(Arrays.asList(names));
    }
    return Map.of("columns", repeated);
  }

  private static String prettyJson(Object value) {
    try {
      return JsonUtil.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render template data", e);
    }
  }

  private static String compactJson(Object value) {
    try {
      return JsonUtil.mapper().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render template data", e);
    }
  }
}
