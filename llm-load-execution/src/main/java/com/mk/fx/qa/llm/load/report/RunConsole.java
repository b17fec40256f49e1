package com.mk.fx.qa.llm.load.report;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Human-readable progress stream of one run. Every line goes to the application log and into a
 * bounded buffer that clients poll by absolute line offset. When the buffer is full the oldest
 * lines are dropped, offsets keep counting.
 */
@Slf4j
public class RunConsole {

  private final String runId;
  private final int capacity;
  private final Deque<String> lines = new ArrayDeque<>();
  private long dropped;

  public RunConsole(String runId, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Console capacity must be positive");
    }
    this.runId = runId;
    this.capacity = capacity;
  }

  public void println(String line) {
    var text = line == null ? "" : line;
    log.info("[run {}] {}", runId, text);
    synchronized (this) {
      lines.addLast(text);
      if (lines.size() > capacity) {
        lines.removeFirst();
        dropped++;
      }
    }
  }

  public void printAll(List<String> block) {
    block.forEach(this::println);
  }

  /**
   * Returns buffered lines starting at absolute offset {@code from}. Offsets older than the buffer
   * are moved forward to the oldest retained line.
   */
  public synchronized Chunk linesFrom(long from) {
    var start = Math.max(Math.max(0, from), dropped);
    var end = dropped + lines.size();
    if (start >= end) {
      return new Chunk(end, end, List.of());
    }
    List<String> result = new ArrayList<>((int) (end - start));
    long index = dropped;
    for (String line : lines) {
      if (index >= start) {
        result.add(line);
      }
      index++;
    }
    return new Chunk(start, end, List.copyOf(result));
  }

  /** Total number of lines written so far, including dropped ones. */
  public synchronized long lineCount() {
    return dropped + lines.size();
  }

  @VisibleForTesting
  synchronized long droppedLines() {
    return dropped;
  }

  /** Lines in {@code [from, nextOffset)}. */
  public record Chunk(long from, long nextOffset, List<String> lines) {}
}
