package com.mk.fx.qa.llm.load.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class RunConsoleTest {

  @Test
  void linesFrom_returnsLinesAfterOffset() {
    var console = new RunConsole("run", 10);
    console.printAll(List.of("a", "b", "c"));

    var chunk = console.linesFrom(1);

    assertThat(chunk.from()).isEqualTo(1);
    assertThat(chunk.nextOffset()).isEqualTo(3);
    assertThat(chunk.lines()).containsExactly("b", "c");
  }

  @Test
  void linesFrom_atEndIsEmpty() {
    var console = new RunConsole("run", 10);
    console.println("a");

    var chunk = console.linesFrom(5);

    assertThat(chunk.lines()).isEmpty();
    assertThat(chunk.nextOffset()).isEqualTo(1);
  }

  @Test
  void negativeOffset_startsAtBeginning() {
    var console = new RunConsole("run", 10);
    console.println("a");

    assertThat(console.linesFrom(-4).lines()).containsExactly("a");
  }

  @Test
  void overflow_dropsOldestAndKeepsOffsets() {
    var console = new RunConsole("run", 3);
    for (int i = 0; i < 5; i++) {
      console.println("line " + i);
    }

    var chunk = console.linesFrom(0);

    assertThat(console.droppedLines()).isEqualTo(2);
    assertThat(console.lineCount()).isEqualTo(5);
    assertThat(chunk.from()).isEqualTo(2);
    assertThat(chunk.nextOffset()).isEqualTo(5);
    assertThat(chunk.lines()).containsExactly("line 2", "line 3", "line 4");
  }

  @Test
  void nullLine_isBlank() {
    var console = new RunConsole("run", 3);
    console.println(null);

    assertThat(console.linesFrom(0).lines()).containsExactly("");
  }

  @Test
  void capacity_mustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new RunConsole("run", 0));
  }
}
