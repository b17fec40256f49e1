package com.mk.fx.qa.llm.load.client;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChatCompletionTest {

  @Test
  void parse_readsContentAndCompletionTokens() {
    var completion =
        ChatCompletion.parse(
            "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"OK\"}}],"
                + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3}}");

    assertThat(completion.content()).isEqualTo("OK");
    assertThat(completion.completionTokens()).isEqualTo(3);
  }

  @Test
  void parse_toleratesMissingFields() {
    assertThat(ChatCompletion.parse("{}")).isEqualTo(ChatCompletion.EMPTY);
    assertThat(ChatCompletion.parse("{\"choices\":[]}")).isEqualTo(ChatCompletion.EMPTY);
    assertThat(ChatCompletion.parse("{\"choices\":[{\"message\":{\"content\":null}}]}").content())
        .isEmpty();
  }

  @Test
  void parse_toleratesNonJsonAndEmptyBodies() {
    assertThat(ChatCompletion.parse("upstream says hello")).isEqualTo(ChatCompletion.EMPTY);
    assertThat(ChatCompletion.parse("")).isEqualTo(ChatCompletion.EMPTY);
    assertThat(ChatCompletion.parse(null)).isEqualTo(ChatCompletion.EMPTY);
  }
}
