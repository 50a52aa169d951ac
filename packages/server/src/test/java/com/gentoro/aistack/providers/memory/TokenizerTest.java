package com.gentoro.aistack.providers.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenizerTest {

  @Test
  @DisplayName("Null, blank and whitespace runs yield the expected token counts")
  void tokenCounts() {
    assertEquals(0, Tokenizer.tokenize(null).size());
    assertEquals(0, Tokenizer.tokenize("").size());
    assertEquals(0, Tokenizer.tokenize("   \n\t").size());
    assertEquals(1, Tokenizer.tokenize("word").size());
    assertEquals(3, Tokenizer.tokenize("  one\ttwo \n three  ").size());
  }

  @Test
  @DisplayName("tokenize reports character offsets into the original text")
  void tokenizeOffsets() {
    String text = "alpha  beta\ngamma";
    List<Tokenizer.Token> tokens = Tokenizer.tokenize(text);
    assertEquals(3, tokens.size());
    assertEquals("alpha", text.substring(tokens.get(0).start(), tokens.get(0).end()));
    assertEquals("beta", text.substring(tokens.get(1).start(), tokens.get(1).end()));
    assertEquals("gamma", text.substring(tokens.get(2).start(), tokens.get(2).end()));
  }
}
