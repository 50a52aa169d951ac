package com.gentoro.aistack.providers.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitespace tokenizer. A token is a maximal run of non-whitespace characters; tokens keep their
 * character offsets so chunks can be cut from the original text without re-joining.
 */
public final class Tokenizer {
  private static final Pattern TOKEN = Pattern.compile("\\S+");

  private Tokenizer() {}

  /** Character span {@code [start, end)} of one token. */
  public record Token(int start, int end) {}

  public static List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) return tokens;
    Matcher m = TOKEN.matcher(text);
    while (m.find()) {
      tokens.add(new Token(m.start(), m.end()));
    }
    return tokens;
  }
}
