package com.flamingo.ai.filingqa.service.query.extraction;

import java.util.regex.Pattern;

/** Whole-word phrase patterns shared by the extractors. */
final class Phrases {

  private Phrases() {}

  /**
   * Compiles a literal phrase anchored on non-word characters, so "ai" never matches inside
   * "maintain". Internal whitespace matches any run of whitespace.
   */
  static Pattern wholeWord(String phrase, boolean caseInsensitive) {
    String[] words = phrase.trim().split("\\s+");
    StringBuilder regex = new StringBuilder("(?<!\\w)");
    for (int i = 0; i < words.length; i++) {
      if (i > 0) {
        regex.append("\\s+");
      }
      regex.append(Pattern.quote(words[i]));
    }
    regex.append("(?!\\w)");
    int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
    return Pattern.compile(regex.toString(), flags);
  }
}
