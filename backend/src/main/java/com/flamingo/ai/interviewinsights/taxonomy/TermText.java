package com.flamingo.ai.interviewinsights.taxonomy;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word splitting shared by the taxonomy and the text normalizer, so that taxonomy phrases and
 * document tokens end up in the same canonical form.
 */
public final class TermText {

  // Letters and digits, plus '+' and '#' for terms like c++ and c#
  private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}+#]+");
  private static final Pattern HAS_LETTER_OR_DIGIT = Pattern.compile(".*[\\p{L}\\p{N}].*");

  private TermText() {}

  /**
   * Splits text into lowercase words after NFKC normalization.
   *
   * @param text the text, may be null
   * @return words in order, never null
   */
  public static List<String> words(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    List<String> words = new ArrayList<>();
    for (String word : WORD_SEPARATOR.split(normalized)) {
      if (!word.isEmpty() && HAS_LETTER_OR_DIGIT.matcher(word).matches()) {
        words.add(word);
      }
    }
    return words;
  }

  /**
   * Canonical form of a term: its words joined by single spaces.
   *
   * @param term the raw term
   * @return the canonical term, empty when the term has no words
   */
  public static String canonical(String term) {
    return String.join(" ", words(term));
  }
}
