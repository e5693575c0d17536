package com.flamingo.ai.interviewinsights.service.normalize;

import com.flamingo.ai.interviewinsights.config.InsightsConfig;
import com.flamingo.ai.interviewinsights.domain.enums.InterviewRoundType;
import com.flamingo.ai.interviewinsights.domain.model.ExperienceRecord;
import com.flamingo.ai.interviewinsights.domain.model.NormalizedDocument;
import com.flamingo.ai.interviewinsights.taxonomy.DomainTaxonomy;
import com.flamingo.ai.interviewinsights.taxonomy.TermText;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

/**
 * Cleans and tokenizes raw experience text.
 *
 * <p>Steps: strip HTML and markdown artifacts, NFKC-normalize and lowercase, split into words, join
 * whitelisted multi-word phrases into single tokens, then drop stopwords and malformed tokens.
 * Taxonomy terms and whitelisted interview terms are never dropped.
 */
@Service
@Slf4j
public class TextNormalizer {

  // Common English stop words plus filler frequent in interview write-ups
  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even",
          "she", "his", "hers", "us", "out", "off", "once", "further", "because", "let", "got",
          "get", "really", "like", "well", "asked", "ask", "told", "said", "one", "two", "s", "t",
          "don", "didn", "im", "ve", "ll", "re");

  // Interview vocabulary kept even where it would look like a stopword or a short token
  private static final Set<String> BUILT_IN_WHITELIST =
      Set.of(
          "technical", "system design", "coding", "design", "system", "behavioral", "round",
          "rounds", "onsite", "online assessment", "phone screen", "hr", "oa", "dp", "os", "db",
          "ai", "ml");

  private static final Pattern HTML_MARKUP = Pattern.compile("<[a-zA-Z/!][^>]*>|&[a-zA-Z]+;|&#\\d+;");
  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
  private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
  private static final Pattern MARKDOWN_ARTIFACTS =
      Pattern.compile("```[a-zA-Z]*|`|\\*\\*|__|(?m)^\\s{0,3}#{1,6}\\s+|(?m)^\\s*>\\s?");

  private final DomainTaxonomy taxonomy;
  private final Set<String> whitelist;
  private final Set<String> stopWords;
  private final int minTokenLength;
  private final int maxTokenLength;
  private final int maxPhraseWords;

  public TextNormalizer(DomainTaxonomy taxonomy, InsightsConfig insightsConfig) {
    this.taxonomy = taxonomy;
    InsightsConfig.Normalization config = insightsConfig.getNormalization();

    Set<String> whitelistBuilder = new HashSet<>(BUILT_IN_WHITELIST);
    for (InterviewRoundType type : InterviewRoundType.values()) {
      whitelistBuilder.addAll(type.getIndicators());
    }
    config.getExtraWhitelist().stream()
        .map(TermText::canonical)
        .filter(t -> !t.isEmpty())
        .forEach(whitelistBuilder::add);
    this.whitelist = Set.copyOf(whitelistBuilder);

    Set<String> stopWordBuilder = new HashSet<>(STOP_WORDS);
    config.getExtraStopwords().stream()
        .map(TermText::canonical)
        .filter(t -> !t.isEmpty())
        .forEach(stopWordBuilder::add);
    this.stopWords = Set.copyOf(stopWordBuilder);

    this.minTokenLength = config.getMinTokenLength();
    this.maxTokenLength = config.getMaxTokenLength();
    this.maxPhraseWords =
        Math.max(
            taxonomy.maxPhraseWords(),
            whitelist.stream().mapToInt(t -> t.split(" ").length).max().orElse(1));
  }

  /**
   * Normalizes raw report text into tokens.
   *
   * @param rawText the raw text, may be null or contain markup
   * @return ordered tokens, empty for empty or unusable input
   */
  public List<String> normalize(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      return List.of();
    }

    List<String> words = TermText.words(stripMarkup(rawText));
    if (words.isEmpty()) {
      return List.of();
    }

    List<String> tokens = new ArrayList<>(words.size());
    int i = 0;
    while (i < words.size()) {
      int phraseLength = longestPhraseAt(words, i);
      if (phraseLength > 1) {
        tokens.add(String.join(" ", words.subList(i, i + phraseLength)));
        i += phraseLength;
        continue;
      }
      String word = words.get(i++);
      if (keep(word)) {
        tokens.add(word);
      }
    }
    return List.copyOf(tokens);
  }

  /**
   * Normalizes an experience record.
   *
   * @param record the record, expected to have passed validation
   * @return the normalized document
   */
  public NormalizedDocument normalize(ExperienceRecord record) {
    List<String> tokens = normalize(record.rawText());
    log.trace("Record {} normalized to {} tokens", record.id(), tokens.size());
    return new NormalizedDocument(
        record.id(), tokens, record.company(), record.date(), record.outcome());
  }

  /** Whether a token is protected from stopword and length filtering. */
  public boolean isWhitelisted(String token) {
    return whitelist.contains(token) || taxonomy.contains(token);
  }

  private String stripMarkup(String text) {
    String cleaned = text;
    if (HTML_MARKUP.matcher(cleaned).find()) {
      cleaned = Jsoup.parse(cleaned).text();
    }
    cleaned = MARKDOWN_LINK.matcher(cleaned).replaceAll("$1");
    cleaned = URL.matcher(cleaned).replaceAll(" ");
    cleaned = MARKDOWN_ARTIFACTS.matcher(cleaned).replaceAll(" ");
    return cleaned;
  }

  private int longestPhraseAt(List<String> words, int start) {
    int limit = Math.min(maxPhraseWords, words.size() - start);
    for (int length = limit; length > 1; length--) {
      String phrase = String.join(" ", words.subList(start, start + length));
      if (isWhitelisted(phrase)) {
        return length;
      }
    }
    return 1;
  }

  private boolean keep(String word) {
    if (isWhitelisted(word)) {
      return true;
    }
    if (word.length() > maxTokenLength) {
      return false;
    }
    // Numbers survive so that "round 3" style counts stay available
    if (NUMBER.matcher(word).matches()) {
      return true;
    }
    if (word.length() < minTokenLength) {
      return false;
    }
    return !stopWords.contains(word);
  }
}
