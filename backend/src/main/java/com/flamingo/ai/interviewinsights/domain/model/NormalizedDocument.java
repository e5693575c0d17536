package com.flamingo.ai.interviewinsights.domain.model;

import com.flamingo.ai.interviewinsights.domain.enums.Outcome;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Tokenized form of one experience record, valid for a single analysis run.
 *
 * @param documentId id of the source record, used as the canonical aggregation order
 * @param tokens ordered normalized tokens; multi-word taxonomy terms are single tokens
 * @param companyRef company the record belongs to
 * @param date date of the experience
 * @param outcomeRef reported outcome
 */
public record NormalizedDocument(
    String documentId, List<String> tokens, String companyRef, LocalDate date, Outcome outcomeRef) {

  public NormalizedDocument {
    tokens = tokens == null ? List.of() : List.copyOf(tokens);
    outcomeRef = outcomeRef == null ? Outcome.UNKNOWN : outcomeRef;
  }

  private static final String ANONYMOUS_PREFIX = "~anonymous|";
  private static final String FIELD_SEPARATOR = "|";
  private static final String TOKEN_SEPARATOR = "\u001f";
  private static final String COPY_SEPARATOR = "#";

  /**
   * Key that identifies the document inside a run and fixes the order in which per-document
   * contributions are summed: the id, or for documents without an id a key spelled out from the
   * whole content. Equal-content documents without an id share this key until {@link
   * #canonicalOrder} numbers them.
   */
  public String key() {
    if (hasId()) {
      return documentId;
    }
    return ANONYMOUS_PREFIX
        + date
        + FIELD_SEPARATOR
        + outcomeRef
        + FIELD_SEPARATOR
        + companyRef
        + FIELD_SEPARATOR
        + String.join(TOKEN_SEPARATOR, tokens);
  }

  private boolean hasId() {
    return documentId != null && !documentId.isBlank();
  }

  /**
   * Sorts documents by {@link #key()}. Documents sharing an id are folded into one: tokens are
   * concatenated, the latest date and the first known outcome are kept. Documents without an id
   * are never folded; each copy of the same content gets the content key plus its occurrence
   * number as id, so the keys are unique and do not depend on input order.
   *
   * @param documents documents in any order, nulls are ignored
   * @return documents in canonical order with unique keys
   */
  public static List<NormalizedDocument> canonicalOrder(Collection<NormalizedDocument> documents) {
    if (documents == null || documents.isEmpty()) {
      return List.of();
    }
    Map<String, List<NormalizedDocument>> byId = new TreeMap<>();
    Map<String, Integer> anonymousCopies = new TreeMap<>();
    Map<String, NormalizedDocument> anonymousContent = new TreeMap<>();
    for (NormalizedDocument document : documents) {
      if (document == null) {
        continue;
      }
      if (document.hasId()) {
        byId.computeIfAbsent(document.documentId(), k -> new ArrayList<>()).add(document);
      } else {
        String contentKey = document.key();
        anonymousCopies.merge(contentKey, 1, Integer::sum);
        anonymousContent.putIfAbsent(contentKey, document);
      }
    }

    Map<String, NormalizedDocument> byKey = new TreeMap<>();
    for (List<NormalizedDocument> group : byId.values()) {
      NormalizedDocument document = group.size() == 1 ? group.get(0) : fold(group);
      byKey.put(document.key(), document);
    }
    anonymousCopies.forEach(
        (contentKey, copies) -> {
          NormalizedDocument content = anonymousContent.get(contentKey);
          for (int copy = 1; copy <= copies; copy++) {
            String id = contentKey + COPY_SEPARATOR + copy;
            byKey.put(
                id,
                new NormalizedDocument(
                    id, content.tokens(), content.companyRef(), content.date(), content.outcomeRef()));
          }
        });
    return List.copyOf(byKey.values());
  }

  private static NormalizedDocument fold(List<NormalizedDocument> group) {
    group.sort(
        Comparator.comparing((NormalizedDocument document) -> String.join(" ", document.tokens()))
            .thenComparing(NormalizedDocument::outcomeRef)
            .thenComparing(
                NormalizedDocument::date, Comparator.nullsFirst(Comparator.naturalOrder())));
    List<String> tokens = new ArrayList<>();
    LocalDate latest = null;
    Outcome outcome = Outcome.UNKNOWN;
    for (NormalizedDocument document : group) {
      tokens.addAll(document.tokens());
      if (document.date() != null && (latest == null || document.date().isAfter(latest))) {
        latest = document.date();
      }
      if (outcome == Outcome.UNKNOWN) {
        outcome = document.outcomeRef();
      }
    }
    NormalizedDocument first = group.get(0);
    String company =
        group.stream()
            .map(NormalizedDocument::companyRef)
            .filter(Objects::nonNull)
            .min(Comparator.naturalOrder())
            .orElse(null);
    return new NormalizedDocument(first.documentId(), tokens, company, latest, outcome);
  }
}
