package com.flamingo.ai.filingqa.service.query.extraction;

import com.flamingo.ai.filingqa.domain.enums.FinancialConcept;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Detects financial topics by whole-word lexicon matching. */
@Component
public class FinancialConceptExtractor {

  private final Map<FinancialConcept, List<Pattern>> lexicon;

  public FinancialConceptExtractor() {
    Map<FinancialConcept, List<Pattern>> compiled = new EnumMap<>(FinancialConcept.class);
    for (FinancialConcept concept : FinancialConcept.values()) {
      compiled.put(
          concept,
          concept.getPhrases().stream().map(phrase -> Phrases.wholeWord(phrase, true)).toList());
    }
    this.lexicon = compiled;
  }

  public Set<FinancialConcept> extract(String query) {
    Set<FinancialConcept> concepts = EnumSet.noneOf(FinancialConcept.class);
    if (query == null || query.isBlank()) {
      return concepts;
    }
    lexicon.forEach(
        (concept, patterns) -> {
          if (patterns.stream().anyMatch(pattern -> pattern.matcher(query).find())) {
            concepts.add(concept);
          }
        });
    return concepts;
  }
}
