package com.flamingo.ai.filingqa.service.query.extraction;

import com.flamingo.ai.filingqa.domain.enums.FilingType;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Maps form codes and their common names in a query to SEC filing types. */
@Component
public class FilingTypeExtractor {

  private static final Set<FilingType> INSIDER_FORMS =
      EnumSet.of(FilingType.FORM_3, FilingType.FORM_4, FilingType.FORM_5);

  private static final Map<Pattern, Set<FilingType>> SYNONYMS = synonyms();

  public Set<FilingType> extract(String query) {
    Set<FilingType> types = EnumSet.noneOf(FilingType.class);
    if (query == null || query.isBlank()) {
      return types;
    }
    SYNONYMS.forEach(
        (pattern, mapped) -> {
          if (pattern.matcher(query).find()) {
            types.addAll(mapped);
          }
        });
    return types;
  }

  private static Map<Pattern, Set<FilingType>> synonyms() {
    Map<Pattern, Set<FilingType>> synonyms = new LinkedHashMap<>();
    put(synonyms, "(?<!\\w)10-?k(?!\\w)", EnumSet.of(FilingType.FORM_10K));
    put(synonyms, "(?<!\\w)annual\\s+reports?(?!\\w)", EnumSet.of(FilingType.FORM_10K));
    put(synonyms, "(?<!\\w)10-?q(?!\\w)", EnumSet.of(FilingType.FORM_10Q));
    put(synonyms, "(?<!\\w)quarterly\\s+reports?(?!\\w)", EnumSet.of(FilingType.FORM_10Q));
    put(synonyms, "(?<!\\w)8-?k(?!\\w)", EnumSet.of(FilingType.FORM_8K));
    put(synonyms, "(?<!\\w)current\\s+reports?(?!\\w)", EnumSet.of(FilingType.FORM_8K));
    put(synonyms, "(?<!\\w)proxy(?!\\w)", EnumSet.of(FilingType.DEF_14A));
    put(synonyms, "(?<!\\w)def\\s*14a(?!\\w)", EnumSet.of(FilingType.DEF_14A));
    put(synonyms, "(?<!\\w)insider\\s+trading(?!\\w)", INSIDER_FORMS);
    put(synonyms, "(?<!\\w)forms?\\s+[345](?!\\w)", INSIDER_FORMS);
    return synonyms;
  }

  private static void put(
      Map<Pattern, Set<FilingType>> synonyms, String regex, Set<FilingType> types) {
    synonyms.put(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), types);
  }
}
