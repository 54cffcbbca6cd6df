package com.flamingo.ai.filingqa.service.query.extraction;

import com.flamingo.ai.filingqa.domain.model.Company;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds company tickers in a query, by ticker symbol or by company name.
 *
 * <p>Ticker symbols collide with ordinary words, so symbol matching is guarded by length: four or
 * more letters match in any case, three letters only in upper case, and one or two letters only
 * in upper case with a company-context cue nearby (a word such as "stock" or "shares" within three
 * words, a possessive {@code 's}, or a name of the same company elsewhere in the query). Company
 * names match in any case. All matching is whole-word.
 */
@Component
@Slf4j
public class TickerExtractor {

  static final Set<String> CONTEXT_CUES =
      Set.of(
          "stock", "stocks", "share", "shares", "shareholders", "ticker", "company", "corp",
          "inc", "10-k", "10-q", "8-k", "filing", "filings", "revenue", "revenues", "earnings",
          "compare", "versus", "vs");

  private static final int CUE_WINDOW = 3;
  private static final Pattern WORD = Pattern.compile("[\\w&][\\w&.'-]*");

  private final List<CompanyPatterns> companies;

  /** Compiled patterns for one company. */
  private record CompanyPatterns(Company company, Pattern tickerPattern, List<Pattern> aliases) {}

  public TickerExtractor(CompanyDirectory companyDirectory) {
    List<CompanyPatterns> compiled = new ArrayList<>();
    for (Company company : companyDirectory.getCompanies()) {
      String ticker = company.ticker();
      boolean anyCase = ticker.length() >= 4;
      List<Pattern> aliases =
          company.aliases().stream().map(alias -> Phrases.wholeWord(alias, true)).toList();
      compiled.add(new CompanyPatterns(company, Phrases.wholeWord(ticker, anyCase), aliases));
    }
    this.companies = List.copyOf(compiled);
  }

  /**
   * Extracts the tickers mentioned in a query.
   *
   * @param query raw query, may be null
   * @return sorted upper-case tickers
   */
  public SortedSet<String> extract(String query) {
    SortedSet<String> tickers = new TreeSet<>();
    if (query == null || query.isBlank()) {
      return tickers;
    }
    for (CompanyPatterns patterns : companies) {
      boolean aliasHit = patterns.aliases().stream().anyMatch(p -> p.matcher(query).find());
      if (aliasHit || symbolHit(patterns, query)) {
        tickers.add(patterns.company().ticker());
      }
    }
    log.debug("Tickers in '{}': {}", query, tickers);
    return tickers;
  }

  private boolean symbolHit(CompanyPatterns patterns, String query) {
    Matcher matcher = patterns.tickerPattern().matcher(query);
    if (patterns.company().ticker().length() > 2) {
      return matcher.find();
    }
    while (matcher.find()) {
      if (hasContextCue(query, matcher.start(), matcher.end())) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasContextCue(String query, int start, int end) {
    String after = query.substring(end);
    if (after.startsWith("'s") || after.startsWith("’s")) {
      return true;
    }
    List<String> before = words(query.substring(0, start));
    List<String> following = words(after);
    List<String> window = new ArrayList<>();
    window.addAll(before.subList(Math.max(0, before.size() - CUE_WINDOW), before.size()));
    window.addAll(following.subList(0, Math.min(CUE_WINDOW, following.size())));
    return window.stream().anyMatch(CONTEXT_CUES::contains);
  }

  private static List<String> words(String text) {
    List<String> words = new ArrayList<>();
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String word = matcher.group().replaceAll("(['’]s|[.'-])+$", "");
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}
