package com.flamingo.ai.filingqa.service.query.extraction;

import com.flamingo.ai.filingqa.domain.model.Company;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** The universe of companies whose filings are indexed, with the names they go by in queries. */
@Component
public class CompanyDirectory {

  static final List<Company> DEFAULT_UNIVERSE =
      List.of(
          new Company("AAPL", "Apple Inc.", "Technology", List.of("apple", "apple inc")),
          new Company(
              "MSFT",
              "Microsoft Corporation",
              "Technology",
              List.of("microsoft", "microsoft corporation")),
          new Company("GOOGL", "Alphabet Inc.", "Technology", List.of("google", "alphabet")),
          new Company(
              "JPM",
              "JPMorgan Chase & Co.",
              "Finance",
              List.of("jpmorgan", "jp morgan", "jpmorgan chase", "jp morgan chase")),
          new Company(
              "BAC",
              "Bank of America Corporation",
              "Finance",
              List.of("bank of america", "bofa")),
          new Company(
              "WFC",
              "Wells Fargo & Company",
              "Finance",
              List.of("wells fargo", "wells fargo & company")),
          new Company(
              "JNJ",
              "Johnson & Johnson",
              "Healthcare",
              List.of("johnson & johnson", "johnson and johnson", "j&j")),
          new Company("PFE", "Pfizer Inc.", "Healthcare", List.of("pfizer")),
          new Company(
              "XOM",
              "Exxon Mobil Corporation",
              "Energy",
              List.of("exxon", "exxon mobil", "exxonmobil")),
          new Company("CVX", "Chevron Corporation", "Energy", List.of("chevron")),
          new Company("AMZN", "Amazon.com Inc.", "Retail", List.of("amazon", "amazon.com")),
          new Company("WMT", "Walmart Inc.", "Retail", List.of("walmart", "wal-mart")),
          new Company(
              "GE", "General Electric Company", "Manufacturing", List.of("general electric")),
          new Company("CAT", "Caterpillar Inc.", "Manufacturing", List.of("caterpillar")),
          new Company(
              "BA",
              "The Boeing Company",
              "Manufacturing",
              List.of("boeing", "the boeing company")));

  private final Map<String, Company> byTicker;

  public CompanyDirectory() {
    this(DEFAULT_UNIVERSE);
  }

  public CompanyDirectory(List<Company> companies) {
    Map<String, Company> index = new LinkedHashMap<>();
    for (Company company : companies) {
      index.put(company.ticker().toUpperCase(Locale.ROOT), company);
    }
    this.byTicker = Collections.unmodifiableMap(index);
  }

  public List<Company> getCompanies() {
    return List.copyOf(byTicker.values());
  }

  public Optional<Company> findByTicker(String ticker) {
    if (ticker == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byTicker.get(ticker.trim().toUpperCase(Locale.ROOT)));
  }
}
