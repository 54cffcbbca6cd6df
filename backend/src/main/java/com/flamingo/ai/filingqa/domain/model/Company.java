package com.flamingo.ai.filingqa.domain.model;

import java.util.List;

/**
 * A company in the filing universe.
 *
 * @param ticker upper-case ticker
 * @param name full legal name
 * @param sector industry sector
 * @param aliases lower-case alternative names, matched whole-word
 */
public record Company(String ticker, String name, String sector, List<String> aliases) {

  public Company {
    aliases = List.copyOf(aliases);
  }
}
