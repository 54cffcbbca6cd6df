package com.flamingo.ai.filingqa.domain.model;

/** A routing decision together with the retrieval outcome it produced. */
public record RoutedQuery(RoutingDecision decision, SearchOutcome outcome) {}
