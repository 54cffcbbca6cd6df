package com.flamingo.ai.filingqa.domain.model;

import com.flamingo.ai.filingqa.domain.enums.QueryComplexity;
import com.flamingo.ai.filingqa.domain.enums.QueryType;
import com.flamingo.ai.filingqa.domain.enums.RetrievalStrategy;

/** The router's classification of a query and the strategy chosen for it. */
public record RoutingDecision(
    QueryContext context,
    QueryType queryType,
    RetrievalStrategy strategy,
    ProcessingHints processingHints,
    QueryComplexity complexity) {}
