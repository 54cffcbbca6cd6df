package com.flamingo.ai.filingqa.domain.enums;

/** Query classification produced by the router, used by the answer-generation layer. */
public enum QueryType {
  SINGLE_COMPANY,
  MULTI_COMPANY,
  TEMPORAL_ANALYSIS,
  CROSS_SECTIONAL,
  GENERAL_SEARCH
}
