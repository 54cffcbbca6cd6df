package com.flamingo.ai.filingqa.domain.enums;

import java.util.List;

/** Financial topics recognised in queries, each with the phrases that signal it. */
public enum FinancialConcept {
  REVENUE(List.of("revenue", "revenues", "sales", "income", "earnings")),
  EXPENSES(List.of("expenses", "expense", "costs", "spending")),
  PROFIT(List.of("profit", "profits", "net income", "earnings", "margin", "margins")),
  CASH_FLOW(List.of("cash flow", "cash flows", "operating cash", "free cash flow")),
  DEBT(List.of("debt", "liabilities", "borrowing", "borrowings")),
  ASSETS(List.of("assets", "balance sheet")),
  RISK_FACTORS(List.of("risk", "risks", "risk factors")),
  COMPETITION(List.of("competition", "competitive", "competitors")),
  RESEARCH_AND_DEVELOPMENT(List.of("r&d", "research", "development", "innovation")),
  ACQUISITIONS(List.of("acquisition", "acquisitions", "merger", "mergers", "m&a")),
  EXECUTIVE_COMPENSATION(List.of("compensation", "executive pay", "salary", "salaries")),
  WORKING_CAPITAL(List.of("working capital", "current assets")),
  CLIMATE(List.of("climate", "environmental", "sustainability", "emissions")),
  AI_AUTOMATION(List.of("ai", "artificial intelligence", "automation", "technology"));

  private final List<String> phrases;

  FinancialConcept(List<String> phrases) {
    this.phrases = phrases;
  }

  public List<String> getPhrases() {
    return phrases;
  }
}
