package com.flamingo.ai.filingqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the SEC filings retrieval service. */
@SpringBootApplication
public class FilingQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(FilingQaApplication.class, args);
  }
}
