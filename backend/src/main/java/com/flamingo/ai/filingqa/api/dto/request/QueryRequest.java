package com.flamingo.ai.filingqa.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a retrieval query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Optional result budget. If null, the routed strategy's default is used. */
  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 100, message = "topK must not exceed 100")
  private Integer topK;
}
