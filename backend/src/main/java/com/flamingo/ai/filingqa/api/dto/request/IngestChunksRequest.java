package com.flamingo.ai.filingqa.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a batch of chunks to embed and store. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestChunksRequest {

  @NotEmpty(message = "At least one chunk is required")
  @Size(max = 50000, message = "A batch must not exceed 50000 chunks")
  private List<ChunkIngestRequest> chunks;
}
