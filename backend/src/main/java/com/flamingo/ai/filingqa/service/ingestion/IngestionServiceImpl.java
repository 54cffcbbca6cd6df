package com.flamingo.ai.filingqa.service.ingestion;

import com.flamingo.ai.filingqa.api.dto.request.ChunkIngestRequest;
import com.flamingo.ai.filingqa.domain.enums.FilingType;
import com.flamingo.ai.filingqa.domain.model.Chunk;
import com.flamingo.ai.filingqa.domain.model.ChunkMetadata;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import com.flamingo.ai.filingqa.domain.model.IngestionSummary;
import com.flamingo.ai.filingqa.exception.IngestionStateException;
import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.filingqa.service.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of IngestionService.
 *
 * <p>Ingestion is single-writer: {@link #ingest} is synchronized so that fitting, adding and
 * saving never interleave.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionServiceImpl implements IngestionService {

  private final EmbeddingGenerator embeddingGenerator;
  private final VectorStore vectorStore;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "ingestion.batch", description = "Time to ingest a batch of chunks")
  public synchronized IngestionSummary ingest(List<ChunkIngestRequest> records) {
    List<String> warnings = new ArrayList<>();
    List<Chunk> chunks = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();

    for (int i = 0; i < records.size(); i++) {
      ChunkIngestRequest record = records.get(i);
      Optional<String> problem = validate(record);
      if (problem.isPresent()) {
        warnings.add(describe(i, record) + ": " + problem.get());
        continue;
      }
      String id = record.getId().trim();
      if (!seenIds.add(id)) {
        warnings.add(describe(i, record) + ": duplicate id in batch");
        continue;
      }
      if (vectorStore.getChunk(id).isPresent()) {
        warnings.add(describe(i, record) + ": already stored");
        continue;
      }
      chunks.add(toChunk(record));
    }

    int skipped = records.size() - chunks.size();
    warnings.forEach(warning -> log.warn("Skipping chunk {}", warning));
    meterRegistry.counter("ingestion.chunks.skipped").increment(skipped);

    if (chunks.isEmpty()) {
      log.info("No valid chunks in batch of {}", records.size());
      return new IngestionSummary(
          records.size(), 0, skipped, warnings, embeddingGenerator.getActiveMethod());
    }

    List<String> texts = chunks.stream().map(Chunk::text).toList();
    prepareGenerator(texts);

    List<EmbeddingVector> embeddings = embeddingGenerator.embedBatch(texts);
    for (int i = 0; i < embeddings.size(); i++) {
      if (embeddings.get(i).isZero()) {
        String warning = "chunk " + chunks.get(i).id() + ": embedding is the zero vector";
        log.warn("Stored {}", warning);
        warnings.add(warning);
      }
    }

    int accepted = vectorStore.add(chunks, embeddings);
    vectorStore.save();
    meterRegistry.counter("ingestion.chunks.accepted").increment(accepted);

    log.info(
        "Ingested {} of {} chunks ({} skipped) with {} embeddings",
        accepted,
        records.size(),
        skipped,
        embeddingGenerator.getActiveMethod());
    return new IngestionSummary(
        records.size(), accepted, skipped, warnings, embeddingGenerator.getActiveMethod());
  }

  /**
   * Fits the generator on the batch when the store is empty. A non-empty store keeps the fit its
   * embeddings were produced with.
   */
  private void prepareGenerator(List<String> texts) {
    if (vectorStore.isEmpty()) {
      embeddingGenerator.fit(texts);
      return;
    }
    if (!embeddingGenerator.isReady()) {
      throw new IngestionStateException(
          "Store holds "
              + vectorStore.size()
              + " chunks but the embedding generator is not fitted");
    }
  }

  private Optional<String> validate(ChunkIngestRequest record) {
    if (record == null) {
      return Optional.of("record is null");
    }
    if (isBlank(record.getId())) {
      return Optional.of("id is missing");
    }
    if (isBlank(record.getText())) {
      return Optional.of("text is empty");
    }
    if (isBlank(record.getTicker())) {
      return Optional.of("ticker is missing");
    }
    if (FilingType.fromCode(record.getFilingType()).isEmpty()) {
      return Optional.of("unknown filing type '" + record.getFilingType() + "'");
    }
    if (isBlank(record.getFilingDate())) {
      return Optional.of("filing date is missing");
    }
    try {
      LocalDate.parse(record.getFilingDate().trim());
    } catch (DateTimeParseException e) {
      return Optional.of("filing date '" + record.getFilingDate() + "' is not an ISO date");
    }
    Double quality = record.getQualityScore();
    if (quality != null && (quality.isNaN() || quality < 0.0 || quality > 1.0)) {
      return Optional.of("quality score " + quality + " is outside [0,1]");
    }
    return Optional.empty();
  }

  private Chunk toChunk(ChunkIngestRequest record) {
    ChunkMetadata metadata =
        ChunkMetadata.builder()
            .ticker(record.getTicker().trim().toUpperCase(Locale.ROOT))
            .filingType(FilingType.of(record.getFilingType()))
            .filingDate(LocalDate.parse(record.getFilingDate().trim()))
            .sectionType(trimToNull(record.getSectionType()))
            .qualityScore(record.getQualityScore() == null ? 1.0 : record.getQualityScore())
            .companyName(trimToNull(record.getCompanyName()))
            .sector(trimToNull(record.getSector()))
            .build();
    return new Chunk(record.getId().trim(), record.getText(), metadata);
  }

  private static String describe(int position, ChunkIngestRequest record) {
    String id = record == null || isBlank(record.getId()) ? "<no id>" : record.getId();
    return "#" + position + " (" + id + ")";
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String trimToNull(String value) {
    return isBlank(value) ? null : value.trim();
  }
}
