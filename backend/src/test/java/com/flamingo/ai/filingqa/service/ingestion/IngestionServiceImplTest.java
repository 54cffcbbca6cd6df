package com.flamingo.ai.filingqa.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.filingqa.api.dto.request.ChunkIngestRequest;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.domain.enums.FilingType;
import com.flamingo.ai.filingqa.domain.model.Chunk;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import com.flamingo.ai.filingqa.domain.model.IngestionSummary;
import com.flamingo.ai.filingqa.exception.IngestionStateException;
import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.filingqa.service.store.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("IngestionServiceImpl Tests")
class IngestionServiceImplTest {

  @Mock private EmbeddingGenerator embeddingGenerator;
  @Mock private VectorStore vectorStore;

  @Captor private ArgumentCaptor<List<Chunk>> chunksCaptor;
  @Captor private ArgumentCaptor<List<String>> textsCaptor;

  private SimpleMeterRegistry meterRegistry;
  private IngestionServiceImpl ingestionService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ingestionService = new IngestionServiceImpl(embeddingGenerator, vectorStore, meterRegistry);
    when(embeddingGenerator.getActiveMethod()).thenReturn(EmbeddingMethod.FALLBACK);
    when(vectorStore.getChunk(anyString())).thenReturn(Optional.empty());
    when(vectorStore.isEmpty()).thenReturn(true);
    when(embeddingGenerator.embedBatch(anyList()))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              List<EmbeddingVector> vectors = new ArrayList<>();
              texts.forEach(text -> vectors.add(unit()));
              return vectors;
            });
    when(vectorStore.add(anyList(), anyList()))
        .thenAnswer(invocation -> invocation.<List<Chunk>>getArgument(0).size());
  }

  @Test
  @DisplayName("Should fit on an empty store, then add and save")
  void shouldFitAddAndSave() {
    // Given
    List<ChunkIngestRequest> records =
        List.of(
            record("a1", "AAPL", "10-K", "2023-11-03"),
            record("m1", "msft", "10-q", "2023-07-27"));

    // When
    IngestionSummary summary = ingestionService.ingest(records);

    // Then
    assertThat(summary.received()).isEqualTo(2);
    assertThat(summary.accepted()).isEqualTo(2);
    assertThat(summary.skipped()).isZero();
    assertThat(summary.activeMethod()).isEqualTo(EmbeddingMethod.FALLBACK);
    verify(embeddingGenerator).fit(textsCaptor.capture());
    assertThat(textsCaptor.getValue()).hasSize(2);
    verify(vectorStore).add(chunksCaptor.capture(), anyList());
    verify(vectorStore).save();

    Chunk msft = chunksCaptor.getValue().get(1);
    assertThat(msft.metadata().ticker()).isEqualTo("MSFT");
    assertThat(msft.metadata().filingType()).isEqualTo(FilingType.FORM_10Q);
    assertThat(msft.metadata().filingDate()).isEqualTo(LocalDate.of(2023, 7, 27));
    assertThat(msft.metadata().qualityScore()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("ingestion.chunks.accepted").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should skip malformed records with a warning each")
  void shouldSkipMalformedRecords() {
    ChunkIngestRequest badQuality = record("q1", "AAPL", "10-K", "2023-11-03");
    badQuality.setQualityScore(1.5);
    ChunkIngestRequest blankText = record("t1", "AAPL", "10-K", "2023-11-03");
    blankText.setText("  ");
    List<ChunkIngestRequest> records =
        Arrays.asList(
            record("ok", "AAPL", "10-K", "2023-11-03"),
            null,
            record(null, "AAPL", "10-K", "2023-11-03"),
            record("f1", "AAPL", "S-1", "2023-11-03"),
            record("d1", "AAPL", "10-K", "11/03/2023"),
            record("k1", " ", "10-K", "2023-11-03"),
            badQuality,
            blankText);

    IngestionSummary summary = ingestionService.ingest(records);

    assertThat(summary.accepted()).isEqualTo(1);
    assertThat(summary.skipped()).isEqualTo(7);
    assertThat(summary.warnings())
        .hasSize(7)
        .anyMatch(warning -> warning.contains("record is null"))
        .anyMatch(warning -> warning.contains("id is missing"))
        .anyMatch(warning -> warning.contains("unknown filing type 'S-1'"))
        .anyMatch(warning -> warning.contains("not an ISO date"))
        .anyMatch(warning -> warning.contains("ticker is missing"))
        .anyMatch(warning -> warning.contains("outside [0,1]"))
        .anyMatch(warning -> warning.contains("text is empty"));
    assertThat(meterRegistry.counter("ingestion.chunks.skipped").count()).isEqualTo(7.0);
  }

  @Test
  @DisplayName("Should skip duplicates within the batch and ids already stored")
  void shouldSkipDuplicates() {
    when(vectorStore.getChunk("old")).thenReturn(Optional.of(storedChunk()));

    IngestionSummary summary =
        ingestionService.ingest(
            List.of(
                record("a1", "AAPL", "10-K", "2023-11-03"),
                record(" a1 ", "AAPL", "10-K", "2023-11-03"),
                record("old", "AAPL", "10-K", "2023-11-03")));

    assertThat(summary.accepted()).isEqualTo(1);
    assertThat(summary.warnings())
        .containsExactly("#1 ( a1 ): duplicate id in batch", "#2 (old): already stored");
  }

  @Test
  @DisplayName("Should not touch the generator when nothing is valid")
  void shouldNotFitWithoutValidChunks() {
    IngestionSummary summary =
        ingestionService.ingest(List.of(record("x", "AAPL", "10-K", "not a date")));

    assertThat(summary.accepted()).isZero();
    verify(embeddingGenerator, never()).fit(anyList());
    verify(vectorStore, never()).add(anyList(), anyList());
    verify(vectorStore, never()).save();
  }

  @Test
  @DisplayName("Should keep the existing fit when the store already holds chunks")
  void shouldKeepExistingFit() {
    when(vectorStore.isEmpty()).thenReturn(false);
    when(embeddingGenerator.isReady()).thenReturn(true);

    ingestionService.ingest(List.of(record("a1", "AAPL", "10-K", "2023-11-03")));

    verify(embeddingGenerator, never()).fit(anyList());
    verify(vectorStore).add(anyList(), anyList());
  }

  @Test
  @DisplayName("Should refuse to embed into a non-empty store with an unfitted generator")
  void shouldRefuseUnfittedGeneratorForNonEmptyStore() {
    when(vectorStore.isEmpty()).thenReturn(false);
    when(vectorStore.size()).thenReturn(10);
    when(embeddingGenerator.isReady()).thenReturn(false);

    assertThatThrownBy(
            () -> ingestionService.ingest(List.of(record("a1", "AAPL", "10-K", "2023-11-03"))))
        .isInstanceOf(IngestionStateException.class);
    verify(vectorStore, never()).add(anyList(), anyList());
  }

  @Test
  @DisplayName("Should warn about chunks stored with a zero embedding")
  void shouldWarnOnZeroEmbeddings() {
    when(embeddingGenerator.embedBatch(anyList()))
        .thenReturn(List.of(EmbeddingVector.zero(2, EmbeddingMethod.FALLBACK)));

    IngestionSummary summary =
        ingestionService.ingest(List.of(record("a1", "AAPL", "10-K", "2023-11-03")));

    assertThat(summary.accepted()).isEqualTo(1);
    assertThat(summary.warnings()).containsExactly("chunk a1: embedding is the zero vector");
    verify(vectorStore).add(anyList(), any());
  }

  private static ChunkIngestRequest record(
      String id, String ticker, String filingType, String filingDate) {
    return ChunkIngestRequest.builder()
        .id(id)
        .text("Net sales increased due to higher iPhone and Services revenue.")
        .ticker(ticker)
        .filingType(filingType)
        .filingDate(filingDate)
        .sectionType("mda")
        .build();
  }

  private static Chunk storedChunk() {
    return new Chunk("old", "text", null);
  }

  private static EmbeddingVector unit() {
    return new EmbeddingVector(new float[] {1f, 0f}, EmbeddingMethod.FALLBACK);
  }
}
