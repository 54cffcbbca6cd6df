package com.flamingo.ai.filingqa.service.store;

import com.flamingo.ai.filingqa.config.RagConfig;
import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.domain.model.Chunk;
import com.flamingo.ai.filingqa.domain.model.ChunkMetadata;
import com.flamingo.ai.filingqa.domain.model.EmbeddingVector;
import com.flamingo.ai.filingqa.domain.model.SearchOutcome;
import com.flamingo.ai.filingqa.domain.model.SearchResult;
import com.flamingo.ai.filingqa.exception.IngestionStateException;
import com.flamingo.ai.filingqa.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.filingqa.service.embedding.FallbackEmbeddingModel;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * In-memory corpus of embedded chunks with a metadata index, hybrid scoring and snapshot
 * persistence.
 *
 * <p>The state is loaded lazily from the snapshot on first access and published as an immutable
 * value through a volatile field. Searches read whichever state is current without locking;
 * {@link #add}, {@link #save} and {@link #clear} are serialized on a write lock and are expected
 * to run in a separate ingestion phase.
 *
 * <p>All stored embeddings share one {@link EmbeddingMethod}, fixed by the first add or by the
 * loaded snapshot. The matching {@link ScoringProfile} is chosen at the same moment.
 */
@Service
@Slf4j
public class VectorStore {

  private final EmbeddingGenerator embeddingGenerator;
  private final VectorStorePersistence persistence;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final KeywordScorer keywordScorer = new KeywordScorer();
  private final Object writeLock = new Object();

  private volatile State state;

  /** Chunk with its embedding and precomputed keyword tokens. */
  private record StoredChunk(
      Chunk chunk, EmbeddingVector embedding, Set<String> tokens, String lowerCaseText) {}

  /** Immutable published state. {@code activeMethod} and {@code profile} are null when empty. */
  private record State(
      List<StoredChunk> chunks,
      Map<String, StoredChunk> byId,
      MetadataIndex index,
      EmbeddingMethod activeMethod,
      ScoringProfile profile) {

    static State empty() {
      return new State(List.of(), Map.of(), new MetadataIndex(), null, null);
    }
  }

  public VectorStore(
      EmbeddingGenerator embeddingGenerator,
      VectorStorePersistence persistence,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.embeddingGenerator = embeddingGenerator;
    this.persistence = persistence;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    // Fail fast on a misconfigured adaptation direction.
    ScoringProfile.forMethod(EmbeddingMethod.PRIMARY, ragConfig.getScoring());
  }

  /**
   * Appends chunks with their embeddings. Chunk ids already stored are skipped with a warning.
   *
   * @return number of chunks stored
   * @throws IllegalArgumentException when the list sizes differ
   * @throws IngestionStateException when an embedding's method differs from the active method or
   *     its dimensionality is wrong
   */
  public int add(List<Chunk> chunks, List<EmbeddingVector> embeddings) {
    if (chunks.size() != embeddings.size()) {
      throw new IllegalArgumentException(
          "Got " + chunks.size() + " chunks but " + embeddings.size() + " embeddings");
    }
    if (chunks.isEmpty()) {
      return 0;
    }

    synchronized (writeLock) {
      State current = state();
      EmbeddingMethod method =
          current.activeMethod() != null ? current.activeMethod() : embeddings.get(0).method();
      int dimensions = embeddingGenerator.getDimensions();
      for (EmbeddingVector embedding : embeddings) {
        if (embedding.method() != method) {
          throw new IngestionStateException(
              "Cannot mix " + embedding.method() + " embeddings into a " + method + " store");
        }
        if (embedding.dimensions() != dimensions) {
          throw new IngestionStateException(
              "Embedding has " + embedding.dimensions() + " dimensions, expected " + dimensions);
        }
      }

      List<StoredChunk> stored = new ArrayList<>(current.chunks());
      Map<String, StoredChunk> byId = new LinkedHashMap<>(current.byId());
      MetadataIndex index = current.index().copy();
      int added = 0;
      for (int i = 0; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        if (byId.containsKey(chunk.id())) {
          log.warn("Chunk {} already stored, skipping", chunk.id());
          continue;
        }
        StoredChunk entry = toStored(chunk, embeddings.get(i));
        stored.add(entry);
        byId.put(chunk.id(), entry);
        index.add(chunk.id(), chunk.metadata().indexFields());
        added++;
      }

      ScoringProfile profile =
          current.profile() != null
              ? current.profile()
              : ScoringProfile.forMethod(method, ragConfig.getScoring());
      if (current.activeMethod() == null) {
        log.info(
            "Vector store active method set to {} (semantic={}, keyword={}, minScore={})",
            method,
            profile.semanticWeight(),
            profile.keywordWeight(),
            profile.minScore());
      }
      state = new State(List.copyOf(stored), Map.copyOf(byId), index, method, profile);
      meterRegistry.counter("store.chunks.added").increment(added);
      log.info("Added {} chunks, store now holds {}", added, stored.size());
      return added;
    }
  }

  /**
   * Hybrid search over the corpus.
   *
   * @param queryVector query embedding; a zero vector or one of another method disables the
   *     semantic signal and flags the outcome as degraded
   * @param queryText raw query used for keyword scoring
   * @param filters exact-match metadata filters applied before scoring; null or empty for none
   * @param topK maximum number of results
   */
  @Timed(value = "store.search", description = "Time for hybrid vector store search")
  public SearchOutcome search(
      EmbeddingVector queryVector, String queryText, Map<String, String> filters, int topK) {
    return search(queryVector, queryText, filters, topK, 0.0);
  }

  /**
   * Hybrid search with extra weight on the keyword signal.
   *
   * @param keywordBoost added to the active profile's keyword weight before renormalising; 0 for
   *     the plain profile
   */
  @Timed(value = "store.search", description = "Time for hybrid vector store search")
  public SearchOutcome search(
      EmbeddingVector queryVector,
      String queryText,
      Map<String, String> filters,
      int topK,
      double keywordBoost) {
    State current = state();
    if (current.chunks().isEmpty()) {
      log.debug("Search on empty corpus");
      meterRegistry.counter("store.search.no_data").increment();
      return SearchOutcome.noData();
    }

    Collection<StoredChunk> candidates = candidates(current, filters);
    if (candidates.isEmpty()) {
      log.debug("No candidates for filters {}", filters);
      return SearchOutcome.noMatches();
    }

    boolean semanticUsable = isSemanticUsable(current, queryVector);
    List<String> keywords = keywordScorer.extractKeywords(queryText);
    ScoringProfile profile = current.profile().withKeywordBoost(keywordBoost);

    List<SearchResult> results = new ArrayList<>();
    for (StoredChunk candidate : candidates) {
      double semantic =
          semanticUsable ? clamp(queryVector.dot(candidate.embedding())) : 0.0;
      double keyword =
          keywordScorer.score(keywords, candidate.tokens(), candidate.lowerCaseText());
      double combined = profile.combine(semantic, keyword);
      if (profile.passes(combined)) {
        results.add(toResult(candidate.chunk(), combined, semantic, keyword));
      }
    }
    results.sort(SearchResult.RANKING);
    List<SearchResult> top = results.size() > topK ? results.subList(0, topK) : results;

    log.debug(
        "Search filters={} candidates={} aboveCutoff={} returned={} semantic={}",
        filters,
        candidates.size(),
        results.size(),
        top.size(),
        semanticUsable);
    meterRegistry.counter("store.search.success").increment();
    return SearchOutcome.of(top, !semanticUsable);
  }

  /**
   * Lists chunks matching metadata filters without scoring, in insertion order.
   *
   * @return results with all scores set to 1.0
   */
  public List<SearchResult> searchByMetadata(Map<String, String> filters, int limit) {
    return candidates(state(), filters).stream()
        .limit(limit)
        .map(stored -> toResult(stored.chunk(), 1.0, 1.0, 1.0))
        .toList();
  }

  /**
   * Finds the chunks whose embeddings are closest to a stored chunk's embedding.
   *
   * @return neighbours ranked by semantic score, excluding the chunk itself; empty when the chunk
   *     is unknown or its embedding is zero
   */
  public List<SearchResult> findSimilar(String chunkId, int limit) {
    State current = state();
    StoredChunk target = current.byId().get(chunkId);
    if (target == null || target.embedding().isZero()) {
      return List.of();
    }
    return current.chunks().stream()
        .filter(stored -> !stored.chunk().id().equals(chunkId))
        .filter(stored -> !stored.embedding().isZero())
        .map(
            stored -> {
              double semantic = clamp(target.embedding().dot(stored.embedding()));
              return toResult(stored.chunk(), semantic, semantic, 0.0);
            })
        .sorted(SearchResult.RANKING)
        .limit(limit)
        .toList();
  }

  public Optional<Chunk> getChunk(String chunkId) {
    return Optional.ofNullable(state().byId().get(chunkId)).map(StoredChunk::chunk);
  }

  /** Stored chunks in insertion order. */
  public List<Chunk> getChunks() {
    return state().chunks().stream().map(StoredChunk::chunk).toList();
  }

  public Optional<EmbeddingVector> getEmbedding(String chunkId) {
    return Optional.ofNullable(state().byId().get(chunkId)).map(StoredChunk::embedding);
  }

  /** Copy of the current metadata index. */
  public MetadataIndex getMetadataIndex() {
    return state().index().copy();
  }

  /** Method of the stored embeddings, empty until the first add or load of a non-empty store. */
  public Optional<EmbeddingMethod> getActiveMethod() {
    return Optional.ofNullable(state().activeMethod());
  }

  public int size() {
    return state().chunks().size();
  }

  public boolean isEmpty() {
    return state().chunks().isEmpty();
  }

  public StoreStats stats() {
    State current = state();
    List<Chunk> chunks = current.chunks().stream().map(StoredChunk::chunk).toList();
    Set<String> tickers = new TreeSet<>();
    Set<String> filingTypes = new TreeSet<>();
    Set<String> sectors = new TreeSet<>();
    LocalDate earliest = null;
    LocalDate latest = null;
    long words = 0;
    for (Chunk chunk : chunks) {
      ChunkMetadata metadata = chunk.metadata();
      tickers.add(metadata.ticker());
      filingTypes.add(metadata.filingType().getCode());
      if (metadata.sector() != null) {
        sectors.add(metadata.sector());
      }
      LocalDate date = metadata.filingDate();
      earliest = earliest == null || date.isBefore(earliest) ? date : earliest;
      latest = latest == null || date.isAfter(latest) ? date : latest;
      words += chunk.text().isBlank() ? 0 : chunk.text().trim().split("\\s+").length;
    }
    return StoreStats.builder()
        .totalChunks(chunks.size())
        .tickers(List.copyOf(tickers))
        .filingTypes(List.copyOf(filingTypes))
        .sectors(List.copyOf(sectors))
        .earliestFilingDate(earliest)
        .latestFilingDate(latest)
        .activeMethod(current.activeMethod())
        .embeddingsAvailable(
            current.chunks().stream().filter(stored -> !stored.embedding().isZero()).count())
        .averageWordsPerChunk(chunks.isEmpty() ? 0.0 : (double) words / chunks.size())
        .build();
  }

  /**
   * Writes the full state snapshot atomically, including the fitted fallback model when the
   * store runs on fallback embeddings.
   */
  public void save() {
    synchronized (writeLock) {
      State current = state();
      Map<String, float[]> embeddings = new LinkedHashMap<>();
      current
          .chunks()
          .forEach(stored -> embeddings.put(stored.chunk().id(), stored.embedding().values()));
      FallbackEmbeddingModel fallbackModel =
          current.activeMethod() == EmbeddingMethod.FALLBACK
              ? embeddingGenerator.getFallbackModel().orElse(null)
              : null;
      VectorStoreSnapshot snapshot =
          new VectorStoreSnapshot(
              ragConfig.getStore().getCollectionName(),
              current.chunks().stream().map(StoredChunk::chunk).toList(),
              embeddings,
              current.index().asMap(),
              current.activeMethod(),
              fallbackModel,
              Instant.now());
      persistence.write(snapshotPath(), snapshot);
    }
  }

  /** Drops every chunk and deletes the snapshot. */
  public void clear() {
    synchronized (writeLock) {
      persistence.delete(snapshotPath());
      state = State.empty();
      log.info("Cleared collection {}", ragConfig.getStore().getCollectionName());
    }
  }

  Path snapshotPath() {
    RagConfig.Store store = ragConfig.getStore();
    return Path.of(store.getPath()).resolve(store.getCollectionName() + ".json");
  }

  private State state() {
    State current = state;
    if (current == null) {
      synchronized (writeLock) {
        current = state;
        if (current == null) {
          current = load();
          state = current;
        }
      }
    }
    return current;
  }

  private State load() {
    Path path = snapshotPath();
    Optional<VectorStoreSnapshot> loaded = persistence.read(path);
    if (loaded.isEmpty()) {
      log.info("No snapshot at {}, starting with an empty store", path);
      return State.empty();
    }
    VectorStoreSnapshot snapshot = loaded.get();
    if (snapshot.chunks() == null || snapshot.chunks().isEmpty()) {
      log.info("Snapshot at {} is empty", path);
      return State.empty();
    }
    EmbeddingMethod method = snapshot.activeMethod();
    checkCompatible(snapshot);

    int dimensions = embeddingGenerator.getDimensions();
    List<StoredChunk> stored = new ArrayList<>(snapshot.chunks().size());
    Map<String, StoredChunk> byId = new LinkedHashMap<>();
    for (Chunk chunk : snapshot.chunks()) {
      float[] values = snapshot.embeddings().get(chunk.id());
      if (values == null || values.length != dimensions) {
        throw new IngestionStateException(
            "Snapshot embedding for chunk " + chunk.id() + " is missing or has wrong size");
      }
      StoredChunk entry = toStored(chunk, new EmbeddingVector(values, method));
      stored.add(entry);
      byId.put(chunk.id(), entry);
    }

    MetadataIndex index = MetadataIndex.fromMap(snapshot.metadataIndex());
    if (!index.allChunkIds().equals(byId.keySet())) {
      throw new IngestionStateException("Snapshot metadata index does not match its chunks");
    }

    log.info(
        "Loaded {} chunks ({} embeddings) from {} written at {}",
        stored.size(),
        method,
        path,
        snapshot.createdAt());
    return new State(
        List.copyOf(stored),
        Map.copyOf(byId),
        index,
        method,
        ScoringProfile.forMethod(method, ragConfig.getScoring()));
  }

  private void checkCompatible(VectorStoreSnapshot snapshot) {
    EmbeddingMethod method = snapshot.activeMethod();
    if (method == null) {
      throw new IngestionStateException("Snapshot has chunks but no active embedding method");
    }
    if (method != embeddingGenerator.getActiveMethod()) {
      throw new IngestionStateException(
          "Snapshot was built with "
              + method
              + " embeddings but the generator is using "
              + embeddingGenerator.getActiveMethod());
    }
    if (method != EmbeddingMethod.FALLBACK) {
      return;
    }
    FallbackEmbeddingModel persisted = snapshot.fallbackModel();
    if (persisted == null) {
      throw new IngestionStateException("Fallback snapshot is missing its fitted model");
    }
    Optional<FallbackEmbeddingModel> fitted = embeddingGenerator.getFallbackModel();
    if (fitted.isPresent()) {
      if (!fitted.get().getFingerprint().equals(persisted.getFingerprint())) {
        throw new IngestionStateException(
            "Snapshot fallback model differs from the generator's fitted model");
      }
      return;
    }
    try {
      embeddingGenerator.restoreFallbackModel(persisted);
    } catch (IllegalStateException e) {
      throw new IngestionStateException("Cannot restore fallback model from snapshot", e);
    }
  }

  private boolean isSemanticUsable(State current, EmbeddingVector queryVector) {
    if (queryVector == null || queryVector.isZero()) {
      log.debug("Zero query vector, semantic scoring skipped");
      return false;
    }
    if (queryVector.method() != current.activeMethod()) {
      log.warn(
          "Query embedding method {} does not match store method {}, semantic scoring skipped",
          queryVector.method(),
          current.activeMethod());
      return false;
    }
    if (queryVector.dimensions() != embeddingGenerator.getDimensions()) {
      log.warn("Query embedding has {} dimensions, semantic scoring skipped",
          queryVector.dimensions());
      return false;
    }
    return true;
  }

  private Collection<StoredChunk> candidates(State current, Map<String, String> filters) {
    if (filters == null || filters.isEmpty()) {
      return current.chunks();
    }
    Set<String> ids = current.index().candidates(filters);
    if (ids.isEmpty()) {
      return List.of();
    }
    return current.chunks().stream().filter(stored -> ids.contains(stored.chunk().id())).toList();
  }

  private StoredChunk toStored(Chunk chunk, EmbeddingVector embedding) {
    return new StoredChunk(
        chunk,
        embedding,
        keywordScorer.tokenize(chunk.text()),
        chunk.text().toLowerCase(Locale.ROOT));
  }

  private static SearchResult toResult(
      Chunk chunk, double combined, double semantic, double keyword) {
    return new SearchResult(
        chunk.id(), chunk.text(), chunk.metadata(), combined, semantic, keyword);
  }

  private static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }
}
