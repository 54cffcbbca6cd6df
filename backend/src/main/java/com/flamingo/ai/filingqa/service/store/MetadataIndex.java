package com.flamingo.ai.filingqa.service.store;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Inverted index {@code field -> value -> chunk ids} used for exact-match filtering before
 * scoring.
 *
 * <p>Not thread-safe. The vector store mutates a private copy during ingestion and publishes it
 * for read-only use.
 */
public final class MetadataIndex {

  private final Map<String, Map<String, Set<String>>> entries;

  public MetadataIndex() {
    this.entries = new TreeMap<>();
  }

  /** Rebuilds an index from its serialized form. */
  public static MetadataIndex fromMap(Map<String, Map<String, Set<String>>> source) {
    MetadataIndex index = new MetadataIndex();
    source.forEach(
        (field, values) ->
            values.forEach(
                (value, ids) ->
                    index
                        .entries
                        .computeIfAbsent(field, f -> new TreeMap<>())
                        .computeIfAbsent(value, v -> new TreeSet<>())
                        .addAll(ids)));
    return index;
  }

  public MetadataIndex copy() {
    return fromMap(entries);
  }

  /** Records a chunk under each of its field values. */
  public void add(String chunkId, Map<String, String> fields) {
    fields.forEach(
        (field, value) ->
            entries
                .computeIfAbsent(field, f -> new TreeMap<>())
                .computeIfAbsent(value, v -> new TreeSet<>())
                .add(chunkId));
  }

  /**
   * Returns the ids matching every filter, by intersecting the per-field id sets smallest first.
   * An unknown field or value yields an empty set.
   *
   * @param filters exact-match {@code field -> value} pairs; must not be empty
   */
  public Set<String> candidates(Map<String, String> filters) {
    if (filters.isEmpty()) {
      throw new IllegalArgumentException("At least one filter is required");
    }
    List<Set<String>> matches =
        filters.entrySet().stream()
            .map(
                filter ->
                    entries
                        .getOrDefault(filter.getKey(), Map.of())
                        .getOrDefault(filter.getValue(), Set.of()))
            .sorted(Comparator.comparingInt(Set::size))
            .toList();

    Set<String> result = new TreeSet<>(matches.get(0));
    for (int i = 1; i < matches.size() && !result.isEmpty(); i++) {
      result.retainAll(matches.get(i));
    }
    return result;
  }

  /** Distinct values recorded for a field, sorted. */
  public Set<String> values(String field) {
    return Collections.unmodifiableSet(entries.getOrDefault(field, Map.of()).keySet());
  }

  /** Every chunk id present anywhere in the index. */
  public Set<String> allChunkIds() {
    Set<String> ids = new TreeSet<>();
    entries.values().forEach(values -> values.values().forEach(ids::addAll));
    return ids;
  }

  /** Read-only view for serialization and equality checks. */
  public Map<String, Map<String, Set<String>>> asMap() {
    return Collections.unmodifiableMap(entries);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof MetadataIndex other && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }
}
