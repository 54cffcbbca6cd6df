package com.flamingo.ai.filingqa.domain.model;

/**
 * A bounded, independently retrievable unit of filing text. Immutable once created.
 *
 * @param id unique chunk identifier assigned by the document processor
 * @param text chunk content
 * @param metadata filing metadata used for filtering and citations
 */
public record Chunk(String id, String text, ChunkMetadata metadata) {}
