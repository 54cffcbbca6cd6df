package com.flamingo.ai.filingqa.service.store;

import com.flamingo.ai.filingqa.domain.enums.EmbeddingMethod;
import com.flamingo.ai.filingqa.domain.model.Chunk;
import com.flamingo.ai.filingqa.service.embedding.FallbackEmbeddingModel;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full persisted state of the vector store. Written and replaced as a whole.
 *
 * @param collectionName logical collection the snapshot belongs to
 * @param chunks stored chunks in insertion order
 * @param embeddings vector values by chunk id
 * @param metadataIndex serialized {@link MetadataIndex}
 * @param activeMethod method of every stored embedding; null for an empty store
 * @param fallbackModel fitted fallback state when {@code activeMethod} is FALLBACK
 * @param createdAt when the snapshot was written
 */
public record VectorStoreSnapshot(
    String collectionName,
    List<Chunk> chunks,
    Map<String, float[]> embeddings,
    Map<String, Map<String, Set<String>>> metadataIndex,
    EmbeddingMethod activeMethod,
    FallbackEmbeddingModel fallbackModel,
    Instant createdAt) {}
