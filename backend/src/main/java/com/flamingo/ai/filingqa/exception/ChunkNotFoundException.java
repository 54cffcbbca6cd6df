package com.flamingo.ai.filingqa.exception;

/** Exception thrown when a chunk id is not present in the vector store. */
public class ChunkNotFoundException extends RuntimeException {

  private final String chunkId;

  public ChunkNotFoundException(String chunkId) {
    super("Chunk not found: " + chunkId);
    this.chunkId = chunkId;
  }

  public String getChunkId() {
    return chunkId;
  }
}
