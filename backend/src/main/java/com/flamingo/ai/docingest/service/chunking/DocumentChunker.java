package com.flamingo.ai.docingest.service.chunking;

import java.util.List;

/**
 * Splits Markdown text into bounded chunks ready for embedding.
 *
 * <p>Implementations must be stateless and safe for concurrent use. A chunker only chunks: it
 * does not fetch, embed or store.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the Markdown text.
   *
   * @param markdown the document text; null or empty yields an empty list
   * @param chunkSize target maximum characters per chunk
   * @return ordered list of chunks in document order
   */
  List<String> chunk(String markdown, int chunkSize);

  /** Same as {@link #chunk(String, int)} using the configured default chunk size. */
  List<String> chunk(String markdown);
}
