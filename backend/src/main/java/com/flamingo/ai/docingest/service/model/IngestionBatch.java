package com.flamingo.ai.docingest.service.model;

import java.util.List;

/**
 * Everything derived from one ingestion request, ready for the external embedding and storage
 * steps.
 *
 * @param collectionName vector collection for prose chunks, derived from the root URL
 * @param codeCollectionName vector collection for code snippets
 * @param proseChunks prose chunks of all pages, page by page in document order
 * @param codeSnippets code snippets of all pages, page by page in document order
 * @param pagesProcessed number of pages in the request
 * @param contextualTitlesUsed whether code snippets carry generated titles
 */
public record IngestionBatch(
    String collectionName,
    String codeCollectionName,
    List<ProseChunk> proseChunks,
    List<CodeSnippet> codeSnippets,
    int pagesProcessed,
    boolean contextualTitlesUsed) {}
