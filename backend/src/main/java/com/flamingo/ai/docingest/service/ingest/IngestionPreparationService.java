package com.flamingo.ai.docingest.service.ingest;

import com.flamingo.ai.docingest.exception.DocumentProcessingException;
import com.flamingo.ai.docingest.service.chunking.DocumentChunker;
import com.flamingo.ai.docingest.service.extraction.CodeBlockExtractor;
import com.flamingo.ai.docingest.service.model.CodeBlock;
import com.flamingo.ai.docingest.service.model.CodeSnippet;
import com.flamingo.ai.docingest.service.model.IngestionBatch;
import com.flamingo.ai.docingest.service.model.PageContent;
import com.flamingo.ai.docingest.service.model.ProseChunk;
import com.flamingo.ai.docingest.service.title.CodeExampleTitleService;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns crawled pages into prose chunks and code snippets for the external embedding and storage
 * steps.
 *
 * <p>Every page goes through two independent passes over its Markdown: {@link DocumentChunker} for
 * prose and {@link CodeBlockExtractor} for fenced code. Chunk and code indices restart at zero for
 * each page. When contextual titles are requested, each snippet's embedding payload is prefixed
 * with a generated title while the raw code is kept alongside for exact retrieval.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionPreparationService {

  private final DocumentChunker documentChunker;
  private final CodeBlockExtractor codeBlockExtractor;
  private final Optional<CodeExampleTitleService> codeExampleTitleService;

  /**
   * Prepares a batch of pages crawled from one root URL.
   *
   * @param rootUrl the URL the crawl started from; names the target collections
   * @param pages crawled pages in crawl order
   * @param contextualTitles whether to generate a title for every code snippet
   * @return the prepared batch
   * @throws DocumentProcessingException if there are no pages or no page yields any prose chunk
   * @throws IllegalStateException if titles are requested but no title service is configured
   */
  @Timed(value = "ingest.prepare", description = "Time to prepare pages for indexing")
  public IngestionBatch prepare(String rootUrl, List<PageContent> pages, boolean contextualTitles) {
    if (pages == null || pages.isEmpty()) {
      throw new DocumentProcessingException(rootUrl, "No pages were successfully crawled.");
    }
    CodeExampleTitleService titleService = null;
    if (contextualTitles) {
      titleService =
          codeExampleTitleService.orElseThrow(
              () ->
                  new IllegalStateException(
                      "Contextual code titles requested but ingest.code-titles.enabled is false"));
    }

    List<ProseChunk> proseChunks = new ArrayList<>();
    List<CodeSnippet> codeSnippets = new ArrayList<>();

    for (PageContent page : pages) {
      List<String> chunks = documentChunker.chunk(page.markdown());
      for (int i = 0; i < chunks.size(); i++) {
        proseChunks.add(new ProseChunk(chunks.get(i), page.url(), page.title(), i));
      }

      List<CodeBlock> blocks = codeBlockExtractor.extract(page.markdown());
      for (int i = 0; i < blocks.size(); i++) {
        CodeBlock block = blocks.get(i);
        String embeddingText =
            titleService == null
                ? EmbeddingTexts.codeSnippet(block.code())
                : EmbeddingTexts.titledCodeSnippet(
                    titleService.generateTitle(
                        block.code(), block.contextBefore(), block.contextAfter()),
                    block.code());
        codeSnippets.add(
            new CodeSnippet(
                embeddingText, page.url(), page.title(), i, block.language(), block.code()));
      }

      log.debug(
          "Page {}: {} prose chunks, {} code snippets", page.url(), chunks.size(), blocks.size());
    }

    if (proseChunks.isEmpty()) {
      throw new DocumentProcessingException(
          rootUrl, "No text extracted to chunk from any page.", "No text could be extracted");
    }

    String collectionName = CollectionNames.forUrl(rootUrl);
    log.info(
        "Prepared {} prose chunks and {} code snippets from {} pages for collection '{}'",
        proseChunks.size(),
        codeSnippets.size(),
        pages.size(),
        collectionName);

    return new IngestionBatch(
        collectionName,
        CollectionNames.codeCollection(collectionName),
        proseChunks,
        codeSnippets,
        pages.size(),
        contextualTitles);
  }
}
