package com.flamingo.ai.docingest.service.chunking;

import com.flamingo.ai.docingest.config.IngestConfig;
import com.flamingo.ai.docingest.service.model.MarkdownSection;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that produces chunks aligned to Markdown header boundaries.
 *
 * <p>Two phases: {@link SectionSplitter} partitions the text at ATX headers (ignoring header-like
 * lines inside fenced code), then every section is passed through {@link BoundedSplitter}. Sections
 * that fit within the chunk size come back unchanged; oversized ones are cut at the best available
 * boundary and continuation chunks carry the section header.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SectionAwareChunker implements DocumentChunker {

  private final SectionSplitter sectionSplitter;
  private final BoundedSplitter boundedSplitter;
  private final IngestConfig ingestConfig;

  @Override
  @Timed(value = "ingest.chunk", description = "Time to chunk a Markdown document")
  public List<String> chunk(String markdown, int chunkSize) {
    List<MarkdownSection> sections = sectionSplitter.split(markdown);
    List<String> chunks = new ArrayList<>();

    for (MarkdownSection section : sections) {
      chunks.addAll(boundedSplitter.bound(section.text(), section.header(), chunkSize));
    }

    long oversized = chunks.stream().filter(c -> CodePoints.length(c) > chunkSize).count();
    if (oversized > 0) {
      log.debug(
          "{} chunks exceed chunk size {} (header prefix or atomic content)", oversized, chunkSize);
    }
    log.debug(
        "SectionAwareChunker produced {} chunks from {} sections", chunks.size(), sections.size());
    return chunks;
  }

  @Override
  @Timed(value = "ingest.chunk", description = "Time to chunk a Markdown document")
  public List<String> chunk(String markdown) {
    return chunk(markdown, ingestConfig.getChunking().getSize());
  }
}
