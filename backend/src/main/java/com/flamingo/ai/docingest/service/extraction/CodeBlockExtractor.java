package com.flamingo.ai.docingest.service.extraction;

import com.flamingo.ai.docingest.config.IngestConfig;
import com.flamingo.ai.docingest.service.chunking.CodePoints;
import com.flamingo.ai.docingest.service.chunking.FenceScanner;
import com.flamingo.ai.docingest.service.model.CodeBlock;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts fenced code blocks, with surrounding prose, from raw Markdown.
 *
 * <p>Delimiters are paired by position: the 1st and 2nd {@code ```} form the first block, the 3rd
 * and 4th the second, and so on. An unpaired trailing delimiter is ignored. Pairing is purely
 * positional, so a triple backtick inside a block body shifts every later pair; malformed fencing
 * never raises.
 *
 * <p>Lengths and context sizes count characters (code points), not UTF-16 units.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CodeBlockExtractor {

  private final IngestConfig ingestConfig;

  /** Extracts blocks using the configured minimum code length. */
  @Timed(value = "ingest.extract_code", description = "Time to extract code blocks")
  public List<CodeBlock> extract(String markdown) {
    return extract(markdown, ingestConfig.getCodeExtraction().getMinLength());
  }

  /**
   * Extracts every fenced block whose code body has at least {@code minLength} characters.
   *
   * @param markdown the raw document
   * @param minLength minimum trimmed code length; shorter blocks are dropped with their context
   * @return blocks in document order
   */
  @Timed(value = "ingest.extract_code", description = "Time to extract code blocks")
  public List<CodeBlock> extract(String markdown, int minLength) {
    if (markdown == null || markdown.isEmpty()) {
      return List.of();
    }

    List<Integer> positions = FenceScanner.delimiterPositions(markdown);
    if (positions.size() % 2 != 0) {
      log.debug(
          "Ignoring unpaired trailing fence at offset {}", positions.get(positions.size() - 1));
    }

    int contextChars = ingestConfig.getCodeExtraction().getContextChars();
    int fenceLength = FenceScanner.FENCE.length();
    List<CodeBlock> blocks = new ArrayList<>();
    int skipped = 0;

    for (int i = 0; i + 1 < positions.size(); i += 2) {
      int open = positions.get(i);
      int close = positions.get(i + 1);
      String region = markdown.substring(open + fenceLength, close);

      String language = "";
      String code = region.strip();
      int newline = region.indexOf('\n');
      if (newline != -1) {
        String firstLine = region.substring(0, newline).strip();
        if (isLanguageTag(firstLine)) {
          language = firstLine;
          code = region.substring(newline + 1).strip();
        }
      }

      if (CodePoints.length(code) < minLength) {
        skipped++;
        continue;
      }

      int beforeStart = CodePoints.retreat(markdown, open, contextChars);
      String contextBefore = markdown.substring(beforeStart, open).strip();
      int afterStart = close + fenceLength;
      int afterEnd = CodePoints.advance(markdown, afterStart, contextChars);
      String contextAfter = markdown.substring(afterStart, afterEnd).strip();
      blocks.add(new CodeBlock(code, language, contextBefore, contextAfter));
    }

    log.debug(
        "Extracted {} code blocks ({} below min length {})", blocks.size(), skipped, minLength);
    return blocks;
  }

  private boolean isLanguageTag(String firstLine) {
    int maxLength = ingestConfig.getCodeExtraction().getMaxLanguageTagLength();
    return !firstLine.isEmpty()
        && firstLine.indexOf(' ') == -1
        && CodePoints.length(firstLine) < maxLength;
  }
}
