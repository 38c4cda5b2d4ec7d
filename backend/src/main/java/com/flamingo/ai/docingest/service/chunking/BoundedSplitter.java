package com.flamingo.ai.docingest.service.chunking;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Divides an oversized section into chunks of at most {@code chunkSize} characters.
 *
 * <p>Each iteration looks at a window of {@code budget} characters from the cursor and asks the
 * {@link BoundaryRule#CASCADE} for a cut point (fence, paragraph, sentence, line, space). When no
 * rule clears its threshold the window is hard cut at the budget boundary.
 *
 * <p>The owning header is re-injected in a separate pass: every chunk after the first that does
 * not already start with the header gets {@code header + "\n"} prepended. The budget reserves room
 * for that prefix; if the header alone would exhaust it, the raw chunk size is used instead and the
 * resulting chunks may exceed {@code chunkSize} by the header length.
 *
 * <p>All sizes are character counts (code points); cut offsets never split a surrogate pair.
 */
@Component
@Slf4j
public class BoundedSplitter {

  /**
   * Splits one section.
   *
   * @param sectionText the trimmed section text
   * @param header the owning header line, or an empty string
   * @param chunkSize target maximum characters per chunk
   * @return ordered, non-empty chunks
   */
  public List<String> bound(String sectionText, String header, int chunkSize) {
    int sectionChars = CodePoints.length(sectionText);
    if (sectionChars <= chunkSize) {
      return List.of(sectionText);
    }
    String owningHeader = header == null ? "" : header;
    int budget = bodyBudget(owningHeader, chunkSize);
    List<String> pieces = cut(sectionText, budget);
    log.debug(
        "Section of {} chars split into {} pieces (budget {}, header '{}')",
        sectionChars,
        pieces.size(),
        budget,
        owningHeader);
    return reinjectHeader(pieces, owningHeader);
  }

  /**
   * Per-chunk body budget after reserving room for an injected header and its newline.
   *
   * @return the budget, never less than 1
   */
  int bodyBudget(String header, int chunkSize) {
    int headerChars = CodePoints.length(header);
    int budget = header.isEmpty() ? chunkSize : chunkSize - headerChars - 1;
    if (budget <= 0) {
      log.warn(
          "Header of {} chars leaves no body budget within chunk size {}, using raw chunk size",
          headerChars,
          chunkSize);
      budget = chunkSize;
    }
    return Math.max(1, budget);
  }

  List<String> cut(String text, int budget) {
    List<Integer> fences = FenceScanner.delimiterPositions(text);
    List<String> pieces = new ArrayList<>();
    int start = 0;

    while (start < text.length()) {
      int windowEnd = CodePoints.advance(text, start, budget);
      if (windowEnd == text.length()) {
        addIfNotBlank(pieces, text.substring(start));
        break;
      }

      String window = text.substring(start, windowEnd);
      int end = start + findCut(window, budget, openingFenceOffsets(fences, start, windowEnd));
      addIfNotBlank(pieces, text.substring(start, end));
      start = end;
    }
    return pieces;
  }

  /**
   * Applies the cascade to a single window of {@code budget} characters.
   *
   * @return the accepted cut offset in UTF-16 units, or the window length for a hard cut
   */
  int findCut(String window, int budget, List<Integer> openingFenceOffsets) {
    for (BoundaryRule rule : BoundaryRule.CASCADE) {
      int cut = rule.findCut(window, budget, openingFenceOffsets);
      if (cut != -1) {
        return cut;
      }
    }
    log.debug("No boundary cleared its threshold, hard cut at {} chars", budget);
    return window.length();
  }

  /** Header re-injection pass over the pieces produced by {@link #cut}. */
  List<String> reinjectHeader(List<String> pieces, String header) {
    if (header.isEmpty()) {
      return pieces;
    }
    List<String> chunks = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      String piece = pieces.get(i);
      if (i > 0 && !piece.startsWith(header)) {
        chunks.add(header + "\n" + piece);
      } else {
        chunks.add(piece);
      }
    }
    return chunks;
  }

  // Delimiters at even positions in the section open a fenced block.
  private List<Integer> openingFenceOffsets(List<Integer> fences, int start, int windowEnd) {
    List<Integer> offsets = new ArrayList<>();
    for (int i = 0; i < fences.size(); i += 2) {
      int pos = fences.get(i);
      if (pos >= windowEnd) {
        break;
      }
      if (pos >= start) {
        offsets.add(pos - start);
      }
    }
    return offsets;
  }

  private void addIfNotBlank(List<String> pieces, String raw) {
    String piece = raw.strip();
    if (!piece.isEmpty()) {
      pieces.add(piece);
    }
  }
}
