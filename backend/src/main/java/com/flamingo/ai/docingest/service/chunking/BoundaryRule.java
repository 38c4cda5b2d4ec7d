package com.flamingo.ai.docingest.service.chunking;

import java.util.List;

/**
 * One step of the cut-point cascade used by {@link BoundedSplitter}.
 *
 * <p>Rules are evaluated in declaration order. Each rule looks for its last match inside the
 * provisional window and accepts it only when the number of characters before the match is
 * strictly greater than {@code minFraction * budget}. The first accepted rule decides the cut.
 * Delimiters are ASCII, so a cut never lands inside a surrogate pair.
 */
public enum BoundaryRule {

  /**
   * Cuts immediately before the last opening fence delimiter so the whole fenced block moves to
   * the next chunk. Closing delimiters are never cut points.
   */
  FENCE(FenceScanner.FENCE, 0.3, 0) {
    // Unlike a plain lastIndexOf("```"), a closing delimiter never qualifies: cutting there would
    // leave the block's opening half in one chunk and its closing fence in the next.
    @Override
    int lastMatch(String window, List<Integer> openingFenceOffsets) {
      for (int i = openingFenceOffsets.size() - 1; i >= 0; i--) {
        int offset = openingFenceOffsets.get(i);
        if (offset + delimiter().length() <= window.length()) {
          return offset;
        }
      }
      return -1;
    }
  },

  /** Blank line between paragraphs. */
  PARAGRAPH("\n\n", 0.3, 0),

  /** Sentence terminator; the period stays with the chunk that owns the sentence. */
  SENTENCE(". ", 0.3, 1),

  LINE("\n", 0.3, 0),

  SPACE(" ", 0.1, 0);

  /** All rules in priority order. */
  public static final List<BoundaryRule> CASCADE = List.of(values());

  private final String delimiter;
  private final double minFraction;
  private final int cutShift;

  BoundaryRule(String delimiter, double minFraction, int cutShift) {
    this.delimiter = delimiter;
    this.minFraction = minFraction;
    this.cutShift = cutShift;
  }

  public String delimiter() {
    return delimiter;
  }

  public double minFraction() {
    return minFraction;
  }

  /**
   * Finds this rule's cut offset inside the window.
   *
   * @param window the provisional window, at most {@code budget} characters long
   * @param budget the body budget the window was cut to
   * @param openingFenceOffsets window-relative offsets of fence delimiters that open a block,
   *     ascending
   * @return the cut offset in UTF-16 units relative to the window start, or -1 when the rule does
   *     not apply
   */
  public int findCut(String window, int budget, List<Integer> openingFenceOffsets) {
    int idx = lastMatch(window, openingFenceOffsets);
    if (idx != -1 && window.codePointCount(0, idx) > budget * minFraction) {
      return idx + cutShift;
    }
    return -1;
  }

  int lastMatch(String window, List<Integer> openingFenceOffsets) {
    return window.lastIndexOf(delimiter);
  }
}
