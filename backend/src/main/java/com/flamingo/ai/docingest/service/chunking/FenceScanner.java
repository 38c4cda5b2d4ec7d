package com.flamingo.ai.docingest.service.chunking;

import java.util.ArrayList;
import java.util.List;

/** Locates raw triple-backtick delimiters in text. */
public final class FenceScanner {

  public static final String FENCE = "```";

  private FenceScanner() {}

  /**
   * Returns the offsets of every non-overlapping {@code ```} occurrence, scanning left to right.
   *
   * <p>Delimiters at even indices open a fenced region and those at odd indices close it. No
   * attempt is made to tell an inline triple backtick apart from a fence line.
   *
   * @param text the text to scan
   * @return delimiter offsets in ascending order
   */
  public static List<Integer> delimiterPositions(String text) {
    List<Integer> positions = new ArrayList<>();
    int pos = text.indexOf(FENCE);
    while (pos != -1) {
      positions.add(pos);
      pos = text.indexOf(FENCE, pos + FENCE.length());
    }
    return positions;
  }
}
