package com.flamingo.ai.docingest.service.chunking;

/**
 * Scanner state for a top-to-bottom walk over Markdown lines.
 *
 * <p>A line whose trimmed form starts with a triple backtick flips the state. Header detection is
 * only active while in {@link #IN_PROSE}.
 */
public enum FenceState {
  IN_PROSE,
  IN_FENCE;

  /** Returns the state after crossing a fence delimiter line. */
  public FenceState toggle() {
    return this == IN_PROSE ? IN_FENCE : IN_PROSE;
  }

  public boolean allowsHeaders() {
    return this == IN_PROSE;
  }
}
