package com.flamingo.ai.docingest.service.chunking;

/**
 * Character-count helpers for chunk and context sizes.
 *
 * <p>Sizes count Unicode code points, not UTF-16 units, so an emoji or a supplementary CJK
 * character counts once and no offset returned here ever falls between the two halves of a
 * surrogate pair.
 */
public final class CodePoints {

  private CodePoints() {}

  public static int length(String text) {
    return text.codePointCount(0, text.length());
  }

  /**
   * Moves forward from {@code index} by up to {@code count} characters.
   *
   * @return the UTF-16 offset reached, at most {@code text.length()}
   */
  public static int advance(String text, int index, int count) {
    int offset = index;
    for (int i = 0; i < count && offset < text.length(); i++) {
      offset += Character.charCount(text.codePointAt(offset));
    }
    return offset;
  }

  /**
   * Moves backward from {@code index} by up to {@code count} characters.
   *
   * @return the UTF-16 offset reached, at least 0
   */
  public static int retreat(String text, int index, int count) {
    int offset = index;
    for (int i = 0; i < count && offset > 0; i++) {
      offset -= Character.charCount(text.codePointBefore(offset));
    }
    return offset;
  }

  /** The first {@code maxChars} characters of the text. */
  public static String head(String text, int maxChars) {
    return text.substring(0, advance(text, 0, maxChars));
  }

  /** The last {@code maxChars} characters of the text. */
  public static String tail(String text, int maxChars) {
    return text.substring(retreat(text, text.length(), maxChars));
  }
}
