package com.flamingo.ai.docingest.service.model;

/**
 * A run of Markdown lines belonging to one heading scope.
 *
 * @param header the trimmed ATX header line that opened this section, or an empty string for
 *     content preceding the first header
 * @param text trimmed section text, including the header line itself when present
 */
public record MarkdownSection(String header, String text) {

  public boolean hasHeader() {
    return !header.isEmpty();
  }
}
