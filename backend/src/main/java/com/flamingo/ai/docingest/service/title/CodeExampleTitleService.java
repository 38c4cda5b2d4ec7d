package com.flamingo.ai.docingest.service.title;

/**
 * Generates a one-sentence title for an extracted code example from the code and its surrounding
 * prose. The title is prepended to the snippet before embedding.
 */
public interface CodeExampleTitleService {

  /**
   * Generates a title for a code example.
   *
   * @param code the code body
   * @param contextBefore prose preceding the block
   * @param contextAfter prose following the block
   * @return a single-sentence title; the configured fallback title when generation fails
   */
  String generateTitle(String code, String contextBefore, String contextAfter);
}
