package com.flamingo.ai.docingest.service.model;

/**
 * A code example ready for embedding into the code collection.
 *
 * @param embeddingText formatted payload sent to the embedding model, optionally carrying a
 *     generated title
 * @param url source page URL
 * @param title source page title
 * @param codeIndex position of this snippet within its page (0-based)
 * @param language language tag from the opening fence, or an empty string
 * @param rawCode the untouched code body, kept for exact retrieval
 */
public record CodeSnippet(
    String embeddingText,
    String url,
    String title,
    int codeIndex,
    String language,
    String rawCode) {}
