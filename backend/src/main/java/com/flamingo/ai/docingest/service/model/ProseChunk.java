package com.flamingo.ai.docingest.service.model;

/**
 * A prose chunk ready for embedding.
 *
 * @param text chunk text, embedded verbatim
 * @param url source page URL
 * @param title source page title
 * @param chunkIndex position of this chunk within its page (0-based)
 */
public record ProseChunk(String text, String url, String title, int chunkIndex) {}
