package com.flamingo.ai.docingest.service.ingest;

/** Builds the text payloads handed to the embedding model. */
public final class EmbeddingTexts {

  private EmbeddingTexts() {}

  public static String codeSnippet(String code) {
    return "Code Snippet:\n" + code;
  }

  public static String titledCodeSnippet(String title, String code) {
    return "Title: " + title + "\n\n" + codeSnippet(code);
  }

  /**
   * Expands a search query so its embedding lands near titled code payloads.
   *
   * <p>Not called during ingestion. Exported for the query side, which lives outside this
   * repository and must format queries to match {@link #titledCodeSnippet}.
   *
   * @param query the user query
   * @return the expanded query text
   */
  public static String codeSearchQuery(String query) {
    return "Code example for " + query + "\n\nSummary: Example code showing " + query;
  }
}
