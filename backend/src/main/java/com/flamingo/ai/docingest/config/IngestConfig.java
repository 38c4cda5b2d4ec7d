package com.flamingo.ai.docingest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for Markdown chunking and code extraction. */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Getter
@Setter
public class IngestConfig {

  private Chunking chunking = new Chunking();
  private CodeExtraction codeExtraction = new CodeExtraction();
  private CodeTitles codeTitles = new CodeTitles();

  @Getter
  @Setter
  public static class Chunking {
    /** Target maximum characters per prose chunk. */
    private int size = 1500;
  }

  @Getter
  @Setter
  public static class CodeExtraction {
    /** Code bodies shorter than this are discarded together with their context. */
    private int minLength = 50;

    /** Characters of prose captured on each side of a fenced block. */
    private int contextChars = 500;

    /** A first line is only taken as a language tag when strictly shorter than this. */
    private int maxLanguageTagLength = 20;
  }

  /**
   * LLM-generated one-sentence titles for extracted code examples. Disabled by default; enabling
   * requires an OpenAI API key.
   */
  @Getter
  @Setter
  public static class CodeTitles {
    private boolean enabled = false;

    /** Trailing characters of the preceding prose, and leading characters of the following. */
    private int maxContextChars = 500;

    private int maxCodeChars = 1500;

    /** Title used when generation fails or returns nothing. */
    private String fallbackTitle = "Code Snippet";
  }
}
