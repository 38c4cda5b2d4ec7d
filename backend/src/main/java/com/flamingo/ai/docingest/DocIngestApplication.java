package com.flamingo.ai.docingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Markdown ingestion engine: section-aware chunking and code example extraction. */
@SpringBootApplication
public class DocIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocIngestApplication.class, args);
  }
}
