package com.flamingo.ai.docingest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docingest.config.IngestConfig;
import com.flamingo.ai.docingest.exception.DocumentProcessingException;
import com.flamingo.ai.docingest.service.ingest.IngestionPreparationService;
import com.flamingo.ai.docingest.service.model.IngestionBatch;
import com.flamingo.ai.docingest.service.model.PageContent;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Prepares local Markdown files from the command line and prints the batch as JSON.
 *
 * <p>Every non-option argument is a file path. Each file becomes one page whose URL is the file
 * URI and whose title is the file name; the collection is named after the first file's directory.
 * Option arguments ({@code --name=value}) are left to Spring. Without file arguments the runner
 * does nothing.
 *
 * <p>Failures are logged and never abort application startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarkdownIngestRunner implements CommandLineRunner {

  private final IngestionPreparationService ingestionPreparationService;
  private final IngestConfig ingestConfig;
  private final ObjectMapper objectMapper;

  private PrintStream out = System.out;

  @Override
  public void run(String... args) {
    List<Path> files = new ArrayList<>();
    for (String arg : args) {
      if (!arg.startsWith("--")) {
        files.add(Path.of(arg));
      }
    }
    if (files.isEmpty()) {
      log.debug("No Markdown files given, nothing to ingest");
      return;
    }

    try {
      List<PageContent> pages = new ArrayList<>();
      for (Path file : files) {
        String markdown = Files.readString(file, StandardCharsets.UTF_8);
        pages.add(
            new PageContent(file.toUri().toString(), file.getFileName().toString(), markdown));
        log.info("Read {} ({} chars)", file, markdown.length());
      }

      Path parent = files.get(0).toAbsolutePath().getParent();
      String rootUrl = parent != null ? parent.toUri().toString() : files.get(0).toUri().toString();
      IngestionBatch batch =
          ingestionPreparationService.prepare(
              rootUrl, pages, ingestConfig.getCodeTitles().isEnabled());

      out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(batch));
    } catch (DocumentProcessingException e) {
      log.error("{} for {}: {}", e.getUserMessage(), e.getSource(), e.getMessage());
    } catch (IOException e) {
      log.error("Failed to ingest Markdown files {}: {}", files, e.getMessage(), e);
    } catch (RuntimeException e) {
      log.error("Markdown ingestion failed: {}", e.getMessage(), e);
    }
  }

  void setOut(PrintStream out) {
    this.out = out;
  }
}
