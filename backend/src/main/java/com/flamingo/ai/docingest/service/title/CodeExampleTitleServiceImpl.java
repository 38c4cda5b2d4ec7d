package com.flamingo.ai.docingest.service.title;

import com.flamingo.ai.docingest.agent.CodeExampleTitleAgent;
import com.flamingo.ai.docingest.config.IngestConfig;
import com.flamingo.ai.docingest.exception.LlmServiceException;
import com.flamingo.ai.docingest.service.chunking.CodePoints;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Implementation of {@link CodeExampleTitleService} using an LLM agent. */
@Service
@ConditionalOnProperty(prefix = "ingest.code-titles", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class CodeExampleTitleServiceImpl implements CodeExampleTitleService {

  private final CodeExampleTitleAgent codeExampleTitleAgent;
  private final IngestConfig ingestConfig;

  @Override
  @Timed(value = "ingest.code_title", description = "Time to generate a code example title")
  @Retry(name = "llm", fallbackMethod = "generateTitleFallback")
  public String generateTitle(String code, String contextBefore, String contextAfter) {
    IngestConfig.CodeTitles settings = ingestConfig.getCodeTitles();
    int maxContext = settings.getMaxContextChars();

    String title;
    try {
      title =
          codeExampleTitleAgent.generateTitle(
              head(code, settings.getMaxCodeChars()),
              tail(contextBefore, maxContext),
              head(contextAfter, maxContext));
    } catch (RuntimeException e) {
      throw new LlmServiceException("Code example title generation failed: " + e.getMessage(), e);
    }

    if (title == null || title.isBlank()) {
      log.debug("Title agent returned nothing, using fallback title");
      return settings.getFallbackTitle();
    }
    return title.strip();
  }

  private String generateTitleFallback(
      String code, String contextBefore, String contextAfter, Throwable t) {
    log.warn("Code example title fallback triggered: {}", t.getMessage());
    return ingestConfig.getCodeTitles().getFallbackTitle();
  }

  private static String head(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    return CodePoints.head(text, maxChars);
  }

  private static String tail(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    return CodePoints.tail(text, maxChars);
  }
}
