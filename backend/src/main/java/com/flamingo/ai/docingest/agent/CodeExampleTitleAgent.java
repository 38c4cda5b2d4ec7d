package com.flamingo.ai.docingest.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for titling extracted code examples.
 *
 * <p>Implements contextual retrieval for code: a one-sentence title derived from the snippet and
 * the prose around it is embedded together with the code, so that natural-language queries find
 * the snippet.
 */
public interface CodeExampleTitleAgent {

  @SystemMessage(
      """
        You write search metadata for code examples taken from technical documentation.
        Given a code example and the prose around it, provide a concise 1-sentence summary/title
        that describes what the code example demonstrates.

        Rules:
        - Write exactly 1 sentence
        - Formulate it so it serves well as search metadata, e.g.
          "Example demonstrating how to configure cache bypass in the crawler"
        - Do NOT use Markdown formatting or quote marks
        """)
  @UserMessage(
      """
        <context_before>
        {{contextBefore}}
        </context_before>

        <code_example>
        {{code}}
        </code_example>

        <context_after>
        {{contextAfter}}
        </context_after>
        """)
  String generateTitle(
      @V("code") String code,
      @V("contextBefore") String contextBefore,
      @V("contextAfter") String contextAfter);
}
