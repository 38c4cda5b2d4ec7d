package com.flamingo.ai.docingest.service.model;

/**
 * A fenced code block extracted from a Markdown document.
 *
 * @param code trimmed code body, without the language tag line
 * @param language short single-token tag from the opening fence line, or an empty string
 * @param contextBefore trimmed prose immediately preceding the opening fence
 * @param contextAfter trimmed prose immediately following the closing fence
 */
public record CodeBlock(String code, String language, String contextBefore, String contextAfter) {}
