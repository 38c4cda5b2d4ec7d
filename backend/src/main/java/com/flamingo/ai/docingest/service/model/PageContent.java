package com.flamingo.ai.docingest.service.model;

/**
 * A crawled page handed to ingestion.
 *
 * @param url page URL
 * @param title page title
 * @param markdown page content rendered as Markdown
 */
public record PageContent(String url, String title, String markdown) {}
