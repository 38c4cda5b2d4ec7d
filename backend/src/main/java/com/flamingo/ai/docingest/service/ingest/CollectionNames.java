package com.flamingo.ai.docingest.service.ingest;

import java.util.regex.Pattern;

/** Derives vector collection names from source URLs. */
public final class CollectionNames {

  private static final Pattern INVALID_CHARS = Pattern.compile("[^a-zA-Z0-9_\\-]");
  private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

  private static final String CODE_SUFFIX = "_code";

  private CollectionNames() {}

  /**
   * Replaces every character other than ASCII letters, digits, underscore and hyphen with an
   * underscore, then strips leading and trailing underscores.
   */
  public static String forUrl(String url) {
    String escaped = INVALID_CHARS.matcher(url).replaceAll("_");
    return EDGE_UNDERSCORES.matcher(escaped).replaceAll("");
  }

  public static String codeCollection(String collectionName) {
    return collectionName + CODE_SUFFIX;
  }
}
