package com.flamingo.ai.memorystore.service.document;

import java.util.Map;

/**
 * One pre-chunked piece of a source document, as supplied for ingestion.
 *
 * @param text the fragment text
 * @param metadata free-form metadata stored with the fragment
 */
public record FragmentInput(String text, Map<String, String> metadata) {

  public FragmentInput {
    metadata = metadata != null ? metadata : Map.of();
  }

  public static FragmentInput of(String text) {
    return new FragmentInput(text, Map.of());
  }
}
