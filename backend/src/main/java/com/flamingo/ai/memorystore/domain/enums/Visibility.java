package com.flamingo.ai.memorystore.domain.enums;

/** Defines who may retrieve a document fragment. */
public enum Visibility {
  /** Visible only to the uploader. */
  PRIVATE,

  /** Visible to every user of the store. */
  SHARED
}
