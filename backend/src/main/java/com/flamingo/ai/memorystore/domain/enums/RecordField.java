package com.flamingo.ai.memorystore.domain.enums;

/** Record attributes that store predicates can filter on. */
public enum RecordField {
  ID("id"),
  OWNER("ownerId"),
  SOURCE("source"),
  VISIBILITY("visibility");

  private final String fieldName;

  RecordField(String fieldName) {
    this.fieldName = fieldName;
  }

  /** Field name used in persisted documents. */
  public String getFieldName() {
    return fieldName;
  }
}
