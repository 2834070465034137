package com.flamingo.ai.memorystore.domain.record;

import com.flamingo.ai.memorystore.domain.enums.RecordField;

/**
 * Common shape of everything held by a vector record store: identity, owner, embedding and
 * creation order.
 *
 * <p>{@code sequence} is assigned by the store on insert and is the only ordering key used for
 * eviction, chronological listing and ranking tie-breaks. {@code createdAt} is informational.
 *
 * @param <R> the concrete record type
 */
public interface VectorRecord<R extends VectorRecord<R>> {

  String getId();

  void setId(String id);

  String getOwnerId();

  float[] getEmbedding();

  Long getCreatedAt();

  void setCreatedAt(Long createdAt);

  Long getSequence();

  void setSequence(Long sequence);

  /** Cosine distance to the query vector; only set on query results. */
  Double getDistance();

  void setDistance(Double distance);

  /**
   * Returns the value of a filterable attribute, or {@code null} when this record kind does not
   * carry it.
   */
  String attribute(RecordField field);

  /** Returns a deep copy that shares no mutable state with this record. */
  R copy();
}
