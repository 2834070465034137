package com.flamingo.ai.memorystore.store;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.record.VectorRecord;
import java.util.List;

/**
 * Persistent collection of vector records of one kind.
 *
 * <p>Every write is a single unit of work: either all of its effects become visible to readers or
 * none do. Distance is always cosine distance ({@code 1 - cosine similarity}).
 *
 * @param <T> the record type stored
 */
public interface VectorRecordStore<T extends VectorRecord<T>> {

  /**
   * Appends one record. Assigns id, creation time and sequence when absent.
   *
   * @param record the record to insert
   * @return {@code false} if a record with the same explicit id already exists (nothing written)
   * @throws com.flamingo.ai.memorystore.exception.DimensionMismatchException if the embedding has
   *     the wrong dimension
   */
  boolean insert(T record);

  /**
   * Appends a batch of records. All records are validated before any is written; if one fails,
   * none are stored.
   *
   * @param records the records to insert
   * @return the number of records written (duplicates of existing explicit ids are skipped)
   */
  int insertAll(List<T> records);

  /**
   * Inserts a record after evicting the oldest records in {@code scope} so that the scope holds at
   * most {@code capacity} records once the insert completes. Eviction and insertion form one unit
   * of work; readers never observe more than {@code capacity} records in the scope.
   *
   * @param record the record to insert
   * @param scope the records subject to the capacity bound
   * @param capacity maximum number of records in the scope
   * @return the evicted records, oldest first
   */
  List<T> insertEvictingOldest(T record, RecordFilter scope, int capacity);

  /**
   * Removes every record matching the filter.
   *
   * @param filter the delete predicate
   * @return the number of records removed
   */
  long deleteWhere(RecordFilter filter);

  /**
   * Returns up to {@code k} records matching the filter, nearest first. Ties are broken by lower
   * sequence. Returns an empty list when nothing matches.
   *
   * @param filter the record predicate
   * @param queryVector the query embedding
   * @param k maximum number of results
   * @return matching records with {@link VectorRecord#getDistance()} populated
   */
  List<T> queryNearest(RecordFilter filter, float[] queryVector, int k);

  /**
   * Counts records matching the filter.
   *
   * @param filter the record predicate
   * @return exact count
   */
  long countWhere(RecordFilter filter);

  /**
   * Returns every record matching the filter in creation order.
   *
   * @param filter the record predicate
   * @return matching records, oldest first
   */
  List<T> findWhere(RecordFilter filter);

  /**
   * Returns the distinct value tuples of the given fields across matching records, in order of
   * first appearance.
   *
   * @param filter the record predicate
   * @param fields the fields to project
   * @return one list per distinct tuple, values in {@code fields} order
   */
  List<List<String>> distinct(RecordFilter filter, List<RecordField> fields);

  /** Returns the embedding dimension every record must have. */
  int dimensions();

  /** Returns a short name for logs and metrics. */
  String getName();
}
