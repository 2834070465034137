package com.flamingo.ai.memorystore.store.memory;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.record.VectorRecord;
import com.flamingo.ai.memorystore.exception.DimensionMismatchException;
import com.flamingo.ai.memorystore.store.RecordFilter;
import com.flamingo.ai.memorystore.store.VectorMath;
import com.flamingo.ai.memorystore.store.VectorRecordStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Vector record store held in process memory with exact (brute-force) cosine ranking.
 *
 * <p>A read/write lock makes every write a single atomic unit and every read a consistent snapshot.
 * Records are copied on the way in and on the way out, so callers never share state with the
 * store.
 *
 * @param <T> the record type stored
 */
@Slf4j
public class InMemoryVectorRecordStore<T extends VectorRecord<T>> implements VectorRecordStore<T> {

  private static final Comparator<VectorRecord<?>> BY_SEQUENCE =
      Comparator.comparingLong(VectorRecord::getSequence);

  private final String name;
  private final int dimensions;
  private final Clock clock;

  private final Map<String, T> records = new LinkedHashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private long lastSequence = 0L;

  public InMemoryVectorRecordStore(String name, int dimensions, Clock clock) {
    if (dimensions <= 0) {
      throw new IllegalArgumentException("dimensions must be positive: " + dimensions);
    }
    this.name = name;
    this.dimensions = dimensions;
    this.clock = clock;
  }

  @Override
  public boolean insert(T record) {
    validateDimensions(record.getEmbedding());
    return write(() -> doInsert(record));
  }

  @Override
  public int insertAll(List<T> batch) {
    for (T record : batch) {
      validateDimensions(record.getEmbedding());
    }
    return write(
        () -> {
          // Explicit ids repeated inside the batch count once, like against existing records
          Set<String> seen = new HashSet<>();
          int inserted = 0;
          for (T record : batch) {
            if (record.getId() != null && !seen.add(record.getId())) {
              continue;
            }
            if (doInsert(record)) {
              inserted++;
            }
          }
          log.debug("Inserted {} of {} records into {}", inserted, batch.size(), name);
          return inserted;
        });
  }

  @Override
  public List<T> insertEvictingOldest(T record, RecordFilter scope, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
    }
    validateDimensions(record.getEmbedding());
    return write(
        () -> {
          if (record.getId() != null && records.containsKey(record.getId())) {
            return List.of();
          }
          List<T> inScope =
              records.values().stream().filter(scope::matches).sorted(BY_SEQUENCE).toList();
          int excess = inScope.size() - capacity + 1;
          List<T> evicted = new ArrayList<>();
          for (int i = 0; i < excess; i++) {
            T oldest = inScope.get(i);
            records.remove(oldest.getId());
            evicted.add(oldest.copy());
          }
          doInsert(record);
          if (!evicted.isEmpty()) {
            log.debug("Evicted {} records from {} in scope [{}]", evicted.size(), name, scope);
          }
          return evicted;
        });
  }

  @Override
  public long deleteWhere(RecordFilter filter) {
    return write(
        () -> {
          int before = records.size();
          records.values().removeIf(filter::matches);
          long removed = before - records.size();
          log.debug("Deleted {} records from {} matching [{}]", removed, name, filter);
          return removed;
        });
  }

  @Override
  public List<T> queryNearest(RecordFilter filter, float[] queryVector, int k) {
    validateDimensions(queryVector);
    if (k <= 0) {
      return List.of();
    }
    return read(
        () -> {
          List<T> ranked = new ArrayList<>();
          for (T record : records.values()) {
            if (filter.matches(record)) {
              T candidate = record.copy();
              candidate.setDistance(
                  VectorMath.cosineDistance(queryVector, candidate.getEmbedding()));
              ranked.add(candidate);
            }
          }
          ranked.sort(
              Comparator.comparingDouble((T r) -> r.getDistance())
                  .thenComparingLong(VectorRecord::getSequence));
          return ranked.size() > k ? List.copyOf(ranked.subList(0, k)) : List.copyOf(ranked);
        });
  }

  @Override
  public long countWhere(RecordFilter filter) {
    return read(() -> records.values().stream().filter(filter::matches).count());
  }

  @Override
  public List<T> findWhere(RecordFilter filter) {
    return read(
        () ->
            records.values().stream()
                .filter(filter::matches)
                .sorted(BY_SEQUENCE)
                .map(VectorRecord::copy)
                .toList());
  }

  @Override
  public List<List<String>> distinct(RecordFilter filter, List<RecordField> fields) {
    return read(
        () -> {
          Set<List<String>> tuples = new LinkedHashSet<>();
          records.values().stream()
              .filter(filter::matches)
              .sorted(BY_SEQUENCE)
              .forEach(
                  record -> {
                    List<String> tuple = new ArrayList<>(fields.size());
                    for (RecordField field : fields) {
                      tuple.add(record.attribute(field));
                    }
                    tuples.add(tuple);
                  });
          return List.copyOf(tuples);
        });
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public String getName() {
    return name;
  }

  /** Must be called with the write lock held. */
  private boolean doInsert(T record) {
    if (record.getId() != null && records.containsKey(record.getId())) {
      log.debug("Skipping duplicate record id {} in {}", record.getId(), name);
      return false;
    }
    T stored = record.copy();
    if (stored.getId() == null) {
      stored.setId(UUID.randomUUID().toString());
    }
    if (stored.getCreatedAt() == null) {
      stored.setCreatedAt(clock.millis());
    }
    if (stored.getSequence() == null) {
      stored.setSequence(++lastSequence);
    } else {
      lastSequence = Math.max(lastSequence, stored.getSequence());
    }
    stored.setDistance(null);
    records.put(stored.getId(), stored);

    // Reflect assigned identity back to the caller's instance
    record.setId(stored.getId());
    record.setCreatedAt(stored.getCreatedAt());
    record.setSequence(stored.getSequence());
    return true;
  }

  private void validateDimensions(float[] vector) {
    int actual = vector == null ? 0 : vector.length;
    if (actual != dimensions) {
      throw new DimensionMismatchException(name, dimensions, actual);
    }
  }

  private <V> V write(Supplier<V> action) {
    lock.writeLock().lock();
    try {
      return action.get();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private <V> V read(Supplier<V> action) {
    lock.readLock().lock();
    try {
      return action.get();
    } finally {
      lock.readLock().unlock();
    }
  }
}
