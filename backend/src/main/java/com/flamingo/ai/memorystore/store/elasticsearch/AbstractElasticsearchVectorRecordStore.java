package com.flamingo.ai.memorystore.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.bulk.OperationType;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.record.VectorRecord;
import com.flamingo.ai.memorystore.exception.DimensionMismatchException;
import com.flamingo.ai.memorystore.exception.StoreUnavailableException;
import com.flamingo.ai.memorystore.store.RecordFilter;
import com.flamingo.ai.memorystore.store.VectorMath;
import com.flamingo.ai.memorystore.store.VectorRecordStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch-backed vector record stores.
 *
 * <p>Each record kind lives in its own single-shard index with a {@code dense_vector} field using
 * cosine similarity. Ranking is exact: a {@code script_score} query computes cosine similarity for
 * every filtered document, and results are sorted by score then by sequence.
 *
 * <p>Every write is one bulk request with {@code refresh=wait_for}, so its operations become
 * searchable in the same refresh. If Elasticsearch applies only part of a bulk request, the applied
 * part is undone before {@link StoreUnavailableException} is thrown.
 *
 * @param <T> the record type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchVectorRecordStore<T extends VectorRecord<T>>
    implements VectorRecordStore<T> {

  protected static final String ID_FIELD = "id";
  protected static final String EMBEDDING_FIELD = "embedding";
  protected static final String SEQUENCE_FIELD = "sequence";
  protected static final String CREATED_AT_FIELD = "createdAt";

  private static final String COSINE_SCRIPT =
      "cosineSimilarity(params.query_vector, '" + EMBEDDING_FIELD + "') + 1.0";
  private static final int PAGE_SIZE = 1000;
  private static final int HTTP_CONFLICT = 409;
  private static final int HTTP_NOT_FOUND = 404;

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;
  private final CircuitBreaker circuitBreaker;
  private final Clock clock;
  private final ElasticsearchFilterTranslator filterTranslator =
      new ElasticsearchFilterTranslator();
  private final AtomicLong lastSequence = new AtomicLong();

  protected AbstractElasticsearchVectorRecordStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry,
      Clock clock) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("vectorStore");
    this.clock = clock;
  }

  /** Returns the Elasticsearch index name. */
  public abstract String getIndexName();

  /**
   * Defines the kind-specific index properties. Id, embedding, sequence and creation time are
   * added by this class.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineKindProperties();

  /**
   * Converts the kind-specific fields of a record to document fields.
   *
   * @param record the record to convert
   * @param document the document map to fill
   */
  protected abstract void writeKindFields(T record, Map<String, Object> document);

  /**
   * Builds a record from a document source map. Common fields are read by the caller.
   *
   * @param source the Elasticsearch document source
   * @return the record with its kind-specific fields populated
   */
  protected abstract T readKindFields(Map<String, Object> source);

  /** Returns the metric prefix for this index (e.g., "conversation_turn"). */
  protected abstract String getMetricPrefix();

  @Override
  public String getName() {
    return getIndexName();
  }

  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
      seedSequence();
    } catch (IOException | ElasticsearchException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>(defineKindProperties());
    properties.put(ID_FIELD, Property.of(p -> p.keyword(k -> k)));
    properties.put(RecordField.OWNER.getFieldName(), Property.of(p -> p.keyword(k -> k)));
    properties.put(SEQUENCE_FIELD, Property.of(p -> p.long_(l -> l)));
    properties.put(CREATED_AT_FIELD, Property.of(p -> p.long_(l -> l)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d -> d.dims(dimensions()).index(true).similarity("cosine")))));
    return properties;
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // Single shard: a bulk request lands on one shard and becomes visible in one refresh
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .settings(s -> s.numberOfShards("1"))
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and fails on type or dimension mismatches.
   *
   * <p>Elasticsearch cannot change the type of an existing field, and a stored vector of another
   * dimension can never be compared with the configured model's output.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    Property actualEmbedding = actualProperties.get(EMBEDDING_FIELD);
    if (actualEmbedding != null && actualEmbedding.isDenseVector()) {
      Integer actualDims = actualEmbedding.denseVector().dims();
      if (actualDims != null && actualDims != dimensions()) {
        throw new DimensionMismatchException(getIndexName(), dimensions(), actualDims);
      }
    }

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), entry.getKey(), entry.getValue()._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }
    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  /** Continues the sequence from the highest value already stored. */
  private void seedSequence() throws IOException {
    SearchResponse<Map> response =
        elasticsearchClient.search(
            s ->
                s.index(getIndexName())
                    .size(1)
                    .source(src -> src.filter(f -> f.includes(SEQUENCE_FIELD)))
                    .sort(so -> so.field(f -> f.field(SEQUENCE_FIELD).order(SortOrder.Desc))),
            Map.class);
    List<Hit<Map>> hits = response.hits().hits();
    if (!hits.isEmpty() && hits.get(0).source() != null) {
      Object seq = hits.get(0).source().get(SEQUENCE_FIELD);
      if (seq instanceof Number n) {
        lastSequence.set(n.longValue());
      }
    }
    log.debug("Index '{}' sequence starts after {}", getIndexName(), lastSequence.get());
  }

  @Override
  public boolean insert(T record) {
    return insertAll(List.of(record)) > 0;
  }

  @Override
  public int insertAll(List<T> records) {
    for (T record : records) {
      validateDimensions(record.getEmbedding());
    }
    if (records.isEmpty()) {
      return 0;
    }
    List<T> prepared = new ArrayList<>(records.size());
    Set<String> seen = new HashSet<>();
    for (T record : records) {
      if (record.getId() != null && !seen.add(record.getId())) {
        continue;
      }
      assignIdentity(record);
      seen.add(record.getId());
      prepared.add(record);
    }

    return execute(
        "insert",
        () -> {
          BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
          for (T record : prepared) {
            Map<String, Object> doc = convertToDocument(record);
            bulk.operations(
                op -> op.create(c -> c.index(getIndexName()).id(record.getId()).document(doc)));
          }
          BulkResponse response = elasticsearchClient.bulk(bulk.build());

          List<String> created = new ArrayList<>();
          List<BulkResponseItem> failed = new ArrayList<>();
          for (BulkResponseItem item : response.items()) {
            if (item.error() == null) {
              created.add(item.id());
            } else if (item.status() != HTTP_CONFLICT) {
              failed.add(item);
            } else {
              log.debug("Skipping duplicate record id {} in {}", item.id(), getIndexName());
            }
          }
          if (!failed.isEmpty()) {
            log.warn(
                "{} of {} records failed to index in {}; removing the {} that were written",
                failed.size(),
                prepared.size(),
                getIndexName(),
                created.size());
            deleteIds(created);
            meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
            throw new StoreUnavailableException(
                "Failed to index records into " + getIndexName() + ": " + failed.get(0).error());
          }
          meterRegistry.counter(getMetricPrefix() + ".indexed").increment(created.size());
          log.debug("Indexed {} records to {}", created.size(), getIndexName());
          return created.size();
        });
  }

  @Override
  public List<T> insertEvictingOldest(T record, RecordFilter scope, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
    }
    validateDimensions(record.getEmbedding());
    assignIdentity(record);
    Query scopeQuery = filterTranslator.translate(scope);

    return execute(
        "insert_evicting",
        () -> {
          long count =
              elasticsearchClient.count(c -> c.index(getIndexName()).query(scopeQuery)).count();
          int excess = (int) Math.max(0, count - capacity + 1);
          List<T> evicted = excess > 0 ? oldest(scopeQuery, excess) : List.of();

          BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
          for (T old : evicted) {
            bulk.operations(op -> op.delete(d -> d.index(getIndexName()).id(old.getId())));
          }
          Map<String, Object> doc = convertToDocument(record);
          bulk.operations(
              op -> op.create(c -> c.index(getIndexName()).id(record.getId()).document(doc)));
          BulkResponse response = elasticsearchClient.bulk(bulk.build());

          if (response.errors() && compensateEviction(response, record, evicted)) {
            log.debug("Skipping duplicate record id {} in {}", record.getId(), getIndexName());
            return List.of();
          }
          if (!evicted.isEmpty()) {
            meterRegistry.counter(getMetricPrefix() + ".evicted").increment(evicted.size());
            log.debug(
                "Evicted {} records from {} in scope [{}]", evicted.size(), getIndexName(), scope);
          }
          meterRegistry.counter(getMetricPrefix() + ".indexed").increment();
          return evicted;
        });
  }

  /**
   * Undoes the applied part of an evict-and-insert bulk request that reported errors.
   *
   * @return {@code true} if the only error was a duplicate id, in which case the evicted records
   *     are restored and nothing is written
   * @throws StoreUnavailableException if any other operation failed
   */
  private boolean compensateEviction(BulkResponse response, T record, List<T> evicted)
      throws IOException {
    boolean inserted = false;
    boolean duplicate = false;
    Set<String> deleted = new HashSet<>();
    BulkResponseItem firstError = null;
    for (BulkResponseItem item : response.items()) {
      if (item.error() == null) {
        if (item.operationType() == OperationType.Create) {
          inserted = true;
        } else if (item.operationType() == OperationType.Delete) {
          deleted.add(item.id());
        }
      } else if (item.operationType() == OperationType.Create
          && item.status() == HTTP_CONFLICT) {
        duplicate = true;
      } else if (item.operationType() != OperationType.Delete || item.status() != HTTP_NOT_FOUND) {
        if (firstError == null) {
          firstError = item;
        }
      }
    }
    if (firstError == null && !duplicate) {
      return false;
    }
    log.warn(
        "Evict-and-insert partially failed in {}; restoring {} evicted record(s), inserted={}",
        getIndexName(),
        deleted.size(),
        inserted);
    if (inserted) {
      deleteIds(List.of(record.getId()));
    }
    if (!deleted.isEmpty()) {
      BulkRequest.Builder restore = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (T old : evicted) {
        if (deleted.contains(old.getId())) {
          Map<String, Object> doc = convertToDocument(old);
          restore.operations(
              op -> op.index(idx -> idx.index(getIndexName()).id(old.getId()).document(doc)));
        }
      }
      elasticsearchClient.bulk(restore.build());
    }
    if (firstError == null) {
      return true;
    }
    meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
    throw new StoreUnavailableException(
        "Failed to insert record into " + getIndexName() + ": " + firstError.error());
  }

  @Override
  public long deleteWhere(RecordFilter filter) {
    Query query = filterTranslator.translate(filter);
    return execute(
        "delete",
        () -> {
          DeleteByQueryRequest request =
              DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(query).refresh(true));
          Long deleted = elasticsearchClient.deleteByQuery(request).deleted();
          long removed = deleted != null ? deleted : 0L;
          log.info("Deleted {} records from {} matching [{}]", removed, getIndexName(), filter);
          meterRegistry.counter(getMetricPrefix() + ".deleted").increment(removed);
          return removed;
        });
  }

  @Override
  public List<T> queryNearest(RecordFilter filter, float[] queryVector, int k) {
    validateDimensions(queryVector);
    if (k <= 0) {
      return List.of();
    }
    Query filterQuery = filterTranslator.translate(filter);
    List<Float> vector = VectorMath.toFloatList(queryVector);

    return execute(
        "vector_search",
        () -> {
          SearchRequest request =
              SearchRequest.of(
                  s ->
                      s.index(getIndexName())
                          .size(k)
                          .trackScores(true)
                          .query(
                              q ->
                                  q.scriptScore(
                                      ss ->
                                          ss.query(filterQuery)
                                              .script(
                                                  sc ->
                                                      sc.source(COSINE_SCRIPT)
                                                          .params(
                                                              "query_vector",
                                                              JsonData.of(vector)))))
                          .sort(so -> so.score(sc -> sc.order(SortOrder.Desc)))
                          .sort(so -> so.field(f -> f.field(SEQUENCE_FIELD).order(SortOrder.Asc))));
          SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
          List<T> results = new ArrayList<>();
          for (Hit<Map> hit : response.hits().hits()) {
            T record = convertFromHit(hit);
            if (record != null) {
              record.setDistance(distanceOf(hit, queryVector, record));
              results.add(record);
            }
          }
          log.debug(
              "[vectorSearch] index={} filter=[{}] k={} returned={}",
              getIndexName(),
              filter,
              k,
              results.size());
          meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
          return results;
        });
  }

  /**
   * Reads the distance from the score the hit was ranked by ({@code cosineSimilarity + 1}), so the
   * reported distances follow the result order even for near-ties at float precision.
   */
  private double distanceOf(Hit<Map> hit, float[] queryVector, T record) {
    Double score = hit.score();
    if (score == null) {
      return VectorMath.cosineDistance(queryVector, record.getEmbedding());
    }
    return Math.max(0.0, 2.0 - score);
  }

  @Override
  public long countWhere(RecordFilter filter) {
    Query query = filterTranslator.translate(filter);
    return execute(
        "count",
        () -> elasticsearchClient.count(c -> c.index(getIndexName()).query(query)).count());
  }

  @Override
  public List<T> findWhere(RecordFilter filter) {
    Query query = filterTranslator.translate(filter);
    return execute(
        "find",
        () -> {
          List<T> results = new ArrayList<>();
          scan(
              query,
              null,
              source -> {
                T record = convertFromDocument(source);
                if (record != null) {
                  results.add(record);
                }
              });
          return results;
        });
  }

  @Override
  public List<List<String>> distinct(RecordFilter filter, List<RecordField> fields) {
    Query query = filterTranslator.translate(filter);
    List<String> includes = fields.stream().map(RecordField::getFieldName).toList();
    return execute(
        "distinct",
        () -> {
          Set<List<String>> tuples = new LinkedHashSet<>();
          scan(
              query,
              includes,
              source -> {
                List<String> tuple = new ArrayList<>(fields.size());
                for (String field : includes) {
                  Object value = source.get(field);
                  tuple.add(value != null ? value.toString() : null);
                }
                tuples.add(tuple);
              });
          return List.copyOf(tuples);
        });
  }

  /** Pages through every matching document in sequence order using {@code search_after}. */
  private void scan(Query query, List<String> includes, Consumer<Map<String, Object>> consumer)
      throws IOException {
    Long cursor = null;
    while (true) {
      final Long after = cursor;
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s -> {
                s.index(getIndexName())
                    .query(query)
                    .size(PAGE_SIZE)
                    .sort(so -> so.field(f -> f.field(SEQUENCE_FIELD).order(SortOrder.Asc)));
                if (includes != null) {
                  List<String> fields = new ArrayList<>(includes);
                  fields.add(SEQUENCE_FIELD);
                  s.source(src -> src.filter(f -> f.includes(fields)));
                }
                if (after != null) {
                  s.searchAfter(FieldValue.of(after));
                }
                return s;
              },
              Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      for (Hit<Map> hit : hits) {
        @SuppressWarnings("unchecked")
        Map<String, Object> source = hit.source();
        if (source == null) {
          continue;
        }
        source.putIfAbsent(ID_FIELD, hit.id());
        consumer.accept(source);
        if (source.get(SEQUENCE_FIELD) instanceof Number n) {
          cursor = n.longValue();
        }
      }
      if (hits.size() < PAGE_SIZE || cursor == null || cursor.equals(after)) {
        return;
      }
    }
  }

  private List<T> oldest(Query scopeQuery, int count) throws IOException {
    SearchResponse<Map> response =
        elasticsearchClient.search(
            s ->
                s.index(getIndexName())
                    .query(scopeQuery)
                    .size(count)
                    .sort(so -> so.field(f -> f.field(SEQUENCE_FIELD).order(SortOrder.Asc))),
            Map.class);
    List<T> results = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      T record = convertFromHit(hit);
      if (record != null) {
        results.add(record);
      }
    }
    return results;
  }

  private void deleteIds(List<String> ids) throws IOException {
    if (ids.isEmpty()) {
      return;
    }
    BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (String id : ids) {
      bulk.operations(op -> op.delete(d -> d.index(getIndexName()).id(id)));
    }
    BulkResponse response = elasticsearchClient.bulk(bulk.build());
    if (response.errors()) {
      log.error("Compensating delete failed in {}: {}", getIndexName(), response.items());
    }
  }

  private void assignIdentity(T record) {
    if (record.getId() == null) {
      record.setId(UUID.randomUUID().toString());
    }
    if (record.getCreatedAt() == null) {
      record.setCreatedAt(clock.millis());
    }
    if (record.getSequence() == null) {
      record.setSequence(lastSequence.incrementAndGet());
    } else {
      lastSequence.accumulateAndGet(record.getSequence(), Math::max);
    }
  }

  private Map<String, Object> convertToDocument(T record) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put(ID_FIELD, record.getId());
    doc.put(RecordField.OWNER.getFieldName(), record.getOwnerId());
    doc.put(EMBEDDING_FIELD, VectorMath.toFloatList(record.getEmbedding()));
    doc.put(SEQUENCE_FIELD, record.getSequence());
    doc.put(CREATED_AT_FIELD, record.getCreatedAt());
    writeKindFields(record, doc);
    return doc;
  }

  @SuppressWarnings("unchecked")
  private T convertFromDocument(Map<String, Object> source) {
    T record = readKindFields(source);
    record.setId((String) source.get(ID_FIELD));
    if (source.get(SEQUENCE_FIELD) instanceof Number n) {
      record.setSequence(n.longValue());
    }
    if (source.get(CREATED_AT_FIELD) instanceof Number n) {
      record.setCreatedAt(n.longValue());
    }
    return record;
  }

  @SuppressWarnings("unchecked")
  private T convertFromHit(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    if (source == null) {
      return null;
    }
    source.putIfAbsent(ID_FIELD, hit.id());
    return convertFromDocument(source);
  }

  /** Reads the embedding stored in a document source. */
  @SuppressWarnings("unchecked")
  protected static float[] readEmbedding(Map<String, Object> source) {
    Object value = source.get(EMBEDDING_FIELD);
    return value instanceof List<?> list
        ? VectorMath.toFloatArray((List<? extends Number>) list)
        : new float[0];
  }

  private void validateDimensions(float[] vector) {
    int actual = vector == null ? 0 : vector.length;
    if (actual != dimensions()) {
      throw new DimensionMismatchException(getIndexName(), dimensions(), actual);
    }
  }

  /** Runs one Elasticsearch interaction behind the store circuit breaker. */
  private <V> V execute(String operation, ElasticsearchCall<V> call) {
    try {
      return circuitBreaker.executeCallable(call::call);
    } catch (CallNotPermittedException e) {
      meterRegistry.counter(getMetricPrefix() + "." + operation + ".rejected").increment();
      throw new StoreUnavailableException(
          "Vector store circuit breaker is open; " + operation + " on " + getIndexName()
              + " rejected",
          e);
    } catch (IOException | ElasticsearchException e) {
      log.error("{} failed for {}: {}", operation, getIndexName(), e.getMessage(), e);
      meterRegistry.counter(getMetricPrefix() + "." + operation + ".errors").increment();
      throw new StoreUnavailableException(operation + " failed for " + getIndexName(), e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new StoreUnavailableException(operation + " failed for " + getIndexName(), e);
    }
  }

  @FunctionalInterface
  private interface ElasticsearchCall<V> {
    V call() throws IOException;
  }
}
