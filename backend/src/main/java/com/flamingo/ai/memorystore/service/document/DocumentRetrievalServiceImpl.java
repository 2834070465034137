package com.flamingo.ai.memorystore.service.document;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import com.flamingo.ai.memorystore.service.embedding.EmbeddingGateway;
import com.flamingo.ai.memorystore.store.RecordFilter;
import com.flamingo.ai.memorystore.store.VectorRecordStore;
import com.flamingo.ai.memorystore.support.KeyedLocks;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of DocumentRetrievalService over a vector record store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentRetrievalServiceImpl implements DocumentRetrievalService {

  private static final List<RecordField> SOURCE_FIELDS =
      List.of(RecordField.SOURCE, RecordField.OWNER);

  private final VectorRecordStore<DocumentFragment> documentFragmentStore;
  private final EmbeddingGateway embeddingGateway;
  private final KeyedLocks keyedLocks;
  private final MeterRegistry meterRegistry;

  @Override
  public List<DocumentFragment> ingest(
      List<FragmentInput> fragments, String userId, String source, Visibility visibility) {
    return keyedLocks.withLock(
        KeyedLocks.documentKey(source, userId),
        () -> {
          List<float[]> embeddings =
              embeddingGateway.embedMany(fragments.stream().map(FragmentInput::text).toList());

          List<DocumentFragment> records = new ArrayList<>(fragments.size());
          for (int i = 0; i < fragments.size(); i++) {
            FragmentInput input = fragments.get(i);
            records.add(
                DocumentFragment.builder()
                    .ownerId(userId)
                    .source(source)
                    .visibility(visibility)
                    .text(input.text())
                    .metadata(input.metadata())
                    .embedding(embeddings.get(i))
                    .build());
          }
          int inserted = documentFragmentStore.insertAll(records);

          meterRegistry.counter("document.fragments.ingested").increment(inserted);
          log.info(
              "Ingested {} fragments of source '{}' for user {} as {}",
              inserted,
              source,
              userId,
              visibility);
          return records;
        });
  }

  @Override
  public List<DocumentFragment> retrieve(String userId, String query, int k) {
    float[] queryVector = embeddingGateway.embedOne(query);
    List<DocumentFragment> results =
        documentFragmentStore.queryNearest(visibleTo(userId), queryVector, k);
    log.debug("Retrieve for user {} returned {} of k={} fragments", userId, results.size(), k);
    return results;
  }

  @Override
  public List<SourceListing> listSources() {
    return documentFragmentStore.distinct(RecordFilter.all(), SOURCE_FIELDS).stream()
        .map(tuple -> new SourceListing(tuple.get(0), tuple.get(1)))
        .toList();
  }

  @Override
  public long purgeBySource(String source) {
    long removed =
        documentFragmentStore.deleteWhere(RecordFilter.eq(RecordField.SOURCE, source));
    log.info("Purged {} fragments of source '{}'", removed, source);
    return removed;
  }

  @Override
  public long purgeBySourceAndUser(String source, String userId) {
    return keyedLocks.withLock(
        KeyedLocks.documentKey(source, userId),
        () -> {
          long removed =
              documentFragmentStore.deleteWhere(
                  RecordFilter.and(
                      RecordFilter.eq(RecordField.SOURCE, source),
                      RecordFilter.eq(RecordField.OWNER, userId)));
          log.info("Purged {} fragments of source '{}' uploaded by {}", removed, source, userId);
          return removed;
        });
  }

  @Override
  public long purgeByUser(String userId) {
    long removed = documentFragmentStore.deleteWhere(RecordFilter.eq(RecordField.OWNER, userId));
    log.info("Purged {} fragments uploaded by {}", removed, userId);
    return removed;
  }

  @Override
  public long purgeAll() {
    long removed = documentFragmentStore.deleteWhere(RecordFilter.all());
    log.info("Purged {} fragments", removed);
    return removed;
  }

  /** The user's own fragments plus every shared fragment. */
  private static RecordFilter visibleTo(String userId) {
    return RecordFilter.or(
        RecordFilter.eq(RecordField.OWNER, userId),
        RecordFilter.eq(RecordField.VISIBILITY, Visibility.SHARED.name()));
  }
}
