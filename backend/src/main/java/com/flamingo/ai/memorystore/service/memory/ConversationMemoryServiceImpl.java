package com.flamingo.ai.memorystore.service.memory;

import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import com.flamingo.ai.memorystore.service.embedding.EmbeddingGateway;
import com.flamingo.ai.memorystore.store.RecordFilter;
import com.flamingo.ai.memorystore.store.VectorRecordStore;
import com.flamingo.ai.memorystore.support.KeyedLocks;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of ConversationMemoryService over a vector record store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationMemoryServiceImpl implements ConversationMemoryService {

  private final VectorRecordStore<ConversationTurn> conversationTurnStore;
  private final EmbeddingGateway embeddingGateway;
  private final KeyedLocks keyedLocks;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public ConversationTurn recordTurn(String userId, String text) {
    // Embedding happens inside the lock so turns of one user are stored in call order
    return keyedLocks.withLock(
        KeyedLocks.turnKey(userId),
        () -> {
          float[] embedding = embeddingGateway.embedOne(text);
          ConversationTurn turn =
              ConversationTurn.builder().ownerId(userId).text(text).embedding(embedding).build();
          List<ConversationTurn> evicted =
              conversationTurnStore.insertEvictingOldest(
                  turn, ownedBy(userId), retrievalConfig.getMemory().getHistoryCapacity());

          meterRegistry.counter("memory.turns.recorded").increment();
          if (!evicted.isEmpty()) {
            meterRegistry.counter("memory.turns.evicted").increment(evicted.size());
          }
          log.info(
              "Recorded turn {} for user {} ({} chars), evicted {}",
              turn.getId(),
              userId,
              text.length(),
              evicted.size());
          return turn;
        });
  }

  @Override
  public List<ConversationTurn> recall(String userId, String query, int k) {
    float[] queryVector = embeddingGateway.embedOne(query);
    List<ConversationTurn> results =
        conversationTurnStore.queryNearest(ownedBy(userId), queryVector, k);
    log.debug("Recall for user {} returned {} of k={} turns", userId, results.size(), k);
    return results;
  }

  @Override
  public List<ConversationTurn> history(String userId) {
    return conversationTurnStore.findWhere(ownedBy(userId));
  }

  @Override
  public long clear(String userId) {
    long removed = conversationTurnStore.deleteWhere(ownedBy(userId));
    log.info("Cleared {} turns for user {}", removed, userId);
    return removed;
  }

  @Override
  public long clearAll() {
    long removed = conversationTurnStore.deleteWhere(RecordFilter.all());
    log.info("Cleared {} turns for all users", removed);
    return removed;
  }

  @Override
  public List<String> usersWithHistory() {
    return conversationTurnStore.distinct(RecordFilter.all(), List.of(RecordField.OWNER)).stream()
        .map(tuple -> tuple.get(0))
        .toList();
  }

  @Override
  public long count(String userId) {
    return conversationTurnStore.countWhere(ownedBy(userId));
  }

  private static RecordFilter ownedBy(String userId) {
    return RecordFilter.eq(RecordField.OWNER, userId);
  }
}
