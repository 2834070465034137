package com.flamingo.ai.memorystore.service.retrieval;

import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import com.flamingo.ai.memorystore.exception.DimensionMismatchException;
import com.flamingo.ai.memorystore.exception.EmbeddingUnavailableException;
import com.flamingo.ai.memorystore.exception.RetrievalRejectedException;
import com.flamingo.ai.memorystore.exception.RetrievalUnavailableException;
import com.flamingo.ai.memorystore.exception.StoreUnavailableException;
import com.flamingo.ai.memorystore.service.document.DocumentRetrievalService;
import com.flamingo.ai.memorystore.service.document.FragmentInput;
import com.flamingo.ai.memorystore.service.document.SourceListing;
import com.flamingo.ai.memorystore.service.memory.ConversationMemoryService;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of RetrievalEngine.
 *
 * <p>Operations that embed text run under the {@code embedding} retry, which only re-runs a call
 * that failed with {@link EmbeddingUnavailableException}. Embedding always happens before the
 * store is touched, so a retried call has written nothing.
 */
@Service
@Slf4j
public class RetrievalEngineImpl implements RetrievalEngine {

  private final ConversationMemoryService conversationMemoryService;
  private final DocumentRetrievalService documentRetrievalService;
  private final RetrievalConfig retrievalConfig;
  private final MeterRegistry meterRegistry;
  private final Retry embeddingRetry;

  public RetrievalEngineImpl(
      ConversationMemoryService conversationMemoryService,
      DocumentRetrievalService documentRetrievalService,
      RetrievalConfig retrievalConfig,
      MeterRegistry meterRegistry,
      RetryRegistry retryRegistry) {
    this.conversationMemoryService = conversationMemoryService;
    this.documentRetrievalService = documentRetrievalService;
    this.retrievalConfig = retrievalConfig;
    this.meterRegistry = meterRegistry;
    this.embeddingRetry = retryRegistry.retry("embedding");
  }

  @Override
  @Timed(value = "retrieval.recordTurn", description = "Time to record a conversation turn")
  public ConversationTurn recordTurn(String userId, String text) {
    requireText(userId, "userId");
    requireText(text, "text");
    return withRetry(() -> conversationMemoryService.recordTurn(userId, text));
  }

  @Override
  @Timed(value = "retrieval.recall", description = "Time to recall conversation turns")
  public List<ConversationTurn> recall(String userId, String query, Integer k) {
    requireText(userId, "userId");
    requireText(query, "query");
    int topK = resolveTopK(k);
    return withRetry(() -> conversationMemoryService.recall(userId, query, topK));
  }

  @Override
  public List<ConversationTurn> history(String userId) {
    requireText(userId, "userId");
    return translate(() -> conversationMemoryService.history(userId));
  }

  @Override
  public long clearHistory(String userId) {
    requireText(userId, "userId");
    return translate(() -> conversationMemoryService.clear(userId));
  }

  @Override
  public long clearAllHistory() {
    return translate(conversationMemoryService::clearAll);
  }

  @Override
  public List<String> usersWithHistory() {
    return translate(conversationMemoryService::usersWithHistory);
  }

  @Override
  public long historyCount(String userId) {
    requireText(userId, "userId");
    return translate(() -> conversationMemoryService.count(userId));
  }

  @Override
  @Timed(value = "retrieval.ingest", description = "Time to ingest document fragments")
  public List<DocumentFragment> ingest(
      List<FragmentInput> fragments, String userId, String source, Visibility visibility) {
    requireText(userId, "userId");
    requireText(source, "source");
    if (visibility == null) {
      throw invalid("visibility is required");
    }
    if (fragments == null || fragments.isEmpty()) {
      throw invalid("at least one fragment is required");
    }
    for (int i = 0; i < fragments.size(); i++) {
      FragmentInput fragment = fragments.get(i);
      if (fragment == null || fragment.text() == null || fragment.text().isBlank()) {
        throw invalid("fragment " + i + " has no text");
      }
    }
    List<FragmentInput> batch = List.copyOf(fragments);
    return withRetry(() -> documentRetrievalService.ingest(batch, userId, source, visibility));
  }

  @Override
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve document fragments")
  public List<DocumentFragment> retrieve(String userId, String query, Integer k) {
    requireText(userId, "userId");
    requireText(query, "query");
    int topK = resolveTopK(k);
    return withRetry(() -> documentRetrievalService.retrieve(userId, query, topK));
  }

  @Override
  public List<SourceListing> listSources() {
    return translate(documentRetrievalService::listSources);
  }

  @Override
  public long purgeBySource(String source) {
    requireText(source, "source");
    return translate(() -> documentRetrievalService.purgeBySource(source));
  }

  @Override
  public long purgeBySourceAndUser(String source, String userId) {
    requireText(source, "source");
    requireText(userId, "userId");
    return translate(() -> documentRetrievalService.purgeBySourceAndUser(source, userId));
  }

  @Override
  public long purgeByUser(String userId) {
    requireText(userId, "userId");
    return translate(() -> documentRetrievalService.purgeByUser(userId));
  }

  @Override
  public long purgeAll() {
    return translate(documentRetrievalService::purgeAll);
  }

  private <V> V withRetry(Supplier<V> action) {
    return translate(Retry.decorateSupplier(embeddingRetry, action));
  }

  private <V> V translate(Supplier<V> action) {
    try {
      return action.get();
    } catch (EmbeddingUnavailableException e) {
      log.warn("Embedding unavailable: {}", e.getMessage());
      meterRegistry.counter("retrieval.errors", "type", "embedding_unavailable").increment();
      throw new RetrievalUnavailableException(
          RetrievalUnavailableException.Dependency.EMBEDDING, e.getMessage(), e);
    } catch (StoreUnavailableException e) {
      log.warn("Vector store unavailable: {}", e.getMessage());
      meterRegistry.counter("retrieval.errors", "type", "store_unavailable").increment();
      throw new RetrievalUnavailableException(
          RetrievalUnavailableException.Dependency.STORE, e.getMessage(), e);
    } catch (DimensionMismatchException e) {
      log.error(
          "Dimension mismatch: expected {} but got {}: {}",
          e.getExpected(),
          e.getActual(),
          e.getMessage());
      meterRegistry.counter("retrieval.errors", "type", "dimension_mismatch").increment();
      throw new RetrievalRejectedException(
          RetrievalRejectedException.Reason.DIMENSION_MISMATCH, e.getMessage(), e);
    }
  }

  private int resolveTopK(Integer k) {
    if (k == null) {
      return retrievalConfig.getDefaultTopK();
    }
    if (k <= 0) {
      throw invalid("k must be positive: " + k);
    }
    return k;
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw invalid(name + " must not be blank");
    }
  }

  private RetrievalRejectedException invalid(String message) {
    meterRegistry.counter("retrieval.errors", "type", "invalid_request").increment();
    return new RetrievalRejectedException(
        RetrievalRejectedException.Reason.INVALID_REQUEST, message);
  }
}
