package com.flamingo.ai.memorystore.config;

import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import com.flamingo.ai.memorystore.store.VectorRecordStore;
import com.flamingo.ai.memorystore.store.memory.InMemoryVectorRecordStore;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Store wiring.
 *
 * <p>The in-memory stores are the default backend. Setting {@code retrieval.store.type} to {@code
 * elasticsearch} replaces them with the Elasticsearch index services.
 */
@Configuration
public class VectorStoreConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(
      name = "retrieval.store.type",
      havingValue = "memory",
      matchIfMissing = true)
  public VectorRecordStore<ConversationTurn> conversationTurnStore(
      RetrievalConfig retrievalConfig, Clock clock) {
    return new InMemoryVectorRecordStore<>(
        "conversation-turns", retrievalConfig.getEmbedding().getDimensions(), clock);
  }

  @Bean
  @ConditionalOnProperty(
      name = "retrieval.store.type",
      havingValue = "memory",
      matchIfMissing = true)
  public VectorRecordStore<DocumentFragment> documentFragmentStore(
      RetrievalConfig retrievalConfig, Clock clock) {
    return new InMemoryVectorRecordStore<>(
        "document-fragments", retrievalConfig.getEmbedding().getDimensions(), clock);
  }
}
