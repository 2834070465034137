package com.flamingo.ai.memorystore.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for conversation turns.
 *
 * <p>Stores each user's recent turns with their embeddings for semantic recall over conversation
 * history.
 */
@Service
@ConditionalOnProperty(name = "retrieval.store.type", havingValue = "elasticsearch")
public class ConversationTurnIndexService
    extends AbstractElasticsearchVectorRecordStore<ConversationTurn> {

  private static final String TEXT_FIELD = "text";

  private final String indexName;
  private final int vectorDimensions;

  public ConversationTurnIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry,
      RetrievalConfig retrievalConfig,
      Clock clock) {
    super(elasticsearchClient, meterRegistry, circuitBreakerRegistry, clock);
    this.indexName = retrievalConfig.getStore().getElasticsearch().getTurnIndexName();
    this.vectorDimensions = retrievalConfig.getEmbedding().getDimensions();
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  public int dimensions() {
    return vectorDimensions;
  }

  @Override
  protected String getMetricPrefix() {
    return "conversation_turn";
  }

  @Override
  protected Map<String, Property> defineKindProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(TEXT_FIELD, Property.of(p -> p.text(TextProperty.of(t -> t))));
    return properties;
  }

  @Override
  protected void writeKindFields(ConversationTurn turn, Map<String, Object> document) {
    document.put(TEXT_FIELD, turn.getText());
  }

  @Override
  protected ConversationTurn readKindFields(Map<String, Object> source) {
    return ConversationTurn.builder()
        .ownerId((String) source.get(RecordField.OWNER.getFieldName()))
        .text((String) source.get(TEXT_FIELD))
        .embedding(readEmbedding(source))
        .build();
  }
}
