package com.flamingo.ai.memorystore.store.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for document fragments.
 *
 * <p>Owner, source and visibility are keyword fields so that scope filters are exact term matches.
 * Metadata is stored as-is and never indexed.
 */
@Service
@ConditionalOnProperty(name = "retrieval.store.type", havingValue = "elasticsearch")
public class DocumentFragmentIndexService
    extends AbstractElasticsearchVectorRecordStore<DocumentFragment> {

  private static final String TEXT_FIELD = "text";
  private static final String METADATA_FIELD = "metadata";

  private final String indexName;
  private final int vectorDimensions;

  public DocumentFragmentIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry,
      RetrievalConfig retrievalConfig,
      Clock clock) {
    super(elasticsearchClient, meterRegistry, circuitBreakerRegistry, clock);
    this.indexName = retrievalConfig.getStore().getElasticsearch().getFragmentIndexName();
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
    return "document_fragment";
  }

  @Override
  protected Map<String, Property> defineKindProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(RecordField.SOURCE.getFieldName(), Property.of(p -> p.keyword(k -> k)));
    properties.put(RecordField.VISIBILITY.getFieldName(), Property.of(p -> p.keyword(k -> k)));
    properties.put(TEXT_FIELD, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(METADATA_FIELD, Property.of(p -> p.object(o -> o.enabled(false))));
    return properties;
  }

  @Override
  protected void writeKindFields(DocumentFragment fragment, Map<String, Object> document) {
    document.put(RecordField.SOURCE.getFieldName(), fragment.getSource());
    document.put(RecordField.VISIBILITY.getFieldName(), fragment.getVisibility().name());
    document.put(TEXT_FIELD, fragment.getText());
    document.put(METADATA_FIELD, fragment.getMetadata());
  }

  @Override
  protected DocumentFragment readKindFields(Map<String, Object> source) {
    Object visibility = source.get(RecordField.VISIBILITY.getFieldName());
    return DocumentFragment.builder()
        .ownerId((String) source.get(RecordField.OWNER.getFieldName()))
        .source((String) source.get(RecordField.SOURCE.getFieldName()))
        .visibility(visibility != null ? Visibility.valueOf(visibility.toString()) : null)
        .text((String) source.get(TEXT_FIELD))
        .embedding(readEmbedding(source))
        .metadata(readMetadata(source.get(METADATA_FIELD)))
        .build();
  }

  private static Map<String, String> readMetadata(Object value) {
    if (!(value instanceof Map<?, ?> raw)) {
      return Map.of();
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    raw.forEach((k, v) -> metadata.put(String.valueOf(k), v != null ? v.toString() : null));
    return metadata;
  }
}
