package com.flamingo.ai.memorystore.domain.record;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.enums.Visibility;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One chunk of an ingested source document, stored with its embedding.
 *
 * <p>Owner, source, visibility and text have no setters: they are fixed when the fragment is built.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "embedding")
public class DocumentFragment implements VectorRecord<DocumentFragment> {

  @Setter private String id;

  /** User who uploaded the source document. */
  private String ownerId;

  /** Name of the source document. */
  private String source;

  private Visibility visibility;

  /** Fragment text. */
  private String text;

  private float[] embedding;

  /** Free-form metadata, kept exactly as supplied. */
  @Builder.Default private Map<String, String> metadata = Map.of();

  /** Creation time (epoch milliseconds). */
  @Setter private Long createdAt;

  @Setter private Long sequence;

  @Setter private Double distance;

  @Override
  public String attribute(RecordField field) {
    return switch (field) {
      case ID -> id;
      case OWNER -> ownerId;
      case SOURCE -> source;
      case VISIBILITY -> visibility != null ? visibility.name() : null;
    };
  }

  @Override
  public DocumentFragment copy() {
    return toBuilder()
        .embedding(embedding != null ? embedding.clone() : null)
        .metadata(metadata != null ? new LinkedHashMap<>(metadata) : Map.of())
        .build();
  }
}
