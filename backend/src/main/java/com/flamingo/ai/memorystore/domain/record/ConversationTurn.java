package com.flamingo.ai.memorystore.domain.record;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/** A single conversational turn of a user, stored with its embedding. */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "embedding")
public class ConversationTurn implements VectorRecord<ConversationTurn> {

  private String id;

  /** User this turn belongs to. */
  private String ownerId;

  /** Raw turn text. */
  private String text;

  private float[] embedding;

  /** Creation time (epoch milliseconds). */
  private Long createdAt;

  private Long sequence;

  private Double distance;

  @Override
  public String attribute(RecordField field) {
    return switch (field) {
      case ID -> id;
      case OWNER -> ownerId;
      case SOURCE, VISIBILITY -> null;
    };
  }

  @Override
  public ConversationTurn copy() {
    return toBuilder().embedding(embedding != null ? embedding.clone() : null).build();
  }
}
