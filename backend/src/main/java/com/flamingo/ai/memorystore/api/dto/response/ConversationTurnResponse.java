package com.flamingo.ai.memorystore.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversation turn. Distance is present on recall results only. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationTurnResponse {

  private String id;
  private String text;
  private String owner;
  private Instant timestamp;
  private Double distance;

  /** Creates a ConversationTurnResponse from a stored turn. */
  public static ConversationTurnResponse fromEntity(ConversationTurn turn) {
    return ConversationTurnResponse.builder()
        .id(turn.getId())
        .text(turn.getText())
        .owner(turn.getOwnerId())
        .timestamp(turn.getCreatedAt() != null ? Instant.ofEpochMilli(turn.getCreatedAt()) : null)
        .distance(turn.getDistance())
        .build();
  }
}
