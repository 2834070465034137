package com.flamingo.ai.memorystore.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document fragment. Distance is present on retrieval results only. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentFragmentResponse {

  private String id;
  private String text;
  private String owner;
  private String source;
  private Visibility visibility;
  private Map<String, String> metadata;
  private Double distance;

  /** Creates a DocumentFragmentResponse from a stored fragment. */
  public static DocumentFragmentResponse fromEntity(DocumentFragment fragment) {
    return DocumentFragmentResponse.builder()
        .id(fragment.getId())
        .text(fragment.getText())
        .owner(fragment.getOwnerId())
        .source(fragment.getSource())
        .visibility(fragment.getVisibility())
        .metadata(fragment.getMetadata())
        .distance(fragment.getDistance())
        .build();
  }
}
