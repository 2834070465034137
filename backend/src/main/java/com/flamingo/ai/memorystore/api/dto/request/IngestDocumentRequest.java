package com.flamingo.ai.memorystore.api.dto.request;

import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.service.document.FragmentInput;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting the pre-chunked fragments of one source document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestDocumentRequest {

  @NotBlank(message = "Source is required")
  private String source;

  @NotNull(message = "Visibility is required")
  private Visibility visibility;

  @NotEmpty(message = "At least one fragment is required")
  @Valid
  private List<Fragment> fragments;

  /** Converts the request fragments to service inputs. */
  public List<FragmentInput> toFragmentInputs() {
    return fragments.stream().map(f -> new FragmentInput(f.getText(), f.getMetadata())).toList();
  }

  /** One fragment of the document. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Fragment {

    @NotBlank(message = "Fragment text is required")
    private String text;

    private Map<String, String> metadata;
  }
}
