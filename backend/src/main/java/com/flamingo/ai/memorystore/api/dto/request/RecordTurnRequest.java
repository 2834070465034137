package com.flamingo.ai.memorystore.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for recording a conversation turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordTurnRequest {

  @NotBlank(message = "Text is required")
  private String text;
}
