package com.flamingo.ai.memorystore.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for delete operations. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeletionResponse {

  /** Number of records removed. */
  private long deleted;
}
