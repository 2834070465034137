package com.flamingo.ai.memorystore.api.dto.response;

import com.flamingo.ai.memorystore.service.document.SourceListing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored source document and its uploader. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResponse {

  private String source;
  private String uploader;

  public static SourceResponse fromListing(SourceListing listing) {
    return new SourceResponse(listing.source(), listing.uploader());
  }
}
