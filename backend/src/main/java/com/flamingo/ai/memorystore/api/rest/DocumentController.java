package com.flamingo.ai.memorystore.api.rest;

import com.flamingo.ai.memorystore.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.memorystore.api.dto.response.DeletionResponse;
import com.flamingo.ai.memorystore.api.dto.response.DocumentFragmentResponse;
import com.flamingo.ai.memorystore.api.dto.response.SourceResponse;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import com.flamingo.ai.memorystore.service.retrieval.RetrievalEngine;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document fragment ingestion, retrieval and purging. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

  private final RetrievalEngine retrievalEngine;

  /**
   * Ingests the pre-chunked fragments of one source document.
   *
   * @param userId the uploading user
   * @param request source, visibility and fragments
   * @return the stored fragments
   */
  @PostMapping("/users/{userId}/documents")
  public ResponseEntity<List<DocumentFragmentResponse>> ingest(
      @PathVariable String userId, @Valid @RequestBody IngestDocumentRequest request) {
    log.info(
        "Ingesting {} fragments of '{}' for user {}",
        request.getFragments().size(),
        request.getSource(),
        userId);
    List<DocumentFragment> stored =
        retrievalEngine.ingest(
            request.toFragmentInputs(), userId, request.getSource(), request.getVisibility());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(stored.stream().map(DocumentFragmentResponse::fromEntity).toList());
  }

  /**
   * Retrieves the fragments closest to the query among the user's own and all shared fragments.
   *
   * @param userId the requesting user
   * @param query the query text
   * @param k maximum number of results (optional)
   * @return fragments with their distances, closest first
   */
  @GetMapping("/users/{userId}/documents/retrieve")
  public ResponseEntity<List<DocumentFragmentResponse>> retrieve(
      @PathVariable String userId,
      @RequestParam String query,
      @RequestParam(required = false) Integer k) {
    return ResponseEntity.ok(
        retrievalEngine.retrieve(userId, query, k).stream()
            .map(DocumentFragmentResponse::fromEntity)
            .toList());
  }

  /** Deletes the user's fragments, or only those of one source when a source is given. */
  @DeleteMapping("/users/{userId}/documents")
  public ResponseEntity<DeletionResponse> purgeForUser(
      @PathVariable String userId, @RequestParam(required = false) String source) {
    long deleted =
        source != null
            ? retrievalEngine.purgeBySourceAndUser(source, userId)
            : retrievalEngine.purgeByUser(userId);
    return ResponseEntity.ok(new DeletionResponse(deleted));
  }

  @GetMapping("/documents/sources")
  public ResponseEntity<List<SourceResponse>> listSources() {
    return ResponseEntity.ok(
        retrievalEngine.listSources().stream().map(SourceResponse::fromListing).toList());
  }

  /** Deletes every fragment, or every fragment of one source when a source is given. */
  @DeleteMapping("/documents")
  public ResponseEntity<DeletionResponse> purge(@RequestParam(required = false) String source) {
    long deleted =
        source != null ? retrievalEngine.purgeBySource(source) : retrievalEngine.purgeAll();
    return ResponseEntity.ok(new DeletionResponse(deleted));
  }
}
