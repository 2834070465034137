package com.flamingo.ai.memorystore.api.rest;

import com.flamingo.ai.memorystore.api.dto.request.RecordTurnRequest;
import com.flamingo.ai.memorystore.api.dto.response.ConversationTurnResponse;
import com.flamingo.ai.memorystore.api.dto.response.DeletionResponse;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import com.flamingo.ai.memorystore.service.retrieval.RetrievalEngine;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
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

/** REST controller for per-user conversation memory. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

  private final RetrievalEngine retrievalEngine;

  /**
   * Records a conversation turn, evicting the user's oldest turns beyond the history capacity.
   *
   * @param userId the user ID
   * @param request the turn text
   * @return the stored turn
   */
  @PostMapping("/users/{userId}/turns")
  public ResponseEntity<ConversationTurnResponse> recordTurn(
      @PathVariable String userId, @Valid @RequestBody RecordTurnRequest request) {
    log.debug("Recording turn for user {}", userId);
    ConversationTurn turn = retrievalEngine.recordTurn(userId, request.getText());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ConversationTurnResponse.fromEntity(turn));
  }

  /** Lists the user's stored turns, oldest first. */
  @GetMapping("/users/{userId}/turns")
  public ResponseEntity<List<ConversationTurnResponse>> history(@PathVariable String userId) {
    return ResponseEntity.ok(
        retrievalEngine.history(userId).stream()
            .map(ConversationTurnResponse::fromEntity)
            .toList());
  }

  /**
   * Recalls the user's turns closest to the query.
   *
   * @param userId the user ID
   * @param query the query text
   * @param k maximum number of results (optional)
   * @return turns with their distances, closest first
   */
  @GetMapping("/users/{userId}/turns/recall")
  public ResponseEntity<List<ConversationTurnResponse>> recall(
      @PathVariable String userId,
      @RequestParam String query,
      @RequestParam(required = false) Integer k) {
    return ResponseEntity.ok(
        retrievalEngine.recall(userId, query, k).stream()
            .map(ConversationTurnResponse::fromEntity)
            .toList());
  }

  @GetMapping("/users/{userId}/turns/count")
  public ResponseEntity<Map<String, Long>> count(@PathVariable String userId) {
    return ResponseEntity.ok(Map.of("count", retrievalEngine.historyCount(userId)));
  }

  @DeleteMapping("/users/{userId}/turns")
  public ResponseEntity<DeletionResponse> clearHistory(@PathVariable String userId) {
    return ResponseEntity.ok(new DeletionResponse(retrievalEngine.clearHistory(userId)));
  }

  @DeleteMapping("/turns")
  public ResponseEntity<DeletionResponse> clearAllHistory() {
    log.info("Clearing conversation history of all users");
    return ResponseEntity.ok(new DeletionResponse(retrievalEngine.clearAllHistory()));
  }

  /** Lists the users that have at least one stored turn. */
  @GetMapping("/turns/users")
  public ResponseEntity<List<String>> usersWithHistory() {
    return ResponseEntity.ok(retrievalEngine.usersWithHistory());
  }
}
