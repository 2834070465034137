package com.flamingo.ai.memorystore.api.rest;

import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.service.retrieval.RetrievalEngine;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final RetrievalConfig retrievalConfig;
  private final RetrievalEngine retrievalEngine;

  /** Returns a simple health check response with the active store settings. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "memory-store");
    health.put("storeType", retrievalConfig.getStore().getType());
    health.put("dimensions", retrievalConfig.getEmbedding().getDimensions());
    health.put("historyCapacity", retrievalConfig.getMemory().getHistoryCapacity());
    return ResponseEntity.ok(health);
  }

  /** Returns store statistics. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("usersWithHistory", retrievalEngine.usersWithHistory().size());
    stats.put("sources", retrievalEngine.listSources().size());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
