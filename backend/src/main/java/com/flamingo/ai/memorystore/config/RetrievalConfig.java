package com.flamingo.ai.memorystore.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval engine. */
@Configuration
@ConfigurationProperties(prefix = "retrieval")
@Getter
@Setter
public class RetrievalConfig {

  /** Number of results returned by recall/retrieve when the caller does not ask for a count. */
  private int defaultTopK = 3;

  /** Longest a write waits for its per-key critical section before failing. */
  private Duration lockTimeout = Duration.ofSeconds(60);

  private Memory memory = new Memory();
  private Embedding embedding = new Embedding();
  private Store store = new Store();

  @Getter
  @Setter
  public static class Memory {
    /** Maximum stored conversation turns per user; older turns are evicted first. */
    private int historyCapacity = 10;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Dimension D of every embedding in the store. Must match the embedding model. */
    private int dimensions = 1536;

    /** Default bound on a single embedding call. */
    private Duration timeout = Duration.ofSeconds(30);

    private int maxInputChars = 8000;
  }

  @Getter
  @Setter
  public static class Store {
    /** Store backend: "memory" (default) or "elasticsearch". */
    private String type = "memory";

    private Elasticsearch elasticsearch = new Elasticsearch();

    @Getter
    @Setter
    public static class Elasticsearch {
      private String turnIndexName = "memory-conversation-turns";
      private String fragmentIndexName = "memory-document-fragments";
    }
  }
}
