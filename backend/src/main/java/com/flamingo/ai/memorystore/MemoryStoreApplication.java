package com.flamingo.ai.memorystore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Vector memory store: per-user conversation memory and document retrieval. */
@SpringBootApplication
public class MemoryStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(MemoryStoreApplication.class, args);
  }
}
