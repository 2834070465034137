package com.flamingo.ai.memorystore.service.embedding;

import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.exception.EmbeddingUnavailableException;
import com.flamingo.ai.memorystore.store.VectorMath;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Turns text into fixed-dimension vectors using the configured embedding model.
 *
 * <p>Every call is bounded by a timeout and every returned vector is checked: exactly one vector
 * per input, the configured dimension, finite components and non-zero magnitude. Any failure is
 * reported as {@link EmbeddingUnavailableException}. The gateway never retries.
 */
@Service
@Slf4j
public class EmbeddingGateway {

  private final EmbeddingModel embeddingModel;
  private final AsyncTaskExecutor embeddingExecutor;
  private final MeterRegistry meterRegistry;
  private final int dimensions;
  private final Duration defaultTimeout;
  private final int maxInputChars;

  public EmbeddingGateway(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingExecutor") AsyncTaskExecutor embeddingExecutor,
      MeterRegistry meterRegistry,
      RetrievalConfig retrievalConfig) {
    this.embeddingModel = embeddingModel;
    this.embeddingExecutor = embeddingExecutor;
    this.meterRegistry = meterRegistry;
    this.dimensions = retrievalConfig.getEmbedding().getDimensions();
    this.defaultTimeout = retrievalConfig.getEmbedding().getTimeout();
    this.maxInputChars = retrievalConfig.getEmbedding().getMaxInputChars();
  }

  /**
   * Embeds one text within the configured timeout.
   *
   * @param text the text to embed
   * @return a vector of the configured dimension
   */
  @Timed(value = "embedding.embedOne", description = "Time to embed one text")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedOneFallback")
  public float[] embedOne(String text) {
    return doEmbedOne(text, defaultTimeout);
  }

  /**
   * Embeds several texts in one model call within the configured timeout.
   *
   * @param texts the texts to embed
   * @return one vector per input, in input order
   */
  @Timed(value = "embedding.embedMany", description = "Time to embed a batch")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedManyFallback")
  public List<float[]> embedMany(List<String> texts) {
    return doEmbedMany(texts, defaultTimeout);
  }

  private float[] doEmbedOne(String text, Duration timeout) {
    String input = truncate(text, 0);
    log.debug("embedOne called, input length: {} chars", input.length());
    Response<Embedding> response = callModel(() -> embeddingModel.embed(input), timeout);
    if (response == null || response.content() == null) {
      throw malformed("model returned no embedding");
    }
    float[] vector = validate(response.content().vector(), 0);
    meterRegistry.counter("embedding.requests.success", "type", "one").increment();
    return vector;
  }

  private List<float[]> doEmbedMany(List<String> texts, Duration timeout) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      segments.add(TextSegment.from(truncate(texts.get(i), i)));
    }
    log.debug("embedMany called for {} texts", segments.size());
    Response<List<Embedding>> response =
        callModel(() -> embeddingModel.embedAll(segments), timeout);
    if (response == null || response.content() == null) {
      throw malformed("model returned no embeddings");
    }
    List<Embedding> embeddings = response.content();
    if (embeddings.size() != texts.size()) {
      throw malformed(
          "model returned " + embeddings.size() + " embeddings for " + texts.size() + " inputs");
    }
    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (int i = 0; i < embeddings.size(); i++) {
      Embedding embedding = embeddings.get(i);
      if (embedding == null) {
        throw malformed("model returned no embedding for input " + i);
      }
      vectors.add(validate(embedding.vector(), i));
    }
    meterRegistry.counter("embedding.requests.success", "type", "many").increment();
    return vectors;
  }

  private <V> V callModel(Callable<V> call, Duration timeout) {
    Future<V> future;
    try {
      future = embeddingExecutor.submit(call);
    } catch (RejectedExecutionException e) {
      throw new EmbeddingUnavailableException("Embedding executor rejected the request", e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Embedding call timed out after {}", timeout);
      throw new EmbeddingUnavailableException("Embedding call timed out after " + timeout, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new EmbeddingUnavailableException("Interrupted while waiting for embedding", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new EmbeddingUnavailableException(
          "Embedding model call failed: " + cause.getMessage(), cause);
    }
  }

  private float[] validate(float[] vector, int index) {
    if (vector == null || vector.length != dimensions) {
      throw malformed(
          String.format(
              "embedding %d has dimension %d, expected %d",
              index, vector == null ? 0 : vector.length, dimensions));
    }
    if (!VectorMath.isUsable(vector)) {
      throw malformed("embedding " + index + " is zero-magnitude or has non-finite values");
    }
    return vector;
  }

  private String truncate(String text, int index) {
    if (text.length() > maxInputChars) {
      log.warn(
          "Input {} too long for embedding, truncating from {} chars to {} chars",
          index,
          text.length(),
          maxInputChars);
      return text.substring(0, maxInputChars);
    }
    return text;
  }

  private EmbeddingUnavailableException malformed(String detail) {
    return new EmbeddingUnavailableException("Malformed embedding response: " + detail);
  }

  @SuppressWarnings("unused")
  private float[] embedOneFallback(String text, Throwable t) {
    throw unavailable(t, 1);
  }

  @SuppressWarnings("unused")
  private List<float[]> embedManyFallback(List<String> texts, Throwable t) {
    throw unavailable(t, texts.size());
  }

  private EmbeddingUnavailableException unavailable(Throwable t, int count) {
    log.error("Embedding failed for {} input(s): {}", count, t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof EmbeddingUnavailableException e) {
      return e;
    }
    return new EmbeddingUnavailableException("Embedding service unavailable: " + t.getMessage(), t);
  }
}
