package com.flamingo.ai.memorystore.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingGateway Tests")
class EmbeddingGatewayTest {

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private ThreadPoolTaskExecutor executor;
  private EmbeddingGateway gateway;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setThreadNamePrefix("embedding-test-");
    executor.initialize();
    gateway = gatewayWithTimeout(Duration.ofSeconds(5));
  }

  private EmbeddingGateway gatewayWithTimeout(Duration timeout) {
    RetrievalConfig config = new RetrievalConfig();
    config.getEmbedding().setDimensions(3);
    config.getEmbedding().setMaxInputChars(100);
    config.getEmbedding().setTimeout(timeout);
    return new EmbeddingGateway(embeddingModel, executor, meterRegistry, config);
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  private static Response<Embedding> response(float... vector) {
    return Response.from(Embedding.from(vector));
  }

  @Nested
  @DisplayName("embedOne")
  class EmbedOne {

    @Test
    @DisplayName("Should return the model's vector")
    void shouldReturnVector() {
      when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f, 0.3f));

      float[] vector = gateway.embedOne("hello");

      assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f);
      assertThat(meterRegistry.counter("embedding.requests.success", "type", "one").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a vector of the wrong dimension")
    void shouldRejectWrongDimension() {
      when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f));

      assertThatThrownBy(() -> gateway.embedOne("hello"))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasMessageContaining("dimension 2, expected 3");
    }

    @Test
    @DisplayName("Should reject a zero-magnitude vector")
    void shouldRejectZeroVector() {
      when(embeddingModel.embed(anyString())).thenReturn(response(0f, 0f, 0f));

      assertThatThrownBy(() -> gateway.embedOne("hello"))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasMessageContaining("zero-magnitude");
    }

    @Test
    @DisplayName("Should reject non-finite values")
    void shouldRejectNonFinite() {
      when(embeddingModel.embed(anyString())).thenReturn(response(Float.NaN, 0.2f, 0.3f));

      assertThatThrownBy(() -> gateway.embedOne("hello"))
          .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    @DisplayName("Should wrap model failures")
    void shouldWrapModelFailure() {
      RuntimeException failure = new RuntimeException("connection refused");
      when(embeddingModel.embed(anyString())).thenThrow(failure);

      assertThatThrownBy(() -> gateway.embedOne("hello"))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasCause(failure);
    }

    @Test
    @DisplayName("Should fail when the model does not answer within the timeout")
    void shouldTimeOut() {
      when(embeddingModel.embed(anyString()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(2000);
                return response(0.1f, 0.2f, 0.3f);
              });

      EmbeddingGateway impatient = gatewayWithTimeout(Duration.ofMillis(50));

      assertThatThrownBy(() -> impatient.embedOne("hello"))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("Should truncate input longer than the configured limit")
    void shouldTruncateLongInput() {
      when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f, 0.3f));

      gateway.embedOne("x".repeat(250));

      ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
      verify(embeddingModel).embed(captor.capture());
      assertThat(captor.getValue()).hasSize(100);
    }
  }

  @Nested
  @DisplayName("embedMany")
  class EmbedMany {

    @Test
    @DisplayName("Should embed all texts in one call and keep input order")
    void shouldEmbedInOneCall() {
      when(embeddingModel.embedAll(anyList()))
          .thenReturn(
              Response.from(
                  List.of(
                      Embedding.from(new float[] {1f, 0f, 0f}),
                      Embedding.from(new float[] {0f, 1f, 0f}))));

      List<float[]> vectors = gateway.embedMany(List.of("first", "second"));

      assertThat(vectors).hasSize(2);
      assertThat(vectors.get(0)).containsExactly(1f, 0f, 0f);
      assertThat(vectors.get(1)).containsExactly(0f, 1f, 0f);

      @SuppressWarnings("unchecked")
      ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
      verify(embeddingModel, times(1)).embedAll(captor.capture());
      assertThat(captor.getValue())
          .extracting(TextSegment::text)
          .containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should fail when the model returns fewer vectors than inputs")
    void shouldRejectCountMismatch() {
      when(embeddingModel.embedAll(anyList()))
          .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f, 0f, 0f}))));

      assertThatThrownBy(() -> gateway.embedMany(List.of("first", "second")))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasMessageContaining("1 embeddings for 2 inputs");
    }

    @Test
    @DisplayName("Should fail the whole batch when one vector is malformed")
    void shouldRejectMalformedMember() {
      when(embeddingModel.embedAll(anyList()))
          .thenReturn(
              Response.from(
                  List.of(
                      Embedding.from(new float[] {1f, 0f, 0f}),
                      Embedding.from(new float[] {0f, 0f, 0f}))));

      assertThatThrownBy(() -> gateway.embedMany(List.of("first", "second")))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasMessageContaining("embedding 1");
    }

    @Test
    @DisplayName("Should not call the model for an empty batch")
    void shouldSkipEmptyBatch() {
      assertThat(gateway.embedMany(List.of())).isEmpty();
      verify(embeddingModel, never()).embedAll(anyList());
    }

    @Test
    @DisplayName("Should fail the batch when the model does not answer within the timeout")
    void shouldTimeOutBatch() {
      when(embeddingModel.embedAll(anyList()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(2000);
                return Response.from(List.of(Embedding.from(new float[] {1f, 0f, 0f})));
              });
      EmbeddingGateway impatient = gatewayWithTimeout(Duration.ofMillis(50));

      assertThatThrownBy(() -> impatient.embedMany(List.of("first")))
          .isInstanceOf(EmbeddingUnavailableException.class)
          .hasMessageContaining("timed out");
    }
  }
}
