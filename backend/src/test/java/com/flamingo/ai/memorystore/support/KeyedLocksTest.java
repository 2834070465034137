package com.flamingo.ai.memorystore.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.memorystore.exception.StoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KeyedLocks Tests")
class KeyedLocksTest {

  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("Should return the action result")
  void shouldReturnActionResult() {
    KeyedLocks locks = new KeyedLocks(Duration.ofSeconds(1));

    assertThat(locks.withLock("k", () -> 42)).isEqualTo(42);
  }

  @Test
  @DisplayName("Should fail with store unavailable when the lock is held past the timeout")
  void shouldTimeOutWhileLockHeld() throws Exception {
    KeyedLocks locks = new KeyedLocks(Duration.ofMillis(100));
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);

    Future<Boolean> holder =
        executor.submit(
            () ->
                locks.withLock(
                    KeyedLocks.turnKey("alice"),
                    () -> {
                      held.countDown();
                      try {
                        return release.await(5, TimeUnit.SECONDS);
                      } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                      }
                    }));
    assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

    assertThatThrownBy(() -> locks.withLock(KeyedLocks.turnKey("alice"), () -> "never"))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessageContaining("turn:alice");

    release.countDown();
    assertThat(holder.get(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  @DisplayName("Should not block work on a different key")
  void shouldNotBlockDifferentKeys() throws Exception {
    KeyedLocks locks = new KeyedLocks(Duration.ofMillis(200));
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);

    executor.submit(
        () ->
            locks.withLock(
                KeyedLocks.turnKey("alice"),
                () -> {
                  held.countDown();
                  try {
                    return release.await(5, TimeUnit.SECONDS);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                  }
                }));
    assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(locks.withLock(KeyedLocks.turnKey("bob"), () -> "bob")).isEqualTo("bob");
    release.countDown();
  }

  @Test
  @DisplayName("Should serialize actions on the same key")
  void shouldSerializeSameKey() throws Exception {
    KeyedLocks locks = new KeyedLocks(Duration.ofSeconds(5));
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();

    Future<?>[] futures = new Future<?>[4];
    for (int i = 0; i < futures.length; i++) {
      futures[i] =
          executor.submit(
              () ->
                  locks.withLock(
                      KeyedLocks.documentKey("doc.pdf", "alice"),
                      () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        try {
                          Thread.sleep(20);
                        } catch (InterruptedException e) {
                          Thread.currentThread().interrupt();
                        }
                        return inside.decrementAndGet();
                      }));
    }
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }

    assertThat(maxInside.get()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should keep document keys distinct when parts run together")
  void shouldKeepDocumentKeysDistinct() {
    assertThat(KeyedLocks.documentKey("a", "bc")).isNotEqualTo(KeyedLocks.documentKey("ab", "c"));
  }
}
