package com.flamingo.ai.memorystore.support;

import com.flamingo.ai.memorystore.config.RetrievalConfig;
import com.flamingo.ai.memorystore.exception.StoreUnavailableException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Mutual exclusion per string key.
 *
 * <p>Each key gets its own lock, so work on different keys never waits. Locks are weakly held and
 * disappear once no thread holds or waits on them.
 */
@Component
@Slf4j
public class KeyedLocks {

  private final LoadingCache<String, ReentrantLock> locks =
      CacheBuilder.newBuilder()
          .weakValues()
          .build(
              new CacheLoader<>() {
                @Override
                public ReentrantLock load(String key) {
                  return new ReentrantLock();
                }
              });

  private final Duration timeout;

  @Autowired
  public KeyedLocks(RetrievalConfig retrievalConfig) {
    this(retrievalConfig.getLockTimeout());
  }

  @VisibleForTesting
  public KeyedLocks(Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * Runs the action while holding the lock for the key.
   *
   * @param key the lock key
   * @param action the critical section
   * @return the action's result
   * @throws StoreUnavailableException if the lock is not acquired within the timeout or the thread
   *     is interrupted while waiting
   */
  public <V> V withLock(String key, Supplier<V> action) {
    ReentrantLock lock = locks.getUnchecked(key);
    boolean acquired;
    try {
      acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException("Interrupted while waiting for lock on " + key, e);
    }
    if (!acquired) {
      log.warn("Timed out after {} waiting for lock on {}", timeout, key);
      throw new StoreUnavailableException("Timed out waiting for lock on " + key);
    }
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Key for the per-user conversation critical section. */
  public static String turnKey(String userId) {
    return "turn:" + userId;
  }

  /** Key for the per-(source, user) ingestion critical section. */
  public static String documentKey(String source, String userId) {
    return "doc:" + source + '\u0000' + userId;
  }
}
