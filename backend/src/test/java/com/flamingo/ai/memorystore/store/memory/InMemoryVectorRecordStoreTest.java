package com.flamingo.ai.memorystore.store.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.enums.Visibility;
import com.flamingo.ai.memorystore.domain.record.ConversationTurn;
import com.flamingo.ai.memorystore.domain.record.DocumentFragment;
import com.flamingo.ai.memorystore.exception.DimensionMismatchException;
import com.flamingo.ai.memorystore.store.RecordFilter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryVectorRecordStore Tests")
class InMemoryVectorRecordStoreTest {

  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  private InMemoryVectorRecordStore<ConversationTurn> turns;
  private InMemoryVectorRecordStore<DocumentFragment> fragments;

  @BeforeEach
  void setUp() {
    turns = new InMemoryVectorRecordStore<>("turns", 3, FIXED_CLOCK);
    fragments = new InMemoryVectorRecordStore<>("fragments", 3, FIXED_CLOCK);
  }

  private static ConversationTurn turn(String owner, String text, float... vector) {
    return ConversationTurn.builder().ownerId(owner).text(text).embedding(vector).build();
  }

  private static DocumentFragment fragment(
      String owner, String source, Visibility visibility, String text, float... vector) {
    return DocumentFragment.builder()
        .ownerId(owner)
        .source(source)
        .visibility(visibility)
        .text(text)
        .embedding(vector)
        .build();
  }

  private static RecordFilter ownedBy(String owner) {
    return RecordFilter.eq(RecordField.OWNER, owner);
  }

  @Nested
  @DisplayName("insert")
  class Insert {

    @Test
    @DisplayName("should assign id, creation time and increasing sequence")
    void shouldAssignIdentity() {
      ConversationTurn first = turn("alice", "hello", 1, 0, 0);
      ConversationTurn second = turn("alice", "again", 0, 1, 0);

      assertThat(turns.insert(first)).isTrue();
      assertThat(turns.insert(second)).isTrue();

      assertThat(first.getId()).isNotBlank();
      assertThat(first.getCreatedAt()).isEqualTo(FIXED_CLOCK.millis());
      assertThat(second.getSequence()).isGreaterThan(first.getSequence());
    }

    @Test
    @DisplayName("should ignore a record whose explicit id already exists")
    void shouldIgnoreDuplicateId() {
      ConversationTurn original = turn("alice", "original", 1, 0, 0);
      original.setId("t-1");
      ConversationTurn duplicate = turn("alice", "duplicate", 0, 1, 0);
      duplicate.setId("t-1");

      turns.insert(original);
      boolean inserted = turns.insert(duplicate);

      assertThat(inserted).isFalse();
      assertThat(turns.findWhere(RecordFilter.all()))
          .extracting(ConversationTurn::getText)
          .containsExactly("original");
    }

    @Test
    @DisplayName("should reject a vector of the wrong dimension without storing it")
    void shouldRejectWrongDimension() {
      assertThatThrownBy(() -> turns.insert(turn("alice", "bad", 1, 0)))
          .isInstanceOf(DimensionMismatchException.class)
          .hasMessageContaining("expected 3 but got 2")
          .satisfies(
              e -> {
                DimensionMismatchException mismatch = (DimensionMismatchException) e;
                assertThat(mismatch.getExpected()).isEqualTo(3);
                assertThat(mismatch.getActual()).isEqualTo(2);
              });

      assertThat(turns.countWhere(RecordFilter.all())).isZero();
    }

    @Test
    @DisplayName("should not share state with the caller's instance")
    void shouldCopyOnWrite() {
      float[] vector = {1, 0, 0};
      turns.insert(turn("alice", "hello", vector));
      vector[0] = 0;
      vector[1] = 1;

      List<ConversationTurn> nearest =
          turns.queryNearest(RecordFilter.all(), new float[] {1, 0, 0}, 1);

      assertThat(nearest.get(0).getDistance()).isCloseTo(0.0, within(1e-9));
    }
  }

  @Nested
  @DisplayName("insertAll")
  class InsertAll {

    @Test
    @DisplayName("should insert nothing when any record has the wrong dimension")
    void shouldBeAllOrNothing() {
      List<DocumentFragment> batch =
          List.of(
              fragment("alice", "a.pdf", Visibility.PRIVATE, "one", 1, 0, 0),
              fragment("alice", "a.pdf", Visibility.PRIVATE, "two", 0, 1, 0),
              fragment("alice", "a.pdf", Visibility.PRIVATE, "three", 0, 1));

      assertThatThrownBy(() -> fragments.insertAll(batch))
          .isInstanceOf(DimensionMismatchException.class);
      assertThat(fragments.countWhere(RecordFilter.all())).isZero();
    }

    @Test
    @DisplayName("should count repeated explicit ids in one batch once")
    void shouldCountRepeatedIdsOnce() {
      DocumentFragment first = fragment("alice", "a.pdf", Visibility.PRIVATE, "one", 1, 0, 0);
      first.setId("f-1");
      DocumentFragment repeat = fragment("alice", "a.pdf", Visibility.PRIVATE, "two", 0, 1, 0);
      repeat.setId("f-1");

      int inserted = fragments.insertAll(List.of(first, repeat));

      assertThat(inserted).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("insertEvictingOldest")
  class InsertEvictingOldest {

    @Test
    @DisplayName("should keep only the newest records of the scope")
    void shouldEvictOldestInScope() {
      for (int i = 1; i <= 5; i++) {
        turns.insertEvictingOldest(turn("alice", "msg" + i, 1, i, 0), ownedBy("alice"), 3);
      }

      assertThat(turns.findWhere(ownedBy("alice")))
          .extracting(ConversationTurn::getText)
          .containsExactly("msg3", "msg4", "msg5");
    }

    @Test
    @DisplayName("should return the evicted records")
    void shouldReturnEvicted() {
      turns.insertEvictingOldest(turn("alice", "msg1", 1, 0, 0), ownedBy("alice"), 1);

      List<ConversationTurn> evicted =
          turns.insertEvictingOldest(turn("alice", "msg2", 0, 1, 0), ownedBy("alice"), 1);

      assertThat(evicted).extracting(ConversationTurn::getText).containsExactly("msg1");
    }

    @Test
    @DisplayName("should leave records outside the scope untouched")
    void shouldNotTouchOtherScopes() {
      turns.insertEvictingOldest(turn("bob", "bob1", 1, 0, 0), ownedBy("bob"), 2);
      for (int i = 1; i <= 4; i++) {
        turns.insertEvictingOldest(turn("alice", "msg" + i, 0, 1, i), ownedBy("alice"), 2);
      }

      assertThat(turns.countWhere(ownedBy("bob"))).isEqualTo(1);
      assertThat(turns.countWhere(ownedBy("alice"))).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject a capacity below one")
    void shouldRejectZeroCapacity() {
      assertThatThrownBy(
              () -> turns.insertEvictingOldest(turn("alice", "x", 1, 0, 0), ownedBy("alice"), 0))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should never let a reader observe more records than the capacity")
    void shouldBoundConcurrentWriters() throws Exception {
      int capacity = 4;
      int writers = 8;
      int perWriter = 50;
      ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
      CountDownLatch start = new CountDownLatch(1);
      AtomicBoolean done = new AtomicBoolean(false);
      AtomicLong maxSeen = new AtomicLong();
      try {
        Future<?> reader =
            pool.submit(
                () -> {
                  while (!done.get()) {
                    maxSeen.accumulateAndGet(turns.countWhere(ownedBy("alice")), Math::max);
                    maxSeen.accumulateAndGet(turns.findWhere(ownedBy("alice")).size(), Math::max);
                  }
                });
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
          int writer = w;
          futures.add(
              pool.submit(
                  () -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                      turns.insertEvictingOldest(
                          turn("alice", writer + "-" + i, 1, writer, i),
                          ownedBy("alice"),
                          capacity);
                    }
                    return null;
                  }));
        }
        start.countDown();
        for (Future<?> future : futures) {
          future.get(30, TimeUnit.SECONDS);
        }
        done.set(true);
        reader.get(30, TimeUnit.SECONDS);
      } finally {
        pool.shutdownNow();
      }

      assertThat(maxSeen.get()).isLessThanOrEqualTo(capacity);
      assertThat(turns.countWhere(ownedBy("alice"))).isEqualTo(capacity);
    }
  }

  @Nested
  @DisplayName("queryNearest")
  class QueryNearest {

    @Test
    @DisplayName("should rank by ascending cosine distance and honour k")
    void shouldRankByDistance() {
      turns.insert(turn("alice", "far", 0, 0, 1));
      turns.insert(turn("alice", "exact", 1, 0, 0));
      turns.insert(turn("alice", "close", 1, 1, 0));

      List<ConversationTurn> results =
          turns.queryNearest(RecordFilter.all(), new float[] {1, 0, 0}, 2);

      assertThat(results).extracting(ConversationTurn::getText).containsExactly("exact", "close");
      assertThat(results.get(0).getDistance()).isLessThan(results.get(1).getDistance());
    }

    @Test
    @DisplayName("should break distance ties by insertion order")
    void shouldBreakTiesBySequence() {
      turns.insert(turn("alice", "first", 2, 0, 0));
      turns.insert(turn("alice", "second", 1, 0, 0));
      turns.insert(turn("alice", "third", 3, 0, 0));

      for (int run = 0; run < 5; run++) {
        assertThat(turns.queryNearest(RecordFilter.all(), new float[] {1, 0, 0}, 3))
            .extracting(ConversationTurn::getText)
            .containsExactly("first", "second", "third");
      }
    }

    @Test
    @DisplayName("should only consider records matching the filter")
    void shouldApplyFilter() {
      fragments.insert(fragment("alice", "a.pdf", Visibility.PRIVATE, "alice-private", 1, 0, 0));
      fragments.insert(fragment("bob", "b.pdf", Visibility.PRIVATE, "bob-private", 1, 0, 0));
      fragments.insert(fragment("bob", "b.pdf", Visibility.SHARED, "bob-shared", 0, 1, 0));

      RecordFilter visibleToAlice =
          RecordFilter.or(
              ownedBy("alice"), RecordFilter.eq(RecordField.VISIBILITY, Visibility.SHARED.name()));
      List<DocumentFragment> results =
          fragments.queryNearest(visibleToAlice, new float[] {1, 0, 0}, 10);

      assertThat(results)
          .extracting(DocumentFragment::getText)
          .containsExactly("alice-private", "bob-shared");
    }

    @Test
    @DisplayName("should return an empty list when nothing matches or k is zero")
    void shouldReturnEmpty() {
      turns.insert(turn("alice", "hello", 1, 0, 0));

      assertThat(turns.queryNearest(ownedBy("bob"), new float[] {1, 0, 0}, 3)).isEmpty();
      assertThat(turns.queryNearest(RecordFilter.all(), new float[] {1, 0, 0}, 0)).isEmpty();
    }

    @Test
    @DisplayName("should reject a query vector of the wrong dimension")
    void shouldRejectWrongQueryDimension() {
      assertThatThrownBy(() -> turns.queryNearest(RecordFilter.all(), new float[] {1, 0}, 3))
          .isInstanceOf(DimensionMismatchException.class);
    }
  }

  @Nested
  @DisplayName("deleteWhere, findWhere and distinct")
  class SetOperations {

    @Test
    @DisplayName("should delete matching records and report the count")
    void shouldDeleteMatching() {
      fragments.insert(fragment("alice", "doc.pdf", Visibility.PRIVATE, "a1", 1, 0, 0));
      fragments.insert(fragment("bob", "doc.pdf", Visibility.SHARED, "b1", 0, 1, 0));
      fragments.insert(fragment("bob", "other.pdf", Visibility.SHARED, "b2", 0, 0, 1));

      long removed = fragments.deleteWhere(RecordFilter.eq(RecordField.SOURCE, "doc.pdf"));

      assertThat(removed).isEqualTo(2);
      assertThat(fragments.deleteWhere(RecordFilter.eq(RecordField.SOURCE, "doc.pdf"))).isZero();
      assertThat(fragments.findWhere(RecordFilter.all()))
          .extracting(DocumentFragment::getText)
          .containsExactly("b2");
    }

    @Test
    @DisplayName("should list distinct value tuples in first-seen order")
    void shouldListDistinctTuples() {
      fragments.insert(fragment("alice", "doc.pdf", Visibility.PRIVATE, "a1", 1, 0, 0));
      fragments.insert(fragment("alice", "doc.pdf", Visibility.PRIVATE, "a2", 0, 1, 0));
      fragments.insert(fragment("bob", "doc.pdf", Visibility.SHARED, "b1", 0, 0, 1));

      List<List<String>> tuples =
          fragments.distinct(RecordFilter.all(), List.of(RecordField.SOURCE, RecordField.OWNER));

      assertThat(tuples).containsExactly(List.of("doc.pdf", "alice"), List.of("doc.pdf", "bob"));
    }
  }
}
