package com.zexats.admission.store.local;

import static org.assertj.core.api.Assertions.assertThat;

import com.zexats.admission.store.SlotRecord;
import com.zexats.admission.support.MutableClock;
import com.zexats.admission.support.TestFixtures;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryAdmissionStoreTest {

  private MutableClock clock;
  private InMemoryAdmissionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(TestFixtures.START);
    store = new InMemoryAdmissionStore(clock, 10_000);
  }

  @Test
  void incrementReturnsRunningCountAndPeekDoesNotMutate() {
    assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(1L);
    assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(2L);

    assertThat(store.peek("k")).isEqualTo(2L);
    assertThat(store.peek("k")).isEqualTo(2L);
    assertThat(store.peek("missing")).isZero();
  }

  @Test
  void counterExpiresOneWindowAfterLastIncrement() {
    store.increment("k", Duration.ofSeconds(60));
    clock.advance(Duration.ofSeconds(59));
    assertThat(store.peek("k")).isEqualTo(1L);

    clock.advance(Duration.ofSeconds(1));
    assertThat(store.peek("k")).isZero();
    assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(1L);
  }

  @Test
  void deleteByPrefixOnlyRemovesMatchingKeys() {
    store.increment("admission:rate:u1:burst:1", Duration.ofSeconds(60));
    store.increment("admission:rate:u1:daily:1", Duration.ofSeconds(60));
    store.increment("admission:rate:u10:burst:1", Duration.ofSeconds(60));

    store.deleteByPrefix("admission:rate:u1:");

    assertThat(store.peek("admission:rate:u1:burst:1")).isZero();
    assertThat(store.peek("admission:rate:u1:daily:1")).isZero();
    assertThat(store.peek("admission:rate:u10:burst:1")).isEqualTo(1L);
  }

  @Test
  void expiredCountersAreSweptOnceThresholdIsExceeded() {
    InMemoryAdmissionStore small = new InMemoryAdmissionStore(clock, 3);
    small.increment("a", Duration.ofSeconds(10));
    small.increment("b", Duration.ofSeconds(10));
    small.increment("c", Duration.ofSeconds(10));
    clock.advance(Duration.ofSeconds(11));

    small.increment("d", Duration.ofSeconds(10));

    assertThat(small.counterEntries()).isEqualTo(1);
    assertThat(small.peek("d")).isEqualTo(1L);
  }

  @Test
  void concurrentIncrementsAreNotLost() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Void>> tasks = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        tasks.add(() -> {
          for (int j = 0; j < 500; j++) {
            store.increment("hot", Duration.ofMinutes(1));
          }
          return null;
        });
      }
      for (Future<Void> future : executor.invokeAll(tasks)) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(store.peek("hot")).isEqualTo(4_000L);
  }

  @Test
  void acquireStopsAtMaxConcurrentAndReleaseFreesCapacity() {
    assertThat(store.tryAcquire(slot("a1", "u1"), 2)).isTrue();
    assertThat(store.tryAcquire(slot("a2", "u1"), 2)).isTrue();
    assertThat(store.tryAcquire(slot("a3", "u1"), 2)).isFalse();
    assertThat(store.activeCount("u1")).isEqualTo(2L);

    assertThat(store.release("u1", "a1")).isTrue();
    assertThat(store.activeCount("u1")).isEqualTo(1L);
    assertThat(store.tryAcquire(slot("a3", "u1"), 2)).isTrue();
  }

  @Test
  void releaseIsIdempotentAndChecksOwner() {
    store.tryAcquire(slot("a1", "u1"), 1);

    assertThat(store.release("u2", "a1")).isFalse();
    assertThat(store.release("u1", "a1")).isTrue();
    assertThat(store.release("u1", "a1")).isFalse();
    assertThat(store.release("u1", "unknown")).isFalse();
    assertThat(store.activeCount("u1")).isZero();
  }

  @Test
  void findIssuedBeforeReturnsOnlyOlderSlots() {
    store.tryAcquire(slot("old", "u1"), 5);
    clock.advance(Duration.ofMinutes(10));
    store.tryAcquire(slot("new", "u1"), 5);

    List<SlotRecord> stale = store.findIssuedBefore(TestFixtures.START.plus(Duration.ofMinutes(5)));

    assertThat(stale).extracting(SlotRecord::analysisId).containsExactly("old");
  }

  @Test
  void releaseAllDropsUserSlotsAndZeroesCount() {
    store.tryAcquire(slot("a1", "u1"), 5);
    store.tryAcquire(slot("a2", "u1"), 5);
    store.tryAcquire(slot("b1", "u2"), 5);

    assertThat(store.releaseAll("u1")).isEqualTo(2);

    assertThat(store.activeCount("u1")).isZero();
    assertThat(store.activeCount("u2")).isEqualTo(1L);
    assertThat(store.release("u1", "a1")).isFalse();
  }

  private SlotRecord slot(String analysisId, String userId) {
    return new SlotRecord(analysisId, userId, clock.instant());
  }
}
