package com.zexats.admission.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

import com.zexats.admission.store.local.InMemoryAdmissionStore;
import com.zexats.admission.support.MutableClock;
import com.zexats.admission.support.TestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

@ExtendWith(MockitoExtension.class)
class FailoverSlotStoreTest {

  @Mock private SlotStore primary;

  private InMemoryAdmissionStore fallback;
  private FailoverSlotStore store;

  @BeforeEach
  void setUp() {
    fallback = new InMemoryAdmissionStore(new MutableClock(TestFixtures.START), 10_000);
    store = new FailoverSlotStore(primary, fallback, new SimpleMeterRegistry());
  }

  @Test
  void acquireFallsBackToLocalStoreWhenPrimaryIsDown() {
    when(primary.tryAcquire(any(), anyInt())).thenThrow(new RedisConnectionFailureException("down"));

    assertThat(store.tryAcquire(slot("a1"), 1)).isTrue();
    assertThat(store.tryAcquire(slot("a2"), 1)).isFalse();
    assertThat(fallback.activeCount("u1")).isEqualTo(1L);
  }

  @Test
  void releaseReachesSlotGrantedLocallyAfterBackendRecovered() {
    fallback.tryAcquire(slot("a1"), 1);
    when(primary.release("u1", "a1")).thenReturn(false);

    assertThat(store.release("u1", "a1")).isTrue();
    assertThat(fallback.activeCount("u1")).isZero();
  }

  @Test
  void releaseHandledByPrimaryDoesNotConsultFallback() {
    fallback.tryAcquire(slot("a1"), 1);
    when(primary.release("u1", "a1")).thenReturn(true);

    assertThat(store.release("u1", "a1")).isTrue();
    assertThat(fallback.activeCount("u1")).isEqualTo(1L);
  }

  @Test
  void findIssuedBeforeMergesBothStoresAndSurvivesPrimaryFailure() {
    fallback.tryAcquire(slot("local"), 5);
    Instant cutoff = TestFixtures.START.plusSeconds(1);
    when(primary.findIssuedBefore(cutoff))
        .thenReturn(List.of(new SlotRecord("remote", "u2", TestFixtures.START)))
        .thenThrow(new RedisConnectionFailureException("down"));

    assertThat(store.findIssuedBefore(cutoff))
        .extracting(SlotRecord::analysisId)
        .containsExactly("remote", "local");
    assertThat(store.findIssuedBefore(cutoff))
        .extracting(SlotRecord::analysisId)
        .containsExactly("local");
  }

  @Test
  void activeCountUsesPrimaryWhenHealthy() {
    when(primary.activeCount("u1")).thenReturn(3L);

    assertThat(store.activeCount("u1")).isEqualTo(3L);
  }

  @Test
  void releaseAllSumsBothStores() {
    fallback.tryAcquire(slot("a1"), 5);
    when(primary.releaseAll("u1")).thenReturn(2);

    assertThat(store.releaseAll("u1")).isEqualTo(3);
    assertThat(fallback.activeCount("u1")).isZero();
  }

  private static SlotRecord slot(String analysisId) {
    return new SlotRecord(analysisId, "u1", TestFixtures.START);
  }
}
