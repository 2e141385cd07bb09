package com.zexats.admission.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.zexats.admission.store.local.InMemoryAdmissionStore;
import com.zexats.admission.support.MutableClock;
import com.zexats.admission.support.TestFixtures;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

@ExtendWith(MockitoExtension.class)
class FailoverCounterStoreTest {

  @Mock private CounterStore primary;

  private InMemoryAdmissionStore fallback;
  private SimpleMeterRegistry meterRegistry;
  private FailoverCounterStore store;

  @BeforeEach
  void setUp() {
    fallback = new InMemoryAdmissionStore(new MutableClock(TestFixtures.START), 10_000);
    meterRegistry = new SimpleMeterRegistry();
    store = new FailoverCounterStore(primary, fallback, meterRegistry);
    lenient().when(primary.backendName()).thenReturn("redis");
  }

  @Test
  void healthyPrimaryServesCallsWithoutTouchingFallback() {
    when(primary.increment("k", Duration.ofSeconds(60))).thenReturn(7L);
    when(primary.peek("k")).thenReturn(7L);

    assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(7L);
    assertThat(store.peek("k")).isEqualTo(7L);
    assertThat(fallback.peek("k")).isZero();
    assertThat(meterRegistry.find("admission.store.fallback").counter()).isNull();
  }

  @Test
  void failingPrimaryIsRetriedOnceAgainstLocalStore() {
    when(primary.increment(anyString(), any())).thenThrow(new RedisConnectionFailureException("down"));
    when(primary.peek(anyString())).thenThrow(new RedisConnectionFailureException("down"));

    assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(1L);
    assertThat(store.increment("k", Duration.ofSeconds(60))).isEqualTo(2L);
    assertThat(store.peek("k")).isEqualTo(2L);

    double fallbacks = meterRegistry.get("admission.store.fallback").counters().stream()
        .mapToDouble(Counter::count)
        .sum();
    assertThat(fallbacks).isEqualTo(3.0);
  }

  @Test
  void deleteByPrefixClearsBothStoresEvenWhenPrimaryFails() {
    fallback.increment("admission:rate:u1:burst:1", Duration.ofSeconds(60));
    doThrow(new RedisConnectionFailureException("down"))
        .when(primary).deleteByPrefix("admission:rate:u1:");

    store.deleteByPrefix("admission:rate:u1:");

    verify(primary).deleteByPrefix("admission:rate:u1:");
    assertThat(fallback.peek("admission:rate:u1:burst:1")).isZero();
  }

  @Test
  void reportsCompositeBackendAndPrimaryReachability() {
    when(primary.ping()).thenReturn(false);

    assertThat(store.backendName()).isEqualTo("redis+local");
    assertThat(store.ping()).isFalse();
  }
}
