package com.zexats.admission.store;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Routes counter calls to the distributed store and retries a failed call once against the
 * local store.
 *
 * <p>Fail-open is the chosen policy: an unreachable backend must not deny service. While the
 * backend is down each instance enforces limits on its own traffic only.
 */
public class FailoverCounterStore implements CounterStore {
  private static final Logger log = LoggerFactory.getLogger(FailoverCounterStore.class);

  private final CounterStore primary;
  private final CounterStore fallback;
  private final MeterRegistry meterRegistry;

  public FailoverCounterStore(CounterStore primary, CounterStore fallback, MeterRegistry meterRegistry) {
    this.primary = primary;
    this.fallback = fallback;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public long increment(String key, Duration window) {
    return withFallback("increment", () -> primary.increment(key, window), () -> fallback.increment(key, window));
  }

  @Override
  public long peek(String key) {
    return withFallback("peek", () -> primary.peek(key), () -> fallback.peek(key));
  }

  @Override
  public void deleteByPrefix(String prefix) {
    try {
      primary.deleteByPrefix(prefix);
    } catch (DataAccessException ex) {
      recordFallback("delete", ex);
    }
    // Local counters may hold increments taken during an outage.
    fallback.deleteByPrefix(prefix);
  }

  @Override
  public String backendName() {
    return primary.backendName() + "+" + fallback.backendName();
  }

  @Override
  public boolean ping() {
    return primary.ping();
  }

  private <T> T withFallback(String operation, Supplier<T> primaryCall, Supplier<T> fallbackCall) {
    try {
      return primaryCall.get();
    } catch (DataAccessException ex) {
      recordFallback(operation, ex);
      return fallbackCall.get();
    }
  }

  private void recordFallback(String operation, DataAccessException ex) {
    meterRegistry.counter("admission.store.fallback", "store", "counter", "operation", operation).increment();
    log.warn("Counter backend {} failed on {}, using {}: {}",
        primary.backendName(), operation, fallback.backendName(), ex.getMessage());
  }
}
