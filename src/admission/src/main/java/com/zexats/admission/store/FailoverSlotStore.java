package com.zexats.admission.store;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Slot registry counterpart of {@link FailoverCounterStore}.
 *
 * <p>Slots granted by the local store during an outage stay there. Release, sweep and reset
 * therefore consult both stores, so such slots are reclaimed once the backend recovers.
 */
public class FailoverSlotStore implements SlotStore {
  private static final Logger log = LoggerFactory.getLogger(FailoverSlotStore.class);

  private final SlotStore primary;
  private final SlotStore fallback;
  private final MeterRegistry meterRegistry;

  public FailoverSlotStore(SlotStore primary, SlotStore fallback, MeterRegistry meterRegistry) {
    this.primary = primary;
    this.fallback = fallback;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public boolean tryAcquire(SlotRecord slot, int maxConcurrent) {
    try {
      return primary.tryAcquire(slot, maxConcurrent);
    } catch (DataAccessException ex) {
      recordFallback("acquire", ex);
      return fallback.tryAcquire(slot, maxConcurrent);
    }
  }

  @Override
  public boolean release(String userId, String analysisId) {
    boolean released = false;
    try {
      released = primary.release(userId, analysisId);
    } catch (DataAccessException ex) {
      recordFallback("release", ex);
    }
    return released || fallback.release(userId, analysisId);
  }

  @Override
  public long activeCount(String userId) {
    try {
      return primary.activeCount(userId);
    } catch (DataAccessException ex) {
      recordFallback("active_count", ex);
      return fallback.activeCount(userId);
    }
  }

  @Override
  public List<SlotRecord> findIssuedBefore(Instant cutoff) {
    List<SlotRecord> stale = new ArrayList<>();
    try {
      stale.addAll(primary.findIssuedBefore(cutoff));
    } catch (DataAccessException ex) {
      recordFallback("scan", ex);
    }
    stale.addAll(fallback.findIssuedBefore(cutoff));
    return stale;
  }

  @Override
  public int releaseAll(String userId) {
    int released = 0;
    try {
      released += primary.releaseAll(userId);
    } catch (DataAccessException ex) {
      recordFallback("release_all", ex);
    }
    return released + fallback.releaseAll(userId);
  }

  private void recordFallback(String operation, DataAccessException ex) {
    meterRegistry.counter("admission.store.fallback", "store", "slot", "operation", operation).increment();
    log.warn("Slot backend failed on {}, using local store: {}", operation, ex.getMessage());
  }
}
