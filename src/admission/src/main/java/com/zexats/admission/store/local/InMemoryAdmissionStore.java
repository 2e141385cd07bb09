package com.zexats.admission.store.local;

import com.zexats.admission.store.CounterStore;
import com.zexats.admission.store.SlotRecord;
import com.zexats.admission.store.SlotStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-process store for counters and concurrency slots.
 *
 * <p>All maps share one monitor. Operations are O(1) except the lazy expiry sweep, which runs
 * only once the counter map grows past {@code sweepThreshold}. State is local to one
 * application instance.
 */
public class InMemoryAdmissionStore implements CounterStore, SlotStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryAdmissionStore.class);

  private final Object lock = new Object();
  private final Map<String, CounterEntry> counters = new HashMap<>();
  private final Map<String, SlotRecord> slots = new HashMap<>();
  private final Map<String, Long> activeByUser = new HashMap<>();
  private final Clock clock;
  private final int sweepThreshold;

  public InMemoryAdmissionStore(Clock clock, int sweepThreshold) {
    this.clock = clock;
    this.sweepThreshold = Math.max(1, sweepThreshold);
  }

  @Override
  public long increment(String key, Duration window) {
    long nowMs = clock.millis();
    synchronized (lock) {
      CounterEntry entry = counters.get(key);
      if (entry == null || entry.isExpired(nowMs)) {
        entry = new CounterEntry();
        counters.put(key, entry);
      }
      entry.value++;
      entry.expiresAtMs = nowMs + Math.max(1L, window.toMillis());
      long value = entry.value;
      if (counters.size() > sweepThreshold) {
        sweepExpired(nowMs);
      }
      return value;
    }
  }

  @Override
  public long peek(String key) {
    long nowMs = clock.millis();
    synchronized (lock) {
      CounterEntry entry = counters.get(key);
      if (entry == null || entry.isExpired(nowMs)) {
        return 0L;
      }
      return entry.value;
    }
  }

  @Override
  public void deleteByPrefix(String prefix) {
    synchronized (lock) {
      counters.keySet().removeIf(key -> key.startsWith(prefix));
    }
  }

  @Override
  public String backendName() {
    return "local";
  }

  @Override
  public boolean ping() {
    return true;
  }

  @Override
  public boolean tryAcquire(SlotRecord slot, int maxConcurrent) {
    synchronized (lock) {
      long active = activeByUser.getOrDefault(slot.userId(), 0L);
      if (active >= maxConcurrent || slots.containsKey(slot.analysisId())) {
        return false;
      }
      slots.put(slot.analysisId(), slot);
      activeByUser.put(slot.userId(), active + 1);
      return true;
    }
  }

  @Override
  public boolean release(String userId, String analysisId) {
    synchronized (lock) {
      SlotRecord slot = slots.get(analysisId);
      if (slot == null || !slot.userId().equals(userId)) {
        return false;
      }
      slots.remove(analysisId);
      decrementActive(userId);
      return true;
    }
  }

  @Override
  public long activeCount(String userId) {
    synchronized (lock) {
      return activeByUser.getOrDefault(userId, 0L);
    }
  }

  @Override
  public List<SlotRecord> findIssuedBefore(Instant cutoff) {
    synchronized (lock) {
      List<SlotRecord> stale = new ArrayList<>();
      for (SlotRecord slot : slots.values()) {
        if (slot.issuedAt().isBefore(cutoff)) {
          stale.add(slot);
        }
      }
      return stale;
    }
  }

  @Override
  public int releaseAll(String userId) {
    synchronized (lock) {
      int removed = 0;
      Iterator<SlotRecord> it = slots.values().iterator();
      while (it.hasNext()) {
        if (it.next().userId().equals(userId)) {
          it.remove();
          removed++;
        }
      }
      activeByUser.remove(userId);
      return removed;
    }
  }

  /** Number of counter entries currently held, expired ones included until swept. */
  int counterEntries() {
    synchronized (lock) {
      return counters.size();
    }
  }

  private void decrementActive(String userId) {
    long active = activeByUser.getOrDefault(userId, 0L);
    if (active <= 1) {
      activeByUser.remove(userId);
    } else {
      activeByUser.put(userId, active - 1);
    }
  }

  private void sweepExpired(long nowMs) {
    int before = counters.size();
    counters.values().removeIf(entry -> entry.isExpired(nowMs));
    log.debug("Swept {} expired local counters", before - counters.size());
  }

  private static final class CounterEntry {
    private long value;
    private long expiresAtMs;

    private boolean isExpired(long nowMs) {
      return nowMs >= expiresAtMs;
    }
  }
}
