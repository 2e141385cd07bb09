package com.zexats.admission.slot;

import com.zexats.admission.policy.TierPolicy;
import com.zexats.admission.policy.TierPolicyRegistry;
import com.zexats.admission.store.SlotRecord;
import com.zexats.admission.store.SlotStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and reclaims concurrency slots bounded by each tier's {@code maxConcurrent}.
 *
 * <p>A slot is either active or gone: {@link #finish} releases it, {@link #sweep} reclaims it
 * once its lease expired. Both go through {@link SlotStore#release}, which only decrements the
 * owner's counter when it actually removed the slot.
 */
public class ConcurrencyGovernor {
  private static final Logger log = LoggerFactory.getLogger(ConcurrencyGovernor.class);

  private final SlotStore slotStore;
  private final TierPolicyRegistry tierPolicies;
  private final Clock clock;
  private final Counter startedCounter;
  private final Counter rejectedCounter;
  private final Counter releasedCounter;
  private final Counter reclaimedCounter;

  public ConcurrencyGovernor(
      SlotStore slotStore,
      TierPolicyRegistry tierPolicies,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.slotStore = slotStore;
    this.tierPolicies = tierPolicies;
    this.clock = clock;
    this.startedCounter = meterRegistry.counter("admission.slots", "outcome", "started");
    this.rejectedCounter = meterRegistry.counter("admission.slots", "outcome", "rejected");
    this.releasedCounter = meterRegistry.counter("admission.slots", "outcome", "released");
    this.reclaimedCounter = meterRegistry.counter("admission.slots", "outcome", "reclaimed");
  }

  /**
   * Requests a slot for a new analysis.
   *
   * @param userId caller identity
   * @param tier caller subscription tier
   * @return granted slot token, or a rejection when the user is at its concurrency limit
   */
  public SlotGrant start(String userId, String tier) {
    requireUser(userId);
    TierPolicy policy = tierPolicies.require(tier);
    SlotRecord slot = new SlotRecord(UUID.randomUUID().toString(), userId, clock.instant());

    if (!slotStore.tryAcquire(slot, policy.maxConcurrent())) {
      rejectedCounter.increment();
      log.debug("Concurrency limit reached user={} tier={} max={}", userId, policy.name(), policy.maxConcurrent());
      return SlotGrant.rejected();
    }
    startedCounter.increment();
    return SlotGrant.granted(slot.analysisId());
  }

  /**
   * Releases a slot. Unknown or already released tokens are ignored.
   *
   * @param userId slot owner
   * @param analysisId token returned by {@link #start}
   */
  public void finish(String userId, String analysisId) {
    if (userId == null || analysisId == null) {
      return;
    }
    if (slotStore.release(userId, analysisId)) {
      releasedCounter.increment();
    } else {
      log.debug("Ignoring finish for unknown slot user={} analysisId={}", userId, analysisId);
    }
  }

  /** Read-only check whether {@link #start} would currently succeed. */
  public boolean canStart(String userId, String tier) {
    requireUser(userId);
    TierPolicy policy = tierPolicies.require(tier);
    return slotStore.activeCount(userId) < policy.maxConcurrent();
  }

  public long activeCount(String userId) {
    requireUser(userId);
    return slotStore.activeCount(userId);
  }

  /**
   * Reclaims every slot whose lease expired, i.e. {@code now - issuedAt > leaseTtl}.
   *
   * @param leaseTtl slot lease duration
   * @return number of slots reclaimed by this call
   */
  public int sweep(Duration leaseTtl) {
    Instant cutoff = clock.instant().minus(leaseTtl);
    List<SlotRecord> stale = slotStore.findIssuedBefore(cutoff);
    int reclaimed = 0;
    for (SlotRecord slot : stale) {
      // A concurrent finish may win; release then reports false and nothing is decremented.
      if (slotStore.release(slot.userId(), slot.analysisId())) {
        reclaimed++;
        log.info("Reclaimed expired slot user={} analysisId={} issuedAt={}",
            slot.userId(), slot.analysisId(), slot.issuedAt());
      }
    }
    reclaimedCounter.increment(reclaimed);
    return reclaimed;
  }

  private static void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
  }
}
