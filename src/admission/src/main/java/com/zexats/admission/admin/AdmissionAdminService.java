package com.zexats.admission.admin;

import com.zexats.admission.store.AdmissionKeys;
import com.zexats.admission.store.CounterStore;
import com.zexats.admission.store.SlotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator remediation on a user's admission state.
 *
 * <p>Resets are best effort when they overlap live traffic for the same user: an increment
 * landing after the delete survives.
 */
public class AdmissionAdminService {
  private static final Logger log = LoggerFactory.getLogger(AdmissionAdminService.class);

  private final CounterStore counterStore;
  private final SlotStore slotStore;
  private final AdmissionKeys keys;
  private final boolean distributed;

  public AdmissionAdminService(
      CounterStore counterStore, SlotStore slotStore, AdmissionKeys keys, boolean distributed) {
    this.counterStore = counterStore;
    this.slotStore = slotStore;
    this.keys = keys;
    this.distributed = distributed;
  }

  /**
   * Deletes every rate counter and concurrency slot of a user and zeroes the active count.
   *
   * @param userId user to reset
   */
  public void resetUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
    counterStore.deleteByPrefix(keys.rateCounterPrefix(userId));
    int slots = slotStore.releaseAll(userId);
    log.warn("Admission state reset for user={} (released {} slots)", userId, slots);
  }

  public BackendStatus backendStatus() {
    return new BackendStatus(counterStore.backendName(), distributed, counterStore.ping());
  }
}
