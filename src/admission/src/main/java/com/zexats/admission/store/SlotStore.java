package com.zexats.admission.store;

import java.time.Instant;
import java.util.List;

/**
 * Registry of concurrency slots and the per-user active counter that mirrors it.
 *
 * <p>Every mutation changes the slot set and the counter together, so the counter always
 * equals the number of slots owned by the user once the call returns.
 */
public interface SlotStore {

  /**
   * Registers {@code slot} when its owner holds fewer than {@code maxConcurrent} slots.
   *
   * @return {@code true} when the slot was registered
   */
  boolean tryAcquire(SlotRecord slot, int maxConcurrent);

  /**
   * Removes the slot and decrements its owner's counter, never below zero.
   *
   * @return {@code true} when this call removed the slot; {@code false} when it was unknown,
   *     already released, or owned by another user
   */
  boolean release(String userId, String analysisId);

  long activeCount(String userId);

  /** Slots issued strictly before {@code cutoff}. */
  List<SlotRecord> findIssuedBefore(Instant cutoff);

  /**
   * Removes every slot owned by the user and zeroes the counter.
   *
   * @return number of slots removed
   */
  int releaseAll(String userId);
}
