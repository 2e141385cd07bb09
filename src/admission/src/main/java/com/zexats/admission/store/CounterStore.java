package com.zexats.admission.store;

import java.time.Duration;

/**
 * Atomic windowed counters.
 *
 * <p>Counters are only ever incremented. Each increment refreshes the counter expiry to the
 * window size, after which the counter reads as absent.
 */
public interface CounterStore {

  /**
   * Increments a counter and refreshes its expiry in one atomic step.
   *
   * @param key bucket key, see {@link AdmissionKeys#rateCounter}
   * @param window window size, used as the expiry
   * @return value after the increment
   */
  long increment(String key, Duration window);

  /** Returns the current value without mutating it, {@code 0} when absent or expired. */
  long peek(String key);

  /** Removes every counter whose key starts with {@code prefix}. */
  void deleteByPrefix(String prefix);

  /** Short identifier of the backend, used in logs and status reports. */
  String backendName();

  /** Checks that the backend answers. */
  boolean ping();
}
