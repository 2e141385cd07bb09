package com.zexats.admission.rate;

import com.zexats.admission.policy.WindowKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of a user's limits for status surfaces.
 *
 * @param tier normalized tier name
 * @param limits configured cap per window
 * @param usage requests counted in the current bucket per window
 * @param remaining requests left per window, never negative
 * @param resetTimes absolute start of the next bucket per window
 * @param rateLimited {@code true} when at least one window is exhausted
 */
public record LimitInfo(
    String tier,
    Map<WindowKind, Integer> limits,
    WindowUsage usage,
    Map<WindowKind, Long> remaining,
    Map<WindowKind, Instant> resetTimes,
    boolean rateLimited) {

  public LimitInfo {
    limits = Collections.unmodifiableMap(new EnumMap<>(limits));
    remaining = Collections.unmodifiableMap(new EnumMap<>(remaining));
    resetTimes = Collections.unmodifiableMap(new EnumMap<>(resetTimes));
  }

  /**
   * Seconds until every exhausted window has reset.
   *
   * @param now reference time
   * @return {@code 0} when no window is exhausted, otherwise at least {@code 1}, rounded up
   */
  public long retryAfterSeconds(Instant now) {
    long retryAfter = 0L;
    for (WindowKind window : WindowKind.values()) {
      if (usage.get(window) >= limits.get(window)) {
        long untilResetMs = Duration.between(now, resetTimes.get(window)).toMillis();
        retryAfter = Math.max(retryAfter, Math.max(1L, (untilResetMs + 999L) / 1000L));
      }
    }
    return Math.max(0L, retryAfter);
  }
}
