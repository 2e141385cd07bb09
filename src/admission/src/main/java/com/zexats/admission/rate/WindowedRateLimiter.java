package com.zexats.admission.rate;

import com.zexats.admission.policy.TierPolicy;
import com.zexats.admission.policy.TierPolicyRegistry;
import com.zexats.admission.policy.WindowKind;
import com.zexats.admission.store.AdmissionKeys;
import com.zexats.admission.store.CounterStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window request limiter evaluated over the burst, hourly, daily and monthly windows.
 *
 * <p>The check and the increments are separate store calls. Two callers passing the check
 * before either increments are both admitted, so a limit can be overshot by up to the number
 * of concurrent racers minus one. Limits are soft quotas; availability wins over exactness.
 */
public class WindowedRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(WindowedRateLimiter.class);

  private final CounterStore counterStore;
  private final TierPolicyRegistry tierPolicies;
  private final AdmissionKeys keys;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Counter allowedCounter;

  public WindowedRateLimiter(
      CounterStore counterStore,
      TierPolicyRegistry tierPolicies,
      AdmissionKeys keys,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.counterStore = counterStore;
    this.tierPolicies = tierPolicies;
    this.keys = keys;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.allowedCounter = meterRegistry.counter("admission.requests", "outcome", "allowed");
  }

  /**
   * Admits one request when every window is under its cap, consuming one unit of each.
   *
   * @param userId caller identity
   * @param tier caller subscription tier
   * @return {@code false} when any window is exhausted; no counter is touched in that case
   * @throws com.zexats.admission.policy.UnknownTierException for unconfigured tiers
   */
  public boolean checkAndConsume(String userId, String tier) {
    requireUser(userId);
    TierPolicy policy = tierPolicies.require(tier);
    Instant now = clock.instant();

    Map<WindowKind, String> bucketKeys = bucketKeys(userId, now);
    for (WindowKind window : WindowKind.values()) {
      long used = counterStore.peek(bucketKeys.get(window));
      if (used >= policy.limitFor(window)) {
        meterRegistry.counter("admission.requests", "outcome", "rate_limited", "window", window.label())
            .increment();
        log.debug("Rate limited user={} tier={} window={} used={}", userId, policy.name(), window.label(), used);
        return false;
      }
    }

    for (WindowKind window : WindowKind.values()) {
      counterStore.increment(bucketKeys.get(window), window.duration());
    }
    allowedCounter.increment();
    return true;
  }

  /** Requests counted in the current bucket of each window. */
  public WindowUsage usage(String userId) {
    requireUser(userId);
    return usageAt(userId, clock.instant());
  }

  private WindowUsage usageAt(String userId, Instant now) {
    Map<WindowKind, String> bucketKeys = bucketKeys(userId, now);
    Map<WindowKind, Long> counts = new EnumMap<>(WindowKind.class);
    for (WindowKind window : WindowKind.values()) {
      counts.put(window, counterStore.peek(bucketKeys.get(window)));
    }
    return new WindowUsage(counts);
  }

  /**
   * Builds limits, usage, remaining quota and reset times for a user.
   *
   * @param userId caller identity
   * @param tier caller subscription tier
   * @return status snapshot
   */
  public LimitInfo info(String userId, String tier) {
    requireUser(userId);
    TierPolicy policy = tierPolicies.require(tier);
    Instant now = clock.instant();
    WindowUsage usage = usageAt(userId, now);

    Map<WindowKind, Long> remaining = new EnumMap<>(WindowKind.class);
    Map<WindowKind, Instant> resetTimes = new EnumMap<>(WindowKind.class);
    boolean rateLimited = false;
    for (WindowKind window : WindowKind.values()) {
      long limit = policy.limitFor(window);
      long used = usage.get(window);
      remaining.put(window, Math.max(0L, limit - used));
      resetTimes.put(window, window.nextReset(now));
      rateLimited |= used >= limit;
    }
    return new LimitInfo(policy.name(), policy.windowLimits(), usage, remaining, resetTimes, rateLimited);
  }

  public TierPolicy tierLimits(String tier) {
    return tierPolicies.require(tier);
  }

  private Map<WindowKind, String> bucketKeys(String userId, Instant now) {
    Map<WindowKind, String> bucketKeys = new EnumMap<>(WindowKind.class);
    for (WindowKind window : WindowKind.values()) {
      bucketKeys.put(window, keys.rateCounter(userId, window, window.bucketIndex(now)));
    }
    return bucketKeys;
  }

  private static void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
  }
}
