package com.zexats.admission.policy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable limits for one subscription tier.
 *
 * @param name normalized tier name
 * @param burst requests allowed per burst window
 * @param hourly requests allowed per hourly window
 * @param daily requests allowed per daily window
 * @param monthly requests allowed per monthly window
 * @param maxConcurrent analyses allowed in flight at once
 */
public record TierPolicy(String name, int burst, int hourly, int daily, int monthly, int maxConcurrent) {

  public TierPolicy {
    if (burst < 0 || hourly < 0 || daily < 0 || monthly < 0 || maxConcurrent < 0) {
      throw new IllegalArgumentException("tier limits must not be negative: " + name);
    }
  }

  public int limitFor(WindowKind window) {
    return switch (window) {
      case BURST -> burst;
      case HOURLY -> hourly;
      case DAILY -> daily;
      case MONTHLY -> monthly;
    };
  }

  public Map<WindowKind, Integer> windowLimits() {
    Map<WindowKind, Integer> limits = new EnumMap<>(WindowKind.class);
    for (WindowKind window : WindowKind.values()) {
      limits.put(window, limitFor(window));
    }
    return Collections.unmodifiableMap(limits);
  }
}
