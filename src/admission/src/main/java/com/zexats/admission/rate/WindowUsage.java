package com.zexats.admission.rate;

import com.zexats.admission.policy.WindowKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Requests counted in the current bucket of every window. */
public record WindowUsage(Map<WindowKind, Long> counts) {

  public WindowUsage {
    EnumMap<WindowKind, Long> copy = new EnumMap<>(WindowKind.class);
    for (WindowKind window : WindowKind.values()) {
      copy.put(window, 0L);
    }
    copy.putAll(counts);
    counts = Collections.unmodifiableMap(copy);
  }

  public long get(WindowKind window) {
    return counts.get(window);
  }
}
