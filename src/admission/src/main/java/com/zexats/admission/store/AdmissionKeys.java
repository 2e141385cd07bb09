package com.zexats.admission.store;

import com.zexats.admission.policy.WindowKind;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Key layout shared by both backends.
 *
 * <ul>
 *   <li>{@code {prefix}:rate:{user}:{window}:{bucket}} request counters</li>
 *   <li>{@code {prefix}:concurrent:{user}} active slot counter</li>
 *   <li>{@code {prefix}:slots} hash of analysis id to owner</li>
 *   <li>{@code {prefix}:slots:issued} sorted set of analysis id scored by issue time (millis)</li>
 * </ul>
 *
 * <p>User ids are URL-encoded inside keys so a {@code :} in an id cannot reach into another
 * user's key space.
 */
public final class AdmissionKeys {
  private final String prefix;

  public AdmissionKeys(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("key prefix must not be blank");
    }
    this.prefix = prefix.trim();
  }

  public String rateCounter(String userId, WindowKind window, long bucketIndex) {
    return rateCounterPrefix(userId) + window.label() + ":" + bucketIndex;
  }

  public String rateCounterPrefix(String userId) {
    return prefix + ":rate:" + userSegment(userId) + ":";
  }

  public String activeCounter(String userId) {
    return prefix + ":concurrent:" + userSegment(userId);
  }

  public String slots() {
    return prefix + ":slots";
  }

  public String slotsIssued() {
    return prefix + ":slots:issued";
  }

  private static String userSegment(String userId) {
    return URLEncoder.encode(userId, StandardCharsets.UTF_8);
  }
}
