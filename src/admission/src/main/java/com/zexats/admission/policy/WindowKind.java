package com.zexats.admission.policy;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-duration request windows, declared in evaluation order.
 *
 * <p>Buckets are aligned on the epoch: a window of {@code W} seconds covers
 * {@code [k*W, (k+1)*W)} for bucket index {@code k}.
 */
public enum WindowKind {
  BURST("burst", 60L),
  HOURLY("hourly", 3_600L),
  DAILY("daily", 86_400L),
  MONTHLY("monthly", 2_592_000L);

  private final String label;
  private final long seconds;

  WindowKind(String label, long seconds) {
    this.label = label;
    this.seconds = seconds;
  }

  public String label() {
    return label;
  }

  public long seconds() {
    return seconds;
  }

  public Duration duration() {
    return Duration.ofSeconds(seconds);
  }

  public long bucketIndex(Instant now) {
    return Math.floorDiv(now.getEpochSecond(), seconds);
  }

  /** Start of the bucket following the one containing {@code now}. */
  public Instant nextReset(Instant now) {
    return Instant.ofEpochSecond((bucketIndex(now) + 1) * seconds);
  }
}
