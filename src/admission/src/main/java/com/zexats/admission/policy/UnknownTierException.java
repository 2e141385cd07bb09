package com.zexats.admission.policy;

/**
 * Raised when a caller names a tier that is not configured.
 *
 * <p>This is a configuration or entitlement bug on the caller side, so it is never mapped to a
 * default tier.
 */
public class UnknownTierException extends IllegalArgumentException {
  private final String tier;

  public UnknownTierException(String tier) {
    super("unknown subscription tier: " + tier);
    this.tier = tier;
  }

  public String getTier() {
    return tier;
  }
}
