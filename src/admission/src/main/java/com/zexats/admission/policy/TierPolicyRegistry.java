package com.zexats.admission.policy;

import com.zexats.admission.config.AdmissionProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Static tier table loaded from configuration at startup. */
@Component
public class TierPolicyRegistry {
  private static final Logger log = LoggerFactory.getLogger(TierPolicyRegistry.class);

  private final Map<String, TierPolicy> policies;

  public TierPolicyRegistry(AdmissionProperties properties) {
    Map<String, TierPolicy> loaded = new LinkedHashMap<>();
    properties.getTiers().forEach((name, tier) -> {
      String normalized = normalize(name);
      loaded.put(normalized, new TierPolicy(
          normalized,
          tier.getBurst(),
          tier.getHourly(),
          tier.getDaily(),
          tier.getMonthly(),
          tier.getMaxConcurrent()));
    });
    if (loaded.isEmpty()) {
      throw new IllegalStateException("admission.tiers must define at least one tier");
    }
    this.policies = Collections.unmodifiableMap(loaded);
    log.info("Loaded admission tiers: {}", policies.keySet());
  }

  /**
   * Resolves the policy for a tier name.
   *
   * @param tier tier name, case-insensitive
   * @return configured policy
   * @throws UnknownTierException when the tier is not configured
   */
  public TierPolicy require(String tier) {
    TierPolicy policy = tier == null ? null : policies.get(normalize(tier));
    if (policy == null) {
      throw new UnknownTierException(tier);
    }
    return policy;
  }

  private static String normalize(String tier) {
    return tier.trim().toLowerCase(Locale.ROOT);
  }
}
