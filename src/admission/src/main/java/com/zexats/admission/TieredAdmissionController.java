package com.zexats.admission;

import com.zexats.admission.admin.AdmissionAdminService;
import com.zexats.admission.admin.BackendStatus;
import com.zexats.admission.api.ConcurrencyLimitExceededException;
import com.zexats.admission.api.RateLimitedException;
import com.zexats.admission.policy.TierPolicy;
import com.zexats.admission.rate.LimitInfo;
import com.zexats.admission.rate.WindowUsage;
import com.zexats.admission.rate.WindowedRateLimiter;
import com.zexats.admission.slot.ConcurrencyGovernor;
import com.zexats.admission.slot.SlotGrant;
import java.time.Clock;

/**
 * Entry point used by the request-handling layer.
 *
 * <p>One instance is built at startup and injected where needed. Typical use:
 *
 * <pre>{@code
 * String token = controller.admit(userId, tier);
 * try {
 *   runAnalysis();
 * } finally {
 *   controller.finishSlot(userId, token);
 * }
 * }</pre>
 */
public class TieredAdmissionController {
  private final WindowedRateLimiter rateLimiter;
  private final ConcurrencyGovernor governor;
  private final AdmissionAdminService adminService;
  private final Clock clock;

  public TieredAdmissionController(
      WindowedRateLimiter rateLimiter,
      ConcurrencyGovernor governor,
      AdmissionAdminService adminService,
      Clock clock) {
    this.rateLimiter = rateLimiter;
    this.governor = governor;
    this.adminService = adminService;
    this.clock = clock;
  }

  public boolean checkAndConsume(String userId, String tier) {
    return rateLimiter.checkAndConsume(userId, tier);
  }

  public SlotGrant startSlot(String userId, String tier) {
    return governor.start(userId, tier);
  }

  public void finishSlot(String userId, String token) {
    governor.finish(userId, token);
  }

  public WindowUsage usage(String userId) {
    return rateLimiter.usage(userId);
  }

  public LimitInfo info(String userId, String tier) {
    return rateLimiter.info(userId, tier);
  }

  public TierPolicy tierLimits(String tier) {
    return rateLimiter.tierLimits(tier);
  }

  public void resetUser(String userId) {
    adminService.resetUser(userId);
  }

  public BackendStatus backendStatus() {
    return adminService.backendStatus();
  }

  /**
   * Consumes request quota and takes a concurrency slot in one call.
   *
   * <p>A user already at the concurrency limit is refused before any quota is consumed. When a
   * slot is taken between that check and {@link #startSlot}, the refusal comes after the quota
   * was consumed.
   *
   * @param userId caller identity
   * @param tier caller subscription tier
   * @return slot token to hand back to {@link #finishSlot}
   * @throws RateLimitedException when a request window is exhausted
   * @throws ConcurrencyLimitExceededException when no slot is free
   */
  public String admit(String userId, String tier) {
    if (!governor.canStart(userId, tier)) {
      throw concurrencyLimitExceeded(userId, tier);
    }
    if (!rateLimiter.checkAndConsume(userId, tier)) {
      LimitInfo info = rateLimiter.info(userId, tier);
      throw new RateLimitedException(userId, info, info.retryAfterSeconds(clock.instant()));
    }
    SlotGrant grant = governor.start(userId, tier);
    if (!grant.allowed()) {
      throw concurrencyLimitExceeded(userId, tier);
    }
    return grant.analysisId();
  }

  private ConcurrencyLimitExceededException concurrencyLimitExceeded(String userId, String tier) {
    return new ConcurrencyLimitExceededException(userId, rateLimiter.tierLimits(tier).maxConcurrent());
  }
}
