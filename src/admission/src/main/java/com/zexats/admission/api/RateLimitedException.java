package com.zexats.admission.api;

import com.zexats.admission.rate.LimitInfo;

/** A request window of the user's tier is exhausted. */
public class RateLimitedException extends AdmissionDeniedException {
  private final transient LimitInfo limitInfo;

  public RateLimitedException(String userId, LimitInfo limitInfo, long retryAfterSeconds) {
    super("rate limit exceeded for tier " + limitInfo.tier(), userId, retryAfterSeconds);
    this.limitInfo = limitInfo;
  }

  public LimitInfo getLimitInfo() {
    return limitInfo;
  }
}
