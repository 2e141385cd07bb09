package com.zexats.admission.api;

/** The user already runs as many analyses as the tier allows. */
public class ConcurrencyLimitExceededException extends AdmissionDeniedException {
  private final int maxConcurrent;

  public ConcurrencyLimitExceededException(String userId, int maxConcurrent) {
    super("too many concurrent analyses (max " + maxConcurrent + ")", userId, 0L);
    this.maxConcurrent = maxConcurrent;
  }

  public int getMaxConcurrent() {
    return maxConcurrent;
  }
}
