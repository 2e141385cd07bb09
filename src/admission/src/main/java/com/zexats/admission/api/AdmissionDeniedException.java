package com.zexats.admission.api;

/**
 * Base class for admission refusals carrying a retry hint.
 *
 * <p>Subclasses let the request layer pick distinct user-facing messages.
 */
public abstract class AdmissionDeniedException extends RuntimeException {
  private final String userId;
  private final long retryAfterSeconds;

  /**
   * Creates a denial with message and retry hint.
   *
   * @param message client-facing message
   * @param userId refused user
   * @param retryAfterSeconds seconds before the request can be retried, {@code 0} when unknown
   */
  protected AdmissionDeniedException(String message, String userId, long retryAfterSeconds) {
    super(message);
    this.userId = userId;
    this.retryAfterSeconds = Math.max(0L, retryAfterSeconds);
  }

  public String getUserId() {
    return userId;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
