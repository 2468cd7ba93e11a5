package eventrelay.dispatch;

/**
 * Strategy for computing the delay before retrying a failed event.
 *
 * @see LinearBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param retryCount the retry count after the failure being handled (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int retryCount);
}
