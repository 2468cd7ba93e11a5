package eventrelay.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy whose delay grows linearly with the retry count.
 *
 * <p>Delay formula: {@code baseDelay * retryCount}, so with a five minute base the first retry
 * waits five minutes, the second ten, and so on.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;

  /**
   * @param baseDelay delay added per retry (must be &ge; 0)
   */
  public LinearBackoffRetryPolicy(Duration baseDelay) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
    }
    this.baseDelayMs = baseDelay.toMillis();
  }

  public static LinearBackoffRetryPolicy ofMinutes(long minutes) {
    return new LinearBackoffRetryPolicy(Duration.ofMinutes(minutes));
  }

  @Override
  public long computeDelayMs(int retryCount) {
    if (retryCount <= 0) {
      return 0L;
    }
    if (baseDelayMs != 0 && retryCount > Long.MAX_VALUE / baseDelayMs) {
      return Long.MAX_VALUE;
    }
    return baseDelayMs * retryCount;
  }
}
