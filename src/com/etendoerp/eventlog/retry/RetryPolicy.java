package com.etendoerp.eventlog.retry;

/**
 * Retry policy applied to failed deliveries.
 */
public interface RetryPolicy {
  /**
   * Determines whether another attempt should be made.
   *
   * @param attemptNumber number of the attempt that would follow (1 for the first retry)
   * @param elapsedMs time spent since the first attempt started, in milliseconds
   * @return true if the operation should be retried
   */
  boolean shouldRetry(int attemptNumber, long elapsedMs);

  /**
   * Gets the time to wait before the given attempt.
   *
   * @param attemptNumber number of the upcoming attempt (1 for the first retry)
   * @return delay in milliseconds
   */
  long getRetryDelay(int attemptNumber);
}
