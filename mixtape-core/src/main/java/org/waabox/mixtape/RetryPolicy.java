package org.waabox.mixtape;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how many times entering a replica scope is attempted before the
 * replica is skipped.
 *
 * <p>Instances are created through static factory methods. The default
 * policy makes 2 attempts with a 1-second backoff between them.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 2;

  /** The default backoff duration. */
  private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);

  /** The maximum number of attempts. */
  private final int maxAttempts;

  /** The duration to wait between attempts. */
  private final Duration backoff;

  /**
   * Creates a new retry policy.
   *
   * @param maxAttempts the maximum number of attempts, the first one
   *                    included, must be greater than zero
   * @param backoff     the duration to wait between attempts, never null
   */
  private RetryPolicy(final int maxAttempts, final Duration backoff) {
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the maximum number of attempts, the first one
   *                    included, must be greater than zero
   * @param backoff     the duration to wait between attempts, never null or
   *                    negative
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero, or backoff is negative
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts, final Duration backoff) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException(
          "backoff must not be negative, got: " + backoff);
    }
    return new RetryPolicy(maxAttempts, backoff);
  }

  /**
   * Creates a retry policy with sensible defaults: 2 attempts with a
   * 1-second backoff.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
  }

  /**
   * Creates a policy that tries exactly once.
   *
   * @return the single-attempt policy, never null
   */
  public static RetryPolicy singleAttempt() {
    return new RetryPolicy(1, Duration.ZERO);
  }

  /**
   * Returns the maximum number of attempts.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the duration to wait between attempts.
   *
   * @return the backoff duration, never null
   */
  public Duration backoff() {
    return backoff;
  }
}
