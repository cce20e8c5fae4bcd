/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */
package software.amazon.event.transactionpublisher.retry;

import java.util.Objects;

/**
 * Immutable retry bookkeeping for publishing a single record. A state is either able to retry,
 * on its last try (<code>attempt == maxAttempts</code>) or exhausted (<code>attempt &gt;
 * maxAttempts</code>). Each step produces a new value through {@link #next()}.
 */
public final class RetryState {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_DELAY_MILLIS = 200; // 200ms

  private static final RetryState DEFAULT =
      new RetryState(1, DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY_MILLIS);

  private final int attempt;
  private final int maxAttempts;
  private final long delayMillis;

  private RetryState(int attempt, int maxAttempts, long delayMillis) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1 but was " + attempt);
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0 but was " + maxAttempts);
    }
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must be >= 0 but was " + delayMillis);
    }
    this.attempt = attempt;
    this.maxAttempts = maxAttempts;
    this.delayMillis = delayMillis;
  }

  public static RetryState of(int attempt, int maxAttempts, long delayMillis) {
    return new RetryState(attempt, maxAttempts, delayMillis);
  }

  /** First attempt of a record under the given budget. */
  public static RetryState initial(int maxAttempts, long delayMillis) {
    return new RetryState(1, maxAttempts, delayMillis);
  }

  /** The baseline used when neither the caller nor the configuration supplies a policy. */
  public static RetryState getDefault() {
    return DEFAULT;
  }

  public int getAttempt() {
    return attempt;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getDelayMillis() {
    return delayMillis;
  }

  public boolean isExhausted() {
    return attempt > maxAttempts;
  }

  public boolean isLastTry() {
    return attempt == maxAttempts;
  }

  public RetryState next() {
    var doubled = delayMillis > Long.MAX_VALUE / 2 ? Long.MAX_VALUE : delayMillis * 2;
    return new RetryState(attempt + 1, maxAttempts, doubled);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryState)) return false;
    var that = (RetryState) o;
    return attempt == that.attempt
        && maxAttempts == that.maxAttempts
        && delayMillis == that.delayMillis;
  }

  @Override
  public int hashCode() {
    return Objects.hash(attempt, maxAttempts, delayMillis);
  }

  @Override
  public String toString() {
    return String.format(
        "RetryState{attempt=%d, maxAttempts=%d, delayMillis=%d}", attempt, maxAttempts, delayMillis);
  }
}
