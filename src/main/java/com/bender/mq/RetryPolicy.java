// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.bender.mq;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Optional;
import java.util.SplittableRandom;

/**
 * Contract to determine the delay before the next attempt of some task.
 *
 * <p>The task is typically the creation of a connection, a declaration, or a publish. Policies are
 * pure: the same attempt number always gives the same delay.
 */
public interface RetryPolicy {

  int DEFAULT_MAX_ATTEMPTS = 10;
  Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);
  double DEFAULT_MULTIPLIER = 2.0;
  Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
  double DEFAULT_JITTER_FRACTION = 0.2;

  /**
   * Returns the delay to wait before the next attempt.
   *
   * @param attempt number of failed attempts so far, starting at 1
   * @return the delay, empty if the task should stop being retried
   */
  Optional<Duration> nextDelay(int attempt);

  /**
   * Exponential backoff policy with the default settings.
   *
   * @return the default policy
   */
  static RetryPolicy defaultPolicy() {
    return exponential().build();
  }

  /**
   * Builder for an exponential backoff policy with jitter.
   *
   * @return the builder
   */
  static ExponentialBuilder exponential() {
    return new ExponentialBuilder();
  }

  /**
   * Policy with a fixed delay.
   *
   * @param delay the delay between attempts
   * @param maxAttempts the maximum number of attempts, 0 for no limit
   * @return fixed-delay policy
   */
  static RetryPolicy fixed(Duration delay, int maxAttempts) {
    return new FixedRetryPolicy(delay, maxAttempts);
  }

  /** Builder for {@link ExponentialRetryPolicy}. */
  final class ExponentialBuilder {

    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration baseDelay = DEFAULT_BASE_DELAY;
    private double multiplier = DEFAULT_MULTIPLIER;
    private Duration maxDelay = DEFAULT_MAX_DELAY;
    private double jitterFraction = DEFAULT_JITTER_FRACTION;
    private long seed = System.nanoTime();

    private ExponentialBuilder() {}

    /**
     * Maximum number of attempts, 0 means no limit.
     *
     * @param maxAttempts maximum number of attempts
     * @return this builder
     */
    public ExponentialBuilder maxAttempts(int maxAttempts) {
      if (maxAttempts < 0) {
        throw new IllegalArgumentException("Maximum attempts must be positive or 0");
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    public ExponentialBuilder baseDelay(Duration baseDelay) {
      if (baseDelay == null || baseDelay.isNegative()) {
        throw new IllegalArgumentException("Base delay must be positive");
      }
      this.baseDelay = baseDelay;
      return this;
    }

    public ExponentialBuilder multiplier(double multiplier) {
      if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
        throw new IllegalArgumentException("Multiplier must be greater than or equal to 1");
      }
      this.multiplier = multiplier;
      return this;
    }

    public ExponentialBuilder maxDelay(Duration maxDelay) {
      if (maxDelay == null || maxDelay.isNegative()) {
        throw new IllegalArgumentException("Maximum delay must be positive");
      }
      this.maxDelay = maxDelay;
      return this;
    }

    /**
     * Randomization amount, between 0 and 1.
     *
     * <p>A delay {@code d} becomes a value between {@code d * (1 - jitterFraction)} and {@code d *
     * (1 + jitterFraction)}.
     *
     * @param jitterFraction the jitter fraction
     * @return this builder
     */
    public ExponentialBuilder jitterFraction(double jitterFraction) {
      if (jitterFraction < 0.0 || jitterFraction > 1.0 || Double.isNaN(jitterFraction)) {
        throw new IllegalArgumentException("Jitter fraction must be between 0 and 1");
      }
      this.jitterFraction = jitterFraction;
      return this;
    }

    /**
     * Seed of the jitter.
     *
     * <p>Two policies with the same settings and seed return the same delays.
     *
     * @param seed the seed
     * @return this builder
     */
    public ExponentialBuilder seed(long seed) {
      this.seed = seed;
      return this;
    }

    public RetryPolicy build() {
      if (this.maxDelay.compareTo(this.baseDelay) < 0) {
        throw new IllegalArgumentException("Maximum delay must not be shorter than base delay");
      }
      return new ExponentialRetryPolicy(
          maxAttempts, baseDelay, multiplier, maxDelay, jitterFraction, seed);
    }
  }

  /**
   * Exponential backoff with jitter.
   *
   * <p>The raw delay of attempt {@code n} is {@code baseDelay * multiplier^(n-1)}, capped at {@code
   * maxDelay}, then shifted by a jitter derived from the seed and {@code n}. The returned delays
   * never decrease from one attempt to the next and never exceed {@code maxDelay * (1 +
   * jitterFraction)}.
   */
  final class ExponentialRetryPolicy implements RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFraction;
    private final long seed;

    private ExponentialRetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        double multiplier,
        Duration maxDelay,
        double jitterFraction,
        long seed) {
      this.maxAttempts = maxAttempts;
      this.baseDelay = baseDelay;
      this.multiplier = multiplier;
      this.maxDelay = maxDelay;
      this.jitterFraction = jitterFraction;
      this.seed = seed;
    }

    @Override
    public Optional<Duration> nextDelay(int attempt) {
      if (attempt < 1) {
        throw new IllegalArgumentException("Attempt number must be greater than 0");
      }
      if (this.maxAttempts > 0 && attempt >= this.maxAttempts) {
        return Optional.empty();
      }
      long delay = 0;
      for (int n = 1; n <= attempt; n++) {
        delay = Math.max(delay, jittered(n));
      }
      return Optional.of(Duration.ofMillis(delay));
    }

    private long jittered(int n) {
      double max = this.maxDelay.toMillis();
      double raw = Math.min(this.baseDelay.toMillis() * Math.pow(this.multiplier, n - 1), max);
      double random = new SplittableRandom(this.seed + n).nextDouble();
      double jittered = raw * (1 + this.jitterFraction * (2 * random - 1));
      return (long) Math.min(jittered, max * (1 + this.jitterFraction));
    }

    public int maxAttempts() {
      return this.maxAttempts;
    }

    @Override
    public String toString() {
      return "ExponentialRetryPolicy{"
          + "maxAttempts="
          + maxAttempts
          + ", baseDelay="
          + baseDelay
          + ", multiplier="
          + multiplier
          + ", maxDelay="
          + maxDelay
          + ", jitterFraction="
          + jitterFraction
          + '}';
    }
  }

  final class FixedRetryPolicy implements RetryPolicy {

    private final Optional<Duration> delay;
    private final int maxAttempts;

    @SuppressFBWarnings("CT_CONSTRUCTOR_THROW")
    private FixedRetryPolicy(Duration delay, int maxAttempts) {
      if (delay == null || delay.isNegative()) {
        throw new IllegalArgumentException("Delay must be positive");
      }
      if (maxAttempts < 0) {
        throw new IllegalArgumentException("Maximum attempts must be positive or 0");
      }
      this.delay = Optional.of(delay);
      this.maxAttempts = maxAttempts;
    }

    @Override
    public Optional<Duration> nextDelay(int attempt) {
      if (attempt < 1) {
        throw new IllegalArgumentException("Attempt number must be greater than 0");
      }
      if (this.maxAttempts > 0 && attempt >= this.maxAttempts) {
        return Optional.empty();
      }
      return this.delay;
    }

    @Override
    public String toString() {
      return "FixedRetryPolicy{" + "delay=" + delay.get() + ", maxAttempts=" + maxAttempts + '}';
    }
  }
}
