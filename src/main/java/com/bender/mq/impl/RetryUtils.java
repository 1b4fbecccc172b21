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
package com.bender.mq.impl;

import static java.lang.String.format;

import com.bender.mq.AmqpException;
import com.bender.mq.RetryPolicy;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class RetryUtils {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryUtils.class);

  private RetryUtils() {}

  static <T> T callAndMaybeRetry(
      Callable<T> operation,
      Predicate<Exception> retryCondition,
      RetryPolicy retryPolicy,
      String format,
      Object... args) {
    return callAndMaybeRetry(operation, retryCondition, retryPolicy, null, format, args);
  }

  /**
   * Call an operation and retry it if it fails with a retryable error.
   *
   * <p>Retries stop when the policy returns no delay, when the next delay would go beyond the
   * timeout, or when the thread is interrupted.
   *
   * @param operation the operation
   * @param retryCondition whether a failure can be retried
   * @param retryPolicy the delays between attempts
   * @param timeout the overall timeout, null for none
   * @param format description of the operation
   * @param args arguments of the description
   * @return the result of the operation
   * @param <T> type of the result
   */
  static <T> T callAndMaybeRetry(
      Callable<T> operation,
      Predicate<Exception> retryCondition,
      RetryPolicy retryPolicy,
      Duration timeout,
      String format,
      Object... args) {
    String description = format(format, args);
    int attempt = 0;
    Exception lastException = null;
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    long deadline = Utils.deadline(timeout);
    boolean keepTrying = true;
    while (keepTrying) {
      try {
        attempt++;
        LOGGER.debug("Starting attempt #{} for operation '{}'", attempt, description);
        T result = operation.call();
        LOGGER.debug(
            "Operation '{}' completed in {} ms after {} attempt(s)",
            description,
            stopWatch.stop().toMillis(),
            attempt);
        return result;
      } catch (Exception e) {
        lastException = e;
        if (retryCondition.test(e)) {
          Optional<Duration> delay = retryPolicy.nextDelay(attempt);
          if (!delay.isPresent()) {
            keepTrying = false;
          } else if (Utils.capWait(delay.get()).toNanos() >= deadline - System.nanoTime()) {
            LOGGER.debug("Operation '{}' failed, timeout would be exceeded", description);
            keepTrying = false;
          } else {
            LOGGER.debug(
                "Operation '{}' failed ({}), retrying in {} ms...",
                description,
                exceptionMessage(e),
                delay.get().toMillis());
            if (!delay.get().isZero()) {
              try {
                Thread.sleep(delay.get().toMillis());
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                lastException = ex;
                keepTrying = false;
              }
            }
          }
        } else {
          keepTrying = false;
        }
      }
    }
    String message =
        format(
            "Could not complete task '%s' after %d attempt(s) (reason: %s)",
            description, attempt, exceptionMessage(lastException));
    LOGGER.debug(message);
    if (lastException instanceof RuntimeException) {
      throw (RuntimeException) lastException;
    } else {
      throw new AmqpException(message, lastException);
    }
  }

  /**
   * Remaining time before a deadline.
   *
   * @param deadline deadline in nanoseconds ({@link System#nanoTime()} scale)
   * @param max maximum value to return
   * @return the remaining time, at most max
   */
  static Duration remaining(long deadline, Duration max) {
    long remaining = deadline - System.nanoTime();
    if (remaining <= 0) {
      return Duration.ZERO;
    }
    Duration capped = Utils.capWait(max);
    return remaining < capped.toNanos() ? Duration.ofNanos(remaining) : capped;
  }

  static String exceptionMessage(Exception e) {
    if (e == null) {
      return "unknown";
    } else if (e.getMessage() == null) {
      return e.getClass().getSimpleName();
    } else {
      return e.getMessage() + " [" + e.getClass().getSimpleName() + "]";
    }
  }
}
