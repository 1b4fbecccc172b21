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

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class Utils {

  static final Supplier<String> NAME_SUPPLIER = new NameSupplier("bender-mq-");

  /** Longest wait, keeps {@link System#nanoTime()} deadlines within the range of a long. */
  static final Duration MAX_WAIT = Duration.ofNanos(Long.MAX_VALUE / 4);

  private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+)\\s*(ms|s|m|h)?$");

  private Utils() {}

  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadFactory backingThreadFactory;

    private final String prefix;

    private final AtomicLong count = new AtomicLong(0);

    private NamedThreadFactory(String prefix) {
      this(Executors.defaultThreadFactory(), prefix);
    }

    private NamedThreadFactory(ThreadFactory backingThreadFactory, String prefix) {
      this.backingThreadFactory = backingThreadFactory;
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = this.backingThreadFactory.newThread(r);
      thread.setName(prefix + count.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }

  static ThreadFactory threadFactory(String prefix) {
    if (prefix == null) {
      return Executors.defaultThreadFactory();
    } else {
      return new NamedThreadFactory(prefix);
    }
  }

  static void throwIfInterrupted() throws InterruptedException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException();
    }
  }

  static void maybeClose(AutoCloseable closeable, Consumer<Exception> exceptionCallback) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        exceptionCallback.accept(e);
      }
    }
  }

  static Duration capWait(Duration duration) {
    return duration == null || duration.compareTo(MAX_WAIT) > 0 ? MAX_WAIT : duration;
  }

  /**
   * Deadline in {@link System#nanoTime()} scale.
   *
   * @param timeout the timeout, null or a value above {@link #MAX_WAIT} for the longest wait
   * @return the deadline
   */
  static long deadline(Duration timeout) {
    return System.nanoTime() + capWait(timeout).toNanos();
  }

  /**
   * Parse a duration.
   *
   * <p>Accepts ISO-8601 ({@code PT5S}), shorthand ({@code 250ms}, {@code 5s}, {@code 2m}, {@code
   * 1h}), and milliseconds ({@code 1500}).
   *
   * @param value the value to parse
   * @return the duration
   * @throws IllegalArgumentException if the value cannot be parsed or is negative
   */
  static Duration parseDuration(String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException("Duration value cannot be empty");
    }
    String text = value.trim();
    if (text.toUpperCase(Locale.ENGLISH).startsWith("P")) {
      try {
        Duration duration = Duration.parse(text.toUpperCase(Locale.ENGLISH));
        if (duration.isNegative()) {
          throw new IllegalArgumentException("Duration cannot be negative: " + value);
        }
        return duration;
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid ISO-8601 duration: " + value, e);
      }
    }
    Matcher matcher = DURATION_PATTERN.matcher(text.toLowerCase(Locale.ENGLISH));
    if (!matcher.matches()) {
      throw new IllegalArgumentException(
          "Invalid duration: " + value + " (expected e.g. PT5S, 250ms, 5s, 2m, 1h, or 1500)");
    }
    long amount;
    try {
      amount = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration: " + value, e);
    }
    String unit = matcher.group(2);
    try {
      if (unit == null || "ms".equals(unit)) {
        return Duration.ofMillis(amount);
      } else if ("s".equals(unit)) {
        return Duration.ofSeconds(amount);
      } else if ("m".equals(unit)) {
        return Duration.ofMinutes(amount);
      } else {
        return Duration.ofHours(amount);
      }
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Duration out of range: " + value, e);
    }
  }

  static class StopWatch {

    private final long start = System.nanoTime();
    private Duration duration;

    Duration stop() {
      this.duration = Duration.ofNanos(System.nanoTime() - start);
      return this.duration;
    }
  }

  private static class NameSupplier implements Supplier<String> {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong(0);

    private NameSupplier(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public String get() {
      return this.prefix + this.sequence.incrementAndGet();
    }
  }
}
