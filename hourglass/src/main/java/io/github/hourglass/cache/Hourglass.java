/*
 * Copyright 2026 The Hourglass Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.hourglass.cache;

import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.StringJoiner;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * Configures and creates {@link TtlCache} instances.
 * <p>
 * Without any options the cache is unbounded, rounds expiration times down to 10 milliseconds,
 * lets the latest write decide when an entry expires, keeps no statistics and reads time from
 * {@link System#nanoTime()}. For example, a cache of at most 10,000 squares:
 * <pre>{@code
 *   TtlCache<Integer, Integer> squares = Hourglass.newBuilder()
 *       .maximumSize(10_000)
 *       .recordStats()
 *       .build();
 *   squares.put(30, 900, Duration.ofSeconds(5));
 * }</pre>
 * Each option may be given at most once. A builder may be reused, and every {@link #build()}
 * returns a new cache that shares nothing with the others.
 *
 * @param <K> the key type that the configured listener accepts, {@code Object} until one is set
 * @param <V> the value type that the configured listener accepts, {@code Object} until one is set
 */
public final class Hourglass<K, V> {
  static final long UNSET = -1L;
  static final long DEFAULT_GRANULARITY_NANOS = Duration.ofMillis(10).toNanos();

  long maximumSize = UNSET;
  long granularityNanos = UNSET;
  boolean recordStats;

  @Nullable RemovalListener<? super K, ? super V> removalListener;
  @Nullable OverwritePolicy overwritePolicy;
  @Nullable Executor executor;
  @Nullable Ticker ticker;

  private Hourglass() {}

  /** Throws an {@link IllegalArgumentException} with the formatted message unless true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(US, template, args));
    }
  }

  /** Throws an {@link IllegalStateException} with the formatted message unless true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(US, template, args));
    }
  }

  /**
   * Returns a builder with nothing configured. The {@code Object} type arguments do not restrict
   * the cache, since {@link #build()} infers its own key and value types.
   */
  @CheckReturnValue
  public static Hourglass<Object, Object> newBuilder() {
    return new Hourglass<>();
  }

  /**
   * Returns a builder configured from a comma separated list of options, such as
   * {@code "maximumSize=500, expiryGranularity=50ms, overwritePolicy=maximum, recordStats"}.
   * A duration is written as a whole number followed by {@code d}, {@code h}, {@code m}, {@code s}
   * or {@code ms}, or in the ISO-8601 form accepted by {@link Duration#parse}.
   *
   * @param configuration the options to apply
   * @return a builder with those options set
   * @throws IllegalArgumentException if an option is unknown, repeated or has a bad value
   */
  @CheckReturnValue
  public static Hourglass<Object, Object> from(String configuration) {
    return HourglassSpec.parse(configuration).toBuilder();
  }

  /**
   * Bounds the number of resident entries. Writing a new key into a full cache first removes one
   * entry with the earliest expiration time; replacing the value of a resident key removes nothing.
   * A bound of zero still admits the first entry, because there is nothing to remove, and each
   * later new key then displaces the one before it.
   *
   * @param maximumSize the largest number of entries to hold
   * @return this builder
   * @throws IllegalArgumentException if {@code maximumSize} is negative
   * @throws IllegalStateException if a bound was already set
   */
  @CanIgnoreReturnValue
  public Hourglass<K, V> maximumSize(long maximumSize) {
    requireState(this.maximumSize == UNSET, "maximumSize was already set to %,d", this.maximumSize);
    requireArgument(maximumSize >= 0, "maximumSize must not be negative: %,d", maximumSize);
    this.maximumSize = maximumSize;
    return this;
  }

  boolean hasMaximum() {
    return (maximumSize != UNSET);
  }

  long getMaximum() {
    return maximumSize;
  }

  /**
   * Rounds expiration times down to a multiple of {@code granularity}. Entries then expire up to
   * one granule early, and entries written close together share a slot in the expiration order.
   * A zero granularity keeps full nanosecond precision.
   *
   * @param granularity the unit that expiration times are rounded down to
   * @return this builder
   * @throws IllegalArgumentException if {@code granularity} is negative
   * @throws IllegalStateException if a granularity was already set
   */
  @CanIgnoreReturnValue
  public Hourglass<K, V> expiryGranularity(Duration granularity) {
    requireNonNull(granularity);
    requireState(granularityNanos == UNSET, "expiryGranularity was already set");
    requireArgument(!granularity.isNegative(), "expiryGranularity must not be negative: %s",
        granularity);
    granularityNanos = Math.max(1L, saturatedToNanos(granularity));
    return this;
  }

  long getExpiryGranularityNanos() {
    return (granularityNanos == UNSET) ? DEFAULT_GRANULARITY_NANOS : granularityNanos;
  }

  /**
   * Chooses how a write to a live entry sets its new expiration time. The value is replaced under
   * either policy. {@link OverwritePolicy#REPLACE} is used if none is chosen.
   *
   * @param overwritePolicy the rule for a live entry's new expiration time
   * @return this builder
   * @throws IllegalStateException if a policy was already set
   */
  @CanIgnoreReturnValue
  public Hourglass<K, V> overwritePolicy(OverwritePolicy overwritePolicy) {
    requireNonNull(overwritePolicy);
    requireState(this.overwritePolicy == null,
        "overwritePolicy was already set to %s", this.overwritePolicy);
    this.overwritePolicy = overwritePolicy;
    return this;
  }

  OverwritePolicy getOverwritePolicy() {
    return (overwritePolicy == null) ? OverwritePolicy.REPLACE : overwritePolicy;
  }

  /**
   * Runs removal notifications on {@code executor} instead of {@link ForkJoinPool#commonPool()}.
   * Tests usually pass {@code Runnable::run} so that the listener has run by the time the cache
   * call returns. If the executor rejects a notification it runs on the calling thread.
   *
   * @param executor where removal listeners run
   * @return this builder
   * @throws IllegalStateException if an executor was already set
   */
  @CanIgnoreReturnValue
  public Hourglass<K, V> executor(Executor executor) {
    requireNonNull(executor);
    requireState(this.executor == null, "executor was already set to %s", this.executor);
    this.executor = executor;
    return this;
  }

  Executor getExecutor() {
    return (executor == null) ? ForkJoinPool.commonPool() : executor;
  }

  /**
   * Reads time from {@code ticker} instead of {@link System#nanoTime()}, which lets tests move time
   * forward by hand.
   *
   * @param ticker the nanosecond time source
   * @return this builder
   * @throws IllegalStateException if a ticker was already set
   */
  @CanIgnoreReturnValue
  public Hourglass<K, V> ticker(Ticker ticker) {
    requireNonNull(ticker);
    requireState(this.ticker == null, "ticker was already set to %s", this.ticker);
    this.ticker = ticker;
    return this;
  }

  Ticker getTicker() {
    return (ticker == null) ? Ticker.systemTicker() : ticker;
  }

  /**
   * Tells {@code removalListener} about every entry that leaves the cache, along with the
   * {@link RemovalCause}. An expired entry is reported when it is purged, which happens during a
   * later call on the cache. A listener that throws has its exception logged and otherwise ignored.
   * <p>
   * The returned builder is this one with narrower type arguments; keep using it rather than the
   * original reference so that the listener's types are checked.
   *
   * @param removalListener the listener to notify
   * @param <K1> the key type of the listener
   * @param <V1> the value type of the listener
   * @return this builder, typed to match the listener
   * @throws IllegalStateException if a listener was already set
   */
  @CanIgnoreReturnValue
  public <K1 extends K, V1 extends V> Hourglass<K1, V1> removalListener(
      RemovalListener<? super K1, ? super V1> removalListener) {
    requireNonNull(removalListener);
    requireState(this.removalListener == null, "removalListener was already set");

    @SuppressWarnings("unchecked")
    var narrowed = (Hourglass<K1, V1>) this;
    narrowed.removalListener = removalListener;
    return narrowed;
  }

  @SuppressWarnings("unchecked")
  <K1 extends K, V1 extends V> @Nullable RemovalListener<K1, V1> getRemovalListener() {
    return (RemovalListener<K1, V1>) removalListener;
  }

  /**
   * Counts hits, misses, producer calls and removals so that {@link TtlCache#stats()} can report
   * them. Without this option every count stays zero.
   *
   * @return this builder
   * @throws IllegalStateException if statistics were already enabled
   */
  @CanIgnoreReturnValue
  public Hourglass<K, V> recordStats() {
    requireState(!recordStats, "recordStats was already set");
    recordStats = true;
    return this;
  }

  boolean isRecordingStats() {
    return recordStats;
  }

  StatsCounter newStatsCounter() {
    return recordStats ? new RecordingStatsCounter() : StatsCounter.DISABLED;
  }

  /**
   * Returns a new thread-safe cache with the configured options.
   *
   * @param <K1> the key type of the cache
   * @param <V1> the value type of the cache
   * @return an empty cache
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> TtlCache<K1, V1> build() {
    @SuppressWarnings("unchecked")
    var narrowed = (Hourglass<K1, V1>) this;
    return new LocalTtlCache<>(narrowed);
  }

  /** Returns the duration in nanoseconds, pinned to the long range when it does not fit. */
  static long saturatedToNanos(Duration duration) {
    if (duration.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L) {
      return Long.MAX_VALUE;
    } else if (duration.getSeconds() <= Long.MIN_VALUE / 1_000_000_000L) {
      return Long.MIN_VALUE;
    }
    return duration.toNanos();
  }

  @Override
  public String toString() {
    var options = new StringJoiner(", ", "Hourglass{", "}");
    if (maximumSize != UNSET) {
      options.add("maximumSize=" + maximumSize);
    }
    if (granularityNanos != UNSET) {
      options.add("expiryGranularity=" + granularityNanos + "ns");
    }
    if (overwritePolicy != null) {
      options.add("overwritePolicy=" + overwritePolicy.name().toLowerCase(US));
    }
    if (removalListener != null) {
      options.add("removalListener");
    }
    if (recordStats) {
      options.add("recordStats");
    }
    return options.toString();
  }
}
