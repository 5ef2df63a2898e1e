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
package io.github.hourglass.cache.stats;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.Immutable;

/**
 * Counts of what a {@link io.github.hourglass.cache.TtlCache} has done since it was built, taken
 * at a single moment. A cache that was not configured to record statistics reports
 * {@link #empty()}.
 * <p>
 * Lookups are the calls to {@code getIfPresent}, including those made by a memoized function before
 * it decides whether to call its producer. Loads are the producer calls of a memoized function.
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0, 0, 0);

  private final long hits;
  private final long misses;
  private final long loadSuccesses;
  private final long loadFailures;
  private final long loadNanos;
  private final long evictions;
  private final long expirations;

  private CacheStats(long hits, long misses, long loadSuccesses, long loadFailures,
      long loadNanos, long evictions, long expirations) {
    this.hits = hits;
    this.misses = misses;
    this.loadSuccesses = loadSuccesses;
    this.loadFailures = loadFailures;
    this.loadNanos = loadNanos;
    this.evictions = evictions;
    this.expirations = expirations;
  }

  /**
   * Returns a snapshot holding the given counts.
   *
   * @throws IllegalArgumentException if a count is negative
   */
  public static CacheStats of(long hits, long misses, long loadSuccesses, long loadFailures,
      long loadNanos, long evictions, long expirations) {
    if ((hits | misses | loadSuccesses | loadFailures | loadNanos | evictions | expirations) < 0) {
      throw new IllegalArgumentException("Statistics cannot be negative");
    }
    return new CacheStats(hits, misses, loadSuccesses,
        loadFailures, loadNanos, evictions, expirations);
  }

  /** Returns a snapshot in which every count is zero. */
  public static CacheStats empty() {
    return EMPTY;
  }

  /** Returns the number of lookups that found a live value. */
  public long hits() {
    return hits;
  }

  /** Returns the number of lookups that found no live value. */
  public long misses() {
    return misses;
  }

  /** Returns the number of lookups, saturating at {@link Long#MAX_VALUE}. */
  public long requests() {
    long sum = hits + misses;
    return (sum < 0) ? Long.MAX_VALUE : sum;
  }

  /** Returns the fraction of lookups that were hits, or {@code 1.0} if there were none. */
  public double hitRate() {
    long requests = requests();
    return (requests == 0) ? 1.0 : ((double) hits / requests);
  }

  /** Returns the number of producer calls that yielded a value. */
  public long loadSuccesses() {
    return loadSuccesses;
  }

  /** Returns the number of producer calls that failed or yielded nothing. */
  public long loadFailures() {
    return loadFailures;
  }

  /** Returns the nanoseconds spent waiting on producers, whether they succeeded or not. */
  public long totalLoadNanos() {
    return loadNanos;
  }

  /** Returns the mean nanoseconds per producer call, or {@code 0.0} if there were none. */
  public double averageLoadNanos() {
    long loads = loadSuccesses + loadFailures;
    return (loads <= 0) ? 0.0 : ((double) loadNanos / loads);
  }

  /** Returns the number of live entries removed to make room for a new key. */
  public long evictions() {
    return evictions;
  }

  /** Returns the number of entries removed after their time-to-live had elapsed. */
  public long expirations() {
    return expirations;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof CacheStats)) {
      return false;
    }
    var stats = (CacheStats) o;
    return (hits == stats.hits) && (misses == stats.misses)
        && (loadSuccesses == stats.loadSuccesses) && (loadFailures == stats.loadFailures)
        && (loadNanos == stats.loadNanos) && (evictions == stats.evictions)
        && (expirations == stats.expirations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(hits, misses, loadSuccesses,
        loadFailures, loadNanos, evictions, expirations);
  }

  @Override
  public String toString() {
    return "CacheStats{hits=" + hits + ", misses=" + misses
        + ", loadSuccesses=" + loadSuccesses + ", loadFailures=" + loadFailures
        + ", loadNanos=" + loadNanos + ", evictions=" + evictions
        + ", expirations=" + expirations + '}';
  }
}
