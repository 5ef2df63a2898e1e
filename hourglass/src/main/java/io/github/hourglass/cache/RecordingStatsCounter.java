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

import java.util.concurrent.atomic.LongAdder;

import io.github.hourglass.cache.stats.CacheStats;

/**
 * A {@link StatsCounter} that sums events in {@link LongAdder}s, since hits and misses are recorded
 * by readers that share the cache's lock.
 */
final class RecordingStatsCounter implements StatsCounter {
  final LongAdder hits = new LongAdder();
  final LongAdder misses = new LongAdder();
  final LongAdder loadSuccesses = new LongAdder();
  final LongAdder loadFailures = new LongAdder();
  final LongAdder loadNanos = new LongAdder();
  final LongAdder evictions = new LongAdder();
  final LongAdder expirations = new LongAdder();

  @Override
  public void recordHit() {
    hits.increment();
  }

  @Override
  public void recordMiss() {
    misses.increment();
  }

  @Override
  public void recordLoad(long nanos, boolean succeeded) {
    (succeeded ? loadSuccesses : loadFailures).increment();
    loadNanos.add(Math.max(0L, nanos));
  }

  @Override
  public void recordRemoval(RemovalCause cause) {
    if (cause == RemovalCause.SIZE) {
      evictions.increment();
    } else if (cause == RemovalCause.EXPIRED) {
      expirations.increment();
    }
  }

  @Override
  public CacheStats snapshot() {
    return CacheStats.of(sum(hits), sum(misses), sum(loadSuccesses),
        sum(loadFailures), sum(loadNanos), sum(evictions), sum(expirations));
  }

  /** Returns the adder's total, pinned to {@link Long#MAX_VALUE} once it has overflowed. */
  private static long sum(LongAdder adder) {
    long total = adder.sum();
    return (total < 0) ? Long.MAX_VALUE : total;
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}
