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

import static io.github.hourglass.cache.Hourglass.requireState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * An ordered multimap from an expiration time to the keys that expire at that time, yielding the
 * keys that expire the soonest first. A key may be indexed at most once, and can be removed
 * regardless of the time that it is filed under.
 * <p>
 * This class is not thread-safe.
 *
 * @param <K> the type of keys maintained by this index
 */
final class ExpiryIndex<K> {

  /*
   * The index is a sorted map from the expiration time to a bucket of the keys that expire at that
   * time, in insertion order. A reverse mapping from the key to its time locates the bucket of an
   * arbitrary key in O(lg n) time, after which the key is removed by scanning the bucket. The
   * callers round the times down to a coarse granularity so that ties are common, which keeps the
   * number of buckets small, while the buckets themselves stay short enough for the scan to be
   * cheap. A bucket is discarded as soon as it becomes empty so that the minimum is always the head
   * of a non-empty bucket.
   */

  /** The value returned by {@link #peekMinimum()} when the index is empty. */
  static final long NO_EXPIRY = Long.MAX_VALUE;

  final NavigableMap<Long, ArrayDeque<K>> buckets;
  final Map<K, Long> instants;

  ExpiryIndex() {
    this.instants = new HashMap<>();
    this.buckets = new TreeMap<>();
  }

  /**
   * Files the key under the expiration time.
   *
   * @param instant the time when the key expires, in nanoseconds
   * @param key the key to index
   * @throws IllegalStateException if the key is already indexed
   */
  void add(long instant, K key) {
    requireNonNull(key);
    Long previous = instants.putIfAbsent(key, instant);
    requireState(previous == null, "%s is already indexed at %s", key, previous);
    buckets.computeIfAbsent(instant, time -> new ArrayDeque<>(2)).addLast(key);
  }

  /**
   * Removes the key from the index.
   *
   * @param key the key to remove
   * @return if the key was indexed
   */
  @CanIgnoreReturnValue
  boolean remove(K key) {
    Long instant = instants.remove(key);
    if (instant == null) {
      return false;
    }
    ArrayDeque<K> bucket = requireNonNull(buckets.get(instant));
    bucket.remove(key);
    if (bucket.isEmpty()) {
      buckets.remove(instant);
    }
    return true;
  }

  /**
   * Returns the earliest expiration time, or {@link #NO_EXPIRY} if the index is empty. As a key may
   * legitimately be filed under {@link #NO_EXPIRY}, callers that need to tell the two apart should
   * check {@link #isEmpty()}.
   */
  long peekMinimum() {
    return buckets.isEmpty() ? NO_EXPIRY : buckets.firstKey();
  }

  /**
   * Removes and returns a single key from those that expire the soonest. When several keys share
   * the earliest time they are returned one per call, in the order that they were added.
   *
   * @return the key that expires the soonest, or {@code null} if the index is empty
   */
  @Nullable K pollMinimum() {
    Map.Entry<Long, ArrayDeque<K>> first = buckets.firstEntry();
    if (first == null) {
      return null;
    }
    ArrayDeque<K> bucket = first.getValue();
    K key = requireNonNull(bucket.pollFirst());
    if (bucket.isEmpty()) {
      buckets.pollFirstEntry();
    }
    instants.remove(key);
    return key;
  }

  /** Returns if the key is indexed. */
  boolean contains(K key) {
    return instants.containsKey(key);
  }

  /** Returns the time that the key is filed under, or {@link #NO_EXPIRY} if it is not indexed. */
  long instantOf(K key) {
    Long instant = instants.get(key);
    return (instant == null) ? NO_EXPIRY : instant;
  }

  /** Returns the number of indexed keys. */
  int size() {
    return instants.size();
  }

  /** Returns the number of distinct expiration times. */
  int bucketCount() {
    return buckets.size();
  }

  boolean isEmpty() {
    return instants.isEmpty();
  }

  void clear() {
    instants.clear();
    buckets.clear();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + buckets;
  }
}
