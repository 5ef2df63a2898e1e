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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Var;

/**
 * A map whose entries expire once a time-to-live, supplied with every write, has elapsed. When bounded, inserting a new key into a full map first evicts an entry that
 * expires the soonest.
 * <p>
 * Reads never purge, so {@link #get} may return a value that has already expired. Callers that
 * must not observe such a value consult {@link #hasExpiredItems()} and purge with
 * {@link #removeExpiredItems()} first.
 * <p>
 * Times are kept as nanoseconds since the ticker reading taken when the map was created, so that
 * only differences between readings are used and a ticker near the ends of the {@code long} range
 * behaves like any other.
 * <p>
 * This class is not thread-safe.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
final class TtlMap<K, V> {
  static final Logger logger = System.getLogger(TtlMap.class.getName());

  /** The capacity of a map that is never bounded. */
  static final long UNBOUNDED = Hourglass.UNSET;

  /** The largest time-to-live honored, in nanoseconds (~146 years). */
  static final long MAXIMUM_EXPIRY = (Long.MAX_VALUE >> 1);

  final @Nullable RemovalListener<K, V> removalListener;
  final OverwritePolicy overwritePolicy;
  final StatsCounter statsCounter;
  final HashMap<K, Node<V>> data;
  final ExpiryIndex<K> index;
  final long maximumSize;
  final long granularity;
  final Executor executor;
  final Ticker ticker;
  final long origin;

  TtlMap(Hourglass<K, V> builder) {
    this.maximumSize = builder.hasMaximum() ? builder.getMaximum() : UNBOUNDED;
    this.statsCounter = builder.newStatsCounter();
    this.data = new HashMap<>();
    this.index = new ExpiryIndex<>();
    this.granularity = builder.getExpiryGranularityNanos();
    this.overwritePolicy = builder.getOverwritePolicy();
    this.removalListener = builder.getRemovalListener();
    this.executor = builder.getExecutor();
    this.ticker = builder.getTicker();
    this.origin = ticker.read();
  }

  /** Returns the nanoseconds elapsed since this map was created. */
  long now() {
    return ticker.read() - origin;
  }

  /**
   * Returns the value associated with the key, even if it has expired.
   *
   * @param key the key whose associated value is to be returned
   * @return the resident value, or {@code null} if there is no mapping for the key
   */
  @Nullable V get(K key) {
    Node<V> node = data.get(key);
    return (node == null) ? null : node.value;
  }

  /**
   * Returns when the key's entry expires, in nanoseconds since {@link #origin}, or
   * {@link ExpiryIndex#NO_EXPIRY} if absent.
   */
  long getExpiry(K key) {
    Node<V> node = data.get(key);
    return (node == null) ? ExpiryIndex.NO_EXPIRY : node.expiry;
  }

  /**
   * Associates the value with the key for the time-to-live. If the key is new and the map is at its
   * maximum size then an entry that expires the soonest is evicted first. If the key is present
   * then its value is replaced and its expiration time is decided by the {@link OverwritePolicy},
   * unless the previous entry had already expired, in which case it is treated as absent.
   *
   * @param key the key with which the value is to be associated
   * @param value the value to be associated with the key
   * @param ttl the duration after which the entry expires, where zero or a negative duration
   *        results in an entry that has already expired
   * @return if a live entry was present for the key
   */
  @CanIgnoreReturnValue
  boolean set(K key, V value, Duration ttl) {
    requireNonNull(key);
    requireNonNull(value);
    requireNonNull(ttl);

    long now = now();
    long expiry = expiresAt(now, ttl);
    Node<V> node = data.get(key);
    if (node == null) {
      if ((maximumSize != UNBOUNDED) && (data.size() >= maximumSize)) {
        evict(now);
      }
      data.put(key, new Node<>(value, expiry));
      index.add(expiry, key);
      return false;
    }

    V oldValue = node.value;
    boolean live = (node.expiry > now);
    index.remove(key);
    node.expiry = live ? overwritePolicy.expiry(node.expiry, expiry) : expiry;
    node.value = value;
    index.add(node.expiry, key);

    notifyRemoval(key, oldValue, live ? RemovalCause.REPLACED : RemovalCause.EXPIRED);
    return live;
  }

  /**
   * Removes the key's entry, if present.
   *
   * @param key the key whose mapping is to be removed
   * @return if a live entry was removed
   */
  @CanIgnoreReturnValue
  boolean remove(K key) {
    Node<V> node = data.remove(key);
    if (node == null) {
      return false;
    }
    index.remove(key);

    boolean live = (node.expiry > now());
    notifyRemoval(key, node.value, live ? RemovalCause.EXPLICIT : RemovalCause.EXPIRED);
    return live;
  }

  /** Returns if at least one resident entry has expired. */
  boolean hasExpiredItems() {
    return !index.isEmpty() && (index.peekMinimum() <= now());
  }

  /**
   * Removes every entry that has expired as of a single reading of the ticker.
   *
   * @return if any entry was removed
   */
  @CanIgnoreReturnValue
  boolean removeExpiredItems() {
    long now = now();
    @Var boolean removed = false;
    while (!index.isEmpty() && (index.peekMinimum() <= now)) {
      K key = requireNonNull(index.pollMinimum());
      Node<V> node = requireNonNull(data.remove(key));
      notifyRemoval(key, node.value, RemovalCause.EXPIRED);
      removed = true;
    }
    return removed;
  }

  /**
   * Evicts a single entry that expires the soonest. If the index is empty then nothing is evicted,
   * which allows a map with a maximum size of zero to hold its first entry.
   */
  void evict(long now) {
    K victim = index.pollMinimum();
    if (victim == null) {
      return;
    }
    Node<V> node = requireNonNull(data.remove(victim));
    RemovalCause cause = (node.expiry <= now) ? RemovalCause.EXPIRED : RemovalCause.SIZE;
    notifyRemoval(victim, node.value, cause);
  }

  /** Removes all of the entries, notifying the listener of each as an explicit removal. */
  void clear() {
    List<Map.Entry<K, Node<V>>> entries = new ArrayList<>(data.entrySet());
    data.clear();
    index.clear();
    for (var entry : entries) {
      notifyRemoval(entry.getKey(), entry.getValue().value, RemovalCause.EXPLICIT);
    }
  }

  /** Returns the number of resident entries, including those that have expired. */
  int size() {
    return data.size();
  }

  boolean isEmpty() {
    return data.isEmpty();
  }

  /** Returns the maximum size, if bounded. */
  OptionalLong capacity() {
    return (maximumSize == UNBOUNDED) ? OptionalLong.empty() : OptionalLong.of(maximumSize);
  }

  /** Returns the expiration time for an entry written now, rounded down to the granularity. */
  long expiresAt(long now, Duration ttl) {
    long duration = Math.max(-MAXIMUM_EXPIRY,
        Math.min(MAXIMUM_EXPIRY, Hourglass.saturatedToNanos(ttl)));
    return roundDown(saturatedAdd(now, duration));
  }

  /** Rounds the time down to the granularity, leaving saturated times as they are. */
  long roundDown(long time) {
    if ((granularity <= 1) || (time == Long.MAX_VALUE) || (time == Long.MIN_VALUE)) {
      return time;
    }
    long rounded = time - Math.floorMod(time, granularity);
    return (rounded > time) ? time : rounded;
  }

  /** Returns the sum of {@code a} and {@code b} unless it would overflow or underflow. */
  static long saturatedAdd(long a, long b) {
    long naiveSum = a + b;
    if (((a ^ b) < 0) | ((a ^ naiveSum) >= 0)) {
      return naiveSum;
    }
    return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
  }

  /** Records the removal and notifies the listener on the executor. */
  void notifyRemoval(K key, V value, RemovalCause cause) {
    statsCounter.recordRemoval(cause);
    if (removalListener == null) {
      return;
    }

    RemovalListener<K, V> listener = removalListener;
    Runnable task = () -> {
      try {
        listener.onRemoval(key, value, cause);
      } catch (Throwable t) {
        logger.log(Level.WARNING, "Exception thrown by removal listener", t);
      }
    };
    try {
      executor.execute(task);
    } catch (Throwable t) {
      logger.log(Level.ERROR, "Exception thrown when submitting removal listener", t);
      task.run();
    }
  }

  /** A mutable holder of the value and its expiration time. */
  static final class Node<V> {
    V value;
    long expiry;

    Node(V value, long expiry) {
      this.value = value;
      this.expiry = expiry;
    }
  }
}
