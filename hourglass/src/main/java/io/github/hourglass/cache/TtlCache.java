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

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;

import io.github.hourglass.cache.stats.CacheStats;

/**
 * An in-memory map in which every entry carries its own time-to-live. Entries are written by
 * {@link #put(Object, Object, Duration)} or by a function from {@link #memoize(Function)}, and stay
 * until they expire, are displaced by the size bound or are invalidated.
 * <p>
 * An entry whose time-to-live has elapsed is never returned, even while it still occupies the
 * cache. Such entries are purged by a later read or write rather than by a background thread.
 * <p>
 * All methods may be called from any number of threads at once. Values are handed out by
 * reference, so a caller that mutates a value affects every other reader of it.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface TtlCache<K, V> {

  /**
   * Returns the value associated with the {@code key} in this cache, or {@code null} if there is
   * no live cached value for the {@code key}. If any entry in the cache has expired then the
   * expired entries are purged before the lookup.
   *
   * @param key the key to look up
   * @return the live value, or {@code null}
   * @throws NullPointerException if {@code key} is null
   */
  @Nullable V getIfPresent(K key);

  /**
   * Associates the {@code value} with the {@code key} in this cache until the {@code ttl} elapses.
   * If the cache previously contained a value associated with the {@code key}, the old value is
   * replaced by the new {@code value}. If the key is new and the cache is at its maximum size, an
   * entry that expires the soonest is evicted first.
   *
   * @param key the key to write
   * @param value the value to store
   * @param ttl the time-to-live of the entry, where zero or a negative duration stores an entry
   *        that has already expired
   * @return if a live value was replaced
   * @throws NullPointerException if any argument is null
   */
  @CanIgnoreReturnValue
  boolean put(K key, V value, Duration ttl);

  /**
   * Discards any cached value for the {@code key}.
   *
   * @param key the key to remove
   * @return if a live value was discarded
   * @throws NullPointerException if {@code key} is null
   */
  @CanIgnoreReturnValue
  boolean invalidate(K key);

  /** Discards all entries in the cache. */
  void invalidateAll();

  /**
   * Returns the number of entries resident in this cache. The value may include entries that have
   * expired but have not yet been purged.
   *
   * @return the number of entries in this cache
   */
  int size();

  /** Returns if this cache has no resident entries. */
  boolean isEmpty();

  /**
   * Returns if at least one resident entry has expired and is waiting to be purged.
   *
   * @return if the cache holds an expired entry
   */
  boolean hasExpiredEntries();

  /**
   * Returns the maximum number of entries that this cache may hold, or empty if it is unbounded.
   *
   * @return the maximum size, if bounded
   */
  OptionalLong capacity();

  /**
   * Purges the entries that have expired. This is not normally needed as reads and writes purge
   * on demand.
   *
   * @return if any entry was purged
   */
  @CanIgnoreReturnValue
  boolean cleanUp();

  /**
   * Returns the counts recorded since the cache was built. Every count is zero unless the cache
   * was built with {@link Hourglass#recordStats()}.
   *
   * @return a snapshot of the counts
   */
  CacheStats stats();

  /**
   * Returns a function that serves a key's live value from this cache, or otherwise asks the
   * {@code producer} for a value and a time-to-live and stores the result.
   * <p>
   * The producer is invoked without holding any lock, and concurrent misses for the same key may
   * each invoke it. If it fails, the returned future fails with the producer's exception and
   * nothing is cached. If it completes with a {@code null} {@link TimedValue}, the returned future
   * completes with {@code null} and nothing is cached. Cancelling the returned future does not
   * cancel the producer's work.
   *
   * @param producer the function to compute a value and its time-to-live on a miss
   * @return a memoizing function backed by this cache
   * @throws NullPointerException if {@code producer} is null
   */
  @CheckReturnValue
  Function<K, CompletableFuture<V>> memoize(
      Function<? super K, ? extends CompletionStage<TimedValue<V>>> producer);
}
