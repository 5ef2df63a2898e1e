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

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.concurrent.GuardedBy;

import io.github.hourglass.cache.stats.CacheStats;

/**
 * A {@link TtlCache} that guards a single {@link TtlMap} with a read-write lock. Lookups share the
 * read lock while nothing has expired. Otherwise the lookup releases it and takes the write lock to
 * purge before reading, so concurrent readers may each purge redundantly.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
final class LocalTtlCache<K, V> implements TtlCache<K, V> {
  final ReentrantReadWriteLock lock;
  final StatsCounter statsCounter;
  final Lock writeLock;
  final Lock readLock;
  final Ticker ticker;

  @GuardedBy("lock")
  final TtlMap<K, V> map;

  LocalTtlCache(Hourglass<K, V> builder) {
    this.map = new TtlMap<>(builder);
    this.lock = new ReentrantReadWriteLock();
    this.readLock = lock.readLock();
    this.writeLock = lock.writeLock();
    this.statsCounter = map.statsCounter;
    this.ticker = builder.getTicker();
  }

  @Override
  public @Nullable V getIfPresent(K key) {
    requireNonNull(key);
    readLock.lock();
    try {
      if (!map.hasExpiredItems()) {
        return recordAccess(map.get(key));
      }
    } finally {
      readLock.unlock();
    }

    writeLock.lock();
    try {
      map.removeExpiredItems();
      return recordAccess(map.get(key));
    } finally {
      writeLock.unlock();
    }
  }

  private @Nullable V recordAccess(@Nullable V value) {
    if (value == null) {
      statsCounter.recordMiss();
    } else {
      statsCounter.recordHit();
    }
    return value;
  }

  @Override
  public boolean put(K key, V value, Duration ttl) {
    requireNonNull(key);
    requireNonNull(value);
    requireNonNull(ttl);
    writeLock.lock();
    try {
      return map.set(key, value, ttl);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public boolean invalidate(K key) {
    requireNonNull(key);
    writeLock.lock();
    try {
      return map.remove(key);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public void invalidateAll() {
    writeLock.lock();
    try {
      map.clear();
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public int size() {
    readLock.lock();
    try {
      return map.size();
    } finally {
      readLock.unlock();
    }
  }

  @Override
  public boolean isEmpty() {
    readLock.lock();
    try {
      return map.isEmpty();
    } finally {
      readLock.unlock();
    }
  }

  @Override
  public boolean hasExpiredEntries() {
    readLock.lock();
    try {
      return map.hasExpiredItems();
    } finally {
      readLock.unlock();
    }
  }

  @Override
  public OptionalLong capacity() {
    return map.capacity();
  }

  @Override
  public boolean cleanUp() {
    writeLock.lock();
    try {
      return map.removeExpiredItems();
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public CacheStats stats() {
    return statsCounter.snapshot();
  }

  @Override
  public Function<K, CompletableFuture<V>> memoize(
      Function<? super K, ? extends CompletionStage<TimedValue<V>>> producer) {
    return new MemoizingFunction<>(this, producer);
  }

  @Override
  public String toString() {
    readLock.lock();
    try {
      var description = new StringBuilder("LocalTtlCache{size=").append(map.size());
      map.capacity().ifPresent(maximum -> description.append(", maximumSize=").append(maximum));
      return description.append('}').toString();
    } finally {
      readLock.unlock();
    }
  }
}
