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
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

/**
 * A function that serves live values from a cache and otherwise asks a producer for a value and
 * its time-to-live, storing the result on success. No lock is held while the producer runs, and
 * concurrent misses for the same key each invoke the producer with the last write winning.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
final class MemoizingFunction<K, V> implements Function<K, CompletableFuture<V>> {
  static final Logger logger = System.getLogger(MemoizingFunction.class.getName());

  final Function<? super K, ? extends CompletionStage<TimedValue<V>>> producer;
  final LocalTtlCache<K, V> cache;

  MemoizingFunction(LocalTtlCache<K, V> cache,
      Function<? super K, ? extends CompletionStage<TimedValue<V>>> producer) {
    this.producer = requireNonNull(producer);
    this.cache = requireNonNull(cache);
  }

  @Override
  public CompletableFuture<V> apply(K key) {
    requireNonNull(key);
    V cached = cache.getIfPresent(key);
    if (cached != null) {
      return CompletableFuture.completedFuture(cached);
    }

    var result = new CompletableFuture<V>();
    long startTime = cache.ticker.read();
    CompletionStage<TimedValue<V>> stage;
    try {
      stage = requireNonNull(producer.apply(key), "The producer returned a null stage");
    } catch (Throwable t) {
      onFailure(t, startTime, result);
      return result;
    }

    stage.whenComplete((timedValue, error) -> {
      if (error != null) {
        onFailure(error, startTime, result);
      } else {
        onSuccess(key, timedValue, startTime, result);
      }
    });
    return result;
  }

  /** Stores the produced value and completes the caller's future with it. */
  @SuppressWarnings("NullAway")
  private void onSuccess(K key, @Nullable TimedValue<V> timedValue,
      long startTime, CompletableFuture<V> result) {
    if (timedValue == null) {
      cache.statsCounter.recordLoad(cache.ticker.read() - startTime, false);
      result.complete(null);
      return;
    }
    try {
      cache.put(key, timedValue.value(), timedValue.ttl());
    } catch (Throwable t) {
      onFailure(t, startTime, result);
      return;
    }
    cache.statsCounter.recordLoad(cache.ticker.read() - startTime, true);
    result.complete(timedValue.value());
  }

  /** Fails the caller's future with the producer's unwrapped exception, caching nothing. */
  private void onFailure(Throwable error, long startTime, CompletableFuture<V> result) {
    Throwable cause = unwrap(error);
    if (!(cause instanceof CancellationException) && !(cause instanceof TimeoutException)) {
      logger.log(Level.WARNING, "Exception thrown by the memoized producer", cause);
    }
    cache.statsCounter.recordLoad(cache.ticker.read() - startTime, false);
    result.completeExceptionally(cause);
  }

  /**
   * Returns the exception that a {@link CompletionStage} wrapped in a {@link CompletionException}
   * on its way to a dependent stage. Any other exception is the producer's own and is kept as is.
   */
  static Throwable unwrap(Throwable error) {
    return ((error instanceof CompletionException) && (error.getCause() != null))
        ? error.getCause()
        : error;
  }
}
