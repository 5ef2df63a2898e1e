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

import static com.google.common.truth.Truth.assertThat;
import static io.github.hourglass.testing.LoggingEvents.logEvents;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.expectThrows;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.event.Level;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.testing.FakeTicker;

import io.github.hourglass.testing.LoggingEvents;

/**
 * A test for caching the results of an asynchronous producer.
 */
public final class MemoizingFunctionTest {
  private AtomicInteger calls;
  private FakeTicker ticker;
  private TtlCache<Integer, Integer> cache;

  @BeforeMethod
  public void before() {
    LoggingEvents.clearEvents();
    calls = new AtomicInteger();
    ticker = new FakeTicker();
    cache = Hourglass.newBuilder()
        .executor(Runnable::run)
        .ticker(ticker::read)
        .recordStats()
        .build();
  }

  @Test
  public void memoize_nullProducer() {
    assertThrows(NullPointerException.class, () -> cache.memoize(null));
  }

  @Test
  public void apply_nullKey() {
    var squares = cache.memoize(square(Duration.ofMinutes(1)));
    assertThrows(NullPointerException.class, () -> squares.apply(null));
  }

  @Test
  public void apply_missThenHit() {
    var squares = cache.memoize(square(Duration.ofMinutes(1)));

    assertThat(squares.apply(30).join()).isEqualTo(900);
    assertThat(squares.apply(30).join()).isEqualTo(900);
    assertThat(calls.get()).isEqualTo(1);
    assertThat(cache.getIfPresent(30)).isEqualTo(900);

    var stats = cache.stats();
    assertThat(stats.hits()).isEqualTo(2);
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.loadSuccesses()).isEqualTo(1);
  }

  @Test
  public void apply_hitIsCompleted() {
    cache.put(3, 10, Duration.ofMinutes(1));
    var squares = cache.memoize(square(Duration.ofMinutes(1)));

    CompletableFuture<Integer> future = squares.apply(3);
    assertThat(future.isDone()).isTrue();
    assertThat(future.join()).isEqualTo(10);
    assertThat(calls.get()).isEqualTo(0);
  }

  @Test
  public void apply_reproducesAfterExpiry() {
    var squares = cache.memoize(square(Duration.ofSeconds(1)));
    squares.apply(2).join();
    ticker.advance(Duration.ofSeconds(1));

    assertThat(squares.apply(2).join()).isEqualTo(4);
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  public void apply_ttlRelativeToStoreTime() {
    var pending = new CompletableFuture<TimedValue<Integer>>();
    var squares = cache.memoize(key -> pending);

    CompletableFuture<Integer> future = squares.apply(5);
    ticker.advance(Duration.ofMinutes(5));
    pending.complete(TimedValue.of(25, Duration.ofMinutes(1)));

    assertThat(future.join()).isEqualTo(25);
    ticker.advance(Duration.ofSeconds(59));
    assertThat(cache.getIfPresent(5)).isEqualTo(25);
    assertThat(cache.stats().totalLoadNanos()).isEqualTo(Duration.ofMinutes(5).toNanos());
  }

  @Test
  public void apply_failure_notCached() {
    var error = new IllegalStateException("unlucky");
    var squares = cache.memoize(key -> {
      calls.incrementAndGet();
      return CompletableFuture.failedFuture(error);
    });

    var e = expectThrows(ExecutionException.class, () -> squares.apply(7).get());
    assertThat(e).hasCauseThat().isSameInstanceAs(error);
    assertThat(cache.getIfPresent(7)).isNull();

    squares.apply(7).exceptionally(t -> null).join();
    assertThat(calls.get()).isEqualTo(2);
    assertThat(cache.stats().loadFailures()).isEqualTo(2);
    assertThat(logEvents()
        .withMessage("Exception thrown by the memoized producer")
        .withLevel(Level.WARN)).hasSize(2);
  }

  @Test
  public void apply_failure_unwrapsCompletionException() {
    var error = new IllegalArgumentException();
    Function<Integer, CompletionStage<TimedValue<Integer>>> producer = key ->
        CompletableFuture.<TimedValue<Integer>>supplyAsync(() -> { throw error; }, Runnable::run)
            .thenApply(Function.identity());
    var squares = cache.memoize(producer);

    var e = expectThrows(CompletionException.class, () -> squares.apply(1).join());
    assertThat(e).hasCauseThat().isSameInstanceAs(error);
  }

  @Test
  public void apply_failure_keepsProducerExecutionException() {
    var error = new ExecutionException("app failure", new IOException("io"));
    var squares = cache.memoize(key -> CompletableFuture.failedFuture(error));

    var e = expectThrows(ExecutionException.class, () -> squares.apply(1).get());
    assertThat(e).hasCauseThat().isSameInstanceAs(error);
    assertThat(cache.getIfPresent(1)).isNull();
  }

  @Test
  public void unwrap() {
    var cause = new IOException("io");
    var execution = new ExecutionException(cause);
    assertThat(MemoizingFunction.unwrap(new CompletionException(cause))).isSameInstanceAs(cause);
    assertThat(MemoizingFunction.unwrap(execution)).isSameInstanceAs(execution);
    assertThat(MemoizingFunction.unwrap(cause)).isSameInstanceAs(cause);

    var bare = new CompletionException("bare", null);
    assertThat(MemoizingFunction.unwrap(bare)).isSameInstanceAs(bare);
  }

  @Test
  public void apply_failure_synchronousThrow() {
    var error = new IllegalStateException();
    var squares = cache.memoize(key -> {
      throw error;
    });

    CompletableFuture<Integer> future = squares.apply(1);
    assertThat(future.isCompletedExceptionally()).isTrue();
    var e = expectThrows(CompletionException.class, future::join);
    assertThat(e).hasCauseThat().isSameInstanceAs(error);
    assertThat(cache.isEmpty()).isTrue();
  }

  @Test
  public void apply_failure_nullStage() {
    var squares = cache.memoize(key -> null);

    var e = expectThrows(CompletionException.class, () -> squares.apply(1).join());
    assertThat(e).hasCauseThat().isInstanceOf(NullPointerException.class);
  }

  @Test
  public void apply_cancelled_notLogged() {
    var squares = cache.memoize(key -> {
      var future = new CompletableFuture<TimedValue<Integer>>();
      future.cancel(false);
      return future;
    });

    assertThrows(CancellationException.class, () -> squares.apply(1).join());
    assertThat(logEvents().withLevel(Level.WARN)).isEmpty();
  }

  @Test
  public void apply_nullValue_notCached() {
    var squares = cache.memoize(key -> {
      calls.incrementAndGet();
      return CompletableFuture.<TimedValue<Integer>>completedFuture(null);
    });

    assertThat(squares.apply(1).join()).isNull();
    assertThat(squares.apply(1).join()).isNull();
    assertThat(calls.get()).isEqualTo(2);
    assertThat(cache.isEmpty()).isTrue();
  }

  @Test
  public void apply_callerCancellation_leavesProducerRunning() {
    var pending = new CompletableFuture<TimedValue<Integer>>();
    var squares = cache.memoize(key -> pending);

    CompletableFuture<Integer> future = squares.apply(4);
    future.cancel(true);
    assertThat(pending.isCancelled()).isFalse();

    pending.complete(TimedValue.of(16, Duration.ofMinutes(1)));
    assertThat(cache.getIfPresent(4)).isEqualTo(16);
  }

  @Test
  public void apply_negativeTtl_returnedButNotServed() {
    var squares = cache.memoize(square(Duration.ofSeconds(-1)));

    assertThat(squares.apply(3).join()).isEqualTo(9);
    assertThat(squares.apply(3).join()).isEqualTo(9);
    assertThat(calls.get()).isEqualTo(2);
  }

  @Test
  public void apply_concurrentMisses_lastWriterWins() {
    var first = new CompletableFuture<TimedValue<Integer>>();
    var second = new CompletableFuture<TimedValue<Integer>>();
    var squares = cache.memoize(key -> (calls.incrementAndGet() == 1) ? first : second);

    CompletableFuture<Integer> a = squares.apply(1);
    CompletableFuture<Integer> b = squares.apply(1);
    assertThat(calls.get()).isEqualTo(2);

    first.complete(TimedValue.of(100, Duration.ofMinutes(1)));
    second.complete(TimedValue.of(200, Duration.ofMinutes(1)));
    assertThat(a.join()).isEqualTo(100);
    assertThat(b.join()).isEqualTo(200);
    assertThat(cache.getIfPresent(1)).isEqualTo(200);
  }

  private Function<Integer, CompletionStage<TimedValue<Integer>>> square(Duration ttl) {
    return key -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture(TimedValue.of(key * key, ttl));
    };
  }
}
