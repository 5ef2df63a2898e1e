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
package io.github.hourglass.examples.memoize;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

import io.github.hourglass.cache.Hourglass;
import io.github.hourglass.cache.TtlCache;
import io.github.hourglass.cache.stats.CacheStats;

public final class Application {
  private final Function<Integer, CompletableFuture<Integer>> squares;
  private final TtlCache<Integer, Integer> cache;

  public Application(SquareClient client) {
    cache = Hourglass.newBuilder()
        .recordStats()
        .build();
    squares = cache.memoize(client::square);
  }

  /** Returns the square, asking the service only if no live answer is cached. */
  public int square(int number) {
    return squares.apply(number).join();
  }

  public CacheStats stats() {
    return cache.stats();
  }

  public static void main(String[] args) {
    var baseUri = URI.create((args.length == 0) ? "http://localhost:5000" : args[0]);
    var app = new Application(new SquareClient(baseUri));
    try {
      System.out.println("square(30) = " + app.square(30));
      System.out.println("square(30) = " + app.square(30));
    } catch (CompletionException e) {
      System.err.println("Failed to square: " + e.getCause());
    }
    System.out.println(app.stats());
  }
}
