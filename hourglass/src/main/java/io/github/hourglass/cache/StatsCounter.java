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

import io.github.hourglass.cache.stats.CacheStats;

/**
 * Receives the events that {@link TtlCache#stats()} reports. Every event is ignored unless
 * overridden, so a cache that does not record statistics uses {@link #DISABLED}.
 */
@FunctionalInterface
interface StatsCounter {
  StatsCounter DISABLED = CacheStats::empty;

  /** A lookup found a live value. */
  default void recordHit() {}

  /** A lookup found no live value. */
  default void recordMiss() {}

  /** A producer finished after {@code nanos}, either yielding a value or not. */
  default void recordLoad(long nanos, boolean succeeded) {}

  /** An entry left the map for the given reason. */
  default void recordRemoval(RemovalCause cause) {}

  /** Returns the counts accumulated so far. */
  CacheStats snapshot();
}
