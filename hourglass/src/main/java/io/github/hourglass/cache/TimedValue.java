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
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.Immutable;

/**
 * A value paired with the time-to-live that it should be cached for, as produced by a function
 * passed to {@link TtlCache#memoize}.
 *
 * @param <V> the type of the value
 */
@Immutable(containerOf = "V")
public final class TimedValue<V> {
  private final V value;
  private final Duration ttl;

  private TimedValue(V value, Duration ttl) {
    this.value = requireNonNull(value);
    this.ttl = requireNonNull(ttl);
  }

  /**
   * Returns a value that should be cached for the {@code ttl}.
   *
   * @param value the value
   * @param ttl the time-to-live, measured from when the value is stored
   * @param <V> the type of the value
   * @return a timed value
   * @throws NullPointerException if either argument is null
   */
  public static <V> TimedValue<V> of(V value, Duration ttl) {
    return new TimedValue<>(value, ttl);
  }

  /** Returns the value. */
  public V value() {
    return value;
  }

  /** Returns the time-to-live. */
  public Duration ttl() {
    return ttl;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof TimedValue<?>)) {
      return false;
    }
    TimedValue<?> other = (TimedValue<?>) o;
    return value.equals(other.value) && ttl.equals(other.ttl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, ttl);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{value=" + value + ", ttl=" + ttl + '}';
  }
}
