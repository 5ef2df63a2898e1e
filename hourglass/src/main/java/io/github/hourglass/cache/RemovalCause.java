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

/**
 * Why an entry left a {@link TtlCache}, as passed to a {@link RemovalListener}.
 */
public enum RemovalCause {

  /** Removed by {@link TtlCache#invalidate} or {@link TtlCache#invalidateAll}. */
  EXPLICIT,

  /**
   * The key was written again while its entry was live, so the old value was dropped. The key
   * itself stays in the cache.
   */
  REPLACED,

  /**
   * The entry's time-to-live had elapsed. The cache reports this when it purges the entry during a
   * later call, which may be well after the moment of expiry.
   */
  EXPIRED,

  /**
   * A new key was written while the cache was at its {@linkplain Hourglass#maximumSize maximum
   * size}, and this entry had the earliest expiration time.
   */
  SIZE;

  /** Returns whether the cache removed the entry on its own rather than at a caller's request. */
  public boolean wasEvicted() {
    return (this == EXPIRED) || (this == SIZE);
  }
}
