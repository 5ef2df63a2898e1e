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
 * Determines which expiration time governs an entry when its value is replaced before the previous
 * time-to-live has elapsed. The value itself is always replaced.
 */
public enum OverwritePolicy {

  /** The expiration time computed from the new time-to-live always replaces the current one. */
  REPLACE {
    @Override long expiry(long currentExpiry, long newExpiry) {
      return newExpiry;
    }
  },

  /**
   * The later of the current and the newly computed expiration times is retained, so a shorter
   * time-to-live never brings an entry's expiration forward.
   */
  MAXIMUM {
    @Override long expiry(long currentExpiry, long newExpiry) {
      return Math.max(currentExpiry, newExpiry);
    }
  };

  /**
   * Returns the expiration time for the replaced entry.
   *
   * @param currentExpiry the entry's current expiration time, in nanoseconds
   * @param newExpiry the expiration time computed for the new value, in nanoseconds
   * @return the expiration time that the entry should be indexed under
   */
  abstract long expiry(long currentExpiry, long newExpiry);
}
