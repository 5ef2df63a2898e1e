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
 * Told about each entry that leaves a cache. Calls happen on the builder's executor after the
 * removal, possibly from several threads at once, so a slow listener should hand off its work.
 *
 * @param <K> the key type it accepts
 * @param <V> the value type it accepts
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

  /**
   * Receives a removed entry. By the time this runs the key may have been written again.
   *
   * @param key the removed entry's key
   * @param value the removed entry's value
   * @param cause why the entry was removed
   */
  void onRemoval(K key, V value, RemovalCause cause);
}
