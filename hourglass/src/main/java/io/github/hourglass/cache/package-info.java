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
/**
 * This package contains an in-memory cache whose entries expire after a time-to-live that is
 * chosen with every write. All cache variants are configured and created using the
 * {@link io.github.hourglass.cache.Hourglass} builder.
 * <p>
 * A {@link io.github.hourglass.cache.TtlCache} hides an entry as soon as its time-to-live elapses
 * and purges it during a later operation. When bounded, the cache makes room for a new key by
 * evicting the entry that expires the soonest. The cache can also
 * {@linkplain io.github.hourglass.cache.TtlCache#memoize memoize} an asynchronous function whose
 * results carry their own time-to-live.
 */
@NullMarked
@CheckReturnValue
package io.github.hourglass.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
