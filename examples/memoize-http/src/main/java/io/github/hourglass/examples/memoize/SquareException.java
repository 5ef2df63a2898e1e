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

/** Indicates that the square service rejected a request or replied with an unusable response. */
public final class SquareException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SquareException(String message) {
    super(message);
  }

  public SquareException(String message, Throwable cause) {
    super(message, cause);
  }
}
