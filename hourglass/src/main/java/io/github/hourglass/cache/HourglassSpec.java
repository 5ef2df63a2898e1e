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

import static io.github.hourglass.cache.Hourglass.requireArgument;
import static java.util.Locale.US;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

import org.jspecify.annotations.Nullable;

/**
 * The options read from a configuration string by {@link Hourglass#from(String)}. Options are
 * separated by commas and written as {@code name=value}, except {@code recordStats} which takes no
 * value. Blanks around separators are ignored and an option may appear at most once.
 */
final class HourglassSpec {
  long maximumSize = Hourglass.UNSET;
  @Nullable Duration expiryGranularity;
  @Nullable OverwritePolicy overwritePolicy;
  boolean recordStats;

  private HourglassSpec() {}

  /** Returns the options in {@code configuration}. */
  static HourglassSpec parse(String configuration) {
    var spec = new HourglassSpec();
    for (String option : configuration.split(",", -1)) {
      if (!option.isBlank()) {
        spec.apply(option);
      }
    }
    return spec;
  }

  private void apply(String option) {
    int separator = option.indexOf('=');
    String name = ((separator < 0) ? option : option.substring(0, separator)).trim();
    String value = (separator < 0) ? null : option.substring(separator + 1).trim();
    requireArgument((value == null) || (value.indexOf('=') < 0),
        "option %s has more than one '='", option.trim());

    switch (name) {
      case "maximumSize":
        requireArgument(maximumSize == Hourglass.UNSET, "maximumSize was given twice");
        maximumSize = parseCount(name, value);
        break;
      case "expiryGranularity":
        requireArgument(expiryGranularity == null, "expiryGranularity was given twice");
        expiryGranularity = parseDuration(name, value);
        break;
      case "overwritePolicy":
        requireArgument(overwritePolicy == null, "overwritePolicy was given twice");
        overwritePolicy = parsePolicy(name, value);
        break;
      case "recordStats":
        requireArgument(value == null, "recordStats does not take a value");
        requireArgument(!recordStats, "recordStats was given twice");
        recordStats = true;
        break;
      default:
        throw new IllegalArgumentException("Unknown option: " + name);
    }
  }

  /** Returns a builder with these options applied. */
  Hourglass<Object, Object> toBuilder() {
    var builder = Hourglass.newBuilder();
    if (maximumSize != Hourglass.UNSET) {
      builder.maximumSize(maximumSize);
    }
    if (expiryGranularity != null) {
      builder.expiryGranularity(expiryGranularity);
    }
    if (overwritePolicy != null) {
      builder.overwritePolicy(overwritePolicy);
    }
    if (recordStats) {
      builder.recordStats();
    }
    return builder;
  }

  static long parseCount(String name, @Nullable String value) {
    String text = requireValue(name, value);
    long count;
    try {
      count = Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be a whole number: " + text, e);
    }
    requireArgument(count >= 0, "%s must not be negative: %s", name, text);
    return count;
  }

  static OverwritePolicy parsePolicy(String name, @Nullable String value) {
    String text = requireValue(name, value);
    for (OverwritePolicy policy : OverwritePolicy.values()) {
      if (policy.name().equalsIgnoreCase(text)) {
        return policy;
      }
    }
    throw new IllegalArgumentException(name + " must be replace or maximum: " + text);
  }

  /** Parses {@code 10ms}, {@code 5s}, {@code 2m}, {@code 1h}, {@code 1d} or an ISO-8601 duration. */
  static Duration parseDuration(String name, @Nullable String value) {
    String text = requireValue(name, value).toLowerCase(US);
    Duration duration;
    try {
      duration = text.startsWith("p") || text.startsWith("-p")
          ? Duration.parse(text)
          : Duration.of(Long.parseLong(text.substring(0, text.length() - suffix(text).length())),
              unitOf(name, text));
    } catch (DateTimeParseException | NumberFormatException | ArithmeticException e) {
      throw new IllegalArgumentException(name + " is not a duration: " + value, e);
    }
    requireArgument(!duration.isNegative(), "%s must not be negative: %s", name, value);
    return duration;
  }

  private static String suffix(String text) {
    return text.endsWith("ms") ? "ms" : text.substring(Math.max(0, text.length() - 1));
  }

  private static ChronoUnit unitOf(String name, String text) {
    switch (suffix(text)) {
      case "ms":
        return ChronoUnit.MILLIS;
      case "s":
        return ChronoUnit.SECONDS;
      case "m":
        return ChronoUnit.MINUTES;
      case "h":
        return ChronoUnit.HOURS;
      case "d":
        return ChronoUnit.DAYS;
      default:
        throw new IllegalArgumentException(
            name + " must end in d, h, m, s or ms, or be ISO-8601: " + text);
    }
  }

  private static String requireValue(String name, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "%s needs a value", name);
    @SuppressWarnings("NullAway")
    String present = value;
    return present;
  }

  @Override
  public String toString() {
    return "HourglassSpec{maximumSize=" + maximumSize + ", expiryGranularity=" + expiryGranularity
        + ", overwritePolicy=" + overwritePolicy + ", recordStats=" + recordStats + '}';
  }
}
