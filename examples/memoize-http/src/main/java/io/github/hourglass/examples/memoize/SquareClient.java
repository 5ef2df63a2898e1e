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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.hourglass.cache.TimedValue;

/**
 * A client of a service that squares numbers and says how long the answer may be cached. A
 * successful reply has the form {@code {"msg": 900, "ttl(ms)": 250}} and a failed one
 * {@code {"error": "..."}}.
 */
public final class SquareClient {
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;
  private final URI baseUri;

  public SquareClient(URI baseUri) {
    this(baseUri, HttpClient.newHttpClient(), new ObjectMapper());
  }

  /**
   * Creates a client of the service at {@code baseUri}. Requests go to {@code squareme} beneath the
   * base, so {@code http://host/api} is called as {@code http://host/api/squareme}.
   *
   * @throws IllegalArgumentException if the base has a query or a fragment
   */
  public SquareClient(URI baseUri, HttpClient httpClient, ObjectMapper objectMapper) {
    this.objectMapper = requireNonNull(objectMapper);
    this.httpClient = requireNonNull(httpClient);
    this.baseUri = asDirectory(requireNonNull(baseUri));
  }

  /** Returns the base with a trailing slash, so that relative references resolve beneath it. */
  static URI asDirectory(URI baseUri) {
    if ((baseUri.getRawQuery() != null) || (baseUri.getRawFragment() != null)) {
      throw new IllegalArgumentException("The base must not have a query or fragment: " + baseUri);
    }
    String path = baseUri.getRawPath();
    return ((path != null) && path.endsWith("/")) ? baseUri : URI.create(baseUri + "/");
  }

  /**
   * Asks the service for the square of the number.
   *
   * @param number the number to square
   * @return the square and its time-to-live, or a future failed with a {@link SquareException}
   */
  public CompletableFuture<TimedValue<Integer>> square(int number) {
    var request = HttpRequest.newBuilder(baseUri.resolve("squareme?num=" + number))
        .header("Accept", "application/json")
        .GET()
        .build();
    return httpClient.sendAsync(request, BodyHandlers.ofString()).thenApply(this::decode);
  }

  /** Returns the square carried by the response, or throws if the service reported an error. */
  TimedValue<Integer> decode(HttpResponse<String> response) {
    SquareResponse reply;
    try {
      reply = objectMapper.readValue(response.body(), SquareResponse.class);
    } catch (JsonProcessingException e) {
      throw new SquareException(String.format(
          "Malformed response (HTTP %d): %s", response.statusCode(), response.body()), e);
    }
    if (reply.error() != null) {
      throw new SquareException(reply.error());
    } else if ((response.statusCode() / 100) != 2) {
      throw new SquareException("Square request failed: HTTP " + response.statusCode());
    } else if ((reply.msg() == null) || (reply.ttlMillis() == null)) {
      throw new SquareException("Incomplete response: " + response.body());
    }
    return TimedValue.of(reply.msg(), Duration.ofMillis(reply.ttlMillis()));
  }

  /** The service's reply, where either the square and its time-to-live or the error is set. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record SquareResponse(
      @JsonProperty("msg") @Nullable Integer msg,
      @JsonProperty("ttl(ms)") @Nullable Long ttlMillis,
      @JsonProperty("error") @Nullable String error) {}
}
