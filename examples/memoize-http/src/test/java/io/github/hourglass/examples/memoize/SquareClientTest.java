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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.github.hourglass.cache.TimedValue;

public final class SquareClientTest {
  private final Queue<String> replies = new ConcurrentLinkedQueue<>();
  private final Queue<String> queries = new ConcurrentLinkedQueue<>();
  private final Queue<String> paths = new ConcurrentLinkedQueue<>();
  private final AtomicInteger status = new AtomicInteger(200);

  private HttpServer server;
  private SquareClient client;

  @BeforeEach
  public void before() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/squareme", this::reply);
    server.createContext("/api/squareme", this::reply);
    server.start();
    client = new SquareClient(URI.create("http://localhost:" + server.getAddress().getPort()));
  }

  @AfterEach
  public void after() {
    server.stop(0);
  }

  private void reply(HttpExchange exchange) throws IOException {
    queries.add(exchange.getRequestURI().getQuery());
    paths.add(exchange.getRequestURI().getPath());
    byte[] body = replies.remove().getBytes(UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status.get(), body.length);
    try (var out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  @Test
  public void square() {
    replies.add("{\"msg\": 900, \"ttl(ms)\": 250}");

    TimedValue<Integer> square = client.square(30).join();
    assertThat(square).isEqualTo(TimedValue.of(900, Duration.ofMillis(250)));
    assertThat(queries).containsExactly("num=30");
    assertThat(paths).containsExactly("/squareme");
  }

  @Test
  public void square_basePathKept() {
    replies.add("{\"msg\": 16, \"ttl(ms)\": 250}");
    replies.add("{\"msg\": 25, \"ttl(ms)\": 250}");
    var base = "http://localhost:" + server.getAddress().getPort() + "/api";

    assertThat(new SquareClient(URI.create(base)).square(4).join().value()).isEqualTo(16);
    assertThat(new SquareClient(URI.create(base + "/")).square(5).join().value()).isEqualTo(25);
    assertThat(paths).containsExactly("/api/squareme", "/api/squareme");
    assertThat(queries).containsExactly("num=4", "num=5");
  }

  @Test
  public void asDirectory() {
    assertThat(SquareClient.asDirectory(URI.create("http://host:5000")))
        .isEqualTo(URI.create("http://host:5000/"));
    assertThat(SquareClient.asDirectory(URI.create("http://host/api/")))
        .isEqualTo(URI.create("http://host/api/"));
    assertThrows(IllegalArgumentException.class, () ->
        SquareClient.asDirectory(URI.create("http://host/api?key=1")));
  }

  @Test
  public void square_error() {
    replies.add("{\"error\": \"the server is feeling unlucky\"}");

    var e = assertThrows(CompletionException.class, () -> client.square(7).join());
    assertThat(e).hasCauseThat().isInstanceOf(SquareException.class);
    assertThat(e).hasCauseThat().hasMessageThat().isEqualTo("the server is feeling unlucky");
  }

  @Test
  public void square_malformed() {
    replies.add("<html>oops</html>");

    var e = assertThrows(CompletionException.class, () -> client.square(7).join());
    assertThat(e).hasCauseThat().isInstanceOf(SquareException.class);
    assertThat(e).hasCauseThat().hasMessageThat().startsWith("Malformed response");
  }

  @Test
  public void square_httpStatus() {
    status.set(503);
    replies.add("{}");

    var e = assertThrows(CompletionException.class, () -> client.square(7).join());
    assertThat(e).hasCauseThat().hasMessageThat().contains("503");
  }

  @Test
  public void square_incomplete() {
    replies.add("{\"msg\": 49}");

    var e = assertThrows(CompletionException.class, () -> client.square(7).join());
    assertThat(e).hasCauseThat().hasMessageThat().startsWith("Incomplete response");
  }

  @Test
  public void memoized() {
    replies.add("{\"msg\": 900, \"ttl(ms)\": 60000}");
    var app = new Application(client);

    assertThat(app.square(30)).isEqualTo(900);
    assertThat(app.square(30)).isEqualTo(900);
    assertThat(queries).hasSize(1);
    assertThat(app.stats().hits()).isEqualTo(1);
    assertThat(app.stats().loadSuccesses()).isEqualTo(1);
  }

  @Test
  public void memoized_failureNotCached() {
    replies.add("{\"error\": \"try again\"}");
    replies.add("{\"msg\": 4, \"ttl(ms)\": 60000}");
    var app = new Application(client);

    var e = assertThrows(CompletionException.class, () -> app.square(2));
    assertThat(e).hasCauseThat().isInstanceOf(SquareException.class);

    assertThat(app.square(2)).isEqualTo(4);
    assertThat(queries).hasSize(2);
    assertThat(app.stats().loadFailures()).isEqualTo(1);
  }
}
