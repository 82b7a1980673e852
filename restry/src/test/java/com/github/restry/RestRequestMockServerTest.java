/*
 * Copyright (c) 2025 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.restry;

import static com.github.restry.testing.verifiers.Verifiers.verifyThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.type;

import com.github.restry.RestException.Stage;
import com.github.restry.testing.MockWebServerExtension;
import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;

@Timeout(10)
@ExtendWith(MockWebServerExtension.class)
class RestRequestMockServerTest {
  private MockWebServer server;
  private String serverUrl;

  @BeforeEach
  void setUp(MockWebServer server) {
    this.server = server;
    this.serverUrl = server.url("/items").toString();
  }

  @Test
  void sendQueryAndHeaders() throws Exception {
    server.enqueue(
        new MockResponse.Builder().code(200).setHeader("X-Items", "1").body("[42]").build());

    var response =
        RestRequest.GET(serverUrl)
            .addQuery("id", 42)
            .addQuery("q", "a b")
            .addHeader("Accept", "application/json")
            .addHeader("X-Trace", "1", "2")
            .timeout(Duration.ofSeconds(5))
            .send();
    verifyThat(response).hasCode(200).hasBody("[42]").containsHeader("X-Items", "1");

    var sentRequest = server.takeRequest();
    assertThat(sentRequest.getMethod()).isEqualTo("GET");
    assertThat(sentRequest.getRequestUrl().encodedPath()).isEqualTo("/items");
    assertThat(sentRequest.getRequestUrl().encodedQuery()).isEqualTo("id=42&q=a+b");
    assertThat(sentRequest.getHeaders().get("Accept")).isEqualTo("application/json");
    assertThat(sentRequest.getHeaders().values("X-Trace")).containsExactly("1", "2");
  }

  @Test
  void sendBody() throws Exception {
    server.enqueue(new MockResponse.Builder().code(201).build());

    var response =
        RestRequest.POST(serverUrl)
            .addHeader("Content-Type", "application/json")
            .body("{\"id\":42}".getBytes(UTF_8))
            .send();
    verifyThat(response).hasCode(201).hasBody("");

    var sentRequest = server.takeRequest();
    assertThat(sentRequest.getMethod()).isEqualTo("POST");
    assertThat(sentRequest.getHeaders().get("Content-Type")).isEqualTo("application/json");
    assertThat(sentRequest.getBody().readUtf8()).isEqualTo("{\"id\":42}");
  }

  @Test
  void sendForm() throws Exception {
    server.enqueue(new MockResponse.Builder().code(200).build());

    RestRequest.POST(serverUrl).addForm("name", "Pikachu").addForm("type", "electric").send();

    var sentRequest = server.takeRequest();
    assertThat(sentRequest.getHeaders().get("Content-Type"))
        .isEqualTo("application/x-www-form-urlencoded");
    assertThat(sentRequest.getBody().readUtf8()).isEqualTo("name=Pikachu&type=electric");
  }

  @Test
  void retryOnServerError() throws Exception {
    server.enqueue(new MockResponse.Builder().code(500).body("oops").build());
    server.enqueue(new MockResponse.Builder().code(200).body("ok").build());

    var response =
        RestRequest.GET(serverUrl)
            .retry(2, Duration.ofMillis(10), RetryPredicate.onServerError())
            .send();
    verifyThat(response).hasCode(200).hasBody("ok");
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void lastResponseIsReturnedWhenRetriesAreExhausted() throws Exception {
    server.enqueue(new MockResponse.Builder().code(503).body("busy #1").build());
    server.enqueue(new MockResponse.Builder().code(503).body("busy #2").build());

    var response =
        RestRequest.GET(serverUrl)
            .retry(1, Duration.ZERO, RetryPredicate.onServerError())
            .send();
    verifyThat(response).hasCode(503).hasBody("busy #2");
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void timeoutCoversBody() {
    server.enqueue(
        new MockResponse.Builder().code(200).body("late").bodyDelay(3, TimeUnit.SECONDS).build());

    var request = RestRequest.GET(serverUrl).timeout(Duration.ofMillis(500));
    long start = System.nanoTime();
    assertThatThrownBy(request::send)
        .asInstanceOf(type(RestException.class))
        .satisfies(
            e -> {
              assertThat(e.stage()).isEqualTo(Stage.TRANSPORT);
              assertThat(e).hasCauseInstanceOf(HttpTimeoutException.class);
            });
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
  }

  @Test
  void retryAfterBodyTimeout() throws Exception {
    server.enqueue(
        new MockResponse.Builder().code(200).body("late").bodyDelay(3, TimeUnit.SECONDS).build());
    server.enqueue(new MockResponse.Builder().code(200).body("ok").build());

    var response =
        RestRequest.GET(serverUrl)
            .timeout(Duration.ofMillis(500))
            .retry(1, Duration.ZERO, RetryPredicate.onException(HttpTimeoutException.class))
            .send();
    verifyThat(response).hasCode(200).hasBody("ok");
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void connectionRefused() throws IOException {
    var closedServer = new MockWebServer();
    closedServer.start();
    var closedServerUrl = closedServer.url("/").toString();
    closedServer.close();

    var request =
        RestRequest.GET(closedServerUrl)
            .retry(1, Duration.ofMillis(10), RetryPredicate.onException(IOException.class));
    assertThatThrownBy(request::send)
        .asInstanceOf(type(RestException.class))
        .extracting(RestException::stage)
        .isEqualTo(Stage.TRANSPORT);
  }
}
