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
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RequestAssemblerTest {
  @Test
  void basicFields() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test/items").timeout(Duration.ofMillis(500)));
    verifyThat(request)
        .isGET()
        .hasUri("https://example.test/items")
        .hasTimeout(Duration.ofMillis(500))
        .hasNoBody();
  }

  @Test
  void queryWithRepeatedKey() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test/items").addQuery("x", "a").addQuery("x", "b"));
    verifyThat(request).hasUri("https://example.test/items?x=a&x=b");
  }

  @Test
  void queryKeysAreSorted() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test")
                .addQuery("id", 42)
                .addQuery("b", "2", "1")
                .addQuery("a", "3"));
    verifyThat(request).hasRawQuery("a=3&b=2&b=1&id=42");
  }

  @Test
  void queryIsEscaped() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test")
                .addQuery("q", "a b&c=d")
                .addQuery("s", "*~-_.")
                .addQuery("u", "¥"));
    verifyThat(request).hasRawQuery("q=a+b%26c%3Dd&s=%2A~-_.&u=%C2%A5");
  }

  @Test
  void queryReplacesExistingQuery() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test/path?old=1#fragment").addQuery("new", "2"));
    verifyThat(request).hasUri("https://example.test/path?new=2");
  }

  @Test
  void emptyQueryRemovesExistingQuery() throws RestException {
    var request = RequestAssembler.assemble(RestRequest.GET("https://example.test/path?old=1"));
    verifyThat(request).hasUri("https://example.test/path");
  }

  @Test
  void portAndEscapedPathArePreserved() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("http://localhost:8080/a%20b/").addQuery("k", "v"));
    verifyThat(request).hasUri("http://localhost:8080/a%20b/?k=v");
  }

  @Test
  void headersAccumulate() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test")
                .addHeader("X", "1")
                .addHeader("X", "2")
                .addHeader("Accept", "text/plain"));
    verifyThat(request).containsHeader("X", "1", "2").containsHeader("Accept", "text/plain");
  }

  @Test
  void headersFromMap() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.GET("https://example.test")
                .setHeaders(Map.of("X", List.of("a", "b")))
                .addHeader("X", "c"));
    verifyThat(request).containsHeader("X", "a", "b", "c");
  }

  @Test
  void rawBody() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.POST("https://example.test").body("Pikachu".getBytes(UTF_8)));
    verifyThat(request).isPOST().hasBody("Pikachu").doesNotContainHeader("Content-Type");
  }

  @Test
  void formBody() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.POST("https://example.test")
                .addForm("type", "electric")
                .addForm("name", "Pikachu", "Raichu"));
    verifyThat(request)
        .hasBody("name=Pikachu&name=Raichu&type=electric")
        .containsHeader("Content-Type", "application/x-www-form-urlencoded");
  }

  @Test
  void formBodyKeepsGivenContentType() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.POST("https://example.test")
                .addHeader("content-type", "application/x-www-form-urlencoded; charset=UTF-8")
                .addForm("a", "1"));
    verifyThat(request)
        .hasBody("a=1")
        .containsHeader("Content-Type", "application/x-www-form-urlencoded; charset=UTF-8");
  }

  @Test
  void bodyWinsOverForm() throws RestException {
    var request =
        RequestAssembler.assemble(
            RestRequest.POST("https://example.test")
                .body("raw".getBytes(UTF_8))
                .addForm("a", "1"));
    verifyThat(request).hasBody("raw").doesNotContainHeader("Content-Type");
  }

  @Test
  void paramsAreNotSent() throws RestException {
    var request =
        RequestAssembler.assemble(RestRequest.POST("https://example.test").addParam("p", 1));
    verifyThat(request).hasUri("https://example.test").hasNoBody();
  }

  @Test
  void malformedUrl() {
    assertThatThrownBy(() -> RequestAssembler.assemble(RestRequest.GET("http://exa mple.test")))
        .asInstanceOf(type(RestException.class))
        .satisfies(
            e -> {
              assertThat(e.stage()).isEqualTo(Stage.URL_PARSE);
              assertThat(e.isConfigurationError()).isTrue();
              assertThat(e).hasMessageStartingWith("url parse: ");
              assertThat(e).hasCauseInstanceOf(URISyntaxException.class);
            });
  }

  @ParameterizedTest
  @ValueSource(strings = {"ftp://example.test", "example.test/path", "http:opaque", "/relative"})
  void unsendableUrl(String url) {
    assertThatThrownBy(() -> RequestAssembler.assemble(RestRequest.GET(url)))
        .asInstanceOf(type(RestException.class))
        .extracting(RestException::stage)
        .isEqualTo(Stage.URL_PARSE);
  }

  @Test
  void invalidMethod() {
    assertThatThrownBy(
            () -> RequestAssembler.assemble(RestRequest.create("GE T", "https://example.test")))
        .asInstanceOf(type(RestException.class))
        .satisfies(
            e -> {
              assertThat(e.stage()).isEqualTo(Stage.REQUEST);
              assertThat(e).hasMessageStartingWith("request build: ");
              assertThat(e).hasCauseInstanceOf(IllegalArgumentException.class);
            });
  }

  @ParameterizedTest
  @ValueSource(strings = {"Bad Header", "Connection"})
  void unsendableHeader(String name) {
    assertThatThrownBy(
            () ->
                RequestAssembler.assemble(
                    RestRequest.GET("https://example.test").addHeader(name, "value")))
        .asInstanceOf(type(RestException.class))
        .extracting(RestException::stage)
        .isEqualTo(Stage.REQUEST);
  }
}
