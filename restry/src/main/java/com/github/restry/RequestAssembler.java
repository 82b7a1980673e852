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

import static java.nio.charset.StandardCharsets.US_ASCII;

import com.github.restry.RestException.Stage;
import com.github.restry.internal.FormEncoder;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;

/** Builds the {@code HttpRequest} sent by an attempt from a {@link RestRequest}'s current state. */
final class RequestAssembler {
  private static final String CONTENT_TYPE = "Content-Type";

  private RequestAssembler() {}

  static HttpRequest assemble(RestRequest request) throws RestException {
    var uri = resolveUri(request.url(), FormEncoder.encode(request.query()));
    try {
      var builder = HttpRequest.newBuilder(uri).timeout(request.timeout());
      var headers = request.headers();
      headers.forEach((name, values) -> values.forEach(value -> builder.header(name, value)));
      builder.method(request.method(), bodyPublisher(request, builder));
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new RestException(Stage.REQUEST, e);
    }
  }

  /**
   * Parses the given URL and replaces its query with the given encoded one. The fragment, if any,
   * is dropped as it's never sent.
   */
  static URI resolveUri(String url, String encodedQuery) throws RestException {
    URI parsed;
    try {
      parsed = new URI(url);
    } catch (URISyntaxException e) {
      throw new RestException(Stage.URL_PARSE, e);
    }

    var scheme = parsed.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new RestException(Stage.URL_PARSE, "unsupported scheme: '" + url + "'");
    }
    if (parsed.getHost() == null) {
      throw new RestException(Stage.URL_PARSE, "missing host: '" + url + "'");
    }

    var resolved =
        new StringBuilder().append(scheme).append("://").append(parsed.getRawAuthority());
    var rawPath = parsed.getRawPath();
    if (rawPath != null) {
      resolved.append(rawPath);
    }
    if (!encodedQuery.isEmpty()) {
      resolved.append('?').append(encodedQuery);
    }
    try {
      return new URI(resolved.toString());
    } catch (URISyntaxException e) {
      throw new RestException(Stage.URL_PARSE, e);
    }
  }

  private static BodyPublisher bodyPublisher(RestRequest request, HttpRequest.Builder builder) {
    var body = request.bodyOrNull();
    if (body != null && body.length > 0) {
      return BodyPublishers.ofByteArray(body);
    }

    var encodedForm = FormEncoder.encode(request.form());
    if (encodedForm.isEmpty()) {
      return BodyPublishers.noBody();
    }
    if (request.headers().keySet().stream().noneMatch(CONTENT_TYPE::equalsIgnoreCase)) {
      builder.header(CONTENT_TYPE, FormEncoder.MEDIA_TYPE);
    }
    return BodyPublishers.ofString(encodedForm, US_ASCII);
  }
}
