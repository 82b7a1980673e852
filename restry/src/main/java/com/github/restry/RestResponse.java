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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.net.http.HttpHeaders;

/**
 * The outcome of a successful attempt: a status code, the received headers and the fully drained
 * body. A {@code RestResponse} is immutable.
 */
public final class RestResponse {
  private final URI uri;
  private final int statusCode;
  private final HttpHeaders headers;
  private final byte[] body;

  RestResponse(URI uri, int statusCode, HttpHeaders headers, byte[] body) {
    this.uri = requireNonNull(uri);
    this.statusCode = statusCode;
    this.headers = requireNonNull(headers);
    this.body = requireNonNull(body);
  }

  /** Returns the {@code URI} the request was sent to, including its encoded query. */
  public URI uri() {
    return uri;
  }

  public int statusCode() {
    return statusCode;
  }

  /** Returns {@code true} for a {@code 2xx} status. */
  public boolean isSuccessful() {
    return statusClass() == 2;
  }

  /**
   * Returns {@code true} for a {@code 3xx} status. Such a response is only seen when the transport
   * doesn't follow the redirect.
   */
  public boolean isRedirection() {
    return statusClass() == 3;
  }

  /** Returns {@code true} for a {@code 4xx} status. */
  public boolean isClientError() {
    return statusClass() == 4;
  }

  /** Returns {@code true} for a {@code 5xx} status. */
  public boolean isServerError() {
    return statusClass() == 5;
  }

  private int statusClass() {
    return statusCode >= 100 && statusCode <= 599 ? statusCode / 100 : 0;
  }

  public HttpHeaders headers() {
    return headers;
  }

  /** Returns the response body decoded as UTF-8 text. */
  public String body() {
    return new String(body, UTF_8);
  }

  /** Returns a copy of the raw response body. */
  public byte[] bodyBytes() {
    return body.clone();
  }

  @Override
  public String toString() {
    return "RestResponse[uri=" + uri + ", statusCode=" + statusCode + "]";
  }

  /** Creates a new {@code RestResponse} from the given parts. */
  public static RestResponse of(URI uri, int statusCode, HttpHeaders headers, byte[] body) {
    return new RestResponse(uri, statusCode, headers, body.clone());
  }
}
