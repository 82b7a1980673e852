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

import static java.util.Objects.requireNonNull;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;

/** A response as returned by a {@link Transport}, whose body is yet to be read. */
public final class TransportResponse implements Closeable {
  private final int statusCode;
  private final HttpHeaders headers;
  private final InputStream body;

  private TransportResponse(int statusCode, HttpHeaders headers, InputStream body) {
    this.statusCode = statusCode;
    this.headers = requireNonNull(headers);
    this.body = requireNonNull(body);
  }

  public int statusCode() {
    return statusCode;
  }

  public HttpHeaders headers() {
    return headers;
  }

  /** Returns the response body stream, which can be read once. */
  public InputStream body() {
    return body;
  }

  /** Closes the body stream, releasing the underlying connection back to the transport. */
  @Override
  public void close() throws IOException {
    body.close();
  }

  public static TransportResponse of(int statusCode, HttpHeaders headers, InputStream body) {
    return new TransportResponse(statusCode, headers, body);
  }
}
