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

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * The HTTP engine a {@link RestRequest} delegates to for each attempt. A transport takes care of
 * connecting, TLS and framing, and returns the response status, headers and an unread body stream.
 * The per-attempt timeout is carried by {@link HttpRequest#timeout()} and bounds the whole
 * exchange: a body that isn't received in time fails when read with an {@link
 * java.net.http.HttpTimeoutException HttpTimeoutException}, possibly as the cause of another
 * {@code IOException}.
 *
 * <p>The caller of {@link #exchange(HttpRequest)} owns the returned {@link TransportResponse} and
 * must close it exactly once.
 */
@FunctionalInterface
public interface Transport {

  /**
   * Sends the given request and returns the response once its status and headers are available.
   *
   * @throws IOException if the request couldn't be sent or no response was received in time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  TransportResponse exchange(HttpRequest request) throws IOException, InterruptedException;

  /**
   * Returns the shared transport that dials hosts directly, without any proxy, using the JDK's
   * {@code HttpClient}.
   */
  static Transport direct() {
    return DirectTransport.shared();
  }
}
