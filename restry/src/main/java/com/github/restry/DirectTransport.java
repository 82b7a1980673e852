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

import com.github.restry.internal.Utils;
import com.github.restry.internal.concurrent.Delayer;
import com.github.restry.internal.concurrent.Lazy;
import com.github.restry.internal.extensions.DeadlineBodySubscriber;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * A {@link Transport} backed by the JDK's {@link HttpClient}. By default, connections are
 * established directly to the target host ({@link HttpClient.Builder#NO_PROXY no proxy}) with the
 * platform's name resolution, and redirects are followed except from {@code https} to {@code http}.
 *
 * <p>The request's {@link HttpRequest#timeout() timeout} bounds the whole exchange. The JDK client
 * applies it until the response headers arrive, and this transport applies what's left of it to
 * the body. A body that isn't fully received in time fails with an {@link
 * java.net.http.HttpTimeoutException HttpTimeoutException} when read.
 *
 * <p>The underlying client is created on first use and reused for every exchange, so connections
 * can be pooled across attempts and across requests sharing this transport.
 */
public final class DirectTransport implements Transport {
  private static final Lazy<DirectTransport> SHARED = Lazy.of(DirectTransport::new);

  private final Lazy<HttpClient> lazyClient;
  private final Delayer delayer;

  /** Creates a transport with a default direct-dialing client. */
  public DirectTransport() {
    this(DirectTransport::newDirectClient, Delayer.defaultDelayer());
  }

  /** Creates a transport that sends requests through the given client. */
  public DirectTransport(HttpClient client) {
    this(supplierOf(requireNonNull(client)), Delayer.defaultDelayer());
  }

  DirectTransport(HttpClient client, Delayer delayer) {
    this(supplierOf(requireNonNull(client)), delayer);
  }

  private DirectTransport(Supplier<HttpClient> clientFactory, Delayer delayer) {
    this.lazyClient = Lazy.of(clientFactory);
    this.delayer = requireNonNull(delayer);
  }

  /** Returns the client this transport sends requests through. */
  public HttpClient client() {
    return lazyClient.get();
  }

  @Override
  public TransportResponse exchange(HttpRequest request)
      throws IOException, InterruptedException {
    var response = client().send(request, bodyHandler(request, System.nanoTime()));
    return TransportResponse.of(response.statusCode(), response.headers(), response.body());
  }

  private BodyHandler<InputStream> bodyHandler(HttpRequest request, long sentAtNanos) {
    var timeout = request.timeout().orElse(null);
    if (timeout == null) {
      return responseInfo -> BodySubscribers.ofInputStream();
    }
    return responseInfo -> {
      var elapsed = Duration.ofNanos(System.nanoTime() - sentAtNanos);
      var remaining = timeout.minus(elapsed);
      return new DeadlineBodySubscriber<>(
          BodySubscribers.ofInputStream(),
          remaining.isNegative() ? Duration.ZERO : remaining,
          timeout,
          delayer);
    };
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + lazyClient.current().map(client -> "[client=" + client + "]").orElse("[client=<lazy>]");
  }

  static DirectTransport shared() {
    return SHARED.get();
  }

  private static HttpClient newDirectClient() {
    return HttpClient.newBuilder()
        .proxy(HttpClient.Builder.NO_PROXY)
        .followRedirects(Redirect.NORMAL)
        .build();
  }

  private static Supplier<HttpClient> supplierOf(HttpClient client) {
    return () -> client;
  }
}
