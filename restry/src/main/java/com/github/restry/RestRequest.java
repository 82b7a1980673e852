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

import static com.github.restry.internal.Utils.requireNonNegativeDuration;
import static com.github.restry.internal.Utils.requirePositiveDuration;
import static com.github.restry.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.restry.internal.concurrent.Delayer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A mutable accumulator of everything needed to send one HTTP request, with optional automatic
 * retry. Configuration methods mutate this instance and return it for chaining. {@link #send()}
 * builds the actual request from the accumulated state, sends it, and retries as specified by
 * {@link #retry(int, Duration, RetryPredicate)}.
 *
 * <pre>{@code
 * var response =
 *     RestRequest.GET("https://example.com/items")
 *         .addQuery("id", 42)
 *         .addHeader("Accept", "application/json")
 *         .timeout(Duration.ofMillis(500))
 *         .send();
 * }</pre>
 *
 * <p>Query parameters, headers and form fields are multi-valued. {@code addX} methods append to the
 * values already present under a name, while {@code setX} methods replace all of them. Values are
 * rendered as text with {@link String#valueOf(Object)}.
 *
 * <p>When a body is set, it is sent as-is and form fields are ignored. Otherwise, form fields (if
 * any) are sent as an {@code application/x-www-form-urlencoded} body. The {@link #params() params}
 * map is kept for the caller's use and is not sent.
 *
 * <p>A {@code RestRequest} is meant to be configured and sent once by a single thread. It is not
 * safe for concurrent use; create a separate instance for each request.
 */
public final class RestRequest {

  /** The per-attempt timeout used if none is {@link #timeout(Duration) set}. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

  private final String method;
  private final String url;

  private Duration timeout = DEFAULT_TIMEOUT;
  private int retryAttempts;
  private Duration retryDelay = Duration.ZERO;
  private @Nullable RetryPredicate retryPredicate;

  private Map<String, String> params = new LinkedHashMap<>();
  private Map<String, List<String>> query = new LinkedHashMap<>();
  private Map<String, List<String>> headers = new LinkedHashMap<>();
  private Map<String, List<String>> form = new LinkedHashMap<>();
  private byte @Nullable [] body;
  private @Nullable Object records;

  private Transport transport = Transport.direct();
  private Delayer delayer = Delayer.defaultDelayer();

  private RestRequest(String method, String url) {
    this.method = requireNonNull(method);
    this.url = requireNonNull(url);
  }

  /**
   * Sets the timeout of each attempt. An attempt that doesn't get a response within the timeout
   * fails with a {@link RestException.Stage#TRANSPORT transport} error. The default is {@link
   * #DEFAULT_TIMEOUT 2 seconds}.
   *
   * @throws IllegalArgumentException if the given timeout is not positive
   */
  @CanIgnoreReturnValue
  public RestRequest timeout(Duration timeout) {
    this.timeout = requirePositiveDuration(timeout);
    return this;
  }

  /**
   * Specifies the retry policy, replacing any previous one. After a failed or unwanted attempt, the
   * request is sent again if {@code attempts} remain and {@code predicate} approves, after waiting
   * for {@code delay}. At most {@code attempts + 1} attempts are made in total.
   *
   * @param attempts the number of attempts to make after the first one, or zero to not retry
   * @param delay the time to wait before each retry
   * @param predicate decides whether to retry, may be null only if {@code attempts} is zero
   * @throws IllegalArgumentException if {@code attempts} or {@code delay} is negative, or if {@code
   *     attempts} is positive and {@code predicate} is null
   */
  @CanIgnoreReturnValue
  public RestRequest retry(int attempts, Duration delay, @Nullable RetryPredicate predicate) {
    requireArgument(attempts >= 0, "negative retry attempts: %d", attempts);
    requireNonNegativeDuration(delay);
    requireArgument(
        attempts == 0 || predicate != null,
        "a retry predicate is required to retry %d times",
        attempts);
    this.retryAttempts = attempts;
    this.retryDelay = delay;
    this.retryPredicate = predicate;
    return this;
  }

  /** Replaces all params with a copy of the given map. */
  @CanIgnoreReturnValue
  public RestRequest setParams(Map<String, String> params) {
    var copy = new LinkedHashMap<String, String>();
    params.forEach((name, value) -> copy.put(requireNonNull(name), requireNonNull(value)));
    this.params = copy;
    return this;
  }

  /** Sets the param with the given name to the given value's text, replacing any previous one. */
  @CanIgnoreReturnValue
  public RestRequest addParam(String name, Object value) {
    params.put(requireNonNull(name), String.valueOf(requireNonNull(value)));
    return this;
  }

  /** Replaces all query parameters with a copy of the given map. */
  @CanIgnoreReturnValue
  public RestRequest setQuery(Map<String, ? extends List<String>> query) {
    this.query = copyOf(query);
    return this;
  }

  /** Adds the given values to the query parameter with the given name. */
  @CanIgnoreReturnValue
  public RestRequest addQuery(String name, Object... values) {
    add(query, name, values);
    return this;
  }

  /** Replaces all headers with a copy of the given map. */
  @CanIgnoreReturnValue
  public RestRequest setHeaders(Map<String, ? extends List<String>> headers) {
    this.headers = copyOf(headers);
    return this;
  }

  /**
   * Adds the given values to the header with the given name. Values are never overwritten, neither
   * here nor when the request is built.
   */
  @CanIgnoreReturnValue
  public RestRequest addHeader(String name, Object... values) {
    add(headers, name, values);
    return this;
  }

  /** Replaces all form fields with a copy of the given map. */
  @CanIgnoreReturnValue
  public RestRequest setForm(Map<String, ? extends List<String>> form) {
    this.form = copyOf(form);
    return this;
  }

  /** Adds the given values to the form field with the given name. */
  @CanIgnoreReturnValue
  public RestRequest addForm(String name, Object... values) {
    add(form, name, values);
    return this;
  }

  /** Sets the raw request body to a copy of the given bytes. */
  @CanIgnoreReturnValue
  public RestRequest body(byte[] body) {
    this.body = body.clone();
    return this;
  }

  /** Attaches the given value to this request for the caller's own bookkeeping. */
  @CanIgnoreReturnValue
  public RestRequest records(@Nullable Object records) {
    this.records = records;
    return this;
  }

  /** Sets the {@link Transport} used to send this request. */
  @CanIgnoreReturnValue
  public RestRequest transport(Transport transport) {
    this.transport = requireNonNull(transport);
    return this;
  }

  /** Calls the given consumer against this request. */
  @CanIgnoreReturnValue
  public RestRequest apply(Consumer<? super RestRequest> consumer) {
    consumer.accept(this);
    return this;
  }

  @CanIgnoreReturnValue
  RestRequest delayer(Delayer delayer) {
    this.delayer = requireNonNull(delayer);
    return this;
  }

  /**
   * Sends this request, retrying as specified by {@link #retry(int, Duration, RetryPredicate)},
   * and returns the response of the last attempt.
   *
   * @throws RestException if the request couldn't be built, or if the last attempt failed
   * @throws InterruptedException if the current thread is interrupted during an attempt or while
   *     waiting to retry
   * @throws IllegalStateException if the retry predicate is removed while retries remain
   */
  public RestResponse send() throws RestException, InterruptedException {
    return new RetryExecutor(this).execute();
  }

  public String method() {
    return method;
  }

  public String url() {
    return url;
  }

  public Duration timeout() {
    return timeout;
  }

  public int retryAttempts() {
    return retryAttempts;
  }

  public Duration retryDelay() {
    return retryDelay;
  }

  public Optional<RetryPredicate> retryPredicate() {
    return Optional.ofNullable(retryPredicate);
  }

  /** Returns an unmodifiable snapshot of this request's params. */
  public Map<String, String> params() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  /** Returns an unmodifiable snapshot of this request's query parameters. */
  public Map<String, List<String>> query() {
    return snapshotOf(query);
  }

  /** Returns an unmodifiable snapshot of this request's headers. */
  public Map<String, List<String>> headers() {
    return snapshotOf(headers);
  }

  /** Returns an unmodifiable snapshot of this request's form fields. */
  public Map<String, List<String>> form() {
    return snapshotOf(form);
  }

  /** Returns a copy of this request's body, if one is set. */
  public Optional<byte[]> body() {
    var currentBody = body;
    return currentBody != null ? Optional.of(currentBody.clone()) : Optional.empty();
  }

  public Optional<Object> records() {
    return Optional.ofNullable(records);
  }

  public Transport transport() {
    return transport;
  }

  Delayer delayer() {
    return delayer;
  }

  byte @Nullable [] bodyOrNull() {
    return body;
  }

  @Override
  public String toString() {
    return "RestRequest[" + method + " " + url + "]";
  }

  /** Creates a new request with the given method and URL. */
  public static RestRequest create(String method, String url) {
    return new RestRequest(method, url);
  }

  /** Creates a new {@code GET} request with the given URL. */
  public static RestRequest GET(String url) {
    return create("GET", url);
  }

  /** Creates a new {@code POST} request with the given URL. */
  public static RestRequest POST(String url) {
    return create("POST", url);
  }

  /** Creates a new {@code PUT} request with the given URL. */
  public static RestRequest PUT(String url) {
    return create("PUT", url);
  }

  /** Creates a new {@code DELETE} request with the given URL. */
  public static RestRequest DELETE(String url) {
    return create("DELETE", url);
  }

  private static void add(Map<String, List<String>> map, String name, Object... values) {
    var current = map.computeIfAbsent(requireNonNull(name), __ -> new ArrayList<>());
    for (var value : values) {
      current.add(String.valueOf(requireNonNull(value)));
    }
  }

  private static Map<String, List<String>> copyOf(Map<String, ? extends List<String>> map) {
    var copy = new LinkedHashMap<String, List<String>>();
    map.forEach(
        (name, values) -> {
          var valuesCopy = new ArrayList<String>(values.size());
          values.forEach(value -> valuesCopy.add(requireNonNull(value)));
          copy.put(requireNonNull(name), valuesCopy);
        });
    return copy;
  }

  private static Map<String, List<String>> snapshotOf(Map<String, List<String>> map) {
    var snapshot = new LinkedHashMap<String, List<String>>();
    map.forEach((name, values) -> snapshot.put(name, List.copyOf(values)));
    return Collections.unmodifiableMap(snapshot);
  }
}
