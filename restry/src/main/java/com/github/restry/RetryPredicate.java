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

import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether a {@link RestRequest} is to be sent again after an attempt. The predicate sees
 * the outcome of the latest attempt only: exactly one of {@code response} or {@code exception} is
 * non-null. It's only consulted while retry attempts remain.
 *
 * <p>The predicate may modify the request it receives (e.g. add a header). The next attempt is
 * built from the request's state at that point.
 *
 * <h2>Example:</h2>
 *
 * Retry server errors and failed connections up to 3 times, waiting 100ms between attempts:
 *
 * <pre>{@code
 * var response =
 *     RestRequest.GET("https://example.com/items")
 *         .addQuery("id", 42)
 *         .retry(
 *             3,
 *             Duration.ofMillis(100),
 *             RetryPredicate.onServerError().or(RetryPredicate.onException()))
 *         .send();
 * }</pre>
 */
@FunctionalInterface
public interface RetryPredicate {

  /** Returns {@code true} if the request should be sent again. */
  boolean shouldRetry(
      RestRequest request, @Nullable RestResponse response, @Nullable RestException exception);

  /**
   * Returns a predicate that retries if either this predicate or the given one does. The given
   * predicate is not evaluated if this one already decides to retry.
   */
  default RetryPredicate or(RetryPredicate other) {
    requireNonNull(other);
    return (request, response, exception) ->
        shouldRetry(request, response, exception)
            || other.shouldRetry(request, response, exception);
  }

  /** Returns a predicate that retries only if both this predicate and the given one do. */
  default RetryPredicate and(RetryPredicate other) {
    requireNonNull(other);
    return (request, response, exception) ->
        shouldRetry(request, response, exception)
            && other.shouldRetry(request, response, exception);
  }

  /** Returns a predicate that always retries, until attempts are exhausted. */
  static RetryPredicate always() {
    return (request, response, exception) -> true;
  }

  /** Returns a predicate that never retries. */
  static RetryPredicate never() {
    return (request, response, exception) -> false;
  }

  /** Returns a predicate that retries whenever the attempt failed with an exception. */
  static RetryPredicate onException() {
    return (request, response, exception) -> exception != null;
  }

  /**
   * Returns a predicate that retries if the attempt failed with an exception whose cause is an
   * instance of any of the given types. For example, {@code
   * onException(HttpTimeoutException.class)} retries timed out attempts only.
   */
  @SafeVarargs
  static RetryPredicate onException(Class<? extends Throwable>... causeTypes) {
    var causeTypesCopy = Set.of(causeTypes);
    return (request, response, exception) -> {
      if (exception == null) {
        return false;
      }
      var cause = exception.getCause();
      return cause != null && causeTypesCopy.stream().anyMatch(c -> c.isInstance(cause));
    };
  }

  /**
   * Returns a predicate that retries if a response with any of the given status codes is received.
   */
  static RetryPredicate onStatus(Integer... codes) {
    var codesCopy = Set.of(codes);
    return (request, response, exception) ->
        response != null && codesCopy.contains(response.statusCode());
  }

  /** Returns a predicate that retries if a response with a 5xx status code is received. */
  static RetryPredicate onServerError() {
    return (request, response, exception) -> response != null && response.isServerError();
  }
}
