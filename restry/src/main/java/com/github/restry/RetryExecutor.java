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

import static com.github.restry.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.restry.RestException.Stage;
import com.github.restry.internal.Utils;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpRequest;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sends a {@link RestRequest}, retrying while attempts remain and the request's {@link
 * RetryPredicate} approves. Each attempt is built from the request's state at the time it's made.
 */
final class RetryExecutor {
  private static final Logger logger = System.getLogger(RetryExecutor.class.getName());

  private final RestRequest request;

  RetryExecutor(RestRequest request) {
    this.request = requireNonNull(request);
  }

  RestResponse execute() throws RestException, InterruptedException {
    int remainingRetries = request.retryAttempts();
    int attemptCount = 0;
    while (true) {
      // A request that can't be built fails right away, retrying won't fix it.
      var httpRequest = RequestAssembler.assemble(request);
      var outcome = attempt(httpRequest, attemptCount);
      attemptCount++;
      if (remainingRetries <= 0 || !shouldRetry(outcome)) {
        return outcome.get();
      }

      remainingRetries--;
      var delay = request.retryDelay();
      int retriesLeft = remainingRetries;
      int attemptNumber = attemptCount;
      logger.log(
          Level.DEBUG,
          () ->
              "Retrying "
                  + request
                  + " in "
                  + delay
                  + " after attempt #"
                  + attemptNumber
                  + " ("
                  + outcome
                  + "), "
                  + retriesLeft
                  + " retries left");
      await(delay);
    }
  }

  private Outcome attempt(HttpRequest httpRequest, int attemptCount) throws InterruptedException {
    logger.log(
        Level.TRACE,
        () -> "Sending " + httpRequest.method() + " " + httpRequest.uri() + " #" + attemptCount);

    TransportResponse transportResponse;
    try {
      transportResponse = requireNonNull(request.transport().exchange(httpRequest));
    } catch (IOException e) {
      return Outcome.failure(new RestException(Stage.TRANSPORT, e));
    }

    try {
      var body = transportResponse.body().readAllBytes();
      return Outcome.success(
          new RestResponse(
              httpRequest.uri(),
              transportResponse.statusCode(),
              transportResponse.headers(),
              body));
    } catch (IOException e) {
      var timeout = timeoutCause(e);
      return Outcome.failure(
          timeout != null
              ? new RestException(Stage.TRANSPORT, timeout)
              : new RestException(Stage.READ, e));
    } finally {
      Utils.closeQuietly(transportResponse);
    }
  }

  /**
   * Returns the {@code HttpTimeoutException} behind a failed body read, if any. A body that misses
   * the attempt's deadline is reported like a response that misses it.
   */
  private static @Nullable HttpTimeoutException timeoutCause(IOException readFailure) {
    for (Throwable t = readFailure; t != null; t = t.getCause()) {
      if (t instanceof HttpTimeoutException) {
        return (HttpTimeoutException) t;
      }
    }
    return null;
  }

  private boolean shouldRetry(Outcome outcome) {
    var predicate = request.retryPredicate().orElse(null);
    requireState(predicate != null, "retries remain but no retry predicate is set");
    return predicate.shouldRetry(request, outcome.response, outcome.exception);
  }

  private void await(Duration delay) throws InterruptedException {
    var delayedFuture = request.delayer().delay(() -> {}, delay, Runnable::run);
    try {
      delayedFuture.get();
    } catch (InterruptedException e) {
      delayedFuture.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      // Cannot happen.
      throw new AssertionError(e);
    }
  }

  /** The result of a single attempt, where exactly one of response or exception is non-null. */
  private static final class Outcome {
    final @Nullable RestResponse response;
    final @Nullable RestException exception;

    private Outcome(@Nullable RestResponse response, @Nullable RestException exception) {
      this.response = response;
      this.exception = exception;
    }

    RestResponse get() throws RestException {
      if (exception != null) {
        throw exception;
      }
      return requireNonNull(response);
    }

    @Override
    public String toString() {
      return response != null ? "status " + response.statusCode() : String.valueOf(exception);
    }

    static Outcome success(RestResponse response) {
      return new Outcome(response, null);
    }

    static Outcome failure(RestException exception) {
      return new Outcome(null, exception);
    }
  }
}
