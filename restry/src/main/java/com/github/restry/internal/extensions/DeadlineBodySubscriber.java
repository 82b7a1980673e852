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

package com.github.restry.internal.extensions;

import static com.github.restry.internal.Utils.requireNonNegativeDuration;
import static java.util.Objects.requireNonNull;

import com.github.restry.internal.concurrent.Delayer;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow.Subscription;
import java.util.concurrent.Future;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@code BodySubscriber} that completes its downstream with an {@link HttpTimeoutException} if
 * the body isn't fully received before a deadline. Unlike a read timeout, the deadline isn't
 * extended by received items: it bounds the whole body.
 *
 * <p>Signals are serialized on this subscriber's monitor, so downstream never receives a signal
 * after the timeout error. Items arriving after that are dropped.
 */
public final class DeadlineBodySubscriber<T> implements BodySubscriber<T> {
  private final BodySubscriber<T> downstream;
  private final Duration remaining;
  private final Duration timeout;
  private final Delayer delayer;

  private @MonotonicNonNull Subscription upstream;
  private @Nullable Future<Void> deadlineFuture;
  private boolean done;

  /**
   * Creates a subscriber that times out after {@code remaining}, reporting the whole {@code
   * timeout} of which {@code remaining} is what's left.
   */
  public DeadlineBodySubscriber(
      BodySubscriber<T> downstream, Duration remaining, Duration timeout, Delayer delayer) {
    this.downstream = requireNonNull(downstream);
    this.remaining = requireNonNegativeDuration(remaining);
    this.timeout = requireNonNull(timeout);
    this.delayer = requireNonNull(delayer);
  }

  @Override
  public CompletionStage<T> getBody() {
    return downstream.getBody();
  }

  @Override
  public void onSubscribe(Subscription subscription) {
    requireNonNull(subscription);
    synchronized (this) {
      if (upstream != null) {
        subscription.cancel();
        return;
      }
      upstream = subscription;
    }
    downstream.onSubscribe(new DeadlineSubscription(subscription));

    // Scheduled after downstream is subscribed, as a deadline that's already passed fires right
    // away.
    var future = delayer.delay(this::onDeadline, remaining, Runnable::run);
    synchronized (this) {
      if (done) {
        future.cancel(false);
      } else {
        deadlineFuture = future;
      }
    }
  }

  @Override
  public synchronized void onNext(List<ByteBuffer> item) {
    requireNonNull(item);
    if (!done) {
      downstream.onNext(item);
    }
  }

  @Override
  public void onError(Throwable throwable) {
    requireNonNull(throwable);
    synchronized (this) {
      if (!markDone()) {
        return;
      }
      downstream.onError(throwable);
    }
  }

  @Override
  public void onComplete() {
    synchronized (this) {
      if (!markDone()) {
        return;
      }
      downstream.onComplete();
    }
  }

  private void onDeadline() {
    Subscription subscription;
    synchronized (this) {
      if (!markDone()) {
        return;
      }
      subscription = requireNonNull(upstream);
      downstream.onError(
          new HttpTimeoutException(
              "body not received within " + timeout.toMillis() + " ms of sending the request"));
    }

    // Cancelled after downstream is completed so the client's own cancellation error isn't seen
    // first.
    subscription.cancel();
  }

  /** Returns {@code true} if this call terminated the stream. Must hold the monitor. */
  private boolean markDone() {
    if (done) {
      return false;
    }
    done = true;
    var future = deadlineFuture;
    if (future != null) {
      future.cancel(false);
      deadlineFuture = null;
    }
    return true;
  }

  private final class DeadlineSubscription implements Subscription {
    private final Subscription delegate;

    DeadlineSubscription(Subscription delegate) {
      this.delegate = delegate;
    }

    @Override
    public void request(long n) {
      delegate.request(n);
    }

    @Override
    public void cancel() {
      synchronized (DeadlineBodySubscriber.this) {
        markDone();
      }
      delegate.cancel();
    }
  }
}
