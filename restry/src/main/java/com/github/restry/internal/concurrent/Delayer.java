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

package com.github.restry.internal.concurrent;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/** Delays the execution of a task. */
@FunctionalInterface
public interface Delayer {

  /**
   * Arranges for the given task to run on the given executor after the given delay. The returned
   * future completes when the task has run. Cancelling the future cancels the pending task.
   */
  CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor);

  /** Returns a {@code Delayer} backed by the library's shared scheduler. */
  static Delayer defaultDelayer() {
    return DefaultDelayerHolder.INSTANCE;
  }

  /** Returns a {@code Delayer} backed by the given scheduler. */
  static Delayer of(ScheduledExecutorService scheduler) {
    return new ScheduledExecutorServiceDelayer(scheduler);
  }
}

final class DefaultDelayerHolder {
  static final Delayer INSTANCE = new ScheduledExecutorServiceDelayer(SharedExecutors.scheduler());

  private DefaultDelayerHolder() {}
}
