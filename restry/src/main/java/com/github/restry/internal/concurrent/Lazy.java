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

import static com.github.restry.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value that is computed once, on first access, by a factory that is dropped afterwards. Safe for
 * use by multiple threads: the factory runs at most once.
 */
public final class Lazy<T> implements Supplier<T> {
  private final ReentrantLock initLock = new ReentrantLock();

  private volatile @MonotonicNonNull T value;

  /** Cleared once the value is computed. Guarded by initLock. */
  private @Nullable Supplier<T> factory;

  private Lazy(Supplier<T> factory) {
    this.factory = requireNonNull(factory);
  }

  @Override
  public T get() {
    var currentValue = value;
    return currentValue != null ? currentValue : initialize();
  }

  /** Returns the value if it was already computed, without computing it. */
  public Optional<T> current() {
    return Optional.ofNullable(value);
  }

  private T initialize() {
    requireState(!initLock.isHeldByCurrentThread(), "recursive initialization of a lazy value");
    initLock.lock();
    try {
      var currentValue = value;
      if (currentValue == null) {
        currentValue = requireNonNull(requireNonNull(factory).get(), "factory returned null");
        value = currentValue;
        factory = null;
      }
      return currentValue;
    } finally {
      initLock.unlock();
    }
  }

  public static <T> Lazy<T> of(Supplier<T> factory) {
    return new Lazy<>(factory);
  }
}
