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

import java.io.IOException;

/**
 * Signals that a {@link RestRequest} could not produce a {@link RestResponse}. The {@link #stage()
 * stage} tells where the attempt failed, and the cause carries the underlying failure.
 *
 * <p>Configuration errors ({@link Stage#URL_PARSE} and {@link Stage#REQUEST}) are raised before
 * anything is sent and are never retried. Transport and read errors are handed to the request's
 * {@link RetryPredicate}, which decides whether another attempt is made.
 */
public final class RestException extends IOException {
  private static final long serialVersionUID = 4716328591253347024L;

  private final Stage stage;

  public RestException(Stage stage, Throwable cause) {
    super(stage.label() + ": " + cause.getMessage(), cause);
    this.stage = requireNonNull(stage);
  }

  public RestException(Stage stage, String message) {
    super(stage.label() + ": " + message);
    this.stage = requireNonNull(stage);
  }

  /** Returns the stage at which the request failed. */
  public Stage stage() {
    return stage;
  }

  /** Returns {@code true} if this exception was raised before any attempt was made. */
  public boolean isConfigurationError() {
    return stage == Stage.URL_PARSE || stage == Stage.REQUEST;
  }

  /** The stage of a request's lifecycle at which a {@link RestException} is raised. */
  public enum Stage {
    /** The URL couldn't be parsed, or isn't an absolute {@code http} or {@code https} URL. */
    URL_PARSE("url parse"),

    /** The request couldn't be built, e.g. due to an invalid method or header. */
    REQUEST("request build"),

    /**
     * The transport failed to get a response (connection refused, DNS failure...), or the response
     * wasn't fully received within the request's timeout.
     */
    TRANSPORT("transport"),

    /** A response was received but reading its body failed for a reason other than a timeout. */
    READ("read");

    private final String label;

    Stage(String label) {
      this.label = label;
    }

    /** Returns the short label prefixed to the messages of exceptions raised at this stage. */
    public String label() {
      return label;
    }
  }
}
