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

package com.github.restry.internal;

import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Encodes multi-valued name-value pairs using the {@code application/x-www-form-urlencoded} format,
 * as used both for query strings and for form bodies. Names are written in sorted order and each
 * name's values keep their given order, so {@code {b=[2], a=[1, 0]}} encodes to {@code
 * a=1&a=0&b=2}.
 *
 * <p>Spaces are encoded as {@code +}. Only the unreserved characters {@code A-Z a-z 0-9 - _ . ~}
 * are left as-is.
 */
public final class FormEncoder {
  public static final String MEDIA_TYPE = "application/x-www-form-urlencoded";

  private static final Charset ENCODING_CHARSET = StandardCharsets.UTF_8;

  private FormEncoder() {}

  /** Returns the url-encoded string of the given pairs, or an empty string if there are none. */
  public static String encode(Map<String, ? extends List<String>> values) {
    var joiner = new StringJoiner("&");
    for (var entry : new TreeMap<>(values).entrySet()) {
      var encodedName = escape(entry.getKey());
      for (var value : entry.getValue()) {
        joiner.add(encodedName + "=" + escape(value));
      }
    }
    return joiner.toString();
  }

  /** Escapes the given string so it can be safely used as a form name or value. */
  public static String escape(String value) {
    // URLEncoder keeps '*' and escapes '~', which is the other way around for unreserved chars.
    var encoded = URLEncoder.encode(value, ENCODING_CHARSET);
    if (encoded.indexOf('*') >= 0) {
      encoded = encoded.replace("*", "%2A");
    }
    if (encoded.contains("%7E")) {
      encoded = encoded.replace("%7E", "~");
    }
    return encoded;
  }
}
