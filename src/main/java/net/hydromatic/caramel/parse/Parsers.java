/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.caramel.parse;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Punctuation characters that may occur in a word, besides letters and
   * digits.
   */
  static final String WORD_PUNCTUATION = "_.@:?$!^&|*-+<>~=/";

  /** Spaces by which each level of local definitions is indented. */
  static final int INDENT = 4;

  /** Returns whether a code point may occur in a word. */
  public static boolean isWordChar(int c) {
    return Character.isLetterOrDigit(c) || WORD_PUNCTUATION.indexOf(c) >= 0;
  }

  /** Returns whether a code point is an ASCII decimal digit. */
  static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  /**
   * Prepares source text for parsing.
   *
   * <p>Removes the comment, starting with {@code --}, from each line; removes
   * trailing spaces from each line; removes lines that contain only
   * whitespace. Each remaining line ends with a newline, and the text ends
   * with an extra newline.
   */
  public static String stripComments(String source) {
    final StringBuilder b = new StringBuilder();
    for (String line : Splitter.on('\n').split(source)) {
      final int i = line.indexOf("--");
      if (i >= 0) {
        line = line.substring(0, i);
      }
      line = CharMatcher.is(' ').trimTrailingFrom(line);
      if (CharMatcher.whitespace().matchesAllOf(line)) {
        continue;
      }
      b.append(line).append('\n');
    }
    return b.append('\n').toString();
  }

  /** Returns whether a string contains only whitespace after an offset. */
  static boolean isBlank(String s, int offset) {
    return CharMatcher.whitespace().matchesAllOf(s.substring(offset));
  }

  /** Converts a list of code points to a string. */
  static String toString(List<Integer> codePoints) {
    final StringBuilder b = new StringBuilder();
    codePoints.forEach(b::appendCodePoint);
    return b.toString();
  }
}

// End Parsers.java
