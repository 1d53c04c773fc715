/*
 * Licensed to Julian Hyde under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.hydromatic.datum;

import com.google.common.base.CharMatcher;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/** Reads lines until they form a complete unit of input.
 *
 * <p>After each line, the rules are checked in order:
 *
 * <ol>
 * <li>If the line, trimmed, ends with ";;", the unit is every line so far;
 *   trailing whitespace and one ';' are removed from the last line, so that
 *   the query ends with a single ';'.
 * <li>If the line, trimmed and upper-cased, starts with "GO", the unit is
 *   every line before it.
 * <li>If the line starts with ':', the unit is that line alone, and any
 *   lines before it are discarded.
 * <li>Otherwise, read another line.
 * </ol>
 */
public class InputAssembler {
  private final Prompter prompter;

  public InputAssembler(Prompter prompter) {
    this.prompter = requireNonNull(prompter);
  }

  /** Reads the next unit of input.
   *
   * <p>Returns null at end of input; a partly-entered query is discarded.
   * Returns the empty string if the user interrupts. */
  public @Nullable String next(String prompt) throws IOException {
    final List<String> lines = new ArrayList<>();
    for (;;) {
      final String line;
      try {
        line = prompter.readLine(prompt);
      } catch (InterruptedIOException e) {
        return "";
      }
      if (line == null) {
        return null;
      }
      final String trimmed = line.trim();
      if (trimmed.endsWith(";;")) {
        final String last = CharMatcher.whitespace().trimTrailingFrom(line);
        lines.add(last.substring(0, last.length() - 1));
        return String.join("\n", lines);
      }
      if (trimmed.toUpperCase(Locale.ROOT).startsWith("GO")) {
        return String.join("\n", lines);
      }
      if (line.startsWith(":")) {
        return line;
      }
      lines.add(line);
    }
  }
}

// End InputAssembler.java
