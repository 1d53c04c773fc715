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

import com.google.common.collect.ImmutableList;

import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Query text with named placeholders.
 *
 * <p>A placeholder is an identifier in braces, for example {@code {name}}.
 * Each distinct name is asked for once, however many times it occurs.
 * <code>{{</code> and <code>}}</code> stand for literal braces. A template with an
 * unmatched brace, an empty or numeric placeholder, or a placeholder that is
 * not an identifier is malformed; {@link #parse} finds this before anything
 * is asked.
 */
public class Template {
  private final ImmutableList<Segment> segments;
  private final ImmutableList<String> names;

  private Template(List<Segment> segments, Set<String> names) {
    this.segments = ImmutableList.copyOf(segments);
    this.names = ImmutableList.copyOf(names);
  }

  /** Parses a template.
   *
   * @throws TemplateException if the template is malformed */
  public static Template parse(String text) {
    final List<Segment> segments = new ArrayList<>();
    final Set<String> names = new LinkedHashSet<>();
    final StringBuilder literal = new StringBuilder();
    final int n = text.length();
    for (int i = 0; i < n; i++) {
      final char c = text.charAt(i);
      if (c == '{') {
        if (i + 1 < n && text.charAt(i + 1) == '{') {
          literal.append('{');
          ++i;
          continue;
        }
        final int close = text.indexOf('}', i + 1);
        if (close < 0) {
          throw new TemplateException("unmatched '{' at position " + i);
        }
        final String name = text.substring(i + 1, close);
        if (name.isEmpty() || isDigits(name)) {
          throw new TemplateException("positional placeholder '{" + name
              + "}' has no name");
        }
        if (!isIdentifier(name)) {
          throw new TemplateException("invalid placeholder '{" + name + "}'");
        }
        if (literal.length() > 0) {
          segments.add(new Segment(false, literal.toString()));
          literal.setLength(0);
        }
        segments.add(new Segment(true, name));
        names.add(name);
        i = close;
      } else if (c == '}') {
        if (i + 1 < n && text.charAt(i + 1) == '}') {
          literal.append('}');
          ++i;
          continue;
        }
        throw new TemplateException("single '}' at position " + i);
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      segments.add(new Segment(false, literal.toString()));
    }
    return new Template(segments, names);
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isIdentifier(String s) {
    final char first = s.charAt(0);
    if (!Character.isLetter(first) && first != '_') {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') {
        return false;
      }
    }
    return true;
  }

  /** Returns the distinct placeholder names, in order of first
   * appearance. */
  public List<String> names() {
    return names;
  }

  /** Substitutes values for placeholders. */
  public String expand(Map<String, String> values) {
    final StringBuilder b = new StringBuilder();
    for (Segment segment : segments) {
      if (segment.placeholder) {
        b.append(requireNonNull(values.get(segment.text), segment.text));
      } else {
        b.append(segment.text);
      }
    }
    return b.toString();
  }

  /** Asks for a value of each placeholder, with prompt "name> ", and
   * substitutes the values. */
  public String expand(Prompter prompter) throws IOException {
    final Map<String, String> values = new LinkedHashMap<>();
    for (String name : names) {
      final String value = prompter.readLine(name + "> ");
      if (value == null) {
        throw new EOFException("End of input while reading value of '"
            + name + "'");
      }
      values.put(name, value);
    }
    return expand(values);
  }

  /** Piece of a template: literal text or a placeholder name. */
  private static class Segment {
    final boolean placeholder;
    final String text;

    Segment(boolean placeholder, String text) {
      this.placeholder = placeholder;
      this.text = text;
    }
  }
}

// End Template.java
