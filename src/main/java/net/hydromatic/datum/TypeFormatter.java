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

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;

import static java.util.Objects.requireNonNull;

/** Converts a {@link Cell} into the text shown in a grid.
 *
 * <p>Settings are read from the {@link SessionConfig} on every call. */
public class TypeFormatter {
  /** Appended to text that has been cut to the column display width. */
  public static final String TRUNCATION_MARKER = "[...]";

  /** Text shown for a value of a type that the formatter does not know. */
  public static final String UNKNOWN = "#unknown#";

  /** Width of a boolean column; long enough for "false". */
  static final int BOOLEAN_WIDTH = 5;

  private final SessionConfig config;

  public TypeFormatter(SessionConfig config) {
    this.config = requireNonNull(config);
  }

  /** Formats a cell. */
  public FormattedCell format(Cell cell) {
    final Object value = cell.value;
    switch (cell.kind) {
    case NULL:
      final String nullString = config.getNullDisplayString();
      return new FormattedCell(nullString, nullString.length());
    case BOOLEAN:
      return new FormattedCell(String.valueOf(value), BOOLEAN_WIDTH);
    case INTEGER:
      final long v = (Long) requireNonNull(value);
      return new FormattedCell(Long.toString(v), integerWidth(v));
    case DECIMAL:
      final BigDecimal d = (BigDecimal) requireNonNull(value);
      return new FormattedCell(d.toPlainString(), decimalWidth(d));
    case DATE:
      return temporal(DateTimeFormatter.ISO_DATE, value);
    case TIME:
      return temporal(DateTimeFormatter.ISO_TIME, value);
    case TIMESTAMP:
      return temporal(DateTimeFormatter.ISO_DATE_TIME, value);
    case TEXT:
      return text((String) requireNonNull(value));
    case BINARY:
      return text(JdbcUtils.hex((byte[]) requireNonNull(value)));
    case UNKNOWN:
    default:
      return new FormattedCell(UNKNOWN, UNKNOWN.length());
    }
  }

  private static FormattedCell temporal(DateTimeFormatter formatter,
      Object value) {
    final String s = formatter.format((TemporalAccessor) value);
    return new FormattedCell(s, s.length());
  }

  /** Formats a piece of text, such as a column label or a string value. */
  public FormattedCell text(String s) {
    final String t = formatText(s);
    return new FormattedCell(t, t.length());
  }

  /** Replaces newlines and tabs, then truncates to the column display
   * width.
   *
   * <p>A carriage return followed by a newline counts as one newline, and
   * so does a lone carriage return.
   *
   * <p>If the width is too small to hold the truncation marker, the text is
   * cut to the width and no marker is added. */
  public String formatText(String s) {
    String t = s;
    if (!config.getNewlineReplacement().equals("\n")) {
      final String replacement = config.getNewlineReplacement();
      t = t.replace("\r\n", replacement)
          .replace("\r", replacement)
          .replace("\n", replacement);
    }
    if (!config.getTabReplacement().equals("\t")) {
      t = t.replace("\t", config.getTabReplacement());
    }
    final int width = config.getColumnDisplayWidth();
    if (width > 0 && t.length() > width) {
      if (width > TRUNCATION_MARKER.length()) {
        return t.substring(0, width - TRUNCATION_MARKER.length())
            + TRUNCATION_MARKER;
      }
      return t.substring(0, width);
    }
    return t;
  }

  /** Returns the number of characters needed to print an integer,
   * including its sign. */
  static int integerWidth(long v) {
    int digits = 1;
    for (long x = v; x >= 10 || x <= -10; x /= 10) {
      ++digits;
    }
    return v < 0 ? digits + 1 : digits;
  }

  /** Returns the width allowed for a decimal value: its digits, including
   * the leading zero of a value less than one and the trailing zeros of a
   * value with negative scale, plus one for the decimal point and one for a
   * minus sign. */
  static int decimalWidth(BigDecimal d) {
    final int precision = d.precision();
    final int scale = d.scale();
    final int digits;
    if (scale <= 0) {
      digits = precision - scale;
    } else if (scale >= precision) {
      digits = scale + 1;
    } else {
      digits = precision;
    }
    return digits + 1 + (d.signum() < 0 ? 1 : 0);
  }
}

// End TypeFormatter.java
