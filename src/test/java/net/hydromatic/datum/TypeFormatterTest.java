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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;

/** Tests for {@link Cell} and {@link TypeFormatter}. */
class TypeFormatterTest {
  private final SessionConfig config = new SessionConfig();
  private final TypeFormatter formatter = new TypeFormatter(config);

  private FormattedCell format(Object o) {
    return formatter.format(Cell.of(o));
  }

  @Test void testClassify() {
    assertThat(Cell.of(null).kind, is(Cell.Kind.NULL));
    assertThat(Cell.of(true).kind, is(Cell.Kind.BOOLEAN));
    assertThat(Cell.of((short) 3).kind, is(Cell.Kind.INTEGER));
    assertThat(Cell.of(3L).kind, is(Cell.Kind.INTEGER));
    assertThat(Cell.of(new BigDecimal("1.5")).kind, is(Cell.Kind.DECIMAL));
    assertThat(Cell.of(BigInteger.TEN).kind, is(Cell.Kind.DECIMAL));
    assertThat(Cell.of(2.5d).kind, is(Cell.Kind.DECIMAL));
    assertThat(Cell.of(Double.NaN).kind, is(Cell.Kind.TEXT));
    assertThat(Cell.of("abc").kind, is(Cell.Kind.TEXT));
    assertThat(Cell.of(new byte[] {1}).kind, is(Cell.Kind.BINARY));
    assertThat(Cell.of(new Object()).kind, is(Cell.Kind.UNKNOWN));
  }

  /** A {@link Timestamp} is a {@link java.util.Date}, but must be treated
   * as a timestamp, not a date. */
  @Test void testTimestampBeforeDate() {
    final Timestamp timestamp =
        Timestamp.valueOf(LocalDateTime.of(2024, 2, 29, 13, 45, 30));
    final Cell cell = Cell.of(timestamp);
    assertThat(cell.kind, is(Cell.Kind.TIMESTAMP));
    assertThat(formatter.format(cell).text, is("2024-02-29T13:45:30"));

    assertThat(Cell.of(java.sql.Date.valueOf(LocalDate.of(2024, 2, 29))).kind,
        is(Cell.Kind.DATE));
    assertThat(format(java.sql.Date.valueOf("2024-02-29")).text,
        is("2024-02-29"));
    assertThat(format(Time.valueOf("08:05:00")).text, is("08:05:00"));
  }

  @Test void testNull() {
    FormattedCell cell = format(null);
    assertThat(cell.text, is("[NULL]"));
    assertThat(cell.width, is(6));

    config.setNullDisplayString("N/A");
    cell = format(null);
    assertThat(cell.text, is("N/A"));
    assertThat(cell.width, is(3));

    config.setNullDisplayString("");
    assertThat(format(null).width, is(0));
  }

  @Test void testBoolean() {
    assertThat(format(true).text, is("true"));
    assertThat(format(true).width, is(5));
    assertThat(format(false).text, is("false"));
    assertThat(format(false).width, is(5));
  }

  @Test void testIntegerWidth() {
    assertThat(format(0).width, is(1));
    assertThat(format(7).width, is(1));
    assertThat(format(12345).width, is(5));
    assertThat(format(-42).text, is("-42"));
    assertThat(format(-42).width, is(3));
    assertThat(format(Long.MIN_VALUE).width,
        is(Long.toString(Long.MIN_VALUE).length()));
    assertThat(format(Long.MAX_VALUE).width,
        is(Long.toString(Long.MAX_VALUE).length()));
  }

  /** The width of a decimal column allows for each digit, the decimal
   * point and the sign, and is never less than the text. */
  @Test void testDecimalWidth() {
    checkDecimal("123.45", "123.45", 6);
    checkDecimal("-123.45", "-123.45", 7);
    checkDecimal("0.001", "0.001", 5);
    checkDecimal("0.5", "0.5", 3);
    checkDecimal("1.50", "1.50", 4);
    checkDecimal("1E+3", "1000", 5);
    checkDecimal("-1E+3", "-1000", 6);
    checkDecimal("0", "0", 2);
    checkDecimal("42", "42", 3);
  }

  private void checkDecimal(String value, String text, int width) {
    final FormattedCell cell = format(new BigDecimal(value));
    assertThat(cell.text, is(text));
    assertThat(cell.width, is(width));
    assertThat(cell.width, greaterThanOrEqualTo(cell.text.length()));
  }

  @Test void testDouble() {
    assertThat(format(2.5d).text, is("2.5"));
    assertThat(format(1e20d).text, is("100000000000000000000"));
    assertThat(format(Double.POSITIVE_INFINITY).text, is("Infinity"));
  }

  @Test void testTruncate() {
    config.setColumnDisplayWidth(10);
    assertThat(format("abcdefghijklmno").text, is("abcde[...]"));
    assertThat(format("abcdefghij").text, is("abcdefghij"));
    assertThat(format("abc").text, is("abc"));

    config.setColumnDisplayWidth(0);
    assertThat(format("abcdefghijklmno").text, is("abcdefghijklmno"));
  }

  /** If the width cannot hold the marker, the text is cut with no
   * marker. */
  @Test void testTruncateNarrow() {
    config.setColumnDisplayWidth(5);
    assertThat(format("abcdefgh").text, is("abcde"));
    config.setColumnDisplayWidth(3);
    assertThat(format("abcdefgh").text, is("abc"));
    config.setColumnDisplayWidth(6);
    assertThat(format("abcdefgh").text, is("a[...]"));
  }

  @Test void testNewlineAndTab() {
    assertThat(format("a\nb\tc").text, is("a\\nb\\tc"));

    config.setNewlineReplacement(" | ");
    config.setTabReplacement("    ");
    assertThat(format("a\nb\tc").text, is("a | b    c"));

    config.setNewlineReplacement("\n");
    config.setTabReplacement("\t");
    assertThat(format("a\nb\tc").text, is("a\nb\tc"));
  }

  /** A carriage return, alone or before a newline, is treated as a newline,
   * so it never reaches the terminal. */
  @Test void testCarriageReturn() {
    assertThat(format("line1\r\nline2").text, is("line1\\nline2"));
    assertThat(format("a\rb\nc").text, is("a\\nb\\nc"));

    config.setNewlineReplacement(" ");
    assertThat(format("x\r\n\r\ny").text, is("x  y"));

    config.setNewlineReplacement("\n");
    assertThat(format("a\r\nb").text, is("a\r\nb"));
  }

  /** Replacement happens before truncation, so the replacement counts
   * towards the width. */
  @Test void testReplaceThenTruncate() {
    config.setColumnDisplayWidth(8);
    assertThat(format("ab\ncdefgh").text, is("ab\\[...]"));
  }

  @Test void testBinary() {
    assertThat(format(new byte[] {(byte) 0xCA, (byte) 0xFE, 1}).text,
        is("0xCAFE01"));
    config.setColumnDisplayWidth(7);
    assertThat(format(new byte[] {(byte) 0xCA, (byte) 0xFE, 1}).text,
        is("0x[...]"));
  }

  @Test void testUnknown() {
    final FormattedCell cell = format(new Object());
    assertThat(cell.text, is("#unknown#"));
    assertThat(cell.width, is(9));
  }
}

// End TypeFormatterTest.java
