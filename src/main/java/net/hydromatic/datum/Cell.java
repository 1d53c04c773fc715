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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

import static java.util.Objects.requireNonNull;

/** Value of one column in one row, tagged with its kind.
 *
 * <p>{@link #of(Object)} classifies a value returned by a JDBC driver; after
 * that, code switches on {@link #kind} and never looks at the Java class of
 * {@link #value} again.
 */
public final class Cell {
  /** The null cell. */
  public static final Cell NULL = new Cell(Kind.NULL, null);

  public final Kind kind;
  /** The value; its class depends on {@link #kind}. */
  public final @Nullable Object value;

  private Cell(Kind kind, @Nullable Object value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  @Override public String toString() {
    return kind + "(" + value + ")";
  }

  public static Cell ofBoolean(boolean b) {
    return new Cell(Kind.BOOLEAN, b);
  }

  public static Cell ofInteger(long v) {
    return new Cell(Kind.INTEGER, v);
  }

  public static Cell ofDecimal(BigDecimal v) {
    return new Cell(Kind.DECIMAL, requireNonNull(v));
  }

  public static Cell ofDate(LocalDate v) {
    return new Cell(Kind.DATE, requireNonNull(v));
  }

  /** Creates a time cell; the value is a {@link LocalTime} or an
   * {@link OffsetTime}. */
  public static Cell ofTime(TemporalAccessor v) {
    return new Cell(Kind.TIME, requireNonNull(v));
  }

  /** Creates a timestamp cell; the value is a {@link LocalDateTime},
   * {@link OffsetDateTime} or {@link ZonedDateTime}. */
  public static Cell ofTimestamp(TemporalAccessor v) {
    return new Cell(Kind.TIMESTAMP, requireNonNull(v));
  }

  public static Cell ofText(String v) {
    return new Cell(Kind.TEXT, requireNonNull(v));
  }

  public static Cell ofBinary(byte[] v) {
    return new Cell(Kind.BINARY, requireNonNull(v));
  }

  /** Classifies a value returned by a JDBC driver.
   *
   * <p>Order matters. {@link Timestamp}, {@link Time} and
   * {@link java.sql.Date} all extend {@link Date}, and must be recognized
   * before the generic rule for {@code Date}. */
  public static Cell of(@Nullable Object o) {
    if (o == null) {
      return NULL;
    }
    if (o instanceof Boolean) {
      return ofBoolean((Boolean) o);
    }
    if (o instanceof Long
        || o instanceof Integer
        || o instanceof Short
        || o instanceof Byte) {
      return ofInteger(((Number) o).longValue());
    }
    if (o instanceof BigDecimal) {
      return ofDecimal((BigDecimal) o);
    }
    if (o instanceof BigInteger) {
      return ofDecimal(new BigDecimal((BigInteger) o));
    }
    if (o instanceof Double || o instanceof Float) {
      final double d = ((Number) o).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return ofText(o.toString());
      }
      // Float.toString gives the shortest digits that identify the float
      return ofDecimal(new BigDecimal(o.toString()));
    }
    if (o instanceof Timestamp) {
      return ofTimestamp(((Timestamp) o).toLocalDateTime());
    }
    if (o instanceof Time) {
      return ofTime(((Time) o).toLocalTime());
    }
    if (o instanceof java.sql.Date) {
      return ofDate(((java.sql.Date) o).toLocalDate());
    }
    if (o instanceof Date) {
      return ofTimestamp(
          LocalDateTime.ofInstant(((Date) o).toInstant(),
              ZoneId.systemDefault()));
    }
    if (o instanceof LocalDateTime
        || o instanceof OffsetDateTime
        || o instanceof ZonedDateTime) {
      return ofTimestamp((TemporalAccessor) o);
    }
    if (o instanceof LocalDate) {
      return ofDate((LocalDate) o);
    }
    if (o instanceof LocalTime || o instanceof OffsetTime) {
      return ofTime((TemporalAccessor) o);
    }
    if (o instanceof CharSequence || o instanceof Character) {
      return ofText(o.toString());
    }
    if (o instanceof byte[]) {
      return ofBinary((byte[]) o);
    }
    return new Cell(Kind.UNKNOWN, o);
  }

  /** Kind of value held by a cell. */
  public enum Kind {
    NULL,
    BOOLEAN,
    INTEGER,
    DECIMAL,
    DATE,
    TIME,
    TIMESTAMP,
    TEXT,
    BINARY,
    UNKNOWN
  }
}

// End Cell.java
