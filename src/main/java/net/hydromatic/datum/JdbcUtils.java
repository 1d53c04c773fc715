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
import com.google.common.io.BaseEncoding;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;

/** Utilities for JDBC. */
abstract class JdbcUtils {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcUtils.class);

  private JdbcUtils() {
  }

  /** Returns the labels of the columns of a result set. */
  static ImmutableList<String> columnLabels(ResultSetMetaData metaData)
      throws SQLException {
    final ImmutableList.Builder<String> labels = ImmutableList.builder();
    for (int i = 0; i < metaData.getColumnCount(); i++) {
      labels.add(metaData.getColumnLabel(i + 1));
    }
    return labels.build();
  }

  /** Returns the value of a column in the current row, reading large
   * objects into memory. */
  static @Nullable Object getValue(ResultSet resultSet, int column)
      throws SQLException {
    final Object o = resultSet.getObject(column);
    if (o instanceof Clob) {
      final Clob clob = (Clob) o;
      return clob.getSubString(1, (int) Math.min(clob.length(), Integer.MAX_VALUE));
    }
    if (o instanceof Blob) {
      final Blob blob = (Blob) o;
      return blob.getBytes(1, (int) Math.min(blob.length(), Integer.MAX_VALUE));
    }
    if (o instanceof SQLXML) {
      return ((SQLXML) o).getString();
    }
    return o;
  }

  /** Returns the number of rows in a result set, or -1 if it cannot be
   * found cheaply.
   *
   * <p>Only a scrollable result set can answer; this method moves its cursor
   * to the last row. */
  static int rowCountHint(ResultSet resultSet) {
    try {
      if (resultSet.getType() == ResultSet.TYPE_FORWARD_ONLY) {
        return RenderedResultSet.UNKNOWN;
      }
      if (!resultSet.last()) {
        return 0;
      }
      return resultSet.getRow();
    } catch (SQLException e) {
      LOGGER.debug("Could not count rows", e);
      return RenderedResultSet.UNKNOWN;
    }
  }

  /** Converts bytes to upper-case hexadecimal with a "0x" prefix. */
  static String hex(byte[] bytes) {
    return "0x" + BaseEncoding.base16().encode(bytes);
  }
}

// End JdbcUtils.java
