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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Prints a window of a result set as a grid.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * ID|NAME
 * --|-----
 * 1 |Alice
 * 2 |Bob
 *
 * Rows printed: 2/2
 * </pre></blockquote>
 *
 * <p>At most {@link SessionConfig#getRowsToPrint()} rows are fetched. A
 * result set with no rows prints nothing at all.
 */
public class ResultFormatter {
  private static final Joiner PIPE = Joiner.on('|');

  private final SessionConfig config;

  public ResultFormatter(SessionConfig config) {
    this.config = requireNonNull(config);
  }

  /** Fetches rows from a result set and lays them out. Does not close the
   * result set. */
  public RenderedResultSet render(ResultSet resultSet) throws SQLException {
    final TypeFormatter formatter = new TypeFormatter(config);
    final int rowsToPrint = config.getRowsToPrint();
    final ResultSetMetaData metaData = resultSet.getMetaData();
    final int columnCount = metaData.getColumnCount();

    final List<FormattedCell[]> rows = new ArrayList<>();
    while ((rowsToPrint == 0 || rows.size() < rowsToPrint)
        && resultSet.next()) {
      final FormattedCell[] row = new FormattedCell[columnCount];
      for (int i = 0; i < columnCount; i++) {
        row[i] = formatter.format(Cell.of(JdbcUtils.getValue(resultSet, i + 1)));
      }
      rows.add(row);
    }
    final int printed = rows.size();
    if (printed == 0) {
      return RenderedResultSet.empty();
    }
    final int total;
    if (rowsToPrint == 0 || printed < rowsToPrint) {
      total = printed;
    } else {
      total = JdbcUtils.rowCountHint(resultSet);
    }

    final List<FormattedCell> header = new ArrayList<>();
    for (String label : JdbcUtils.columnLabels(metaData)) {
      header.add(formatter.text(label));
    }
    final List<String> lines = new ArrayList<>();
    lines.add("");
    lines.addAll(grid(header, rows));
    lines.add("");
    lines.add("Rows printed: " + printed + "/"
        + RenderedResultSet.totalRowCountString(total));
    return RenderedResultSet.grid(lines, printed, total);
  }

  /** Lays out a header, a separator and rows. Each column is as wide as its
   * widest cell, header included; cells are left-aligned. */
  static ImmutableList<String> grid(List<FormattedCell> header,
      List<FormattedCell[]> rows) {
    final int[] widths = new int[header.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = Math.max(header.get(i).width, header.get(i).text.length());
    }
    for (FormattedCell[] row : rows) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i],
            Math.max(row[i].width, row[i].text.length()));
      }
    }

    final ImmutableList.Builder<String> lines = ImmutableList.builder();
    final List<String> strings = new ArrayList<>();
    for (int i = 0; i < widths.length; i++) {
      strings.add(Strings.padEnd(header.get(i).text, widths[i], ' '));
    }
    lines.add(PIPE.join(strings));
    strings.clear();
    for (int width : widths) {
      strings.add(Strings.repeat("-", width));
    }
    lines.add(PIPE.join(strings));
    for (FormattedCell[] row : rows) {
      strings.clear();
      for (int i = 0; i < widths.length; i++) {
        strings.add(Strings.padEnd(row[i].text, widths[i], ' '));
      }
      lines.add(PIPE.join(strings));
    }
    return lines.build();
  }
}

// End ResultFormatter.java
