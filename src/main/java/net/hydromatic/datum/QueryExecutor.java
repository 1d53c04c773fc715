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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Runs a query, asks for the values of its parameters, and prints or
 * exports each result set it produces. */
public class QueryExecutor {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(QueryExecutor.class);

  /** Character sequences counted as parameter markers. This is a
   * heuristic, not a parser; a '?' inside a string literal that follows a
   * space is counted too. */
  private static final List<String> PARAMETER_MARKERS =
      ImmutableList.of(" ?", ",?", "=?");

  private final SessionConfig config;
  private final ConnectionManager connections;
  private final Prompter prompter;
  private final PrintWriter writer;
  private final ResultFormatter resultFormatter;
  private final CsvSink csvSink;

  public QueryExecutor(SessionConfig config, ConnectionManager connections,
      Prompter prompter, PrintWriter writer) {
    this(config, connections, prompter, writer, new CsvSink(writer));
  }

  public QueryExecutor(SessionConfig config, ConnectionManager connections,
      Prompter prompter, PrintWriter writer, CsvSink csvSink) {
    this.config = requireNonNull(config);
    this.connections = requireNonNull(connections);
    this.prompter = requireNonNull(prompter);
    this.writer = requireNonNull(writer);
    this.resultFormatter = new ResultFormatter(config);
    this.csvSink = requireNonNull(csvSink);
  }

  /** Returns the number of parameters in a query. */
  public static int countParameters(String sql) {
    int count = 0;
    for (String marker : PARAMETER_MARKERS) {
      for (int i = sql.indexOf(marker); i >= 0;
           i = sql.indexOf(marker, i + marker.length())) {
        ++count;
      }
    }
    return count;
  }

  /** Executes a query.
   *
   * <p>If a CSV export path is set, it is cleared once the statement has
   * executed, and every result set of this query is appended to that file; otherwise each result set is
   * printed as a grid. Prints the number of rows affected. */
  public List<RenderedResultSet> execute(String sql) throws Exception {
    final int parameterCount = countParameters(sql);
    final List<String> parameters = readParameters(parameterCount);

    final List<RenderedResultSet> results = new ArrayList<>();
    final int rowsAffected;
    try (Statement statement = createStatement(sql, parameterCount > 0)) {
      applyTimeout(statement);
      final boolean isResultSet;
      if (statement instanceof PreparedStatement) {
        final PreparedStatement preparedStatement =
            (PreparedStatement) statement;
        for (int i = 0; i < parameters.size(); i++) {
          preparedStatement.setString(i + 1, parameters.get(i));
        }
        isResultSet = preparedStatement.execute();
      } else {
        isResultSet = statement.execute(sql);
      }
      LOGGER.debug("Executed query: {}", sql);

      // Cleared only once the statement has run, so a failed query keeps it
      final @Nullable Path csvPath = config.takeCsvExportPath();

      Step step = Step.current(statement, isResultSet);
      rowsAffected = step.updateCount;
      while (step.kind != Step.Kind.NO_MORE_RESULTS) {
        if (step.kind == Step.Kind.PRODUCED) {
          try (ResultSet resultSet = requireNonNull(step.resultSet)) {
            final RenderedResultSet result;
            if (csvPath != null) {
              final int count = csvSink.export(resultSet, csvPath);
              result = RenderedResultSet.csv(csvPath, count);
            } else {
              result = resultFormatter.render(resultSet);
            }
            result.print(writer);
            results.add(result);
          }
        }
        step = Step.next(statement);
      }
    }
    writer.println();
    writer.println("Rows affected: " + rowsAffected);
    writer.flush();
    return results;
  }

  private List<String> readParameters(int parameterCount)
      throws IOException {
    if (parameterCount == 0) {
      return ImmutableList.of();
    }
    writer.println();
    writer.flush();
    final List<String> parameters = new ArrayList<>();
    for (int i = 0; i < parameterCount; i++) {
      final String value = prompter.readLine((i + 1) + "> ");
      if (value == null) {
        throw new EOFException("End of input while reading parameter "
            + (i + 1));
      }
      parameters.add(value);
    }
    return parameters;
  }

  /** Creates a scrollable statement, so that the formatter can find how
   * many rows a result set has, or a default statement if the driver cannot
   * scroll. */
  private Statement createStatement(String sql, boolean prepared)
      throws Exception {
    final Connection connection = connections.connection();
    try {
      return prepared
          ? connection.prepareStatement(sql, ResultSet.TYPE_SCROLL_INSENSITIVE,
              ResultSet.CONCUR_READ_ONLY)
          : connection.createStatement(ResultSet.TYPE_SCROLL_INSENSITIVE,
              ResultSet.CONCUR_READ_ONLY);
    } catch (SQLFeatureNotSupportedException e) {
      LOGGER.debug("Driver does not support scrollable result sets", e);
      return prepared
          ? connection.prepareStatement(sql)
          : connection.createStatement();
    }
  }

  private void applyTimeout(Statement statement) {
    final int timeout = config.getCommandTimeoutSeconds();
    try {
      statement.setQueryTimeout(timeout);
    } catch (SQLException e) {
      LOGGER.warn("Driver refused command timeout of {} seconds: {}",
          timeout, e.getMessage());
    }
  }
}

// End QueryExecutor.java
