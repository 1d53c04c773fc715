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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static java.util.Objects.requireNonNull;

/** Outcome of moving a statement to its next result.
 *
 * <p>A statement that has executed produces a sequence of results, each
 * either a result set or an update count. The sequence ends when there is
 * no result set and the update count is -1. */
public final class Step {
  public static final Step NO_MORE_RESULTS =
      new Step(Kind.NO_MORE_RESULTS, null, -1);

  public final Kind kind;
  public final @Nullable ResultSet resultSet;
  /** Update count; -1 unless {@link #kind} is
   * {@link Kind#NO_RESULT_SET}. */
  public final int updateCount;

  private Step(Kind kind, @Nullable ResultSet resultSet, int updateCount) {
    this.kind = requireNonNull(kind);
    this.resultSet = resultSet;
    this.updateCount = updateCount;
  }

  static Step produced(ResultSet resultSet) {
    return new Step(Kind.PRODUCED, requireNonNull(resultSet), -1);
  }

  static Step noResultSet(int updateCount) {
    return new Step(Kind.NO_RESULT_SET, null, updateCount);
  }

  /** Returns the statement's current result.
   *
   * @param statement Statement
   * @param isResultSet Value returned by {@link Statement#execute} or
   *   {@link Statement#getMoreResults()}
   */
  static Step current(Statement statement, boolean isResultSet)
      throws SQLException {
    if (isResultSet) {
      final ResultSet resultSet = statement.getResultSet();
      if (resultSet != null) {
        return produced(resultSet);
      }
    }
    final int updateCount = statement.getUpdateCount();
    return updateCount == -1 ? NO_MORE_RESULTS : noResultSet(updateCount);
  }

  /** Advances a statement to its next result. Closes the current result
   * set, if any. */
  static Step next(Statement statement) throws SQLException {
    return current(statement, statement.getMoreResults());
  }

  /** Kind of step. */
  public enum Kind {
    /** The statement produced a result set. */
    PRODUCED,
    /** The statement produced an update count. */
    NO_RESULT_SET,
    /** There are no more results. */
    NO_MORE_RESULTS
  }
}

// End Step.java
