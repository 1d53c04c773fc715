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

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/** What became of one result set: the lines printed for it, and how many
 * rows it had.
 *
 * <p>A result set that was exported to CSV has a {@link #csvPath}; its
 * {@link #lines} are empty because progress was printed while
 * writing. */
public class RenderedResultSet {
  /** Value of {@link #totalRowCount} if the total is not known. */
  public static final int UNKNOWN = -1;

  public final ImmutableList<String> lines;
  /** Number of rows printed or written. */
  public final int rowCount;
  /** Number of rows in the result set, or {@link #UNKNOWN}. */
  public final int totalRowCount;
  public final @Nullable Path csvPath;

  private RenderedResultSet(List<String> lines, int rowCount,
      int totalRowCount, @Nullable Path csvPath) {
    this.lines = ImmutableList.copyOf(lines);
    this.rowCount = rowCount;
    this.totalRowCount = totalRowCount;
    this.csvPath = csvPath;
  }

  /** Creates a rendering of a result set that had no rows. Nothing is
   * printed. */
  static RenderedResultSet empty() {
    return new RenderedResultSet(ImmutableList.of(), 0, 0, null);
  }

  static RenderedResultSet grid(List<String> lines, int rowCount,
      int totalRowCount) {
    return new RenderedResultSet(lines, rowCount, totalRowCount, null);
  }

  static RenderedResultSet csv(Path path, int rowCount) {
    return new RenderedResultSet(ImmutableList.of(), rowCount, rowCount, path);
  }

  /** Returns the total row count as it appears in the footer. */
  public String totalRowCountString() {
    return totalRowCountString(totalRowCount);
  }

  static String totalRowCountString(int totalRowCount) {
    return totalRowCount == UNKNOWN ? "(unknown)"
        : Integer.toString(totalRowCount);
  }

  /** Prints the lines. */
  public void print(PrintWriter writer) {
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }
}

// End RenderedResultSet.java
