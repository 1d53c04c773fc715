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

import com.google.common.base.Preconditions;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Writes every row of a result set to a CSV file.
 *
 * <p>The file is opened for append, so several result sets can be collected
 * in one file; each starts with a header record of column labels. Rows are
 * fetched in batches, and one "!" is printed after each batch. */
public class CsvSink {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvSink.class);

  /** Default number of rows per batch. */
  public static final int DEFAULT_BATCH_SIZE = 10_000;

  private static final CSVFormat FORMAT =
      CSVFormat.DEFAULT.builder().setRecordSeparator('\n').build();

  private final PrintWriter writer;
  private final int batchSize;

  public CsvSink(PrintWriter writer) {
    this(writer, DEFAULT_BATCH_SIZE);
  }

  public CsvSink(PrintWriter writer, int batchSize) {
    Preconditions.checkArgument(batchSize > 0,
        "batch size must be positive: %s", batchSize);
    this.writer = requireNonNull(writer);
    this.batchSize = batchSize;
  }

  /** Writes the remaining rows of a result set to a file, and returns the
   * number of rows written. Does not close the result set. */
  public int export(ResultSet resultSet, Path path)
      throws SQLException, IOException {
    final ResultSetMetaData metaData = resultSet.getMetaData();
    final int columnCount = metaData.getColumnCount();
    writer.println("Writing to file, one ! per " + batchSize + " rows:");
    writer.flush();

    int count = 0;
    try (Writer w =
             Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                 StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                 StandardOpenOption.APPEND);
         CSVPrinter printer = new CSVPrinter(w, FORMAT)) {
      printer.printRecord(JdbcUtils.columnLabels(metaData));
      final List<List<@Nullable Object>> batch = new ArrayList<>();
      for (;;) {
        batch.clear();
        while (batch.size() < batchSize && resultSet.next()) {
          final List<@Nullable Object> record = new ArrayList<>(columnCount);
          for (int i = 0; i < columnCount; i++) {
            record.add(csvValue(JdbcUtils.getValue(resultSet, i + 1)));
          }
          batch.add(record);
        }
        if (batch.isEmpty()) {
          break;
        }
        printer.printRecords(batch);
        count += batch.size();
        writer.print('!');
        writer.flush();
        if (batch.size() < batchSize) {
          break;
        }
      }
    }
    writer.println();
    writer.println("Rows written: " + count);
    writer.flush();
    LOGGER.debug("Wrote {} rows to {}", count, path);
    return count;
  }

  /** Converts a value to what the CSV printer writes. Null becomes an empty
   * field; binary becomes hexadecimal. */
  private static @Nullable Object csvValue(@Nullable Object o) {
    if (o instanceof byte[]) {
      return JdbcUtils.hex((byte[]) o);
    }
    return o;
  }
}

// End CsvSink.java
