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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/** Settings of an interactive session.
 *
 * <p>There is one instance per session. The session loop owns it and every
 * component holds a reference to the same instance, so a change made by a
 * built-in command is seen immediately everywhere. Components must read a
 * field again after prompting the user, because a nested command may have
 * changed it.
 */
public class SessionConfig {
  /** Default value of {@link #getRowsToPrint()}. */
  public static final int DEFAULT_ROWS_TO_PRINT = 100;

  /** Default value of {@link #getColumnDisplayWidth()}. */
  public static final int DEFAULT_COLUMN_DISPLAY_WIDTH = 100;

  /** Default value of {@link #getNullDisplayString()}. */
  public static final String DEFAULT_NULL_DISPLAY_STRING = "[NULL]";

  /** Default value of {@link #getNewlineReplacement()}; the two characters
   * backslash and 'n'. */
  public static final String DEFAULT_NEWLINE_REPLACEMENT = "\\n";

  /** Default value of {@link #getTabReplacement()}; the two characters
   * backslash and 't'. */
  public static final String DEFAULT_TAB_REPLACEMENT = "\\t";

  /** Default value of {@link #getCommandTimeoutSeconds()}. */
  public static final int DEFAULT_COMMAND_TIMEOUT_SECONDS = 30;

  /** Token that switches off a replacement or the null string. */
  public static final String OFF = "OFF";

  private int rowsToPrint = DEFAULT_ROWS_TO_PRINT;
  private int columnDisplayWidth = DEFAULT_COLUMN_DISPLAY_WIDTH;
  private String nullDisplayString = DEFAULT_NULL_DISPLAY_STRING;
  private String newlineReplacement = DEFAULT_NEWLINE_REPLACEMENT;
  private String tabReplacement = DEFAULT_TAB_REPLACEMENT;
  private int commandTimeoutSeconds = DEFAULT_COMMAND_TIMEOUT_SECONDS;
  private @Nullable Path csvExportPath;
  /** Named commands, in the order they were declared. */
  private final Map<String, String> namedCommands = new LinkedHashMap<>();

  /** Returns the maximum number of rows printed for each result set;
   * 0 means all rows. */
  public int getRowsToPrint() {
    return rowsToPrint;
  }

  public SessionConfig setRowsToPrint(int rowsToPrint) {
    Preconditions.checkArgument(rowsToPrint >= 0,
        "rows to print must not be negative: %s", rowsToPrint);
    this.rowsToPrint = rowsToPrint;
    return this;
  }

  /** Returns the maximum number of characters shown in a column;
   * 0 means no limit. */
  public int getColumnDisplayWidth() {
    return columnDisplayWidth;
  }

  public SessionConfig setColumnDisplayWidth(int columnDisplayWidth) {
    Preconditions.checkArgument(columnDisplayWidth >= 0,
        "column display width must not be negative: %s", columnDisplayWidth);
    this.columnDisplayWidth = columnDisplayWidth;
    return this;
  }

  public String getNullDisplayString() {
    return nullDisplayString;
  }

  public SessionConfig setNullDisplayString(String nullDisplayString) {
    this.nullDisplayString = requireNonNull(nullDisplayString);
    return this;
  }

  /** Returns the string that replaces each newline character in a text
   * value. If it is a newline, newlines are printed as they are. */
  public String getNewlineReplacement() {
    return newlineReplacement;
  }

  public SessionConfig setNewlineReplacement(String newlineReplacement) {
    this.newlineReplacement = requireNonNull(newlineReplacement);
    return this;
  }

  /** Returns the string that replaces each tab character in a text value.
   * If it is a tab, tabs are printed as they are. */
  public String getTabReplacement() {
    return tabReplacement;
  }

  public SessionConfig setTabReplacement(String tabReplacement) {
    this.tabReplacement = requireNonNull(tabReplacement);
    return this;
  }

  public int getCommandTimeoutSeconds() {
    return commandTimeoutSeconds;
  }

  public SessionConfig setCommandTimeoutSeconds(int commandTimeoutSeconds) {
    Preconditions.checkArgument(commandTimeoutSeconds >= 0,
        "command timeout must not be negative: %s", commandTimeoutSeconds);
    this.commandTimeoutSeconds = commandTimeoutSeconds;
    return this;
  }

  /** Returns the file that the next query exports to, or null if results
   * are printed on the terminal. */
  public @Nullable Path getCsvExportPath() {
    return csvExportPath;
  }

  public SessionConfig setCsvExportPath(@Nullable Path csvExportPath) {
    this.csvExportPath = csvExportPath;
    return this;
  }

  /** Returns the CSV export path and clears it, so that only one query
   * is exported. */
  public @Nullable Path takeCsvExportPath() {
    final Path path = csvExportPath;
    csvExportPath = null;
    return path;
  }

  /** Returns the named commands, a mutable map from command name (without
   * the colon) to template text, in declaration order. */
  public Map<String, String> namedCommands() {
    return namedCommands;
  }

  public SessionConfig addNamedCommand(String name, String template) {
    namedCommands.put(requireNonNull(name), requireNonNull(template));
    return this;
  }
}

// End SessionConfig.java
