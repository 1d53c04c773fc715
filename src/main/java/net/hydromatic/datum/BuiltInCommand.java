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

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Commands that are always available. */
enum BuiltInCommand implements Command {
  HELP(":help") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final PrintWriter w = x.writer();
      for (String line : HELP_LINES) {
        w.println(line);
      }
      if (!x.config().namedCommands().isEmpty()) {
        w.println();
        w.println("Commands declared in the configuration file:");
        for (String line : wrap(x.config().namedCommands().keySet(), 79)) {
          w.println(line);
        }
      }
      return null;
    }
  },

  ROWS(":rows") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final SessionConfig config = x.config();
      final Integer n = nonNegative(x, invocation);
      if (n != null) {
        config.setRowsToPrint(n);
      }
      final int rows = config.getRowsToPrint();
      if (rows == 0) {
        x.writer().println("Printing ALL rows of each resultset.");
      } else {
        x.writer().println("Printing " + rows + " rows of each resultset.");
      }
      return null;
    }
  },

  CHARS(":chars") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final SessionConfig config = x.config();
      final Integer n = nonNegative(x, invocation);
      if (n != null) {
        config.setColumnDisplayWidth(n);
      }
      final int chars = config.getColumnDisplayWidth();
      if (chars == 0) {
        x.writer().println("Printing ALL characters of each column.");
      } else {
        x.writer().println("Printing a maximum of " + chars
            + " characters of each column.");
      }
      return null;
    }
  },

  NULL(":null") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final SessionConfig config = x.config();
      if (!invocation.args.isEmpty()) {
        final String arg = invocation.args.get(0);
        config.setNullDisplayString(
            arg.equals(SessionConfig.OFF) ? "" : arg);
      }
      x.writer().println("Using the string \"" + config.getNullDisplayString()
          + "\" to print NULL values.");
      return null;
    }
  },

  NEWLINE(":newline") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final SessionConfig config = x.config();
      if (!invocation.args.isEmpty()) {
        final String arg = invocation.args.get(0);
        config.setNewlineReplacement(
            arg.equals(SessionConfig.OFF) ? "\n" : arg);
      }
      final String replacement = config.getNewlineReplacement();
      if (replacement.equals("\n")) {
        x.writer().println("Printing newlines with no conversion "
            + "(might break the display of query output).");
      } else {
        x.writer().println("Using the string \"" + replacement
            + "\" to print literal new lines in values.");
      }
      return null;
    }
  },

  TAB(":tab") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final SessionConfig config = x.config();
      if (!invocation.args.isEmpty()) {
        final String arg = invocation.args.get(0);
        config.setTabReplacement(arg.equals(SessionConfig.OFF) ? "\t" : arg);
      }
      final String replacement = config.getTabReplacement();
      if (replacement.equals("\t")) {
        x.writer().println("Printing tabs with no conversion "
            + "(might break the display of query output).");
      } else {
        x.writer().println("Using the string \"" + replacement
            + "\" to print literal tabs in values.");
      }
      return null;
    }
  },

  TIMEOUT(":timeout") {
    @Override public @Nullable String execute(Context x, Invocation invocation)
        throws Exception {
      final Integer n = nonNegative(x, invocation);
      if (n != null && !x.connections().setCommandTimeout(n)) {
        x.writer().println("The driver does not support command timeouts.");
      }
      x.writer().println("Command timeout set to "
          + x.config().getCommandTimeoutSeconds() + " seconds.");
      return null;
    }
  },

  CSV(":csv") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      final SessionConfig config = x.config();
      if (invocation.args.isEmpty()) {
        config.setCsvExportPath(null);
        x.writer().println("Disabled CSV writing");
        return null;
      }
      final String name = unquote(invocation.argString());
      final Path path;
      try {
        path = Paths.get(name).toAbsolutePath();
        // Fail now, rather than after the query has run
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE,
            StandardOpenOption.APPEND)) {
          w.flush();
        }
      } catch (IOException | InvalidPathException e) {
        x.writer().println("ERROR opening file \"" + name
            + "\". Invalid path?");
        return null;
      }
      config.setCsvExportPath(path);
      x.writer().println("CSV target \"" + path + "\"");
      return null;
    }
  },

  SCRIPT(":script") {
    @Override public @Nullable String execute(Context x, Invocation invocation)
        throws IOException {
      if (invocation.args.isEmpty()) {
        x.writer().println("No input path provided");
        return null;
      }
      final String name = unquote(invocation.argString());
      final Path path;
      try {
        path = Paths.get(name).toAbsolutePath();
      } catch (InvalidPathException e) {
        x.writer().println("File \"" + name + "\" does not exist");
        return null;
      }
      if (!Files.isRegularFile(path)) {
        x.writer().println("File \"" + path + "\" does not exist");
        return null;
      }
      final String text;
      try {
        text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8)
            .trim();
      } catch (IOException e) {
        x.writer().println("ERROR reading file \"" + path + "\"");
        return null;
      }
      x.writer().println("Loaded script file \"" + path + "\"");
      return x.expand(text);
    }
  },

  RECONNECT(":reconnect") {
    @Override public @Nullable String execute(Context x, Invocation invocation)
        throws Exception {
      x.connections().reconnect();
      x.writer().println("Opened new connection.");
      return null;
    }
  },

  TABLES(":tables") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      if (invocation.args.size() > 1) {
        return invalidArguments(x);
      }
      String q = "SELECT * FROM INFORMATION_SCHEMA.TABLES";
      if (!invocation.args.isEmpty()) {
        q += " WHERE TABLE_NAME LIKE " + contains(invocation.args.get(0));
      }
      x.echo(q);
      return q;
    }
  },

  COLS(":cols", "-eq", "-full") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      if (invocation.args.size() != 1) {
        return invalidArguments(x);
      }
      final String cols = invocation.has("-full") ? "*"
          : "TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, COLUMN_NAME, DATA_TYPE";
      final String table = invocation.args.get(0);
      final String q = "SELECT " + cols + " FROM INFORMATION_SCHEMA.COLUMNS"
          + " WHERE TABLE_NAME "
          + (invocation.has("-eq") ? "= " + literal(table)
              : "LIKE " + contains(table));
      x.echo(q);
      return q;
    }
  },

  VIEWS(":views", "-full") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      if (invocation.args.size() > 1) {
        return invalidArguments(x);
      }
      final String cols = invocation.has("-full") ? "*"
          : "TABLE_CATALOG, TABLE_SCHEMA, TABLE_NAME, CHECK_OPTION, "
          + "IS_UPDATABLE";
      String q = "SELECT " + cols + " FROM INFORMATION_SCHEMA.VIEWS";
      if (!invocation.args.isEmpty()) {
        q += " WHERE TABLE_NAME LIKE " + contains(invocation.args.get(0));
      }
      x.echo(q);
      return q;
    }
  },

  PROCS(":procs", "-full") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      return routines(x, invocation, "PROCEDURE");
    }
  },

  FUNCS(":funcs", "-full") {
    @Override public @Nullable String execute(Context x, Invocation invocation) {
      return routines(x, invocation, "FUNCTION");
    }
  };

  private static final String[] HELP_LINES = {
      "--Available commands--",
      ":help             Prints the command list.",
      "",
      ":exit, :quit      Ends the session.",
      "",
      ":rows [number]    How many rows to print out of the resultset. Call with no",
      "                  number to see the current value. Use 0 for \"all rows\".",
      "",
      ":chars [number]   How many chars per column to print. Call with no number to",
      "                  see the current value. Use 0 to not truncate.",
      "",
      ":null [string]    String to show for NULL values. Call with no args to see",
      "                  the current string. Use \"OFF\" (no quotes) to show",
      "                  nothing (this makes empty string and null look the same).",
      "",
      ":newline [string] String to replace newlines in values. Use \"OFF\" (no quotes)",
      "                  to keep newlines as-is, which will most likely break the",
      "                  display of output. Call with no arg to show the current",
      "                  value.",
      "",
      ":tab [string]     String to replace tabs in values. Use \"OFF\" (no quotes) to",
      "                  keep tab characters. Call with no arguments to show the",
      "                  current value.",
      "",
      ":timeout [number] Seconds to wait for a command to finish running.",
      "",
      ":reconnect        Opens a new connection, discarding the old one.",
      "",
      ":csv [path]       Exports the output of the next query to a CSV file. Call",
      "                  with no arguments to print results again.",
      "",
      ":script [path]    Reads a query from a file. The text is processed as a",
      "                  named command, with {placeholders} and ? parameters.",
      "",
      ":tables [name]    Lists tables whose name contains the given text.",
      "",
      ":cols [-eq] [-full] table",
      "                  Lists columns of tables whose name contains (with -eq,",
      "                  equals) the given text. With -full, shows all details.",
      "",
      ":views [-full] [name]",
      ":procs [-full] [name]",
      ":funcs [-full] [name]",
      "                  Lists views, procedures or functions whose name contains",
      "                  the given text.",
      "",
      "Queries end with \";;\" at the end of a line, or a line starting with",
      "\"GO\".",
  };

  private final String commandName;
  private final ImmutableSet<String> modifiers;

  BuiltInCommand(String commandName, String... modifiers) {
    this.commandName = commandName;
    this.modifiers = ImmutableSet.copyOf(modifiers);
  }

  @Override public String commandName() {
    return commandName;
  }

  @Override public Set<String> modifiers() {
    return modifiers;
  }

  /** Parses the first argument as a non-negative integer. Returns null if
   * there is no argument, or if it is invalid, in which case prints a
   * message. */
  private static @Nullable Integer nonNegative(Context x,
      Invocation invocation) {
    if (invocation.args.isEmpty()) {
      return null;
    }
    final String arg = invocation.args.get(0);
    final Integer n = Ints.tryParse(arg);
    if (n != null && n >= 0) {
      return n;
    }
    x.writer().println("Invalid arguments: expected a non-negative number, "
        + "got \"" + arg + "\"");
    return null;
  }

  private static @Nullable String invalidArguments(Context x) {
    x.writer().println("Invalid arguments");
    return null;
  }

  private static @Nullable String routines(Context x, Invocation invocation,
      String routineType) {
    if (invocation.args.size() > 1) {
      return invalidArguments(x);
    }
    final String cols = invocation.has("-full") ? "*"
        : "ROUTINE_CATALOG, ROUTINE_SCHEMA, ROUTINE_NAME, DATA_TYPE, "
        + "CREATED, LAST_ALTERED";
    String q = "SELECT " + cols + " FROM INFORMATION_SCHEMA.ROUTINES"
        + " WHERE ROUTINE_TYPE = " + literal(routineType);
    if (!invocation.args.isEmpty()) {
      q += " AND ROUTINE_NAME LIKE " + contains(invocation.args.get(0));
    }
    x.echo(q);
    return q;
  }

  /** Converts a string to a SQL character literal. */
  static String literal(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  /** Converts a string to a LIKE pattern that matches values that contain
   * it. */
  static String contains(String s) {
    return literal("%" + s + "%");
  }

  /** Removes one pair of double or single quotes around a path. */
  static String unquote(String s) {
    final String t = s.trim();
    if (t.length() >= 2) {
      final char first = t.charAt(0);
      if ((first == '"' || first == '\'')
          && t.charAt(t.length() - 1) == first) {
        return t.substring(1, t.length() - 1);
      }
    }
    return t;
  }

  /** Joins names with ", ", starting a new line before a line would exceed
   * {@code width} characters. A line that continues ends with a comma. */
  static List<String> wrap(Iterable<String> names, int width) {
    final List<String> lines = new ArrayList<>();
    final StringBuilder line = new StringBuilder();
    for (String name : names) {
      if (line.length() == 0) {
        line.append(name);
      } else if (line.length() + 2 + name.length() >= width) {
        lines.add(line.append(',').toString());
        line.setLength(0);
        line.append(name);
      } else {
        line.append(", ").append(name);
      }
    }
    if (line.length() > 0) {
      lines.add(line.toString());
    }
    return lines;
  }
}

// End BuiltInCommand.java
