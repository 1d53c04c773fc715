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
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/** Interactive session against a JDBC data source.
 *
 * <p>Reads queries and commands, runs them, and prints the results, until
 * the user types ":exit" or ":quit" or input ends. An error in one query or
 * command is printed, and the session continues.
 */
public class Datum {
  private static final Logger LOGGER = LoggerFactory.getLogger(Datum.class);

  /** Commands that end the session. */
  static final List<String> EXIT_COMMANDS = ImmutableList.of(":exit", ":quit");

  /** Line that precedes and follows the message of an error. */
  static final String ERROR_MARKER = "---ERROR---";

  private static final String[] BANNER_LINES = {
      "Special commands are prefixed with \":\". For example, use \":exit\" or",
      "\":quit\" to finish your session. Use \":help\" to list available "
          + "commands.",
      "Everything else is sent to the database when you type \"GO\" on a new",
      "line or \";;\" at the end of a query.",
  };

  /** Connection factory that fails; the default if none is configured. */
  public static final ConnectionFactory EMPTY_CONNECTION_FACTORY = () -> {
    throw new SQLException("No connection factory");
  };

  /** Prompter that is always at end of input. */
  public static final Prompter EMPTY_PROMPTER = prompt -> null;

  private final PrintWriter writer;
  private final SessionConfig sessionConfig;
  private final ConnectionManager connections;
  private final InputAssembler input;
  private final CommandDispatcher dispatcher;
  private final QueryExecutor executor;

  /** Creates a session. */
  public Datum(Config config) {
    final Writer rawWriter = config.writer();
    if (rawWriter instanceof PrintWriter) {
      this.writer = (PrintWriter) rawWriter;
    } else {
      this.writer = new PrintWriter(rawWriter);
    }
    this.sessionConfig = config.sessionConfig();
    this.connections =
        new ConnectionManager(config.connectionFactory(), sessionConfig);
    this.input = new InputAssembler(config.prompter());
    this.dispatcher = new CommandDispatcher(sessionConfig, connections,
        config.prompter(), writer);
    this.executor = new QueryExecutor(sessionConfig, connections,
        config.prompter(), writer);
  }

  /** Creates a {@link ConfigBuilder} with the default settings. */
  public static ConfigBuilder configBuilder() {
    return new ConfigBuilder(EMPTY_PROMPTER, new StringWriter(),
        EMPTY_CONNECTION_FACTORY, new SessionConfig());
  }

  /** Entry point from the command line.
   *
   * <p>Reads from the terminal with line editing; see
   * {@link Launcher} for the arguments. */
  public static void main(String[] args) throws IOException {
    final int code;
    try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
      final DefaultParser parser = new DefaultParser();
      parser.setEscapeChars(null);
      parser.setQuoteChars(new char[0]);
      final LineReader lineReader = LineReaderBuilder.builder()
          .terminal(terminal)
          .appName("datum")
          .parser(parser)
          .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
          .build();
      final PrintWriter out = terminal.writer();
      final PrintWriter err = new PrintWriter(System.err);
      code = Launcher.main2(out, err, Arrays.asList(args),
          Prompters.of(lineReader), System::getenv);
    }
    System.exit(code);
  }

  /** Runs the session until the user exits or input ends.
   *
   * <p>Opens the connection first; if that fails, throws. Closes the
   * connection on exit. */
  public void execute() throws Exception {
    try {
      final String header = connections.describe();
      writer.println("Connected to " + header);
      writer.println();
      for (String line : BANNER_LINES) {
        writer.println(line);
      }
      writer.println(header);
      writer.flush();
      loop(header);
    } finally {
      writer.flush();
      connections.close();
    }
  }

  private void loop(String header) {
    for (;;) {
      final String prompt =
          sessionConfig.getCsvExportPath() != null ? "csv>" : ">";
      final String unit;
      try {
        unit = input.next(prompt);
      } catch (IOException e) {
        printError(e);
        continue;
      }
      if (unit == null || EXIT_COMMANDS.contains(unit.trim())) {
        LOGGER.debug("Session ended");
        return;
      }
      try {
        final String query =
            unit.startsWith(":") ? dispatcher.dispatch(unit) : unit;
        if (query != null && !query.trim().isEmpty()) {
          executor.execute(query);
        }
      } catch (Exception e) {
        printError(e);
      }
      writer.println();
      writer.println(header);
      writer.flush();
    }
  }

  private void printError(Exception e) {
    LOGGER.debug("Error in session", e);
    writer.println(ERROR_MARKER);
    writer.println(message(e));
    for (Throwable t = nextException(e); t != null; t = nextException(t)) {
      writer.println(message(t));
    }
    writer.println(ERROR_MARKER);
    writer.flush();
  }

  private static String message(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.toString();
  }

  private static @Nullable Throwable nextException(Throwable e) {
    return e instanceof SQLException ? ((SQLException) e).getNextException()
        : null;
  }

  /** Creates connections to the data source.
   *
   * <p>Caller must close the connection. */
  public interface ConnectionFactory {
    /** Creates a connection. */
    Connection connect() throws Exception;
  }

  /** The information needed to start a session. */
  public interface Config {
    Prompter prompter();
    Writer writer();
    ConnectionFactory connectionFactory();

    /** Returns the settings that the session starts with; the session
     * modifies this object as commands are run. */
    SessionConfig sessionConfig();
  }

  /** Builds a {@link Config}. */
  public static class ConfigBuilder {
    private final Prompter prompter;
    private final Writer writer;
    private final ConnectionFactory connectionFactory;
    private final SessionConfig sessionConfig;

    private ConfigBuilder(Prompter prompter, Writer writer,
        ConnectionFactory connectionFactory, SessionConfig sessionConfig) {
      this.prompter = Objects.requireNonNull(prompter);
      this.writer = Objects.requireNonNull(writer);
      this.connectionFactory = Objects.requireNonNull(connectionFactory);
      this.sessionConfig = Objects.requireNonNull(sessionConfig);
    }

    /** Returns a {@link Config}. */
    public Config build() {
      return new Config() {
        public Prompter prompter() {
          return prompter;
        }

        public Writer writer() {
          return writer;
        }

        public ConnectionFactory connectionFactory() {
          return connectionFactory;
        }

        public SessionConfig sessionConfig() {
          return sessionConfig;
        }
      };
    }

    /** Sets {@link Config#prompter}. */
    public ConfigBuilder withPrompter(Prompter prompter) {
      return new ConfigBuilder(prompter, writer, connectionFactory,
          sessionConfig);
    }

    /** Sets {@link Config#writer}. */
    public ConfigBuilder withWriter(Writer writer) {
      return new ConfigBuilder(prompter, writer, connectionFactory,
          sessionConfig);
    }

    /** Sets {@link Config#connectionFactory}. */
    public ConfigBuilder withConnectionFactory(
        ConnectionFactory connectionFactory) {
      return new ConfigBuilder(prompter, writer, connectionFactory,
          sessionConfig);
    }

    /** Sets {@link Config#sessionConfig}. */
    public ConfigBuilder withSessionConfig(SessionConfig sessionConfig) {
      return new ConfigBuilder(prompter, writer, connectionFactory,
          sessionConfig);
    }
  }
}

// End Datum.java
