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

import ch.qos.logback.classic.Level;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintWriter;
import java.sql.Driver;
import java.sql.DriverManager;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Parses command-line arguments.
 */
class Launcher {
  private static final String[] USAGE_LINES = {
      "Usage: datum --url jdbcUrl [argument...]",
      "",
      "Arguments:",
      "  --help",
      "           Print usage",
      "  --url jdbcUrl",
      "           JDBC URL of the database to connect to",
      "  --user user",
      "           User name",
      "  --password password",
      "           Password",
      "  --config file",
      "           Configuration file (default " + ConfigFile.DEFAULT_NAME + ",",
      "           looked up in $XDG_CONFIG_HOME/datum)",
      "  --debug",
      "           Log debugging information",
      "  --list-drivers",
      "           List the JDBC drivers that are available, and exit",
      "",
      "A value of the form ENV=NAME is replaced by the value of environment",
      "variable NAME.",
  };

  private static final String ENV_PREFIX = "ENV=";

  private final List<String> args;
  private final PrintWriter out;
  private final Prompter prompter;
  private final Function<String, @Nullable String> env;

  Launcher(List<String> args, PrintWriter out, Prompter prompter,
      Function<String, @Nullable String> env) {
    this.args = args;
    this.out = out;
    this.prompter = prompter;
    this.env = env;
  }

  /** Creates a launcher, parses command line arguments, and runs a
   * session.
   *
   * <p>Similar to a {@code main} method, but never calls
   * {@link System#exit(int)}.
   *
   * @param out Writer to which to print output
   * @param err Writer to which to print errors
   * @param args Command-line arguments
   * @param prompter Source of input
   * @param env Environment variables
   *
   * @return Operating system error code (0 = success, 1 = invalid arguments,
   * 2 = other error)
   */
  static int main2(PrintWriter out, PrintWriter err, List<String> args,
      Prompter prompter, Function<String, @Nullable String> env) {
    try {
      final Launcher launcher = new Launcher(args, out, prompter, env);
      final Datum datum;
      try {
        datum = launcher.parse();
      } catch (ParseException e) {
        return e.code;
      }
      datum.execute();
      return 0;
    } catch (Throwable e) {
      out.flush();
      err.println("Error: " + e.getMessage());
      LoggerFactory.getLogger(Launcher.class).debug("Fatal error", e);
      return 2;
    } finally {
      out.flush();
      err.flush();
    }
  }

  /** Parses the command line arguments, and returns a {@link Datum}
   * instance.
   *
   * @throws ParseException if command line arguments were invalid or usage
   * was requested
   */
  public Datum parse() throws Exception {
    String url = null;
    String user = null;
    String password = null;
    String configName = ConfigFile.DEFAULT_NAME;
    for (int i = 0; i < args.size();) {
      final String arg = args.get(i);
      switch (arg) {
      case "--help":
        usage();
        throw new ParseException(0);
      case "--debug":
        debug();
        i += 1;
        continue;
      case "--list-drivers":
        listDrivers();
        throw new ParseException(0);
      case "--url":
        url = value(i);
        i += 2;
        continue;
      case "--user":
        user = value(i);
        i += 2;
        continue;
      case "--password":
        password = value(i);
        i += 2;
        continue;
      case "--config":
        configName = value(i);
        i += 2;
        continue;
      default:
        throw error("Unknown argument " + arg);
      }
    }
    if (url == null) {
      throw error("Missing --url");
    }

    final File configFile = ConfigFile.locate(configName, env);
    if (configFile == null && !configName.equals(ConfigFile.DEFAULT_NAME)) {
      throw error("Configuration file " + configName + " not found");
    }
    final SessionConfig sessionConfig = ConfigFile.read(configFile);
    final Datum.Config config = Datum.configBuilder()
        .withPrompter(prompter)
        .withWriter(out)
        .withConnectionFactory(
            new SimpleConnectionFactory(url, user, password))
        .withSessionConfig(sessionConfig)
        .build();
    return new Datum(config);
  }

  /** Returns the value of the flag at position {@code i}, resolving
   * {@code ENV=NAME}. */
  private String value(int i) throws ParseException {
    final String flag = args.get(i);
    if (i + 1 >= args.size()) {
      throw error("Insufficient arguments for " + flag);
    }
    final String value = args.get(i + 1);
    if (!value.startsWith(ENV_PREFIX)) {
      return value;
    }
    final String name = value.substring(ENV_PREFIX.length());
    final String resolved = env.apply(name);
    if (resolved == null) {
      throw error("Environment variable " + name + " (for " + flag
          + ") is not set");
    }
    return resolved;
  }

  /** Lowers the level of the root logger to DEBUG. */
  private static void debug() {
    final org.slf4j.Logger root =
        LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    if (root instanceof ch.qos.logback.classic.Logger) {
      ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
    }
  }

  private void listDrivers() {
    final List<String> drivers = DriverManager.drivers()
        .map(Launcher::describe)
        .sorted()
        .collect(Collectors.toList());
    out.println("Drivers available:");
    for (String driver : drivers) {
      out.println(driver);
    }
  }

  private static String describe(Driver driver) {
    return driver.getClass().getName() + " " + driver.getMajorVersion() + "."
        + driver.getMinorVersion();
  }

  private ParseException error(String error) {
    out.println(error);
    out.println();
    usage();
    return new ParseException(1);
  }

  private void usage() {
    for (String line : USAGE_LINES) {
      out.println(line);
    }
  }

  /** Thrown when arguments are invalid or usage was requested; carries the
   * exit code. */
  static class ParseException extends Exception {
    private final int code;

    ParseException(int code) {
      super();
      this.code = code;
    }
  }
}

// End Launcher.java
