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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Handles a line that starts with a colon.
 *
 * <p>Built-in commands take effect at once. A named command, declared in
 * the configuration file, is a query template; the dispatcher asks for the
 * values of its placeholders and returns the query for the session to
 * execute. */
public class CommandDispatcher implements Command.Context {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(CommandDispatcher.class);

  private static final Splitter SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private static final Map<String, Command> BUILT_INS;

  static {
    final ImmutableMap.Builder<String, Command> builder =
        ImmutableMap.builder();
    for (BuiltInCommand command : BuiltInCommand.values()) {
      builder.put(command.commandName(), command);
    }
    BUILT_INS = builder.build();
  }

  private final SessionConfig config;
  private final ConnectionManager connections;
  private final Prompter prompter;
  private final PrintWriter writer;

  public CommandDispatcher(SessionConfig config,
      ConnectionManager connections, Prompter prompter, PrintWriter writer) {
    this.config = requireNonNull(config);
    this.connections = requireNonNull(connections);
    this.prompter = requireNonNull(prompter);
    this.writer = requireNonNull(writer);
  }

  /** Handles a command.
   *
   * <p>Returns the query to execute, or null if there is nothing to
   * execute. Mistakes in a command's arguments are reported by printing a
   * message. A malformed template ({@link TemplateException}), end of input
   * while asking for a value, or failure to connect is thrown.
   *
   * @param line Line that starts with ':'
   */
  public @Nullable String dispatch(String line) throws Exception {
    final List<String> words = SPLITTER.splitToList(line);
    if (words.isEmpty()) {
      return null;
    }
    final String name = words.get(0);
    final Command command = BUILT_INS.get(name);
    if (command != null) {
      final Command.Invocation invocation =
          parse(name, command.modifiers(), words.subList(1, words.size()));
      LOGGER.debug("Built-in command {}", invocation);
      return command.execute(this, invocation);
    }
    final String template =
        name.length() > 1 ? config.namedCommands().get(name.substring(1))
            : null;
    if (template != null) {
      LOGGER.debug("Named command {}", name);
      return expand(template);
    }
    writer.println(
        "Invalid command. Use :help for a list of available commands.");
    return null;
  }

  /** Separates the words that follow a command name into modifiers and
   * arguments. */
  static Command.Invocation parse(String name, Set<String> allowedModifiers,
      List<String> words) {
    final Set<String> modifiers = new LinkedHashSet<>();
    final List<String> args = new ArrayList<>();
    for (String word : words) {
      if (allowedModifiers.contains(word)) {
        modifiers.add(word);
      } else {
        args.add(word);
      }
    }
    return new Command.Invocation(name, modifiers, args);
  }

  @Override public PrintWriter writer() {
    return writer;
  }

  @Override public SessionConfig config() {
    return config;
  }

  @Override public ConnectionManager connections() {
    return connections;
  }

  @Override public String expand(String template) throws IOException {
    final Template t = Template.parse(template);
    if (!t.names().isEmpty()) {
      writer.println();
      writer.flush();
    }
    final String query = t.expand(prompter);
    echo(query);
    return query;
  }

  @Override public void echo(String query) {
    writer.println("Command query:");
    writer.println(query);
    writer.flush();
  }
}

// End CommandDispatcher.java
