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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/** Command that begins with a colon, such as {@code :rows 10}.
 *
 * @see BuiltInCommand
 * @see CommandDispatcher
 */
public interface Command {
  /** Returns the name of this command, including the colon; for example
   * ":rows". */
  String commandName();

  /** Returns the modifier flags that this command accepts; for example
   * "-eq" and "-full". Other words are arguments. */
  Set<String> modifiers();

  /** Executes this command.
   *
   * @param x Execution context
   * @param invocation Name, modifiers and arguments as typed
   * @return Query text to execute, or null
   *
   * @throws Exception if command fails
   */
  @Nullable String execute(Context x, Invocation invocation) throws Exception;

  /** Execution context for a command. */
  interface Context {
    PrintWriter writer();

    SessionConfig config();

    ConnectionManager connections();

    /** Asks for the values of a template's placeholders, and returns the
     * expanded query, after echoing it. */
    String expand(String template) throws IOException;

    /** Prints a query that a command has produced. */
    void echo(String query);
  }

  /** A command as typed: name, modifiers and arguments. */
  class Invocation {
    private static final Joiner SPACE = Joiner.on(' ');

    public final String name;
    public final ImmutableSet<String> modifiers;
    public final ImmutableList<String> args;

    public Invocation(String name, Set<String> modifiers, List<String> args) {
      this.name = requireNonNull(name);
      this.modifiers = ImmutableSet.copyOf(modifiers);
      this.args = ImmutableList.copyOf(args);
    }

    public boolean has(String modifier) {
      return modifiers.contains(modifier);
    }

    /** Returns the arguments joined by spaces; for example, a path that
     * contains spaces. */
    public String argString() {
      return SPACE.join(args);
    }

    @Override public String toString() {
      return name + " " + modifiers + " " + args;
    }
  }
}

// End Command.java
