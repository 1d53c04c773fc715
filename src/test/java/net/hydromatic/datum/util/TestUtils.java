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
package net.hydromatic.datum.util;

import net.hydromatic.datum.Datum;
import net.hydromatic.datum.Prompter;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.core.Is.is;

/** Utilities for writing Datum tests. */
public class TestUtils {
  private static final AtomicInteger DB_COUNT = new AtomicInteger();

  private TestUtils() {
  }

  /** Converts Windows line endings to Linux line endings. */
  public static String toLinux(String s) {
    return s.replace("\r\n", "\n");
  }

  /** Returns a matcher that concatenates an array of strings into a multi-line
   * string. */
  public static Matcher<String> isLines(String... lines) {
    return is(lines(lines));
  }

  /** Concatenates lines, each followed by a newline. */
  public static String lines(String... lines) {
    final StringBuilder b = new StringBuilder();
    for (String line : lines) {
      b.append(line).append("\n");
    }
    return b.toString();
  }

  /** Returns a matcher that checks the string contents of a file. */
  public static Matcher<? super File> hasContents(Matcher<String> matcher) {
    return new CustomTypeSafeMatcher<File>("file contents") {
      @Override protected void describeMismatchSafely(File file,
          Description mismatchDescription) {
        mismatchDescription.appendText("file has contents [")
            .appendText(fileContents(file))
            .appendText("]");
      }

      @Override protected boolean matchesSafely(File file) {
        return matcher.matches(fileContents(file));
      }

      String fileContents(File file) {
        try {
          return Files.asCharSource(file, StandardCharsets.UTF_8).read();
        } catch (IOException e) {
          throw new RuntimeException(e);
        }
      }
    };
  }

  /** Creates a connection factory for a new, empty in-memory HSQLDB
   * database, and runs some statements in it. */
  public static Datum.ConnectionFactory hsqldb(String... statements) {
    final String url =
        "jdbc:hsqldb:mem:datum" + DB_COUNT.getAndIncrement();
    try (Connection connection = DriverManager.getConnection(url, "SA", "");
         Statement statement = connection.createStatement()) {
      for (String sql : statements) {
        statement.execute(sql);
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
    return () -> DriverManager.getConnection(url, "SA", "");
  }

  /** Prompter that reads from a fixed list of lines and records the prompts
   * it was asked to show. */
  public static class ScriptedPrompter implements Prompter {
    private final Iterator<String> lines;
    public final List<String> prompts = new ArrayList<>();

    public ScriptedPrompter(String... lines) {
      this(Arrays.asList(lines));
    }

    public ScriptedPrompter(List<String> lines) {
      this.lines = ImmutableList.copyOf(lines).iterator();
    }

    @Override public @Nullable String readLine(String prompt) {
      prompts.add(prompt);
      return lines.hasNext() ? lines.next() : null;
    }
  }

  /** Supplies a sequence of unique file names in a temporary directory that
   * will be deleted when the JVM finishes. */
  public static class FileFont {
    private final File file;
    private final AtomicInteger i = new AtomicInteger();

    /** Creates a FileFont. */
    public FileFont(String dirName) {
      try {
        Path p = java.nio.file.Files.createTempDirectory(dirName);
        file = p.toFile();
        file.deleteOnExit();
      } catch (IOException e) {
        throw new RuntimeException(e);
      }
    }

    /** Generates a unique file in the temporary directory.
     *
     * <p>If you call {@code file("out", ".csv")}
     * the file name might be something like
     * "{@code /tmp/datum-test123/out_3.csv}". */
    public File file(String name, String suffix) {
      final File f = new File(file, name + '_' + i.getAndIncrement() + suffix);
      f.deleteOnExit();
      return f;
    }
  }
}

// End TestUtils.java
