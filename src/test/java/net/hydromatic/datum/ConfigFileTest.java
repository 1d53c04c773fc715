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

import net.hydromatic.datum.util.TestUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link ConfigFile}. */
class ConfigFileTest {
  private static final TestUtils.FileFont FILE_FONT =
      new TestUtils.FileFont("datum-config-test");

  private static File write(File file, String... lines) throws IOException {
    Files.write(file.toPath(),
        TestUtils.lines(lines).getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test void testDefaults() throws IOException {
    final SessionConfig config = ConfigFile.read(null);
    assertThat(config.getRowsToPrint(), is(100));
    assertThat(config.getColumnDisplayWidth(), is(100));
    assertThat(config.getNullDisplayString(), is("[NULL]"));
    assertThat(config.getNewlineReplacement(), is("\\n"));
    assertThat(config.getTabReplacement(), is("\\t"));
    assertThat(config.getCommandTimeoutSeconds(), is(30));
    assertThat(config.getCsvExportPath(), nullValue());
    assertThat(config.namedCommands().isEmpty(), is(true));
  }

  @Test void testRead() throws IOException {
    final File file = write(FILE_FONT.file("config", ".properties"),
        "# settings",
        "rows_to_print=50",
        "column_display_length=0",
        "null_string=(null)",
        "tab_replacement=\\u0020\\u0020",
        "command_timeout=5",
        "query.zeta=SELECT 'z'",
        "query.alpha=SELECT * FROM t WHERE a = '{a}'",
        "query.mid=SELECT 2");
    final SessionConfig config = ConfigFile.read(file);
    assertThat(config.getRowsToPrint(), is(50));
    assertThat(config.getColumnDisplayWidth(), is(0));
    assertThat(config.getNullDisplayString(), is("(null)"));
    assertThat(config.getTabReplacement(), is("  "));
    assertThat(config.getNewlineReplacement(), is("\\n"));
    assertThat(config.getCommandTimeoutSeconds(), is(5));
    assertThat(ImmutableList.copyOf(config.namedCommands().keySet()),
        is(ImmutableList.of("zeta", "alpha", "mid")));
    assertThat(config.namedCommands().get("alpha"),
        is("SELECT * FROM t WHERE a = '{a}'"));
  }

  /** "OFF" means the same in the file as in the built-in commands. */
  @Test void testOff() {
    final SessionConfig config =
        ConfigFile.apply(
            ImmutableMap.of("null_string", "OFF",
                "newline_replacement", "OFF",
                "tab_replacement", "OFF"),
            new SessionConfig(), "test");
    assertThat(config.getNullDisplayString(), is(""));
    assertThat(config.getNewlineReplacement(), is("\n"));
    assertThat(config.getTabReplacement(), is("\t"));
  }

  @Test void testInvalidValue() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> ConfigFile.apply(ImmutableMap.of("rows_to_print", "-1"),
                new SessionConfig(), "test"));
    assertThat(e.getMessage(),
        is("Invalid value '-1' for rows_to_print in test"));
  }

  @Test void testLocate() throws IOException {
    final File file = write(FILE_FONT.file("direct", ".properties"));
    assertThat(ConfigFile.locate(file.getPath(), name -> null), is(file));

    final File home = FILE_FONT.file("xdg", "");
    final File dir = new File(home, "datum");
    assertThat(dir.mkdirs(), is(true));
    final File inHome = write(new File(dir, "my.properties"), "rows_to_print=7");
    assertThat(
        ConfigFile.locate("my.properties",
            name -> name.equals("XDG_CONFIG_HOME") ? home.getPath() : null),
        is(inHome));
    assertThat(
        ConfigFile.locate("other.properties",
            name -> name.equals("XDG_CONFIG_HOME") ? home.getPath() : null),
        nullValue());
    assertThat(ConfigFile.read(inHome).getRowsToPrint(), is(7));
  }

  @Test void testUnknownKeyIgnored() {
    final SessionConfig config =
        ConfigFile.apply(ImmutableMap.of("color", "blue", "query.", "x"),
            new SessionConfig(), "test");
    assertThat(config.namedCommands().isEmpty(), is(true));
    assertThat(config.getRowsToPrint(), is(100));
  }
}

// End ConfigFileTest.java
