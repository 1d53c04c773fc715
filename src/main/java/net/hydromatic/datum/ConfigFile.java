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

import com.google.common.base.Strings;
import com.google.common.primitives.Ints;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/** Reads session settings and named commands from a properties file.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * rows_to_print=50
 * null_string=(null)
 * query.who=SELECT * FROM users WHERE name = '{name}'
 * </pre></blockquote>
 *
 * <p>declares a named command {@code :who}. Named commands keep the order in
 * which they appear in the file.
 */
public abstract class ConfigFile {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFile.class);

  /** Name of the file that is read if none is specified. */
  public static final String DEFAULT_NAME = "config.properties";

  /** Prefix of keys that declare named commands. */
  static final String QUERY_PREFIX = "query.";

  private ConfigFile() {
  }

  /** Finds a configuration file.
   *
   * <p>If {@code name} is a file, returns it. Otherwise looks for
   * {@code name} in the directory "datum" under {@code $XDG_CONFIG_HOME},
   * or under "~/.config" if that variable is not set. Returns null if
   * there is no such file.
   *
   * @param name File name or path
   * @param env Environment variables
   */
  public static @Nullable File locate(String name,
      Function<String, @Nullable String> env) {
    final File file = new File(name);
    if (file.isFile()) {
      return file;
    }
    String base = env.apply("XDG_CONFIG_HOME");
    if (Strings.isNullOrEmpty(base)) {
      base = System.getProperty("user.home") + File.separator + ".config";
    }
    final File file2 = new File(new File(base, "datum"), name);
    return file2.isFile() ? file2 : null;
  }

  /** Reads settings from a file, or returns the defaults if the file is
   * null. */
  public static SessionConfig read(@Nullable File file) throws IOException {
    final SessionConfig config = new SessionConfig();
    if (file == null) {
      LOGGER.debug("No configuration file; using defaults");
      return config;
    }
    final Map<String, String> entries = new LinkedHashMap<>();
    final Properties properties = new Properties() {
      @Override public synchronized Object put(Object key, Object value) {
        entries.put((String) key, (String) value);
        return super.put(key, value);
      }
    };
    try (Reader reader =
             Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      properties.load(reader);
    }
    LOGGER.debug("Read configuration file {}", file);
    return apply(entries, config, file.toString());
  }

  /** Applies settings to a session configuration.
   *
   * @throws IllegalArgumentException if a value is invalid
   */
  static SessionConfig apply(Map<String, String> entries,
      SessionConfig config, String source) {
    for (Map.Entry<String, String> entry : entries.entrySet()) {
      final String key = entry.getKey();
      final String value = entry.getValue();
      switch (key) {
      case "rows_to_print":
        config.setRowsToPrint(nonNegative(key, value, source));
        break;
      case "column_display_length":
        config.setColumnDisplayWidth(nonNegative(key, value, source));
        break;
      case "command_timeout":
        config.setCommandTimeoutSeconds(nonNegative(key, value, source));
        break;
      case "null_string":
        config.setNullDisplayString(orOff(value, ""));
        break;
      case "newline_replacement":
        config.setNewlineReplacement(orOff(value, "\n"));
        break;
      case "tab_replacement":
        config.setTabReplacement(orOff(value, "\t"));
        break;
      default:
        if (key.startsWith(QUERY_PREFIX)
            && key.length() > QUERY_PREFIX.length()) {
          config.addNamedCommand(key.substring(QUERY_PREFIX.length()), value);
        } else {
          LOGGER.warn("Unknown key '{}' in {}", key, source);
        }
      }
    }
    return config;
  }

  /** Returns a value, or the given value if it is the "OFF" token. */
  private static String orOff(String value, String off) {
    return value.equals(SessionConfig.OFF) ? off : value;
  }

  private static int nonNegative(String key, String value, String source) {
    final Integer n = Ints.tryParse(value.trim());
    if (n == null || n < 0) {
      throw new IllegalArgumentException("Invalid value '" + value
          + "' for " + key + " in " + source);
    }
    return n;
  }
}

// End ConfigFile.java
