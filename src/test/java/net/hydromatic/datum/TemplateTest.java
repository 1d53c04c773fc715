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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.util.Arrays;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Tests for {@link Template}. */
class TemplateTest {
  @Test void testNames() {
    final Template t =
        Template.parse("SELECT * FROM {table} WHERE a = '{x}' OR b = '{x}'");
    assertThat(t.names(), is(Arrays.asList("table", "x")));
    assertThat(t.expand(ImmutableMap.of("table", "emp", "x", "1")),
        is("SELECT * FROM emp WHERE a = '1' OR b = '1'"));
  }

  @Test void testNoPlaceholders() {
    final Template t = Template.parse("SELECT 1");
    assertThat(t.names(), empty());
    assertThat(t.expand(ImmutableMap.of()), is("SELECT 1"));
  }

  @Test void testEscapedBraces() {
    final Template t = Template.parse("SELECT '{{a}}', '{b}', '}}'");
    assertThat(t.names(), is(Arrays.asList("b")));
    assertThat(t.expand(ImmutableMap.of("b", "B")),
        is("SELECT '{a}', 'B', '}'"));
  }

  /** Each distinct name is asked for once, in order of first
   * appearance. */
  @Test void testPrompt() throws Exception {
    final TestUtils.ScriptedPrompter prompter =
        new TestUtils.ScriptedPrompter("alice", "10");
    final String query = Template.parse(
        "SELECT * FROM users WHERE name = '{name}' AND age > {age}"
            + " OR nickname = '{name}'").expand(prompter);
    assertThat(prompter.prompts, is(Arrays.asList("name> ", "age> ")));
    assertThat(query,
        is("SELECT * FROM users WHERE name = 'alice' AND age > 10"
            + " OR nickname = 'alice'"));
  }

  @Test void testPromptEndOfInput() {
    final TestUtils.ScriptedPrompter prompter =
        new TestUtils.ScriptedPrompter();
    assertThrows(EOFException.class,
        () -> Template.parse("{a}").expand(prompter));
  }

  @Test void testMalformed() {
    checkMalformed("SELECT {a", "unmatched '{'");
    checkMalformed("SELECT a}", "single '}'");
    checkMalformed("SELECT {}", "positional placeholder");
    checkMalformed("SELECT {0}", "positional placeholder");
    checkMalformed("SELECT {a b}", "invalid placeholder '{a b}'");
    checkMalformed("SELECT {1a}", "invalid placeholder");
  }

  private static void checkMalformed(String text, String message) {
    final TemplateException e =
        assertThrows(TemplateException.class, () -> Template.parse(text));
    assertThat(e.getMessage(), containsString("Template error: "));
    assertThat(e.getMessage(), containsString(message));
  }
}

// End TemplateTest.java
