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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;

/** Shows a prompt and reads one line of input.
 *
 * @see Prompters */
@FunctionalInterface
public interface Prompter {
  /** Shows a prompt and reads one line.
   *
   * <p>Returns null at end of input. Throws
   * {@link java.io.InterruptedIOException} if the user interrupts the line
   * (for example, presses Ctrl-C).
   *
   * @param prompt Prompt, such as {@code ">"} or {@code "name> "}
   * @return Line read, without its terminator, or null at end of input
   */
  @Nullable String readLine(String prompt) throws IOException;
}

// End Prompter.java
