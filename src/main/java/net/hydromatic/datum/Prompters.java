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

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.io.BufferedReader;
import java.io.InterruptedIOException;
import java.io.PrintWriter;

import static java.util.Objects.requireNonNull;

/** Implementations of {@link Prompter}. */
public abstract class Prompters {
  private Prompters() {
  }

  /** Creates a prompter that prints prompts to a writer and reads lines
   * from a reader. Suitable for piped input. */
  public static Prompter of(BufferedReader reader, PrintWriter writer) {
    requireNonNull(reader);
    requireNonNull(writer);
    return prompt -> {
      writer.print(prompt);
      writer.flush();
      return reader.readLine();
    };
  }

  /** Creates a prompter that reads from a terminal with line editing.
   *
   * <p>Ctrl-C becomes {@link InterruptedIOException} and Ctrl-D becomes end
   * of input. */
  public static Prompter of(LineReader lineReader) {
    requireNonNull(lineReader);
    return prompt -> {
      try {
        return lineReader.readLine(prompt);
      } catch (UserInterruptException e) {
        throw new InterruptedIOException("Interrupted");
      } catch (EndOfFileException e) {
        return null;
      }
    };
  }
}

// End Prompters.java
