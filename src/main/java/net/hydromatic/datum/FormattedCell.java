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

import static java.util.Objects.requireNonNull;

/** Text of a cell as it appears in a grid, and the minimum width of the
 * column needed to show it.
 *
 * <p>The width is at least the length of the text. For some kinds it is
 * larger; a boolean column is always wide enough for "false". */
public class FormattedCell {
  public final String text;
  public final int width;

  public FormattedCell(String text, int width) {
    this.text = requireNonNull(text);
    this.width = width;
  }

  @Override public String toString() {
    return text;
  }
}

// End FormattedCell.java
