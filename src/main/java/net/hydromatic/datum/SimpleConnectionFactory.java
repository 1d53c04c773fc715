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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/** Connection factory that connects to a JDBC URL using
 * {@link DriverManager}.
 *
 * <p>Each call creates a new connection; {@code :reconnect} relies on
 * this. */
class SimpleConnectionFactory implements Datum.ConnectionFactory {
  private final String url;
  private final @Nullable String user;
  private final @Nullable String password;

  SimpleConnectionFactory(String url, @Nullable String user,
      @Nullable String password) {
    this.url = requireNonNull(url);
    this.user = user;
    this.password = password;
  }

  @Override public Connection connect() throws SQLException {
    return DriverManager.getConnection(url, user, password);
  }

  @Override public String toString() {
    return "SimpleConnectionFactory{url=" + url + ", user=" + user + "}";
  }
}

// End SimpleConnectionFactory.java
