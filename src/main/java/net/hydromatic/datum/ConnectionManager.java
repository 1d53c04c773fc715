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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.Statement;

import static java.util.Objects.requireNonNull;

/** Holds the one live connection of a session.
 *
 * <p>The connection is opened on first use. {@link #reconnect()} opens a
 * new connection before closing the old one, so that a failed reconnect
 * leaves the session with the connection it had. */
public class ConnectionManager implements AutoCloseable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ConnectionManager.class);

  private final Datum.ConnectionFactory connectionFactory;
  private final SessionConfig config;
  private @Nullable Connection connection;

  public ConnectionManager(Datum.ConnectionFactory connectionFactory,
      SessionConfig config) {
    this.connectionFactory = requireNonNull(connectionFactory);
    this.config = requireNonNull(config);
  }

  /** Returns the live connection, opening it if necessary. */
  public Connection connection() throws Exception {
    if (connection == null) {
      connection = open();
    }
    return connection;
  }

  /** Opens a new connection and makes it the live one. Closes the previous
   * connection; a failure to close is logged. */
  public Connection reconnect() throws Exception {
    final Connection newConnection = open();
    final Connection oldConnection = connection;
    connection = newConnection;
    if (oldConnection != null) {
      try {
        oldConnection.close();
      } catch (SQLException e) {
        LOGGER.warn("Error closing previous connection", e);
      }
    }
    return newConnection;
  }

  private Connection open() throws Exception {
    final Connection c =
        requireNonNull(connectionFactory.connect(), "connection");
    c.setAutoCommit(true);
    LOGGER.debug("Opened connection {}", c);
    return c;
  }

  /** Sets the command timeout and checks whether the driver accepts it.
   *
   * <p>The value is stored in the session config whatever the driver says;
   * every statement applies it. Returns whether the driver accepted it. */
  public boolean setCommandTimeout(int seconds) throws Exception {
    config.setCommandTimeoutSeconds(seconds);
    final Statement statement = connection().createStatement();
    try {
      statement.setQueryTimeout(seconds);
      return true;
    } catch (SQLException e) {
      LOGGER.warn("Driver refused command timeout of {} seconds: {}",
          seconds, e.getMessage());
      return false;
    } finally {
      statement.close();
    }
  }

  /** Returns a description of the connection, "product@catalog", used as a
   * prompt header. */
  public String describe() throws Exception {
    final Connection c = connection();
    final DatabaseMetaData metaData = c.getMetaData();
    final String product = metaData.getDatabaseProductName();
    final String catalog = c.getCatalog();
    return (product == null ? "-" : product)
        + "@" + (catalog == null || catalog.isEmpty() ? "-" : catalog);
  }

  @Override public void close() throws SQLException {
    if (connection != null) {
      final Connection c = connection;
      connection = null;
      c.close();
    }
  }
}

// End ConnectionManager.java
