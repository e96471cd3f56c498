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
package net.hydromatic.recordriver;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.Array;
import java.sql.Blob;
import java.sql.CallableStatement;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.NClob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLClientInfoException;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Savepoint;
import java.sql.Statement;
import java.sql.Struct;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Executor;

import static net.hydromatic.recordriver.JdbcUtils.unsupported;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/** Connection to a session in a {@link SessionRegistry}.
 *
 * <p>Opening the connection creates the session if it does not exist;
 * closing the connection deletes it (unless {@link Config#deleteOnClose()}
 * is false). Transactions are accepted and have no effect: commit, rollback
 * and savepoints always succeed and never change what has been recorded. */
public class RecordConnection implements Connection {
  private final SessionRegistry registry;
  private final String session;
  private final Config config;
  private final Properties clientInfo = new Properties();
  private boolean autoCommit = true;
  private boolean readOnly;
  private int isolation = TRANSACTION_NONE;
  private int holdability = ResultSet.HOLD_CURSORS_OVER_COMMIT;
  private int savepointCount;
  private @Nullable String catalog;
  private @Nullable String schema;
  private Map<String, Class<?>> typeMap = ImmutableMap.of();
  private boolean closed;

  RecordConnection(SessionRegistry registry, String session, Config config) {
    this.registry = requireNonNull(registry, "registry");
    this.session = requireNonNull(session, "session");
    this.config = requireNonNull(config, "config");
    registry.ensureSession(session);
  }

  /** Returns the name of the session this connection records into. */
  public String sessionName() {
    return session;
  }

  /** Returns the configuration of this connection. */
  public Config config() {
    return config;
  }

  private void checkOpen() throws SQLException {
    if (closed) {
      throw new SQLException(
          format("connection to session '%s' is closed", session));
    }
  }

  /** Records a query and returns the response to read its rows from. */
  Response query(String sql) throws SQLException {
    checkOpen();
    switch (config.mode()) {
      case LENIENT:
        return registry.recordQuery(session, sql);
      case STRICT:
        final Response response =
            registry.recordQueryIfRegistered(session, sql);
        if (response == null) {
          throw new SQLException(
              format("no response registered for query [%s] in session '%s'",
                  sql, session));
        }
        return response;
      default:
        throw new AssertionError(config.mode());
    }
  }

  /** Records a statement. */
  void statement(String sql) throws SQLException {
    checkOpen();
    registry.recordStatement(session, sql);
  }

  @Override public Statement createStatement() throws SQLException {
    checkOpen();
    return new RecordStatement(this, null);
  }

  @Override public Statement createStatement(int resultSetType,
      int resultSetConcurrency) throws SQLException {
    return createStatement();
  }

  @Override public Statement createStatement(int resultSetType,
      int resultSetConcurrency, int resultSetHoldability)
      throws SQLException {
    return createStatement();
  }

  @Override public PreparedStatement prepareStatement(String sql)
      throws SQLException {
    checkOpen();
    return new RecordStatement(this, requireNonNull(sql, "sql"));
  }

  @Override public PreparedStatement prepareStatement(String sql,
      int resultSetType, int resultSetConcurrency) throws SQLException {
    return prepareStatement(sql);
  }

  @Override public PreparedStatement prepareStatement(String sql,
      int resultSetType, int resultSetConcurrency, int resultSetHoldability)
      throws SQLException {
    return prepareStatement(sql);
  }

  @Override public PreparedStatement prepareStatement(String sql,
      int autoGeneratedKeys) throws SQLException {
    return prepareStatement(sql);
  }

  @Override public PreparedStatement prepareStatement(String sql,
      int[] columnIndexes) throws SQLException {
    return prepareStatement(sql);
  }

  @Override public PreparedStatement prepareStatement(String sql,
      String[] columnNames) throws SQLException {
    return prepareStatement(sql);
  }

  @Override public CallableStatement prepareCall(String sql)
      throws SQLException {
    throw unsupported("callable statements");
  }

  @Override public CallableStatement prepareCall(String sql,
      int resultSetType, int resultSetConcurrency) throws SQLException {
    throw unsupported("callable statements");
  }

  @Override public CallableStatement prepareCall(String sql,
      int resultSetType, int resultSetConcurrency, int resultSetHoldability)
      throws SQLException {
    throw unsupported("callable statements");
  }

  @Override public String nativeSQL(String sql) throws SQLException {
    checkOpen();
    return sql;
  }

  // Transactions. None of these has any effect on the session.

  @Override public void setAutoCommit(boolean autoCommit)
      throws SQLException {
    checkOpen();
    this.autoCommit = autoCommit;
  }

  @Override public boolean getAutoCommit() throws SQLException {
    checkOpen();
    return autoCommit;
  }

  @Override public void commit() throws SQLException {
    checkOpen();
  }

  @Override public void rollback() throws SQLException {
    checkOpen();
  }

  @Override public Savepoint setSavepoint() throws SQLException {
    checkOpen();
    return new RecordSavepoint(++savepointCount, null);
  }

  @Override public Savepoint setSavepoint(String name) throws SQLException {
    checkOpen();
    return new RecordSavepoint(++savepointCount, requireNonNull(name, "name"));
  }

  @Override public void rollback(Savepoint savepoint) throws SQLException {
    checkOpen();
  }

  @Override public void releaseSavepoint(Savepoint savepoint)
      throws SQLException {
    checkOpen();
  }

  @Override public void setTransactionIsolation(int level)
      throws SQLException {
    checkOpen();
    this.isolation = level;
  }

  @Override public int getTransactionIsolation() throws SQLException {
    checkOpen();
    return isolation;
  }

  /** Closes this connection and, if {@link Config#deleteOnClose()}, deletes
   * its session. Closing a connection that is already closed does nothing;
   * in particular, it does not delete a session of the same name that
   * another connection has since opened. */
  @Override public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (config.deleteOnClose()) {
      registry.deleteSession(session);
    }
  }

  @Override public boolean isClosed() {
    return closed;
  }

  @Override public boolean isValid(int timeout) throws SQLException {
    if (timeout < 0) {
      throw new SQLException("timeout must not be negative");
    }
    return !closed;
  }

  @Override public void abort(Executor executor) {
    close();
  }

  @Override public DatabaseMetaData getMetaData() throws SQLException {
    throw unsupported("database metadata");
  }

  @Override public void setReadOnly(boolean readOnly) throws SQLException {
    checkOpen();
    this.readOnly = readOnly;
  }

  @Override public boolean isReadOnly() throws SQLException {
    checkOpen();
    return readOnly;
  }

  @Override public void setCatalog(String catalog) throws SQLException {
    checkOpen();
    this.catalog = catalog;
  }

  @Override public @Nullable String getCatalog() throws SQLException {
    checkOpen();
    return catalog;
  }

  @Override public void setSchema(String schema) throws SQLException {
    checkOpen();
    this.schema = schema;
  }

  @Override public @Nullable String getSchema() throws SQLException {
    checkOpen();
    return schema;
  }

  @Override public @Nullable SQLWarning getWarnings() throws SQLException {
    checkOpen();
    return null;
  }

  @Override public void clearWarnings() throws SQLException {
    checkOpen();
  }

  @Override public Map<String, Class<?>> getTypeMap() throws SQLException {
    checkOpen();
    return typeMap;
  }

  @Override public void setTypeMap(Map<String, Class<?>> map)
      throws SQLException {
    checkOpen();
    this.typeMap = ImmutableMap.copyOf(map);
  }

  @Override public void setHoldability(int holdability) throws SQLException {
    checkOpen();
    this.holdability = holdability;
  }

  @Override public int getHoldability() throws SQLException {
    checkOpen();
    return holdability;
  }

  @Override public void setClientInfo(String name, String value)
      throws SQLClientInfoException {
    if (value == null) {
      clientInfo.remove(name);
    } else {
      clientInfo.setProperty(name, value);
    }
  }

  @Override public void setClientInfo(Properties properties)
      throws SQLClientInfoException {
    clientInfo.clear();
    clientInfo.putAll(properties);
  }

  @Override public @Nullable String getClientInfo(String name) {
    return clientInfo.getProperty(name);
  }

  @Override public Properties getClientInfo() {
    final Properties properties = new Properties();
    properties.putAll(clientInfo);
    return properties;
  }

  @Override public void setNetworkTimeout(Executor executor,
      int milliseconds) throws SQLException {
    checkOpen();
  }

  @Override public int getNetworkTimeout() throws SQLException {
    checkOpen();
    return 0;
  }

  @Override public Clob createClob() throws SQLException {
    throw unsupported("CLOB");
  }

  @Override public Blob createBlob() throws SQLException {
    throw unsupported("BLOB");
  }

  @Override public NClob createNClob() throws SQLException {
    throw unsupported("NCLOB");
  }

  @Override public SQLXML createSQLXML() throws SQLException {
    throw unsupported("SQLXML");
  }

  @Override public Array createArrayOf(String typeName, Object[] elements)
      throws SQLException {
    throw unsupported("ARRAY");
  }

  @Override public Struct createStruct(String typeName, Object[] attributes)
      throws SQLException {
    throw unsupported("STRUCT");
  }

  @Override public <T> T unwrap(Class<T> iface) throws SQLException {
    if (iface.isInstance(this)) {
      return iface.cast(this);
    }
    throw new SQLException("not a wrapper for " + iface);
  }

  @Override public boolean isWrapperFor(Class<?> iface) {
    return iface.isInstance(this);
  }

  @Override public String toString() {
    return "RecordConnection{" + session + "}";
  }

  /** Savepoint that marks nothing. */
  private static class RecordSavepoint implements Savepoint {
    private final int id;
    private final @Nullable String name;

    RecordSavepoint(int id, @Nullable String name) {
      this.id = id;
      this.name = name;
    }

    @Override public int getSavepointId() throws SQLException {
      if (name != null) {
        throw new SQLException("savepoint is named");
      }
      return id;
    }

    @Override public String getSavepointName() throws SQLException {
      if (name == null) {
        throw new SQLException("savepoint is not named");
      }
      return name;
    }
  }
}

// End RecordConnection.java
