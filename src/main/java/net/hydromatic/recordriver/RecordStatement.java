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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Statement that records what it executes in its connection's session.
 *
 * <p>Queries ({@link #executeQuery()}) are logged and answered with the
 * response registered for their exact text. Everything else
 * ({@link #executeUpdate()}, {@link #execute()}, batches) is logged as a
 * statement, affects no rows, and generates a single key whose value is 0.
 *
 * <p>A statement created by {@link Connection#createStatement()} has no SQL
 * of its own and executes the SQL passed to each method. A statement created
 * by {@link Connection#prepareStatement(String)} is bound to its SQL, and
 * its methods that take a SQL string throw. */
class RecordStatement extends AbstractPreparedStatement {
  private static final String GENERATED_KEY = "GENERATED_KEY";

  private final RecordConnection connection;
  private final @Nullable String sql;
  private final List<String> batch = new ArrayList<>();
  private @Nullable RecordResultSet resultSet;
  private long updateCount = -1;
  private boolean closed;

  RecordStatement(RecordConnection connection, @Nullable String sql) {
    this.connection = requireNonNull(connection, "connection");
    this.sql = sql;
  }

  @Override protected void checkOpen() throws SQLException {
    if (closed) {
      throw new SQLException("statement is closed");
    }
  }

  private String sql() throws SQLException {
    checkOpen();
    if (sql == null) {
      throw new SQLException("statement has no SQL; "
          + "use a method that takes a SQL string, or prepareStatement");
    }
    return sql;
  }

  /** Checks that SQL may be passed to an execute or batch method; a
   * prepared statement executes only the SQL it was prepared with. */
  private String given(String sql) throws SQLException {
    checkOpen();
    if (this.sql != null) {
      throw new SQLException(
          "cannot pass SQL to a method of a prepared statement");
    }
    return requireNonNull(sql, "sql");
  }

  private ResultSet query(String sql) throws SQLException {
    checkOpen();
    closeResultSet();
    final Response response = connection.query(sql);
    final RecordResultSet resultSet = new RecordResultSet(this, response);
    this.resultSet = resultSet;
    this.updateCount = -1;
    return resultSet;
  }

  private long update(String sql) throws SQLException {
    checkOpen();
    closeResultSet();
    connection.statement(sql);
    this.updateCount = 0;
    return 0;
  }

  private void closeResultSet() {
    if (resultSet != null) {
      resultSet.close();
      resultSet = null;
    }
  }

  @Override public ResultSet executeQuery(String sql) throws SQLException {
    return query(given(sql));
  }

  @Override public ResultSet executeQuery() throws SQLException {
    return query(sql());
  }

  @Override public int executeUpdate(String sql) throws SQLException {
    return (int) update(given(sql));
  }

  @Override public int executeUpdate() throws SQLException {
    return (int) update(sql());
  }

  @Override public int executeUpdate(String sql, int autoGeneratedKeys)
      throws SQLException {
    return executeUpdate(sql);
  }

  @Override public int executeUpdate(String sql, int[] columnIndexes)
      throws SQLException {
    return executeUpdate(sql);
  }

  @Override public int executeUpdate(String sql, String[] columnNames)
      throws SQLException {
    return executeUpdate(sql);
  }

  @Override public long executeLargeUpdate(String sql) throws SQLException {
    return update(given(sql));
  }

  @Override public long executeLargeUpdate() throws SQLException {
    return update(sql());
  }

  @Override public long executeLargeUpdate(String sql, int autoGeneratedKeys)
      throws SQLException {
    return executeLargeUpdate(sql);
  }

  @Override public long executeLargeUpdate(String sql, int[] columnIndexes)
      throws SQLException {
    return executeLargeUpdate(sql);
  }

  @Override public long executeLargeUpdate(String sql, String[] columnNames)
      throws SQLException {
    return executeLargeUpdate(sql);
  }

  /** {@inheritDoc}
   *
   * <p>The command is recorded as a statement, not a query, and this method
   * returns false. Use {@link #executeQuery(String)} to execute a query. */
  @Override public boolean execute(String sql) throws SQLException {
    update(given(sql));
    return false;
  }

  @Override public boolean execute() throws SQLException {
    update(sql());
    return false;
  }

  @Override public boolean execute(String sql, int autoGeneratedKeys)
      throws SQLException {
    return execute(sql);
  }

  @Override public boolean execute(String sql, int[] columnIndexes)
      throws SQLException {
    return execute(sql);
  }

  @Override public boolean execute(String sql, String[] columnNames)
      throws SQLException {
    return execute(sql);
  }

  @Override public @Nullable ResultSet getResultSet() throws SQLException {
    checkOpen();
    return resultSet;
  }

  @Override public int getUpdateCount() throws SQLException {
    return (int) getLargeUpdateCount();
  }

  @Override public long getLargeUpdateCount() throws SQLException {
    checkOpen();
    return updateCount;
  }

  @Override public boolean getMoreResults() throws SQLException {
    return getMoreResults(CLOSE_CURRENT_RESULT);
  }

  @Override public boolean getMoreResults(int current) throws SQLException {
    checkOpen();
    if (current != KEEP_CURRENT_RESULT) {
      closeResultSet();
    }
    resultSet = null;
    updateCount = -1;
    return false;
  }

  @Override public ResultSet getGeneratedKeys() throws SQLException {
    checkOpen();
    final Response keys =
        Response.builder().columns(GENERATED_KEY).row(0L).build();
    return new RecordResultSet(this, keys);
  }

  @Override public void addBatch(String sql) throws SQLException {
    batch.add(given(sql));
  }

  @Override public void addBatch() throws SQLException {
    batch.add(sql());
  }

  @Override public void clearBatch() throws SQLException {
    checkOpen();
    batch.clear();
  }

  /** {@inheritDoc}
   *
   * <p>Records each command in the batch as a statement, in the order they
   * were added. Each affects 0 rows. */
  @Override public int[] executeBatch() throws SQLException {
    final long[] counts = executeLargeBatch();
    return new int[counts.length];
  }

  @Override public long[] executeLargeBatch() throws SQLException {
    checkOpen();
    final List<String> commands = new ArrayList<>(batch);
    batch.clear();
    for (String command : commands) {
      update(command);
    }
    updateCount = -1;
    return new long[commands.size()];
  }

  @Override public @Nullable ResultSetMetaData getMetaData()
      throws SQLException {
    checkOpen();
    return null;
  }

  @Override public Connection getConnection() throws SQLException {
    checkOpen();
    return connection;
  }

  @Override public void close() {
    if (!closed) {
      closeResultSet();
      batch.clear();
      closed = true;
    }
  }

  @Override public boolean isClosed() {
    return closed;
  }

  @Override public String toString() {
    return "RecordStatement{" + (sql == null ? "" : sql) + "}";
  }
}

// End RecordStatement.java
