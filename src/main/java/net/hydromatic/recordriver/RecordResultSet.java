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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/** Result set that reads the rows of a {@link Response}.
 *
 * <p>Each call to {@link #next()} removes a row from the response, so the
 * row is gone for any other result set over the same response. */
class RecordResultSet extends AbstractResultSet {
  private final @Nullable Statement statement;
  private final Response response;
  private final ImmutableList<String> columns;
  private final ResultSetMetaData metaData;
  private @Nullable List<@Nullable Object> row;
  private int rowNumber;
  private boolean done;
  private boolean closed;

  RecordResultSet(@Nullable Statement statement, Response response) {
    this.statement = statement;
    this.response = requireNonNull(response, "response");
    this.columns = ImmutableList.copyOf(response.columns());
    this.metaData = new RecordResultSetMetaData(columns, response.peek());
  }

  @Override public boolean next() throws SQLException {
    checkOpen();
    if (done) {
      return false;
    }
    row = response.next();
    if (row == null) {
      done = true;
      return false;
    }
    ++rowNumber;
    return true;
  }

  @Override protected @Nullable Object value(int columnIndex)
      throws SQLException {
    checkOpen();
    final List<@Nullable Object> row = this.row;
    if (row == null) {
      throw new SQLException("no current row");
    }
    if (columnIndex < 1 || columnIndex > row.size()) {
      throw new SQLException(
          format("column index %d out of range; row has %d values",
              columnIndex, row.size()));
    }
    return row.get(columnIndex - 1);
  }

  @Override public int findColumn(String columnLabel) throws SQLException {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).equalsIgnoreCase(columnLabel)) {
        return i + 1;
      }
    }
    throw new SQLException(format("column '%s' not found", columnLabel));
  }

  @Override public ResultSetMetaData getMetaData() {
    return metaData;
  }

  @Override public @Nullable Statement getStatement() {
    return statement;
  }

  @Override public int getRow() {
    return row == null ? 0 : rowNumber;
  }

  @Override public boolean isBeforeFirst() {
    return rowNumber == 0 && !done && !response.isExhausted();
  }

  @Override public boolean isAfterLast() {
    return done && rowNumber > 0;
  }

  @Override public boolean isFirst() {
    return row != null && rowNumber == 1;
  }

  /** Closes this result set. Rows already read stay consumed; rows not yet
   * read stay in the response. */
  @Override public void close() {
    closed = true;
    row = null;
    response.close();
  }

  @Override public boolean isClosed() {
    return closed;
  }

  private void checkOpen() throws SQLException {
    if (closed) {
      throw new SQLException("result set is closed");
    }
  }
}

// End RecordResultSet.java
