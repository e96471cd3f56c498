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

import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.net.URL;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.NClob;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.RowId;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.Calendar;

import static net.hydromatic.recordriver.JdbcUtils.unsupported;

/** Implementation of {@link PreparedStatement} that accepts parameter values
 * and statement settings but does not use them. Use it as a base class.
 *
 * <p>Parameter values are never part of the text that a query is matched
 * on, so they are checked for a valid index and then dropped. */
abstract class AbstractPreparedStatement implements PreparedStatement {
  /** Value of {@link ParameterMetaData#getParameterCount()} that means the
   * number of parameters is not known. */
  static final int UNKNOWN_PARAMETER_COUNT = -1;

  private int maxFieldSize;
  private int maxRows;
  private int queryTimeout;
  private int fetchSize;
  private boolean poolable;
  private boolean closeOnCompletion;

  /** Throws if this statement is closed. */
  protected abstract void checkOpen() throws SQLException;

  /** Called by every {@code setXxx} method. */
  protected void bind(int parameterIndex) throws SQLException {
    checkOpen();
    if (parameterIndex < 1) {
      throw new SQLException("invalid parameter index " + parameterIndex);
    }
  }

  @Override public ParameterMetaData getParameterMetaData()
      throws SQLException {
    checkOpen();
    return new UnknownParameterMetaData();
  }

  @Override public void clearParameters() throws SQLException {
    checkOpen();
  }

  @Override public void setNull(int parameterIndex, int sqlType)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNull(int parameterIndex, int sqlType,
      String typeName) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBoolean(int parameterIndex, boolean x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setByte(int parameterIndex, byte x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setShort(int parameterIndex, short x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setInt(int parameterIndex, int x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setLong(int parameterIndex, long x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setFloat(int parameterIndex, float x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setDouble(int parameterIndex, double x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBigDecimal(int parameterIndex, BigDecimal x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setString(int parameterIndex, String x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNString(int parameterIndex, String value)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBytes(int parameterIndex, byte[] x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setDate(int parameterIndex, Date x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setDate(int parameterIndex, Date x, Calendar cal)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setTime(int parameterIndex, Time x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setTime(int parameterIndex, Time x, Calendar cal)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setTimestamp(int parameterIndex, Timestamp x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setTimestamp(int parameterIndex, Timestamp x,
      Calendar cal) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setObject(int parameterIndex, Object x,
      int targetSqlType) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setObject(int parameterIndex, Object x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setObject(int parameterIndex, Object x,
      int targetSqlType, int scaleOrLength) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setURL(int parameterIndex, URL x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setAsciiStream(int parameterIndex, InputStream x,
      int length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setAsciiStream(int parameterIndex, InputStream x,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setAsciiStream(int parameterIndex, InputStream x)
      throws SQLException {
    bind(parameterIndex);
  }

  @SuppressWarnings("deprecation")
  @Override public void setUnicodeStream(int parameterIndex, InputStream x,
      int length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBinaryStream(int parameterIndex, InputStream x,
      int length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBinaryStream(int parameterIndex, InputStream x,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBinaryStream(int parameterIndex, InputStream x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setCharacterStream(int parameterIndex, Reader reader,
      int length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setCharacterStream(int parameterIndex, Reader reader,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setCharacterStream(int parameterIndex, Reader reader)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNCharacterStream(int parameterIndex, Reader value,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNCharacterStream(int parameterIndex, Reader value)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setRef(int parameterIndex, Ref x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBlob(int parameterIndex, Blob x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBlob(int parameterIndex, InputStream inputStream,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setBlob(int parameterIndex, InputStream inputStream)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setClob(int parameterIndex, Clob x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setClob(int parameterIndex, Reader reader,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setClob(int parameterIndex, Reader reader)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNClob(int parameterIndex, NClob value)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNClob(int parameterIndex, Reader reader,
      long length) throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setNClob(int parameterIndex, Reader reader)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setArray(int parameterIndex, Array x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setRowId(int parameterIndex, RowId x)
      throws SQLException {
    bind(parameterIndex);
  }

  @Override public void setSQLXML(int parameterIndex, SQLXML xmlObject)
      throws SQLException {
    bind(parameterIndex);
  }

  // Settings

  @Override public int getMaxFieldSize() {
    return maxFieldSize;
  }

  @Override public void setMaxFieldSize(int max) {
    this.maxFieldSize = max;
  }

  @Override public int getMaxRows() {
    return maxRows;
  }

  @Override public void setMaxRows(int max) {
    this.maxRows = max;
  }

  @Override public void setEscapeProcessing(boolean enable) {
  }

  @Override public int getQueryTimeout() {
    return queryTimeout;
  }

  @Override public void setQueryTimeout(int seconds) {
    this.queryTimeout = seconds;
  }

  @Override public void cancel() {
  }

  @Override public @Nullable SQLWarning getWarnings() {
    return null;
  }

  @Override public void clearWarnings() {
  }

  @Override public void setCursorName(String name) throws SQLException {
    throw unsupported("named cursors");
  }

  @Override public void setFetchDirection(int direction)
      throws SQLException {
    if (direction != ResultSet.FETCH_FORWARD) {
      throw unsupported("scrollable result sets");
    }
  }

  @Override public int getFetchDirection() {
    return ResultSet.FETCH_FORWARD;
  }

  @Override public void setFetchSize(int rows) {
    this.fetchSize = rows;
  }

  @Override public int getFetchSize() {
    return fetchSize;
  }

  @Override public int getResultSetConcurrency() {
    return ResultSet.CONCUR_READ_ONLY;
  }

  @Override public int getResultSetType() {
    return ResultSet.TYPE_FORWARD_ONLY;
  }

  @Override public int getResultSetHoldability() {
    return ResultSet.HOLD_CURSORS_OVER_COMMIT;
  }

  @Override public void setPoolable(boolean poolable) {
    this.poolable = poolable;
  }

  @Override public boolean isPoolable() {
    return poolable;
  }

  @Override public void closeOnCompletion() {
    this.closeOnCompletion = true;
  }

  @Override public boolean isCloseOnCompletion() {
    return closeOnCompletion;
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

  /** Parameter metadata that does not know how many parameters there are. */
  private static class UnknownParameterMetaData
      implements ParameterMetaData {
    @Override public int getParameterCount() {
      return UNKNOWN_PARAMETER_COUNT;
    }

    @Override public int isNullable(int param) {
      return parameterNullableUnknown;
    }

    @Override public boolean isSigned(int param) {
      return false;
    }

    @Override public int getPrecision(int param) {
      return 0;
    }

    @Override public int getScale(int param) {
      return 0;
    }

    @Override public int getParameterType(int param) {
      return java.sql.Types.OTHER;
    }

    @Override public String getParameterTypeName(int param) {
      return "OTHER";
    }

    @Override public String getParameterClassName(int param) {
      return Object.class.getName();
    }

    @Override public int getParameterMode(int param) {
      return parameterModeUnknown;
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
  }
}

// End AbstractPreparedStatement.java
