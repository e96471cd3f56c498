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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Date;
import java.sql.NClob;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.RowId;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.SQLXML;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.Calendar;
import java.util.Map;

import static net.hydromatic.recordriver.JdbcUtils.unsupported;

/** Implementation of {@link ResultSet} that is read-only and forward-only.
 *
 * <p>Every getter is derived from {@link #value(int)}; getters that take a
 * column label go through {@link #findColumn(String)}. Updates and cursor
 * movement other than {@link #next()} throw
 * {@link java.sql.SQLFeatureNotSupportedException}. Use it as a base
 * class. */
abstract class AbstractResultSet implements ResultSet {
  private boolean wasNull;

  /** Returns the value of a column in the current row.
   *
   * @param columnIndex 1-based column index */
  protected abstract @Nullable Object value(int columnIndex)
      throws SQLException;

  @Override public @Nullable Object getObject(int columnIndex)
      throws SQLException {
    final Object value = value(columnIndex);
    wasNull = value == null;
    return value;
  }

  @Override public boolean wasNull() {
    return wasNull;
  }

  @Override public @Nullable String getString(int columnIndex)
      throws SQLException {
    return JdbcUtils.toString(getObject(columnIndex));
  }

  @Override public boolean getBoolean(int columnIndex) throws SQLException {
    return JdbcUtils.toBoolean(getObject(columnIndex));
  }

  @Override public byte getByte(int columnIndex) throws SQLException {
    return JdbcUtils.toByte(getObject(columnIndex));
  }

  @Override public short getShort(int columnIndex) throws SQLException {
    return JdbcUtils.toShort(getObject(columnIndex));
  }

  @Override public int getInt(int columnIndex) throws SQLException {
    return JdbcUtils.toInt(getObject(columnIndex));
  }

  @Override public long getLong(int columnIndex) throws SQLException {
    return JdbcUtils.toLong(getObject(columnIndex));
  }

  @Override public float getFloat(int columnIndex) throws SQLException {
    return (float) JdbcUtils.toDouble(getObject(columnIndex));
  }

  @Override public double getDouble(int columnIndex) throws SQLException {
    return JdbcUtils.toDouble(getObject(columnIndex));
  }

  @SuppressWarnings("deprecation")
  @Override public @Nullable BigDecimal getBigDecimal(int columnIndex,
      int scale) throws SQLException {
    final BigDecimal v = getBigDecimal(columnIndex);
    return v == null ? null : v.setScale(scale, RoundingMode.HALF_UP);
  }

  @Override public @Nullable BigDecimal getBigDecimal(int columnIndex)
      throws SQLException {
    return JdbcUtils.toBigDecimal(getObject(columnIndex));
  }

  @Override public byte @Nullable [] getBytes(int columnIndex)
      throws SQLException {
    return JdbcUtils.toBytes(getObject(columnIndex));
  }

  @Override public @Nullable Date getDate(int columnIndex)
      throws SQLException {
    return JdbcUtils.toDate(getObject(columnIndex));
  }

  @Override public @Nullable Time getTime(int columnIndex)
      throws SQLException {
    return JdbcUtils.toTime(getObject(columnIndex));
  }

  @Override public @Nullable Timestamp getTimestamp(int columnIndex)
      throws SQLException {
    return JdbcUtils.toTimestamp(getObject(columnIndex));
  }

  @Override public @Nullable Date getDate(int columnIndex, Calendar cal)
      throws SQLException {
    return getDate(columnIndex);
  }

  @Override public @Nullable Time getTime(int columnIndex, Calendar cal)
      throws SQLException {
    return getTime(columnIndex);
  }

  @Override public @Nullable Timestamp getTimestamp(int columnIndex,
      Calendar cal) throws SQLException {
    return getTimestamp(columnIndex);
  }

  @Override public @Nullable InputStream getAsciiStream(int columnIndex)
      throws SQLException {
    final String s = getString(columnIndex);
    return s == null ? null
        : new ByteArrayInputStream(s.getBytes(StandardCharsets.US_ASCII));
  }

  @SuppressWarnings("deprecation")
  @Override public @Nullable InputStream getUnicodeStream(int columnIndex)
      throws SQLException {
    final String s = getString(columnIndex);
    return s == null ? null
        : new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_16BE));
  }

  @Override public @Nullable InputStream getBinaryStream(int columnIndex)
      throws SQLException {
    final byte[] bytes = getBytes(columnIndex);
    return bytes == null ? null : new ByteArrayInputStream(bytes);
  }

  @Override public @Nullable Reader getCharacterStream(int columnIndex)
      throws SQLException {
    final String s = getString(columnIndex);
    return s == null ? null : new StringReader(s);
  }

  @Override public @Nullable String getNString(int columnIndex)
      throws SQLException {
    return getString(columnIndex);
  }

  @Override public @Nullable Reader getNCharacterStream(int columnIndex)
      throws SQLException {
    return getCharacterStream(columnIndex);
  }

  @Override public @Nullable Object getObject(int columnIndex,
      Map<String, Class<?>> map) throws SQLException {
    return getObject(columnIndex);
  }

  @Override public <T> @Nullable T getObject(int columnIndex, Class<T> type)
      throws SQLException {
    final Object value = getObject(columnIndex);
    if (value == null) {
      return null;
    }
    if (type.isInstance(value)) {
      return type.cast(value);
    }
    if (type == String.class) {
      return type.cast(getString(columnIndex));
    } else if (type == Integer.class) {
      return type.cast(getInt(columnIndex));
    } else if (type == Long.class) {
      return type.cast(getLong(columnIndex));
    } else if (type == Short.class) {
      return type.cast(getShort(columnIndex));
    } else if (type == Byte.class) {
      return type.cast(getByte(columnIndex));
    } else if (type == Double.class) {
      return type.cast(getDouble(columnIndex));
    } else if (type == Float.class) {
      return type.cast(getFloat(columnIndex));
    } else if (type == Boolean.class) {
      return type.cast(getBoolean(columnIndex));
    } else if (type == BigDecimal.class) {
      return type.cast(getBigDecimal(columnIndex));
    } else if (type == Date.class) {
      return type.cast(getDate(columnIndex));
    } else if (type == Time.class) {
      return type.cast(getTime(columnIndex));
    } else if (type == Timestamp.class) {
      return type.cast(getTimestamp(columnIndex));
    } else if (type == byte[].class) {
      return type.cast(getBytes(columnIndex));
    }
    throw new SQLException("cannot convert value of "
        + value.getClass().getSimpleName() + " to " + type.getName());
  }

  @Override public @Nullable String getString(String columnLabel)
      throws SQLException {
    return getString(findColumn(columnLabel));
  }

  @Override public boolean getBoolean(String columnLabel)
      throws SQLException {
    return getBoolean(findColumn(columnLabel));
  }

  @Override public byte getByte(String columnLabel) throws SQLException {
    return getByte(findColumn(columnLabel));
  }

  @Override public short getShort(String columnLabel) throws SQLException {
    return getShort(findColumn(columnLabel));
  }

  @Override public int getInt(String columnLabel) throws SQLException {
    return getInt(findColumn(columnLabel));
  }

  @Override public long getLong(String columnLabel) throws SQLException {
    return getLong(findColumn(columnLabel));
  }

  @Override public float getFloat(String columnLabel) throws SQLException {
    return getFloat(findColumn(columnLabel));
  }

  @Override public double getDouble(String columnLabel) throws SQLException {
    return getDouble(findColumn(columnLabel));
  }

  @SuppressWarnings("deprecation")
  @Override public @Nullable BigDecimal getBigDecimal(String columnLabel,
      int scale) throws SQLException {
    return getBigDecimal(findColumn(columnLabel), scale);
  }

  @Override public @Nullable BigDecimal getBigDecimal(String columnLabel)
      throws SQLException {
    return getBigDecimal(findColumn(columnLabel));
  }

  @Override public byte @Nullable [] getBytes(String columnLabel)
      throws SQLException {
    return getBytes(findColumn(columnLabel));
  }

  @Override public @Nullable Date getDate(String columnLabel)
      throws SQLException {
    return getDate(findColumn(columnLabel));
  }

  @Override public @Nullable Time getTime(String columnLabel)
      throws SQLException {
    return getTime(findColumn(columnLabel));
  }

  @Override public @Nullable Timestamp getTimestamp(String columnLabel)
      throws SQLException {
    return getTimestamp(findColumn(columnLabel));
  }

  @Override public @Nullable Date getDate(String columnLabel, Calendar cal)
      throws SQLException {
    return getDate(findColumn(columnLabel), cal);
  }

  @Override public @Nullable Time getTime(String columnLabel, Calendar cal)
      throws SQLException {
    return getTime(findColumn(columnLabel), cal);
  }

  @Override public @Nullable Timestamp getTimestamp(String columnLabel,
      Calendar cal) throws SQLException {
    return getTimestamp(findColumn(columnLabel), cal);
  }

  @Override public @Nullable InputStream getAsciiStream(String columnLabel)
      throws SQLException {
    return getAsciiStream(findColumn(columnLabel));
  }

  @SuppressWarnings("deprecation")
  @Override public @Nullable InputStream getUnicodeStream(String columnLabel)
      throws SQLException {
    return getUnicodeStream(findColumn(columnLabel));
  }

  @Override public @Nullable InputStream getBinaryStream(String columnLabel)
      throws SQLException {
    return getBinaryStream(findColumn(columnLabel));
  }

  @Override public @Nullable Reader getCharacterStream(String columnLabel)
      throws SQLException {
    return getCharacterStream(findColumn(columnLabel));
  }

  @Override public @Nullable String getNString(String columnLabel)
      throws SQLException {
    return getNString(findColumn(columnLabel));
  }

  @Override public @Nullable Reader getNCharacterStream(String columnLabel)
      throws SQLException {
    return getNCharacterStream(findColumn(columnLabel));
  }

  @Override public @Nullable Object getObject(String columnLabel)
      throws SQLException {
    return getObject(findColumn(columnLabel));
  }

  @Override public @Nullable Object getObject(String columnLabel,
      Map<String, Class<?>> map) throws SQLException {
    return getObject(findColumn(columnLabel), map);
  }

  @Override public <T> @Nullable T getObject(String columnLabel,
      Class<T> type) throws SQLException {
    return getObject(findColumn(columnLabel), type);
  }

  @Override public @Nullable SQLWarning getWarnings() {
    return null;
  }

  @Override public void clearWarnings() {
  }

  @Override public String getCursorName() throws SQLException {
    throw unsupported("named cursors");
  }

  @Override public boolean isLast() throws SQLException {
    throw unsupported("isLast");
  }

  @Override public void beforeFirst() throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public void afterLast() throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public boolean first() throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public boolean last() throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public boolean absolute(int row) throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public boolean relative(int rows) throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public boolean previous() throws SQLException {
    throw unsupported("scrollable result sets");
  }

  @Override public void setFetchDirection(int direction)
      throws SQLException {
    if (direction != FETCH_FORWARD) {
      throw unsupported("scrollable result sets");
    }
  }

  @Override public int getFetchDirection() {
    return FETCH_FORWARD;
  }

  @Override public void setFetchSize(int rows) {
  }

  @Override public int getFetchSize() {
    return 0;
  }

  @Override public int getType() {
    return TYPE_FORWARD_ONLY;
  }

  @Override public int getConcurrency() {
    return CONCUR_READ_ONLY;
  }

  @Override public int getHoldability() {
    return HOLD_CURSORS_OVER_COMMIT;
  }

  @Override public boolean rowUpdated() {
    return false;
  }

  @Override public boolean rowInserted() {
    return false;
  }

  @Override public boolean rowDeleted() {
    return false;
  }

  @Override public Ref getRef(int columnIndex) throws SQLException {
    throw unsupported("REF");
  }

  @Override public Blob getBlob(int columnIndex) throws SQLException {
    throw unsupported("BLOB");
  }

  @Override public Clob getClob(int columnIndex) throws SQLException {
    throw unsupported("CLOB");
  }

  @Override public Array getArray(int columnIndex) throws SQLException {
    throw unsupported("ARRAY");
  }

  @Override public URL getURL(int columnIndex) throws SQLException {
    throw unsupported("DATALINK");
  }

  @Override public RowId getRowId(int columnIndex) throws SQLException {
    throw unsupported("ROWID");
  }

  @Override public NClob getNClob(int columnIndex) throws SQLException {
    throw unsupported("NCLOB");
  }

  @Override public SQLXML getSQLXML(int columnIndex) throws SQLException {
    throw unsupported("SQLXML");
  }

  @Override public Ref getRef(String columnLabel) throws SQLException {
    return getRef(findColumn(columnLabel));
  }

  @Override public Blob getBlob(String columnLabel) throws SQLException {
    return getBlob(findColumn(columnLabel));
  }

  @Override public Clob getClob(String columnLabel) throws SQLException {
    return getClob(findColumn(columnLabel));
  }

  @Override public Array getArray(String columnLabel) throws SQLException {
    return getArray(findColumn(columnLabel));
  }

  @Override public URL getURL(String columnLabel) throws SQLException {
    return getURL(findColumn(columnLabel));
  }

  @Override public RowId getRowId(String columnLabel) throws SQLException {
    return getRowId(findColumn(columnLabel));
  }

  @Override public NClob getNClob(String columnLabel) throws SQLException {
    return getNClob(findColumn(columnLabel));
  }

  @Override public SQLXML getSQLXML(String columnLabel) throws SQLException {
    return getSQLXML(findColumn(columnLabel));
  }

  // Updates

  @Override public void insertRow() throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void updateRow() throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void deleteRow() throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void refreshRow() throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void cancelRowUpdates() throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void moveToInsertRow() throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void moveToCurrentRow() throws SQLException {
    throw unsupported("updatable result sets");
  }

  /** Called by every {@code updateXxx} method. */
  private void update(int columnIndex) throws SQLException {
    throw unsupported("updatable result sets");
  }

  private void update(String columnLabel) throws SQLException {
    throw unsupported("updatable result sets");
  }

  @Override public void updateNull(int columnIndex) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBoolean(int columnIndex, boolean x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateByte(int columnIndex, byte x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateShort(int columnIndex, short x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateInt(int columnIndex, int x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateLong(int columnIndex, long x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateFloat(int columnIndex, float x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateDouble(int columnIndex, double x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBigDecimal(int columnIndex, BigDecimal x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateString(int columnIndex, String x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBytes(int columnIndex, byte[] x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateDate(int columnIndex, Date x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateTime(int columnIndex, Time x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateTimestamp(int columnIndex, Timestamp x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateAsciiStream(int columnIndex, InputStream x,
      int length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBinaryStream(int columnIndex, InputStream x,
      int length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateCharacterStream(int columnIndex, Reader x,
      int length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateObject(int columnIndex, Object x,
      int scaleOrLength) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateObject(int columnIndex, Object x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateRef(int columnIndex, Ref x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBlob(int columnIndex, Blob x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateClob(int columnIndex, Clob x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateArray(int columnIndex, Array x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateRowId(int columnIndex, RowId x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNString(int columnIndex, String nString)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNClob(int columnIndex, NClob nClob)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateSQLXML(int columnIndex, SQLXML xmlObject)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNCharacterStream(int columnIndex, Reader x,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateAsciiStream(int columnIndex, InputStream x,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBinaryStream(int columnIndex, InputStream x,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateCharacterStream(int columnIndex, Reader x,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBlob(int columnIndex, InputStream inputStream,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateClob(int columnIndex, Reader reader,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNClob(int columnIndex, Reader reader,
      long length) throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNCharacterStream(int columnIndex, Reader x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateAsciiStream(int columnIndex, InputStream x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBinaryStream(int columnIndex, InputStream x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateCharacterStream(int columnIndex, Reader x)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateBlob(int columnIndex, InputStream inputStream)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateClob(int columnIndex, Reader reader)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNClob(int columnIndex, Reader reader)
      throws SQLException {
    update(columnIndex);
  }

  @Override public void updateNull(String columnLabel) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBoolean(String columnLabel, boolean x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateByte(String columnLabel, byte x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateShort(String columnLabel, short x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateInt(String columnLabel, int x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateLong(String columnLabel, long x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateFloat(String columnLabel, float x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateDouble(String columnLabel, double x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBigDecimal(String columnLabel, BigDecimal x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateString(String columnLabel, String x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBytes(String columnLabel, byte[] x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateDate(String columnLabel, Date x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateTime(String columnLabel, Time x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateTimestamp(String columnLabel, Timestamp x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateAsciiStream(String columnLabel, InputStream x,
      int length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBinaryStream(String columnLabel, InputStream x,
      int length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateCharacterStream(String columnLabel,
      Reader reader, int length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateObject(String columnLabel, Object x,
      int scaleOrLength) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateObject(String columnLabel, Object x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateRef(String columnLabel, Ref x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBlob(String columnLabel, Blob x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateClob(String columnLabel, Clob x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateArray(String columnLabel, Array x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateRowId(String columnLabel, RowId x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateNString(String columnLabel, String nString)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateNClob(String columnLabel, NClob nClob)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateSQLXML(String columnLabel, SQLXML xmlObject)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateNCharacterStream(String columnLabel,
      Reader reader, long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateAsciiStream(String columnLabel, InputStream x,
      long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBinaryStream(String columnLabel, InputStream x,
      long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateCharacterStream(String columnLabel,
      Reader reader, long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBlob(String columnLabel,
      InputStream inputStream, long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateClob(String columnLabel, Reader reader,
      long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateNClob(String columnLabel, Reader reader,
      long length) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateNCharacterStream(String columnLabel,
      Reader reader) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateAsciiStream(String columnLabel, InputStream x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBinaryStream(String columnLabel, InputStream x)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateCharacterStream(String columnLabel,
      Reader reader) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateBlob(String columnLabel,
      InputStream inputStream) throws SQLException {
    update(columnLabel);
  }

  @Override public void updateClob(String columnLabel, Reader reader)
      throws SQLException {
    update(columnLabel);
  }

  @Override public void updateNClob(String columnLabel, Reader reader)
      throws SQLException {
    update(columnLabel);
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

// End AbstractResultSet.java
