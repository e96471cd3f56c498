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
import java.sql.Types;
import java.util.List;

import static java.lang.String.format;

/** Metadata of a {@link RecordResultSet}.
 *
 * <p>Column names come from the response. Column types are deduced from the
 * first row that had not been read when the result set was created; if there
 * is no such row, or a value is null, the type is {@link Types#VARCHAR}. */
class RecordResultSetMetaData implements ResultSetMetaData {
  private final ImmutableList<String> names;
  private final ImmutableList<Integer> types;

  RecordResultSetMetaData(List<String> names,
      @Nullable List<@Nullable Object> sampleRow) {
    this.names = ImmutableList.copyOf(names);
    final ImmutableList.Builder<Integer> types = ImmutableList.builder();
    for (int i = 0; i < names.size(); i++) {
      final int type =
          sampleRow == null || i >= sampleRow.size()
              ? Types.NULL
              : JdbcUtils.jdbcType(sampleRow.get(i));
      types.add(type == Types.NULL ? Types.VARCHAR : type);
    }
    this.types = types.build();
  }

  private int check(int column) throws SQLException {
    if (column < 1 || column > names.size()) {
      throw new SQLException(
          format("column %d out of range; result set has %d columns",
              column, names.size()));
    }
    return column - 1;
  }

  @Override public int getColumnCount() {
    return names.size();
  }

  @Override public String getColumnName(int column) throws SQLException {
    return names.get(check(column));
  }

  @Override public String getColumnLabel(int column) throws SQLException {
    return getColumnName(column);
  }

  @Override public int getColumnType(int column) throws SQLException {
    return types.get(check(column));
  }

  @Override public String getColumnTypeName(int column) throws SQLException {
    return JdbcUtils.typeName(getColumnType(column));
  }

  @Override public String getColumnClassName(int column)
      throws SQLException {
    check(column);
    return Object.class.getName();
  }

  @Override public boolean isAutoIncrement(int column) {
    return false;
  }

  @Override public boolean isCaseSensitive(int column) {
    return true;
  }

  @Override public boolean isSearchable(int column) {
    return false;
  }

  @Override public boolean isCurrency(int column) {
    return false;
  }

  @Override public int isNullable(int column) {
    return columnNullableUnknown;
  }

  @Override public boolean isSigned(int column) {
    return false;
  }

  @Override public int getColumnDisplaySize(int column) {
    return 0;
  }

  @Override public String getSchemaName(int column) {
    return "";
  }

  @Override public int getPrecision(int column) {
    return 0;
  }

  @Override public int getScale(int column) {
    return 0;
  }

  @Override public String getTableName(int column) {
    return "";
  }

  @Override public String getCatalogName(int column) {
    return "";
  }

  @Override public boolean isReadOnly(int column) {
    return true;
  }

  @Override public boolean isWritable(int column) {
    return false;
  }

  @Override public boolean isDefinitelyWritable(int column) {
    return false;
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

// End RecordResultSetMetaData.java
