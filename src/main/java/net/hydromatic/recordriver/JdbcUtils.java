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

import com.google.common.collect.BiMap;
import com.google.common.collect.ImmutableBiMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.sql.Date;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static java.lang.String.format;

/** JDBC utilities. */
abstract class JdbcUtils {
  // utility class
  private JdbcUtils() {
  }

  /** Names and values of fields in {@link Types}. */
  private static final BiMap<String, Integer> JDBC_TYPES;

  static {
    final ImmutableBiMap.Builder<String, Integer> builder =
        ImmutableBiMap.builder();
    for (Field field : Types.class.getFields()) {
      if ((field.getModifiers() & Modifier.STATIC) != 0
          && field.getType() == int.class) {
        try {
          builder.put(field.getName(), field.getInt(null));
        } catch (IllegalAccessException e) {
          throw new AssertionError(e);
        }
      }
    }
    JDBC_TYPES = builder.build();
  }

  /** Returns the name of a JDBC type, e.g. "INTEGER" for
   * {@link Types#INTEGER}. */
  static String typeName(int type) {
    final String typeName = JDBC_TYPES.inverse().get(type);
    return typeName != null ? typeName : "type" + type;
  }

  /** Deduces the JDBC type of a column from a sample value. */
  static int jdbcType(@Nullable Object value) {
    if (value == null) {
      return Types.NULL;
    } else if (value instanceof String) {
      return Types.VARCHAR;
    } else if (value instanceof Integer) {
      return Types.INTEGER;
    } else if (value instanceof Long) {
      return Types.BIGINT;
    } else if (value instanceof Short) {
      return Types.SMALLINT;
    } else if (value instanceof Byte) {
      return Types.TINYINT;
    } else if (value instanceof Double) {
      return Types.DOUBLE;
    } else if (value instanceof Float) {
      return Types.REAL;
    } else if (value instanceof BigDecimal || value instanceof BigInteger) {
      return Types.DECIMAL;
    } else if (value instanceof Boolean) {
      return Types.BOOLEAN;
    } else if (value instanceof Date || value instanceof LocalDate) {
      return Types.DATE;
    } else if (value instanceof Time || value instanceof LocalTime) {
      return Types.TIME;
    } else if (value instanceof java.util.Date
        || value instanceof LocalDateTime) {
      return Types.TIMESTAMP;
    } else if (value instanceof byte[]) {
      return Types.VARBINARY;
    } else {
      return Types.JAVA_OBJECT;
    }
  }

  static SQLFeatureNotSupportedException unsupported(String feature) {
    return new SQLFeatureNotSupportedException(
        format("recordriver does not support %s", feature));
  }

  static @Nullable String toString(@Nullable Object value) {
    if (value == null) {
      return null;
    } else if (value instanceof byte[]) {
      return new String((byte[]) value, StandardCharsets.UTF_8);
    } else {
      return value.toString();
    }
  }

  static boolean toBoolean(@Nullable Object value) throws SQLException {
    if (value == null) {
      return false;
    } else if (value instanceof Boolean) {
      return (Boolean) value;
    } else if (value instanceof Double || value instanceof Float
        || value instanceof BigDecimal) {
      return ((Number) value).doubleValue() != 0D;
    } else if (value instanceof BigInteger) {
      return ((BigInteger) value).signum() != 0;
    } else if (value instanceof Number) {
      return ((Number) value).longValue() != 0L;
    } else if (value instanceof String) {
      final String s = ((String) value).trim();
      if (s.equalsIgnoreCase("true") || s.equals("1")) {
        return true;
      }
      if (s.equalsIgnoreCase("false") || s.equals("0")) {
        return false;
      }
    }
    throw cannotConvert(value, "boolean");
  }

  static long toLong(@Nullable Object value) throws SQLException {
    if (value == null) {
      return 0L;
    } else if (value instanceof BigInteger) {
      try {
        return ((BigInteger) value).longValueExact();
      } catch (ArithmeticException e) {
        throw cannotConvert(value, "long", e);
      }
    } else if (value instanceof Number) {
      return ((Number) value).longValue();
    } else if (value instanceof Boolean) {
      return (Boolean) value ? 1L : 0L;
    } else if (value instanceof String) {
      try {
        return new BigDecimal(((String) value).trim()).longValueExact();
      } catch (ArithmeticException | NumberFormatException e) {
        throw cannotConvert(value, "long", e);
      }
    }
    throw cannotConvert(value, "long");
  }

  static int toInt(@Nullable Object value) throws SQLException {
    final long v = toLong(value);
    if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
      throw cannotConvert(value, "int");
    }
    return (int) v;
  }

  static short toShort(@Nullable Object value) throws SQLException {
    final long v = toLong(value);
    if (v < Short.MIN_VALUE || v > Short.MAX_VALUE) {
      throw cannotConvert(value, "short");
    }
    return (short) v;
  }

  static byte toByte(@Nullable Object value) throws SQLException {
    final long v = toLong(value);
    if (v < Byte.MIN_VALUE || v > Byte.MAX_VALUE) {
      throw cannotConvert(value, "byte");
    }
    return (byte) v;
  }

  static double toDouble(@Nullable Object value) throws SQLException {
    if (value == null) {
      return 0D;
    } else if (value instanceof Number) {
      return ((Number) value).doubleValue();
    } else if (value instanceof String) {
      try {
        return Double.parseDouble(((String) value).trim());
      } catch (NumberFormatException e) {
        throw cannotConvert(value, "double", e);
      }
    }
    throw cannotConvert(value, "double");
  }

  static @Nullable BigDecimal toBigDecimal(@Nullable Object value)
      throws SQLException {
    if (value == null) {
      return null;
    } else if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    } else if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue());
    } else if (value instanceof Number) {
      return BigDecimal.valueOf(((Number) value).longValue());
    } else if (value instanceof String) {
      try {
        return new BigDecimal(((String) value).trim());
      } catch (NumberFormatException e) {
        throw cannotConvert(value, "BigDecimal", e);
      }
    }
    throw cannotConvert(value, "BigDecimal");
  }

  static byte @Nullable [] toBytes(@Nullable Object value)
      throws SQLException {
    if (value == null) {
      return null;
    } else if (value instanceof byte[]) {
      return (byte[]) value;
    } else if (value instanceof String) {
      return ((String) value).getBytes(StandardCharsets.UTF_8);
    }
    throw cannotConvert(value, "byte[]");
  }

  static @Nullable Date toDate(@Nullable Object value) throws SQLException {
    if (value == null) {
      return null;
    } else if (value instanceof Date) {
      return (Date) value;
    } else if (value instanceof LocalDate) {
      return Date.valueOf((LocalDate) value);
    } else if (value instanceof java.util.Date) {
      return new Date(((java.util.Date) value).getTime());
    } else if (value instanceof String) {
      try {
        return Date.valueOf(((String) value).trim());
      } catch (IllegalArgumentException e) {
        throw cannotConvert(value, "Date", e);
      }
    }
    throw cannotConvert(value, "Date");
  }

  static @Nullable Time toTime(@Nullable Object value) throws SQLException {
    if (value == null) {
      return null;
    } else if (value instanceof Time) {
      return (Time) value;
    } else if (value instanceof LocalTime) {
      return Time.valueOf((LocalTime) value);
    } else if (value instanceof String) {
      try {
        return Time.valueOf(((String) value).trim());
      } catch (IllegalArgumentException e) {
        throw cannotConvert(value, "Time", e);
      }
    }
    throw cannotConvert(value, "Time");
  }

  static @Nullable Timestamp toTimestamp(@Nullable Object value)
      throws SQLException {
    if (value == null) {
      return null;
    } else if (value instanceof Timestamp) {
      return (Timestamp) value;
    } else if (value instanceof LocalDateTime) {
      return Timestamp.valueOf((LocalDateTime) value);
    } else if (value instanceof java.util.Date) {
      return new Timestamp(((java.util.Date) value).getTime());
    } else if (value instanceof String) {
      try {
        return Timestamp.valueOf(((String) value).trim());
      } catch (IllegalArgumentException e) {
        throw cannotConvert(value, "Timestamp", e);
      }
    }
    throw cannotConvert(value, "Timestamp");
  }

  private static SQLException cannotConvert(Object value, String type) {
    return new SQLException(
        format("cannot convert value '%s' of %s to %s", value,
            value.getClass().getSimpleName(), type));
  }

  private static SQLException cannotConvert(Object value, String type,
      Exception cause) {
    final SQLException e = cannotConvert(value, type);
    e.initCause(cause);
    return e;
  }
}

// End JdbcUtils.java
