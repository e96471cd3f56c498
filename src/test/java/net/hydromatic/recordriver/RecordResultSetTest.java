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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.fail;

/** Tests {@link RecordResultSet}. */
public class RecordResultSetTest {
  private static ResultSet resultSet(Response response) {
    return new RecordResultSet(null, response);
  }

  @Test void testGetters() throws SQLException {
    final ResultSet r =
        resultSet(
            Response.builder()
                .columns("i", "s", "d", "b", "n", "dt")
                .row(7, "12", 2.5D, true, new BigDecimal("3.10"),
                    LocalDate.of(2024, 2, 29))
                .build());
    assertThat(r.next(), is(true));
    assertThat(r.getInt(1), is(7));
    assertThat(r.getLong("I"), is(7L));
    assertThat(r.getString(1), is("7"));
    assertThat(r.getDouble(1), is(7D));
    assertThat(r.getInt(2), is(12));
    assertThat(r.getString("s"), is("12"));
    assertThat(r.getDouble(3), is(2.5D));
    assertThat(r.getBigDecimal(3), hasToString("2.5"));
    assertThat(r.getBoolean(4), is(true));
    assertThat(r.getBigDecimal(5), hasToString("3.10"));
    assertThat(r.getBigDecimal(5, 1), hasToString("3.1"));
    assertThat(r.getDate(6), is(Date.valueOf("2024-02-29")));
    assertThat(r.getObject(6, LocalDate.class), is(LocalDate.of(2024, 2, 29)));
    assertThat(r.getObject(1, Long.class), is(7L));
    assertThat(r.getObject(1, String.class), is("7"));
    assertThat(r.next(), is(false));
  }

  @Test void testNull() throws SQLException {
    final ResultSet r =
        resultSet(Response.builder().columns("a", "b").row(null, 1).build());
    assertThat(r.next(), is(true));
    assertThat(r.getString(1), nullValue());
    assertThat(r.wasNull(), is(true));
    assertThat(r.getInt(1), is(0));
    assertThat(r.wasNull(), is(true));
    assertThat(r.getInt(2), is(1));
    assertThat(r.wasNull(), is(false));
    assertThat(r.getTimestamp(1), nullValue());
  }

  @Test void testStringConversions() throws SQLException {
    final ResultSet r =
        resultSet(
            Response.builder()
                .columns("ts", "bad")
                .row("2024-01-02 03:04:05", "abc")
                .build());
    assertThat(r.next(), is(true));
    assertThat(r.getTimestamp(1),
        is(Timestamp.valueOf("2024-01-02 03:04:05")));
    try {
      r.getInt(2);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("cannot convert value 'abc' of String to long"));
    }
  }

  /** Values too large for the requested type are an error, not a silently
   * truncated value. */
  @Test void testNarrowingOutOfRange() throws SQLException {
    final ResultSet r =
        resultSet(
            Response.builder()
                .columns("big", "pow32", "small", "half", "huge")
                .row(5_000_000_000L, 4_294_967_296L, 100_000, 0.5D,
                    new BigInteger("18446744073709551616"))
                .build());
    assertThat(r.next(), is(true));
    assertThat(r.getLong(1), is(5_000_000_000L));
    try {
      r.getInt(1);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("cannot convert value '5000000000' of Long to int"));
    }
    try {
      r.getShort(1);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("cannot convert value '5000000000' of Long to short"));
    }
    try {
      r.getObject(2, Integer.class);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("cannot convert value '4294967296' of Long to int"));
    }
    try {
      r.getByte(3);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("cannot convert value '100000' of Integer to byte"));
    }
    assertThat(r.getInt(3), is(100_000));
    try {
      r.getLong(5);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("cannot convert value '18446744073709551616' of BigInteger"
              + " to long"));
    }

    // Non-zero values are true, however large or small.
    assertThat(r.getBoolean(1), is(true));
    assertThat(r.getBoolean(2), is(true));
    assertThat(r.getBoolean(4), is(true));
    assertThat(r.getBoolean(5), is(true));
  }

  @Test void testMetaData() throws SQLException {
    final ResultSet r =
        resultSet(
            Response.builder()
                .columns("id", "name", "x")
                .row(1, "a", null)
                .build());
    final ResultSetMetaData metaData = r.getMetaData();
    assertThat(metaData.getColumnCount(), is(3));
    assertThat(metaData.getColumnLabel(2), is("name"));
    assertThat(metaData.getColumnType(1), is(Types.INTEGER));
    assertThat(metaData.getColumnTypeName(1), is("INTEGER"));
    assertThat(metaData.getColumnType(2), is(Types.VARCHAR));
    assertThat(metaData.getColumnType(3), is(Types.VARCHAR));
    try {
      metaData.getColumnName(4);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("column 4 out of range; result set has 3 columns"));
    }
    // Deducing types does not consume the row.
    assertThat(r.next(), is(true));
    assertThat(r.getInt(1), is(1));
  }

  @Test void testCursor() throws SQLException {
    final ResultSet r =
        resultSet(Response.builder().columns("c").row(1).row(2).build());
    assertThat(r.isBeforeFirst(), is(true));
    assertThat(r.getRow(), is(0));
    try {
      r.getInt(1);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(), is("no current row"));
    }
    assertThat(r.next(), is(true));
    assertThat(r.isFirst(), is(true));
    assertThat(r.getRow(), is(1));
    assertThat(r.next(), is(true));
    assertThat(r.getRow(), is(2));
    assertThat(r.next(), is(false));
    assertThat(r.isAfterLast(), is(true));
    assertThat(r.getRow(), is(0));
    assertThat(r.next(), is(false));
    assertThat(r.getType(), is(ResultSet.TYPE_FORWARD_ONLY));
    assertThat(r.getConcurrency(), is(ResultSet.CONCUR_READ_ONLY));
  }

  @Test void testBadColumn() throws SQLException {
    final ResultSet r =
        resultSet(Response.builder().columns("c").row(1).build());
    assertThat(r.next(), is(true));
    try {
      r.getInt("d");
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(), is("column 'd' not found"));
    }
    try {
      r.getInt(2);
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(),
          is("column index 2 out of range; row has 1 values"));
    }
  }

  /** Closing a result set leaves unread rows in the response. */
  @Test void testCloseLeavesUnreadRows() throws SQLException {
    final Response response =
        Response.builder().columns("c").row(1).row(2).build();
    final ResultSet r = resultSet(response);
    assertThat(r.next(), is(true));
    r.close();
    assertThat(r.isClosed(), is(true));
    try {
      r.next();
      fail("expected error");
    } catch (SQLException e) {
      assertThat(e.getMessage(), is("result set is closed"));
    }
    final ResultSet r2 = resultSet(response);
    assertThat(r2.next(), is(true));
    assertThat(r2.getInt(1), is(2));
    assertThat(r2.next(), is(false));
  }

  @Test void testUpdatesAreUnsupported() throws SQLException {
    final ResultSet r =
        resultSet(Response.builder().columns("c").row(1).build());
    assertThat(r.next(), is(true));
    try {
      r.updateInt(1, 2);
      fail("expected error");
    } catch (SQLFeatureNotSupportedException e) {
      assertThat(e.getMessage(),
          is("recordriver does not support updatable result sets"));
    }
    try {
      r.previous();
      fail("expected error");
    } catch (SQLFeatureNotSupportedException e) {
      assertThat(e.getMessage(),
          is("recordriver does not support scrollable result sets"));
    }
  }
}

// End RecordResultSetTest.java
