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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Canned result set that is returned when a registered query is executed.
 *
 * <p>A response has a list of column names and a queue of rows. Rows are
 * consumed destructively: each call to {@link #next()} removes the row it
 * returns. A response is shared by every execution of its query within a
 * session, so executing the same query twice returns the same, partially or
 * fully drained, response. To start again, register a new response.
 *
 * <p>Reading rows is not guarded by the {@link SessionRegistry} lock; a
 * response must be read by one thread at a time.
 */
public class Response {
  private final ImmutableList<String> columns;
  private final Deque<List<@Nullable Object>> rows;

  private Response(ImmutableList<String> columns,
      Deque<List<@Nullable Object>> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  /** Creates a response with the given columns and rows.
   *
   * <p>Each row should have as many values as there are columns; this is not
   * checked. */
  public static Response of(List<String> columns,
      List<? extends List<?>> rows) {
    final Deque<List<@Nullable Object>> deque = new ArrayDeque<>();
    for (List<?> row : rows) {
      // ArrayDeque does not accept null elements, but a row's values may be
      // null, so each row is copied into a list that allows them.
      deque.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    return new Response(ImmutableList.copyOf(columns), deque);
  }

  /** Creates a response with no columns and no rows. */
  public static Response empty() {
    return new Response(ImmutableList.of(), new ArrayDeque<>());
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the column names, in the order they were registered. */
  public List<String> columns() {
    return columns;
  }

  /** Returns the next row and removes it from this response, or returns
   * null if there are no more rows (end of data). */
  public @Nullable List<@Nullable Object> next() {
    return rows.pollFirst();
  }

  /** Returns the next row without removing it, or null. */
  @Nullable List<@Nullable Object> peek() {
    return rows.peekFirst();
  }

  /** Returns whether all rows have been consumed. */
  public boolean isExhausted() {
    return rows.isEmpty();
  }

  /** Returns the number of rows not yet consumed. */
  public int remaining() {
    return rows.size();
  }

  /** Closes this response. Does nothing; rows that have been consumed stay
   * consumed. */
  public void close() {
  }

  @Override public String toString() {
    return "Response{columns=" + columns + ", remaining=" + rows.size() + "}";
  }

  /** Builds a {@link Response}.
   *
   * <p>For example,
   *
   * <blockquote><pre>
   * Response.builder()
   *     .columns("id", "name")
   *     .row(1, "a")
   *     .row(2, "b")
   *     .build();
   * </pre></blockquote>
   */
  public static class Builder {
    private final List<String> columns = new ArrayList<>();
    private final List<List<@Nullable Object>> rows = new ArrayList<>();

    private Builder() {
    }

    /** Adds column names. */
    public Builder columns(String... names) {
      for (String name : names) {
        columns.add(requireNonNull(name, "name"));
      }
      return this;
    }

    /** Adds a row. Values may be null. */
    public Builder row(@Nullable Object... values) {
      rows.add(Arrays.asList(values.clone()));
      return this;
    }

    public Response build() {
      return of(columns, rows);
    }
  }
}

// End Response.java
