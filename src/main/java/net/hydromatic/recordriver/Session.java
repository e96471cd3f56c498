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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

import static java.util.Objects.requireNonNull;

/** Recording state of one named connection.
 *
 * <p>A session holds the queries and statements that have been executed
 * against it, in execution order, and the responses that have been registered
 * for particular queries.
 *
 * <p>The logs are append-only. A session lives in its {@link SessionRegistry}
 * from the moment its name is first referenced until it is deleted, typically
 * when its connection is closed.
 *
 * <p>All state is guarded by the registry's lock. The mutating methods are
 * package-private and are called only by the registry while it holds the
 * lock; the public accessors acquire the lock and return snapshots. */
public class Session {
  private final String name;
  private final Lock lock;
  private final List<String> queries = new ArrayList<>();
  private final List<String> statements = new ArrayList<>();
  private final Map<String, Response> responses = new HashMap<>();

  Session(String name, Lock lock) {
    this.name = requireNonNull(name, "name");
    this.lock = requireNonNull(lock, "lock");
  }

  /** Returns the name of this session. */
  public String name() {
    return name;
  }

  /** Returns the queries (row-returning commands) executed so far, in
   * order. */
  public List<String> queries() {
    lock.lock();
    try {
      return ImmutableList.copyOf(queries);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the statements (commands that do not return rows) executed so
   * far, in order. */
  public List<String> statements() {
    lock.lock();
    try {
      return ImmutableList.copyOf(statements);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the statements as a script; each statement is followed by a
   * semicolon and a newline.
   *
   * <p>For example, after "CREATE TABLE t (i INT)" and "DROP TABLE t",
   * returns "{@code CREATE TABLE t (i INT);\nDROP TABLE t;\n}". */
  public String script() {
    final StringBuilder b = new StringBuilder();
    for (String statement : statements()) {
      b.append(statement).append(";\n");
    }
    return b.toString();
  }

  /** Returns the response registered for a query, or null. */
  public @Nullable Response response(String query) {
    lock.lock();
    try {
      return responses.get(query);
    } finally {
      lock.unlock();
    }
  }

  @Override public String toString() {
    return "Session{" + name + "}";
  }

  void putResponse(String query, Response response) {
    responses.put(query, response);
  }

  void addStatement(String sql) {
    statements.add(sql);
  }

  /** Appends a query to the log and returns the response registered for
   * exactly that text, or null. */
  @Nullable Response addQuery(String sql) {
    queries.add(sql);
    return responses.get(sql);
  }
}

// End Session.java
