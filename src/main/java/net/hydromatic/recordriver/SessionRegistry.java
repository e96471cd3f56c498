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

import com.google.common.collect.ImmutableSortedSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.locks.ReentrantLock;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/** Table of {@link Session}s, keyed by name.
 *
 * <p>A test harness typically creates one registry per test, hands it to a
 * {@link RecordDriver}, and discards it at teardown.
 *
 * <p>Every operation holds a single lock for its full duration, so operations
 * on different sessions serialize against each other. The lock also guards
 * each session's logs and response map. It does not guard the rows of a
 * {@link Response}; see that class.
 *
 * <p>There is at most one session per name at a time. After a session is
 * deleted its name may be reused, and the next reference creates a new, empty
 * session. */
public class SessionRegistry {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SessionRegistry.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Session> sessions = new HashMap<>();

  /** Creates an empty registry. */
  public SessionRegistry() {
  }

  /** Returns the session with the given name, creating an empty one if it
   * does not exist. */
  public Session ensureSession(String name) {
    requireNonNull(name, "name");
    lock.lock();
    try {
      return ensure(name);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the session with the given name, or null if it does not exist.
   * Never creates a session. */
  public @Nullable Session lookup(String name) {
    requireNonNull(name, "name");
    lock.lock();
    try {
      return sessions.get(name);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the session with the given name, if it exists. */
  public Optional<Session> session(String name) {
    return Optional.ofNullable(lookup(name));
  }

  /** Registers the response to return when {@code query} is executed in the
   * named session, replacing any previous response for the same text.
   *
   * <p>Creates the session if it does not exist. The query is matched by
   * exact text: case, whitespace and parameter markers all count, and values
   * bound to parameters are ignored. */
  public void setResponse(String name, String query, Response response) {
    requireNonNull(name, "name");
    requireNonNull(query, "query");
    requireNonNull(response, "response");
    lock.lock();
    try {
      ensure(name).putResponse(query, response);
    } finally {
      lock.unlock();
    }
  }

  /** Removes the session with the given name. Does nothing if there is no
   * such session. */
  public void deleteSession(String name) {
    requireNonNull(name, "name");
    lock.lock();
    try {
      if (sessions.remove(name) != null) {
        LOGGER.debug("Deleted session '{}'", name);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Appends a statement (a command that returns no rows) to the named
   * session's log.
   *
   * @throws IllegalStateException if the session does not exist */
  public void recordStatement(String name, String sql) {
    requireNonNull(sql, "sql");
    lock.lock();
    try {
      existing(name).addStatement(sql);
      LOGGER.trace("Session '{}' executed statement [{}]", name, sql);
    } finally {
      lock.unlock();
    }
  }

  /** Appends a query to the named session's log and returns the response
   * registered for exactly that text, or a new empty response if there is
   * none.
   *
   * <p>A registered response is returned by reference; reading its rows
   * consumes them for every later execution of the same query.
   *
   * @throws IllegalStateException if the session does not exist */
  public Response recordQuery(String name, String sql) {
    final Response response = recordQueryIfRegistered(name, sql);
    return response != null ? response : Response.empty();
  }

  /** As {@link #recordQuery(String, String)}, but returns null if no response
   * is registered. The query is logged either way. */
  @Nullable Response recordQueryIfRegistered(String name, String sql) {
    requireNonNull(sql, "sql");
    lock.lock();
    try {
      final Response response = existing(name).addQuery(sql);
      if (response == null) {
        LOGGER.debug("Session '{}' has no response for query [{}]", name,
            sql);
      } else {
        LOGGER.trace("Session '{}' executed query [{}]", name, sql);
      }
      return response;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the names of the sessions that currently exist, sorted. */
  public SortedSet<String> sessionNames() {
    lock.lock();
    try {
      return ImmutableSortedSet.copyOf(sessions.keySet());
    } finally {
      lock.unlock();
    }
  }

  /** Removes all sessions. */
  public void clear() {
    lock.lock();
    try {
      sessions.clear();
    } finally {
      lock.unlock();
    }
  }

  private Session ensure(String name) {
    Session session = sessions.get(name);
    if (session == null) {
      session = new Session(name, lock);
      sessions.put(name, session);
      LOGGER.debug("Created session '{}'", name);
    }
    return session;
  }

  private Session existing(String name) {
    requireNonNull(name, "name");
    final Session session = sessions.get(name);
    if (session == null) {
      throw new IllegalStateException(format("unknown session '%s'", name));
    }
    return session;
  }
}

// End SessionRegistry.java
