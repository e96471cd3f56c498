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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.IsNull.notNullValue;
import static org.junit.jupiter.api.Assertions.fail;

/** Tests {@link SessionRegistry} and {@link Session}. */
public class SessionRegistryTest {
  @Test void testEnsureSession() {
    final SessionRegistry registry = new SessionRegistry();
    assertThat(registry.lookup("s1"), nullValue());
    assertThat(registry.session("s1").isPresent(), is(false));

    final Session session = registry.ensureSession("s1");
    assertThat(session.name(), is("s1"));
    assertThat(session.queries(), empty());
    assertThat(session.statements(), empty());
    assertThat(registry.ensureSession("s1"), sameInstance(session));
    assertThat(registry.lookup("s1"), sameInstance(session));
    assertThat(registry.session("s1").get(), sameInstance(session));
    assertThat(registry.sessionNames(), hasSize(1));
  }

  /** Registering a response creates the session. */
  @Test void testSetResponseCreatesSession() {
    final SessionRegistry registry = new SessionRegistry();
    final Response response = Response.builder().columns("x").build();
    registry.setResponse("s1", "select 1", response);
    final Session session = registry.lookup("s1");
    assertThat(session, notNullValue());
    assertThat(session.response("select 1"), sameInstance(response));
    assertThat(session.response("select 2"), nullValue());

    // A second registration for the same text replaces the first.
    final Response response2 = Response.builder().columns("y").build();
    registry.setResponse("s1", "select 1", response2);
    assertThat(session.response("select 1"), sameInstance(response2));
  }

  @Test void testIsolation() {
    final SessionRegistry registry = new SessionRegistry();
    registry.ensureSession("a");
    registry.ensureSession("b");
    registry.recordStatement("a", "create table t (i int)");
    registry.recordQuery("a", "select * from t");
    registry.recordStatement("b", "drop table u");
    assertThat(registry.lookup("a").statements(),
        is(Arrays.asList("create table t (i int)")));
    assertThat(registry.lookup("a").queries(),
        is(Arrays.asList("select * from t")));
    assertThat(registry.lookup("b").statements(),
        is(Arrays.asList("drop table u")));
    assertThat(registry.lookup("b").queries(), empty());
  }

  /** Queries and statements are logged separately, each in execution
   * order. */
  @Test void testOrdering() {
    final SessionRegistry registry = new SessionRegistry();
    registry.ensureSession("s");
    registry.recordQuery("s", "q1");
    registry.recordStatement("s", "s1");
    registry.recordQuery("s", "q2");
    registry.recordQuery("s", "q1");
    registry.recordStatement("s", "s2");
    registry.recordQuery("s", "q3");
    final Session session = registry.lookup("s");
    assertThat(session.queries(), is(Arrays.asList("q1", "q2", "q1", "q3")));
    assertThat(session.statements(), is(Arrays.asList("s1", "s2")));
    assertThat(session.script(), is("s1;\ns2;\n"));
  }

  @Test void testScriptOfEmptySession() {
    final SessionRegistry registry = new SessionRegistry();
    assertThat(registry.ensureSession("s").script(), is(""));
  }

  /** Snapshots returned by a session do not change when more commands are
   * recorded. */
  @Test void testSnapshots() {
    final SessionRegistry registry = new SessionRegistry();
    final Session session = registry.ensureSession("s");
    registry.recordQuery("s", "q1");
    final List<String> queries = session.queries();
    registry.recordQuery("s", "q2");
    assertThat(queries, is(Arrays.asList("q1")));
    assertThat(session.queries(), is(Arrays.asList("q1", "q2")));
  }

  @Test void testExactMatchDispatch() {
    final SessionRegistry registry = new SessionRegistry();
    final Response response =
        Response.builder().columns("id").row(1).build();
    registry.setResponse("s", "SELECT * FROM t", response);
    assertThat(registry.recordQuery("s", "SELECT * FROM t"),
        sameInstance(response));

    // Anything else, even a difference in case or whitespace, gets an
    // empty response.
    for (String sql
        : Arrays.asList("select * from t", "SELECT *  FROM t",
            "SELECT * FROM t ", " SELECT * FROM t", "SELECT * FROM t;")) {
      final Response other = registry.recordQuery("s", sql);
      assertThat(other, not(sameInstance(response)));
      assertThat(other.columns(), empty());
      assertThat(other.next(), nullValue());
    }
    assertThat(registry.lookup("s").queries(), hasSize(6));
  }

  /** Responses belong to one session only. */
  @Test void testResponseIsPerSession() {
    final SessionRegistry registry = new SessionRegistry();
    final Response response =
        Response.builder().columns("id").row(1).build();
    registry.setResponse("a", "q", response);
    registry.ensureSession("b");
    assertThat(registry.recordQuery("b", "q").columns(), empty());
    assertThat(registry.recordQuery("a", "q"), sameInstance(response));
  }

  /** The registered response is shared by reference, so a second execution
   * sees the rows that the first left behind. */
  @Test void testNoRestart() {
    final SessionRegistry registry = new SessionRegistry();
    registry.setResponse("s", "q",
        Response.builder().columns("id").row(1).row(2).build());
    final Response first = registry.recordQuery("s", "q");
    assertThat(first.next(), is(Arrays.<Object>asList(1)));
    final Response second = registry.recordQuery("s", "q");
    assertThat(second, sameInstance(first));
    assertThat(second.next(), is(Arrays.<Object>asList(2)));
    assertThat(second.next(), nullValue());
    assertThat(registry.recordQuery("s", "q").next(), nullValue());
  }

  @Test void testDeleteResetsSession() {
    final SessionRegistry registry = new SessionRegistry();
    registry.setResponse("s", "q",
        Response.builder().columns("id").row(1).build());
    registry.recordQuery("s", "q");
    registry.recordStatement("s", "st");
    registry.deleteSession("s");
    assertThat(registry.lookup("s"), nullValue());
    assertThat(registry.sessionNames(), empty());

    // Deleting again does nothing.
    registry.deleteSession("s");
    registry.deleteSession("never-created");

    final Session session = registry.ensureSession("s");
    assertThat(session.queries(), empty());
    assertThat(session.statements(), empty());
    assertThat(session.response("q"), nullValue());
    assertThat(registry.recordQuery("s", "q").columns(), empty());
  }

  @Test void testClear() {
    final SessionRegistry registry = new SessionRegistry();
    registry.ensureSession("a");
    registry.setResponse("b", "q", Response.empty());
    assertThat(registry.sessionNames().toString(), is("[a, b]"));
    registry.clear();
    assertThat(registry.sessionNames(), empty());
  }

  /** Recording against a session that was never opened is a programming
   * error. */
  @Test void testUnknownSession() {
    final SessionRegistry registry = new SessionRegistry();
    try {
      registry.recordQuery("nope", "select 1");
      fail("expected error");
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), is("unknown session 'nope'"));
    }
    try {
      registry.recordStatement("nope", "drop table t");
      fail("expected error");
    } catch (IllegalStateException e) {
      assertThat(e.getMessage(), is("unknown session 'nope'"));
    }
    assertThat(registry.lookup("nope"), nullValue());
  }

  /** Many threads recording into their own sessions, and into one shared
   * session, lose nothing and keep each thread's order. */
  @Test void testConcurrentRecording() throws Exception {
    final SessionRegistry registry = new SessionRegistry();
    final int threadCount = 8;
    final int commandCount = 500;
    registry.ensureSession("shared");
    final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
    try {
      final CountDownLatch start = new CountDownLatch(1);
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threadCount; t++) {
        final String name = "s" + t;
        futures.add(
            executor.submit(() -> {
              start.await();
              registry.ensureSession(name);
              registry.setResponse(name, "q",
                  Response.builder().columns("t").row(name).build());
              for (int i = 0; i < commandCount; i++) {
                registry.recordQuery(name, "q" + i);
                registry.recordStatement(name, "s" + i);
                registry.recordStatement("shared", name + ":" + i);
              }
              return null;
            }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(1, TimeUnit.MINUTES);
      }
    } finally {
      executor.shutdownNow();
    }

    for (int t = 0; t < threadCount; t++) {
      final String name = "s" + t;
      final Session session = registry.lookup(name);
      final List<String> queries = session.queries();
      final List<String> statements = session.statements();
      assertThat(queries, hasSize(commandCount));
      assertThat(statements, hasSize(commandCount));
      for (int i = 0; i < commandCount; i++) {
        assertThat(queries.get(i), is("q" + i));
        assertThat(statements.get(i), is("s" + i));
      }
      assertThat(registry.recordQuery(name, "q").next(),
          is(Arrays.<Object>asList(name)));
    }

    final List<String> shared = registry.lookup("shared").statements();
    assertThat(shared, hasSize(threadCount * commandCount));
    final int[] next = new int[threadCount];
    for (String statement : shared) {
      final int colon = statement.indexOf(':');
      final int t = Integer.parseInt(statement.substring(1, colon));
      final int i = Integer.parseInt(statement.substring(colon + 1));
      assertThat(i, is(next[t]++));
    }
  }
}

// End SessionRegistryTest.java
