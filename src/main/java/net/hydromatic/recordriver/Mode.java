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

/** What a connection does when a query has no registered response.
 *
 * @see Config#withMode(Mode) */
public enum Mode {
  /** Returns an empty result set (no columns, no rows). */
  LENIENT,

  /** Throws {@link java.sql.SQLException}. The query is still recorded. */
  STRICT
}

// End Mode.java
