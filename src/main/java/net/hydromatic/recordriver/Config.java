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

import java.util.Properties;

/** Configuration of a {@link RecordDriver} and its connections.
 *
 * <p>Immutable. Created via {@link RecordDriver#config()}.
 */
public interface Config {
  /** Name of the connection property that overrides {@link #mode()}. */
  String MODE_PROPERTY = "mode";

  /** Name of the connection property that overrides
   * {@link #deleteOnClose()}. */
  String DELETE_ON_CLOSE_PROPERTY = "deleteOnClose";

  Mode mode();

  /** Whether closing a connection deletes its session. Default true. */
  boolean deleteOnClose();

  Config withMode(Mode mode);
  Config withDeleteOnClose(boolean deleteOnClose);

  /** Returns a configuration with values overridden by connection properties
   * ({@link #MODE_PROPERTY}, {@link #DELETE_ON_CLOSE_PROPERTY}); properties
   * that are absent leave the value unchanged.
   *
   * @throws IllegalArgumentException if a property value is invalid */
  Config withProperties(Properties properties);
}

// End Config.java
