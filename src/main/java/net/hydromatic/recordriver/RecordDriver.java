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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/** JDBC driver that records queries and statements instead of executing
 * them, and answers queries with canned {@link Response}s.
 *
 * <p>The URL is "{@code jdbc:recordriver:}" followed by a session name.
 * Each connection records into the session of that name in the driver's
 * {@link SessionRegistry}; connections with the same name share a session.
 *
 * <p>A test usually creates a registry and a driver of its own:
 *
 * <blockquote><pre>
 * SessionRegistry registry = new SessionRegistry();
 * registry.setResponse("s1", "SELECT * FROM t",
 *     Response.builder().columns("id").row(1).build());
 * Driver driver = new RecordDriver(registry);
 * try (Connection c = driver.connect("jdbc:recordriver:s1", new Properties())) {
 *   ...
 * }
 * </pre></blockquote>
 *
 * <p>Code that can only obtain connections through {@link DriverManager}
 * uses the instance returned by {@link #registered()}. This class registers
 * it when it is loaded; {@code DriverManager} loads the class from
 * {@code META-INF/services}. */
public class RecordDriver implements Driver {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(RecordDriver.class);

  /** Prefix of every URL this driver accepts. */
  public static final String URL_PREFIX = "jdbc:recordriver:";

  static final int MAJOR_VERSION = 0;
  static final int MINOR_VERSION = 1;

  static {
    try {
      DriverManager.registerDriver(new RecordDriver());
    } catch (SQLException e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final SessionRegistry registry;
  private final Config config;

  /** Creates a driver with an empty registry and the default
   * configuration. */
  public RecordDriver() {
    this(new SessionRegistry());
  }

  /** Creates a driver over a given registry, with the default
   * configuration. */
  public RecordDriver(SessionRegistry registry) {
    this(registry, config());
  }

  /** Creates a driver over a given registry and configuration. */
  public RecordDriver(SessionRegistry registry, Config config) {
    this.registry = requireNonNull(registry, "registry");
    this.config = requireNonNull(config, "config");
  }

  /** Returns the default configuration: {@link Mode#LENIENT}, and sessions
   * are deleted when their connection closes. */
  public static Config config() {
    return ConfigImpl.DEFAULT;
  }

  /** Returns the driver that is registered with {@link DriverManager},
   * registering one if there is none. */
  public static synchronized RecordDriver registered() throws SQLException {
    final Enumeration<Driver> drivers = DriverManager.getDrivers();
    while (drivers.hasMoreElements()) {
      final Driver driver = drivers.nextElement();
      if (driver instanceof RecordDriver) {
        return (RecordDriver) driver;
      }
    }
    final RecordDriver driver = new RecordDriver();
    DriverManager.registerDriver(driver);
    LOGGER.debug("Registered {} with DriverManager", driver);
    return driver;
  }

  /** Returns the URL of the session with the given name. */
  public static String url(String sessionName) {
    return URL_PREFIX + requireNonNull(sessionName, "sessionName");
  }

  /** Returns the registry that this driver's connections record into. */
  public SessionRegistry registry() {
    return registry;
  }

  /** Returns this driver's configuration. Connection properties may
   * override it for individual connections. */
  public Config getConfig() {
    return config;
  }

  /** Opens a connection to the named session with this driver's
   * configuration. */
  public RecordConnection connect(String sessionName) {
    return new RecordConnection(registry, sessionName, config);
  }

  @Override public @Nullable RecordConnection connect(String url,
      @Nullable Properties info) throws SQLException {
    if (!acceptsURL(url)) {
      return null;
    }
    final String sessionName = url.substring(URL_PREFIX.length());
    final Config config;
    try {
      config = info == null ? this.config : this.config.withProperties(info);
    } catch (IllegalArgumentException e) {
      throw new SQLException(format("invalid properties for '%s'", url), e);
    }
    return new RecordConnection(registry, sessionName, config);
  }

  @Override public boolean acceptsURL(@Nullable String url) {
    return url != null && url.startsWith(URL_PREFIX);
  }

  @Override public DriverPropertyInfo[] getPropertyInfo(String url,
      @Nullable Properties info) {
    final Config config = info == null ? this.config
        : this.config.withProperties(info);
    final DriverPropertyInfo mode =
        new DriverPropertyInfo(Config.MODE_PROPERTY,
            config.mode().name().toLowerCase(Locale.ROOT));
    mode.description = "What to do when a query has no registered response";
    mode.choices = new String[] {"lenient", "strict"};
    final DriverPropertyInfo deleteOnClose =
        new DriverPropertyInfo(Config.DELETE_ON_CLOSE_PROPERTY,
            Boolean.toString(config.deleteOnClose()));
    deleteOnClose.description =
        "Whether closing a connection deletes its session";
    deleteOnClose.choices = new String[] {"true", "false"};
    return new DriverPropertyInfo[] {mode, deleteOnClose};
  }

  @Override public int getMajorVersion() {
    return MAJOR_VERSION;
  }

  @Override public int getMinorVersion() {
    return MINOR_VERSION;
  }

  @Override public boolean jdbcCompliant() {
    return false;
  }

  @Override public java.util.logging.Logger getParentLogger()
      throws SQLFeatureNotSupportedException {
    throw new SQLFeatureNotSupportedException("recordriver logs via SLF4J");
  }

  /** Implementation of {@link Config}. */
  private static class ConfigImpl implements Config {
    static final ConfigImpl DEFAULT = new ConfigImpl(Mode.LENIENT, true);

    private final Mode mode;
    private final boolean deleteOnClose;

    private ConfigImpl(Mode mode, boolean deleteOnClose) {
      this.mode = requireNonNull(mode, "mode");
      this.deleteOnClose = deleteOnClose;
    }

    @Override public Mode mode() {
      return mode;
    }

    @Override public boolean deleteOnClose() {
      return deleteOnClose;
    }

    @Override public Config withMode(Mode mode) {
      return new ConfigImpl(mode, deleteOnClose);
    }

    @Override public Config withDeleteOnClose(boolean deleteOnClose) {
      return new ConfigImpl(mode, deleteOnClose);
    }

    @Override public Config withProperties(Properties properties) {
      Config config = this;
      final String mode = properties.getProperty(MODE_PROPERTY);
      if (mode != null) {
        try {
          final String modeName = mode.trim().toUpperCase(Locale.ROOT);
          config = config.withMode(Mode.valueOf(modeName));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException(
              format("invalid value '%s' for property '%s'", mode,
                  MODE_PROPERTY), e);
        }
      }
      final String deleteOnClose =
          properties.getProperty(DELETE_ON_CLOSE_PROPERTY);
      if (deleteOnClose != null) {
        switch (deleteOnClose.trim().toLowerCase(Locale.ROOT)) {
          case "true":
            config = config.withDeleteOnClose(true);
            break;
          case "false":
            config = config.withDeleteOnClose(false);
            break;
          default:
            throw new IllegalArgumentException(
                format("invalid value '%s' for property '%s'", deleteOnClose,
                    DELETE_ON_CLOSE_PROPERTY));
        }
      }
      return config;
    }

    @Override public String toString() {
      return "Config{mode=" + mode + ", deleteOnClose=" + deleteOnClose + "}";
    }
  }
}

// End RecordDriver.java
