// This file is part of TSTable.
// Copyright (C) 2026 The TSTable Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tstable.configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;

import net.tstable.common.Const;
import net.tstable.utils.JSON;
import net.tstable.utils.YAML;

/**
 * Connection and execution settings for a store and the table manager on
 * top of it. Loaded from a YAML or JSON file, then overridden by system
 * properties prefixed with {@code tstable.}, e.g.
 * {@code -Dtstable.redis.host=10.0.0.5}.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = StoreConfig.Builder.class)
public class StoreConfig {
  private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

  /** Prefix of overriding system properties. */
  public static final String PROPERTY_PREFIX = "tstable.";

  public static final String HOST_KEY = "redis.host";
  public static final String PORT_KEY = "redis.port";
  public static final String DATABASE_KEY = "redis.database";
  public static final String PASSWORD_KEY = "redis.password";
  public static final String TIMEOUT_KEY = "redis.timeout";
  public static final String THREADS_KEY = "write.threads";
  public static final String WRITE_TIMEOUT_KEY = "write.timeout";
  public static final String PROBE_WINDOW_KEY = "query.probe_window";

  private final String host;
  private final int port;
  private final int database;
  private final String password;
  private final int timeout;
  private final int write_threads;
  private final long write_timeout;
  private final int probe_window;

  /**
   * Protected builder ctor.
   * @param builder The non-null builder.
   * @throws ConfigurationException if a value was out of range.
   */
  protected StoreConfig(final Builder builder) {
    host = Strings.isNullOrEmpty(builder.host) ? "localhost" : builder.host;
    port = builder.port == null ? 6379 : builder.port;
    database = builder.database == null ? 0 : builder.database;
    password = Strings.emptyToNull(builder.password);
    timeout = builder.timeout == null ? 2000 : builder.timeout;
    write_threads = builder.writeThreads == null ?
        Runtime.getRuntime().availableProcessors() : builder.writeThreads;
    write_timeout = builder.writeTimeout == null ?
        Const.DEFAULT_WRITE_TIMEOUT_MS : builder.writeTimeout;
    probe_window = builder.probeWindow == null ?
        Const.DEFAULT_PROBE_WINDOW : builder.probeWindow;

    if (port < 1 || port > 65535) {
      throw new ConfigurationException("Invalid port: " + port);
    }
    if (database < 0) {
      throw new ConfigurationException("Database index cannot be negative: "
          + database);
    }
    if (timeout < 0) {
      throw new ConfigurationException("Timeout cannot be negative: " + timeout);
    }
    if (write_threads < 1) {
      throw new ConfigurationException("Write threads must be at least 1: "
          + write_threads);
    }
    if (write_timeout < 1) {
      throw new ConfigurationException("Write timeout must be positive: "
          + write_timeout);
    }
    if (probe_window < 1) {
      throw new ConfigurationException("Probe window must be at least 1: "
          + probe_window);
    }
  }

  /** @return The store host. */
  @JsonProperty("host")
  public String getHost() {
    return host;
  }

  /** @return The store port. */
  @JsonProperty("port")
  public int getPort() {
    return port;
  }

  /** @return The database index. */
  @JsonProperty("database")
  public int getDatabase() {
    return database;
  }

  /** @return The password or null. Never serialized. */
  public String password() {
    return password;
  }

  /** @return The connection and socket timeout in milliseconds. */
  @JsonProperty("timeout")
  public int getTimeout() {
    return timeout;
  }

  /** @return The number of threads issuing appends. */
  @JsonProperty("writeThreads")
  public int getWriteThreads() {
    return write_threads;
  }

  /** @return How long in milliseconds an ingest call waits on its appends. */
  @JsonProperty("writeTimeout")
  public long getWriteTimeout() {
    return write_timeout;
  }

  /** @return Points fetched per line in each backward probe. */
  @JsonProperty("probeWindow")
  public int getProbeWindow() {
    return probe_window;
  }

  @Override
  public String toString() {
    return JSON.serializeToString(this);
  }

  /** @return A builder seeded with this config. */
  public Builder toBuilder() {
    return newBuilder()
        .setHost(host)
        .setPort(port)
        .setDatabase(database)
        .setPassword(password)
        .setTimeout(timeout)
        .setWriteThreads(write_threads)
        .setWriteTimeout(write_timeout)
        .setProbeWindow(probe_window);
  }

  /**
   * Loads a config file, YAML unless the name ends in ".json", and applies
   * system property overrides.
   * @param path The non-null path.
   * @return The config.
   * @throws ConfigurationException if the file could not be read or parsed.
   */
  public static StoreConfig load(final Path path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    try (final InputStream stream = Files.newInputStream(path)) {
      final StoreConfig config = path.toString().endsWith(".json") ?
          JSON.parseToObject(stream, StoreConfig.class) :
          YAML.parseToObject(stream, StoreConfig.class);
      LOG.info("Loaded store config from " + path);
      return config.withOverrides(System.getProperties());
    } catch (IOException e) {
      throw new ConfigurationException("Failed to open config file: " + path, e);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Failed to parse config file: " + path, e);
    }
  }

  /**
   * Applies overrides from a property set, e.g. the system properties.
   * @param properties The non-null properties.
   * @return A new config or this one if nothing was overridden.
   * @throws ConfigurationException if an override was not a number where one
   * was expected.
   */
  public StoreConfig withOverrides(final Properties properties) {
    final Builder builder = toBuilder();
    boolean changed = false;
    String value = override(properties, HOST_KEY);
    if (value != null) {
      builder.setHost(value);
      changed = true;
    }
    value = override(properties, PORT_KEY);
    if (value != null) {
      builder.setPort(parseInt(PORT_KEY, value));
      changed = true;
    }
    value = override(properties, DATABASE_KEY);
    if (value != null) {
      builder.setDatabase(parseInt(DATABASE_KEY, value));
      changed = true;
    }
    value = override(properties, PASSWORD_KEY);
    if (value != null) {
      builder.setPassword(value);
      changed = true;
    }
    value = override(properties, TIMEOUT_KEY);
    if (value != null) {
      builder.setTimeout(parseInt(TIMEOUT_KEY, value));
      changed = true;
    }
    value = override(properties, THREADS_KEY);
    if (value != null) {
      builder.setWriteThreads(parseInt(THREADS_KEY, value));
      changed = true;
    }
    value = override(properties, WRITE_TIMEOUT_KEY);
    if (value != null) {
      builder.setWriteTimeout((long) parseInt(WRITE_TIMEOUT_KEY, value));
      changed = true;
    }
    value = override(properties, PROBE_WINDOW_KEY);
    if (value != null) {
      builder.setProbeWindow(parseInt(PROBE_WINDOW_KEY, value));
      changed = true;
    }
    return changed ? builder.build() : this;
  }

  private static String override(final Properties properties,
                                 final String key) {
    final String value = properties.getProperty(PROPERTY_PREFIX + key);
    if (Strings.isNullOrEmpty(value)) {
      return null;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Overriding store config " + key + " from properties");
    }
    return value.trim();
  }

  private static int parseInt(final String key, final String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Value for " + PROPERTY_PREFIX + key
          + " must be an integer: " + value, e);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder {
    @JsonProperty
    private String host;
    @JsonProperty
    private Integer port;
    @JsonProperty
    private Integer database;
    @JsonProperty
    private String password;
    @JsonProperty
    private Integer timeout;
    @JsonProperty
    private Integer writeThreads;
    @JsonProperty
    private Long writeTimeout;
    @JsonProperty
    private Integer probeWindow;

    public Builder setHost(final String host) {
      this.host = host;
      return this;
    }

    public Builder setPort(final Integer port) {
      this.port = port;
      return this;
    }

    public Builder setDatabase(final Integer database) {
      this.database = database;
      return this;
    }

    public Builder setPassword(final String password) {
      this.password = password;
      return this;
    }

    public Builder setTimeout(final Integer timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder setWriteThreads(final Integer write_threads) {
      this.writeThreads = write_threads;
      return this;
    }

    public Builder setWriteTimeout(final Long write_timeout) {
      this.writeTimeout = write_timeout;
      return this;
    }

    public Builder setProbeWindow(final Integer probe_window) {
      this.probeWindow = probe_window;
      return this;
    }

    public StoreConfig build() {
      return new StoreConfig(this);
    }
  }
}
