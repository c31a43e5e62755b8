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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.junit.Test;

import net.tstable.common.Const;
import net.tstable.utils.JSON;

public class TestStoreConfig {

  @Test
  public void defaults() throws Exception {
    final StoreConfig config = StoreConfig.newBuilder().build();
    assertEquals("localhost", config.getHost());
    assertEquals(6379, config.getPort());
    assertEquals(0, config.getDatabase());
    assertNull(config.password());
    assertEquals(2000, config.getTimeout());
    assertTrue(config.getWriteThreads() >= 1);
    assertEquals(Const.DEFAULT_WRITE_TIMEOUT_MS, config.getWriteTimeout());
    assertEquals(Const.DEFAULT_PROBE_WINDOW, config.getProbeWindow());
  }

  @Test
  public void load() throws Exception {
    final Path path = Paths.get(getClass().getResource("/store.yaml").toURI());
    final StoreConfig config = StoreConfig.load(path);
    assertEquals("redis.example.com", config.getHost());
    assertEquals(6380, config.getPort());
    assertEquals(2, config.getDatabase());
    assertEquals("secret", config.password());
    assertEquals(500, config.getTimeout());
    assertEquals(4, config.getWriteThreads());
    assertEquals(1000, config.getWriteTimeout());
    assertEquals(16, config.getProbeWindow());

    // never serialized
    assertFalse(JSON.serializeToString(config).contains("secret"));

    try {
      StoreConfig.load(Paths.get("no/such/store.yaml"));
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void overrides() throws Exception {
    final StoreConfig config = StoreConfig.newBuilder()
        .setHost("redis1")
        .setPort(6380)
        .build();
    assertSame(config, config.withOverrides(new Properties()));

    final Properties properties = new Properties();
    properties.setProperty("tstable.redis.host", " redis2 ");
    properties.setProperty("tstable.redis.database", "3");
    properties.setProperty("tstable.query.probe_window", "8");
    properties.setProperty("tstable.write.timeout", "250");
    properties.setProperty("unrelated.redis.port", "1");
    final StoreConfig overridden = config.withOverrides(properties);
    assertEquals("redis2", overridden.getHost());
    assertEquals(6380, overridden.getPort());
    assertEquals(3, overridden.getDatabase());
    assertEquals(8, overridden.getProbeWindow());
    assertEquals(250, overridden.getWriteTimeout());

    properties.setProperty("tstable.redis.port", "not a port");
    try {
      config.withOverrides(properties);
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }

  @Test
  public void invalid() throws Exception {
    try {
      StoreConfig.newBuilder().setPort(0).build();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      StoreConfig.newBuilder().setDatabase(-1).build();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      StoreConfig.newBuilder().setWriteThreads(0).build();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
    try {
      StoreConfig.newBuilder().setProbeWindow(0).build();
      fail("Expected ConfigurationException");
    } catch (ConfigurationException e) { }
  }
}
