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
package net.tstable.table;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.tstable.exceptions.TableDefinitionException;
import net.tstable.utils.JSON;

public class TestTimeframeSpec {

  @Test
  public void builder() throws Exception {
    TimeframeSpec spec = TimeframeSpec.newBuilder()
        .setRetention(3600)
        .build();
    assertEquals(3600, spec.getRetention());
    assertEquals(3600000, spec.getRetentionMillis());
    assertNull(spec.getBucket());
    assertEquals(0, spec.getBucketMillis());
    assertTrue(spec.isWritable());
    assertFalse(spec.isRuled());
    assertFalse(spec.isNoRules());

    spec = TimeframeSpec.newBuilder()
        .setRetention(0)
        .setBucket(300L)
        .build();
    assertEquals(300000, spec.getBucketMillis());
    assertFalse(spec.isWritable());
    assertTrue(spec.isRuled());
  }

  @Test
  public void invalid() throws Exception {
    try {
      TimeframeSpec.newBuilder().setRetention(-1).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      TimeframeSpec.newBuilder().setBucket(0L).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }

    try {
      TimeframeSpec.newBuilder().setBucket(60L).setNoRules(true).build();
      fail("Expected TableDefinitionException");
    } catch (TableDefinitionException e) { }
  }

  @Test
  public void serdes() throws Exception {
    final TimeframeSpec spec = JSON.parseToObject(
        "{\"retention\":86400,\"bucket\":60}", TimeframeSpec.class);
    assertEquals(86400, spec.getRetention());
    assertEquals(60L, (long) spec.getBucket());
    assertEquals(spec, JSON.parseToObject(JSON.serializeToString(spec),
        TimeframeSpec.class));
  }
}
