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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestAggregatorKind {

  @Test
  public void fromString() throws Exception {
    assertSame(AggregatorKind.AVG, AggregatorKind.fromString("avg"));
    assertSame(AggregatorKind.SUM, AggregatorKind.fromString(" Sum "));
    assertSame(AggregatorKind.STD_P, AggregatorKind.fromString("std.p"));
    assertSame(AggregatorKind.STD_S, AggregatorKind.fromString("STD_S"));
    assertSame(AggregatorKind.VAR_P, AggregatorKind.fromString("var_p"));
    assertSame(AggregatorKind.LAST, AggregatorKind.fromString("LAST"));
    assertEquals("var.s", AggregatorKind.VAR_S.getName());
    assertEquals("range", AggregatorKind.RANGE.toString());

    try {
      AggregatorKind.fromString("median");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      AggregatorKind.fromString(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
