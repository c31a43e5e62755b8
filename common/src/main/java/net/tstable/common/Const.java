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
package net.tstable.common;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

/** Constants used in various places.  */
public final class Const {

  /** Used for table, classifier and line names. */
  public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;

  /** Separator between the components of a physical series key. */
  public static final char KEY_SEPARATOR = ':';

  /** Label carrying the logical table name. */
  public static final String TABLE_LABEL = "table";

  /** Label carrying the first classifier. */
  public static final String C1_LABEL = "c1";

  /** Label carrying the second classifier. */
  public static final String C2_LABEL = "c2";

  /** Label carrying the line name. */
  public static final String LINE_LABEL = "line";

  /** Label carrying the timeframe name. */
  public static final String TIMEFRAME_LABEL = "timeframe";

  /** Labels derived from the key itself. Extra labels may not override them. */
  public static final Set<String> RESERVED_LABELS = ImmutableSet.of(
      TABLE_LABEL, C1_LABEL, C2_LABEL, LINE_LABEL, TIMEFRAME_LABEL);

  /** Milliseconds in a second, the table API speaks seconds. */
  public static final long MILLIS_PER_SECOND = 1000L;

  /** Default number of points fetched per line in a backward probe. */
  public static final int DEFAULT_PROBE_WINDOW = 128;

  /** Default time in milliseconds to wait on a batch of appends. */
  public static final long DEFAULT_WRITE_TIMEOUT_MS = 30000L;

  private Const() {
    // constants only
  }
}
