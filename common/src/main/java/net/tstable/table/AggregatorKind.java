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

import com.google.common.base.Strings;

/**
 * The aggregations a downsampling rule may apply to a bucket of source
 * points. The store performs the arithmetic.
 *
 * @since 1.0
 */
public enum AggregatorKind {
  AVG("avg"),
  SUM("sum"),
  MIN("min"),
  MAX("max"),
  RANGE("range"),
  COUNT("count"),
  FIRST("first"),
  LAST("last"),
  STD_P("std.p"),
  STD_S("std.s"),
  VAR_P("var.p"),
  VAR_S("var.s");

  /** The name used by the store and in table files. */
  private final String name;

  AggregatorKind(final String name) {
    this.name = name;
  }

  /** @return The name used by the store and in table files. */
  public String getName() {
    return name;
  }

  /**
   * Resolves an aggregator by name, ignoring case. Both "std.p" and "std_p"
   * forms are accepted.
   * @param name A non-null and non-empty name.
   * @return The aggregator.
   * @throws IllegalArgumentException if the name was null, empty or not a
   * recognized aggregator.
   */
  public static AggregatorKind fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Aggregator cannot be null or empty.");
    }
    final String normalized = name.trim().toLowerCase().replace('_', '.');
    for (final AggregatorKind kind : values()) {
      if (kind.name.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unrecognized aggregator: " + name);
  }

  @Override
  public String toString() {
    return name;
  }
}
