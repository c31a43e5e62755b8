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
package net.tstable.core;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tstable.common.Const;
import net.tstable.naming.KeyNamingScheme;

/**
 * The series of a table matching an index query, as key names and as the
 * distinct values of each key component. A failed query has no keys and
 * carries the error.
 *
 * @since 1.0
 */
public class IndexResult {

  private static final List<String> COMPONENTS = ImmutableList.of(
      Const.C1_LABEL, Const.C2_LABEL, Const.TIMEFRAME_LABEL, Const.LINE_LABEL);

  private final List<String> keys;
  private final Map<String, Set<String>> values;
  private final boolean success;
  private final String error;
  private final Throwable exception;

  /**
   * Default ctor.
   * @param keys The matching keys, sorted.
   */
  public IndexResult(final List<String> keys) {
    this(true, keys, null, null);
  }

  private IndexResult(final boolean success,
                      final List<String> keys,
                      final String error,
                      final Throwable exception) {
    this.success = success;
    this.keys = ImmutableList.copyOf(keys);
    this.error = error;
    this.exception = exception;
    final Map<String, Set<String>> distinct = Maps.newLinkedHashMap();
    for (final String component : COMPONENTS) {
      distinct.put(component, Sets.<String>newTreeSet());
    }
    for (final String key : keys) {
      final Map<String, String> parsed = KeyNamingScheme.parse(key);
      if (parsed == null) {
        continue;
      }
      for (final String component : COMPONENTS) {
        distinct.get(component).add(parsed.get(component));
      }
    }
    final ImmutableMap.Builder<String, Set<String>> builder = ImmutableMap.builder();
    for (final Map.Entry<String, Set<String>> entry : distinct.entrySet()) {
      builder.put(entry.getKey(), ImmutableSortedSet.copyOf(entry.getValue()));
    }
    values = builder.build();
  }

  /**
   * @param error The error message.
   * @param exception The cause, may be null.
   * @return A failed query.
   */
  public static IndexResult failed(final String error,
                                   final Throwable exception) {
    return new IndexResult(false, ImmutableList.<String>of(), error,
        exception);
  }

  /** @return Whether the query succeeded. */
  public boolean isSuccess() {
    return success;
  }

  /** @return The error message, null on success. */
  public String getError() {
    return error;
  }

  /** @return The cause of a failure, may be null. */
  public Throwable getException() {
    return exception;
  }

  /** @return The matching keys, sorted. */
  public List<String> getKeys() {
    return keys;
  }

  /** @return The distinct c1, c2, timeframe and line values of the keys. */
  public Map<String, Set<String>> getValues() {
    return values;
  }

  /**
   * @param component One of the c1, c2, timeframe or line labels.
   * @return The distinct values, empty if the component is unknown.
   */
  public Set<String> getValues(final String component) {
    final Set<String> set = values.get(component);
    return set == null ? ImmutableSortedSet.<String>of() : set;
  }

  @Override
  public String toString() {
    return isSuccess() ? values.toString() : "error=" + error;
  }
}
