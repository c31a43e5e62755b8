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
package net.tstable.naming;

import java.util.Map;
import java.util.Map.Entry;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.tstable.common.Const;
import net.tstable.data.LabelSet;
import net.tstable.data.SeriesKey;
import net.tstable.table.TableDefinition;

/**
 * Maps a table, classifier pair, timeframe and line to the physical series
 * key {@code table:c1:c2:timeframe:line} and its labels
 * {@code {table, c1, c2, line, timeframe} + extra labels}.
 * <p>
 * Classifiers are trimmed and lower cased. Since no component may contain
 * the separator, two different tuples never produce the same key.
 *
 * @since 1.0
 */
public final class KeyNamingScheme {

  private KeyNamingScheme() {
  }

  /**
   * Derives the key and labels of one series.
   * @param table The non-null table definition.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param timeframe A declared timeframe.
   * @param line A declared line.
   * @param extra_labels Optional extra labels, may be null.
   * @return The key paired with its labels.
   * @throws IllegalArgumentException if a classifier was blank or contained
   * the separator, or an extra label was malformed or reserved.
   * @throws net.tstable.exceptions.TableDefinitionException if the line or
   * timeframe is not declared by the table.
   */
  public static SeriesKey derive(final TableDefinition table,
                                 final String c1,
                                 final String c2,
                                 final String timeframe,
                                 final String line,
                                 final Map<String, String> extra_labels) {
    final String key = keyName(table, c1, c2, timeframe, line);
    final Map<String, String> labels = Maps.newHashMap();
    if (extra_labels != null) {
      for (final Entry<String, String> entry : extra_labels.entrySet()) {
        if (Strings.isNullOrEmpty(entry.getKey())
            || Strings.isNullOrEmpty(entry.getValue())) {
          throw new IllegalArgumentException("Extra label names and values "
              + "cannot be null or empty: " + extra_labels);
        }
        if (Const.RESERVED_LABELS.contains(entry.getKey())) {
          throw new IllegalArgumentException("Extra label '" + entry.getKey()
              + "' collides with a reserved label " + Const.RESERVED_LABELS);
        }
        labels.put(entry.getKey(), entry.getValue());
      }
    }
    labels.put(Const.TABLE_LABEL, table.getName());
    labels.put(Const.C1_LABEL, normalize("c1", c1));
    labels.put(Const.C2_LABEL, normalize("c2", c2));
    labels.put(Const.TIMEFRAME_LABEL, timeframe.toLowerCase());
    labels.put(Const.LINE_LABEL, line.toLowerCase());
    return new SeriesKey(key, LabelSet.of(labels));
  }

  /**
   * Builds the key of one series without its labels.
   * @param table The non-null table definition.
   * @param c1 The first classifier.
   * @param c2 The second classifier.
   * @param timeframe A declared timeframe.
   * @param line A declared line.
   * @return The key.
   * @throws IllegalArgumentException if a classifier was blank or contained
   * the separator.
   * @throws net.tstable.exceptions.TableDefinitionException if the line or
   * timeframe is not declared by the table.
   */
  public static String keyName(final TableDefinition table,
                               final String c1,
                               final String c2,
                               final String timeframe,
                               final String line) {
    if (table == null) {
      throw new IllegalArgumentException("Table definition cannot be null.");
    }
    table.lineIndex(line);
    table.getTimeframe(timeframe);
    return new StringBuilder()
        .append(table.getName())
        .append(Const.KEY_SEPARATOR)
        .append(normalize("c1", c1))
        .append(Const.KEY_SEPARATOR)
        .append(normalize("c2", c2))
        .append(Const.KEY_SEPARATOR)
        .append(timeframe.toLowerCase())
        .append(Const.KEY_SEPARATOR)
        .append(line.toLowerCase())
        .toString();
  }

  /**
   * Splits a key back into its components.
   * @param key A key.
   * @return A map with the table, c1, c2, timeframe and line labels or null
   * if the key doesn't have the expected shape.
   */
  public static Map<String, String> parse(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      return null;
    }
    final String[] parts = key.split(String.valueOf(Const.KEY_SEPARATOR), -1);
    if (parts.length != 5) {
      return null;
    }
    for (final String part : parts) {
      if (part.isEmpty()) {
        return null;
      }
    }
    final Map<String, String> components = Maps.newLinkedHashMap();
    components.put(Const.TABLE_LABEL, parts[0]);
    components.put(Const.C1_LABEL, parts[1]);
    components.put(Const.C2_LABEL, parts[2]);
    components.put(Const.TIMEFRAME_LABEL, parts[3]);
    components.put(Const.LINE_LABEL, parts[4]);
    return components;
  }

  /**
   * Validates and normalizes a classifier.
   * @param what The classifier name for error messages.
   * @param value The value.
   * @return The trimmed, lower cased value.
   * @throws IllegalArgumentException if the value was blank or contained
   * the separator.
   */
  public static String normalize(final String what, final String value) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException(what + " cannot be null or empty.");
    }
    if (value.indexOf(Const.KEY_SEPARATOR) >= 0) {
      throw new IllegalArgumentException(what + " '" + value
          + "' cannot contain '" + Const.KEY_SEPARATOR + "'.");
    }
    return value.trim().toLowerCase();
  }
}
