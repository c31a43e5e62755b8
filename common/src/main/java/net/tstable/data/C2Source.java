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
package net.tstable.data;

import com.google.common.base.Strings;

/**
 * Where the second classifier of written rows comes from: either a fixed
 * value for the whole batch, or a cell at a fixed offset of every row, e.g.
 * {@code [timestamp, symbol, open, high, low, close]} with the symbol at
 * offset 1.
 *
 * @since 1.0
 */
public final class C2Source {

  /** The kinds of source. */
  public static enum Kind {
    /** One identity for every row. */
    FIXED,

    /** The identity is read from each row at an offset. */
    POSITIONAL
  }

  /** The kind. */
  private final Kind kind;

  /** The identity for FIXED sources. */
  private final String identity;

  /** The offset for POSITIONAL sources. */
  private final int position;

  private C2Source(final Kind kind, final String identity, final int position) {
    this.kind = kind;
    this.identity = identity;
    this.position = position;
  }

  /**
   * @param c2 A non-null and non-empty classifier.
   * @return A fixed source.
   */
  public static C2Source fixed(final String c2) {
    if (Strings.isNullOrEmpty(c2)) {
      throw new IllegalArgumentException("C2 cannot be null or empty.");
    }
    return new C2Source(Kind.FIXED, c2.toLowerCase(), -1);
  }

  /**
   * @param position The offset of the classifier in each row. Must be at
   * least 1 since offset 0 holds the timestamp.
   * @return A positional source.
   */
  public static C2Source positional(final int position) {
    if (position < 1) {
      throw new IllegalArgumentException("C2 position must be at least 1, "
          + "offset 0 holds the timestamp: " + position);
    }
    return new C2Source(Kind.POSITIONAL, null, position);
  }

  /** @return The kind of source. */
  public Kind kind() {
    return kind;
  }

  /** @return The fixed identity or null for positional sources. */
  public String identity() {
    return identity;
  }

  /** @return The offset or -1 for fixed sources. */
  public int position() {
    return position;
  }

  /** @return The number of cells a row carries besides timestamp and lines. */
  public int extraCells() {
    return kind == Kind.POSITIONAL ? 1 : 0;
  }

  @Override
  public String toString() {
    return kind == Kind.FIXED ? "c2=" + identity : "c2@" + position;
  }
}
