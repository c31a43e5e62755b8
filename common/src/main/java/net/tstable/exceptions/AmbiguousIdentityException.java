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
package net.tstable.exceptions;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tstable.data.LabelSet;

/**
 * Thrown when a query filter resolves to more than one identity and the
 * caller did not allow multiple identities. Merging such rows silently would
 * mix unrelated streams that may share timestamps, so the caller has to
 * narrow the filter or opt in.
 *
 * @since 1.0
 */
public class AmbiguousIdentityException extends QueryExecutionException {
  private static final long serialVersionUID = -1752320964419447730L;

  /** The identities matched by the filter. */
  private final List<LabelSet> identities;

  /**
   * Default ctor.
   * @param filter A description of the filter that was resolved.
   * @param identities The non-null list of matched identities.
   */
  public AmbiguousIdentityException(final String filter,
                                    final List<LabelSet> identities) {
    super("Inadequate filter " + filter + ": matched " + identities.size()
        + " identities " + identities + ". Narrow the filter or allow "
        + "multiple identities.");
    this.identities = ImmutableList.copyOf(identities);
  }

  /** @return The identities matched by the filter. */
  public List<LabelSet> getIdentities() {
    return Collections.unmodifiableList(identities);
  }
}
