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
package net.tstable.ingest;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tstable.core.OperationResult;

/**
 * The result of writing a batch: the number of points stored and the
 * failed points. The call succeeded only if no point failed.
 *
 * @since 1.0
 */
public class IngestResult extends OperationResult {

  /** The failed points. */
  private final List<PointFailure> failures;

  protected IngestResult(final boolean success,
                         final String message,
                         final long written,
                         final Throwable exception,
                         final List<PointFailure> failures) {
    super(success, message, written, exception);
    this.failures = failures == null ? Collections.<PointFailure>emptyList() :
      ImmutableList.copyOf(failures);
  }

  /**
   * @param written The number of points stored.
   * @param failures The failed points, may be empty.
   * @return A result, successful if nothing failed.
   */
  public static IngestResult of(final long written,
                                final List<PointFailure> failures) {
    if (failures == null || failures.isEmpty()) {
      return new IngestResult(true, "Wrote " + written + " points", written,
          null, null);
    }
    return new IngestResult(false, "Wrote " + written + " points, "
        + failures.size() + " failed. First failure: " + failures.get(0),
        written, failures.get(0).status().exception(), failures);
  }

  /**
   * @param message A description of why nothing was written.
   * @param exception The cause, may be null.
   * @return A failed result with no point written.
   */
  public static IngestResult rejected(final String message,
                                      final Throwable exception) {
    return new IngestResult(false, message, 0, exception, null);
  }

  /** @return The failed points, possibly empty. */
  public List<PointFailure> getFailures() {
    return failures;
  }
}
