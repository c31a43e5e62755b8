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

/**
 * High level exception thrown by the query engine that should bubble up to
 * the caller as the error description of a read result.
 *
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = 6338254902243113267L;

  /** An optional list of exceptions thrown. */
  protected final List<Exception> exceptions;

  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   */
  public QueryExecutionException(final String msg) {
    this(msg, (Exception) null);
  }

  /**
   * Ctor that sets a descriptive message and the exceptions that triggered
   * this one.
   * @param msg A non-null message to be given.
   * @param exceptions An optional list of exceptions. May be null or empty.
   */
  public QueryExecutionException(final String msg,
                                 final List<Exception> exceptions) {
    super(msg);
    this.exceptions = exceptions;
  }

  /**
   * Ctor setting a message and the original exception.
   * @param msg A non-null message to be given.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg, final Exception e) {
    super(msg, e);
    exceptions = null;
  }

  /** @return A list of exceptions that triggered this or an empty list. */
  public List<Exception> getExceptions() {
    return exceptions == null ? Collections.<Exception>emptyList() :
      Collections.<Exception>unmodifiableList(exceptions);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (exceptions != null) {
      buf.append(" subExceptions[");
      for (int i = 0; i < exceptions.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(exceptions.get(i).toString());
      }
      buf.append("]");
    }
    return buf.toString();
  }
}
