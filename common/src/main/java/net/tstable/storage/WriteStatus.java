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
package net.tstable.storage;

/**
 * The response from a point append including the state and optional
 * error message or exception. Every append of an ingest batch resolves to
 * one of these so sibling lines can succeed while one fails.
 *
 * @since 1.0
 */
public interface WriteStatus {

  /**
   * An enum used by callers to determine whether or not the write was
   * successful.
   */
  public static enum WriteState {
    /** The write was successful. */
    OK,

    /** The value was rejected by the store, e.g. a timestamp older than the
     * retention or a duplicate under a blocking policy. */
    REJECTED,

    /** An error happened talking to the store. Not retried. */
    ERROR
  }

  /** @return The non-null state of the write. */
  public WriteState state();

  /** @return An optional error message, should be null if
   * {@link WriteState#OK} is returned. */
  public String message();

  /** @return An optional exception. Likely set when
   * {@link WriteState#ERROR} is returned. */
  public Throwable exception();

  /** @return The OK status, no error message or exception. */
  public static WriteStatus ok() {
    return OK;
  }

  /**
   * Returns a rejected status with the given message.
   * @param message An optional error message.
   * @return The rejected write status.
   */
  public static WriteStatus rejected(final String message) {
    return new WriteStatus() {

      @Override
      public WriteState state() {
        return WriteState.REJECTED;
      }

      @Override
      public String message() {
        return message;
      }

      @Override
      public Throwable exception() {
        return null;
      }

      @Override
      public String toString() {
        return "REJECTED: " + message;
      }
    };
  }

  /**
   * Returns an error status with the given message and optional exception.
   * @param message An optional error message.
   * @param t An optional exception, passed along untouched.
   * @return The error write status.
   */
  public static WriteStatus error(final String message, final Throwable t) {
    return new WriteStatus() {

      @Override
      public WriteState state() {
        return WriteState.ERROR;
      }

      @Override
      public String message() {
        return message;
      }

      @Override
      public Throwable exception() {
        return t;
      }

      @Override
      public String toString() {
        return "ERROR: " + message;
      }
    };
  }

  /** The OK status, no error message or exception. */
  public static WriteStatus OK = new WriteStatus() {

    @Override
    public WriteState state() {
      return WriteState.OK;
    }

    @Override
    public String message() {
      return null;
    }

    @Override
    public Throwable exception() {
      return null;
    }

    @Override
    public String toString() {
      return "OK";
    }
  };
}
