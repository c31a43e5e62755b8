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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.tstable.storage.WriteStatus;
import net.tstable.storage.WriteStatus.WriteState;

/**
 * Collects the appends of one call and waits on them with a shared
 * deadline. Appends still pending at the deadline count as errors.
 *
 * @since 1.0
 */
public class PendingWrites {
  private static final Logger LOG = LoggerFactory.getLogger(PendingWrites.class);

  private final List<Deferred<WriteStatus>> deferreds = Lists.newArrayList();
  private final List<PointFailure> points = Lists.newArrayList();

  /**
   * Tracks an append.
   * @param deferred The deferred the store returned.
   * @param row The row index in the batch.
   * @param key The series key.
   * @param line The line.
   * @param timestamp Timestamp in seconds.
   */
  public void add(final Deferred<WriteStatus> deferred,
                  final int row,
                  final String key,
                  final String line,
                  final long timestamp) {
    deferreds.add(deferred);
    // placeholder status, replaced once the append resolves.
    points.add(new PointFailure(row, key, line, timestamp, WriteStatus.OK));
  }

  /** @return The number of tracked appends. */
  public int size() {
    return deferreds.size();
  }

  /**
   * Waits on every append.
   * @param timeout The overall timeout in milliseconds.
   * @param failures A list the failed points are added to.
   * @return The number of points stored.
   */
  public long join(final long timeout, final List<PointFailure> failures) {
    final long deadline = System.currentTimeMillis() + timeout;
    long written = 0;
    boolean interrupted = false;
    for (int i = 0; i < deferreds.size(); i++) {
      final PointFailure point = points.get(i);
      WriteStatus status;
      if (interrupted) {
        status = WriteStatus.error("Interrupted while waiting on the write.",
            null);
      } else {
        try {
          status = deferreds.get(i).join(
              Math.max(1, deadline - System.currentTimeMillis()));
          if (status == null) {
            status = WriteStatus.error("Store returned no status.", null);
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          interrupted = true;
          status = WriteStatus.error("Interrupted while waiting on the write.",
              e);
        } catch (TimeoutException e) {
          status = WriteStatus.error("Timed out after " + timeout
              + "ms waiting on the write.", e);
        } catch (Exception e) {
          status = WriteStatus.error(e.getMessage(), e);
        }
      }
      if (status.state() == WriteState.OK) {
        written++;
      } else {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Failed to write " + point.key() + "@" + point.timestamp()
              + ": " + status);
        }
        failures.add(new PointFailure(point.row(), point.key(), point.line(),
            point.timestamp(), status));
      }
    }
    return written;
  }
}
