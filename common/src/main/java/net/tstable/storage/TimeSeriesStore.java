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

import java.io.Closeable;
import java.util.List;
import java.util.Map;

import com.stumbleupon.async.Deferred;

import net.tstable.data.DataPoint;
import net.tstable.data.LabelSet;
import net.tstable.table.AggregatorKind;

/**
 * The capabilities the table layer needs from a time series key-value store.
 * Implementations own the storage engine, retention, duplicate handling and
 * the arithmetic of downsampling rules.
 * <p>
 * Timestamps and durations are in milliseconds. Failures reported by the
 * store are thrown as {@link net.tstable.exceptions.StoreException}s with the
 * store's own exception as the cause; nothing is retried. Appends never
 * throw, they resolve to a {@link WriteStatus} instead so a batch can report
 * each point.
 *
 * @since 1.0
 */
public interface TimeSeriesStore extends Closeable {

  /**
   * Creates a series.
   * @param key The non-null key.
   * @param retention Retention in milliseconds, 0 for forever.
   * @param labels The non-null labels.
   * @param policy The duplicate policy.
   * @return Whether the series was created or already present.
   */
  public CreateStatus createSeries(final String key,
                                   final long retention,
                                   final LabelSet labels,
                                   final DuplicatePolicy policy);

  /**
   * Appends a sample. The series must exist.
   * @param key The non-null key.
   * @param timestamp Timestamp in milliseconds.
   * @param value The value.
   * @return A deferred resolving to the outcome. Never an errback.
   */
  public Deferred<WriteStatus> append(final String key,
                                      final long timestamp,
                                      final double value);

  /**
   * Reads samples between two timestamps, inclusive.
   * @param key The non-null key.
   * @param from Start timestamp in milliseconds.
   * @param to End timestamp in milliseconds.
   * @param count The maximum number of samples, 0 or less for all.
   * @param direction The scan direction. With {@link Direction#REVERSE} the
   * newest samples come first and the count keeps the newest ones.
   * @return The samples in scan order, possibly empty.
   */
  public List<DataPoint> range(final String key,
                               final long from,
                               final long to,
                               final int count,
                               final Direction direction);

  /**
   * Creates a downsampling rule.
   * @param source_key The source series.
   * @param dest_key The destination series.
   * @param aggregator The aggregation.
   * @param bucket The bucket width in milliseconds.
   */
  public void createRule(final String source_key,
                         final String dest_key,
                         final AggregatorKind aggregator,
                         final long bucket);

  /**
   * Deletes a series and its rules.
   * @param key The non-null key.
   * @return True if a series was deleted.
   */
  public boolean deleteKey(final String key);

  /**
   * Deletes the samples of a series between two timestamps, inclusive.
   * @param key The non-null key.
   * @param from Start timestamp in milliseconds.
   * @param to End timestamp in milliseconds.
   * @return The number of samples deleted.
   */
  public long deleteRange(final String key, final long from, final long to);

  /**
   * Lists the keys whose labels match every pair of the predicate.
   * @param label_predicate A non-null, non-empty map of label values.
   * @return The matching keys, possibly empty.
   */
  public List<String> listKeys(final Map<String, String> label_predicate);

  /**
   * @param key The non-null key.
   * @return The metadata of the series or null if it doesn't exist.
   */
  public SeriesInfo getInfo(final String key);

  /**
   * @param key The non-null key.
   * @return True if the series exists.
   */
  public boolean exists(final String key);

  /**
   * @param key The non-null key.
   * @return The newest sample or null if the series is empty.
   */
  public DataPoint getLast(final String key);

}
