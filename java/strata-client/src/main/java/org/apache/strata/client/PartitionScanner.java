// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.strata.client;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.strata.util.Pair;

/**
 * Scans one segment and pairs every row with its partition value, so that
 * the rows can be redistributed under a new partitioning.
 *
 * The scanner is single use. All rows of the segment are collected before
 * {@link #scan()} returns; on failure nothing is returned. The executor is
 * finished exactly once in both cases.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@NotThreadSafe
public class PartitionScanner {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionScanner.class);

  private final ScanExecutor executor;
  private final PartitionValueResolver resolver;
  private final String segmentId;

  private boolean scanned = false;
  private long rowsScanned = 0;
  private int iteratorsConsumed = 0;

  /**
   * @param executor the executor producing the rows of the segment
   * @param resolver the resolver built for the same segment
   */
  public PartitionScanner(ScanExecutor executor, PartitionValueResolver resolver) {
    this.executor = Preconditions.checkNotNull(executor, "executor");
    this.resolver = Preconditions.checkNotNull(resolver, "resolver");
    this.segmentId = resolver.getSegmentProperties().getSegmentId();
  }

  /**
   * Scans the segment.
   *
   * @return one (partition value, row) pair per row, in scan order
   * @throws NonRecoverableException if the executor fails or the thread is
   *     interrupted
   * @throws DecodeException if the partition value of a row cannot be resolved
   * @throws StrataException if the dictionary store fails
   */
  public List<Pair<Object, EncodedRow>> scan() throws StrataException {
    Preconditions.checkState(!scanned, "segment %s was already scanned", segmentId);
    scanned = true;
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<Pair<Object, EncodedRow>> rows = new ArrayList<>();
    try {
      List<Iterator<EncodedRow>> iterators = startScan();
      for (Iterator<EncodedRow> iterator : iterators) {
        while (iterator.hasNext()) {
          if (Thread.currentThread().isInterrupted()) {
            throw new NonRecoverableException(Status.Aborted(String.format(
                "scan of segment %s interrupted after %d rows", segmentId, rowsScanned)));
          }
          EncodedRow row = iterator.next();
          rows.add(new Pair<>(resolver.resolve(row), row));
          rowsScanned++;
        }
        iteratorsConsumed++;
      }
    } catch (StrataException e) {
      LOG.error("Partition scan of segment {} failed", segmentId, e);
      throw e;
    } catch (RuntimeException e) {
      LOG.error("Partition scan of segment {} failed", segmentId, e);
      throw StrataException.transformException(e);
    } finally {
      executor.finish();
    }
    LOG.info("Scanned {} rows from {} blocks of segment {} in {}",
             rowsScanned, iteratorsConsumed, segmentId, stopwatch);
    return rows;
  }

  private List<Iterator<EncodedRow>> startScan() throws NonRecoverableException {
    try {
      List<Iterator<EncodedRow>> iterators = executor.processDataBlocks(segmentId);
      LOG.debug("Executor returned {} block iterators for segment {}",
                iterators.size(), segmentId);
      return iterators;
    } catch (Exception e) {
      String message = e.getMessage() == null ?
          "Exception occurred in query execution. Please check logs." :
          "Exception occurred in query execution :: " + e.getMessage();
      throw new NonRecoverableException(Status.IOError(message), e);
    }
  }

  /**
   * @return the number of rows resolved so far
   */
  public long getRowsScanned() {
    return rowsScanned;
  }

  /**
   * @return the number of block iterators read to the end so far
   */
  public int getIteratorsConsumed() {
    return iteratorsConsumed;
  }
}
