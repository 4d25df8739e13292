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

import java.util.Iterator;
import java.util.List;

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Runs the raw scan of a segment's blocks. Implementations hold resources
 * (open block readers, buffers) until {@link #finish()} is called.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public interface ScanExecutor {

  /**
   * Starts scanning the blocks of a segment.
   *
   * @param segmentId the segment to scan
   * @return one iterator over the raw rows of every block
   * @throws StrataException if the scan cannot be started
   */
  List<Iterator<EncodedRow>> processDataBlocks(String segmentId) throws StrataException;

  /**
   * Releases the resources of the scan. Called exactly once, whether or not
   * the scan succeeded.
   */
  void finish();
}
