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

import javax.annotation.Nullable;

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Thrown when the partition value of a row cannot be resolved.
 *
 * Subclasses tell apart a schema or metadata mismatch, which usually means
 * the caller holds a stale schema or dictionary, from corrupted row data,
 * which points at a storage integrity problem. Neither succeeds on retry.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public abstract class DecodeException extends NonRecoverableException {

  private final String columnName;
  @Nullable
  private final String segmentId;
  @Nullable
  private final String rowDescription;

  DecodeException(Status status,
                  String columnName,
                  @Nullable String segmentId,
                  @Nullable String rowDescription,
                  @Nullable Throwable cause) {
    super(status, cause);
    this.columnName = columnName;
    this.segmentId = segmentId;
    this.rowDescription = rowDescription;
  }

  /**
   * Appends the column, segment and row to a message.
   */
  static String describe(String message,
                         String columnName,
                         @Nullable String segmentId,
                         @Nullable String rowDescription) {
    StringBuilder sb = new StringBuilder(message);
    sb.append(" (column: ").append(columnName);
    if (segmentId != null) {
      sb.append(", segment: ").append(segmentId);
    }
    if (rowDescription != null) {
      sb.append(", row: ").append(rowDescription);
    }
    return sb.append(')').toString();
  }

  /**
   * @return the name of the partition column being resolved
   */
  public String getColumnName() {
    return columnName;
  }

  /**
   * @return the segment being scanned, or null if the failure happened
   *     before any segment was bound
   */
  @Nullable
  public String getSegmentId() {
    return segmentId;
  }

  /**
   * @return a description of the offending row, or null if the failure was
   *     not caused by a particular row
   */
  @Nullable
  public String getRowDescription() {
    return rowDescription;
  }

  /**
   * @return true if the schema or metadata held by the caller disagrees with
   *     the data, which is typical of a stale cached schema
   */
  public abstract boolean isMetadataMismatch();

  /**
   * @return true if the row data itself is malformed
   */
  public boolean isDataCorruption() {
    return !isMetadataMismatch();
  }
}
