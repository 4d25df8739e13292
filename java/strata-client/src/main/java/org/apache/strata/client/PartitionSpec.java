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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Names the partition column of a table and the kind of partitioning
 * applied to it.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public class PartitionSpec {

  private final String columnName;
  private final PartitionType partitionType;

  public PartitionSpec(String columnName, PartitionType partitionType) {
    this.columnName = Preconditions.checkNotNull(columnName, "columnName");
    this.partitionType = Preconditions.checkNotNull(partitionType, "partitionType");
  }

  public String getColumnName() {
    return columnName;
  }

  public PartitionType getPartitionType() {
    return partitionType;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionSpec)) {
      return false;
    }
    PartitionSpec that = (PartitionSpec) o;
    return columnName.equals(that.columnName) && partitionType == that.partitionType;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(columnName, partitionType);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("column", columnName)
        .add("type", partitionType)
        .toString();
  }
}
