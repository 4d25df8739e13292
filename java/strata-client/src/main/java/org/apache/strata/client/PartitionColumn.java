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
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

import org.apache.strata.ColumnSchema;
import org.apache.strata.EncodingFamily;

/**
 * The partition column as located in a schema: the column itself, whether it
 * is a dimension, its ordinal among the dimensions or the measures, and for a
 * dimension the encoding family its values are stored with.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public final class PartitionColumn {

  private final ColumnSchema column;
  private final int index;
  private final boolean dimension;
  @Nullable
  private final EncodingFamily encodingFamily;

  PartitionColumn(ColumnSchema column, int index, boolean dimension,
                  @Nullable EncodingFamily encodingFamily) {
    this.column = column;
    this.index = index;
    this.dimension = dimension;
    this.encodingFamily = encodingFamily;
  }

  public ColumnSchema getColumn() {
    return column;
  }

  /**
   * @return the ordinal of the column among the dimensions if it is a
   *     dimension, among the measures otherwise
   */
  public int getIndex() {
    return index;
  }

  public boolean isDimension() {
    return dimension;
  }

  /**
   * @return the encoding family of a dimension, null for a measure
   */
  @Nullable
  public EncodingFamily getEncodingFamily() {
    return encodingFamily;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionColumn)) {
      return false;
    }
    PartitionColumn that = (PartitionColumn) o;
    return index == that.index &&
        dimension == that.dimension &&
        encodingFamily == that.encodingFamily &&
        column.equals(that.column);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(column, index, dimension, encodingFamily);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("column", column.getName())
        .add("index", index)
        .add("dimension", dimension)
        .add("family", encodingFamily)
        .toString();
  }
}
