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

import org.apache.strata.ColumnSchema;
import org.apache.strata.Type;

/**
 * Identifies the dictionary of a column: the table, the column id and the
 * type the dictionary values are stored as.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public final class ColumnIdentifier {

  private final String tableName;
  private final String columnId;
  private final Type type;

  public ColumnIdentifier(String tableName, String columnId, Type type) {
    this.tableName = Preconditions.checkNotNull(tableName, "tableName");
    this.columnId = Preconditions.checkNotNull(columnId, "columnId");
    this.type = Preconditions.checkNotNull(type, "type");
  }

  static ColumnIdentifier of(String tableName, ColumnSchema column) {
    return new ColumnIdentifier(tableName, column.getColumnId(), column.getType());
  }

  public String getTableName() {
    return tableName;
  }

  public String getColumnId() {
    return columnId;
  }

  public Type getType() {
    return type;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnIdentifier)) {
      return false;
    }
    ColumnIdentifier that = (ColumnIdentifier) o;
    return tableName.equals(that.tableName) &&
        columnId.equals(that.columnId) &&
        type == that.type;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(tableName, columnId, type);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("table", tableName)
        .add("columnId", columnId)
        .add("type", type.getName())
        .toString();
  }
}
