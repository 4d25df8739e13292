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

package org.apache.strata;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Represents a table's schema: its dimensions and its measures, each list in
 * declared order. A column's ordinal is its position in its own list.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public class TableSchema {

  private final String tableName;

  private final List<ColumnSchema> dimensions;

  private final List<ColumnSchema> measures;

  /**
   * Mapping of column name to its ordinal among the dimensions, or among the
   * measures offset by the dimension count.
   */
  private final Map<String, Integer> columnsByName;

  /**
   * Constructs a schema using the specified columns.
   *
   * @param tableName the name of the table
   * @param dimensions the dimensions in declared order
   * @param measures the measures in declared order
   * @throws IllegalArgumentException if two columns share a name
   */
  public TableSchema(String tableName, List<ColumnSchema> dimensions, List<ColumnSchema> measures) {
    this.tableName = Preconditions.checkNotNull(tableName, "tableName");
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.measures = ImmutableList.copyOf(measures);
    this.columnsByName = new HashMap<>(dimensions.size() + measures.size());
    int index = 0;
    for (ColumnSchema column : this.dimensions) {
      addColumnName(column, index++);
    }
    for (ColumnSchema column : this.measures) {
      addColumnName(column, index++);
    }
  }

  private void addColumnName(ColumnSchema column, int index) {
    if (columnsByName.put(column.getName(), index) != null) {
      throw new IllegalArgumentException(
          String.format("Column names must be unique: %s", column.getName()));
    }
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * Get the dimensions of this schema, in declared order
   * @return list of dimensions
   */
  public List<ColumnSchema> getDimensions() {
    return dimensions;
  }

  /**
   * Get the measures of this schema, in declared order
   * @return list of measures
   */
  public List<ColumnSchema> getMeasures() {
    return measures;
  }

  public int getDimensionCount() {
    return dimensions.size();
  }

  public int getMeasureCount() {
    return measures.size();
  }

  /**
   * @return the number of dimensions plus the number of measures
   */
  public int getColumnCount() {
    return dimensions.size() + measures.size();
  }

  /**
   * @param name a column name
   * @return true if a dimension or a measure has this name
   */
  public boolean hasColumn(String name) {
    return columnsByName.containsKey(name);
  }

  /**
   * Get a column by name, looking at dimensions then measures.
   * @param name the column's name
   * @return the column
   * @throws IllegalArgumentException if no column has this name
   */
  public ColumnSchema getColumn(String name) {
    Integer index = columnsByName.get(name);
    if (index == null) {
      throw new IllegalArgumentException(String.format("Unknown column: %s", name));
    }
    return index < dimensions.size() ? dimensions.get(index)
                                     : measures.get(index - dimensions.size());
  }

  /**
   * @return the number of dimensions that store their value in the packed key
   */
  public int getKeyEncodedDimensionCount() {
    int count = 0;
    for (ColumnSchema dimension : dimensions) {
      if (dimension.hasEncoding(Encoding.DICTIONARY)) {
        count++;
      }
    }
    return count;
  }

  /**
   * @return the number of dimensions stored as raw no-dictionary segments
   */
  public int getNoDictionaryDimensionCount() {
    return dimensions.size() - getKeyEncodedDimensionCount();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableSchema)) {
      return false;
    }
    TableSchema that = (TableSchema) o;
    return tableName.equals(that.tableName) &&
        dimensions.equals(that.dimensions) &&
        measures.equals(that.measures);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableName, dimensions, measures);
  }

  @Override
  public String toString() {
    return String.format("TableSchema(%s, dimensions=%s, measures=%s)",
                         tableName, dimensions, measures);
  }
}
