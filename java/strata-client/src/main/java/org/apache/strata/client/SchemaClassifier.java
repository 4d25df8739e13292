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
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.strata.ColumnSchema;
import org.apache.strata.Encoding;
import org.apache.strata.EncodingFamily;

/**
 * Sorts the columns of a schema into index groups and locates the partition
 * column among them.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public final class SchemaClassifier {

  private static final Logger LOG = LoggerFactory.getLogger(SchemaClassifier.class);

  private SchemaClassifier() {
  }

  /**
   * The outcome of {@link #classify}.
   */
  @InterfaceAudience.Public
  @InterfaceStability.Evolving
  @Immutable
  public static final class Classification {
    private final IndexGroups indexGroups;
    private final PartitionColumn partitionColumn;

    Classification(IndexGroups indexGroups, PartitionColumn partitionColumn) {
      this.indexGroups = indexGroups;
      this.partitionColumn = partitionColumn;
    }

    public IndexGroups getIndexGroups() {
      return indexGroups;
    }

    public PartitionColumn getPartitionColumn() {
      return partitionColumn;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Classification)) {
        return false;
      }
      Classification that = (Classification) o;
      return indexGroups.equals(that.indexGroups) &&
          partitionColumn.equals(that.partitionColumn);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(indexGroups, partitionColumn);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("indexGroups", indexGroups)
          .add("partitionColumn", partitionColumn)
          .toString();
    }
  }

  /**
   * Classifies the columns of a schema.
   *
   * @param dimensions the dimensions, in declared order
   * @param measures the measures, in declared order
   * @param partitionColumnName the name of the partition column
   * @param policy what to do if no column has that name
   * @return the index groups and the partition column descriptor
   * @throws SchemaMismatchException if the partition column cannot be found
   *     and the policy is {@link MissingColumnPolicy#FAIL}, or the schema has
   *     no column at all
   * @throws UnsupportedColumnEncodingException if the partition column is a
   *     dimension whose encodings no family accepts
   */
  public static Classification classify(List<ColumnSchema> dimensions,
                                        List<ColumnSchema> measures,
                                        String partitionColumnName,
                                        MissingColumnPolicy policy) throws DecodeException {
    return classify(dimensions, measures, partitionColumnName, policy, null);
  }

  static Classification classify(List<ColumnSchema> dimensions,
                                 List<ColumnSchema> measures,
                                 String partitionColumnName,
                                 MissingColumnPolicy policy,
                                 @Nullable String segmentId) throws DecodeException {
    Preconditions.checkNotNull(dimensions, "dimensions");
    Preconditions.checkNotNull(measures, "measures");
    Preconditions.checkNotNull(partitionColumnName, "partitionColumnName");
    Preconditions.checkNotNull(policy, "policy");

    List<Integer> noDictionaryIndexGroup = new ArrayList<>();
    List<Integer> dictionaryIndexGroup = new ArrayList<>();
    List<Integer> measureIndexGroup = new ArrayList<>(measures.size());
    for (int i = 0; i < dimensions.size(); i++) {
      if (dimensions.get(i).hasEncoding(Encoding.DICTIONARY)) {
        dictionaryIndexGroup.add(i);
      } else {
        noDictionaryIndexGroup.add(i);
      }
    }
    for (int i = 0; i < measures.size(); i++) {
      // Slot 0 of a row is the packed key.
      measureIndexGroup.add(i + 1);
    }
    IndexGroups groups =
        new IndexGroups(noDictionaryIndexGroup, dictionaryIndexGroup, measureIndexGroup);

    int columnCount = dimensions.size() + measures.size();
    int index = -1;
    for (int i = 0; i < columnCount; i++) {
      ColumnSchema column = i < dimensions.size() ? dimensions.get(i)
                                                  : measures.get(i - dimensions.size());
      // Keep scanning: with duplicate names the last column wins.
      if (column.getName().equals(partitionColumnName)) {
        index = i;
      }
    }
    if (index == -1) {
      if (policy == MissingColumnPolicy.FAIL || columnCount == 0) {
        throw new SchemaMismatchException(
            String.format("partition column not found among %d dimensions and %d measures",
                          dimensions.size(), measures.size()),
            partitionColumnName, segmentId, null);
      }
      index = 0;
      ColumnSchema first = dimensions.isEmpty() ? measures.get(0) : dimensions.get(0);
      LOG.warn("Partition column {} not found in the schema of segment {}, " +
               "resolving first column {} instead", partitionColumnName, segmentId,
               first.getName());
    }

    PartitionColumn partitionColumn;
    if (index < dimensions.size()) {
      ColumnSchema column = dimensions.get(index);
      EncodingFamily family = column.getEncodingFamily();
      if (family == null) {
        throw new UnsupportedColumnEncodingException(
            "encodings " + column.getEncodings() + " do not form a supported combination",
            column.getName(), segmentId);
      }
      partitionColumn = new PartitionColumn(column, index, true, family);
    } else {
      int measureIndex = index - dimensions.size();
      partitionColumn = new PartitionColumn(measures.get(measureIndex), measureIndex, false, null);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Classified partition column {} as {} with {}",
                partitionColumnName, partitionColumn, groups);
    }
    return new Classification(groups, partitionColumn);
  }
}
