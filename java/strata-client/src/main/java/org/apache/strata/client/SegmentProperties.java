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
import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

import org.apache.strata.ColumnSchema;
import org.apache.strata.Encoding;
import org.apache.strata.TableSchema;

/**
 * What a resolver needs to know about the segment it scans: its id, the
 * schema its rows were written with and the key generator that packed their
 * dictionary keys.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public class SegmentProperties {

  /**
   * Width of the key field of a direct dictionary dimension. Its values are
   * scaled time offsets rather than dictionary surrogates and have no
   * meaningful cardinality.
   */
  public static final int DIRECT_DICTIONARY_KEY_WIDTH = BitPackedKeyGenerator.MAX_FIELD_WIDTH;

  private final String segmentId;
  private final TableSchema schema;
  private final KeyGenerator keyGenerator;

  /**
   * @param segmentId the id of the segment
   * @param schema the schema the segment was written with
   * @param keyGenerator the generator of the segment's dictionary keys, with
   *     one field per dimension carrying the {@link Encoding#DICTIONARY} flag
   */
  public SegmentProperties(String segmentId, TableSchema schema, KeyGenerator keyGenerator) {
    this.segmentId = Preconditions.checkNotNull(segmentId, "segmentId");
    this.schema = Preconditions.checkNotNull(schema, "schema");
    this.keyGenerator = Preconditions.checkNotNull(keyGenerator, "keyGenerator");
    Preconditions.checkArgument(
        keyGenerator.getDimensionCount() == schema.getKeyEncodedDimensionCount(),
        "key generator of segment %s has %s fields but the schema has %s dictionary dimensions",
        segmentId, keyGenerator.getDimensionCount(), schema.getKeyEncodedDimensionCount());
  }

  /**
   * Creates the properties of a segment whose key generator is sized from the
   * cardinalities of its global dictionary dimensions.
   *
   * @param segmentId the id of the segment
   * @param schema the schema the segment was written with
   * @param cardinalities the cardinality of every global dictionary dimension,
   *     in declared order; direct dictionary dimensions take no cardinality and
   *     get {@link #DIRECT_DICTIONARY_KEY_WIDTH} bits
   * @return the segment properties
   */
  public static SegmentProperties withCardinalities(String segmentId,
                                                    TableSchema schema,
                                                    int... cardinalities) {
    Preconditions.checkNotNull(schema, "schema");
    Preconditions.checkNotNull(cardinalities, "cardinalities");
    int[] widths = new int[schema.getKeyEncodedDimensionCount()];
    int field = 0;
    int next = 0;
    for (ColumnSchema dimension : schema.getDimensions()) {
      if (!dimension.hasEncoding(Encoding.DICTIONARY)) {
        continue;
      }
      if (dimension.hasEncoding(Encoding.DIRECT_DICTIONARY)) {
        widths[field++] = DIRECT_DICTIONARY_KEY_WIDTH;
      } else {
        Preconditions.checkArgument(next < cardinalities.length,
            "no cardinality given for dimension %s", dimension.getName());
        widths[field++] = BitPackedKeyGenerator.bitsForCardinality(cardinalities[next++]);
      }
    }
    Preconditions.checkArgument(next == cardinalities.length,
        "%s cardinalities given for %s global dictionary dimensions",
        cardinalities.length, next);
    return new SegmentProperties(segmentId, schema, new BitPackedKeyGenerator(widths));
  }

  public String getSegmentId() {
    return segmentId;
  }

  public TableSchema getSchema() {
    return schema;
  }

  /**
   * @return the generator that packed the dictionary keys of the segment
   */
  public KeyGenerator getDimensionKeyGenerator() {
    return keyGenerator;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("segmentId", segmentId)
        .add("table", schema.getTableName())
        .add("keyGenerator", keyGenerator)
        .toString();
  }
}
