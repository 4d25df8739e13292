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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.strata.ColumnSchema;
import org.apache.strata.EncodingFamily;
import org.apache.strata.TableSchema;
import org.apache.strata.Type;
import org.apache.strata.util.DataTypeUtil;

/**
 * Extracts the value of the partition column from the rows of one segment.
 *
 * The partition column is located once, when the resolver is built. Every
 * call to {@link #resolve} then reads the column from a row according to how
 * it is stored:
 * <ul>
 *   <li>a direct dictionary dimension is read from the packed key and turned
 *   into a date or timestamp;</li>
 *   <li>a no-dictionary dimension is decoded from its raw bytes;</li>
 *   <li>a global dictionary dimension is read from the packed key and looked
 *   up in the {@link DictionaryStore};</li>
 *   <li>a measure is returned as stored.</li>
 * </ul>
 *
 * A resolver is meant to be used by a single scan task.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@NotThreadSafe
public class PartitionValueResolver {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionValueResolver.class);

  /**
   * Direct dictionary key fields hold the time offset multiplied by this factor.
   */
  public static final long DIRECT_DICTIONARY_SCALE_FACTOR = 1000L;

  private final SegmentProperties segmentProperties;
  private final PartitionSpec partitionSpec;
  private final SchemaClassifier.Classification classification;
  private final ColumnSchema column;
  private final String columnName;
  private final String segmentId;
  private final KeyGenerator keyGenerator;

  /** The branch taken by {@link #resolve}, null for a measure. */
  @Nullable
  private final EncodingFamily family;

  /**
   * Where the value sits: a key field, a no-dictionary segment or a row slot,
   * depending on the branch.
   */
  private final int position;

  @Nullable
  private final DirectDictionaryGenerator directDictionaryGenerator;
  @Nullable
  private final DictionaryStore dictionaryStore;
  @Nullable
  private final ColumnIdentifier columnIdentifier;
  private final boolean returnRangeBytes;

  @Nullable
  private final Map<Integer, Object> dictionaryCache;

  private PartitionValueResolver(Builder builder) throws DecodeException {
    this.segmentProperties = builder.segmentProperties;
    this.partitionSpec = builder.partitionSpec;
    this.segmentId = segmentProperties.getSegmentId();
    this.keyGenerator = segmentProperties.getDimensionKeyGenerator();
    TableSchema schema = segmentProperties.getSchema();
    this.classification = SchemaClassifier.classify(schema.getDimensions(),
                                                    schema.getMeasures(),
                                                    partitionSpec.getColumnName(),
                                                    builder.missingColumnPolicy,
                                                    segmentId);
    PartitionColumn partitionColumn = classification.getPartitionColumn();
    IndexGroups groups = classification.getIndexGroups();
    this.column = partitionColumn.getColumn();
    this.columnName = column.getName();
    this.family = partitionColumn.getEncodingFamily();
    int index = partitionColumn.getIndex();

    DirectDictionaryGenerator generator = null;
    DictionaryStore store = null;
    ColumnIdentifier identifier = null;
    Map<Integer, Object> cache = null;
    boolean rangeBytes = false;
    if (family == null) {
      position = groups.getMeasureIndexGroup().get(index);
    } else {
      switch (family) {
        case DIRECT_DICTIONARY:
          if (!column.getType().isDirectDictionaryCompatible()) {
            throw new UnsupportedColumnEncodingException(
                "type " + column.getType().getName() + " cannot be direct dictionary encoded",
                columnName, segmentId);
          }
          generator = builder.directDictionaryGenerator == null ?
              DirectDictionaryGenerators.forType(column.getType()) :
              builder.directDictionaryGenerator;
          Preconditions.checkArgument(generator.getType() == column.getType(),
              "direct dictionary generator for %s cannot decode column %s of type %s",
              generator.getType().getName(), columnName, column.getType().getName());
          position = groups.getDictionaryIndexGroup().indexOf(index);
          break;
        case NO_DICTIONARY:
          position = groups.getNoDictionaryIndexGroup().indexOf(index);
          break;
        case DICTIONARY:
          store = builder.dictionaryStore;
          Preconditions.checkState(store != null,
              "a dictionary store is required to resolve dictionary column %s", columnName);
          identifier = ColumnIdentifier.of(schema.getTableName(), column);
          rangeBytes = column.getType() == Type.STRING &&
              partitionSpec.getPartitionType() == PartitionType.RANGE;
          if (builder.memoizeDictionaryLookups) {
            cache = new HashMap<>();
          }
          // Legacy layout: the surrogate is read from the key field at the
          // column's dimension ordinal, not at its position among the
          // dictionary dimensions. The two only agree when every dimension
          // before the partition column is dictionary encoded.
          position = index;
          if (LOG.isDebugEnabled() && groups.getDictionaryIndexGroup().indexOf(index) != index) {
            LOG.debug("Dictionary column {} of segment {} is read from key field {} " +
                      "although it is dictionary dimension #{}", columnName, segmentId,
                      index, groups.getDictionaryIndexGroup().indexOf(index));
          }
          break;
        default:
          throw new IllegalStateException("unknown encoding family " + family);
      }
    }
    this.directDictionaryGenerator = generator;
    this.dictionaryStore = store;
    this.columnIdentifier = identifier;
    this.returnRangeBytes = rangeBytes;
    this.dictionaryCache = cache;
    LOG.debug("Built partition value resolver for {} in segment {}: {}",
              partitionSpec, segmentId, partitionColumn);
  }

  /**
   * Resolves the partition value of a row.
   *
   * @param row a row of the segment this resolver was built for
   * @return the value of the partition column, typed after the column; the
   *     UTF-8 bytes of the dictionary value for a string column under range
   *     partitioning
   * @throws SchemaMismatchException if the row lacks the slot, segment or key
   *     field the partition column lives in
   * @throws KeyDecodeException if the packed key or the raw value is malformed
   * @throws DictionaryLookupException if the dictionary has no entry for the
   *     surrogate read from the key
   * @throws StrataException if the dictionary store fails
   */
  @Nullable
  public Object resolve(EncodedRow row) throws StrataException {
    Preconditions.checkNotNull(row, "row");
    if (family == null) {
      return resolveMeasure(row);
    }
    switch (family) {
      case DIRECT_DICTIONARY:
        return resolveDirectDictionary(row);
      case NO_DICTIONARY:
        return resolveNoDictionary(row);
      case DICTIONARY:
        return resolveDictionary(row);
      default:
        throw new IllegalStateException("unknown encoding family " + family);
    }
  }

  private Object resolveMeasure(EncodedRow row) throws DecodeException {
    if (position >= row.getSlotCount()) {
      throw new SchemaMismatchException(
          String.format("row has no slot %d for measure", position),
          columnName, segmentId, row.toString());
    }
    return row.getSlot(position);
  }

  private Object resolveDirectDictionary(EncodedRow row) throws DecodeException {
    long[] keyArray = decodeKey(row);
    checkKeyField(row, keyArray);
    long offset = keyArray[position] / DIRECT_DICTIONARY_SCALE_FACTOR;
    if (offset > Integer.MAX_VALUE || offset < Integer.MIN_VALUE) {
      throw new KeyDecodeException(
          String.format("direct dictionary offset %d does not fit in an int", offset),
          columnName, segmentId, row.toString(), null);
    }
    try {
      return directDictionaryGenerator.getValueFromSurrogate((int) offset);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new KeyDecodeException(
          "cannot convert direct dictionary offset " + offset + ": " + e.getMessage(),
          columnName, segmentId, row.toString(), e);
    }
  }

  private Object resolveNoDictionary(EncodedRow row) throws DecodeException {
    if (position >= row.getNoDictionaryKeyCount()) {
      throw new SchemaMismatchException(
          String.format("row has %d no-dictionary values, expected at least %d",
                        row.getNoDictionaryKeyCount(), position + 1),
          columnName, segmentId, row.toString());
    }
    try {
      return DataTypeUtil.getDataBasedOnDataTypeForNoDictionaryColumn(
          row.noDictionaryKeyUnsafe(position), column.getType());
    } catch (IllegalArgumentException e) {
      throw new KeyDecodeException(
          "cannot decode no-dictionary value: " + e.getMessage(),
          columnName, segmentId, row.toString(), e);
    }
  }

  private Object resolveDictionary(EncodedRow row) throws StrataException {
    long[] keyArray = decodeKey(row);
    checkKeyField(row, keyArray);
    long surrogate = keyArray[position];
    if (surrogate > Integer.MAX_VALUE) {
      throw new KeyDecodeException(
          String.format("surrogate %d does not fit in an int", surrogate),
          columnName, segmentId, row.toString(), null);
    }
    int surrogateKey = (int) surrogate;
    Object value = dictionaryCache == null ? null : dictionaryCache.get(surrogateKey);
    if (value == null) {
      value = dictionaryStore.lookup(columnIdentifier, surrogateKey);
      if (value == null) {
        throw new DictionaryLookupException(surrogateKey, columnName, segmentId, row.toString());
      }
      if (dictionaryCache != null) {
        dictionaryCache.put(surrogateKey, value);
      }
    }
    if (returnRangeBytes && !(value instanceof byte[])) {
      return value.toString().getBytes(UTF_8);
    }
    return value;
  }

  private long[] decodeKey(EncodedRow row) throws KeyDecodeException {
    try {
      return keyGenerator.getKeyArray(row.dictionaryKeyUnsafe());
    } catch (IllegalArgumentException e) {
      throw new KeyDecodeException(
          "cannot decode dictionary key: " + e.getMessage(),
          columnName, segmentId, row.toString(), e);
    }
  }

  private void checkKeyField(EncodedRow row, long[] keyArray) throws SchemaMismatchException {
    if (position < 0 || position >= keyArray.length) {
      throw new SchemaMismatchException(
          String.format("dictionary key has %d fields, no field %d", keyArray.length, position),
          columnName, segmentId, row.toString());
    }
  }

  public SegmentProperties getSegmentProperties() {
    return segmentProperties;
  }

  public PartitionSpec getPartitionSpec() {
    return partitionSpec;
  }

  /**
   * @return the index groups and partition column computed at construction
   */
  public SchemaClassifier.Classification getClassification() {
    return classification;
  }

  /**
   * @return the number of distinct surrogates cached so far, 0 when lookups
   *     are not memoized
   */
  int getCachedDictionaryEntryCount() {
    return dictionaryCache == null ? 0 : dictionaryCache.size();
  }

  /**
   * Builder for a {@link PartitionValueResolver}.
   */
  @InterfaceAudience.Public
  @InterfaceStability.Evolving
  public static class Builder {
    private final SegmentProperties segmentProperties;
    private final PartitionSpec partitionSpec;
    private DictionaryStore dictionaryStore;
    private MissingColumnPolicy missingColumnPolicy = MissingColumnPolicy.FAIL;
    private boolean memoizeDictionaryLookups = false;
    private DirectDictionaryGenerator directDictionaryGenerator;

    /**
     * @param segmentProperties the segment whose rows will be resolved
     * @param partitionSpec the partition column and partitioning
     */
    public Builder(SegmentProperties segmentProperties, PartitionSpec partitionSpec) {
      this.segmentProperties = Preconditions.checkNotNull(segmentProperties, "segmentProperties");
      this.partitionSpec = Preconditions.checkNotNull(partitionSpec, "partitionSpec");
    }

    /**
     * Sets the dictionary store. Required when the partition column is a
     * global dictionary dimension.
     * @param dictionaryStore the store
     * @return this instance
     */
    public Builder dictionaryStore(DictionaryStore dictionaryStore) {
      this.dictionaryStore = dictionaryStore;
      return this;
    }

    /**
     * Sets what to do when the partition column is not in the schema.
     * Defaults to {@link MissingColumnPolicy#FAIL}.
     * @param policy the policy
     * @return this instance
     */
    public Builder missingColumnPolicy(MissingColumnPolicy policy) {
      this.missingColumnPolicy = Preconditions.checkNotNull(policy, "policy");
      return this;
    }

    /**
     * Caches the value of every surrogate looked up in the dictionary store
     * for the life of the resolver. Off by default.
     * @param memoize whether to cache lookups
     * @return this instance
     */
    public Builder memoizeDictionaryLookups(boolean memoize) {
      this.memoizeDictionaryLookups = memoize;
      return this;
    }

    /**
     * Replaces the built-in generator of a direct dictionary partition column.
     * @param generator a generator for the column's type
     * @return this instance
     */
    public Builder directDictionaryGenerator(DirectDictionaryGenerator generator) {
      this.directDictionaryGenerator = generator;
      return this;
    }

    /**
     * Locates the partition column and builds the resolver.
     * @return a new resolver
     * @throws DecodeException if the partition column is missing from the
     *     schema or stored in a way that cannot be decoded
     */
    public PartitionValueResolver build() throws DecodeException {
      return new PartitionValueResolver(this);
    }
  }
}
