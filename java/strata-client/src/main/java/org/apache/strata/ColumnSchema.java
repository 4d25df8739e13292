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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Represents a column of a table: a dimension or a measure.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public class ColumnSchema {

  private final String name;
  private final Type type;
  private final String columnId;
  private final Set<Encoding> encodings;
  @Nullable
  private final EncodingFamily encodingFamily;

  private ColumnSchema(String name, Type type, String columnId, Set<Encoding> encodings) {
    this.name = name;
    this.type = type;
    this.columnId = columnId;
    this.encodings = encodings;
    this.encodingFamily = EncodingFamily.fromEncodings(encodings);
  }

  /**
   * Get the column's Type
   * @return the type
   */
  public Type getType() {
    return type;
  }

  /**
   * Get the column's name
   * @return A string representation of the name
   */
  public String getName() {
    return name;
  }

  /**
   * The identifier the dictionary store knows this column by. Defaults to
   * the column name when none was given.
   * @return the column id
   */
  public String getColumnId() {
    return columnId;
  }

  /**
   * @return the column's encodings, never null
   */
  public Set<Encoding> getEncodings() {
    return encodings;
  }

  public boolean hasEncoding(Encoding encoding) {
    return encodings.contains(encoding);
  }

  /**
   * The family this column's values belong to when it is used as a dimension.
   *
   * @return the family, or null when the encoding set is not supported
   *     (a direct dictionary without a dictionary)
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
    if (!(o instanceof ColumnSchema)) {
      return false;
    }
    ColumnSchema that = (ColumnSchema) o;
    return Objects.equals(name, that.name) &&
        Objects.equals(type, that.type) &&
        Objects.equals(columnId, that.columnId) &&
        Objects.equals(encodings, that.encodings);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, columnId, encodings);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Column name: ").append(name).append(", type: ").append(type.getName());
    if (!encodings.isEmpty()) {
      sb.append(", encodings: ").append(encodings);
    }
    return sb.toString();
  }

  /**
   * Builder for ColumnSchema.
   */
  @InterfaceAudience.Public
  @InterfaceStability.Evolving
  public static class ColumnSchemaBuilder {
    private final String name;
    private final Type type;
    private String columnId = null;
    private final EnumSet<Encoding> encodings = EnumSet.noneOf(Encoding.class);

    /**
     * Constructor for the required parameters.
     * @param name column's name
     * @param type column's type
     */
    public ColumnSchemaBuilder(String name, Type type) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.type = Preconditions.checkNotNull(type, "type");
    }

    /**
     * Constructor to copy an existing column.
     * @param that the column to copy
     */
    public ColumnSchemaBuilder(ColumnSchema that) {
      this.name = that.name;
      this.type = that.type;
      this.columnId = that.columnId;
      this.encodings.addAll(that.encodings);
    }

    /**
     * Sets the identifier used to look the column's dictionary up.
     * @param columnId the identifier
     * @return this instance
     */
    public ColumnSchemaBuilder columnId(String columnId) {
      this.columnId = columnId;
      return this;
    }

    /**
     * Adds encodings to the column. No encodings by default, which makes a
     * dimension a no-dictionary dimension.
     * @param encodings encodings to add
     * @return this instance
     */
    public ColumnSchemaBuilder encodings(Encoding... encodings) {
      for (Encoding encoding : encodings) {
        this.encodings.add(Preconditions.checkNotNull(encoding));
      }
      return this;
    }

    /**
     * Adds encodings to the column.
     * @param encodings encodings to add
     * @return this instance
     */
    public ColumnSchemaBuilder encodings(Collection<Encoding> encodings) {
      return encodings(encodings.toArray(new Encoding[0]));
    }

    /**
     * Shorthand for a global dictionary column.
     * @return this instance
     */
    public ColumnSchemaBuilder dictionary() {
      return encodings(Encoding.DICTIONARY);
    }

    /**
     * Shorthand for a direct dictionary column, which also carries the
     * dictionary flag.
     * @return this instance
     */
    public ColumnSchemaBuilder directDictionary() {
      Preconditions.checkState(type.isDirectDictionaryCompatible(),
          "column %s of type %s cannot use a direct dictionary", name, type.getName());
      return encodings(Encoding.DICTIONARY, Encoding.DIRECT_DICTIONARY);
    }

    /**
     * Builds a {@link ColumnSchema} using the passed parameters.
     * @return a new {@link ColumnSchema}
     */
    public ColumnSchema build() {
      return new ColumnSchema(name, type,
                              columnId == null ? name : columnId,
                              Sets.immutableEnumSet(encodings));
    }
  }
}
