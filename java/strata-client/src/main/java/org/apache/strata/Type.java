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

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Describes all the types available to build table schemas.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public enum Type {

  BOOL("bool", 1),
  INT16("int16", Shorts.BYTES),
  INT32("int32", Ints.BYTES),
  INT64("int64", Longs.BYTES),
  FLOAT("float", Ints.BYTES),
  DOUBLE("double", Longs.BYTES),
  DECIMAL("decimal", Type.VARIABLE_SIZE),
  STRING("string", Type.VARIABLE_SIZE),
  VARCHAR("varchar", Type.VARIABLE_SIZE),
  BINARY("binary", Type.VARIABLE_SIZE),
  // Days since the Unix epoch.
  DATE("date", Ints.BYTES),
  // Microseconds since the Unix epoch.
  TIMESTAMP("timestamp", Longs.BYTES);

  /** Size reported by types whose no-dictionary encoding has no fixed width. */
  public static final int VARIABLE_SIZE = -1;

  private final String name;
  private final int size;

  /**
   * Private constructor used to pre-create the types
   * @param name string representation of the type
   * @param size width of the type's no-dictionary encoding, or {@link #VARIABLE_SIZE}
   */
  Type(String name, int size) {
    this.name = name;
    this.size = size;
  }

  /**
   * Get the string representation of this type
   * @return The type's name
   */
  public String getName() {
    return this.name;
  }

  /**
   * The width of this type when stored as a no-dictionary value.
   * @return A size in bytes, or {@link #VARIABLE_SIZE}
   */
  public int getSize() {
    return this.size;
  }

  /**
   * @return true if the no-dictionary encoding of this type has a fixed width
   */
  public boolean isFixedSize() {
    return this.size != VARIABLE_SIZE;
  }

  /**
   * @return true for the character types, whose values are decoded as UTF-8 text
   */
  public boolean isText() {
    return this == STRING || this == VARCHAR;
  }

  /**
   * @return true for the types a direct dictionary can encode
   */
  public boolean isDirectDictionaryCompatible() {
    return this == DATE || this == TIMESTAMP;
  }

  @Override
  public String toString() {
    return "Type: " + this.name + ", size: " +
        (isFixedSize() ? String.valueOf(this.size) : "variable");
  }

  /**
   * Convert the name of a type to a Type.
   * @param name the type's name, case insensitive
   * @return a matching Type
   * @throws IllegalArgumentException if no type has this name
   */
  public static Type getTypeForName(String name) {
    for (Type t : values()) {
      if (t.name.equalsIgnoreCase(name)) {
        return t;
      }
    }
    throw new IllegalArgumentException("The provided name doesn't map to any known type: " + name);
  }
}
