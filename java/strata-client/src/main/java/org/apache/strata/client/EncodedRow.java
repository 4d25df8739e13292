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
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * One row of a raw scan result.
 *
 * The row is addressed by slots: slot 0 holds the packed dictionary key,
 * slot {@code i >= 1} holds the value of measure {@code i - 1}. The raw bytes
 * of the no-dictionary dimensions travel with the key.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public final class EncodedRow {

  private final byte[] dictionaryKey;
  private final byte[][] noDictionaryKeys;
  private final List<Object> measureValues;

  /**
   * @param dictionaryKey the packed surrogates of the dictionary dimensions
   * @param noDictionaryKeys the raw value of every no-dictionary dimension,
   *     in declared order
   * @param measureValues the value of every measure, in declared order; may
   *     contain nulls
   */
  public EncodedRow(byte[] dictionaryKey, List<byte[]> noDictionaryKeys, List<?> measureValues) {
    Preconditions.checkNotNull(dictionaryKey, "dictionaryKey");
    Preconditions.checkNotNull(noDictionaryKeys, "noDictionaryKeys");
    Preconditions.checkNotNull(measureValues, "measureValues");
    this.dictionaryKey = dictionaryKey.clone();
    this.noDictionaryKeys = new byte[noDictionaryKeys.size()][];
    for (int i = 0; i < this.noDictionaryKeys.length; i++) {
      this.noDictionaryKeys[i] =
          Preconditions.checkNotNull(noDictionaryKeys.get(i), "noDictionaryKeys[%s]", i).clone();
    }
    this.measureValues = Collections.unmodifiableList(new ArrayList<Object>(measureValues));
  }

  /**
   * @return a copy of the packed dictionary key
   */
  public byte[] getDictionaryKey() {
    return dictionaryKey.clone();
  }

  public int getNoDictionaryKeyCount() {
    return noDictionaryKeys.length;
  }

  /**
   * @param index the position of the value among the no-dictionary dimensions
   * @return a copy of the raw value
   */
  public byte[] getNoDictionaryKey(int index) {
    return noDictionaryKeys[index].clone();
  }

  /**
   * @return the measure values, in declared order
   */
  public List<Object> getMeasureValues() {
    return measureValues;
  }

  /**
   * @return the number of slots of the row: the key plus one per measure
   */
  public int getSlotCount() {
    return measureValues.size() + 1;
  }

  /**
   * @param slot the slot to read
   * @return a copy of the dictionary key for slot 0, the measure value otherwise
   * @throws IndexOutOfBoundsException if the row has no such slot
   */
  @Nullable
  public Object getSlot(int slot) {
    if (slot == 0) {
      return getDictionaryKey();
    }
    return measureValues.get(slot - 1);
  }

  /** Reads a no-dictionary value without copying it. */
  byte[] noDictionaryKeyUnsafe(int index) {
    return noDictionaryKeys[index];
  }

  /** Reads the dictionary key without copying it. */
  byte[] dictionaryKeyUnsafe() {
    return dictionaryKey;
  }

  @Override
  public String toString() {
    return "EncodedRow(key=" + BaseEncoding.base16().encode(dictionaryKey) +
        ", noDictionaryKeys=" + noDictionaryKeys.length +
        ", measures=" + measureValues.size() + ")";
  }
}
