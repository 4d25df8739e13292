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

import java.util.Arrays;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * A {@link KeyGenerator} giving every dimension a fixed number of bits.
 *
 * The key is a big-endian bit string. Fields follow each other in declared
 * dimension order, the first field in the most significant bits, and the
 * whole string is aligned to the end of the last byte: the unused high bits
 * of the first byte are always zero.
 *
 * <pre>
 *   widths {3, 6, 4}, surrogates {5, 33, 9}:
 *   0 0 0 1 0 1 1 0 | 0 0 0 1 1 0 0 1
 *   pad   |  5  |     33    |   9
 * </pre>
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public final class BitPackedKeyGenerator implements KeyGenerator {

  /** The widest field a key can hold. */
  public static final int MAX_FIELD_WIDTH = Long.SIZE;

  private final int[] widths;
  private final int totalBits;
  private final int keySize;
  private final int padBits;

  /**
   * Creates a generator from explicit field widths.
   *
   * @param widths the number of bits of every dimension, in declared order
   */
  public BitPackedKeyGenerator(int... widths) {
    Preconditions.checkNotNull(widths, "widths");
    int total = 0;
    for (int i = 0; i < widths.length; i++) {
      Preconditions.checkArgument(widths[i] >= 1 && widths[i] <= MAX_FIELD_WIDTH,
          "width of dimension %s must be between 1 and %s bits, got %s",
          i, MAX_FIELD_WIDTH, widths[i]);
      total += widths[i];
    }
    this.widths = widths.clone();
    this.totalBits = total;
    this.keySize = (total + Byte.SIZE - 1) / Byte.SIZE;
    this.padBits = keySize * Byte.SIZE - total;
  }

  /**
   * Creates a generator sized for the cardinality of every dimension.
   *
   * @param cardinalities the number of distinct surrogates of every dimension,
   *     in declared order; surrogates run from 1 to the cardinality
   * @return a new generator
   */
  public static BitPackedKeyGenerator forCardinalities(int... cardinalities) {
    Preconditions.checkNotNull(cardinalities, "cardinalities");
    int[] widths = new int[cardinalities.length];
    for (int i = 0; i < cardinalities.length; i++) {
      widths[i] = bitsForCardinality(cardinalities[i]);
    }
    return new BitPackedKeyGenerator(widths);
  }

  /**
   * @param cardinality the largest surrogate of a dimension
   * @return the number of bits needed to store it, at least one
   */
  static int bitsForCardinality(long cardinality) {
    Preconditions.checkArgument(cardinality >= 0, "negative cardinality: %s", cardinality);
    return Math.max(1, Long.SIZE - Long.numberOfLeadingZeros(cardinality));
  }

  @Override
  public int getDimensionCount() {
    return widths.length;
  }

  @Override
  public int getKeySizeInBytes() {
    return keySize;
  }

  /**
   * @return a copy of the width table
   */
  public int[] getWidths() {
    return widths.clone();
  }

  @Override
  public long[] getKeyArray(byte[] key) {
    Preconditions.checkNotNull(key, "key");
    if (key.length != keySize) {
      throw new IllegalArgumentException(String.format(
          "expected a key of %d bytes for %d bits of surrogates, got %d bytes",
          keySize, totalBits, key.length));
    }
    if (padBits > 0 && ((key[0] & 0xFF) >>> (Byte.SIZE - padBits)) != 0) {
      throw new IllegalArgumentException(
          "padding bits are set in key " + BaseEncoding.base16().encode(key));
    }
    long[] keys = new long[widths.length];
    int offset = padBits;
    for (int i = 0; i < widths.length; i++) {
      keys[i] = readBits(key, offset, widths[i]);
      offset += widths[i];
    }
    return keys;
  }

  @Override
  public byte[] generateKey(long[] keys) {
    Preconditions.checkNotNull(keys, "keys");
    if (keys.length != widths.length) {
      throw new IllegalArgumentException(String.format(
          "expected %d surrogates, got %d", widths.length, keys.length));
    }
    byte[] key = new byte[keySize];
    int offset = padBits;
    for (int i = 0; i < widths.length; i++) {
      int width = widths[i];
      if (width < MAX_FIELD_WIDTH && (keys[i] < 0 || (keys[i] >>> width) != 0)) {
        throw new IllegalArgumentException(String.format(
            "surrogate %d of dimension %d does not fit in %d bits", keys[i], i, width));
      }
      writeBits(key, offset, width, keys[i]);
      offset += width;
    }
    return key;
  }

  /**
   * Reads {@code width} bits starting {@code offset} bits into the key,
   * counting from the most significant bit of the first byte.
   */
  private static long readBits(byte[] key, int offset, int width) {
    long value = 0;
    int remaining = width;
    int pos = offset;
    while (remaining > 0) {
      int available = Byte.SIZE - (pos & 7);
      int take = Math.min(available, remaining);
      int bits = ((key[pos >>> 3] & 0xFF) >>> (available - take)) & ((1 << take) - 1);
      value = (value << take) | bits;
      remaining -= take;
      pos += take;
    }
    return value;
  }

  private static void writeBits(byte[] key, int offset, int width, long value) {
    int remaining = width;
    int pos = offset;
    while (remaining > 0) {
      int available = Byte.SIZE - (pos & 7);
      int take = Math.min(available, remaining);
      int bits = (int) ((value >>> (remaining - take)) & ((1 << take) - 1));
      key[pos >>> 3] |= (byte) (bits << (available - take));
      remaining -= take;
      pos += take;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BitPackedKeyGenerator)) {
      return false;
    }
    return Arrays.equals(widths, ((BitPackedKeyGenerator) o).widths);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(widths);
  }

  @Override
  public String toString() {
    return "BitPackedKeyGenerator(widths=" + Arrays.toString(widths) +
        ", keySize=" + keySize + ")";
  }
}
