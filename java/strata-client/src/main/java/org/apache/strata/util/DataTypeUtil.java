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

package org.apache.strata.util;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;
import org.apache.yetus.audience.InterfaceAudience;

import org.apache.strata.Type;

/**
 * Decodes the raw bytes of no-dictionary dimensions.
 *
 * Fixed width types are stored big-endian with exactly {@link Type#getSize()}
 * bytes. Text is stored as UTF-8 without a length prefix; the scan executor
 * has already cut each value out of the row. A decimal is stored as one scale
 * byte followed by the two's-complement unscaled value.
 */
@InterfaceAudience.Private
public class DataTypeUtil {

  /** Marker the write path stores in place of a null text value. */
  public static final String MEMBER_DEFAULT_VAL = "@NU#LL$!";

  private static final byte[] MEMBER_DEFAULT_VAL_ARRAY = MEMBER_DEFAULT_VAL.getBytes(UTF_8);

  /** Non-constructable utility class. */
  private DataTypeUtil() {
  }

  /**
   * @param data a no-dictionary value
   * @return true if the value is the null member marker
   */
  public static boolean isNullMember(byte[] data) {
    return Arrays.equals(data, MEMBER_DEFAULT_VAL_ARRAY);
  }

  /**
   * Converts the bytes of a no-dictionary value into the Java object for its type.
   *
   * @param data the raw value, not modified
   * @param type the declared type of the column
   * @return the decoded value: a {@link String} for text, a copy of the bytes
   *     for binary, a boxed primitive, {@link BigDecimal}, {@link java.sql.Date}
   *     or {@link java.sql.Timestamp} otherwise; null for the null member marker
   *     and for an empty non-text value
   * @throws IllegalArgumentException if the bytes cannot hold a value of the type
   */
  @Nullable
  public static Object getDataBasedOnDataTypeForNoDictionaryColumn(byte[] data, Type type) {
    Preconditions.checkNotNull(data, "data");
    Preconditions.checkNotNull(type, "type");
    if (type.isText()) {
      return isNullMember(data) ? null : new String(data, UTF_8);
    }
    if (type == Type.BINARY) {
      return data.clone();
    }
    if (data.length == 0) {
      return null;
    }
    switch (type) {
      case BOOL:
        checkWidth(data, type);
        return data[0] != 0;
      case INT16:
        checkWidth(data, type);
        return Shorts.fromByteArray(data);
      case INT32:
        checkWidth(data, type);
        return Ints.fromByteArray(data);
      case INT64:
        checkWidth(data, type);
        return Longs.fromByteArray(data);
      case FLOAT:
        checkWidth(data, type);
        return Float.intBitsToFloat(Ints.fromByteArray(data));
      case DOUBLE:
        checkWidth(data, type);
        return Double.longBitsToDouble(Longs.fromByteArray(data));
      case DATE:
        checkWidth(data, type);
        return DateUtil.epochDaysToSqlDate(Ints.fromByteArray(data));
      case TIMESTAMP:
        checkWidth(data, type);
        return TimestampUtil.microsToTimestamp(Longs.fromByteArray(data));
      case DECIMAL:
        return bytesToBigDecimal(data);
      default:
        throw new IllegalArgumentException(
            String.format("The column type %s is not a valid no-dictionary type", type.getName()));
    }
  }

  private static void checkWidth(byte[] data, Type type) {
    if (data.length != type.getSize()) {
      throw new IllegalArgumentException(String.format(
          "expected %d bytes for a %s value, got %d", type.getSize(), type.getName(), data.length));
    }
  }

  private static BigDecimal bytesToBigDecimal(byte[] data) {
    if (data.length < 2) {
      throw new IllegalArgumentException(String.format(
          "expected a scale byte and at least one value byte for a decimal, got %d bytes",
          data.length));
    }
    int scale = data[0];
    BigInteger unscaled = new BigInteger(Arrays.copyOfRange(data, 1, data.length));
    return new BigDecimal(unscaled, scale);
  }
}
