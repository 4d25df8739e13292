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

import java.util.Set;

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * The way a dimension's value is represented in a scanned row. Every dimension
 * belongs to exactly one family, resolved once from its encoding set.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public enum EncodingFamily {
  /** Surrogate in the packed key, looked up in the global dictionary. */
  DICTIONARY,
  /** Scaled date/time offset in the packed key. */
  DIRECT_DICTIONARY,
  /** Raw typed bytes in the row's no-dictionary segments. */
  NO_DICTIONARY;

  /**
   * Resolves the family of a dimension from its encoding set.
   *
   * @param encodings the dimension's encodings
   * @return the family, or null if the set combines the flags in a way no
   *     family accepts (a direct dictionary without a dictionary)
   */
  static EncodingFamily fromEncodings(Set<Encoding> encodings) {
    boolean dictionary = encodings.contains(Encoding.DICTIONARY);
    boolean direct = encodings.contains(Encoding.DIRECT_DICTIONARY);
    if (direct) {
      return dictionary ? DIRECT_DICTIONARY : null;
    }
    return dictionary ? DICTIONARY : NO_DICTIONARY;
  }

  /**
   * @return true if values of this family live in the packed dictionary key
   */
  public boolean isKeyEncoded() {
    return this != NO_DICTIONARY;
  }
}
