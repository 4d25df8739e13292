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

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Packs the surrogates of a row's dictionary-style dimensions into one key,
 * and splits such a key back into surrogates.
 *
 * Implementations must be immutable: a single instance is shared by every
 * resolver scanning the segment it was built for.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public interface KeyGenerator {

  /**
   * @return the number of surrogates held in one key
   */
  int getDimensionCount();

  /**
   * @return the length of a key, in bytes
   */
  int getKeySizeInBytes();

  /**
   * Splits a packed key into one surrogate per dimension, in declared order.
   *
   * @param key the packed key, not modified
   * @return the surrogates
   * @throws IllegalArgumentException if the key cannot have been produced by
   *     this generator
   */
  long[] getKeyArray(byte[] key);

  /**
   * Packs surrogates into a key.
   *
   * @param keys one surrogate per dimension, in declared order
   * @return the packed key
   * @throws IllegalArgumentException if the number of surrogates is wrong or a
   *     surrogate does not fit its field
   */
  byte[] generateKey(long[] keys);
}
