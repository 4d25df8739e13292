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

import org.apache.strata.Type;

/**
 * Turns the value stored in the key field of a direct dictionary dimension
 * back into a date or a timestamp.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public interface DirectDictionaryGenerator {

  /**
   * @param surrogate the key field divided by
   *     {@link PartitionValueResolver#DIRECT_DICTIONARY_SCALE_FACTOR}
   * @return the date or timestamp
   * @throws IllegalArgumentException if the value is outside the supported range
   */
  Object getValueFromSurrogate(int surrogate);

  /**
   * @return the column type this generator produces values for
   */
  Type getType();
}
