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

import javax.annotation.Nullable;

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Gives access to the global dictionaries of a table.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public interface DictionaryStore {

  /**
   * Looks up the value a surrogate stands for.
   *
   * @param column the dictionary to search
   * @param surrogateKey the surrogate, starting at 1
   * @return the value, typed after the column, or null if the dictionary has
   *     no entry for the surrogate
   * @throws StrataException if the dictionary cannot be read
   */
  @Nullable
  Object lookup(ColumnIdentifier column, int surrogateKey) throws StrataException;
}
