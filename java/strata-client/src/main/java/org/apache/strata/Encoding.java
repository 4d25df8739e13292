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

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Storage encodings a column can carry. A column holds a set of them.
 *
 * Only {@link #DICTIONARY} and {@link #DIRECT_DICTIONARY} decide how a
 * dimension value is read back; the remaining flags describe the physical
 * layout of a column chunk and do not change its logical value.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public enum Encoding {
  /** Values are replaced by surrogates issued by the table's global dictionary. */
  DICTIONARY,
  /** Surrogates are computed from a date/time offset; always paired with DICTIONARY. */
  DIRECT_DICTIONARY,
  INVERTED_INDEX,
  RLE
}
