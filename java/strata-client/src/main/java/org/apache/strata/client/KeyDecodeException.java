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
 * The packed key or a no-dictionary segment of a row cannot be decoded: its
 * length disagrees with the key generator's width table, its padding bits are
 * set, or a fixed width value has the wrong number of bytes.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public class KeyDecodeException extends DecodeException {

  KeyDecodeException(String message,
                     String columnName,
                     @Nullable String segmentId,
                     @Nullable String rowDescription,
                     @Nullable Throwable cause) {
    super(Status.Corruption(describe(message, columnName, segmentId, rowDescription)),
          columnName, segmentId, rowDescription, cause);
  }

  @Override
  public boolean isMetadataMismatch() {
    return false;
  }
}
