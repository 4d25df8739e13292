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
 * A surrogate read from the packed key has no entry in the column's
 * dictionary. The dictionary snapshot is older than the data.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public class DictionaryLookupException extends DecodeException {

  private final int surrogateKey;

  DictionaryLookupException(int surrogateKey,
                            String columnName,
                            @Nullable String segmentId,
                            @Nullable String rowDescription) {
    super(Status.NotFound(describe("no dictionary entry for surrogate " + surrogateKey,
                                   columnName, segmentId, rowDescription)),
          columnName, segmentId, rowDescription, null);
    this.surrogateKey = surrogateKey;
  }

  public int getSurrogateKey() {
    return surrogateKey;
  }

  @Override
  public boolean isMetadataMismatch() {
    return true;
  }
}
