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
 * What to do when the partition column is neither a dimension nor a measure
 * of the schema being scanned.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public enum MissingColumnPolicy {
  /** Refuse to build the resolver. */
  FAIL,

  /**
   * Resolve the first column of the schema instead, as older releases did
   * silently. Rows end up partitioned by the wrong column, so a warning is
   * logged every time the policy kicks in.
   */
  DEFAULT_TO_FIRST_COLUMN
}
