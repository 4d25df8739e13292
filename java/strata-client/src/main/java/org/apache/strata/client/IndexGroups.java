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

import java.util.List;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Where the columns of a schema live in a scanned row.
 *
 * <ul>
 *   <li>the no-dictionary group lists the ordinals of the dimensions stored as
 *   raw byte segments, in segment order;</li>
 *   <li>the dictionary group lists the ordinals of the dimensions packed in
 *   the dictionary key, in key field order;</li>
 *   <li>the measure group holds the row slot of every measure, 1-based since
 *   slot 0 is the packed key.</li>
 * </ul>
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@Immutable
public final class IndexGroups {

  private final ImmutableList<Integer> noDictionaryIndexGroup;
  private final ImmutableList<Integer> dictionaryIndexGroup;
  private final ImmutableList<Integer> measureIndexGroup;

  IndexGroups(List<Integer> noDictionaryIndexGroup,
              List<Integer> dictionaryIndexGroup,
              List<Integer> measureIndexGroup) {
    this.noDictionaryIndexGroup = ImmutableList.copyOf(noDictionaryIndexGroup);
    this.dictionaryIndexGroup = ImmutableList.copyOf(dictionaryIndexGroup);
    this.measureIndexGroup = ImmutableList.copyOf(measureIndexGroup);
  }

  public List<Integer> getNoDictionaryIndexGroup() {
    return noDictionaryIndexGroup;
  }

  public List<Integer> getDictionaryIndexGroup() {
    return dictionaryIndexGroup;
  }

  public List<Integer> getMeasureIndexGroup() {
    return measureIndexGroup;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IndexGroups)) {
      return false;
    }
    IndexGroups that = (IndexGroups) o;
    return noDictionaryIndexGroup.equals(that.noDictionaryIndexGroup) &&
        dictionaryIndexGroup.equals(that.dictionaryIndexGroup) &&
        measureIndexGroup.equals(that.measureIndexGroup);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(noDictionaryIndexGroup, dictionaryIndexGroup, measureIndexGroup);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("noDictionary", noDictionaryIndexGroup)
        .add("dictionary", dictionaryIndexGroup)
        .add("measure", measureIndexGroup)
        .toString();
  }
}
