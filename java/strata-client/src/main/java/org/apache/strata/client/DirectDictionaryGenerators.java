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
import org.apache.strata.util.DateUtil;
import org.apache.strata.util.TimestampUtil;

/**
 * The built-in direct dictionary generators. Both read their input as a
 * number of seconds since the Unix epoch, in UTC.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public final class DirectDictionaryGenerators {

  private static final DirectDictionaryGenerator DATE = new DirectDictionaryGenerator() {
    @Override
    public Object getValueFromSurrogate(int surrogate) {
      return DateUtil.epochDaysToSqlDate(DateUtil.epochSecondsToEpochDays(surrogate));
    }

    @Override
    public Type getType() {
      return Type.DATE;
    }

    @Override
    public String toString() {
      return "DirectDictionaryGenerator(date)";
    }
  };

  private static final DirectDictionaryGenerator TIMESTAMP = new DirectDictionaryGenerator() {
    @Override
    public Object getValueFromSurrogate(int surrogate) {
      return TimestampUtil.secondsToTimestamp(surrogate);
    }

    @Override
    public Type getType() {
      return Type.TIMESTAMP;
    }

    @Override
    public String toString() {
      return "DirectDictionaryGenerator(timestamp)";
    }
  };

  private DirectDictionaryGenerators() {
  }

  /**
   * @param type a column type
   * @return the generator for the type
   * @throws IllegalArgumentException if the type cannot be direct dictionary encoded
   */
  public static DirectDictionaryGenerator forType(Type type) {
    switch (type) {
      case DATE:
        return DATE;
      case TIMESTAMP:
        return TIMESTAMP;
      default:
        throw new IllegalArgumentException(
            "no direct dictionary generator for type " + type.getName());
    }
  }
}
