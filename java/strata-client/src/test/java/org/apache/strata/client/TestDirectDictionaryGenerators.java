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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;

import org.junit.Rule;
import org.junit.Test;

import org.apache.strata.Type;
import org.apache.strata.test.junit.RetryRule;

public class TestDirectDictionaryGenerators {

  @Rule
  public RetryRule retryRule = new RetryRule();

  @Test
  public void testDate() {
    DirectDictionaryGenerator generator = DirectDictionaryGenerators.forType(Type.DATE);
    assertEquals(Type.DATE, generator.getType());
    assertEquals(Date.valueOf(LocalDate.of(1970, 1, 1)), generator.getValueFromSurrogate(0));
    assertEquals(Date.valueOf(LocalDate.of(1970, 1, 1)), generator.getValueFromSurrogate(86399));
    assertEquals(Date.valueOf(LocalDate.of(1970, 1, 2)), generator.getValueFromSurrogate(86400));
    // Offsets before the epoch fall on the previous day.
    assertEquals(Date.valueOf(LocalDate.of(1969, 12, 31)), generator.getValueFromSurrogate(-1));
  }

  @Test
  public void testTimestamp() {
    DirectDictionaryGenerator generator = DirectDictionaryGenerators.forType(Type.TIMESTAMP);
    assertEquals(Type.TIMESTAMP, generator.getType());
    assertEquals(new Timestamp(86400000L), generator.getValueFromSurrogate(86400));
    assertEquals(new Timestamp(-1000L), generator.getValueFromSurrogate(-1));
  }

  @Test
  public void testUnsupportedType() {
    assertThrows(IllegalArgumentException.class,
        () -> DirectDictionaryGenerators.forType(Type.STRING));
  }
}
