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

package org.apache.strata.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.sql.Timestamp;

import org.junit.Rule;
import org.junit.Test;

import org.apache.strata.test.junit.RetryRule;

public class TestTimestampUtil {

  @Rule
  public RetryRule retryRule = new RetryRule();

  @Test
  public void testTimestampConversion() {
    Timestamp epoch = new Timestamp(0);
    assertEquals(0, TimestampUtil.timestampToMicros(epoch));
    assertEquals(epoch, TimestampUtil.microsToTimestamp(0));

    Timestamp t1 = new Timestamp(0);
    t1.setNanos(123456000);
    assertEquals(123456, TimestampUtil.timestampToMicros(t1));
    assertEquals(t1, TimestampUtil.microsToTimestamp(123456));

    Timestamp t2 = new Timestamp(-1000);
    t2.setNanos(999999000);
    assertEquals(-1, TimestampUtil.timestampToMicros(t2));
    assertEquals(t2, TimestampUtil.microsToTimestamp(-1));
  }

  @Test
  public void testSecondsToTimestamp() {
    assertEquals(new Timestamp(86400000L), TimestampUtil.secondsToTimestamp(86400));
    assertEquals(new Timestamp(-1000L), TimestampUtil.secondsToTimestamp(-1));
    assertThrows(ArithmeticException.class,
        () -> TimestampUtil.secondsToTimestamp(Long.MAX_VALUE));
  }

  @Test
  public void testTimestampToString() {
    assertEquals("1970-01-01T00:00:00.000000Z", TimestampUtil.timestampToString(0));
    assertEquals("1970-01-01T00:00:00.123456Z", TimestampUtil.timestampToString(123456));
  }
}
