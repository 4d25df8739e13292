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

import static org.apache.strata.client.ClientTestUtil.dictionaryColumn;
import static org.apache.strata.client.ClientTestUtil.directDictionaryColumn;
import static org.apache.strata.client.ClientTestUtil.measure;
import static org.apache.strata.client.ClientTestUtil.noDictionaryColumn;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Rule;
import org.junit.Test;

import org.apache.strata.TableSchema;
import org.apache.strata.Type;
import org.apache.strata.test.junit.RetryRule;

public class TestSegmentProperties {

  private static final TableSchema SCHEMA = new TableSchema("events",
      ImmutableList.of(dictionaryColumn("country", Type.STRING),
                       noDictionaryColumn("user", Type.STRING),
                       directDictionaryColumn("at", Type.TIMESTAMP),
                       dictionaryColumn("device", Type.STRING)),
      ImmutableList.of(measure("duration", Type.DOUBLE)));

  @Rule
  public RetryRule retryRule = new RetryRule();

  @Test
  public void testWithCardinalities() {
    SegmentProperties segment = SegmentProperties.withCardinalities("0", SCHEMA, 200, 5);
    BitPackedKeyGenerator keyGen = (BitPackedKeyGenerator) segment.getDimensionKeyGenerator();
    assertArrayEquals(new int[] { 8, SegmentProperties.DIRECT_DICTIONARY_KEY_WIDTH, 3 },
                      keyGen.getWidths());
    assertEquals("0", segment.getSegmentId());
    assertEquals(SCHEMA, segment.getSchema());
  }

  @Test
  public void testWrongCardinalityCount() {
    assertThrows(IllegalArgumentException.class,
        () -> SegmentProperties.withCardinalities("0", SCHEMA, 200));
    assertThrows(IllegalArgumentException.class,
        () -> SegmentProperties.withCardinalities("0", SCHEMA, 200, 5, 5));
  }

  @Test
  public void testKeyGeneratorMustCoverDictionaryDimensions() {
    assertThrows(IllegalArgumentException.class,
        () -> new SegmentProperties("0", SCHEMA, new BitPackedKeyGenerator(8, 3)));
  }
}
