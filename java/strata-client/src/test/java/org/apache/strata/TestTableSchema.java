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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Rule;
import org.junit.Test;

import org.apache.strata.ColumnSchema.ColumnSchemaBuilder;
import org.apache.strata.test.junit.RetryRule;

public class TestTableSchema {

  @Rule
  public RetryRule retryRule = new RetryRule();

  private static TableSchema salesSchema() {
    return new TableSchema("sales",
        ImmutableList.of(new ColumnSchemaBuilder("region", Type.STRING).dictionary().build(),
                         new ColumnSchemaBuilder("city", Type.STRING).build(),
                         new ColumnSchemaBuilder("day", Type.DATE).directDictionary().build()),
        ImmutableList.of(new ColumnSchemaBuilder("amount", Type.INT64).build()));
  }

  @Test
  public void testCounts() {
    TableSchema schema = salesSchema();
    assertEquals(3, schema.getDimensionCount());
    assertEquals(1, schema.getMeasureCount());
    assertEquals(4, schema.getColumnCount());
    assertEquals(2, schema.getKeyEncodedDimensionCount());
    assertEquals(1, schema.getNoDictionaryDimensionCount());
  }

  @Test
  public void testGetColumn() {
    TableSchema schema = salesSchema();
    assertEquals(Type.DATE, schema.getColumn("day").getType());
    assertEquals(Type.INT64, schema.getColumn("amount").getType());
    assertTrue(schema.hasColumn("city"));
    assertFalse(schema.hasColumn("City"));
    assertThrows(IllegalArgumentException.class, () -> schema.getColumn("country"));
  }

  @Test
  public void testDuplicateNames() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> new TableSchema("t",
            ImmutableList.of(new ColumnSchemaBuilder("id", Type.INT32).build()),
            ImmutableList.of(new ColumnSchemaBuilder("id", Type.INT64).build())));
    assertEquals("Column names must be unique: id", e.getMessage());
  }

  @Test
  public void testEquals() {
    assertEquals(salesSchema(), salesSchema());
    assertEquals(salesSchema().hashCode(), salesSchema().hashCode());
  }
}
