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

import static org.apache.strata.client.ClientTestUtil.encodeNoDictionary;
import static org.apache.strata.client.ClientTestUtil.measure;
import static org.apache.strata.client.ClientTestUtil.noDictionaryColumn;
import static org.apache.strata.client.ClientTestUtil.row;
import static org.apache.strata.client.ClientTestUtil.values;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import org.apache.strata.TableSchema;
import org.apache.strata.Type;
import org.apache.strata.test.CapturingLogAppender;
import org.apache.strata.test.junit.RetryRule;
import org.apache.strata.util.Pair;

public class TestPartitionScanner {

  private static final String SEGMENT = "seg-7";

  @Rule
  public RetryRule retryRule = new RetryRule();

  private ScanExecutor executor;
  private PartitionValueResolver resolver;

  @Before
  public void setUp() throws Exception {
    TableSchema schema = new TableSchema("orders",
        ImmutableList.of(noDictionaryColumn("id", Type.INT32)),
        ImmutableList.of(measure("amount", Type.INT64)));
    SegmentProperties segment = SegmentProperties.withCardinalities(SEGMENT, schema);
    resolver = new PartitionValueResolver.Builder(segment,
        new PartitionSpec("id", PartitionType.HASH)).build();
    executor = mock(ScanExecutor.class);
  }

  @After
  public void tearDown() {
    // Clear the flag in case a test left it set.
    Thread.interrupted();
  }

  private static EncodedRow order(int id) {
    return row(new byte[0], ImmutableList.of(encodeNoDictionary(id, Type.INT32)), 10L * id);
  }

  private static Iterator<EncodedRow> block(EncodedRow... rows) {
    return ImmutableList.copyOf(rows).iterator();
  }

  @Test
  public void testScan() throws Exception {
    EncodedRow first = order(1);
    when(executor.processDataBlocks(SEGMENT))
        .thenReturn(ImmutableList.of(block(first, order(2)), block(), block(order(3))));
    PartitionScanner scanner = new PartitionScanner(executor, resolver);
    List<Pair<Object, EncodedRow>> rows = scanner.scan();

    assertEquals(ImmutableList.of(1, 2, 3), values(rows));
    assertSame(first, rows.get(0).getSecond());
    assertEquals(3, scanner.getRowsScanned());
    assertEquals(3, scanner.getIteratorsConsumed());
    verify(executor, times(1)).finish();
  }

  @Test
  public void testScanIsSingleUse() throws Exception {
    when(executor.processDataBlocks(SEGMENT)).thenReturn(ImmutableList.of());
    PartitionScanner scanner = new PartitionScanner(executor, resolver);
    assertTrue(scanner.scan().isEmpty());
    assertThrows(IllegalStateException.class, scanner::scan);
    verify(executor, times(1)).finish();
  }

  @Test
  public void testDecodeFailure() throws Exception {
    EncodedRow corrupt = row(new byte[0], ImmutableList.of(new byte[] { 1 }), 0L);
    when(executor.processDataBlocks(SEGMENT))
        .thenReturn(ImmutableList.of(block(order(1), corrupt, order(3))));
    PartitionScanner scanner = new PartitionScanner(executor, resolver);

    CapturingLogAppender capturer = new CapturingLogAppender();
    KeyDecodeException e;
    try (Closeable c = capturer.attach()) {
      e = assertThrows(KeyDecodeException.class, scanner::scan);
    }
    assertEquals(SEGMENT, e.getSegmentId());
    assertEquals(1, scanner.getRowsScanned());
    assertThat(capturer.getAppendedText(),
        containsString("Partition scan of segment seg-7 failed"));
    assertTrue(capturer.getLevels().contains(Level.ERROR));
    verify(executor, times(1)).finish();
  }

  @Test
  public void testExecutorFailure() throws Exception {
    when(executor.processDataBlocks(SEGMENT)).thenThrow(new IllegalStateException("disk gone"));
    NonRecoverableException e = assertThrows(NonRecoverableException.class,
        () -> new PartitionScanner(executor, resolver).scan());
    assertTrue(e.getStatus().isIOError());
    assertThat(e.getMessage(), containsString("Exception occurred in query execution :: disk gone"));
    assertThat(e.getCause(), instanceOf(IllegalStateException.class));
    verify(executor, times(1)).finish();
  }

  @Test
  public void testExecutorFailureWithoutMessage() throws Exception {
    when(executor.processDataBlocks(SEGMENT))
        .thenThrow(new NonRecoverableException(Status.IOError("")) {
          @Override
          public String getMessage() {
            return null;
          }
        });
    NonRecoverableException e = assertThrows(NonRecoverableException.class,
        () -> new PartitionScanner(executor, resolver).scan());
    assertEquals("Exception occurred in query execution. Please check logs.",
                 e.getStatus().getMessage());
    verify(executor, times(1)).finish();
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testIteratorFailure() throws Exception {
    Iterator<EncodedRow> broken = mock(Iterator.class);
    when(broken.hasNext()).thenReturn(true);
    when(broken.next()).thenThrow(new IllegalStateException("block truncated"));
    when(executor.processDataBlocks(SEGMENT)).thenReturn(ImmutableList.of(broken));
    NonRecoverableException e = assertThrows(NonRecoverableException.class,
        () -> new PartitionScanner(executor, resolver).scan());
    assertTrue(e.getStatus().isIOError());
    assertThat(e.getMessage(), containsString("block truncated"));
    verify(executor, times(1)).finish();
  }

  @Test
  public void testInterrupted() throws Exception {
    when(executor.processDataBlocks(SEGMENT))
        .thenReturn(ImmutableList.of(block(order(1), order(2))));
    PartitionScanner scanner = new PartitionScanner(executor, resolver);
    Thread.currentThread().interrupt();
    NonRecoverableException e = assertThrows(NonRecoverableException.class, scanner::scan);
    assertTrue(e.getStatus().isAborted());
    assertThat(e.getMessage(), containsString("interrupted after 0 rows"));
    // The flag is left for the caller to handle.
    assertTrue(Thread.interrupted());
    verify(executor, times(1)).finish();
  }
}
