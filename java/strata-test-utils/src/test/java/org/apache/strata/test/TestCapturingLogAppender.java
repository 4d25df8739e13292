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

package org.apache.strata.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.Closeable;
import java.io.IOException;

import org.apache.logging.log4j.Level;
import org.junit.Rule;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.strata.test.junit.RetryRule;

public class TestCapturingLogAppender {
  private static final Logger LOG = LoggerFactory.getLogger(TestCapturingLogAppender.class);

  private static final String MAGIC_STRING = "hello world!";

  @Rule
  public RetryRule retryRule = new RetryRule();

  @Test
  public void testCapturesWhileAttached() throws IOException {
    CapturingLogAppender capturer = new CapturingLogAppender();
    try (Closeable c = capturer.attach()) {
      LOG.warn(MAGIC_STRING);
    }
    LOG.warn("not captured");

    String text = capturer.getAppendedText();
    assertTrue(text, text.contains(MAGIC_STRING));
    assertFalse(text, text.contains("not captured"));
    assertEquals(1, capturer.getLevels().size());
    assertEquals(Level.WARN, capturer.getLevels().get(0));
  }

  @Test
  public void testCapturesStackTrace() throws IOException {
    CapturingLogAppender capturer = new CapturingLogAppender();
    try (Closeable c = capturer.attach()) {
      LOG.error("failed", new IllegalStateException("boom"));
    }
    String text = capturer.getAppendedText();
    assertTrue(text, text.contains("java.lang.IllegalStateException: boom"));
    assertEquals(Level.ERROR, capturer.getLevels().get(0));
  }
}
