/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.multiscan.test;

import org.junit.Before;
import org.junit.Rule;
import org.junit.rules.TestName;
import org.junit.rules.TestRule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;
import org.slf4j.Logger;

public class BaseTest {
  static final Logger testReporter = org.slf4j.LoggerFactory.getLogger("org.multiscan.TestReporter");

  static {
    System.setProperty("line.separator", "\n");
  }

  @Rule public final TestRule TIMEOUT = TestTools.getTimeoutRule(50000);
  @Rule public final TestRule logOutcome = new TestLogReporter();

  @Rule public TestName TEST_NAME = new TestName();

  @Before
  public void printID() throws Exception {
    testReporter.debug("Running {}#{}", getClass().getName(), TEST_NAME.getMethodName());
  }

  private static class TestLogReporter extends TestWatcher {

    @Override
    protected void failed(Throwable e, Description description) {
      testReporter.error(String.format("Test Failed: %s", description.getDisplayName()), e);
    }

    @Override
    public void succeeded(Description description) {
      testReporter.info(String.format("Test Succeeded: %s", description.getDisplayName()));
    }
  }
}
