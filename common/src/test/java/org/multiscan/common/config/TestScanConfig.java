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
package org.multiscan.common.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.multiscan.test.BaseTest;
import org.junit.Test;

import com.typesafe.config.ConfigFactory;

public class TestScanConfig extends BaseTest {

  @Test
  public void testDefaultsAreLoaded() {
    ScanConfig config = ScanConfig.create();
    assertTrue(config.getBoolean("multiscan.exec.enable_external_access"));
  }

  @Test
  public void testOverrideFileIsApplied() {
    ScanConfig config = ScanConfig.create();
    assertEquals("override", config.getString("multiscan.test.override"));
  }

  @Test
  public void testPropertiesTakePrecedence() {
    Properties properties = new Properties();
    properties.put("multiscan.exec.enable_external_access", "false");
    properties.put("multiscan.test.override", "properties");

    ScanConfig config = ScanConfig.create(properties);

    assertFalse(config.getBoolean("multiscan.exec.enable_external_access"));
    assertEquals("properties", config.getString("multiscan.test.override"));
  }

  @Test
  public void testWithValue() {
    ScanConfig config = ScanConfig.create(ConfigFactory.parseString("a.b: 1"));
    ScanConfig changed = config.withValue("a.b", 2);

    assertEquals(1, config.getInt("a.b"));
    assertEquals(2, changed.getInt("a.b"));
    assertEquals(2L, changed.getLong("a.b"));
    assertFalse(changed.hasPath("a.c"));
  }
}
