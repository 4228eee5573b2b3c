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
package org.multiscan.common.map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Map;

import org.multiscan.test.BaseTest;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;

public class TestCaseInsensitiveMap extends BaseTest {

  @Test
  public void putAndGet() {
    final Map<String, Integer> map = CaseInsensitiveMap.newHashMap();
    map.put("Year", 1);
    map.put("YEAR", 2);

    assertEquals(1, map.size());
    assertEquals(2, (int) map.get("year"));
    assertTrue(map.containsKey("yEaR"));
    assertFalse(map.containsKey(1));
    assertNull(map.get(null));
  }

  @Test
  public void putAllAndRemove() {
    final Map<String, Integer> map = CaseInsensitiveMap.newHashMapWithExpectedSize(2);
    map.putAll(ImmutableMap.of("A", 1, "b", 2));

    assertEquals(1, (int) map.remove("a"));
    assertEquals(1, map.size());
    assertTrue(map.containsKey("B"));
  }

  @Test
  public void indexOfKeepsFirstPosition() {
    final CaseInsensitiveMap<Integer> index = CaseInsensitiveMap.indexOf(Arrays.asList("a", "B", "b", "c"));

    assertEquals(3, index.size());
    assertEquals(1, (int) index.get("b"));
    assertEquals(3, (int) index.get("C"));
    assertEquals(Arrays.asList("a", "b", "c"), Arrays.asList(index.keySet().toArray()));
  }
}
