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
package org.multiscan.exec.store.multifile;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;
import org.multiscan.common.exceptions.ErrorType;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.ExecConstants;
import org.multiscan.exec.ExecTest;

public class TestMultiFileOptions extends ExecTest {

  @Test
  public void testParseOptionIgnoresCase() {
    MultiFileOptions.Builder builder = MultiFileOptions.builder();
    assertTrue(builder.parseOption("FileName", ScalarValue.ofBoolean(true)));
    assertTrue(builder.parseOption("HIVE_PARTITIONING", ScalarValue.ofBoolean(true)));
    assertTrue(builder.parseOption("union_by_name", ScalarValue.ofBoolean(false)));
    assertEquals(new MultiFileOptions(true, true, false), builder.build());
  }

  @Test
  public void testUnknownOptionIsNotRecognized() {
    MultiFileOptions.Builder builder = MultiFileOptions.builder();
    assertFalse(builder.parseOption("compression", ScalarValue.ofVarchar("gzip")));
    assertEquals(MultiFileOptions.defaults(), builder.build());
  }

  @Test
  public void testNullValue() {
    expectParseError("filename", ScalarValue.nullOf(MinorType.BIT));
  }

  @Test
  public void testNonBooleanValue() {
    expectParseError("union_by_name", ScalarValue.ofInt(1));
  }

  @Test
  public void testDefaultsFromConfig() {
    assertEquals(MultiFileOptions.defaults(), MultiFileOptions.fromConfig(c));

    MultiFileOptions options = MultiFileOptions.builder(c.withValue(ExecConstants.MULTIFILE_HIVE_PARTITIONING, true))
        .build();
    assertEquals(new MultiFileOptions(false, true, false), options);
  }

  @Test
  public void testAddBindInfo() {
    Map<String, ScalarValue> bindInfo = new LinkedHashMap<>();
    new MultiFileOptions(true, false, true).addBindInfo(bindInfo);
    assertEquals(ScalarValue.ofBoolean(true), bindInfo.get("filename"));
    assertEquals(ScalarValue.ofBoolean(false), bindInfo.get("hive_partitioning"));
    assertEquals(ScalarValue.ofBoolean(true), bindInfo.get("union_by_name"));
  }

  @Test
  public void testNamedParameters() {
    assertEquals(3, MultiFileOptions.NAMED_PARAMETERS.size());
    for (MinorType type : MultiFileOptions.NAMED_PARAMETERS.values()) {
      assertEquals(MinorType.BIT, type);
    }
  }

  private static void expectParseError(String key, ScalarValue value) {
    try {
      MultiFileOptions.builder().parseOption(key, value);
      fail("Expected a parse error");
    } catch (UserException e) {
      assertEquals(ErrorType.PARSE, e.getErrorType());
    }
  }
}
