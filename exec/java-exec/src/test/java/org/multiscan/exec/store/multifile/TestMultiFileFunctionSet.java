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
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;
import org.multiscan.common.exceptions.ErrorType;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.ExecTest;
import org.multiscan.exec.store.multifile.MultiFileFunctionSet.TableFunctionSignature;

public class TestMultiFileFunctionSet extends ExecTest {

  private final MultiFileFunctionSet functionSet = MultiFileFunctionSet.create("read_csv");

  @Test
  public void testSignatures() {
    assertEquals(2, functionSet.getSignatures().size());
    for (TableFunctionSignature signature : functionSet.getSignatures()) {
      assertEquals("read_csv", signature.getName());
      assertEquals(MultiFileOptions.NAMED_PARAMETERS, signature.getNamedParameters());
    }
  }

  @Test
  public void testResolve() {
    assertEquals(MinorType.VARCHAR, functionSet.resolve(ScalarValue.ofVarchar("*.csv")).getArgumentType());
    assertEquals(MinorType.LIST,
        functionSet.resolve(ScalarValue.ofList(Arrays.asList(ScalarValue.ofVarchar("a.csv")))).getArgumentType());
  }

  @Test
  public void testResolveUnsupportedArgument() {
    try {
      functionSet.resolve(ScalarValue.ofInt(3));
      fail("Expected a parse error");
    } catch (UserException e) {
      assertEquals(ErrorType.PARSE, e.getErrorType());
      assertEquals("No function matches the given name and argument types 'read_csv(INTEGER)'",
          e.getOriginalMessage());
    }
  }

  @Test
  public void testBindOptions() {
    Map<String, ScalarValue> parameters = new LinkedHashMap<>();
    parameters.put("Hive_Partitioning", ScalarValue.ofBoolean(true));
    parameters.put("filename", ScalarValue.ofBoolean(true));
    assertEquals(new MultiFileOptions(true, true, false), functionSet.bindOptions(parameters, c));
  }

  @Test
  public void testBindUnknownOption() {
    Map<String, ScalarValue> parameters = new LinkedHashMap<>();
    parameters.put("delimiter", ScalarValue.ofVarchar(";"));
    try {
      functionSet.bindOptions(parameters, c);
      fail("Expected a parse error");
    } catch (UserException e) {
      assertEquals(ErrorType.PARSE, e.getErrorType());
      assertEquals("Invalid named parameter \"delimiter\" for function read_csv", e.getOriginalMessage());
    }
  }
}
