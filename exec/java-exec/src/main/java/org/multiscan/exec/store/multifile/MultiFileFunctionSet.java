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

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.multiscan.common.config.ScanConfig;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.common.types.Types;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The signatures of a multi-file table function: one overload taking a single
 * path or glob pattern, one taking a list of them. Both accept the named
 * parameters of {@link MultiFileOptions}.
 */
public class MultiFileFunctionSet {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MultiFileFunctionSet.class);

  private final String name;
  private final List<TableFunctionSignature> signatures;

  private MultiFileFunctionSet(String name, List<TableFunctionSignature> signatures) {
    this.name = name;
    this.signatures = signatures;
  }

  public static MultiFileFunctionSet create(String name) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Function name must be set");
    return new MultiFileFunctionSet(name, ImmutableList.of(
        new TableFunctionSignature(name, MinorType.VARCHAR, MultiFileOptions.NAMED_PARAMETERS),
        new TableFunctionSignature(name, MinorType.LIST, MultiFileOptions.NAMED_PARAMETERS)));
  }

  public String getName() {
    return name;
  }

  public List<TableFunctionSignature> getSignatures() {
    return signatures;
  }

  /**
   * @param argument the positional argument of the call
   * @return the overload accepting the argument
   * @throws UserException parse error if no overload accepts it
   */
  public TableFunctionSignature resolve(ScalarValue argument) {
    Preconditions.checkNotNull(argument, "argument");
    for (TableFunctionSignature signature : signatures) {
      if (signature.getArgumentType() == argument.getType()) {
        return signature;
      }
    }
    throw UserException.parseError()
        .message("No function matches the given name and argument types '%s(%s)'",
            name, Types.getSqlTypeName(argument.getType()))
        .addContext("Candidates", signatures.toString())
        .build(logger);
  }

  /**
   * Turns the named parameters of a call into scan options, on top of the
   * configured defaults.
   *
   * @throws UserException parse error for a parameter that is not a
   *         multi-file option or a value that is not a boolean
   */
  public MultiFileOptions bindOptions(Map<String, ScalarValue> namedParameters, ScanConfig config) {
    final MultiFileOptions.Builder builder = MultiFileOptions.builder(config);
    for (Map.Entry<String, ScalarValue> parameter : namedParameters.entrySet()) {
      if (!builder.parseOption(parameter.getKey(), parameter.getValue())) {
        throw UserException.parseError()
            .message("Invalid named parameter \"%s\" for function %s", parameter.getKey(), name)
            .addContext("Valid parameters", String.join(", ", MultiFileOptions.NAMED_PARAMETERS.keySet()))
            .build(logger);
      }
    }
    return builder.build();
  }

  /**
   * One overload of a table function.
   */
  public static class TableFunctionSignature {
    private final String name;
    private final MinorType argumentType;
    private final Map<String, MinorType> namedParameters;

    public TableFunctionSignature(String name, MinorType argumentType, Map<String, MinorType> namedParameters) {
      this.name = name;
      this.argumentType = argumentType;
      this.namedParameters = ImmutableMap.copyOf(namedParameters);
    }

    public String getName() {
      return name;
    }

    public MinorType getArgumentType() {
      return argumentType;
    }

    public Map<String, MinorType> getNamedParameters() {
      return namedParameters;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      TableFunctionSignature that = (TableFunctionSignature) o;
      return name.equals(that.name)
          && argumentType == that.argumentType
          && namedParameters.equals(that.namedParameters);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, argumentType, namedParameters);
    }

    @Override
    public String toString() {
      return name + "(" + Types.getSqlTypeName(argumentType) + ")";
    }
  }
}
