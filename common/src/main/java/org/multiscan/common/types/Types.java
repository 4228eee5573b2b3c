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
package org.multiscan.common.types;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public class Types {

  /**
   * Numeric types ordered from the most to the least restrictive. Any member
   * widens losslessly (or with the precision loss SQL accepts) to the members
   * after it.
   */
  private static final List<MinorType> NUMERIC_PRECEDENCE = ImmutableList.of(
      MinorType.TINYINT, MinorType.SMALLINT, MinorType.INT, MinorType.BIGINT,
      MinorType.VARDECIMAL, MinorType.FLOAT4, MinorType.FLOAT8);

  private static final List<MinorType> TEMPORAL_PRECEDENCE = ImmutableList.of(
      MinorType.DATE, MinorType.TIMESTAMP);

  public static boolean isNumericType(final MinorType type) {
    return NUMERIC_PRECEDENCE.contains(type);
  }

  public static boolean isTemporalType(final MinorType type) {
    switch (type) {
      case DATE:
      case TIME:
      case TIMESTAMP:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the least restrictive type both arguments can be cast to without
   * failing.
   * <p>{@code NULL} combines with anything to the other type. Two types of
   * the same precedence chain (numeric or temporal) combine to the wider one.
   * Everything else, {@code VARCHAR} included, combines to {@code VARCHAR}.
   * The operation is commutative and associative, so folding it over a list
   * of types gives the same answer for every order of the list.
   *
   * @param first first type
   * @param second second type
   * @return the least upper bound of the two types
   */
  public static MinorType getCompatibleType(final MinorType first, final MinorType second) {
    Preconditions.checkNotNull(first, "first type");
    Preconditions.checkNotNull(second, "second type");
    if (first == second) {
      return first;
    }
    if (first == MinorType.NULL) {
      return second;
    }
    if (second == MinorType.NULL) {
      return first;
    }
    for (List<MinorType> chain : ImmutableList.of(NUMERIC_PRECEDENCE, TEMPORAL_PRECEDENCE)) {
      final int firstIndex = chain.indexOf(first);
      final int secondIndex = chain.indexOf(second);
      if (firstIndex >= 0 && secondIndex >= 0) {
        return chain.get(Math.max(firstIndex, secondIndex));
      }
    }
    return MinorType.VARCHAR;
  }

  /**
   * Gets the SQL data type name of the given type, as shown in error messages
   * and plans.
   */
  public static String getSqlTypeName(final MinorType type) {
    switch (type) {
      case NULL:          return "NULL";
      case BIT:           return "BOOLEAN";
      case TINYINT:       return "TINYINT";
      case SMALLINT:      return "SMALLINT";
      case INT:           return "INTEGER";
      case BIGINT:        return "BIGINT";
      case VARDECIMAL:    return "DECIMAL";
      case FLOAT4:        return "FLOAT";
      case FLOAT8:        return "DOUBLE";
      case DATE:          return "DATE";
      case TIME:          return "TIME";
      case TIMESTAMP:     return "TIMESTAMP";
      case VARCHAR:       return "CHARACTER VARYING";
      case VARBINARY:     return "BINARY VARYING";
      case LIST:          return "ARRAY";
      default:
        throw new AssertionError("Unexpected/unhandled MinorType value " + type);
    }
  }
}
