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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A single typed value: a constant column value, a literal in a filter or an
 * argument of a table function. The Java representation of the value is
 * checked against the type when the value is created:
 * <ul>
 * <li>{@code BIT}: {@link Boolean}</li>
 * <li>{@code TINYINT}, {@code SMALLINT}, {@code INT}, {@code BIGINT}: {@link Long}</li>
 * <li>{@code VARDECIMAL}: {@link BigDecimal}</li>
 * <li>{@code FLOAT4}, {@code FLOAT8}: {@link Double}</li>
 * <li>{@code DATE}, {@code TIME}, {@code TIMESTAMP}: {@link LocalDate},
 *     {@link LocalTime}, {@link LocalDateTime}</li>
 * <li>{@code VARCHAR}: {@link String}</li>
 * <li>{@code VARBINARY}: {@code byte[]}</li>
 * <li>{@code LIST}: {@code List<ScalarValue>}</li>
 * </ul>
 * A {@code null} value is the SQL NULL of the given type.
 */
public final class ScalarValue {

  private final MinorType type;
  private final Object value;

  private ScalarValue(MinorType type, Object value) {
    this.type = Preconditions.checkNotNull(type, "type");
    this.value = value;
  }

  public static ScalarValue of(MinorType type, Object value) {
    if (value == null) {
      return nullOf(type);
    }
    Preconditions.checkArgument(type != MinorType.NULL, "Untyped NULL cannot carry the value %s", value);
    final Object normalized = normalize(type, value);
    return new ScalarValue(type, normalized);
  }

  public static ScalarValue nullOf(MinorType type) {
    return new ScalarValue(type, null);
  }

  public static ScalarValue ofBoolean(boolean value) {
    return new ScalarValue(MinorType.BIT, value);
  }

  public static ScalarValue ofInt(int value) {
    return new ScalarValue(MinorType.INT, (long) value);
  }

  public static ScalarValue ofBigInt(long value) {
    return new ScalarValue(MinorType.BIGINT, value);
  }

  public static ScalarValue ofDouble(double value) {
    return new ScalarValue(MinorType.FLOAT8, value);
  }

  public static ScalarValue ofVarchar(String value) {
    return of(MinorType.VARCHAR, value);
  }

  public static ScalarValue ofList(List<ScalarValue> values) {
    return of(MinorType.LIST, values);
  }

  private static Object normalize(MinorType type, Object value) {
    switch (type) {
      case BIT:
        return checkClass(type, value, Boolean.class);
      case TINYINT:
      case SMALLINT:
      case INT:
      case BIGINT:
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
          return ((Number) value).longValue();
        }
        throw new IllegalArgumentException(mismatch(type, value));
      case VARDECIMAL:
        return checkClass(type, value, BigDecimal.class);
      case FLOAT4:
      case FLOAT8:
        if (value instanceof Float || value instanceof Double) {
          return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException(mismatch(type, value));
      case DATE:
        return checkClass(type, value, LocalDate.class);
      case TIME:
        return checkClass(type, value, LocalTime.class);
      case TIMESTAMP:
        return checkClass(type, value, LocalDateTime.class);
      case VARCHAR:
        return checkClass(type, value, String.class);
      case VARBINARY:
        return checkClass(type, value, byte[].class).clone();
      case LIST:
        final List<?> list = checkClass(type, value, List.class);
        final ImmutableList.Builder<ScalarValue> elements = ImmutableList.builder();
        for (Object element : list) {
          Preconditions.checkArgument(element instanceof ScalarValue,
              "LIST elements must be ScalarValue instances, got %s", element);
          elements.add((ScalarValue) element);
        }
        return elements.build();
      default:
        throw new IllegalArgumentException(mismatch(type, value));
    }
  }

  private static <T> T checkClass(MinorType type, Object value, Class<T> clazz) {
    if (!clazz.isInstance(value)) {
      throw new IllegalArgumentException(mismatch(type, value));
    }
    return clazz.cast(value);
  }

  private static String mismatch(MinorType type, Object value) {
    return String.format("Value %s of class %s is not valid for type %s",
        value, value.getClass().getSimpleName(), type);
  }

  public MinorType getType() {
    return type;
  }

  public boolean isNull() {
    return value == null;
  }

  /**
   * Returns the Java value, or {@code null} for a NULL constant. A
   * {@code VARBINARY} value is returned as a copy.
   */
  public Object getValue() {
    if (value instanceof byte[]) {
      return ((byte[]) value).clone();
    }
    return value;
  }

  public boolean getBoolean() {
    return (Boolean) checkType(MinorType.BIT);
  }

  public long getLong() {
    Preconditions.checkState(value instanceof Long, "%s is not an integer value", this);
    return (Long) value;
  }

  public String getString() {
    return (String) checkType(MinorType.VARCHAR);
  }

  @SuppressWarnings("unchecked")
  public List<ScalarValue> getList() {
    return (List<ScalarValue>) checkType(MinorType.LIST);
  }

  private Object checkType(MinorType expected) {
    Preconditions.checkState(type == expected, "Expected a %s value, got %s", expected, type);
    Preconditions.checkState(value != null, "Value of type %s is NULL", type);
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ScalarValue that = (ScalarValue) o;
    if (type != that.type) {
      return false;
    }
    if (value instanceof byte[] && that.value instanceof byte[]) {
      return Arrays.equals((byte[]) value, (byte[]) that.value);
    }
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return value instanceof byte[]
        ? 31 * type.hashCode() + Arrays.hashCode((byte[]) value)
        : Objects.hash(type, value);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "NULL::" + type;
    }
    if (value instanceof String) {
      return "'" + value + "'";
    }
    if (value instanceof byte[]) {
      return Arrays.toString((byte[]) value);
    }
    return value.toString();
  }
}
