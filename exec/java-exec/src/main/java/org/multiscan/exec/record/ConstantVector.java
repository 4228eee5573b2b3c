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
package org.multiscan.exec.record;

import java.util.Objects;

import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;

import com.google.common.base.Preconditions;

/**
 * Column holding the same value on every row. The value is stored once and
 * broadcast on read.
 */
public class ConstantVector implements ValueVector {
  private final ScalarValue value;
  private final int valueCount;

  public ConstantVector(ScalarValue value, int valueCount) {
    Preconditions.checkArgument(valueCount >= 0, "Negative value count %s", valueCount);
    this.value = Preconditions.checkNotNull(value, "value");
    this.valueCount = valueCount;
  }

  public ScalarValue getValue() {
    return value;
  }

  @Override
  public MinorType getType() {
    return value.getType();
  }

  @Override
  public int getValueCount() {
    return valueCount;
  }

  @Override
  public Object getObject(int index) {
    Preconditions.checkElementIndex(index, valueCount);
    return value.getValue();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ConstantVector that = (ConstantVector) o;
    return valueCount == that.valueCount && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, valueCount);
  }

  @Override
  public String toString() {
    return "ConstantVector [value=" + value + ", valueCount=" + valueCount + "]";
  }
}
