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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.multiscan.common.types.MinorType;

/**
 * Column materialized as one Java object per row, as filled by a file decoder.
 */
public class ObjectVector implements ValueVector {
  private final MinorType type;
  private final List<Object> values;

  public ObjectVector(MinorType type, List<?> values) {
    this.type = type;
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static ObjectVector of(MinorType type, Object... values) {
    return new ObjectVector(type, Arrays.asList(values));
  }

  @Override
  public MinorType getType() {
    return type;
  }

  @Override
  public int getValueCount() {
    return values.size();
  }

  @Override
  public Object getObject(int index) {
    return values.get(index);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ObjectVector that = (ObjectVector) o;
    return type == that.type && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, values);
  }

  @Override
  public String toString() {
    return "ObjectVector [type=" + type + ", values=" + values + "]";
  }
}
