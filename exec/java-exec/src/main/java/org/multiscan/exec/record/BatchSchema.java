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

import java.util.Iterator;
import java.util.List;

import org.multiscan.common.types.MinorType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Ordered, immutable list of columns.
 */
public class BatchSchema implements Iterable<MaterializedField> {

  private final List<MaterializedField> fields;

  public BatchSchema(List<MaterializedField> fields) {
    this.fields = ImmutableList.copyOf(fields);
  }

  public static SchemaBuilder newBuilder() {
    return new SchemaBuilder();
  }

  public int getFieldCount() {
    return fields.size();
  }

  public MaterializedField getColumn(int index) {
    if (index < 0 || index >= fields.size()) {
      return null;
    }
    return fields.get(index);
  }

  /**
   * @return position of the column with exactly this name, or -1
   */
  public int indexOf(String name) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  public List<String> getFieldNames() {
    return Lists.transform(fields, MaterializedField::getName);
  }

  public List<MinorType> getFieldTypes() {
    return Lists.transform(fields, MaterializedField::getType);
  }

  public List<MaterializedField> getFields() {
    return fields;
  }

  @Override
  public Iterator<MaterializedField> iterator() {
    return fields.iterator();
  }

  @Override
  public String toString() {
    return "BatchSchema [fields=" + fields + "]";
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    BatchSchema other = (BatchSchema) obj;
    return fields.equals(other.fields);
  }
}
