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

import java.util.List;

import org.multiscan.common.types.MinorType;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Builds a {@link BatchSchema} column by column. Binding uses it to append
 * injected columns and to retype existing ones.
 */
public class SchemaBuilder {
  private final List<MaterializedField> fields = Lists.newArrayList();

  SchemaBuilder() {
  }

  public SchemaBuilder addField(MaterializedField f) {
    fields.add(f);
    return this;
  }

  public SchemaBuilder add(String name, MinorType type) {
    return addField(MaterializedField.create(name, type));
  }

  public SchemaBuilder addFields(Iterable<MaterializedField> fields) {
    for (MaterializedField f : fields) {
      addField(f);
    }
    return this;
  }

  /**
   * Replaces the type of the column at the given position, keeping its name.
   */
  public SchemaBuilder setType(int index, MinorType type) {
    Preconditions.checkElementIndex(index, fields.size());
    fields.set(index, fields.get(index).cloneWithType(type));
    return this;
  }

  public int getFieldCount() {
    return fields.size();
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

  public BatchSchema build() {
    return new BatchSchema(fields);
  }
}
