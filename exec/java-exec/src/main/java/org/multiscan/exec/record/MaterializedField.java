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

import com.google.common.base.Preconditions;

/**
 * A named, typed column of a file schema or of the global scan schema.
 */
public class MaterializedField {
  private final String name;
  private final MinorType type;

  private MaterializedField(String name, MinorType type) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.type = Preconditions.checkNotNull(type, "type");
  }

  public static MaterializedField create(String name, MinorType type) {
    return new MaterializedField(name, type);
  }

  public MaterializedField cloneWithType(MinorType type) {
    return new MaterializedField(name, type);
  }

  public String getName() {
    return name;
  }

  public MinorType getType() {
    return type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type);
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
    MaterializedField other = (MaterializedField) obj;
    return name.equals(other.name) && type == other.type;
  }

  @Override
  public String toString() {
    return "`" + name + "` (" + type + ")";
  }
}
