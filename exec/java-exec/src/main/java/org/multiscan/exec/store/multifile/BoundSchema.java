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

import java.util.Objects;

import org.multiscan.exec.record.BatchSchema;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The global schema of a scan together with the bind data describing the
 * columns injected into it.
 */
public class BoundSchema {
  private final BatchSchema schema;
  private final MultiFileBindData bindData;

  public BoundSchema(BatchSchema schema, MultiFileBindData bindData) {
    this.schema = Preconditions.checkNotNull(schema, "schema");
    this.bindData = Preconditions.checkNotNull(bindData, "bindData");
  }

  public BatchSchema getSchema() {
    return schema;
  }

  public MultiFileBindData getBindData() {
    return bindData;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BoundSchema that = (BoundSchema) o;
    return schema.equals(that.schema) && bindData.equals(that.bindData);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, bindData);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("schema", schema)
        .add("bindData", bindData)
        .toString();
  }
}
