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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;

/**
 * A partition key and the position of its column in the global schema.
 */
@JsonPropertyOrder({"key", "index"})
public class HivePartitioningIndex {

  private final String key;
  private final int index;

  @JsonCreator
  public HivePartitioningIndex(@JsonProperty(value = "key", required = true) String key,
                               @JsonProperty(value = "index", required = true) int index) {
    Preconditions.checkArgument(key != null, "Partition key must be set");
    Preconditions.checkArgument(index >= 0, "Partition column index must not be negative, got %s", index);
    this.key = key;
    this.index = index;
  }

  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("index")
  public int getIndex() {
    return index;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HivePartitioningIndex that = (HivePartitioningIndex) o;
    return index == that.index && key.equals(that.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, index);
  }

  @Override
  public String toString() {
    return key + "@" + index;
  }
}
