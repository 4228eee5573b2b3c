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
import java.util.Objects;
import java.util.OptionalInt;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Result of binding a multi-file scan: where the columns injected into the
 * global schema live. Immutable and shared by every file of the scan.
 */
@JsonPropertyOrder({"version", "filenameIndex", "hivePartitioningIndexes"})
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
public class MultiFileBindData {

  public static final int CURRENT_VERSION = 1;

  private static final MultiFileBindData EMPTY = new MultiFileBindData(null, ImmutableList.of());

  private final Integer filenameIndex;
  private final List<HivePartitioningIndex> hivePartitioningIndexes;

  public MultiFileBindData(Integer filenameIndex, List<HivePartitioningIndex> hivePartitioningIndexes) {
    Preconditions.checkArgument(filenameIndex == null || filenameIndex >= 0,
        "Filename column index must not be negative, got %s", filenameIndex);
    this.filenameIndex = filenameIndex;
    this.hivePartitioningIndexes = ImmutableList.copyOf(hivePartitioningIndexes);
  }

  @JsonCreator
  static MultiFileBindData fromJson(@JsonProperty(value = "version", required = true) int version,
                                    @JsonProperty(value = "filenameIndex", required = true) Integer filenameIndex,
                                    @JsonProperty(value = "hivePartitioningIndexes", required = true)
                                        List<HivePartitioningIndex> hivePartitioningIndexes) {
    MultiFilePersistence.checkVersion(version, MultiFileBindData.class);
    Preconditions.checkArgument(hivePartitioningIndexes != null, "hivePartitioningIndexes must not be null");
    return new MultiFileBindData(filenameIndex, hivePartitioningIndexes);
  }

  public static MultiFileBindData empty() {
    return EMPTY;
  }

  @JsonProperty("version")
  public int getVersion() {
    return CURRENT_VERSION;
  }

  public OptionalInt getFilenameIndex() {
    return filenameIndex == null ? OptionalInt.empty() : OptionalInt.of(filenameIndex);
  }

  @JsonProperty("filenameIndex")
  @JsonInclude(JsonInclude.Include.ALWAYS)
  Integer filenameIndexOrNull() {
    return filenameIndex;
  }

  @JsonProperty("hivePartitioningIndexes")
  public List<HivePartitioningIndex> getHivePartitioningIndexes() {
    return hivePartitioningIndexes;
  }

  public boolean isFilenameColumn(int columnId) {
    return filenameIndex != null && filenameIndex == columnId;
  }

  /**
   * @return the partition key stored in the given global column, or
   *         {@code null} if the column is not a partition column
   */
  public String findPartitionKey(int columnId) {
    for (HivePartitioningIndex entry : hivePartitioningIndexes) {
      if (entry.getIndex() == columnId) {
        return entry.getKey();
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MultiFileBindData that = (MultiFileBindData) o;
    return Objects.equals(filenameIndex, that.filenameIndex)
        && hivePartitioningIndexes.equals(that.hivePartitioningIndexes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filenameIndex, hivePartitioningIndexes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("filenameIndex", filenameIndex)
        .add("hivePartitioningIndexes", hivePartitioningIndexes)
        .toString();
  }
}
