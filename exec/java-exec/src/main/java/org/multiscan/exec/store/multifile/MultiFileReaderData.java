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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * How the output of one file is assembled, built by {@link ColumnMapper}.
 * Output positions are positions in the projection of the scan.
 * <ul>
 * <li>constant map: output positions filled with one value for the whole
 *     file, such as the file name or a partition value</li>
 * <li>column mapping and column ids: output positions read from the file, and
 *     the local column each one is read from</li>
 * <li>cast map: local columns whose type differs from the global type, with
 *     the type to cast them to</li>
 * <li>filter map: for every global column, where it ended up, when filters
 *     were supplied</li>
 * </ul>
 */
public class MultiFileReaderData {

  private final List<ConstantEntry> constantMap;
  private final List<Integer> columnMapping;
  private final List<Integer> columnIds;
  private final Map<Integer, MinorType> castMap;
  private final List<ColumnFilterIndex> filterMap;

  private MultiFileReaderData(Builder builder) {
    this.constantMap = ImmutableList.copyOf(builder.constantMap);
    this.columnMapping = ImmutableList.copyOf(builder.columnMapping);
    this.columnIds = ImmutableList.copyOf(builder.columnIds);
    this.castMap = ImmutableMap.copyOf(builder.castMap);
    this.filterMap = builder.filterMap == null ? null : ImmutableList.copyOf(builder.filterMap);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<ConstantEntry> getConstantMap() {
    return constantMap;
  }

  public List<Integer> getColumnMapping() {
    return columnMapping;
  }

  /**
   * @return local column ids, aligned with {@link #getColumnMapping()}
   */
  public List<Integer> getColumnIds() {
    return columnIds;
  }

  public Map<Integer, MinorType> getCastMap() {
    return castMap;
  }

  public boolean hasFilterMap() {
    return filterMap != null;
  }

  /**
   * @return the filter map, empty when no filters were supplied
   */
  public List<ColumnFilterIndex> getFilterMap() {
    return filterMap == null ? ImmutableList.of() : filterMap;
  }

  /**
   * @return true if nothing needs to be read from the file
   */
  public boolean isEmptyColumns() {
    return columnMapping.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MultiFileReaderData that = (MultiFileReaderData) o;
    return constantMap.equals(that.constantMap)
        && columnMapping.equals(that.columnMapping)
        && columnIds.equals(that.columnIds)
        && castMap.equals(that.castMap)
        && Objects.equals(filterMap, that.filterMap);
  }

  @Override
  public int hashCode() {
    return Objects.hash(constantMap, columnMapping, columnIds, castMap, filterMap);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("constantMap", constantMap)
        .add("columnMapping", columnMapping)
        .add("columnIds", columnIds)
        .add("castMap", castMap)
        .add("filterMap", filterMap)
        .toString();
  }

  /**
   * A constant output column.
   */
  public static class ConstantEntry {
    private final int columnId;
    private final ScalarValue value;

    public ConstantEntry(int columnId, ScalarValue value) {
      this.columnId = columnId;
      this.value = Preconditions.checkNotNull(value, "value");
    }

    /**
     * @return position of the column in the projection
     */
    public int getColumnId() {
      return columnId;
    }

    public ScalarValue getValue() {
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
      ConstantEntry that = (ConstantEntry) o;
      return columnId == that.columnId && value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(columnId, value);
    }

    @Override
    public String toString() {
      return columnId + "=" + value;
    }
  }

  public static class Builder {
    private final List<ConstantEntry> constantMap = new ArrayList<>();
    private final List<Integer> columnMapping = new ArrayList<>();
    private final List<Integer> columnIds = new ArrayList<>();
    private final Map<Integer, MinorType> castMap = new LinkedHashMap<>();
    private List<ColumnFilterIndex> filterMap;

    private Builder() {
    }

    public Builder addConstant(int columnId, ScalarValue value) {
      constantMap.add(new ConstantEntry(columnId, value));
      return this;
    }

    /**
     * @param columnId position in the projection
     * @param localId column of the file the position is read from
     */
    public Builder addMappedColumn(int columnId, int localId) {
      columnMapping.add(columnId);
      columnIds.add(localId);
      return this;
    }

    public Builder addCast(int localId, MinorType targetType) {
      castMap.put(localId, targetType);
      return this;
    }

    public Builder filterMap(List<ColumnFilterIndex> filterMap) {
      this.filterMap = filterMap;
      return this;
    }

    List<ConstantEntry> constants() {
      return constantMap;
    }

    List<Integer> columnMapping() {
      return columnMapping;
    }

    public MultiFileReaderData build() {
      return new MultiFileReaderData(this);
    }
  }
}
