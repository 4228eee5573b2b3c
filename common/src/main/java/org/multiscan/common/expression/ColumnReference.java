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
package org.multiscan.common.expression;

import java.util.Objects;

/**
 * Reference to a column of a scan in a bound filter. The table index
 * identifies the scan, the column index is the position of the column in
 * the scan's projection.
 */
public final class ColumnReference {

  private final int tableIndex;
  private final int columnIndex;

  public ColumnReference(int tableIndex, int columnIndex) {
    this.tableIndex = tableIndex;
    this.columnIndex = columnIndex;
  }

  public static ColumnReference of(int tableIndex, int columnIndex) {
    return new ColumnReference(tableIndex, columnIndex);
  }

  public int tableIndex() {
    return tableIndex;
  }

  public int columnIndex() {
    return columnIndex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnReference that = (ColumnReference) o;
    return tableIndex == that.tableIndex && columnIndex == that.columnIndex;
  }

  @Override
  public int hashCode() {
    return Objects.hash(tableIndex, columnIndex);
  }

  @Override
  public String toString() {
    return "#" + tableIndex + "." + columnIndex;
  }
}
