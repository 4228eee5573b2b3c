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

/**
 * Where a global column ended up in the output of one file: its position
 * among the physically read columns, or among the constant columns.
 */
public class ColumnFilterIndex {

  /** The column is not part of the file's output. */
  public static final ColumnFilterIndex NOT_MAPPED = new ColumnFilterIndex(-1, false);

  private final int index;
  private final boolean isConstant;

  public ColumnFilterIndex(int index, boolean isConstant) {
    this.index = index;
    this.isConstant = isConstant;
  }

  public int getIndex() {
    return index;
  }

  public boolean isConstant() {
    return isConstant;
  }

  public boolean isMapped() {
    return index >= 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ColumnFilterIndex that = (ColumnFilterIndex) o;
    return index == that.index && isConstant == that.isConstant;
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, isConstant);
  }

  @Override
  public String toString() {
    return isMapped() ? (isConstant ? "constant#" : "column#") + index : "not mapped";
  }
}
