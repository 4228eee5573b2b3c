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

import java.util.Arrays;

/**
 * A selection vector that fronts, at most, 64K values of a batch: the
 * positions of the rows that survived filtering.
 */
public class SelectionVector2 {

  public static final int MAX_RECORD_COUNT = Character.MAX_VALUE + 1;

  private final char[] indexes;

  public SelectionVector2(int... indexes) {
    this.indexes = new char[indexes.length];
    for (int i = 0; i < indexes.length; i++) {
      if (indexes[i] < 0 || indexes[i] >= MAX_RECORD_COUNT) {
        throw new IllegalArgumentException("Selection index out of range: " + indexes[i]);
      }
      this.indexes[i] = (char) indexes[i];
    }
  }

  public int getCount() {
    return indexes.length;
  }

  public char getIndex(int index) {
    return indexes[index];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(indexes, ((SelectionVector2) o).indexes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indexes);
  }

  @Override
  public String toString() {
    return "SelectionVector2 [count=" + indexes.length + "]";
  }
}
