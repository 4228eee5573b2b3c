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
import java.util.Objects;

import org.multiscan.common.exceptions.UserException;

import com.google.common.base.Preconditions;

/**
 * A batch of rows of a scan: one {@link ValueVector} per projected column and
 * an optional {@link SelectionVector2}. Columns read from a file are set by
 * the decoder, constant columns by the chunk finalizer.
 */
public class RowBatch {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RowBatch.class);

  private final ValueVector[] columns;
  private final int recordCount;
  private SelectionVector2 selectionVector;

  public RowBatch(int columnCount, int recordCount) {
    Preconditions.checkArgument(columnCount >= 0, "Negative column count %s", columnCount);
    Preconditions.checkArgument(recordCount >= 0, "Negative record count %s", recordCount);
    this.columns = new ValueVector[columnCount];
    this.recordCount = recordCount;
  }

  public int getColumnCount() {
    return columns.length;
  }

  public int getRecordCount() {
    return recordCount;
  }

  public ValueVector getColumn(int index) {
    return columns[index];
  }

  public void setColumn(int index, ValueVector vector) {
    Preconditions.checkElementIndex(index, columns.length);
    columns[index] = vector;
  }

  public SelectionVector2 getSelectionVector() {
    return selectionVector;
  }

  public void setSelectionVector(SelectionVector2 selectionVector) {
    this.selectionVector = selectionVector;
  }

  /**
   * Checks that the batch is structurally sound: every column is set and
   * holds exactly one value per record, and the selection vector, if any,
   * selects at most every record and points at existing records only.
   *
   * @throws UserException internal error describing the first violation
   */
  public void verify() {
    for (int i = 0; i < columns.length; i++) {
      if (columns[i] == null) {
        throw UserException.internalError()
            .message("Column %d of the batch was not set", i)
            .build(logger);
      }
      if (columns[i].getValueCount() != recordCount) {
        throw UserException.internalError()
            .message("Column %d holds %d values, but the batch has %d records",
                i, columns[i].getValueCount(), recordCount)
            .build(logger);
      }
    }
    if (selectionVector != null) {
      if (selectionVector.getCount() > recordCount) {
        throw UserException.internalError()
            .message("Selection vector selects %d rows out of %d records", selectionVector.getCount(), recordCount)
            .build(logger);
      }
      for (int i = 0; i < selectionVector.getCount(); i++) {
        if (selectionVector.getIndex(i) >= recordCount) {
          throw UserException.internalError()
              .message("Selection vector entry %d points at row %d of %d records",
                  i, (int) selectionVector.getIndex(i), recordCount)
              .build(logger);
        }
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RowBatch that = (RowBatch) o;
    return recordCount == that.recordCount
        && Arrays.equals(columns, that.columns)
        && Objects.equals(selectionVector, that.selectionVector);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(recordCount, selectionVector) + Arrays.hashCode(columns);
  }

  @Override
  public String toString() {
    return "RowBatch [recordCount=" + recordCount + ", columns=" + Arrays.toString(columns) + "]";
  }
}
