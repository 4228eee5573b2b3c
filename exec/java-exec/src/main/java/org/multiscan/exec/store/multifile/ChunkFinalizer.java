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

import org.multiscan.common.exceptions.UserException;
import org.multiscan.exec.record.ConstantVector;
import org.multiscan.exec.record.RowBatch;
import org.multiscan.exec.store.multifile.MultiFileReaderData.ConstantEntry;

/**
 * Completes a batch read from a file: fills the constant columns of the file
 * and checks the result.
 */
public final class ChunkFinalizer {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ChunkFinalizer.class);

  private ChunkFinalizer() {
  }

  /**
   * Sets every constant column of the batch to its value, broadcast over all
   * records, then verifies the batch. Applying it again leaves the batch
   * unchanged.
   *
   * @param bindData bind data of the scan
   * @param readerData mapping of the file the batch was read from
   * @param batch batch whose read columns are filled
   * @throws UserException internal error if the batch is inconsistent
   */
  public static void finalizeChunk(MultiFileBindData bindData, MultiFileReaderData readerData, RowBatch batch) {
    for (ConstantEntry entry : readerData.getConstantMap()) {
      if (entry.getColumnId() >= batch.getColumnCount()) {
        throw UserException.internalError()
            .message("Constant column %d is outside of a batch of %d column(s)",
                entry.getColumnId(), batch.getColumnCount())
            .addContext("Bind data", bindData.toString())
            .build(logger);
      }
      batch.setColumn(entry.getColumnId(), new ConstantVector(entry.getValue(), batch.getRecordCount()));
    }
    batch.verify();
  }
}
