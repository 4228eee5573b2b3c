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
import java.util.List;
import java.util.Map;

import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.types.MinorType;
import org.multiscan.exec.record.BatchSchema;
import org.multiscan.exec.record.SchemaBuilder;

/**
 * Builds the global schema of a multi-file scan from the schema of the files
 * and the scan options: appends the {@code filename} column and one VARCHAR
 * column per hive partition key, and records where they went.
 */
public final class MultiFileBinder {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MultiFileBinder.class);

  public static final String FILENAME_COLUMN = "filename";

  private MultiFileBinder() {
  }

  /**
   * @param baseSchema schema of the first file, or the union of all file
   *        schemas when {@code union_by_name} is set
   * @param options scan options
   * @param files files of the scan, in scan order
   * @return the global schema and its bind data
   * @throws UserException validation error when the filename column clashes
   *         with a file column or when the files disagree on their partition
   *         keys
   */
  public static BoundSchema bind(BatchSchema baseSchema, MultiFileOptions options, List<String> files) {
    final SchemaBuilder builder = BatchSchema.newBuilder().addFields(baseSchema);
    Integer filenameIndex = null;

    if (options.isFilename()) {
      if (builder.indexOf(FILENAME_COLUMN) >= 0) {
        throw UserException.validationError()
            .message("Using filename option on file with column named filename is not supported")
            .build(logger);
      }
      filenameIndex = builder.getFieldCount();
      builder.add(FILENAME_COLUMN, MinorType.VARCHAR);
    }

    final List<HivePartitioningIndex> partitionIndexes = new ArrayList<>();
    if (options.isHivePartitioning()) {
      if (files.isEmpty()) {
        throw UserException.internalError()
            .message("Hive partitioning needs at least one file to take the partition keys from")
            .build(logger);
      }
      final String referenceFile = files.get(0);
      final Map<String, String> partitions = HivePartitioning.parse(referenceFile);
      checkPartitionKeys(referenceFile, partitions, files);

      for (String key : partitions.keySet()) {
        int index = builder.indexOf(key);
        if (index >= 0) {
          // the file holds a column of the same name, the directory value wins
          builder.setType(index, MinorType.VARCHAR);
        } else {
          index = builder.getFieldCount();
          builder.add(key, MinorType.VARCHAR);
        }
        partitionIndexes.add(new HivePartitioningIndex(key, index));
      }
    }

    final BoundSchema bound = new BoundSchema(builder.build(), new MultiFileBindData(filenameIndex, partitionIndexes));
    logger.debug("Bound {} file(s) with {}: {}", files.size(), options, bound);
    return bound;
  }

  private static void checkPartitionKeys(String referenceFile, Map<String, String> partitions, List<String> files) {
    for (String file : files) {
      final Map<String, String> filePartitions = HivePartitioning.parse(file);
      for (String key : partitions.keySet()) {
        if (!filePartitions.containsKey(key)) {
          throw UserException.validationError()
              .message("Hive partition mismatch between file \"%s\" and \"%s\": key \"%s\" not found",
                  referenceFile, file, key)
              .build(logger);
        }
      }
      if (partitions.size() != filePartitions.size()) {
        throw UserException.validationError()
            .message("Hive partition mismatch between file \"%s\" and \"%s\"", referenceFile, file)
            .build(logger);
      }
    }
  }
}
