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

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.multiscan.common.expression.FilterExpression;
import org.multiscan.exec.record.BatchSchema;
import org.multiscan.exec.store.multifile.ConstantFilterEvaluator.FilterResult;

/**
 * Removes from the file list of a scan the files that the pushed down filters
 * rule out using only the file name and the partition values of each file.
 * Filters are left in place; they still run on the rows read.
 */
public final class HivePartitionPruner {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(HivePartitionPruner.class);

  private HivePartitionPruner() {
  }

  /**
   * Maps the name of every projected column to its position in the
   * projection. Row id entries are skipped; for repeated names the first
   * position wins.
   *
   * @param schema global schema of the scan
   * @param columnIds projected global column ids
   */
  public static Map<String, Integer> buildColumnMap(BatchSchema schema, List<Integer> columnIds) {
    final Map<String, Integer> columnMap = new HashMap<>();
    for (int i = 0; i < columnIds.size(); i++) {
      final int columnId = columnIds.get(i);
      if (columnId == ColumnMapper.ROW_ID_COLUMN_ID) {
        continue;
      }
      columnMap.putIfAbsent(schema.getColumn(columnId).getName(), i);
    }
    return columnMap;
  }

  public static boolean complexFilterPushdown(List<String> files, MultiFileOptions options, int tableIndex,
                                              BatchSchema schema, List<Integer> columnIds,
                                              List<FilterExpression> filters) {
    return complexFilterPushdown(files, options, tableIndex, buildColumnMap(schema, columnIds), filters);
  }

  /**
   * Drops the files for which some filter is false or NULL.
   *
   * @param files files of the scan, a mutable list pruned in place
   * @param options scan options; only scans with {@code filename} or
   *        {@code hive_partitioning} set are pruned
   * @param tableIndex table index the filter column references carry for this scan
   * @param columnMap projected column name to its position in the projection
   * @param filters conjunction of filters, not modified
   * @return true if at least one file was removed
   */
  public static boolean complexFilterPushdown(List<String> files, MultiFileOptions options, int tableIndex,
                                              Map<String, Integer> columnMap, List<FilterExpression> filters) {
    if (files.isEmpty() || filters.isEmpty()
        || !(options.isFilename() || options.isHivePartitioning())) {
      return false;
    }

    final int initialCount = files.size();
    for (Iterator<String> iter = files.iterator(); iter.hasNext(); ) {
      final String file = iter.next();
      final ConstantFilterEvaluator evaluator =
          new ConstantFilterEvaluator(tableIndex, knownValues(file, options, columnMap));
      for (FilterExpression filter : filters) {
        final FilterResult result = evaluator.evaluate(filter);
        if (result.excludesFile()) {
          logger.trace("Pruned file {}: filter {} is {}", file, filter, result);
          iter.remove();
          break;
        }
      }
    }

    final int pruned = initialCount - files.size();
    logger.debug("Pruned {} of {} file(s) using {} filter(s)", pruned, initialCount, filters.size());
    return pruned > 0;
  }

  private static Map<Integer, String> knownValues(String file, MultiFileOptions options,
                                                  Map<String, Integer> columnMap) {
    final Map<String, String> constants = new LinkedHashMap<>();
    if (options.isFilename()) {
      constants.put(MultiFileBinder.FILENAME_COLUMN, file);
    }
    if (options.isHivePartitioning()) {
      constants.putAll(HivePartitioning.parse(file));
    }
    final Map<Integer, String> knownValues = new HashMap<>();
    for (Map.Entry<String, String> entry : constants.entrySet()) {
      final Integer columnIndex = columnMap.get(entry.getKey());
      if (columnIndex != null) {
        knownValues.put(columnIndex, entry.getValue());
      }
    }
    return knownValues;
  }
}
