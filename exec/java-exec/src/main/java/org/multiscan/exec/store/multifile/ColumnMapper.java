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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.expression.FilterExpression;
import org.multiscan.common.map.CaseInsensitiveMap;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.record.BatchSchema;
import org.multiscan.exec.record.MaterializedField;
import org.multiscan.exec.store.multifile.MultiFileReaderData.ConstantEntry;

import com.google.common.base.Joiner;

/**
 * Maps the projection of a scan onto the columns of one file.
 * <p>Every projected column is either a constant for the whole file (row id,
 * file name, partition value, or NULL for a column the file lacks under
 * {@code union_by_name}) or is read from the file column of the same name,
 * matched ignoring case, with a cast when the types differ.
 */
public final class ColumnMapper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ColumnMapper.class);

  /** Projection entry standing for the row identifier. */
  public static final int ROW_ID_COLUMN_ID = -1;

  /** Value produced for the row identifier column. */
  public static final ScalarValue ROW_ID_PLACEHOLDER = ScalarValue.ofBigInt(42);

  private static final Joiner CANDIDATE_JOINER = Joiner.on(", ");

  private ColumnMapper() {
  }

  /**
   * @param file path of the file
   * @param localSchema schema of the file
   * @param globalSchema bound schema of the scan
   * @param bindData bind data of the scan
   * @param options scan options
   * @param projection projected global column ids, {@link #ROW_ID_COLUMN_ID}
   *        for the row identifier
   * @param filters filters pushed into the scan, {@code null} when there are
   *        none; a filter map is built only when present
   * @return the mapping of the file
   * @throws UserException data read error when a projected column is missing
   *         from the file
   */
  public static MultiFileReaderData createMapping(String file, BatchSchema localSchema, BatchSchema globalSchema,
                                                  MultiFileBindData bindData, MultiFileOptions options,
                                                  List<Integer> projection, List<FilterExpression> filters) {
    final MultiFileReaderData.Builder builder = MultiFileReaderData.builder();
    final CaseInsensitiveMap<Integer> localNames = CaseInsensitiveMap.indexOf(localSchema.getFieldNames());

    final boolean[] isConstant = bindConstants(file, globalSchema, bindData, options, projection, localNames, builder);
    mapColumns(file, localSchema, globalSchema, projection, localNames, isConstant, builder);

    if (filters != null) {
      builder.filterMap(buildFilterMap(globalSchema.getFieldCount(), projection.size(), builder));
    }

    final int mapped = builder.constants().size() + builder.columnMapping().size();
    if (mapped != projection.size()) {
      throw UserException.internalError()
          .message("Mapped %d constant and %d read column(s) for a projection of %d column(s)",
              builder.constants().size(), builder.columnMapping().size(), projection.size())
          .addContext("File", file)
          .build(logger);
    }

    final MultiFileReaderData readerData = builder.build();
    logger.trace("Mapping for file {}: {}", file, readerData);
    return readerData;
  }

  private static boolean[] bindConstants(String file, BatchSchema globalSchema, MultiFileBindData bindData,
                                         MultiFileOptions options, List<Integer> projection,
                                         CaseInsensitiveMap<Integer> localNames,
                                         MultiFileReaderData.Builder builder) {
    final boolean[] isConstant = new boolean[projection.size()];
    Map<String, String> partitions = null;
    for (int i = 0; i < projection.size(); i++) {
      final int columnId = projection.get(i);
      ScalarValue constant = null;
      if (columnId == ROW_ID_COLUMN_ID) {
        constant = ROW_ID_PLACEHOLDER;
      } else if (bindData.isFilenameColumn(columnId)) {
        constant = ScalarValue.ofVarchar(file);
      } else if (bindData.findPartitionKey(columnId) != null) {
        if (partitions == null) {
          partitions = HivePartitioning.parse(file);
          if (partitions.size() != bindData.getHivePartitioningIndexes().size()) {
            throw UserException.internalError()
                .message("Hive partition count mismatch: file has %d partition(s), the scan was bound with %d",
                    partitions.size(), bindData.getHivePartitioningIndexes().size())
                .addContext("File", file)
                .build(logger);
          }
        }
        final String key = bindData.findPartitionKey(columnId);
        final String value = partitions.get(key);
        if (value == null) {
          throw UserException.internalError()
              .message("Partition key \"%s\" not found in file \"%s\"", key, file)
              .build(logger);
        }
        constant = ScalarValue.ofVarchar(value);
      } else if (options.isUnionByName() && columnId >= 0 && columnId < globalSchema.getFieldCount()) {
        final MaterializedField global = globalSchema.getColumn(columnId);
        if (!localNames.containsKey(global.getName())) {
          constant = ScalarValue.nullOf(global.getType());
        }
      }
      if (constant != null) {
        builder.addConstant(i, constant);
        isConstant[i] = true;
      }
    }
    return isConstant;
  }

  private static void mapColumns(String file, BatchSchema localSchema, BatchSchema globalSchema,
                                 List<Integer> projection, CaseInsensitiveMap<Integer> localNames,
                                 boolean[] isConstant, MultiFileReaderData.Builder builder) {
    for (int i = 0; i < projection.size(); i++) {
      if (isConstant[i]) {
        continue;
      }
      final int columnId = projection.get(i);
      if (columnId < 0 || columnId >= globalSchema.getFieldCount()) {
        throw UserException.internalError()
            .message("Projected column %d is outside of the scan schema of %d column(s)",
                columnId, globalSchema.getFieldCount())
            .addContext("File", file)
            .build(logger);
      }
      final MaterializedField global = globalSchema.getColumn(columnId);
      final Integer localId = localNames.get(global.getName());
      if (localId == null) {
        throw UserException.dataReadError()
            .message("Failed to read file \"%s\": schema mismatch in glob: column \"%s\" was read from "
                    + "the original file, but could not be found in file \"%s\".\nCandidate names: %s\n"
                    + "If you are trying to read files with different schemas, try setting union_by_name=True",
                file, global.getName(), file, CANDIDATE_JOINER.join(localSchema.getFieldNames()))
            .build(logger);
      }
      final MinorType localType = localSchema.getColumn(localId).getType();
      if (localType != global.getType()) {
        builder.addCast(localId, global.getType());
      }
      builder.addMappedColumn(i, localId);
    }
  }

  private static List<ColumnFilterIndex> buildFilterMap(int globalCount, int projectionCount,
                                                        MultiFileReaderData.Builder builder) {
    final List<ColumnFilterIndex> filterMap =
        new ArrayList<>(Collections.nCopies(Math.max(globalCount, projectionCount), ColumnFilterIndex.NOT_MAPPED));
    final List<Integer> columnMapping = builder.columnMapping();
    for (int c = 0; c < columnMapping.size(); c++) {
      filterMap.set(columnMapping.get(c), new ColumnFilterIndex(c, false));
    }
    final List<ConstantEntry> constants = builder.constants();
    for (int c = 0; c < constants.size(); c++) {
      filterMap.set(constants.get(c).getColumnId(), new ColumnFilterIndex(c, true));
    }
    return filterMap;
  }
}
