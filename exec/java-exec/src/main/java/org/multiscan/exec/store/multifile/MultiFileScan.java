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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.multiscan.common.config.ScanConfig;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.expression.FilterExpression;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.ExecConstants;
import org.multiscan.exec.record.BatchSchema;
import org.multiscan.exec.record.RowBatch;
import org.multiscan.exec.store.TimedRunnable;
import org.multiscan.exec.store.dfs.FileListExpander;
import org.multiscan.exec.store.dfs.GlobOption;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * A bound multi-file scan: the files to read, the global schema and the bind
 * data. Binding happens once, in {@link #bind}; pruning returns a new scan and
 * per-file mappings are derived from the bound state without changing it.
 */
public class MultiFileScan {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MultiFileScan.class);

  private final String readerName;
  private final MultiFileOptions options;
  private final List<String> files;
  private final BoundSchema boundSchema;
  private final int parallelism;
  private final long taskTimeoutMs;

  private MultiFileScan(String readerName, MultiFileOptions options, List<String> files,
                        BoundSchema boundSchema, int parallelism, long taskTimeoutMs) {
    this.readerName = readerName;
    this.options = options;
    this.files = ImmutableList.copyOf(files);
    this.boundSchema = boundSchema;
    this.parallelism = parallelism;
    this.taskTimeoutMs = taskTimeoutMs;
  }

  /**
   * Resolves the files of a table function call and binds the scan schema.
   * With {@code union_by_name} every file schema is read, in parallel;
   * otherwise the schema of the first file is used for all of them.
   *
   * @param config configuration providing parallelism and task timeout
   * @param expander resolves the path argument into files
   * @param input path argument of the call
   * @param readerName name of the reader, used in messages
   * @param options scan options
   * @param schemaReader reads the schema of a file
   * @return the bound scan
   */
  public static MultiFileScan bind(ScanConfig config, FileListExpander expander, ScalarValue input,
                                   String readerName, MultiFileOptions options, FileSchemaReader schemaReader) {
    final List<String> files = expander.getFileList(input, readerName, GlobOption.DISALLOW_EMPTY);
    final int parallelism = config.getInt(ExecConstants.MULTIFILE_PARALLELISM);
    final long taskTimeoutMs = config.getLong(ExecConstants.MULTIFILE_TASK_TIMEOUT);

    final BatchSchema baseSchema;
    if (options.isUnionByName()) {
      final List<SchemaReadTask> tasks = new ArrayList<>();
      for (String file : files) {
        tasks.add(new SchemaReadTask(file, schemaReader));
      }
      final List<BatchSchema> schemas = TimedRunnable.run("Read schema of " + readerName + " files",
          logger, tasks, parallelism, taskTimeoutMs);
      baseSchema = UnionByName.unionSchemas(schemas);
    } else {
      baseSchema = readSchema(schemaReader, files.get(0));
    }

    final BoundSchema boundSchema = MultiFileBinder.bind(baseSchema, options, files);
    return new MultiFileScan(readerName, options, files, boundSchema, parallelism, taskTimeoutMs);
  }

  /**
   * Prunes the files using the filters pushed into the scan.
   *
   * @param tableIndex table index the filter column references carry for this scan
   * @param projection projected global column ids
   * @param filters conjunction of filters
   * @return this scan if no file was pruned, otherwise a scan over the
   *         remaining files, possibly none
   */
  public MultiFileScan applyFilters(int tableIndex, List<Integer> projection, List<FilterExpression> filters) {
    final List<String> remaining = new ArrayList<>(files);
    final boolean pruned = HivePartitionPruner.complexFilterPushdown(remaining, options, tableIndex,
        boundSchema.getSchema(), projection, filters);
    if (!pruned) {
      return this;
    }
    return new MultiFileScan(readerName, options, remaining, boundSchema, parallelism, taskTimeoutMs);
  }

  public MultiFileReaderData createMapping(String file, BatchSchema localSchema, List<Integer> projection,
                                           List<FilterExpression> filters) {
    return ColumnMapper.createMapping(file, localSchema, boundSchema.getSchema(), boundSchema.getBindData(),
        options, projection, filters);
  }

  /**
   * Reads the schema of every file and builds its mapping, in parallel.
   * Fails with the first error, in file order, once all files are done.
   *
   * @return one mapping per file, in file order
   */
  public List<MultiFileReaderData> createMappings(List<Integer> projection, List<FilterExpression> filters,
                                                  FileSchemaReader schemaReader) {
    final List<MappingTask> tasks = new ArrayList<>();
    for (String file : files) {
      tasks.add(new MappingTask(file, schemaReader, projection, filters));
    }
    return TimedRunnable.run("Map columns of " + readerName + " files", logger, tasks, parallelism, taskTimeoutMs);
  }

  public void finalizeChunk(MultiFileReaderData readerData, RowBatch batch) {
    ChunkFinalizer.finalizeChunk(boundSchema.getBindData(), readerData, batch);
  }

  public String getReaderName() {
    return readerName;
  }

  public MultiFileOptions getOptions() {
    return options;
  }

  public List<String> getFiles() {
    return files;
  }

  public BoundSchema getBoundSchema() {
    return boundSchema;
  }

  public BatchSchema getSchema() {
    return boundSchema.getSchema();
  }

  public MultiFileBindData getBindData() {
    return boundSchema.getBindData();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("readerName", readerName)
        .add("options", options)
        .add("files", files.size())
        .add("schema", boundSchema.getSchema())
        .toString();
  }

  private static BatchSchema readSchema(FileSchemaReader schemaReader, String file) {
    try {
      return schemaReader.readSchema(file);
    } catch (IOException e) {
      throw schemaReadError(file, e);
    }
  }

  private static UserException schemaReadError(String file, Exception e) {
    return UserException.dataReadError(e)
        .message("Failed to read the schema of file \"%s\"", file)
        .addContext("File", file)
        .build(logger);
  }

  private static UserException taskError(String file, Exception e) {
    if (e instanceof IOException) {
      return schemaReadError(file, e);
    }
    return UserException.internalError(e)
        .message("Unexpected failure while processing file \"%s\"", file)
        .addContext("File", file)
        .build(logger);
  }

  private static class SchemaReadTask extends TimedRunnable<BatchSchema> {
    private final String file;
    private final FileSchemaReader schemaReader;

    SchemaReadTask(String file, FileSchemaReader schemaReader) {
      this.file = file;
      this.schemaReader = schemaReader;
    }

    @Override
    protected BatchSchema runInner() throws Exception {
      return schemaReader.readSchema(file);
    }

    @Override
    protected UserException convertToUserException(Exception e) {
      return taskError(file, e);
    }
  }

  private class MappingTask extends TimedRunnable<MultiFileReaderData> {
    private final String file;
    private final FileSchemaReader schemaReader;
    private final List<Integer> projection;
    private final List<FilterExpression> filters;

    MappingTask(String file, FileSchemaReader schemaReader, List<Integer> projection,
                List<FilterExpression> filters) {
      this.file = file;
      this.schemaReader = schemaReader;
      this.projection = projection;
      this.filters = filters;
    }

    @Override
    protected MultiFileReaderData runInner() throws Exception {
      return createMapping(file, schemaReader.readSchema(file), projection, filters);
    }

    @Override
    protected UserException convertToUserException(Exception e) {
      return taskError(file, e);
    }
  }
}
