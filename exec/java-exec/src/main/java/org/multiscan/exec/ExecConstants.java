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
package org.multiscan.exec;

public final class ExecConstants {
  private ExecConstants() {
    // Don't allow instantiation
  }

  /** Table functions may scan files only when enabled. */
  public static final String ENABLE_EXTERNAL_ACCESS = "multiscan.exec.enable_external_access";

  // Defaults of the named parameters of a multi-file scan
  public static final String MULTIFILE_FILENAME = "multiscan.exec.multifile.filename";
  public static final String MULTIFILE_HIVE_PARTITIONING = "multiscan.exec.multifile.hive_partitioning";
  public static final String MULTIFILE_UNION_BY_NAME = "multiscan.exec.multifile.union_by_name";

  /** Number of threads used to read file schemas and build per-file mappings. */
  public static final String MULTIFILE_PARALLELISM = "multiscan.exec.multifile.parallelism";
  /** Time allowed for a single per-file task, in milliseconds. */
  public static final String MULTIFILE_TASK_TIMEOUT = "multiscan.exec.multifile.task_timeout_ms";
}
