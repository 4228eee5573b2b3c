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
package org.multiscan.exec.store.dfs;

import java.io.IOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import com.google.common.collect.Lists;

/**
 * {@link FileGlobber} over Hadoop file systems. The file system is chosen by
 * the scheme of each pattern, the default file system when it has none.
 * Directories are skipped, files are returned sorted by path.
 */
public class HadoopFileGlobber implements FileGlobber {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(HadoopFileGlobber.class);

  private final Configuration fsConf;

  public HadoopFileGlobber(Configuration fsConf) {
    this.fsConf = fsConf;
  }

  /**
   * Creates a globber over the local file system.
   */
  public static HadoopFileGlobber local() {
    Configuration configuration = new Configuration();
    configuration.set(FileSystem.FS_DEFAULT_NAME_KEY, FileSystem.DEFAULT_FS);
    return new HadoopFileGlobber(configuration);
  }

  @Override
  public List<String> glob(String pattern) throws IOException {
    final Path path = new Path(pattern);
    final FileSystem fs = path.getFileSystem(fsConf);
    final FileStatus[] statuses = fs.globStatus(path);
    final List<String> files = Lists.newArrayList();
    if (statuses == null) {
      logger.debug("No file matches {}", pattern);
      return files;
    }

    // patterns without a scheme yield plain paths
    final boolean keepScheme = path.toUri().getScheme() != null;
    Arrays.sort(statuses, Comparator.comparing((FileStatus status) -> status.getPath().toString()));
    for (FileStatus status : statuses) {
      if (!status.isFile()) {
        continue;
      }
      files.add(keepScheme
          ? status.getPath().toString()
          : Path.getPathWithoutSchemeAndAuthority(status.getPath()).toString());
    }
    logger.debug("Pattern {} matched {} file(s)", pattern, files.size());
    return files;
  }
}
