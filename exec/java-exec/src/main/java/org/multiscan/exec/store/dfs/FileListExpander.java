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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.multiscan.common.config.ScanConfig;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.ExecConstants;

import com.google.common.collect.ImmutableList;

/**
 * Turns the path argument of a table function, a single pattern or a list of
 * patterns, into the ordered list of files to scan. Duplicates are dropped,
 * keeping the first occurrence.
 */
public class FileListExpander {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FileListExpander.class);

  private final ScanConfig config;
  private final FileGlobber globber;

  public FileListExpander(ScanConfig config, FileGlobber globber) {
    this.config = config;
    this.globber = globber;
  }

  /**
   * @param input a VARCHAR pattern or a LIST of VARCHAR patterns
   * @param readerName name of the reader, used in error messages
   * @param option whether an empty result is accepted
   * @return matched files, in pattern order
   */
  public List<String> getFileList(ScalarValue input, String readerName, GlobOption option) {
    if (!config.getBoolean(ExecConstants.ENABLE_EXTERNAL_ACCESS)) {
      throw UserException.permissionError()
          .message("Scanning %s files is disabled through configuration", readerName)
          .build(logger);
    }
    if (input == null || input.isNull()) {
      throw UserException.parseError()
          .message("%s reader cannot take NULL list as parameter", readerName)
          .build(logger);
    }

    final Set<String> files = new LinkedHashSet<>();
    if (input.getType() == MinorType.VARCHAR) {
      files.addAll(glob(input.getString(), readerName));
    } else if (input.getType() == MinorType.LIST) {
      for (ScalarValue element : input.getList()) {
        if (element.isNull()) {
          throw UserException.parseError()
              .message("%s reader cannot take NULL input as parameter", readerName)
              .build(logger);
        }
        if (element.getType() != MinorType.VARCHAR) {
          throw UserException.parseError()
              .message("%s reader expects file paths of type VARCHAR, got %s", readerName, element.getType())
              .build(logger);
        }
        files.addAll(glob(element.getString(), readerName));
      }
    } else {
      throw UserException.internalError()
          .message("Unsupported type %s for the file list of %s reader", input.getType(), readerName)
          .build(logger);
    }

    if (files.isEmpty() && option == GlobOption.DISALLOW_EMPTY) {
      throw UserException.dataReadError()
          .message("%s reader needs at least one file to read", readerName)
          .addContext("Input", input.toString())
          .build(logger);
    }
    logger.debug("{} reader resolved {} file(s) from {}", readerName, files.size(), input);
    return ImmutableList.copyOf(files);
  }

  private List<String> glob(String pattern, String readerName) {
    try {
      return globber.glob(pattern);
    } catch (IOException e) {
      throw UserException.dataReadError(e)
          .message("Failed to list files matching \"%s\"", pattern)
          .addContext("Reader", readerName)
          .build(logger);
    }
  }
}
