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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads hive style partitions from a file path: every {@code key=value}
 * directory, separated by {@code /} or {@code \}, contributes one partition.
 */
public final class HivePartitioning {

  private static final Pattern PARTITION_PATTERN = Pattern.compile("[/\\\\]([^/?\\\\]+)=([^/\\n?\\\\]+)");

  private HivePartitioning() {
  }

  /**
   * Parses the partitions of a path, in path order. When a key repeats, the
   * key keeps its first position and takes the last value.
   *
   * @param path file path
   * @return partition key to partition value, empty when the path has none
   */
  public static Map<String, String> parse(String path) {
    final Map<String, String> partitions = new LinkedHashMap<>();
    final Matcher matcher = PARTITION_PATTERN.matcher(path);
    while (matcher.find()) {
      partitions.put(matcher.group(1), matcher.group(2));
    }
    return partitions;
  }
}
