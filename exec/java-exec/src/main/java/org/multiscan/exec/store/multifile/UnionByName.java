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

import org.multiscan.common.map.CaseInsensitiveMap;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.Types;
import org.multiscan.exec.record.BatchSchema;
import org.multiscan.exec.record.SchemaBuilder;

import com.google.common.base.Preconditions;

/**
 * Merges the schemas of several files into one by column name, for scans
 * with {@code union_by_name} set. Names match ignoring case; a column keeps
 * the spelling and position of its first appearance and takes the least
 * restrictive type of all its appearances.
 */
public final class UnionByName {

  private UnionByName() {
  }

  /**
   * Folds the columns of one file into the union built so far.
   *
   * @param localNames column names of the file
   * @param localTypes column types of the file, aligned with the names
   * @param unionTypes union column types, updated in place
   * @param unionNames union column names, updated in place
   * @param unionNamesMap union name to position, updated in place
   */
  public static void combineUnionTypes(List<String> localNames, List<MinorType> localTypes,
                                       List<MinorType> unionTypes, List<String> unionNames,
                                       CaseInsensitiveMap<Integer> unionNamesMap) {
    Preconditions.checkArgument(localNames.size() == localTypes.size(),
        "Got %s column names but %s column types", localNames.size(), localTypes.size());
    for (int i = 0; i < localNames.size(); i++) {
      final String name = localNames.get(i);
      final MinorType type = localTypes.get(i);
      final Integer position = unionNamesMap.get(name);
      if (position != null) {
        unionTypes.set(position, Types.getCompatibleType(unionTypes.get(position), type));
      } else {
        unionNamesMap.put(name, unionNames.size());
        unionNames.add(name);
        unionTypes.add(type);
      }
    }
  }

  /**
   * @param schemas file schemas, in file order
   * @return the union of all the schemas
   */
  public static BatchSchema unionSchemas(List<BatchSchema> schemas) {
    final List<String> unionNames = new ArrayList<>();
    final List<MinorType> unionTypes = new ArrayList<>();
    final CaseInsensitiveMap<Integer> unionNamesMap = CaseInsensitiveMap.newHashMap();
    for (BatchSchema schema : schemas) {
      combineUnionTypes(schema.getFieldNames(), schema.getFieldTypes(), unionTypes, unionNames, unionNamesMap);
    }
    final SchemaBuilder builder = BatchSchema.newBuilder();
    for (int i = 0; i < unionNames.size(); i++) {
      builder.add(unionNames.get(i), unionTypes.get(i));
    }
    return builder.build();
  }
}
