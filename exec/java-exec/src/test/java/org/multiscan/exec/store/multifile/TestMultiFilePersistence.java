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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;
import org.multiscan.common.exceptions.ErrorType;
import org.multiscan.common.exceptions.UserException;
import org.multiscan.exec.ExecTest;

public class TestMultiFilePersistence extends ExecTest {

  @Test
  public void testOptionsLayout() {
    assertEquals("{\"version\":1,\"filename\":true,\"hivePartitioning\":false,\"unionByName\":true}",
        MultiFilePersistence.serializeOptions(new MultiFileOptions(true, false, true)));
  }

  @Test
  public void testBindDataLayout() {
    MultiFileBindData bindData = new MultiFileBindData(2, Arrays.asList(new HivePartitioningIndex("year", 3)));
    assertEquals("{\"version\":1,\"filenameIndex\":2,\"hivePartitioningIndexes\":[{\"key\":\"year\",\"index\":3}]}",
        MultiFilePersistence.serializeBindData(bindData));
    assertEquals("{\"version\":1,\"filenameIndex\":null,\"hivePartitioningIndexes\":[]}",
        MultiFilePersistence.serializeBindData(MultiFileBindData.empty()));
  }

  @Test
  public void testRoundTrip() {
    MultiFileOptions options = new MultiFileOptions(false, true, true);
    assertEquals(options,
        MultiFilePersistence.deserializeOptions(MultiFilePersistence.serializeOptionsToBytes(options)));

    MultiFileBindData bindData = new MultiFileBindData(null, Arrays.asList(
        new HivePartitioningIndex("year", 1), new HivePartitioningIndex("month", 4)));
    assertEquals(bindData,
        MultiFilePersistence.deserializeBindData(MultiFilePersistence.serializeBindDataToBytes(bindData)));
  }

  @Test
  public void testUnknownPropertiesAreIgnored() {
    MultiFileOptions options = MultiFilePersistence.deserializeOptions(
        "{\"version\":1,\"filename\":true,\"hivePartitioning\":true,\"unionByName\":false,\"compression\":\"zstd\"}");
    assertEquals(new MultiFileOptions(true, true, false), options);

    MultiFileBindData bindData = MultiFilePersistence.deserializeBindData(
        "{\"version\":1,\"filenameIndex\":0,\"hivePartitioningIndexes\":[{\"key\":\"k\",\"index\":1,\"hint\":2}]}");
    assertEquals(new MultiFileBindData(0, Arrays.asList(new HivePartitioningIndex("k", 1))), bindData);
  }

  @Test
  public void testMissingProperty() {
    expectParseError(() -> MultiFilePersistence.deserializeOptions(
        "{\"version\":1,\"filename\":true,\"unionByName\":false}"));
    expectParseError(() -> MultiFilePersistence.deserializeBindData(
        "{\"version\":1,\"filenameIndex\":0}"));
    expectParseError(() -> MultiFilePersistence.deserializeBindData(
        "{\"version\":1,\"filenameIndex\":0,\"hivePartitioningIndexes\":[{\"key\":\"k\"}]}"));
  }

  @Test
  public void testMalformedInput() {
    expectParseError(() -> MultiFilePersistence.deserializeOptions("{\"version\":1,"));
    expectParseError(() -> MultiFilePersistence.deserializeOptions("null"));
    expectParseError(() -> MultiFilePersistence.deserializeOptions(
        "{\"version\":1,\"filename\":null,\"hivePartitioning\":true,\"unionByName\":false}"));
    expectParseError(() -> MultiFilePersistence.deserializeBindData(
        "{\"version\":1,\"filenameIndex\":-1,\"hivePartitioningIndexes\":[]}"));
  }

  @Test
  public void testUnsupportedVersion() {
    expectParseError(() -> MultiFilePersistence.deserializeOptions(
        "{\"version\":2,\"filename\":true,\"hivePartitioning\":true,\"unionByName\":false}"));
  }

  private static void expectParseError(Runnable action) {
    try {
      action.run();
      fail("Expected a parse error");
    } catch (UserException e) {
      assertEquals(ErrorType.PARSE, e.getErrorType());
    }
  }
}
