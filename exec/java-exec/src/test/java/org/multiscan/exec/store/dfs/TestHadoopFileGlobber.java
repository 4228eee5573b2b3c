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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.multiscan.exec.ExecTest;

public class TestHadoopFileGlobber extends ExecTest {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  private String root;

  @Before
  public void setup() throws Exception {
    FileSystem fs = getLocalFileSystem();
    root = new Path(folder.getRoot().getAbsolutePath()).toUri().getPath();
    fs.mkdirs(new Path(root, "data/year=2021"));
    fs.mkdirs(new Path(root, "data/year=2020"));
    fs.mkdirs(new Path(root, "data/year=2020/nested.parquet"));
    fs.create(new Path(root, "data/year=2021/b.parquet")).close();
    fs.create(new Path(root, "data/year=2020/a.parquet")).close();
    fs.create(new Path(root, "data/year=2020/c.parquet")).close();
  }

  @Test
  public void testGlobSortsFilesAndSkipsDirectories() throws IOException {
    List<String> files = HadoopFileGlobber.local().glob(root + "/data/*/*.parquet");
    assertEquals(Arrays.asList(
        root + "/data/year=2020/a.parquet",
        root + "/data/year=2020/c.parquet",
        root + "/data/year=2021/b.parquet"), files);
  }

  @Test
  public void testSingleFile() throws IOException {
    String file = root + "/data/year=2021/b.parquet";
    assertEquals(Arrays.asList(file), HadoopFileGlobber.local().glob(file));
  }

  @Test
  public void testNoMatch() throws IOException {
    assertTrue(HadoopFileGlobber.local().glob(root + "/missing/*.parquet").isEmpty());
    assertTrue(HadoopFileGlobber.local().glob(root + "/missing.parquet").isEmpty());
  }

  @Test
  public void testSchemeIsKept() throws IOException {
    String file = new File(folder.getRoot(), "data/year=2021/b.parquet").toURI().toString();
    List<String> files = HadoopFileGlobber.local().glob(file);
    assertEquals(1, files.size());
    assertTrue(files.get(0).startsWith("file:"));
    assertTrue(files.get(0).endsWith("/data/year=2021/b.parquet"));
  }
}
