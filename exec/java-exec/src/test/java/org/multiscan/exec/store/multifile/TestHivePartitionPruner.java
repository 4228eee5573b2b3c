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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.multiscan.common.expression.ColumnReference;
import org.multiscan.common.expression.FilterExpression;
import org.multiscan.common.types.MinorType;
import org.multiscan.common.types.ScalarValue;
import org.multiscan.exec.ExecTest;
import org.multiscan.exec.record.BatchSchema;

import com.google.common.collect.ImmutableMap;

public class TestHivePartitionPruner extends ExecTest {

  private static final int TABLE = 0;
  private static final MultiFileOptions HIVE = new MultiFileOptions(false, true, false);
  private static final List<String> FILES = Arrays.asList(
      "/data/year=2020/x", "/data/year=2021/x", "/data/year=2022/x");

  // projection [v, year]
  private static final Map<String, Integer> COLUMN_MAP = ImmutableMap.of("v", 0, "year", 1);
  private static final ColumnReference V = ColumnReference.of(TABLE, 0);
  private static final ColumnReference YEAR = ColumnReference.of(TABLE, 1);

  @Test
  public void testEqualityPrunesEverything() {
    List<String> files = new ArrayList<>(FILES.subList(0, 2));
    assertTrue(prune(files, FilterExpression.equal(YEAR, ScalarValue.ofVarchar("2022"))));
    assertTrue(files.isEmpty());
  }

  @Test
  public void testEqualityKeepsMatchingFile() {
    assertEquals(Collections.singletonList("/data/year=2021/x"),
        retained(FilterExpression.equal(YEAR, ScalarValue.ofVarchar("2021"))));
  }

  @Test
  public void testNumericComparison() {
    assertEquals(Arrays.asList("/data/year=2021/x", "/data/year=2022/x"),
        retained(FilterExpression.greaterThan(YEAR, ScalarValue.ofInt(2020))));
    assertEquals(Collections.singletonList("/data/year=2020/x"),
        retained(FilterExpression.lessThanOrEqual(YEAR,
            ScalarValue.of(MinorType.VARDECIMAL, new BigDecimal("2020.5")))));
  }

  @Test
  public void testUnparsableNumberNeverPrunes() {
    List<String> files = new ArrayList<>(Arrays.asList("/data/year=abc/x"));
    assertFalse(prune(files, FilterExpression.equal(YEAR, ScalarValue.ofInt(2020))));
    assertEquals(1, files.size());
  }

  @Test
  public void testAndOrNot() {
    FilterExpression unknown = FilterExpression.equal(V, ScalarValue.ofInt(1));
    FilterExpression is2021 = FilterExpression.equal(YEAR, ScalarValue.ofVarchar("2021"));

    assertEquals(Collections.singletonList("/data/year=2021/x"), retained(FilterExpression.and(unknown, is2021)));
    assertEquals(FILES, retained(FilterExpression.or(unknown, is2021)));
    assertEquals(Arrays.asList("/data/year=2020/x", "/data/year=2022/x"), retained(FilterExpression.not(is2021)));
    assertEquals(FILES, retained(FilterExpression.not(unknown)));
  }

  @Test
  public void testInAndNotIn() {
    assertEquals(Arrays.asList("/data/year=2020/x", "/data/year=2022/x"),
        retained(FilterExpression.in(YEAR, ScalarValue.ofVarchar("2020"), ScalarValue.ofVarchar("2022"))));
    assertEquals(Collections.singletonList("/data/year=2021/x"),
        retained(FilterExpression.notIn(YEAR, ScalarValue.ofVarchar("2020"), ScalarValue.ofVarchar("2022"))));
    // x NOT IN (..., NULL) is never true
    assertEquals(Collections.emptyList(),
        retained(FilterExpression.notIn(YEAR, ScalarValue.ofVarchar("2020"), ScalarValue.nullOf(MinorType.VARCHAR))));
  }

  @Test
  public void testNullLiteralPrunes() {
    assertEquals(Collections.emptyList(),
        retained(FilterExpression.equal(YEAR, ScalarValue.nullOf(MinorType.VARCHAR))));
  }

  @Test
  public void testIsNull() {
    assertEquals(Collections.emptyList(), retained(FilterExpression.isNull(YEAR)));
    assertEquals(FILES, retained(FilterExpression.isNotNull(YEAR)));
    assertEquals(FILES, retained(FilterExpression.isNull(V)));
  }

  @Test
  public void testOtherTableIsNotEvaluated() {
    assertEquals(FILES, retained(FilterExpression.equal(ColumnReference.of(TABLE + 1, 1),
        ScalarValue.ofVarchar("1999"))));
  }

  @Test
  public void testUnprojectedPartitionIsNotEvaluated() {
    List<String> files = new ArrayList<>(FILES);
    Map<String, Integer> columnMap = ImmutableMap.of("v", 0);
    assertFalse(HivePartitionPruner.complexFilterPushdown(files, HIVE, TABLE, columnMap,
        Collections.singletonList(FilterExpression.equal(YEAR, ScalarValue.ofVarchar("1999")))));
    assertEquals(FILES, files);
  }

  @Test
  public void testFilenameFilter() {
    MultiFileOptions options = new MultiFileOptions(true, false, false);
    List<String> files = new ArrayList<>(FILES);
    Map<String, Integer> columnMap = ImmutableMap.of("filename", 0);
    assertTrue(HivePartitionPruner.complexFilterPushdown(files, options, TABLE, columnMap,
        Collections.singletonList(FilterExpression.equal(ColumnReference.of(TABLE, 0),
            ScalarValue.ofVarchar("/data/year=2022/x")))));
    assertEquals(Collections.singletonList("/data/year=2022/x"), files);
  }

  @Test
  public void testNothingToDo() {
    FilterExpression filter = FilterExpression.equal(YEAR, ScalarValue.ofVarchar("1999"));
    List<String> files = new ArrayList<>(FILES);
    assertFalse(HivePartitionPruner.complexFilterPushdown(files, MultiFileOptions.defaults(), TABLE, COLUMN_MAP,
        Collections.singletonList(filter)));
    assertFalse(HivePartitionPruner.complexFilterPushdown(files, HIVE, TABLE, COLUMN_MAP,
        Collections.emptyList()));
    assertEquals(FILES, files);
  }

  @Test
  public void testFiltersAreNotModified() {
    List<FilterExpression> filters = Collections.unmodifiableList(Arrays.asList(
        FilterExpression.equal(YEAR, ScalarValue.ofVarchar("2021")),
        FilterExpression.equal(V, ScalarValue.ofInt(3))));
    List<String> files = new ArrayList<>(FILES);
    assertTrue(HivePartitionPruner.complexFilterPushdown(files, HIVE, TABLE, COLUMN_MAP, filters));
    assertEquals(2, filters.size());
    assertEquals(Collections.singletonList("/data/year=2021/x"), files);
  }

  @Test
  public void testBuildColumnMap() {
    BatchSchema schema = BatchSchema.newBuilder()
        .add("v", MinorType.INT).add("year", MinorType.VARCHAR).build();
    assertEquals(ImmutableMap.of("year", 0, "v", 2),
        HivePartitionPruner.buildColumnMap(schema, Arrays.asList(1, ColumnMapper.ROW_ID_COLUMN_ID, 0)));
  }

  private static List<String> retained(FilterExpression filter) {
    List<String> files = new ArrayList<>(FILES);
    prune(files, filter);
    return files;
  }

  private static boolean prune(List<String> files, FilterExpression filter) {
    return HivePartitionPruner.complexFilterPushdown(files, HIVE, TABLE, COLUMN_MAP,
        Collections.singletonList(filter));
  }
}
