/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.dataframe.DataFrame;
import org.fusionsql.planner.distributed.LocalStageExecutor;
import org.fusionsql.planner.logical.JoinType;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashJoinOperatorTest {

  private final MemoryTable left =
      MemoryTable.fromRows(
          Schema.of(new Field("k", DataType.INT64), new Field("lv", DataType.UTF8)),
          ImmutableList.of(
              row(1L, "a"), row(2L, "b"), row(null, "n"), row(3L, "c")),
          2);

  private final MemoryTable right =
      MemoryTable.fromRows(
          Schema.of(new Field("rk", DataType.INT64), new Field("rv", DataType.UTF8)),
          ImmutableList.of(
              row(1L, "x"), row(1L, "y"), row(3L, "z"), row(4L, "w"), row(null, "m")),
          2);

  private static final List<List<Object>> INNER =
      ImmutableList.of(row(1L, "a", 1L, "x"), row(1L, "a", 1L, "y"), row(3L, "c", 3L, "z"));

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4})
  void should_match_equal_keys_for_inner_join(int partitions) {
    assertRows(INNER, join(JoinType.INNER, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4})
  void should_keep_unmatched_and_null_key_rows_for_left_join(int partitions) {
    List<List<Object>> expected =
        ImmutableList.<List<Object>>builder()
            .addAll(INNER)
            .add(row(2L, "b", null, null))
            .add(row(null, "n", null, null))
            .build();

    assertRows(expected, join(JoinType.LEFT, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4})
  void should_keep_unmatched_build_rows_for_right_join(int partitions) {
    List<List<Object>> expected =
        ImmutableList.<List<Object>>builder()
            .addAll(INNER)
            .add(row(null, null, 4L, "w"))
            .add(row(null, null, null, "m"))
            .build();

    assertRows(expected, join(JoinType.RIGHT, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4})
  void should_keep_both_sides_for_full_join(int partitions) {
    List<List<Object>> expected =
        ImmutableList.<List<Object>>builder()
            .addAll(INNER)
            .add(row(2L, "b", null, null))
            .add(row(null, "n", null, null))
            .add(row(null, null, 4L, "w"))
            .add(row(null, null, null, "m"))
            .build();

    assertRows(expected, join(JoinType.FULL, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 4})
  void should_emit_each_matching_left_row_once_for_semi_join(int partitions) {
    assertRows(ImmutableList.of(row(1L, "a"), row(3L, "c")), join(JoinType.SEMI, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 4})
  void should_emit_rows_without_match_for_anti_join(int partitions) {
    assertRows(ImmutableList.of(row(2L, "b"), row(null, "n")), join(JoinType.ANTI, partitions));
  }

  private List<List<Object>> join(JoinType type, int partitions) {
    DataFrame frame =
        DataFrame.scan("l", left).join(DataFrame.scan("r", right), "k", "rk", type);
    return LocalStageExecutor.execute(frame.logicalPlan(), partitions);
  }

  private static void assertRows(List<List<Object>> expected, List<List<Object>> actual) {
    assertEquals(HashMultiset.create(expected), HashMultiset.create(actual));
  }

  private static List<Object> row(Object... values) {
    return Arrays.asList(values);
  }
}
