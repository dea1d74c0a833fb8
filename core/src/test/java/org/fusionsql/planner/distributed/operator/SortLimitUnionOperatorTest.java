/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import static org.fusionsql.expression.DSL.col;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.common.collect.HashMultiset;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.dataframe.DataFrame;
import org.fusionsql.planner.distributed.LocalStageExecutor;
import org.fusionsql.planner.logical.SortItem;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortLimitUnionOperatorTest {

  private final Schema schema =
      Schema.of(new Field("a", DataType.INT64), new Field("s", DataType.UTF8));

  private final MemoryTable table =
      MemoryTable.fromRows(
          schema,
          List.of(
              row(3L, "c"), row(null, "n"), row(1L, "a"), row(2L, "b"), row(5L, "e"),
              row(4L, "d")),
          2);

  @ParameterizedTest
  @ValueSource(ints = {1, 3})
  void should_sort_ascending_with_nulls_last(int partitions) {
    DataFrame frame = DataFrame.scan("t", table).sort(SortItem.asc(col("a")));

    assertEquals(
        Arrays.asList(1L, 2L, 3L, 4L, 5L, null), firstColumn(frame, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3})
  void should_sort_descending_with_nulls_first(int partitions) {
    DataFrame frame = DataFrame.scan("t", table).sort(SortItem.desc(col("a")));

    assertEquals(
        Arrays.asList(null, 5L, 4L, 3L, 2L, 1L), firstColumn(frame, partitions));
  }

  @Test
  void should_honor_explicit_null_placement() {
    DataFrame frame = DataFrame.scan("t", table).sort(new SortItem(col("a"), true, true));

    assertEquals(Arrays.asList(null, 1L, 2L, 3L, 4L, 5L), firstColumn(frame, 1));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3})
  void should_apply_offset_then_limit_after_sort(int partitions) {
    DataFrame frame =
        DataFrame.scan("t", table).sort(SortItem.asc(col("a"))).limit(2, 1);

    assertEquals(Arrays.asList(2L, 3L), firstColumn(frame, partitions));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3})
  void should_limit_unsorted_input_to_the_requested_count(int partitions) {
    DataFrame frame = DataFrame.scan("t", table).limit(4);

    assertEquals(4, LocalStageExecutor.execute(frame.logicalPlan(), partitions).size());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2})
  void should_concatenate_union_inputs_keeping_duplicates(int partitions) {
    DataFrame frame = DataFrame.scan("t", table).union(DataFrame.scan("t", table));

    List<List<Object>> rows = LocalStageExecutor.execute(frame.logicalPlan(), partitions);

    assertEquals(12, rows.size());
    assertEquals(2, HashMultiset.create(rows).count(row(3L, "c")));
  }

  private static List<Object> firstColumn(DataFrame frame, int partitions) {
    return LocalStageExecutor.execute(frame.logicalPlan(), partitions).stream()
        .map(r -> r.get(0))
        .collect(Collectors.toList());
  }

  private static List<Object> row(Object... values) {
    return Arrays.asList(values);
  }
}
