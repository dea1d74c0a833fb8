/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import static org.fusionsql.expression.DSL.avg;
import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.count;
import static org.fusionsql.expression.DSL.countStar;
import static org.fusionsql.expression.DSL.max;
import static org.fusionsql.expression.DSL.min;
import static org.fusionsql.expression.DSL.sum;
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
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashAggregateOperatorTest {

  private final Schema schema =
      Schema.of(new Field("a", DataType.INT64), new Field("b", DataType.INT64));

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 4})
  void should_sum_per_group_at_any_partition_count(int partitions) {
    // Given
    MemoryTable table =
        MemoryTable.fromRows(
            schema, ImmutableList.of(row(1L, 10L), row(2L, 20L), row(2L, 30L)), 1);

    // When
    DataFrame frame =
        DataFrame.scan("t", table).aggregate(List.of(col("a")), List.of(sum(col("b"))));
    List<List<Object>> rows = LocalStageExecutor.execute(frame.logicalPlan(), partitions);

    // Then
    assertEquals(
        HashMultiset.create(ImmutableList.of(row(1L, 10L), row(2L, 50L))),
        HashMultiset.create(rows));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 3})
  void should_merge_partial_states_of_every_aggregate(int partitions) {
    // Given
    MemoryTable table =
        MemoryTable.fromRows(
            schema,
            ImmutableList.of(
                row(1L, 4L), row(1L, null), row(1L, 8L), row(null, 5L), row(null, 7L)),
            2);

    // When
    DataFrame frame =
        DataFrame.scan("t", table)
            .aggregate(
                List.of(col("a")),
                List.of(
                    countStar(),
                    count(col("b")),
                    min(col("b")),
                    max(col("b")),
                    avg(col("b"))));
    List<List<Object>> rows = LocalStageExecutor.execute(frame.logicalPlan(), partitions);

    // Then
    assertEquals(
        HashMultiset.create(
            ImmutableList.of(row(1L, 3L, 2L, 4L, 8L, 6.0d), row(null, 2L, 2L, 5L, 7L, 6.0d))),
        HashMultiset.create(rows));
  }

  @Test
  void should_emit_one_row_for_global_aggregate_over_empty_input() {
    // Given
    MemoryTable empty = MemoryTable.fromRows(schema, List.of());

    // When
    DataFrame frame =
        DataFrame.scan("t", empty).aggregate(List.of(), List.of(countStar(), sum(col("b"))));
    List<List<Object>> rows = LocalStageExecutor.execute(frame.logicalPlan(), 2);

    // Then
    assertEquals(List.of(row(0L, null)), rows);
  }

  @Test
  void should_emit_nothing_for_grouped_aggregate_over_empty_input() {
    MemoryTable empty = MemoryTable.fromRows(schema, List.of());

    DataFrame frame =
        DataFrame.scan("t", empty).aggregate(List.of(col("a")), List.of(sum(col("b"))));

    assertEquals(List.of(), LocalStageExecutor.execute(frame.logicalPlan(), 2));
  }

  private static List<Object> row(Object... values) {
    return Arrays.asList(values);
  }
}
