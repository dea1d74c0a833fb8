/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.executor.shuffle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.batch.RecordBatchBuilder;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.StageExecutionException;
import org.fusionsql.planner.distributed.codec.RecordBatchCodec;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ShuffleServiceTest {

  private static final Schema SCHEMA = Schema.of(new Field("v", DataType.INT64));

  private final ShuffleService shuffle = new ShuffleService();
  private final RecordBatchCodec codec = new RecordBatchCodec();

  @Test
  void should_keep_the_first_committed_attempt_of_a_task() {
    // Given
    assertTrue(shuffle.commit("q", "stage-1", 0, 1, List.of(List.of(batch(1L)))));

    // When
    boolean second = shuffle.commit("q", "stage-1", 0, 2, List.of(List.of(batch(99L))));

    // Then
    assertFalse(second);
    assertEquals(List.of(List.of(1L)), rows(shuffle.exchangeFor("q").read("stage-1", 0)));
  }

  @Test
  void should_concatenate_a_partition_over_tasks_in_task_order() {
    shuffle.commit("q", "stage-1", 1, 1, List.of(List.of(batch(3L)), List.of()));
    shuffle.commit("q", "stage-1", 0, 1, List.of(List.of(batch(1L), batch(2L)), List.of()));

    assertEquals(
        List.of(List.of(1L), List.of(2L), List.of(3L)),
        rows(shuffle.exchangeFor("q").read("stage-1", 0)));
    assertEquals(List.of(), shuffle.read("q", "stage-1", 1));
  }

  @Test
  void should_fail_reads_of_missing_output() {
    shuffle.commit("q", "stage-1", 0, 1, List.of(List.of()));

    assertThrows(StageExecutionException.class, () -> shuffle.read("q", "stage-2", 0));
    assertThrows(StageExecutionException.class, () -> shuffle.read("q", "stage-1", 1));
    assertThrows(StageExecutionException.class, () -> shuffle.read("other", "stage-1", 0));
  }

  @Test
  void should_drop_output_on_release() {
    shuffle.commit("q", "stage-1", 0, 1, List.of(List.of(batch(1L))));
    assertTrue(shuffle.hasOutput("q"));

    shuffle.release("q");

    assertFalse(shuffle.hasOutput("q"));
  }

  private byte[] batch(long value) {
    return codec.encode(new RecordBatchBuilder(SCHEMA).addRow(value).build());
  }

  private static List<List<Object>> rows(Iterator<RecordBatch> batches) {
    List<List<Object>> rows = new ArrayList<>();
    batches.forEachRemaining(b -> rows.addAll(b.toRows()));
    return rows;
  }
}
