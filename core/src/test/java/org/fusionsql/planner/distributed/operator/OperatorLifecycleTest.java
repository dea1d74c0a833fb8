/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fusionsql.planner.distributed.operator;

import static org.fusionsql.expression.DSL.col;
import static org.fusionsql.expression.DSL.greater;
import static org.fusionsql.expression.DSL.lit;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.fusionsql.data.batch.RecordBatch;
import org.fusionsql.data.schema.Field;
import org.fusionsql.data.schema.Schema;
import org.fusionsql.data.type.DataType;
import org.fusionsql.exception.QueryCancelledException;
import org.fusionsql.expression.eval.ExpressionCompiler;
import org.fusionsql.storage.MemoryTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OperatorLifecycleTest {

  private final Schema schema = Schema.of(new Field("a", DataType.INT64));

  private MemoryTable table;

  private OperatorContext context;

  @BeforeEach
  void setUp() {
    List<List<Object>> rows = new ArrayList<>();
    for (long i = 0; i < 10; i++) {
      rows.add(List.of(i));
    }
    table = MemoryTable.fromRows(schema, rows, 4);
    context = new OperatorContext("task-1", 4);
  }

  @Test
  void should_move_through_states_in_order() {
    // Given
    ScanOperator scan = scan();
    assertEquals(OperatorState.CREATED, scan.getState());

    // When
    scan.open();
    assertEquals(OperatorState.OPEN, scan.getState());
    int rows = 0;
    Optional<RecordBatch> batch = scan.nextBatch();
    while (batch.isPresent()) {
      assertEquals(OperatorState.RUNNING, scan.getState());
      rows += batch.get().getRowCount();
      batch = scan.nextBatch();
    }

    // Then
    assertEquals(10, rows);
    assertEquals(OperatorState.EXHAUSTED, scan.getState());
    assertFalse(scan.nextBatch().isPresent());
    scan.close();
    assertEquals(OperatorState.CLOSED, scan.getState());
  }

  @Test
  void should_reject_pull_before_open() {
    assertThrows(IllegalStateException.class, () -> scan().nextBatch());
  }

  @Test
  void should_reject_reopen_after_close() {
    ScanOperator scan = scan();
    scan.open();
    scan.close();

    assertThrows(IllegalStateException.class, scan::open);
    assertThrows(IllegalStateException.class, scan::nextBatch);
  }

  @Test
  void should_tolerate_repeated_close() {
    ScanOperator scan = scan();
    scan.open();

    scan.close();
    scan.close();

    assertEquals(OperatorState.CLOSED, scan.getState());
  }

  @Test
  void should_open_and_close_children_with_parent() {
    // Given
    ScanOperator scan = scan();
    FilterOperator filter =
        new FilterOperator(
            context, scan, ExpressionCompiler.compile(greater(col("a"), lit(6L)), schema));

    // When
    filter.open();
    List<Object> values = new ArrayList<>();
    filter.nextBatch().ifPresent(b -> values.addAll(b.getColumn(0).toList()));
    filter.close();

    // Then
    assertEquals(List.of(7L), values);
    assertEquals(OperatorState.CLOSED, scan.getState());
  }

  @Test
  void should_stop_when_cancelled() {
    ScanOperator scan = scan();
    scan.open();
    scan.nextBatch();

    context.cancel();

    assertThrows(QueryCancelledException.class, scan::nextBatch);
    assertTrue(context.isCancelled());
  }

  private ScanOperator scan() {
    return new ScanOperator(context, schema, table, schema.getFieldNames(), 0, 1);
  }
}
